package analysis.symexec.storage;

/**
 * Kind of an instruction
 */
public enum InsnCode {
    ASSIGN,
    CALL,
    COND,
    JMP,
    RET
}
