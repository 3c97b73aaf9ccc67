package analysis.symexec.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Instruction of the analyzed program. For a {@link InsnCode#CALL} the operand
 * list is (destination, callee, actual arguments...).
 */
public final class Insn {

    /**
     * Position of the callee operand of a call instruction
     */
    public static final int CALL_FNC_POS = 1;
    /**
     * Position of the first actual argument of a call instruction
     */
    public static final int CALL_ARGS_POS = 2;

    private final InsnCode code;
    private final List<Operand> operands;
    private final Location loc;
    /**
     * Uids of variables that are dead after this instruction
     */
    private final Set<Integer> varsToKill;

    /**
     * Create a new instruction
     * 
     * @param code
     *            kind of instruction
     * @param operands
     *            ordered operands
     * @param loc
     *            location of the instruction
     * @param varsToKill
     *            uids of the variables which are dead after the instruction
     */
    public Insn(InsnCode code, List<Operand> operands, Location loc, Set<Integer> varsToKill) {
        this.code = code;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.loc = loc;
        this.varsToKill = Collections.unmodifiableSet(new LinkedHashSet<>(varsToKill));
    }

    /**
     * Create a call instruction
     * 
     * @param dst
     *            destination of the return value, {@link Operand#VOID} if ignored
     * @param callee
     *            function being called
     * @param args
     *            actual arguments
     * @param loc
     *            location of the call
     * @return new call instruction
     */
    public static Insn call(Operand dst, Fnc callee, List<Operand> args, Location loc) {
        List<Operand> ops = new ArrayList<>();
        ops.add(dst);
        ops.add(Operand.fnc(callee.getUid()));
        ops.addAll(args);
        return new Insn(InsnCode.CALL, ops, loc, Collections.<Integer> emptySet());
    }

    /**
     * Copy of this instruction with a different set of dead variables
     * 
     * @param kill
     *            uids of the variables which are dead after the instruction
     * @return new instruction
     */
    public Insn withVarsToKill(Set<Integer> kill) {
        return new Insn(code, operands, loc, kill);
    }

    public InsnCode getCode() {
        return code;
    }

    public List<Operand> getOperands() {
        return operands;
    }

    public Location getLocation() {
        return loc;
    }

    public Set<Integer> getVarsToKill() {
        return varsToKill;
    }

    @Override
    public String toString() {
        if (code == InsnCode.CALL && operands.size() >= CALL_ARGS_POS) {
            StringBuilder sb = new StringBuilder();
            if (!operands.get(0).isVoid()) {
                sb.append(operands.get(0)).append(" = ");
            }
            sb.append(operands.get(CALL_FNC_POS)).append("(");
            for (int i = CALL_ARGS_POS; i < operands.size(); i++) {
                if (i > CALL_ARGS_POS) {
                    sb.append(", ");
                }
                sb.append(operands.get(i));
            }
            return sb.append(")").toString();
        }
        return code.name().toLowerCase() + " " + operands;
    }
}
