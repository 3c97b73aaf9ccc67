package analysis.symexec.storage;

/**
 * Operand of an instruction. The set of operand kinds is closed, see
 * {@link OperandCode}.
 */
public final class Operand {

    /**
     * Kind of operand
     */
    public enum OperandCode {
        /**
         * No operand, e.g. the destination of a call whose result is ignored
         */
        VOID,
        /**
         * Program variable
         */
        VAR,
        /**
         * Integral constant
         */
        CONST_INT,
        /**
         * Null pointer constant
         */
        CONST_NULL,
        /**
         * Function (the callee operand of a call instruction)
         */
        CONST_FNC
    }

    /**
     * The one void operand
     */
    public static final Operand VOID = new Operand(OperandCode.VOID, -1, 0);

    private final OperandCode code;
    /**
     * Variable or function uid for VAR and CONST_FNC operands, -1 otherwise
     */
    private final int uid;
    /**
     * Value of a CONST_INT operand
     */
    private final long intValue;

    private Operand(OperandCode code, int uid, long intValue) {
        this.code = code;
        this.uid = uid;
        this.intValue = intValue;
    }

    /**
     * Operand referring to the given variable
     * 
     * @param varUid
     *            uid of the variable
     * @return variable operand
     */
    public static Operand var(int varUid) {
        return new Operand(OperandCode.VAR, varUid, 0);
    }

    /**
     * Integral constant operand
     * 
     * @param value
     *            value of the constant
     * @return constant operand
     */
    public static Operand constInt(long value) {
        return new Operand(OperandCode.CONST_INT, -1, value);
    }

    /**
     * Null pointer constant
     * 
     * @return null constant operand
     */
    public static Operand constNull() {
        return new Operand(OperandCode.CONST_NULL, -1, 0);
    }

    /**
     * Operand naming the given function
     * 
     * @param fncUid
     *            uid of the function
     * @return function operand
     */
    public static Operand fnc(int fncUid) {
        return new Operand(OperandCode.CONST_FNC, fncUid, 0);
    }

    public OperandCode getCode() {
        return code;
    }

    public boolean isVoid() {
        return code == OperandCode.VOID;
    }

    public boolean isConstant() {
        return code == OperandCode.CONST_INT || code == OperandCode.CONST_NULL || code == OperandCode.CONST_FNC;
    }

    /**
     * Get the uid of the variable
     * 
     * @return uid of the variable this operand refers to
     */
    public int getVarUid() {
        if (code != OperandCode.VAR) {
            throw new RuntimeException("Not a variable operand: " + this);
        }
        return uid;
    }

    /**
     * Get the uid of the function
     * 
     * @return uid of the function this operand names
     */
    public int getFncUid() {
        if (code != OperandCode.CONST_FNC) {
            throw new RuntimeException("Not a function operand: " + this);
        }
        return uid;
    }

    public long getIntValue() {
        return intValue;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + code.hashCode();
        result = prime * result + (int) (intValue ^ (intValue >>> 32));
        result = prime * result + uid;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Operand))
            return false;
        Operand other = (Operand) obj;
        return code == other.code && uid == other.uid && intValue == other.intValue;
    }

    @Override
    public String toString() {
        switch (code) {
        case VOID:
            return "void";
        case VAR:
            return "#" + uid;
        case CONST_INT:
            return Long.toString(intValue);
        case CONST_NULL:
            return "NULL";
        case CONST_FNC:
            return "fnc#" + uid;
        default:
            throw new RuntimeException("Unhandled operand code: " + code);
        }
    }
}
