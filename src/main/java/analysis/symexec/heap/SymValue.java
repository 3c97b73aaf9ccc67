package analysis.symexec.heap;

/**
 * Immutable value stored in a cell of a symbolic heap object. Addresses refer
 * to objects by their arena id.
 */
public final class SymValue {

    /**
     * Kind of value
     */
    public enum ValueCode {
        /**
         * Null pointer (also integral zero)
         */
        NULL,
        /**
         * Value of a cell nothing was written to
         */
        UNINIT,
        /**
         * Any value
         */
        UNKNOWN,
        /**
         * Integral constant
         */
        INT,
        /**
         * Address of a cell of an object
         */
        ADDR
    }

    public static final SymValue NULL = new SymValue(ValueCode.NULL, 0, 0);
    public static final SymValue UNINIT = new SymValue(ValueCode.UNINIT, 0, 0);
    public static final SymValue UNKNOWN = new SymValue(ValueCode.UNKNOWN, 0, 0);

    private final ValueCode code;
    /**
     * Constant for INT, target object id for ADDR
     */
    private final long payload;
    /**
     * Offset within the target object for ADDR
     */
    private final int offset;

    private SymValue(ValueCode code, long payload, int offset) {
        this.code = code;
        this.payload = payload;
        this.offset = offset;
    }

    public static SymValue ofInt(long value) {
        if (value == 0) {
            return NULL;
        }
        return new SymValue(ValueCode.INT, value, 0);
    }

    public static SymValue addr(int objId, int offset) {
        return new SymValue(ValueCode.ADDR, objId, offset);
    }

    public ValueCode getCode() {
        return code;
    }

    public boolean isAddress() {
        return code == ValueCode.ADDR;
    }

    /**
     * Get the object this address points to
     * 
     * @return arena id of the target object
     */
    public int getTarget() {
        if (code != ValueCode.ADDR) {
            throw new RuntimeException("Not an address: " + this);
        }
        return (int) payload;
    }

    public int getOffset() {
        return offset;
    }

    public long getIntValue() {
        if (code == ValueCode.NULL) {
            return 0;
        }
        if (code != ValueCode.INT) {
            throw new RuntimeException("Not an integral constant: " + this);
        }
        return payload;
    }

    /**
     * Same address with the target object renamed
     * 
     * @param objId
     *            new target
     * @return address of the same offset in <code>objId</code>
     */
    SymValue retarget(int objId) {
        return addr(objId, offset);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * code.hashCode() + (int) (payload ^ (payload >>> 32))) + offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SymValue)) {
            return false;
        }
        SymValue other = (SymValue) obj;
        return code == other.code && payload == other.payload && offset == other.offset;
    }

    @Override
    public String toString() {
        switch (code) {
        case NULL:
            return "NULL";
        case UNINIT:
            return "?uninit";
        case UNKNOWN:
            return "?";
        case INT:
            return Long.toString(payload);
        case ADDR:
            return "&obj" + payload + (offset == 0 ? "" : "+" + offset);
        default:
            throw new RuntimeException("Unhandled value code: " + code);
        }
    }
}
