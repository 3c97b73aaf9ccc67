package analysis.symexec.storage;

/**
 * Storage class of a program variable
 */
public enum VarCode {
    /**
     * Local variable of a function
     */
    LOCAL("lc"),
    /**
     * Formal parameter of a function
     */
    FNC_ARG("arg"),
    /**
     * Global (or static) variable
     */
    GLOBAL("gl");

    /**
     * Short name for the storage class
     */
    private final String name;

    private VarCode(String name) {
        this.name = name;
    }

    /**
     * Whether a variable of this kind lives in a stack frame, i.e. there is a
     * separate instance of it for each active call of the owning function
     * 
     * @return true for locals and formal parameters
     */
    public boolean isOnStack() {
        return this == LOCAL || this == FNC_ARG;
    }

    @Override
    public String toString() {
        return name;
    }
}
