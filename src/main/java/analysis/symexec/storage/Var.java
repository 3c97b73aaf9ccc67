package analysis.symexec.storage;

/**
 * Declaration of a program variable
 */
public final class Var {

    /**
     * Unique identifier of the declaration
     */
    private final int uid;
    /**
     * Name from the source code
     */
    private final String name;
    /**
     * Storage class
     */
    private final VarCode code;
    /**
     * Place of the declaration
     */
    private final Location loc;
    /**
     * Constant initializer, null if there is none
     */
    private final Operand initializer;

    /**
     * Create a variable declaration without an initializer
     * 
     * @param uid
     *            unique identifier of the declaration
     * @param name
     *            name from the source code
     * @param code
     *            storage class
     * @param loc
     *            place of the declaration
     */
    public Var(int uid, String name, VarCode code, Location loc) {
        this(uid, name, code, loc, null);
    }

    /**
     * Create a variable declaration
     * 
     * @param uid
     *            unique identifier of the declaration
     * @param name
     *            name from the source code
     * @param code
     *            storage class
     * @param loc
     *            place of the declaration
     * @param initializer
     *            constant operand the variable is initialized with, may be null
     */
    public Var(int uid, String name, VarCode code, Location loc, Operand initializer) {
        assert initializer == null || initializer.isConstant() : "Non-constant initializer for " + name;
        this.uid = uid;
        this.name = name;
        this.code = code;
        this.loc = loc;
        this.initializer = initializer;
    }

    public int getUid() {
        return uid;
    }

    public String getName() {
        return name;
    }

    public VarCode getCode() {
        return code;
    }

    public Location getLocation() {
        return loc;
    }

    /**
     * Get the constant initializer
     * 
     * @return initializer or null if the variable is declared without one
     */
    public Operand getInitializer() {
        return initializer;
    }

    public boolean isOnStack() {
        return code.isOnStack();
    }

    public boolean isGlobal() {
        return code == VarCode.GLOBAL;
    }

    @Override
    public String toString() {
        return name + "#" + uid;
    }
}
