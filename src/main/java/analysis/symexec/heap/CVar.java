package analysis.symexec.heap;

/**
 * Identity of a program variable in a symbolic heap: the declaration together
 * with the stack-nesting instance. Globals always have instance 0, stack
 * variables of the n-th active call of their function have instance n.
 */
public final class CVar implements Comparable<CVar> {

    private final int uid;
    private final int inst;

    /**
     * Create a new variable identity
     * 
     * @param uid
     *            uid of the variable declaration
     * @param inst
     *            stack-nesting instance, 0 for globals
     */
    public CVar(int uid, int inst) {
        this.uid = uid;
        this.inst = inst;
    }

    public int getUid() {
        return uid;
    }

    public int getInst() {
        return inst;
    }

    @Override
    public int compareTo(CVar o) {
        if (uid != o.uid) {
            return Integer.compare(uid, o.uid);
        }
        return Integer.compare(inst, o.inst);
    }

    @Override
    public int hashCode() {
        return 31 * uid + inst;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CVar)) {
            return false;
        }
        CVar other = (CVar) obj;
        return uid == other.uid && inst == other.inst;
    }

    @Override
    public String toString() {
        return "#" + uid + "/" + inst;
    }
}
