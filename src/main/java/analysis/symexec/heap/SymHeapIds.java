package analysis.symexec.heap;

/**
 * Source of object ids shared by all heaps of one analysis run, so that
 * objects split off into one heap never clash with objects of another heap
 * they are later joined with
 */
public final class SymHeapIds {

    /**
     * Ids below this are reserved, see {@link SymHeap#OBJ_RETURN}
     */
    static final int FIRST_ID = 1;

    private int next = FIRST_ID;

    /**
     * Allocate a fresh object id
     * 
     * @return id never returned before by this source
     */
    int fresh() {
        return next++;
    }

    /**
     * Number of ids handed out so far
     * 
     * @return count of allocated ids
     */
    public int allocated() {
        return next - FIRST_ID;
    }
}
