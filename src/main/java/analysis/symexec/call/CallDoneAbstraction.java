package analysis.symexec.call;

import analysis.symexec.heap.SymHeap;

/**
 * Abstraction run on each heap returned from a call
 */
public interface CallDoneAbstraction {

    /**
     * Leaves the heap as it is
     */
    public static final CallDoneAbstraction NONE = new CallDoneAbstraction() {
        @Override
        public void abstractIfNeeded(SymHeap sh) {
            // nothing to fold
        }
    };

    /**
     * Fold structures of the heap that the merge with the caller's state may
     * have exposed
     * 
     * @param sh
     *            heap to abstract, modified in place
     */
    void abstractIfNeeded(SymHeap sh);
}
