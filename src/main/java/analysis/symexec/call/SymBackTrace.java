package analysis.symexec.call;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import util.print.PrettyPrinter;
import analysis.symexec.heap.CVar;
import analysis.symexec.heap.SymHeap;
import analysis.symexec.storage.GenericInsn;
import analysis.symexec.storage.Storage;

/**
 * Stack of the function calls currently being analyzed. Keeps track of how
 * many times each function occurs on the stack, which is the nesting level
 * (instance) used for the stack variables of its innermost call.
 */
public class SymBackTrace {

    /**
     * One active call
     */
    private static final class Frame {
        final int fncUid;
        final GenericInsn callSite;
        /**
         * Snapshot of the heap of the caller taken when the call was made
         */
        final SymHeap heap;

        Frame(int fncUid, GenericInsn callSite, SymHeap heap) {
            this.fncUid = fncUid;
            this.callSite = callSite;
            this.heap = heap;
        }
    }

    private final Storage stor;
    /**
     * Active calls, the bottom of the stack first
     */
    private final List<Frame> frames = new ArrayList<>();
    /**
     * Number of occurrences of each function on the stack
     */
    private final Map<Integer, Integer> nestMap = new HashMap<>();

    /**
     * Create an empty back trace
     * 
     * @param stor
     *            program being analyzed
     */
    public SymBackTrace(Storage stor) {
        this.stor = stor;
    }

    /**
     * Copy of the given back trace, the heap snapshots are shared
     * 
     * @param other
     *            back trace to copy
     */
    public SymBackTrace(SymBackTrace other) {
        this.stor = other.stor;
        this.frames.addAll(other.frames);
        this.nestMap.putAll(other.nestMap);
    }

    public Storage stor() {
        return stor;
    }

    /**
     * Record a new call
     * 
     * @param fncUid
     *            uid of the called function
     * @param callSite
     *            label of the call
     * @param heapAtCallTime
     *            heap of the caller at the time of the call, a copy is kept
     */
    public void pushCall(int fncUid, GenericInsn callSite, SymHeap heapAtCallTime) {
        frames.add(new Frame(fncUid, callSite.copy(), new SymHeap(heapAtCallTime)));
        Integer n = nestMap.get(fncUid);
        nestMap.put(fncUid, n == null ? 1 : n + 1);
    }

    /**
     * Remove the most recent call
     * 
     * @return uid of the function whose call was removed
     * @throws IllegalStateException
     *             if the back trace is empty
     */
    public int popCall() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("popCall() on an empty back trace");
        }
        Frame top = frames.remove(frames.size() - 1);
        int n = nestMap.get(top.fncUid);
        if (n == 1) {
            nestMap.remove(top.fncUid);
        } else {
            nestMap.put(top.fncUid, n - 1);
        }
        return top.fncUid;
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /**
     * Number of times the given function occurs on the stack
     * 
     * @param fncUid
     *            uid of a function
     * @return occurrence count, 0 if the function is not on the stack
     */
    public int countOccurrencesOfFnc(int fncUid) {
        Integer n = nestMap.get(fncUid);
        return n == null ? 0 : n;
    }

    /**
     * Number of times the function on the top of the stack occurs on the
     * stack, i.e. the instance of its stack variables
     * 
     * @return occurrence count, 0 if the stack is empty
     */
    public int countOccurrencesOfTopFnc() {
        if (frames.isEmpty()) {
            return 0;
        }
        return countOccurrencesOfFnc(topFnc());
    }

    /**
     * Get the function on the top of the stack
     * 
     * @return uid of the function, -1 if the stack is empty
     */
    public int topFnc() {
        if (frames.isEmpty()) {
            return -1;
        }
        return frames.get(frames.size() - 1).fncUid;
    }

    public boolean hasRecursiveCall() {
        for (Integer n : nestMap.values()) {
            if (n > 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get the functions on the stack
     * 
     * @return function uids, the bottom of the stack first
     */
    public List<Integer> getFncSequence() {
        List<Integer> seq = new ArrayList<>(frames.size());
        for (Frame f : frames) {
            seq.add(f.fncUid);
        }
        return Collections.unmodifiableList(seq);
    }

    /**
     * Find the most recent call at which the given variable was alive in the
     * heap of the caller
     * 
     * @param cv
     *            variable to look for
     * @return position in the stack (0 is the bottom), -1 if there is none
     */
    public int lastStackPositionOf(CVar cv) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).heap.isVarAlive(cv)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Heap snapshot recorded for the call at the given position
     * 
     * @param pos
     *            position in the stack (0 is the bottom)
     * @return snapshot of the caller's heap, not to be modified
     */
    public SymHeap heapAt(int pos) {
        return frames.get(pos).heap;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = frames.size() - 1; i >= 0; i--) {
            Frame f = frames.get(i);
            sb.append("#").append(i).append(" ").append(PrettyPrinter.fncString(stor.getFnc(f.fncUid)));
            sb.append(" from ").append(f.callSite.getLocation()).append(": ").append(f.callSite).append("\n");
        }
        return sb.toString();
    }
}
