package analysis.symexec.call;

import java.util.ArrayList;
import java.util.List;

import util.optional.Optional;
import analysis.symexec.heap.SymHeap;

/**
 * Call contexts of one function, keyed by entry heap. Heaps are compared by
 * isomorphism. Entries are never removed.
 */
public class PerFncCache {

    /**
     * Entry heaps, the i-th heap belongs to the i-th context
     */
    private final List<SymHeap> heaps = new ArrayList<>();
    private final List<SymCallCtx> ctxs = new ArrayList<>();
    /**
     * If false nothing is ever stored
     */
    private final boolean enabled;
    private int hits;
    private int misses;

    /**
     * Create an empty cache
     * 
     * @param enabled
     *            if false the cache never stores anything and every lookup
     *            misses
     */
    public PerFncCache(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Find the context whose entry heap is isomorphic to the given heap
     * 
     * @param sh
     *            entry heap
     * @return the context or none
     */
    public Optional<SymCallCtx> lookup(SymHeap sh) {
        int idx = indexOf(sh);
        if (idx < 0) {
            misses++;
            return Optional.none();
        }
        hits++;
        return Optional.some(ctxs.get(idx));
    }

    private int indexOf(SymHeap sh) {
        if (!enabled) {
            return -1;
        }
        int hash = sh.hashCode();
        for (int i = 0; i < heaps.size(); i++) {
            SymHeap other = heaps.get(i);
            if (other.hashCode() == hash && other.equals(sh)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Store a new context
     * 
     * @param sh
     *            entry heap of the context, must not be modified afterwards
     * @param ctx
     *            context to store
     */
    public void insert(SymHeap sh, SymCallCtx ctx) {
        if (!enabled) {
            return;
        }
        assert indexOf(sh) < 0 : "Duplicate entry heap for " + ctx;
        heaps.add(sh);
        ctxs.add(ctx);
        assert heaps.size() == ctxs.size();
    }

    /**
     * Replace the entry heap of an existing slot, the context of the slot is
     * kept
     * 
     * @param oldHeap
     *            heap stored in the slot
     * @param newHeap
     *            new key of the slot
     * @return true if the slot was found
     */
    public boolean updateCacheEntry(SymHeap oldHeap, SymHeap newHeap) {
        if (!enabled) {
            return false;
        }
        int idx = -1;
        for (int i = 0; i < heaps.size(); i++) {
            if (heaps.get(i) == oldHeap) {
                idx = i;
                break;
            }
        }
        if (idx < 0) {
            idx = indexOf(oldHeap);
        }
        if (idx < 0) {
            return false;
        }
        heaps.set(idx, newHeap);
        return true;
    }

    public int size() {
        return ctxs.size();
    }

    public int getHits() {
        return hits;
    }

    public int getMisses() {
        return misses;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
