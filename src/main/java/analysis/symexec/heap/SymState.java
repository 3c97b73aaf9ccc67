package analysis.symexec.heap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered collection of symbolic heaps where no two heaps are isomorphic
 */
public class SymState implements Iterable<SymHeap> {

    private final List<SymHeap> heaps = new ArrayList<>();

    /**
     * Insert a heap unless an isomorphic one is already present
     * 
     * @param sh
     *            heap to insert, it is stored as is (not copied)
     * @return true if the heap was added
     */
    public boolean insert(SymHeap sh) {
        if (lookup(sh) >= 0) {
            return false;
        }
        heaps.add(sh);
        return true;
    }

    /**
     * Find a heap isomorphic to the given one
     * 
     * @param sh
     *            heap to look for
     * @return index of the heap or -1 if there is none
     */
    public int lookup(SymHeap sh) {
        int hash = sh.hashCode();
        for (int i = 0; i < heaps.size(); i++) {
            SymHeap other = heaps.get(i);
            if (other.hashCode() == hash && other.equals(sh)) {
                return i;
            }
        }
        return -1;
    }

    public SymHeap get(int idx) {
        return heaps.get(idx);
    }

    public int size() {
        return heaps.size();
    }

    public boolean isEmpty() {
        return heaps.isEmpty();
    }

    public void clear() {
        heaps.clear();
    }

    @Override
    public Iterator<SymHeap> iterator() {
        return Collections.unmodifiableList(heaps).iterator();
    }

    @Override
    public String toString() {
        return "SymState" + heaps;
    }
}
