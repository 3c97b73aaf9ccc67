package analysis.symexec.heap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import util.OrderedPair;
import util.WorkQueue;
import util.print.PrettyPrinter;
import analysis.symexec.storage.Storage;

/**
 * Abstract memory state. Objects live in an arena and are addressed by small
 * integer ids; an object is either the storage of a program variable, a block
 * allocated on the heap, or the return-value staging slot.
 * <p>
 * Two heaps are {@link #equals(Object) equal} if they are isomorphic, i.e.
 * they have the same live variables and the same shape, regardless of the ids
 * of their objects. Heaps are mutable, so a heap must not be changed while it
 * is used as a key.
 */
public final class SymHeap {

    /**
     * Id of the return-value staging slot, which is the same object in every
     * heap
     */
    public static final int OBJ_RETURN = 0;
    /**
     * Id returned when no object exists
     */
    public static final int OBJ_INVALID = -1;

    /**
     * Kind of heap object
     */
    public enum ObjKind {
        VAR,
        HEAP,
        RETURN
    }

    /**
     * One object of the arena
     */
    private static final class HeapObject {
        final ObjKind kind;
        /**
         * Variable this object is the storage of, null unless kind is VAR
         */
        final CVar var;
        /**
         * Number of cells
         */
        final int size;
        /**
         * Values of cells that were written, others are uninitialized
         */
        final TreeMap<Integer, SymValue> cells = new TreeMap<>();

        HeapObject(ObjKind kind, CVar var, int size) {
            this.kind = kind;
            this.var = var;
            this.size = size;
        }

        HeapObject copy() {
            HeapObject o = new HeapObject(kind, var, size);
            o.cells.putAll(cells);
            return o;
        }
    }

    private final Storage stor;
    private final SymHeapIds ids;
    private final TreeMap<Integer, HeapObject> objects = new TreeMap<>();
    private final TreeMap<CVar, Integer> varObjs = new TreeMap<>();
    /**
     * Objects of this heap that are pointed to from a heap they were split
     * from (the surround), mapped to the number of such heaps. These objects
     * are never garbage.
     */
    private final Map<Integer, Integer> extRefs = new HashMap<>();
    /**
     * Ids of objects of another heap that cells of this heap point to
     */
    private final Set<Integer> borrowed = new TreeSet<>();

    /**
     * Create an empty heap
     * 
     * @param stor
     *            program the heap belongs to
     * @param ids
     *            id source shared by all heaps of the analysis run
     */
    public SymHeap(Storage stor, SymHeapIds ids) {
        this.stor = stor;
        this.ids = ids;
    }

    /**
     * Deep copy of the given heap, the copy keeps the object ids
     * 
     * @param other
     *            heap to copy
     */
    public SymHeap(SymHeap other) {
        this(other.stor, other.ids);
        for (Map.Entry<Integer, HeapObject> e : other.objects.entrySet()) {
            objects.put(e.getKey(), e.getValue().copy());
        }
        varObjs.putAll(other.varObjs);
        extRefs.putAll(other.extRefs);
        borrowed.addAll(other.borrowed);
    }

    public Storage stor() {
        return stor;
    }

    public SymHeapIds ids() {
        return ids;
    }

    /**
     * Gather all program variables that have an object in this heap
     * 
     * @return live variables, sorted
     */
    public List<CVar> gatherCVars() {
        return new ArrayList<>(varObjs.keySet());
    }

    public boolean isVarAlive(CVar cv) {
        return varObjs.containsKey(cv);
    }

    /**
     * Get the object of the given variable
     * 
     * @param cv
     *            variable
     * @return object id or {@link #OBJ_INVALID} if the variable is not alive
     */
    public int objOfVar(CVar cv) {
        Integer id = varObjs.get(cv);
        return id == null ? OBJ_INVALID : id;
    }

    /**
     * Get the address of the given variable, the object of the variable is
     * created (uninitialized) if it does not exist yet
     * 
     * @param cv
     *            variable
     * @return address of the variable
     */
    public SymValue addrOfVar(CVar cv) {
        Integer id = varObjs.get(cv);
        if (id == null) {
            id = ids.fresh();
            objects.put(id, new HeapObject(ObjKind.VAR, cv, 1));
            varObjs.put(cv, id);
        }
        return SymValue.addr(id, 0);
    }

    /**
     * Address of the return-value staging slot. The slot is created when it is
     * first written to.
     * 
     * @return address of the return slot
     */
    public SymValue addrOfRet() {
        return SymValue.addr(OBJ_RETURN, 0);
    }

    public boolean hasObject(int objId) {
        return objects.containsKey(objId);
    }

    /**
     * Read the value stored at the given address
     * 
     * @param addr
     *            address of a cell
     * @return value in the cell, or null if the address does not point to a
     *         valid cell of an existing object
     */
    public SymValue valueOf(SymValue addr) {
        if (!addr.isAddress()) {
            return null;
        }
        HeapObject o = objects.get(addr.getTarget());
        if (o == null || addr.getOffset() < 0 || addr.getOffset() >= o.size) {
            return null;
        }
        SymValue v = o.cells.get(addr.getOffset());
        return v == null ? SymValue.UNINIT : v;
    }

    /**
     * Write a value to the given address
     * 
     * @param addr
     *            address of a cell
     * @param val
     *            value to store
     */
    public void setValue(SymValue addr, SymValue val) {
        if (!addr.isAddress()) {
            throw new RuntimeException("Write through a non-address " + addr);
        }
        int id = addr.getTarget();
        HeapObject o = objects.get(id);
        if (o == null && id == OBJ_RETURN) {
            o = new HeapObject(ObjKind.RETURN, null, 1);
            objects.put(OBJ_RETURN, o);
        }
        if (o == null) {
            throw new RuntimeException("Write through a dangling pointer " + addr);
        }
        if (addr.getOffset() < 0 || addr.getOffset() >= o.size) {
            throw new RuntimeException("Write out of bounds " + addr + " (size " + o.size + ")");
        }
        if (val.getCode() == SymValue.ValueCode.UNINIT) {
            o.cells.remove(addr.getOffset());
        } else {
            o.cells.put(addr.getOffset(), val);
        }
    }

    /**
     * Allocate a new block on the heap
     * 
     * @param cells
     *            number of cells of the block
     * @return address of the first cell
     */
    public SymValue heapAlloc(int cells) {
        assert cells > 0 : "Empty allocation";
        int id = ids.fresh();
        objects.put(id, new HeapObject(ObjKind.HEAP, null, cells));
        return SymValue.addr(id, 0);
    }

    /**
     * Check whether any cell (or a heap this one was split from) points to the
     * given object
     * 
     * @param objId
     *            object id
     * @return true if there is a reference to the object
     */
    public boolean isPointed(int objId) {
        if (extRefCount(objId) > 0) {
            return true;
        }
        for (HeapObject o : objects.values()) {
            for (SymValue v : o.cells.values()) {
                if (v.isAddress() && v.getTarget() == objId) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Deallocate the object the given address points to. Heap blocks which
     * become unreachable as a result are leaked; they are removed as well and
     * reported to the caller.
     * 
     * @param addr
     *            address of the object to destroy, anything else is ignored
     * @return ids of the leaked heap blocks
     */
    public List<Integer> destroyTarget(SymValue addr) {
        if (!addr.isAddress() || !objects.containsKey(addr.getTarget())) {
            return Collections.emptyList();
        }
        removeObject(addr.getTarget());
        return collectJunk();
    }

    private void removeObject(int objId) {
        HeapObject o = objects.remove(objId);
        if (o != null && o.var != null) {
            varObjs.remove(o.var);
        }
        extRefs.remove(objId);
    }

    /**
     * Remove all heap blocks unreachable from the roots
     * 
     * @return ids of the removed blocks
     */
    private List<Integer> collectJunk() {
        Set<Integer> live = reachableFrom(roots());
        List<Integer> junk = new ArrayList<>();
        for (Map.Entry<Integer, HeapObject> e : objects.entrySet()) {
            if (e.getValue().kind == ObjKind.HEAP && !live.contains(e.getKey())) {
                junk.add(e.getKey());
            }
        }
        for (Integer id : junk) {
            removeObject(id);
        }
        return junk;
    }

    /**
     * Variables, the return slot and externally referenced objects
     */
    private List<Integer> roots() {
        List<Integer> roots = new ArrayList<>(varObjs.values());
        if (objects.containsKey(OBJ_RETURN)) {
            roots.add(OBJ_RETURN);
        }
        for (Integer id : extRefs.keySet()) {
            if (objects.containsKey(id)) {
                roots.add(id);
            }
        }
        return roots;
    }

    /**
     * Objects reachable from the given ones following addresses stored in
     * cells, in breadth-first order
     */
    private Set<Integer> reachableFrom(Collection<Integer> start) {
        Set<Integer> visited = new LinkedHashSet<>();
        WorkQueue<Integer> q = new WorkQueue<>(start);
        while (!q.isEmpty()) {
            Integer id = q.poll();
            if (!visited.add(id)) {
                continue;
            }
            HeapObject o = objects.get(id);
            for (SymValue v : o.cells.values()) {
                if (v.isAddress() && objects.containsKey(v.getTarget()) && !visited.contains(v.getTarget())) {
                    q.add(v.getTarget());
                }
            }
        }
        return visited;
    }

    /**
     * Split the heap. This heap keeps the given variables and every object
     * reachable from them, the rest is moved to the returned heap. Objects of
     * the returned heap may still point to objects kept here, such objects are
     * recorded as externally referenced until the returned heap is
     * {@link #join(SymHeap) joined} back.
     * 
     * @param cut
     *            variables to keep, those that are not alive are ignored
     * @return heap containing everything else (the surround)
     */
    public SymHeap split(Collection<CVar> cut) {
        List<Integer> cutRoots = new ArrayList<>();
        for (CVar cv : cut) {
            Integer id = varObjs.get(cv);
            if (id != null) {
                cutRoots.add(id);
            }
        }
        Set<Integer> keep = reachableFrom(cutRoots);

        SymHeap surround = new SymHeap(stor, ids);
        for (Integer id : new ArrayList<>(objects.keySet())) {
            if (keep.contains(id)) {
                continue;
            }
            HeapObject o = objects.get(id);
            surround.objects.put(id, o);
            if (o.var != null) {
                surround.varObjs.put(o.var, id);
            }
            Integer pins = extRefs.get(id);
            if (pins != null) {
                surround.extRefs.put(id, pins);
            }
            removeObject(id);
        }

        // references across the cut
        Set<Integer> borrowedBefore = new HashSet<>(borrowed);
        borrowed.clear();
        for (HeapObject o : surround.objects.values()) {
            for (SymValue v : o.cells.values()) {
                if (!v.isAddress()) {
                    continue;
                }
                int target = v.getTarget();
                if (keep.contains(target)) {
                    surround.borrowed.add(target);
                } else if (borrowedBefore.contains(target)) {
                    surround.borrowed.add(target);
                }
            }
        }
        for (Integer target : surround.borrowed) {
            if (keep.contains(target)) {
                pin(target);
            }
        }
        for (HeapObject o : objects.values()) {
            for (SymValue v : o.cells.values()) {
                if (v.isAddress() && borrowedBefore.contains(v.getTarget())) {
                    borrowed.add(v.getTarget());
                }
            }
        }
        return surround;
    }

    private void pin(int objId) {
        Integer n = extRefs.get(objId);
        extRefs.put(objId, n == null ? 1 : n + 1);
    }

    private void release(int objId) {
        Integer n = extRefs.get(objId);
        if (n == null) {
            return;
        }
        if (n <= 1) {
            extRefs.remove(objId);
        } else {
            extRefs.put(objId, n - 1);
        }
    }

    /**
     * Merge the objects of another heap into this one. Variables that are
     * already alive here and objects with an id present here are kept as they
     * are, only the missing ones are added. References between the two heaps
     * created by {@link #split(Collection)} are resolved.
     * 
     * @param other
     *            heap to merge, it is not modified
     */
    public void join(SymHeap other) {
        for (Map.Entry<Integer, HeapObject> e : other.objects.entrySet()) {
            int id = e.getKey();
            HeapObject o = e.getValue();
            if (objects.containsKey(id)) {
                continue;
            }
            if (o.var != null && varObjs.containsKey(o.var)) {
                continue;
            }
            objects.put(id, o.copy());
            if (o.var != null) {
                varObjs.put(o.var, id);
            }
            Integer pins = other.extRefs.get(id);
            if (pins != null) {
                extRefs.put(id, pins);
            }
        }

        Set<Integer> allBorrowed = new TreeSet<>(borrowed);
        allBorrowed.addAll(other.borrowed);
        borrowed.clear();
        for (Integer id : allBorrowed) {
            if (objects.containsKey(id)) {
                release(id);
            } else {
                borrowed.add(id);
            }
        }
    }

    /**
     * Merge another heap into this one using variable identity as the key. A
     * variable alive in both heaps keeps the object of this heap; cells of
     * the other heap that point to its object there are redirected here.
     * 
     * @param other
     *            heap to merge, it is not modified
     */
    public void joinByCVars(SymHeap other) {
        SymHeap sur = new SymHeap(other);
        Map<Integer, Integer> redirect = new HashMap<>();
        List<CVar> shared = new ArrayList<>();
        for (Map.Entry<CVar, Integer> e : varObjs.entrySet()) {
            Integer theirs = sur.varObjs.get(e.getKey());
            if (theirs == null) {
                continue;
            }
            shared.add(e.getKey());
            int ours = e.getValue();
            if (theirs != ours) {
                redirect.put(theirs, ours);
                Integer pins = sur.extRefs.get(theirs);
                if (pins != null) {
                    Integer n = extRefs.get(ours);
                    extRefs.put(ours, n == null ? pins : n + pins);
                }
            }
        }
        sur.dropVars(shared);

        if (!redirect.isEmpty()) {
            for (HeapObject o : sur.objects.values()) {
                for (Map.Entry<Integer, SymValue> cell : o.cells.entrySet()) {
                    SymValue v = cell.getValue();
                    if (v.isAddress() && redirect.containsKey(v.getTarget())) {
                        cell.setValue(v.retarget(redirect.get(v.getTarget())));
                    }
                }
            }
        }
        join(sur);
    }

    /**
     * Copy of the part of this heap reachable from the given variables. The
     * copy keeps the object ids and carries no external references, so it can
     * be {@link #join(SymHeap) joined} into another heap of the same run.
     * 
     * @param vars
     *            variables to copy, dead ones are ignored
     * @return new heap, this one is not modified
     */
    public SymHeap extract(Collection<CVar> vars) {
        SymHeap part = new SymHeap(this);
        part.split(vars);
        part.extRefs.clear();
        return part;
    }

    /**
     * Remove the given variables without deallocation semantics: objects only
     * reachable through them disappear silently. Used to drop state that is
     * known to be represented elsewhere.
     * 
     * @param vars
     *            variables to remove, dead ones are ignored
     */
    public void dropVars(Collection<CVar> vars) {
        boolean changed = false;
        for (CVar cv : vars) {
            Integer id = varObjs.get(cv);
            if (id != null) {
                removeObject(id);
                changed = true;
            }
        }
        if (changed) {
            collectJunk();
        }
    }

    /**
     * Copy of this heap with objects renamed. Objects whose id is in the
     * mapping get the mapped id, all other objects (except the return slot)
     * get fresh ids.
     * 
     * @param mapping
     *            map from object ids of this heap to ids of the copy
     * @return renamed copy
     */
    public SymHeap renamed(Map<Integer, Integer> mapping) {
        Map<Integer, Integer> full = new HashMap<>();
        for (Integer id : objects.keySet()) {
            if (id == OBJ_RETURN) {
                full.put(id, id);
            } else if (mapping.containsKey(id)) {
                full.put(id, mapping.get(id));
            } else {
                full.put(id, ids.fresh());
            }
        }

        SymHeap copy = new SymHeap(stor, ids);
        for (Map.Entry<Integer, HeapObject> e : objects.entrySet()) {
            HeapObject src = e.getValue();
            HeapObject dst = new HeapObject(src.kind, src.var, src.size);
            for (Map.Entry<Integer, SymValue> cell : src.cells.entrySet()) {
                dst.cells.put(cell.getKey(), rename(cell.getValue(), full, mapping));
            }
            int newId = full.get(e.getKey());
            copy.objects.put(newId, dst);
            if (dst.var != null) {
                copy.varObjs.put(dst.var, newId);
            }
        }
        for (Map.Entry<Integer, Integer> e : extRefs.entrySet()) {
            copy.extRefs.put(renameId(e.getKey(), full, mapping), e.getValue());
        }
        for (Integer id : borrowed) {
            copy.borrowed.add(renameId(id, full, mapping));
        }
        return copy;
    }

    private static int renameId(int id, Map<Integer, Integer> full, Map<Integer, Integer> mapping) {
        Integer n = full.get(id);
        if (n == null) {
            n = mapping.get(id);
        }
        return n == null ? id : n;
    }

    private static SymValue rename(SymValue v, Map<Integer, Integer> full, Map<Integer, Integer> mapping) {
        if (!v.isAddress()) {
            return v;
        }
        return v.retarget(renameId(v.getTarget(), full, mapping));
    }

    /**
     * Compute an isomorphism between this heap and another one
     * 
     * @param other
     *            heap to match against
     * @return map from object ids of this heap to the corresponding object ids
     *         of <code>other</code>, or null if the heaps are not isomorphic
     */
    public Map<Integer, Integer> matchObjects(SymHeap other) {
        OrderedPair<List<Object>, List<Integer>> mine = canonicalize();
        OrderedPair<List<Object>, List<Integer>> theirs = other.canonicalize();
        if (!mine.fst().equals(theirs.fst())) {
            return null;
        }
        Map<Integer, Integer> m = new LinkedHashMap<>();
        for (int i = 0; i < mine.snd().size(); i++) {
            m.put(mine.snd().get(i), theirs.snd().get(i));
        }
        return m;
    }

    /**
     * Canonical form of the heap: objects are numbered in breadth-first order
     * starting from the variables (sorted) and the return slot; objects not
     * reachable from there follow in id order.
     * 
     * @return (canonical description, object ids in canonical order)
     */
    private OrderedPair<List<Object>, List<Integer>> canonicalize() {
        List<Integer> start = new ArrayList<>(varObjs.values());
        if (objects.containsKey(OBJ_RETURN)) {
            start.add(OBJ_RETURN);
        }
        Set<Integer> visited = reachableFrom(start);
        for (Integer id : objects.keySet()) {
            if (!visited.contains(id)) {
                visited.addAll(reachableFrom(Collections.singleton(id)));
            }
        }
        List<Integer> order = new ArrayList<>(visited);
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }

        List<Object> form = new ArrayList<>();
        for (Integer id : order) {
            HeapObject o = objects.get(id);
            form.add(o.kind);
            form.add(o.var);
            form.add(o.size);
            form.add(extRefCount(id) > 0);
            for (Map.Entry<Integer, SymValue> cell : o.cells.entrySet()) {
                SymValue v = cell.getValue();
                Object enc;
                if (!v.isAddress()) {
                    enc = v;
                } else if (index.containsKey(v.getTarget())) {
                    enc = "A" + index.get(v.getTarget()) + "+" + v.getOffset();
                } else {
                    enc = "D+" + v.getOffset();
                }
                form.add(new OrderedPair<>(cell.getKey(), enc));
            }
            form.add("|");
        }
        return new OrderedPair<>(form, order);
    }

    public int objCount() {
        return objects.size();
    }

    /**
     * Ids of all objects in ascending order
     * 
     * @return object ids
     */
    public Set<Integer> objectIds() {
        return Collections.unmodifiableSet(objects.keySet());
    }

    public ObjKind kindOf(int objId) {
        HeapObject o = objects.get(objId);
        return o == null ? null : o.kind;
    }

    /**
     * Variable the given object is the storage of
     * 
     * @param objId
     *            object id
     * @return variable or null for other objects
     */
    public CVar varOf(int objId) {
        HeapObject o = objects.get(objId);
        return o == null ? null : o.var;
    }

    /**
     * Cells of the given object that were written to
     * 
     * @param objId
     *            object id
     * @return map from offset to value
     */
    public SortedMap<Integer, SymValue> cellsOf(int objId) {
        HeapObject o = objects.get(objId);
        if (o == null) {
            return Collections.emptySortedMap();
        }
        return Collections.unmodifiableSortedMap(o.cells);
    }

    public int extRefCount(int objId) {
        Integer n = extRefs.get(objId);
        return n == null ? 0 : n;
    }

    /**
     * Ids of objects of other heaps that this heap points to
     * 
     * @return borrowed object ids
     */
    public Set<Integer> borrowedIds() {
        return Collections.unmodifiableSet(borrowed);
    }

    @Override
    public int hashCode() {
        return canonicalize().fst().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SymHeap)) {
            return false;
        }
        return canonicalize().fst().equals(((SymHeap) obj).canonicalize().fst());
    }

    @Override
    public String toString() {
        return PrettyPrinter.heapString(this);
    }
}
