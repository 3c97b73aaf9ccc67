package analysis.symexec.call;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.print.PrettyPrinter;
import analysis.symexec.Diagnostics;
import analysis.symexec.heap.CVar;
import analysis.symexec.heap.SymHeap;
import analysis.symexec.heap.SymProc;
import analysis.symexec.heap.SymState;
import analysis.symexec.heap.SymValue;
import analysis.symexec.storage.Fnc;
import analysis.symexec.storage.Location;
import analysis.symexec.storage.Operand;
import analysis.symexec.storage.Var;

/**
 * Call of a function with a particular entry heap. Obtained from
 * {@link SymCallCache#getCallCtx}, the driver then
 * <ol>
 * <li>analyzes the body of the callee starting from {@link #entry()} if
 * {@link #needExec()} (or {@link #needReexecFor()} is not empty, see
 * {@link #prepareReexec()}), adding the heaps reaching the end of the body to
 * {@link #rawResults()}</li>
 * <li>calls {@link #flushCallResults(SymState)} to get the heaps of the caller
 * after the call</li>
 * </ol>
 */
public class SymCallCtx {

    private final SymCallCache cache;
    private final Fnc fnc;
    /**
     * Pruned entry heap, this is also the key of the context in the cache
     */
    private SymHeap entry;
    /**
     * Part of the caller's heap hidden from the callee in the current use
     */
    private SymHeap surround;
    /**
     * Map from object ids of {@link #entry} to the ids of the heap the context
     * is currently used with, null if they are the same
     */
    private Map<Integer, Integer> entryMapping;
    /**
     * Destination of the return value
     */
    private Operand dst = Operand.VOID;
    private Location callLoc = Location.UNKNOWN;
    private final SymState rawResults = new SymState();
    private int nestLevel;
    private CallCtxState state = CallCtxState.FRESH;
    /**
     * Globals discovered after the results were computed
     */
    private final Set<CVar> needReexecFor = new LinkedHashSet<>();
    private boolean invalidated;

    SymCallCtx(SymCallCache cache, Fnc fnc, SymHeap entry) {
        this.cache = cache;
        this.fnc = fnc;
        this.entry = entry;
    }

    /**
     * Prepare the context for the current call
     */
    void bind(Operand dst, Location callLoc, int nestLevel, SymHeap surround, Map<Integer, Integer> entryMapping) {
        checkValid();
        this.dst = dst;
        this.callLoc = callLoc;
        this.nestLevel = nestLevel;
        this.surround = surround;
        this.entryMapping = entryMapping;
        if (state == CallCtxState.FLUSHED) {
            // reused, the results are kept
            state = CallCtxState.COMPUTED;
        }
    }

    /**
     * Check whether the body of the callee has to be analyzed
     * 
     * @return true until results were computed for this context
     */
    public boolean needExec() {
        return state == CallCtxState.FRESH;
    }

    /**
     * Heap the body of the callee is to be analyzed with. It is the key of the
     * context and must not be modified, analyze a copy.
     * 
     * @return pruned entry heap
     */
    public SymHeap entry() {
        return entry;
    }

    /**
     * Collector of the heaps reaching the end of the callee
     * 
     * @return raw results
     */
    public SymState rawResults() {
        return rawResults;
    }

    /**
     * Globals discovered after the results of this context were computed. If
     * this is not empty the results are stale and the body has to be analyzed
     * again even if {@link #needExec()} is false.
     * 
     * @return unmodifiable set of variables
     */
    public Set<CVar> needReexecFor() {
        return Collections.unmodifiableSet(needReexecFor);
    }

    /**
     * Drop the stale results so that the body of the callee can be analyzed
     * again from the current {@link #entry()}
     */
    public void prepareReexec() {
        checkValid();
        if (state == CallCtxState.FLUSHED) {
            throw new IllegalStateException("Context of " + PrettyPrinter.fncString(fnc) + " is not in use");
        }
        rawResults.clear();
        needReexecFor.clear();
        state = CallCtxState.FRESH;
    }

    public Fnc fnc() {
        return fnc;
    }

    public CallCtxState state() {
        return state;
    }

    public int nestLevel() {
        return nestLevel;
    }

    /**
     * Part of the caller's heap hidden from the callee
     * 
     * @return surround heap of the current use, not to be modified
     */
    public SymHeap surround() {
        return surround;
    }

    /**
     * Join the results with the part of the caller's heap hidden from the
     * callee, assign the return value and destroy the stack frame of the
     * callee. The context is removed from the top of the live context stack
     * and the call from the back trace.
     * 
     * @param collector
     *            where to put the heaps of the caller after the call
     * @throws IllegalStateException
     *             if the results were already flushed or this is not the most
     *             recent live context
     */
    public void flushCallResults(SymState collector) {
        checkValid();
        if (state == CallCtxState.FLUSHED) {
            throw new IllegalStateException("Results of " + PrettyPrinter.fncString(fnc) + " already flushed");
        }
        cache.popCtx(this);
        state = CallCtxState.FLUSHED;

        Diagnostics diag = cache.diagnostics();
        SymBackTrace callerBt = cache.backTrace();
        int cnt = rawResults.size();
        for (int i = 0; i < cnt; i++) {
            if (1 < cnt) {
                diag.debug(callLoc, "*** SymCallCtx.flushCallResults() is processing heap #" + i);
            }

            SymHeap raw = rawResults.get(i);
            SymHeap sh = entryMapping == null ? new SymHeap(raw) : raw.renamed(entryMapping);

            // the callee may have brought back some of the caller's state
            sh.joinByCVars(surround);

            assignReturnValue(sh, callerBt);
            destroyStackFrame(sh, callerBt);

            if (cache.options().shouldAbstractOnCallDone()) {
                cache.callDoneAbstraction().abstractIfNeeded(sh);
            }
            collector.insert(sh);
        }
    }

    private void assignReturnValue(SymHeap sh, SymBackTrace callerBt) {
        if (dst.isVoid()) {
            return;
        }
        SymProc proc = new SymProc(sh, callerBt, cache.diagnostics());
        proc.setLocation(callLoc);
        int obj = proc.objByOperand(dst);
        assert obj != SymHeap.OBJ_INVALID;

        SymValue val = sh.valueOf(sh.addrOfRet());
        if (val == null) {
            // nothing was returned
            val = SymValue.UNKNOWN;
        }
        proc.objSetValue(obj, val);
    }

    private void destroyStackFrame(SymHeap sh, SymBackTrace callerBt) {
        Diagnostics diag = cache.diagnostics();
        SymProc proc = new SymProc(sh, callerBt, diag);
        proc.setDebugStackFrame(cache.options().shouldDebugStackFrame());

        List<CVar> liveVars = sh.gatherCVars();
        List<CVar> liveLocals = new ArrayList<>();
        for (CVar cv : liveVars) {
            Var v = fnc.getStorage().getVar(cv.getUid());
            if (!v.isOnStack() || cv.getInst() != nestLevel) {
                continue;
            }
            if (fnc.hasVar(cv.getUid())) {
                liveLocals.add(cv);
            }
        }

        diag.debug(fnc.getLocation(), "<<< destroying stack frame of " + PrettyPrinter.fncString(fnc) + ", nestLevel = "
                                        + nestLevel + ", varsTotal = " + fnc.getVars().size() + ", varsAlive = "
                                        + liveLocals.size());

        for (CVar cv : liveLocals) {
            Var v = fnc.getStorage().getVar(cv.getUid());
            if (cache.options().shouldDebugStackFrame()) {
                diag.debug(v.getLocation(), "<<< destroying stack variable: #" + v.getUid() + " (" + v.getName() + ")");
            }
            proc.setLocation(v.getLocation());
            proc.valDestroyTarget(sh.addrOfVar(cv));
        }

        // an ignored return value may own allocated memory
        proc.setLocation(callLoc);
        proc.valDestroyTarget(sh.addrOfRet());
    }

    /**
     * Add objects transferred from the caller's state to the entry heap
     * 
     * @param newEntry
     *            entry heap including the transferred objects
     * @param transferred
     *            ids of the transferred objects, they are the same in the heap
     *            the context is used with
     * @param cv
     *            rediscovered variable
     */
    void rediscovered(SymHeap newEntry, Collection<Integer> transferred, CVar cv) {
        entry = newEntry;
        needReexecFor.add(cv);
        if (entryMapping != null) {
            for (Integer id : transferred) {
                entryMapping.put(id, id);
            }
        }
    }

    /**
     * Release the context. Only has an effect if caching is disabled, cached
     * contexts live as long as the cache.
     */
    public void invalidate() {
        if (cache.isCacheEnabled()) {
            return;
        }
        invalidated = true;
        rawResults.clear();
        surround = null;
        entry = null;
        entryMapping = null;
    }

    private void checkValid() {
        if (invalidated) {
            throw new IllegalStateException("Context of " + PrettyPrinter.fncString(fnc) + " was invalidated");
        }
    }

    @Override
    public String toString() {
        return "SymCallCtx[" + PrettyPrinter.fncString(fnc) + ", " + state + ", nestLevel " + nestLevel + "]";
    }
}
