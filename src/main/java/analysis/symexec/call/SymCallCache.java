package analysis.symexec.call;

import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.json.JSONException;
import org.json.JSONObject;

import util.optional.Optional;
import util.print.PrettyPrinter;
import util.serialization.JSONSerializable;
import analysis.symexec.Diagnostics;
import analysis.symexec.SymExecOptions;
import analysis.symexec.heap.CVar;
import analysis.symexec.heap.SymHeap;
import analysis.symexec.heap.SymProc;
import analysis.symexec.heap.SymValue;
import analysis.symexec.storage.Fnc;
import analysis.symexec.storage.GenericInsn;
import analysis.symexec.storage.Insn;
import analysis.symexec.storage.InsnCode;
import analysis.symexec.storage.Location;
import analysis.symexec.storage.Operand;
import analysis.symexec.storage.Storage;
import analysis.symexec.storage.Var;

/**
 * Provides call contexts for the calls met by the symbolic execution, so that
 * the body of a function is analyzed only once for each entry heap (up to
 * isomorphism). Keeps the back trace and the stack of contexts whose results
 * were not flushed yet.
 * <p>
 * One instance serves one analysis run.
 */
public class SymCallCache implements JSONSerializable {

    private final Storage stor;
    private final SymBackTrace bt;
    private final Diagnostics diag;
    private final SymExecOptions opts;
    /**
     * Contexts by function uid
     */
    private final Map<Integer, PerFncCache> cache = new HashMap<>();
    /**
     * Contexts obtained but not flushed yet, the most recent last
     */
    private final List<SymCallCtx> ctxStack = new ArrayList<>();
    /**
     * For each function, globals that turned out to be used by its callees
     */
    private final Map<Integer, Set<Integer>> discoveredGlVars = new HashMap<>();
    /**
     * All global variables of the program
     */
    private final List<CVar> glVars = new ArrayList<>();
    private CallDoneAbstraction abstraction = CallDoneAbstraction.NONE;
    private int rediscoveries;

    /**
     * Create a cache for one analysis run
     * 
     * @param bt
     *            back trace of the run, it is modified by the cache
     * @param diag
     *            where to report problems
     * @param opts
     *            options of the run
     */
    public SymCallCache(SymBackTrace bt, Diagnostics diag, SymExecOptions opts) {
        this.stor = bt.stor();
        this.bt = bt;
        this.diag = diag;
        this.opts = opts;
        diag.setOutputLevel(opts.getOutputLevel());

        for (Var v : stor.getGlobalVars()) {
            glVars.add(new CVar(v.getUid(), /* global */0));
        }
        int found = glVars.size();
        if (found > 0) {
            diag.debug(null, "(g) SymCallCache found " + found + " gl variable(s)");
        }
    }

    public SymBackTrace backTrace() {
        return bt;
    }

    public Diagnostics diagnostics() {
        return diag;
    }

    public SymExecOptions options() {
        return opts;
    }

    public boolean isCacheEnabled() {
        return !opts.isCallCacheDisabled();
    }

    /**
     * Set the abstraction run on the heaps returned from calls when
     * {@link SymExecOptions#shouldAbstractOnCallDone()}
     * 
     * @param abstraction
     *            post-call abstraction
     */
    public void setCallDoneAbstraction(CallDoneAbstraction abstraction) {
        this.abstraction = abstraction;
    }

    CallDoneAbstraction callDoneAbstraction() {
        return abstraction;
    }

    /**
     * Number of contexts obtained whose results were not flushed yet
     * 
     * @return size of the live context stack
     */
    public int liveCtxCount() {
        return ctxStack.size();
    }

    /**
     * All global variables of the program
     * 
     * @return unmodifiable list of globals
     */
    public List<CVar> glVars() {
        return Collections.unmodifiableList(glVars);
    }

    private PerFncCache perFncCache(int fncUid) {
        PerFncCache pfc = cache.get(fncUid);
        if (pfc == null) {
            pfc = new PerFncCache(isCacheEnabled());
            cache.put(fncUid, pfc);
        }
        return pfc;
    }

    /**
     * Get the context of a call. The call is pushed on the back trace, it is
     * popped again when the results of the context are flushed.
     * 
     * @param entryHeap
     *            heap of the caller at the call, not modified
     * @param fnc
     *            function being called
     * @param insn
     *            call instruction
     * @return context of the call
     * @throws CallCtxException
     *             if the call would reenter a context whose results are not
     *             known yet
     * @throws IllegalArgumentException
     *             if the instruction is not a call or an operand cannot be
     *             read, the back trace is left as it was
     */
    public SymCallCtx getCallCtx(SymHeap entryHeap, Fnc fnc, Insn insn) {
        List<Operand> opList = insn.getOperands();
        if (insn.getCode() != InsnCode.CALL || opList.size() < Insn.CALL_ARGS_POS) {
            throw new IllegalArgumentException("Not a call instruction: " + insn);
        }
        Location lw = insn.getLocation();
        diag.debug(lw, "SymCallCache is looking for " + PrettyPrinter.fncString(fnc) + "...");

        // the arguments are read in the frame of the caller
        SymBackTrace callerBt = new SymBackTrace(bt);
        bt.pushCall(fnc.getUid(), GenericInsn.real(insn), entryHeap);
        try {
            // check recursion depth (if any)
            int nestLevel = bt.countOccurrencesOfFnc(fnc.getUid());
            if (nestLevel != 1) {
                diag.warn(lw, "support of call recursion is not stable yet");
                diag.note(lw, "nestLevel is " + nestLevel);
            }

            SymHeap heap = new SymHeap(entryHeap);
            SymProc proc = new SymProc(heap, bt, diag);
            proc.setLocation(lw);
            proc.setDebugStackFrame(opts.shouldDebugStackFrame());
            SymProc srcProc = new SymProc(heap, callerBt, diag);
            srcProc.setLocation(lw);

            List<CVar> cut = new ArrayList<>();
            createStackFrame(fnc, nestLevel, proc, cut);
            setCallArgs(fnc, nestLevel, opList, lw, proc, srcProc);
            srcProc.killInsn(insn);
            cut.addAll(globalsOfCut(fnc, heap));

            // prune heap
            SymHeap surround = heap.split(cut);
            new SymProc(surround, callerBt, diag).valDestroyTarget(surround.addrOfRet());

            SymCallCtx ctx;
            Map<Integer, Integer> mapping;
            PerFncCache pfc = perFncCache(fnc.getUid());
            Optional<SymCallCtx> cached = pfc.lookup(heap);
            if (cached.isNone()) {
                // cache miss
                ctx = new SymCallCtx(this, fnc, heap);
                pfc.insert(heap, ctx);
                mapping = null;
            } else {
                ctx = cached.get();
                if (ctx.state() != CallCtxState.FLUSHED) {
                    String msg = "SymCallCache: cache entry found, but result not "
                                                    + (ctx.state() == CallCtxState.FRESH ? "computed" : "flushed")
                                                    + " yet, perhaps a recursive function call?";
                    diag.error(lw, msg);
                    throw new CallCtxException(msg);
                }
                mapping = ctx.entry().matchObjects(heap);
                assert mapping != null : "cache hit on a non-isomorphic heap";
            }

            ctx.bind(opList.get(0), lw, nestLevel, surround, mapping);
            ctxStack.add(ctx);
            return ctx;
        } catch (RuntimeException e) {
            // the call is not entered
            bt.popCall();
            throw e;
        }
    }

    /**
     * Initialize the stack variables of the called function and add them to
     * the cut
     */
    private void createStackFrame(Fnc fnc, int nestLevel, SymProc proc, List<CVar> cut) {
        if (opts.shouldDebugStackFrame()) {
            diag.debug(proc.getLocation(), ">>> creating stack frame for " + PrettyPrinter.fncString(fnc)
                                            + ", nestLevel = " + nestLevel);
        }
        for (Var v : fnc.getStackVars()) {
            CVar cv = new CVar(v.getUid(), nestLevel);
            cut.add(cv);
            if (v.getInitializer() != null) {
                proc.initVariable(v, cv);
            }
        }
    }

    /**
     * Write the values of the actual arguments to the formal parameters
     */
    private void setCallArgs(Fnc fnc, int nestLevel, List<Operand> opList, Location lw, SymProc proc,
                                    SymProc srcProc) {
        List<Integer> args = fnc.getArgs();
        if (args.size() + Insn.CALL_ARGS_POS < opList.size()) {
            diag.warn(lw, "too many arguments given (vararg fnc involved?)");
            diag.note(fnc.getLocation(), "fnc was declared here");
        }

        SymHeap heap = proc.sh();
        int pos = Insn.CALL_ARGS_POS;
        for (Integer arg : args) {
            CVar cv = new CVar(arg, nestLevel);
            int lhs = heap.addrOfVar(cv).getTarget();

            if (opList.size() <= pos) {
                diag.note(lw, "missing argument being treated as unknown value");
                proc.objSetValue(lhs, SymValue.UNKNOWN);
                continue;
            }

            Operand op = opList.get(pos++);
            proc.objSetValue(lhs, srcProc.valFromOperand(op));
        }
    }

    /**
     * Globals the callee keeps: those alive in the heap that the callee refers
     * to or that were rediscovered for it before
     */
    private List<CVar> globalsOfCut(Fnc fnc, SymHeap heap) {
        Set<Integer> uids = new LinkedHashSet<>();
        for (Var v : fnc.getGlobalVars()) {
            uids.add(v.getUid());
        }
        Set<Integer> discovered = discoveredGlVars.get(fnc.getUid());
        if (discovered != null) {
            uids.addAll(discovered);
        }

        List<CVar> result = new ArrayList<>();
        for (Integer uid : uids) {
            CVar cv = new CVar(uid, 0);
            if (heap.isVarAlive(cv)) {
                result.add(cv);
            }
        }
        return result;
    }

    /**
     * Remove the given context from the top of the live context stack and its
     * call from the back trace
     */
    void popCtx(SymCallCtx ctx) {
        if (ctxStack.isEmpty() || ctxStack.get(ctxStack.size() - 1) != ctx) {
            throw new IllegalStateException(ctx + " is not the most recent live call context");
        }
        ctxStack.remove(ctxStack.size() - 1);
        int fncUid = bt.popCall();
        assert fncUid == ctx.fnc().getUid();
    }

    /**
     * A global variable that is not alive in the given heap is about to be
     * used. Bring it in from the part of the caller's state that was hidden
     * from the current call chain. Contexts that were computed without the
     * variable are marked for re-execution and their cache keys updated.
     * 
     * @param heap
     *            heap of the function on the top of the stack, the variable is
     *            added to it
     * @param cv
     *            global variable
     * @return true if the variable was found, false if it does not exist yet
     */
    public boolean rediscoverGlVar(SymHeap heap, CVar cv) {
        int found = -1;
        for (int i = ctxStack.size() - 1; i >= 0; i--) {
            SymHeap sur = ctxStack.get(i).surround();
            if (sur != null && sur.isVarAlive(cv)) {
                found = i;
                break;
            }
        }

        int pos = bt.lastStackPositionOf(cv);
        if (found < 0) {
            if (pos >= 0) {
                diag.debug(null, "rediscoverGlVar(): " + PrettyPrinter.varString(stor, cv)
                                                + " alive in the back trace at #" + pos + " but in no surround");
            }
            return false;
        }

        SymHeap piece = ctxStack.get(found).surround().extract(Collections.singleton(cv));
        for (int i = found; i < ctxStack.size(); i++) {
            SymCallCtx ctx = ctxStack.get(i);
            SymHeap oldEntry = ctx.entry();
            SymHeap newEntry = new SymHeap(oldEntry);
            newEntry.join(piece);
            perFncCache(ctx.fnc().getUid()).updateCacheEntry(oldEntry, newEntry);
            ctx.rediscovered(newEntry, piece.objectIds(), cv);

            Set<Integer> discovered = discoveredGlVars.get(ctx.fnc().getUid());
            if (discovered == null) {
                discovered = new LinkedHashSet<>();
                discoveredGlVars.put(ctx.fnc().getUid(), discovered);
            }
            discovered.add(cv.getUid());
        }
        heap.join(piece);

        rediscoveries++;
        diag.debug(null, "rediscoverGlVar(): " + PrettyPrinter.varString(stor, cv) + " rediscovered, "
                                        + (ctxStack.size() - found) + " context(s) need re-execution");
        return true;
    }

    public int getRediscoveries() {
        return rediscoveries;
    }

    /**
     * Number of contexts cached for the given function
     * 
     * @param fnc
     *            function
     * @return number of cached contexts
     */
    public int cachedCtxCount(Fnc fnc) {
        PerFncCache pfc = cache.get(fnc.getUid());
        return pfc == null ? 0 : pfc.size();
    }

    @Override
    public JSONObject toJSON() {
        JSONObject o = new JSONObject();
        o.put("callCacheEnabled", isCacheEnabled());
        o.put("rediscoveries", rediscoveries);
        JSONObject fncs = new JSONObject();
        for (Map.Entry<Integer, PerFncCache> e : new TreeMap<>(cache).entrySet()) {
            PerFncCache pfc = e.getValue();
            JSONObject f = new JSONObject();
            f.put("contexts", pfc.size());
            f.put("hits", pfc.getHits());
            f.put("misses", pfc.getMisses());
            fncs.put(stor.getFnc(e.getKey()).getName(), f);
        }
        o.put("functions", fncs);
        return o;
    }

    @Override
    public void writeJSON(Writer out) throws JSONException {
        toJSON().write(out);
    }
}
