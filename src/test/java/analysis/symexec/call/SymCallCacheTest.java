package analysis.symexec.call;

import java.io.StringWriter;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import junit.framework.TestCase;

import org.json.JSONObject;

import util.Logger;
import analysis.symexec.Diagnostics;
import analysis.symexec.Diagnostics.Severity;
import analysis.symexec.ProgramBuilder;
import analysis.symexec.SymExecOptions;
import analysis.symexec.heap.CVar;
import analysis.symexec.heap.SymHeap;
import analysis.symexec.heap.SymHeapIds;
import analysis.symexec.heap.SymProc;
import analysis.symexec.heap.SymState;
import analysis.symexec.heap.SymValue;
import analysis.symexec.storage.Fnc;
import analysis.symexec.storage.GenericInsn;
import analysis.symexec.storage.Insn;
import analysis.symexec.storage.InsnCode;
import analysis.symexec.storage.Operand;
import analysis.symexec.storage.Var;

/**
 * Drives the call cache the way the symbolic execution does: get a context,
 * analyze the body if needed (here the tests build the result heaps by hand),
 * flush the results.
 */
public class SymCallCacheTest extends TestCase {

    private ProgramBuilder pb;
    private Fnc main;
    private SymHeapIds ids;
    private Diagnostics diag;
    private SymBackTrace bt;

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        Logger.push(false);
        pb = new ProgramBuilder();
        main = pb.fnc("main");
        ids = new SymHeapIds();
        diag = new Diagnostics(2);
    }

    @Override
    protected void tearDown() throws Exception {
        Logger.pop();
        super.tearDown();
    }

    private SymCallCache newCache(String... args) {
        bt = new SymBackTrace(pb.stor());
        return new SymCallCache(bt, diag, SymExecOptions.getOptions(args));
    }

    /**
     * Heap of main, which is the root of the back trace
     */
    private SymHeap enterMain() {
        SymHeap sh = new SymHeap(pb.stor(), ids);
        bt.pushCall(main.getUid(), GenericInsn.text("main"), sh);
        return sh;
    }

    /**
     * Write to a variable of the function on the top of the back trace
     */
    private void set(SymHeap sh, Var v, SymValue val) {
        SymProc proc = new SymProc(sh, bt, diag);
        proc.objSetValue(proc.objByOperand(ProgramBuilder.var(v)), val);
    }

    /**
     * Read a variable of the function on the top of the back trace
     */
    private SymValue get(SymHeap sh, Var v) {
        return new SymProc(sh, bt, diag).valFromOperand(ProgramBuilder.var(v));
    }

    private static SymValue valueOfVar(SymHeap sh, CVar cv) {
        return sh.valueOf(SymValue.addr(sh.objOfVar(cv), 0));
    }

    private static int objectsOf(SymHeap sh, CVar cv) {
        int n = 0;
        for (int id : sh.objectIds()) {
            if (cv.equals(sh.varOf(id))) {
                n++;
            }
        }
        return n;
    }

    /**
     * Analyze the body as if it did not change anything
     */
    private static SymState runIdentity(SymCallCtx ctx) {
        if (ctx.needExec()) {
            ctx.rawResults().insert(new SymHeap(ctx.entry()));
        }
        SymState out = new SymState();
        ctx.flushCallResults(out);
        return out;
    }

    public void testCacheReuse() {
        Fnc f = pb.fnc("f");
        Var a = pb.arg(f, "a");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f, Operand.constInt(1)));
        assertTrue(ctx.needExec());
        assertEquals(CallCtxState.FRESH, ctx.state());
        assertEquals(2, bt.size());
        assertEquals(1, cache.liveCtxCount());
        assertEquals(SymValue.ofInt(1), valueOfVar(ctx.entry(), new CVar(a.getUid(), 1)));

        SymState after = runIdentity(ctx);
        assertEquals(1, after.size());
        assertEquals(1, bt.size());
        assertEquals(0, cache.liveCtxCount());
        assertEquals(CallCtxState.FLUSHED, ctx.state());
        assertFalse(after.get(0).isVarAlive(new CVar(a.getUid(), 1)));

        // the same entry heap from another call site
        SymCallCtx ctx2 = cache.getCallCtx(after.get(0), f, pb.call(Operand.VOID, f, Operand.constInt(1)));
        assertSame(ctx, ctx2);
        assertFalse(ctx2.needExec());
        assertTrue(ctx2.needReexecFor().isEmpty());
        assertEquals(CallCtxState.COMPUTED, ctx2.state());
        assertEquals(1, runIdentity(ctx2).size());
        assertEquals(1, cache.cachedCtxCount(f));

        // a different argument is a different entry heap
        SymCallCtx ctx3 = cache.getCallCtx(after.get(0), f, pb.call(Operand.VOID, f, Operand.constInt(2)));
        assertNotSame(ctx, ctx3);
        assertTrue(ctx3.needExec());
        runIdentity(ctx3);
        assertEquals(2, cache.cachedCtxCount(f));
    }

    public void testCacheHitRenamesResults() {
        Fnc f = pb.fnc("f");
        Var a = pb.arg(f, "a");
        Var p = pb.local(main, "p");
        Var q = pb.local(main, "q");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        SymValue b1 = sh.heapAlloc(1);
        sh.setValue(b1, SymValue.ofInt(5));
        set(sh, p, b1);
        SymValue b2 = sh.heapAlloc(1);
        sh.setValue(b2, SymValue.ofInt(5));
        set(sh, q, b2);

        // f(p) writes 9 to *a
        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f, ProgramBuilder.var(p)));
        assertTrue(ctx.needExec());
        SymHeap run = new SymHeap(ctx.entry());
        run.setValue(get(run, a), SymValue.ofInt(9));
        ctx.rawResults().insert(run);
        SymState res1 = new SymState();
        ctx.flushCallResults(res1);
        assertEquals(1, res1.size());
        assertEquals(SymValue.ofInt(9), res1.get(0).valueOf(get(res1.get(0), p)));
        assertEquals(SymValue.ofInt(5), res1.get(0).valueOf(get(res1.get(0), q)));

        // f(q) has an isomorphic entry heap, the results are reused for q
        SymCallCtx ctx2 = cache.getCallCtx(res1.get(0), f, pb.call(Operand.VOID, f, ProgramBuilder.var(q)));
        assertSame(ctx, ctx2);
        assertFalse(ctx2.needExec());
        SymState res2 = new SymState();
        ctx2.flushCallResults(res2);
        SymHeap out = res2.get(0);
        assertEquals(b1, get(out, p));
        assertEquals(b2, get(out, q));
        assertEquals(SymValue.ofInt(9), out.valueOf(b1));
        assertEquals(SymValue.ofInt(9), out.valueOf(b2));
        assertEquals(0, diag.count(Severity.WARNING));
    }

    public void testPartition() {
        Fnc f = pb.fnc("f");
        pb.arg(f, "a");
        Var gl = pb.global("gl");
        Var other = pb.global("other");
        pb.uses(f, gl);
        Var x = pb.local(main, "x");
        Var y = pb.local(main, "y");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        set(sh, gl, SymValue.ofInt(1));
        set(sh, other, SymValue.ofInt(2));
        set(sh, x, sh.heapAlloc(3));
        set(sh, y, SymValue.ofInt(3));
        int varsBefore = sh.gatherCVars().size();
        int objsBefore = sh.objCount();

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f, ProgramBuilder.var(x)));
        SymHeap entry = ctx.entry();
        SymHeap surround = ctx.surround();

        // the caller's heap is not touched
        assertEquals(varsBefore, sh.gatherCVars().size());
        assertEquals(objsBefore, sh.objCount());

        Set<CVar> inEntry = new HashSet<>(entry.gatherCVars());
        Set<CVar> inSurround = new HashSet<>(surround.gatherCVars());
        Set<CVar> both = new HashSet<>(inEntry);
        both.retainAll(inSurround);
        assertTrue(both.isEmpty());

        Set<CVar> all = new HashSet<>(inEntry);
        all.addAll(inSurround);
        Set<CVar> expected = new HashSet<>(sh.gatherCVars());
        expected.add(new CVar(f.getArgs().get(0), 1));
        assertEquals(expected, all);

        assertTrue(inEntry.contains(new CVar(gl.getUid(), 0)));
        assertTrue(inSurround.contains(new CVar(other.getUid(), 0)));
        assertTrue(inSurround.contains(new CVar(x.getUid(), 1)));

        // every object of the caller is on exactly one side
        for (int id : sh.objectIds()) {
            assertTrue("object " + id, entry.hasObject(id) ^ surround.hasObject(id));
        }
        // the block x points to is reachable from the argument
        assertTrue(entry.hasObject(get(sh, x).getTarget()));
        runIdentity(ctx);
    }

    public void testReturnValueRoundTrip() {
        Fnc g = pb.fnc("g");
        Var x = pb.local(main, "x");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, g, pb.call(ProgramBuilder.var(x), g));
        SymHeap run = new SymHeap(ctx.entry());
        run.setValue(run.addrOfRet(), SymValue.ofInt(42));
        ctx.rawResults().insert(run);
        SymState out = new SymState();
        ctx.flushCallResults(out);

        assertEquals(1, out.size());
        assertEquals(SymValue.ofInt(42), get(out.get(0), x));
        assertFalse(out.get(0).hasObject(SymHeap.OBJ_RETURN));
    }

    public void testLeakOnIgnoredAllocation() {
        Fnc g = pb.fnc("g");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, g, pb.call(Operand.VOID, g));
        SymHeap run = new SymHeap(ctx.entry());
        run.setValue(run.addrOfRet(), run.heapAlloc(2));
        ctx.rawResults().insert(run);
        SymState out = new SymState();
        ctx.flushCallResults(out);

        assertTrue(diag.hasMessage(Severity.WARNING, "memory leak"));
        assertEquals(0, out.get(0).objCount());
    }

    public void testNoLeakOnStoredAllocation() {
        Fnc g = pb.fnc("g");
        Var x = pb.local(main, "x");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, g, pb.call(ProgramBuilder.var(x), g));
        SymHeap run = new SymHeap(ctx.entry());
        run.setValue(run.addrOfRet(), run.heapAlloc(2));
        ctx.rawResults().insert(run);
        SymState out = new SymState();
        ctx.flushCallResults(out);

        assertEquals(0, diag.count(Severity.WARNING));
        SymValue p = get(out.get(0), x);
        assertTrue(p.isAddress());
        assertTrue(out.get(0).hasObject(p.getTarget()));
    }

    public void testLeakOfLocalOnFrameDestruction() {
        Fnc g = pb.fnc("g");
        Var l = pb.local(g, "l");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, g, pb.call(Operand.VOID, g));
        SymHeap run = new SymHeap(ctx.entry());
        set(run, l, run.heapAlloc(1));
        ctx.rawResults().insert(run);
        SymState out = new SymState();
        ctx.flushCallResults(out);

        assertTrue(diag.hasMessage(Severity.WARNING, "memory leak"));
        assertFalse(out.get(0).isVarAlive(new CVar(l.getUid(), 1)));
    }

    public void testDoubleFlushRejected() {
        Fnc f = pb.fnc("f");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        runIdentity(ctx);
        try {
            ctx.flushCallResults(new SymState());
            fail("Should have thrown exception");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("already flushed"));
        }
        assertEquals(1, bt.size());
    }

    public void testFlushOutOfOrderRejected() {
        Fnc f = pb.fnc("f");
        Fnc g = pb.fnc("g");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx cf = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        SymCallCtx cg = cache.getCallCtx(new SymHeap(cf.entry()), g, pb.call(Operand.VOID, g));
        try {
            cf.flushCallResults(new SymState());
            fail("Should have thrown exception");
        } catch (IllegalStateException e) {
            assertEquals(2, cache.liveCtxCount());
        }
        runIdentity(cg);
        runIdentity(cf);
        assertEquals(0, cache.liveCtxCount());
        assertEquals(1, bt.size());
    }

    public void testNoDoubleCounting() {
        Fnc f = pb.fnc("f");
        Var m = pb.local(main, "m");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        set(sh, m, SymValue.ofInt(1));
        CVar mcv = new CVar(m.getUid(), 1);

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        assertTrue(ctx.surround().isVarAlive(mcv));

        // the callee brings back the caller's variable with a new value
        SymHeap run = new SymHeap(ctx.entry());
        run.setValue(run.addrOfVar(mcv), SymValue.ofInt(99));
        ctx.rawResults().insert(run);
        SymState out = new SymState();
        ctx.flushCallResults(out);

        SymHeap res = out.get(0);
        assertEquals(SymValue.ofInt(99), valueOfVar(res, mcv));
        assertEquals(1, objectsOf(res, mcv));
    }

    public void testRestoredVariableKeepsPointers() {
        Fnc f = pb.fnc("f");
        Var m = pb.local(main, "m");
        Var p = pb.local(main, "p");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        CVar mcv = new CVar(m.getUid(), 1);
        CVar pcv = new CVar(p.getUid(), 1);
        set(sh, m, SymValue.ofInt(1));
        set(sh, p, sh.addrOfVar(mcv));

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        assertTrue(ctx.surround().isVarAlive(mcv));
        assertTrue(ctx.surround().isVarAlive(pcv));

        // m comes back from the callee as a new object
        SymHeap run = new SymHeap(ctx.entry());
        run.setValue(run.addrOfVar(mcv), SymValue.ofInt(99));
        ctx.rawResults().insert(run);
        SymState out = new SymState();
        ctx.flushCallResults(out);

        SymHeap res = out.get(0);
        SymValue ptr = valueOfVar(res, pcv);
        assertEquals(res.objOfVar(mcv), ptr.getTarget());
        assertTrue(res.hasObject(ptr.getTarget()));
        assertEquals(SymValue.ofInt(99), res.valueOf(ptr));
        assertEquals(1, objectsOf(res, mcv));
    }

    public void testFailedCallLeavesBackTrace() {
        Fnc f = pb.fnc("f");
        pb.arg(f, "a");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        try {
            cache.getCallCtx(sh, f, pb.call(Operand.VOID, f, Operand.VOID));
            fail("Should have thrown exception");
        } catch (IllegalArgumentException e) {
            // void is not a value
        }
        assertEquals(1, bt.size());
        assertEquals(0, bt.countOccurrencesOfFnc(f.getUid()));
        assertEquals(0, cache.liveCtxCount());

        // the next call gets the right nesting level
        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f, Operand.constInt(3)));
        assertEquals(1, ctx.nestLevel());
        assertEquals(2, bt.size());
    }

    public void testRediscovery() {
        Var g = pb.global("g");
        Fnc f = pb.fnc("f");
        Fnc h = pb.fnc("h");
        pb.uses(h, g);
        CVar gcv = new CVar(g.getUid(), 0);
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        set(sh, g, SymValue.ofInt(7));

        // f does not refer to g, so g stays with main
        SymCallCtx cf = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        assertFalse(cf.entry().isVarAlive(gcv));
        assertTrue(cf.surround().isVarAlive(gcv));

        SymHeap fRun = new SymHeap(cf.entry());
        SymCallCtx ch = cache.getCallCtx(fRun, h, pb.call(Operand.VOID, h));
        assertFalse(ch.entry().isVarAlive(gcv));

        // h reads g
        SymHeap hRun = new SymHeap(ch.entry());
        assertTrue(cache.rediscoverGlVar(hRun, gcv));
        assertEquals(1, cache.getRediscoveries());
        assertTrue(cf.needReexecFor().contains(gcv));
        assertTrue(ch.needReexecFor().contains(gcv));
        assertEquals(SymValue.ofInt(7), valueOfVar(ch.entry(), gcv));
        assertEquals(SymValue.ofInt(7), valueOfVar(cf.entry(), gcv));
        assertEquals(SymValue.ofInt(7), valueOfVar(hRun, gcv));

        // h writes g, the new value makes it to main exactly once
        hRun.setValue(SymValue.addr(hRun.objOfVar(gcv), 0), SymValue.ofInt(8));
        ch.rawResults().insert(hRun);
        SymState fOut = new SymState();
        ch.flushCallResults(fOut);
        assertEquals(SymValue.ofInt(8), valueOfVar(fOut.get(0), gcv));

        cf.rawResults().insert(fOut.get(0));
        SymState mainOut = new SymState();
        cf.flushCallResults(mainOut);
        SymHeap res = mainOut.get(0);
        assertEquals(SymValue.ofInt(8), valueOfVar(res, gcv));
        assertEquals(1, objectsOf(res, gcv));
    }

    public void testRediscoveredGlobalBecomesPartOfKey() {
        Var g = pb.global("g");
        Fnc f = pb.fnc("f");
        Fnc h = pb.fnc("h");
        pb.uses(h, g);
        CVar gcv = new CVar(g.getUid(), 0);
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        set(sh, g, SymValue.ofInt(7));

        SymCallCtx cf = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        SymCallCtx ch = cache.getCallCtx(new SymHeap(cf.entry()), h, pb.call(Operand.VOID, h));
        SymHeap hRun = new SymHeap(ch.entry());
        assertTrue(cache.rediscoverGlVar(hRun, gcv));
        ch.rawResults().insert(hRun);
        SymState fOut = new SymState();
        ch.flushCallResults(fOut);
        cf.rawResults().insert(fOut.get(0));
        SymState mainOut = new SymState();
        cf.flushCallResults(mainOut);

        // f now keeps g, and its updated cache slot matches
        SymCallCtx again = cache.getCallCtx(mainOut.get(0), f, pb.call(Operand.VOID, f));
        assertSame(cf, again);
        assertTrue(again.entry().isVarAlive(gcv));
        assertFalse(again.needExec());
        assertFalse(again.needReexecFor().isEmpty());

        again.prepareReexec();
        assertTrue(again.needExec());
        assertTrue(again.needReexecFor().isEmpty());
        assertEquals(1, runIdentity(again).size());
        assertEquals(1, cache.cachedCtxCount(f));
    }

    public void testRediscoveryOfUnknownGlobal() {
        Var g = pb.global("g");
        Fnc f = pb.fnc("f");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx cf = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        SymHeap run = new SymHeap(cf.entry());
        assertFalse(cache.rediscoverGlVar(run, new CVar(g.getUid(), 0)));
        assertTrue(cf.needReexecFor().isEmpty());
        assertEquals(0, cache.getRediscoveries());
    }

    public void testRecursionWarning() {
        Fnc r = pb.fnc("r");
        Var n = pb.arg(r, "n");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx c1 = cache.getCallCtx(sh, r, pb.call(Operand.VOID, r, Operand.constInt(1)));
        assertEquals(1, c1.nestLevel());
        assertEquals(0, diag.count(Severity.WARNING));

        SymCallCtx c2 = cache.getCallCtx(new SymHeap(c1.entry()), r, pb.call(Operand.VOID, r, Operand.constInt(2)));
        assertEquals(2, c2.nestLevel());
        assertTrue(diag.hasMessage(Severity.WARNING, "recursion"));
        assertTrue(diag.hasMessage(Severity.NOTE, "nestLevel is 2"));
        assertTrue(c2.needExec());
        assertEquals(SymValue.ofInt(2), valueOfVar(c2.entry(), new CVar(n.getUid(), 2)));
        assertTrue(c2.surround().isVarAlive(new CVar(n.getUid(), 1)));
        assertTrue(bt.hasRecursiveCall());

        SymState inner = runIdentity(c2);
        assertEquals(SymValue.ofInt(1), valueOfVar(inner.get(0), new CVar(n.getUid(), 1)));
        assertFalse(inner.get(0).isVarAlive(new CVar(n.getUid(), 2)));
        c1.rawResults().insert(inner.get(0));
        SymState out = new SymState();
        c1.flushCallResults(out);
        assertEquals(0, out.get(0).objCount());
        assertFalse(bt.hasRecursiveCall());
    }

    public void testReentranceRejected() {
        Fnc r = pb.fnc("r");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx c1 = cache.getCallCtx(sh, r, pb.call(Operand.VOID, r));
        int depth = bt.size();
        try {
            cache.getCallCtx(new SymHeap(c1.entry()), r, pb.call(Operand.VOID, r));
            fail("Should have thrown exception");
        } catch (CallCtxException e) {
            assertTrue(e.getMessage().contains("not computed yet"));
        }
        assertEquals(depth, bt.size());
        assertEquals(1, diag.count(Severity.ERROR));
        assertEquals(1, cache.liveCtxCount());

        // the enclosing call is still usable
        assertEquals(1, runIdentity(c1).size());
        assertEquals(1, bt.size());
    }

    public void testMissingArgument() {
        Fnc f = pb.fnc("f");
        Var a = pb.arg(f, "a");
        Var b = pb.arg(f, "b");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f, Operand.constInt(3)));
        assertEquals(SymValue.ofInt(3), valueOfVar(ctx.entry(), new CVar(a.getUid(), 1)));
        assertEquals(SymValue.UNKNOWN, valueOfVar(ctx.entry(), new CVar(b.getUid(), 1)));
        assertTrue(diag.hasMessage(Severity.NOTE, "missing argument"));
        runIdentity(ctx);
    }

    public void testExcessArguments() {
        Fnc f = pb.fnc("f");
        Var a = pb.arg(f, "a");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, f,
                                          pb.call(Operand.VOID, f, Operand.constInt(1), Operand.constInt(2),
                                                  Operand.constNull()));
        assertTrue(diag.hasMessage(Severity.WARNING, "too many arguments"));
        assertTrue(diag.hasMessage(Severity.NOTE, "declared here"));
        assertEquals(SymValue.ofInt(1), valueOfVar(ctx.entry(), new CVar(a.getUid(), 1)));
        assertEquals(1, ctx.entry().gatherCVars().size());
        runIdentity(ctx);
    }

    public void testArgumentReadInCallerFrame() {
        Fnc r = pb.fnc("r");
        Var n = pb.arg(r, "n");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx c1 = cache.getCallCtx(sh, r, pb.call(Operand.VOID, r, Operand.constInt(5)));
        // r(n) called from r reads n of the outer instance
        SymCallCtx c2 = cache.getCallCtx(new SymHeap(c1.entry()), r,
                                         pb.call(Operand.VOID, r, ProgramBuilder.var(n)));
        assertEquals(SymValue.ofInt(5), valueOfVar(c2.entry(), new CVar(n.getUid(), 2)));
        runIdentity(c2);
        runIdentity(c1);
    }

    public void testStackFrameInitializers() {
        Fnc f = pb.fnc("f");
        Var l = pb.local(f, "l", Operand.constInt(4));
        Var u = pb.local(f, "u");
        SymCallCache cache = newCache("-debugStackFrame");
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        assertEquals(SymValue.ofInt(4), valueOfVar(ctx.entry(), new CVar(l.getUid(), 1)));
        assertFalse(ctx.entry().isVarAlive(new CVar(u.getUid(), 1)));
        assertTrue(diag.hasMessage(Severity.DEBUG, "creating stack frame"));

        SymState out = runIdentity(ctx);
        assertFalse(out.get(0).isVarAlive(new CVar(l.getUid(), 1)));
        assertTrue(diag.hasMessage(Severity.DEBUG, "destroying stack variable"));
    }

    public void testCallKillsDeadVariables() {
        Fnc f = pb.fnc("f");
        Var t = pb.local(main, "t");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        set(sh, t, SymValue.ofInt(1));

        Insn call = pb.call(Operand.VOID, f, ProgramBuilder.var(t));
        call = call.withVarsToKill(Collections.singleton(t.getUid()));
        SymCallCtx ctx = cache.getCallCtx(sh, f, call);
        assertFalse(ctx.surround().isVarAlive(new CVar(t.getUid(), 1)));
        assertTrue(sh.isVarAlive(new CVar(t.getUid(), 1)));
        runIdentity(ctx);
    }

    public void testMultipleResults() {
        Fnc f = pb.fnc("f");
        Var x = pb.local(main, "x");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx ctx = cache.getCallCtx(sh, f, pb.call(ProgramBuilder.var(x), f));
        for (int i = 1; i <= 2; i++) {
            SymHeap run = new SymHeap(ctx.entry());
            run.setValue(run.addrOfRet(), SymValue.ofInt(i));
            ctx.rawResults().insert(run);
        }
        SymState out = new SymState();
        ctx.flushCallResults(out);
        assertEquals(2, out.size());
        assertTrue(diag.hasMessage(Severity.DEBUG, "processing heap #1"));
    }

    public void testCacheDisabled() {
        Fnc f = pb.fnc("f");
        SymCallCache cache = newCache("-disableCallCache");
        assertFalse(cache.isCacheEnabled());
        SymHeap sh = enterMain();

        SymCallCtx c1 = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        SymState out = runIdentity(c1);
        c1.invalidate();
        assertNull(c1.entry());

        SymCallCtx c2 = cache.getCallCtx(out.get(0), f, pb.call(Operand.VOID, f));
        assertNotSame(c1, c2);
        assertTrue(c2.needExec());
        runIdentity(c2);
        assertEquals(0, cache.cachedCtxCount(f));
    }

    public void testInvalidateKeepsCachedContext() {
        Fnc f = pb.fnc("f");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();

        SymCallCtx c1 = cache.getCallCtx(sh, f, pb.call(Operand.VOID, f));
        SymState out = runIdentity(c1);
        c1.invalidate();
        assertNotNull(c1.entry());
        assertSame(c1, cache.getCallCtx(out.get(0), f, pb.call(Operand.VOID, f)));
    }

    public void testCallDoneAbstraction() {
        Fnc f = pb.fnc("f");
        final int[] calls = { 0 };
        SymCallCache cache = newCache("-abstractOnCallDone");
        cache.setCallDoneAbstraction(new CallDoneAbstraction() {
            @Override
            public void abstractIfNeeded(SymHeap sh) {
                calls[0]++;
            }
        });
        SymHeap sh = enterMain();
        runIdentity(cache.getCallCtx(sh, f, pb.call(Operand.VOID, f)));
        assertEquals(1, calls[0]);
    }

    public void testNotACall() {
        Fnc f = pb.fnc("f");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        Insn ret = new Insn(InsnCode.RET, Collections.<Operand> emptyList(), pb.nextLoc(),
                            Collections.<Integer> emptySet());
        try {
            cache.getCallCtx(sh, f, ret);
            fail("Should have thrown exception");
        } catch (IllegalArgumentException e) {
            assertEquals(1, bt.size());
        }
    }

    public void testOutputLevelFromOptions() {
        diag = new Diagnostics(0);
        newCache("-o", "2");
        assertEquals(2, diag.getOutputLevel());
        assertTrue(diag.isEchoed(Severity.DEBUG));

        diag = new Diagnostics(2);
        newCache();
        assertEquals(0, diag.getOutputLevel());
        assertFalse(diag.isEchoed(Severity.WARNING));
        assertTrue(diag.isEchoed(Severity.ERROR));
    }

    public void testGlobalsGatheredAtConstruction() {
        pb.global("g1");
        pb.global("g2");
        SymCallCache cache = newCache();
        assertEquals(2, cache.glVars().size());
        assertTrue(diag.hasMessage(Severity.DEBUG, "found 2 gl variable(s)"));
    }

    public void testStatistics() throws Exception {
        Fnc f = pb.fnc("f");
        SymCallCache cache = newCache();
        SymHeap sh = enterMain();
        SymState out = runIdentity(cache.getCallCtx(sh, f, pb.call(Operand.VOID, f)));
        runIdentity(cache.getCallCtx(out.get(0), f, pb.call(Operand.VOID, f)));

        JSONObject json = cache.toJSON();
        assertTrue(json.getBoolean("callCacheEnabled"));
        JSONObject fs = json.getJSONObject("functions").getJSONObject("f");
        assertEquals(1, fs.getInt("contexts"));
        assertEquals(1, fs.getInt("hits"));
        assertEquals(1, fs.getInt("misses"));

        StringWriter sw = new StringWriter();
        cache.writeJSON(sw);
        assertEquals(0, new JSONObject(sw.toString()).getInt("rediscoveries"));
    }
}
