package analysis.symexec.call;

import junit.framework.TestCase;
import util.optional.Optional;
import analysis.symexec.ProgramBuilder;
import analysis.symexec.heap.CVar;
import analysis.symexec.heap.SymHeap;
import analysis.symexec.heap.SymHeapIds;
import analysis.symexec.heap.SymValue;
import analysis.symexec.storage.Fnc;
import analysis.symexec.storage.Var;

public class PerFncCacheTest extends TestCase {

    private ProgramBuilder pb;
    private Fnc f;
    private CVar a;
    private SymHeapIds ids;

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        pb = new ProgramBuilder();
        f = pb.fnc("f");
        Var va = pb.arg(f, "a");
        a = new CVar(va.getUid(), 1);
        ids = new SymHeapIds();
    }

    private SymHeap heapWith(long value) {
        SymHeap sh = new SymHeap(pb.stor(), ids);
        sh.setValue(sh.addrOfVar(a), SymValue.ofInt(value));
        return sh;
    }

    public void testLookupByIsomorphism() {
        PerFncCache pfc = new PerFncCache(true);
        SymHeap h1 = heapWith(1);
        SymCallCtx ctx = new SymCallCtx(null, f, h1);
        assertTrue(pfc.lookup(h1).isNone());
        pfc.insert(h1, ctx);

        // another heap of the same shape
        Optional<SymCallCtx> found = pfc.lookup(heapWith(1));
        assertTrue(found.isSome());
        assertSame(ctx, found.get());
        assertTrue(pfc.lookup(heapWith(2)).isNone());

        assertEquals(1, pfc.size());
        assertEquals(1, pfc.getHits());
        assertEquals(2, pfc.getMisses());
    }

    public void testUpdateCacheEntry() {
        PerFncCache pfc = new PerFncCache(true);
        SymHeap h1 = heapWith(1);
        SymCallCtx ctx = new SymCallCtx(null, f, h1);
        pfc.insert(h1, ctx);

        SymHeap h2 = heapWith(2);
        assertTrue(pfc.updateCacheEntry(h1, h2));
        assertTrue(pfc.lookup(heapWith(1)).isNone());
        assertSame(ctx, pfc.lookup(heapWith(2)).get());
        assertEquals(1, pfc.size());

        assertFalse(pfc.updateCacheEntry(heapWith(3), h1));
    }

    public void testDisabled() {
        PerFncCache pfc = new PerFncCache(false);
        SymHeap h1 = heapWith(1);
        pfc.insert(h1, new SymCallCtx(null, f, h1));
        assertEquals(0, pfc.size());
        assertTrue(pfc.lookup(h1).isNone());
        assertFalse(pfc.updateCacheEntry(h1, heapWith(2)));
        assertFalse(pfc.isEnabled());
    }
}
