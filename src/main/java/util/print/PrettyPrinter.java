package util.print;

import java.util.Map;
import java.util.SortedMap;

import analysis.symexec.heap.CVar;
import analysis.symexec.heap.SymHeap;
import analysis.symexec.heap.SymValue;
import analysis.symexec.storage.Fnc;
import analysis.symexec.storage.Storage;
import analysis.symexec.storage.Var;

/**
 * Pretty printer for functions, variables and symbolic heaps. Variables are
 * printed with their names from the source code where the storage knows them.
 */
public class PrettyPrinter {

    /**
     * If true then variable uids and instances are printed along with the
     * names from the source code
     */
    private static boolean useDebugVariableNames = false;

    /**
     * Methods should be accessed statically
     */
    private PrettyPrinter() {
        // Intentionally blank
    }

    /**
     * Print numerical identifiers of variables in addition to source names
     * 
     * @param b
     *            whether to print them
     */
    public static void setUseDebugVariableNames(boolean b) {
        useDebugVariableNames = b;
    }

    /**
     * Get a string for a function, e.g. "foo()"
     * 
     * @param f
     *            function
     * @return readable name of the function
     */
    public static String fncString(Fnc f) {
        if (useDebugVariableNames) {
            return f.getName() + "()#" + f.getUid();
        }
        return f.getName() + "()";
    }

    /**
     * Get a string for a variable instance
     * 
     * @param stor
     *            program the variable is declared in
     * @param cv
     *            variable
     * @return readable name of the variable
     */
    public static String varString(Storage stor, CVar cv) {
        String name;
        try {
            Var v = stor.getVar(cv.getUid());
            name = v.getName();
        } catch (IllegalArgumentException e) {
            name = "<anon>";
        }
        if (useDebugVariableNames || cv.getInst() > 1) {
            return name + cv;
        }
        return name;
    }

    /**
     * Print the objects of a heap, one per line
     * 
     * @param sh
     *            heap to print
     * @return multi-line string describing the heap
     */
    public static String heapString(SymHeap sh) {
        StringBuilder sb = new StringBuilder();
        sb.append("SymHeap {");
        for (int id : sh.objectIds()) {
            sb.append("\n    obj").append(id).append(" ");
            switch (sh.kindOf(id)) {
            case VAR:
                sb.append(varString(sh.stor(), sh.varOf(id)));
                break;
            case RETURN:
                sb.append("<return>");
                break;
            case HEAP:
                sb.append("<heap>");
                break;
            default:
                throw new RuntimeException("Unhandled kind " + sh.kindOf(id));
            }
            if (sh.extRefCount(id) > 0) {
                sb.append(" (pinned)");
            }
            sb.append(cellsString(sh.cellsOf(id)));
        }
        return sb.append(sh.objectIds().isEmpty() ? "}" : "\n}").toString();
    }

    private static String cellsString(SortedMap<Integer, SymValue> cells) {
        StringBuilder sb = new StringBuilder(" = [");
        boolean first = true;
        for (Map.Entry<Integer, SymValue> e : cells.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.append("]").toString();
    }
}
