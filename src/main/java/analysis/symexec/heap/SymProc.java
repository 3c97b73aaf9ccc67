package analysis.symexec.heap;

import java.util.List;

import util.print.PrettyPrinter;
import analysis.symexec.Diagnostics;
import analysis.symexec.call.SymBackTrace;
import analysis.symexec.storage.Insn;
import analysis.symexec.storage.Location;
import analysis.symexec.storage.Operand;
import analysis.symexec.storage.Var;

/**
 * Operations on a heap that need to resolve operands of instructions. Stack
 * variables are resolved against the function on the top of the back trace,
 * so a procedure working in the caller's frame must be given the caller's back
 * trace.
 */
public class SymProc {

    private final SymHeap sh;
    private final SymBackTrace bt;
    private final Diagnostics diag;
    private Location loc = Location.UNKNOWN;
    private boolean debugStackFrame;

    /**
     * Create a procedure over the given heap
     * 
     * @param sh
     *            heap to work on, modified in place
     * @param bt
     *            back trace giving the nesting level of stack variables
     * @param diag
     *            where to report problems
     */
    public SymProc(SymHeap sh, SymBackTrace bt, Diagnostics diag) {
        this.sh = sh;
        this.bt = bt;
        this.diag = diag;
    }

    public SymHeap sh() {
        return sh;
    }

    public SymBackTrace bt() {
        return bt;
    }

    /**
     * Set the location used for reported messages
     * 
     * @param loc
     *            location of the current instruction
     */
    public void setLocation(Location loc) {
        this.loc = loc == null ? Location.UNKNOWN : loc;
    }

    public Location getLocation() {
        return loc;
    }

    /**
     * Report each stack variable initialized or destroyed as a debug message
     * 
     * @param b
     *            whether to report
     */
    public void setDebugStackFrame(boolean b) {
        this.debugStackFrame = b;
    }

    /**
     * Variable instance an operand refers to
     * 
     * @param op
     *            VAR operand
     * @return variable with the nesting level of the current frame (0 for
     *         globals)
     */
    public CVar cVarByOperand(Operand op) {
        Var v = sh.stor().getVar(op.getVarUid());
        int inst = v.isOnStack() ? bt.countOccurrencesOfTopFnc() : 0;
        return new CVar(v.getUid(), inst);
    }

    /**
     * Get the address of the variable an operand refers to. A variable that
     * is not alive yet is created and initialized.
     * 
     * @param op
     *            VAR operand
     * @return address of the variable
     */
    public SymValue varAt(Operand op) {
        CVar cv = cVarByOperand(op);
        if (sh.isVarAlive(cv)) {
            return sh.addrOfVar(cv);
        }
        SymValue addr = sh.addrOfVar(cv);
        initVariable(sh.stor().getVar(cv.getUid()), cv);
        return addr;
    }

    /**
     * Get the object a VAR operand refers to
     * 
     * @param op
     *            VAR operand
     * @return object id
     */
    public int objByOperand(Operand op) {
        return varAt(op).getTarget();
    }

    /**
     * Read the value of an operand
     * 
     * @param op
     *            operand to read
     * @return value of the operand
     */
    public SymValue valFromOperand(Operand op) {
        switch (op.getCode()) {
        case VAR:
            SymValue v = sh.valueOf(varAt(op));
            assert v != null;
            return v;
        case CONST_INT:
            return SymValue.ofInt(op.getIntValue());
        case CONST_NULL:
            return SymValue.NULL;
        case CONST_FNC:
            // function pointers are not tracked
            return SymValue.UNKNOWN;
        case VOID:
        default:
            throw new IllegalArgumentException("Cannot read value of operand " + op);
        }
    }

    /**
     * Write a value to the first cell of an object
     * 
     * @param objId
     *            object to write to
     * @param val
     *            value to write
     */
    public void objSetValue(int objId, SymValue val) {
        sh.setValue(SymValue.addr(objId, 0), val);
    }

    /**
     * Apply the initializer of a variable that was just created. Globals
     * without an initializer are zero-initialized, locals stay uninitialized.
     * 
     * @param v
     *            declaration of the variable
     * @param cv
     *            instance of the variable
     */
    public void initVariable(Var v, CVar cv) {
        SymValue addr = sh.addrOfVar(cv);
        Operand init = v.getInitializer();
        if (debugStackFrame && v.isOnStack()) {
            diag.debug(v.getLocation(), ">>> initializing stack variable: #" + v.getUid() + " (" + v.getName() + ")");
        }
        if (init != null) {
            sh.setValue(addr, valFromOperand(init));
        } else if (v.isGlobal()) {
            sh.setValue(addr, SymValue.NULL);
        }
    }

    /**
     * Destroy the object the given value points to, reporting every heap
     * block that leaks as a result
     * 
     * @param addr
     *            address of the object
     * @return true if no memory leaked
     */
    public boolean valDestroyTarget(SymValue addr) {
        List<Integer> leaked = sh.destroyTarget(addr);
        for (Integer id : leaked) {
            diag.warn(loc, "memory leak detected while destroying object #" + id);
        }
        return leaked.isEmpty();
    }

    /**
     * Destroy a dead variable unless its address is still referenced
     * 
     * @param cv
     *            variable to destroy
     */
    public void killVar(CVar cv) {
        int obj = sh.objOfVar(cv);
        if (obj == SymHeap.OBJ_INVALID) {
            return;
        }
        if (sh.isPointed(obj)) {
            // the variable lives on as the target of a pointer
            return;
        }
        if (debugStackFrame) {
            diag.debug(loc, "<<< killing variable " + PrettyPrinter.varString(sh.stor(), cv));
        }
        valDestroyTarget(SymValue.addr(obj, 0));
    }

    /**
     * Destroy the variables that are dead after the given instruction
     * 
     * @param insn
     *            instruction
     */
    public void killInsn(Insn insn) {
        for (Integer uid : insn.getVarsToKill()) {
            killVar(cVarByOperand(Operand.var(uid)));
        }
    }
}
