package analysis.symexec.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Descriptor of a function of the analyzed program
 */
public final class Fnc {

    private final Storage stor;
    private final int uid;
    private final String name;
    private final Location loc;
    /**
     * Formal parameters in declaration order (variable uids)
     */
    private final List<Integer> args = new ArrayList<>();
    /**
     * Uids of all variables the body of the function refers to (locals,
     * formal parameters and globals)
     */
    private final MutableIntSet vars = MutableSparseIntSet.makeEmpty();

    Fnc(Storage stor, int uid, String name, Location loc) {
        this.stor = stor;
        this.uid = uid;
        this.name = name;
        this.loc = loc;
    }

    /**
     * Append a formal parameter, the variable must be of kind
     * {@link VarCode#FNC_ARG} and already registered in the storage
     * 
     * @param argUid
     *            uid of the parameter
     * @return this function
     */
    public Fnc addArg(int argUid) {
        Var v = stor.getVar(argUid);
        if (v.getCode() != VarCode.FNC_ARG) {
            throw new IllegalArgumentException(v + " is not a formal parameter");
        }
        args.add(argUid);
        vars.add(argUid);
        return this;
    }

    /**
     * Record that the body of this function refers to the given variable
     * 
     * @param varUid
     *            uid of a variable registered in the storage
     * @return this function
     */
    public Fnc addVar(int varUid) {
        stor.getVar(varUid);
        vars.add(varUid);
        return this;
    }

    public Storage getStorage() {
        return stor;
    }

    public int getUid() {
        return uid;
    }

    public String getName() {
        return name;
    }

    public Location getLocation() {
        return loc;
    }

    public List<Integer> getArgs() {
        return Collections.unmodifiableList(args);
    }

    /**
     * Get all variables visible to the body of this function
     * 
     * @return set of variable uids
     */
    public IntSet getVars() {
        return vars;
    }

    public boolean hasVar(int varUid) {
        return vars.contains(varUid);
    }

    /**
     * Get the stack-scoped variables (locals and formal parameters)
     * 
     * @return list of variables in uid order
     */
    public List<Var> getStackVars() {
        List<Var> result = new ArrayList<>();
        IntIterator it = vars.intIterator();
        while (it.hasNext()) {
            Var v = stor.getVar(it.next());
            if (v.isOnStack()) {
                result.add(v);
            }
        }
        return result;
    }

    /**
     * Get the globally-scoped variables the body refers to
     * 
     * @return list of variables in uid order
     */
    public List<Var> getGlobalVars() {
        List<Var> result = new ArrayList<>();
        IntIterator it = vars.intIterator();
        while (it.hasNext()) {
            Var v = stor.getVar(it.next());
            if (v.isGlobal()) {
                result.add(v);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return name + "()";
    }
}
