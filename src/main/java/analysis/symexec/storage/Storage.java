package analysis.symexec.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All variables and functions of the analyzed program
 */
public final class Storage {

    private final Map<Integer, Var> vars = new LinkedHashMap<>();
    private final Map<Integer, Fnc> fncs = new LinkedHashMap<>();

    /**
     * Register a variable declaration
     * 
     * @param v
     *            variable to add
     * @return the added variable
     */
    public Var addVar(Var v) {
        if (vars.containsKey(v.getUid())) {
            throw new IllegalArgumentException("Duplicate variable uid " + v.getUid());
        }
        vars.put(v.getUid(), v);
        return v;
    }

    /**
     * Register a new function
     * 
     * @param uid
     *            unique identifier of the function
     * @param name
     *            name of the function
     * @param loc
     *            location of the definition
     * @return the new function descriptor
     */
    public Fnc createFnc(int uid, String name, Location loc) {
        if (fncs.containsKey(uid)) {
            throw new IllegalArgumentException("Duplicate function uid " + uid);
        }
        Fnc f = new Fnc(this, uid, name, loc);
        fncs.put(uid, f);
        return f;
    }

    /**
     * Get the variable with the given uid
     * 
     * @param uid
     *            uid of the variable
     * @return variable declaration
     * @throws IllegalArgumentException
     *             if there is no such variable
     */
    public Var getVar(int uid) {
        Var v = vars.get(uid);
        if (v == null) {
            throw new IllegalArgumentException("Unknown variable uid " + uid);
        }
        return v;
    }

    /**
     * Get the function with the given uid
     * 
     * @param uid
     *            uid of the function
     * @return function descriptor
     * @throws IllegalArgumentException
     *             if there is no such function
     */
    public Fnc getFnc(int uid) {
        Fnc f = fncs.get(uid);
        if (f == null) {
            throw new IllegalArgumentException("Unknown function uid " + uid);
        }
        return f;
    }

    public Collection<Var> getVars() {
        return Collections.unmodifiableCollection(vars.values());
    }

    public Collection<Fnc> getFncs() {
        return Collections.unmodifiableCollection(fncs.values());
    }

    /**
     * Get all global variables of the program
     * 
     * @return global variables in declaration order
     */
    public List<Var> getGlobalVars() {
        List<Var> result = new ArrayList<>();
        for (Var v : vars.values()) {
            if (v.isGlobal()) {
                result.add(v);
            }
        }
        return result;
    }
}
