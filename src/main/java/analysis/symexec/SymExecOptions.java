package analysis.symexec;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;

/**
 * Options of the symbolic execution engine
 */
public final class SymExecOptions {

    /**
     * Flag for printing useage information
     */
    @Parameter(names = { "-h", "-help", "-useage", "--help" }, description = "Print useage information")
    private boolean help = false;

    /**
     * Level of output
     */
    @Parameter(names = { "-output", "-o" }, description = "Level of output (higher means more console output)")
    private Integer outputLevel = 0;

    /**
     * If set, every call is executed, call contexts are never reused
     */
    @Parameter(
        names = { "-disableCallCache" },
        description = "If set, the results of function calls are not cached and every call is analyzed again. Call contexts are released right after their results are flushed.")
    private boolean disableCallCache = false;

    /**
     * If set, run the abstraction after each function call returns
     */
    @Parameter(
        names = { "-abstractOnCallDone" },
        description = "If set, run the heap abstraction on every heap produced by a returning function call")
    private boolean abstractOnCallDone = false;

    /**
     * If set, report every stack variable initialized or destroyed
     */
    @Parameter(
        names = { "-debugStackFrame" },
        description = "If set, print a debug message for each stack variable initialized when a stack frame is created or destroyed")
    private boolean debugStackFrame = false;

    private SymExecOptions() {
        // Do not instantiate
    }

    /**
     * Parse the options for the given args
     * 
     * @param args
     *            arguments to parse
     * @return Options object with the parsed options available via getters
     */
    public static SymExecOptions getOptions(String... args) {
        SymExecOptions o = new SymExecOptions();
        JCommander jc = new JCommander();
        jc.addObject(o);
        jc.parse(args);
        return o;
    }

    /**
     * Options with every setting at its default
     * 
     * @return default options
     */
    public static SymExecOptions defaults() {
        return getOptions();
    }

    /**
     * Get the string describing the options
     * 
     * @return useage information
     */
    public static String getUseage() {
        JCommander jc = new JCommander(new SymExecOptions());
        jc.setProgramName("symcall");
        StringBuilder sb = new StringBuilder();
        jc.usage(sb);
        return sb.toString();
    }

    public boolean shouldPrintUseage() {
        return help;
    }

    public Integer getOutputLevel() {
        return outputLevel;
    }

    public boolean isCallCacheDisabled() {
        return disableCallCache;
    }

    public boolean shouldAbstractOnCallDone() {
        return abstractOnCallDone;
    }

    public boolean shouldDebugStackFrame() {
        return debugStackFrame;
    }
}
