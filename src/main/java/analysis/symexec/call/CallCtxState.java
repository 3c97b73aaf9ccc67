package analysis.symexec.call;

/**
 * Lifecycle of a {@link SymCallCtx}
 */
public enum CallCtxState {
    /**
     * The body of the callee was not analyzed yet for this entry heap
     */
    FRESH,
    /**
     * Results are known, but were not flushed to the caller in the current
     * use of the context
     */
    COMPUTED,
    /**
     * Results were flushed, the context can be reused by another call
     */
    FLUSHED;
}
