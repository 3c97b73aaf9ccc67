package analysis.symexec.call;

/**
 * A call context cannot be provided, the analysis of the enclosing path has
 * to be aborted
 */
public class CallCtxException extends RuntimeException {

    private static final long serialVersionUID = -2305726358416183734L;

    public CallCtxException(String message) {
        super(message);
    }
}
