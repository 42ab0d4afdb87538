package org.astrewrite.api;

/**
 * Thrown when a rewrite is aborted by a contract violation.
 * <p>
 * The exception is unchecked: it reports a programming error in a visitor or in the node
 * taxonomy, which a caller cannot sensibly recover from. When it is thrown the tree has been
 * partially rewritten and must be discarded.
 */
public class RewriteException extends RuntimeException {

    private final RewriteErrorCode errorCode;

    /**
     * Constructs a new rewrite exception.
     * @param errorCode The error code identifying the violated contract.
     * @param message The detail message.
     */
    public RewriteException(RewriteErrorCode errorCode, String message) {
        super(String.format("[%s] %s", errorCode, message));
        this.errorCode = errorCode;
    }

    /**
     * @return The error code identifying the violated contract.
     */
    public RewriteErrorCode getErrorCode() {
        return errorCode;
    }
}
