package ai.pipestream.websub.exception;

/**
 * Base exception for all WebSub subscriber errors.
 * <p>
 * Prefer the specific subclasses: {@link ConfigurationException},
 * {@link ResourceDiscoveryFailedException}, {@link SubscriptionInitiationFailedException}
 * and {@link ListenerAttachException}.
 * </p>
 */
public class WebSubException extends RuntimeException {

    /**
     * Creates a new WebSubException.
     *
     * @param message the exception message
     */
    public WebSubException(String message) {
        super(message);
    }

    /**
     * Creates a new WebSubException with a cause.
     *
     * @param message the exception message
     * @param cause the underlying cause
     */
    public WebSubException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a new WebSubException wrapping a cause.
     *
     * @param cause the underlying cause
     */
    public WebSubException(Throwable cause) {
        super(cause);
    }
}
