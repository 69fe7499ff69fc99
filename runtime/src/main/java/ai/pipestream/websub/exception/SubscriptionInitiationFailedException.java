package ai.pipestream.websub.exception;

/**
 * Thrown when a hub does not acknowledge a subscription request.
 * <p>
 * The hub either answered with a non-success status, could not be reached, or the
 * request could not be built. {@link #getStatusCode()} is {@code -1} when no response
 * was received.
 * </p>
 */
public class SubscriptionInitiationFailedException extends WebSubException {

    private final String hubUrl;
    private final int statusCode;

    /**
     * Creates a new SubscriptionInitiationFailedException for a rejected request.
     *
     * @param hubUrl the hub the request was sent to
     * @param statusCode the HTTP status returned by the hub
     * @param message description of the rejection
     */
    public SubscriptionInitiationFailedException(String hubUrl, int statusCode, String message) {
        super(String.format("Subscription request to hub '%s' failed: %s", hubUrl, message));
        this.hubUrl = hubUrl;
        this.statusCode = statusCode;
    }

    /**
     * Creates a new SubscriptionInitiationFailedException wrapping an underlying cause.
     *
     * @param hubUrl the hub the request was sent to
     * @param cause the underlying exception
     */
    public SubscriptionInitiationFailedException(String hubUrl, Throwable cause) {
        super(String.format("Subscription request to hub '%s' failed: %s", hubUrl, cause.getMessage()), cause);
        this.hubUrl = hubUrl;
        this.statusCode = -1;
    }

    /**
     * Returns the hub URL the request was sent to.
     *
     * @return the hub URL
     */
    public String getHubUrl() {
        return hubUrl;
    }

    /**
     * Returns the HTTP status the hub answered with.
     *
     * @return the status code, or {@code -1} if no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
