package ai.pipestream.websub.exception;

/**
 * Thrown when the hub and topic of a resource could not be discovered.
 * <p>
 * Covers transport failures, non-success responses and incomplete or ambiguous
 * {@code Link} metadata alike; the message carries the underlying reason.
 * </p>
 */
public class ResourceDiscoveryFailedException extends WebSubException {

    private final String resourceUrl;

    /**
     * Creates a new ResourceDiscoveryFailedException.
     *
     * @param resourceUrl the resource URL that was being discovered
     * @param message description of the discovery failure
     */
    public ResourceDiscoveryFailedException(String resourceUrl, String message) {
        super(String.format("Resource discovery failed for '%s': %s", resourceUrl, message));
        this.resourceUrl = resourceUrl;
    }

    /**
     * Creates a new ResourceDiscoveryFailedException wrapping an underlying cause.
     *
     * @param resourceUrl the resource URL that was being discovered
     * @param cause the underlying exception
     */
    public ResourceDiscoveryFailedException(String resourceUrl, Throwable cause) {
        super(String.format("Resource discovery failed for '%s': %s", resourceUrl, cause.getMessage()), cause);
        this.resourceUrl = resourceUrl;
    }

    /**
     * Returns the resource URL that failed discovery.
     *
     * @return the resource URL
     */
    public String getResourceUrl() {
        return resourceUrl;
    }
}
