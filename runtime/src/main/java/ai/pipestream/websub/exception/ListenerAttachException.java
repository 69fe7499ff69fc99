package ai.pipestream.websub.exception;

/**
 * Thrown when the listener cannot bind a service to its callback path.
 */
public class ListenerAttachException extends WebSubException {

    private final String serviceName;

    /**
     * Creates a new ListenerAttachException.
     *
     * @param serviceName the service that could not be attached
     * @param message description of the failure
     */
    public ListenerAttachException(String serviceName, String message) {
        super(String.format("Failed to attach service '%s': %s", serviceName, message));
        this.serviceName = serviceName;
    }

    /**
     * Returns the name of the service that could not be attached.
     *
     * @return the service name
     */
    public String getServiceName() {
        return serviceName;
    }
}
