package ai.pipestream.websub.exception;

/**
 * Thrown when the subscriber configuration of a service is missing or malformed.
 */
public class ConfigurationException extends WebSubException {

    private final String serviceName;

    /**
     * Creates a new ConfigurationException.
     *
     * @param serviceName the service whose configuration is invalid
     * @param message description of the problem
     */
    public ConfigurationException(String serviceName, String message) {
        super(String.format("Invalid subscriber configuration for service '%s': %s", serviceName, message));
        this.serviceName = serviceName;
    }

    /**
     * Returns the name of the misconfigured service.
     *
     * @return the service name
     */
    public String getServiceName() {
        return serviceName;
    }
}
