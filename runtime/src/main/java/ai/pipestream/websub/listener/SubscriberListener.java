package ai.pipestream.websub.listener;

import java.util.Map;

/**
 * The HTTP listener that serves callback requests for attached services.
 * <p>
 * The listener owns the socket and routes inbound verification and content
 * requests; the subscription flow only needs its address and the attach/start
 * lifecycle.
 */
public interface SubscriberListener {

    /**
     * Binds a service to a callback path.
     *
     * @param serviceName the service to attach
     * @param path        the path the service is served under, starting with {@code /}
     * @throws ai.pipestream.websub.exception.ListenerAttachException if the service cannot be bound
     */
    void attach(String serviceName, String path);

    /**
     * Removes a service binding. Unknown services are ignored.
     */
    void detach(String serviceName);

    /**
     * Returns the attached services and their paths.
     */
    Map<String, String> attachments();

    void start();

    /**
     * Stops accepting new attachments and releases existing ones.
     */
    void gracefulStop();

    void immediateStop();

    /**
     * Host under which the listener is publicly reachable.
     */
    String host();

    /**
     * Port under which the listener is publicly reachable.
     */
    int port();

    /**
     * Whether the listener serves TLS.
     */
    boolean tlsEnabled();
}
