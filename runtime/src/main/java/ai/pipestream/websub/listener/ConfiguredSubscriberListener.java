package ai.pipestream.websub.listener;

import ai.pipestream.websub.config.WebSubSubscriberConfig;
import ai.pipestream.websub.exception.ListenerAttachException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link SubscriberListener} backed by the Quarkus HTTP server.
 * <p>
 * The socket belongs to Quarkus; this bean tracks which service is bound to which
 * callback path and derives the public address from configuration.
 */
@ApplicationScoped
public class ConfiguredSubscriberListener implements SubscriberListener {

    private static final Logger LOG = Logger.getLogger(ConfiguredSubscriberListener.class);

    enum Phase {
        CREATED,
        STARTED,
        STOPPED
    }

    private final String host;
    private final int port;
    private final boolean tlsEnabled;
    private final Map<String, String> attachments = new LinkedHashMap<>();
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.CREATED);

    @Inject
    public ConfiguredSubscriberListener(WebSubSubscriberConfig config,
                                        @ConfigProperty(name = "quarkus.http.port", defaultValue = "8080") int httpPort,
                                        @ConfigProperty(name = "quarkus.http.ssl-port", defaultValue = "8443") int httpsPort) {
        this(config.listener().host(),
                config.listener().port().orElse(config.listener().tlsEnabled() ? httpsPort : httpPort),
                config.listener().tlsEnabled());
    }

    public ConfiguredSubscriberListener(String host, int port, boolean tlsEnabled) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host is null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.host = host;
        this.port = port;
        this.tlsEnabled = tlsEnabled;
    }

    @Override
    public synchronized void attach(String serviceName, String path) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new ListenerAttachException(String.valueOf(serviceName), "service name is required");
        }
        if (phase.get() == Phase.STOPPED) {
            throw new ListenerAttachException(serviceName, "listener is stopped");
        }
        if (path == null || !path.startsWith("/")) {
            throw new ListenerAttachException(serviceName, "path must start with '/', got '" + path + "'");
        }
        if (attachments.containsKey(serviceName)) {
            throw new ListenerAttachException(serviceName, "service is already attached at " + attachments.get(serviceName));
        }
        for (Map.Entry<String, String> entry : attachments.entrySet()) {
            if (entry.getValue().equals(path)) {
                throw new ListenerAttachException(serviceName,
                        "path " + path + " is already bound to service '" + entry.getKey() + "'");
            }
        }
        attachments.put(serviceName, path);
        LOG.debugf("Attached service %s at %s", serviceName, path);
    }

    @Override
    public synchronized void detach(String serviceName) {
        String path = attachments.remove(serviceName);
        if (path != null) {
            LOG.debugf("Detached service %s from %s", serviceName, path);
        }
    }

    @Override
    public synchronized Map<String, String> attachments() {
        return Map.copyOf(attachments);
    }

    @Override
    public void start() {
        if (phase.compareAndSet(Phase.CREATED, Phase.STARTED)) {
            LOG.infof("WebSub listener started on %s://%s:%d", tlsEnabled ? "https" : "http", host, port);
        }
    }

    @Override
    public synchronized void gracefulStop() {
        phase.set(Phase.STOPPED);
        LOG.infof("WebSub listener stopping, releasing %d service(s)", attachments.size());
        attachments.clear();
    }

    @Override
    public synchronized void immediateStop() {
        phase.set(Phase.STOPPED);
        attachments.clear();
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public int port() {
        return port;
    }

    @Override
    public boolean tlsEnabled() {
        return tlsEnabled;
    }
}
