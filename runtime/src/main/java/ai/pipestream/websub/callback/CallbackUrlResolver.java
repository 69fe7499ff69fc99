package ai.pipestream.websub.callback;

import ai.pipestream.websub.events.SubscriptionEventListener;
import ai.pipestream.websub.listener.SubscriberListener;
import ai.pipestream.websub.model.CallbackUrl;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the callback URL under which a hub reaches an attached service.
 * <p>
 * The scheme follows the listener: {@code https} when TLS is configured, {@code http}
 * otherwise. A service without a configured path gets one generated segment; the
 * caller resolves once per attach and keeps the result.
 */
@ApplicationScoped
public class CallbackUrlResolver {

    private final PathSegmentGenerator segmentGenerator;
    private final SubscriptionEventListener events;

    @Inject
    public CallbackUrlResolver(PathSegmentGenerator segmentGenerator, SubscriptionEventListener events) {
        this.segmentGenerator = segmentGenerator;
        this.events = events;
    }

    public CallbackUrl resolve(String serviceName, List<String> path, SubscriberListener listener) {
        return resolve(serviceName, path, listener.host(), listener.port(), listener.tlsEnabled());
    }

    /**
     * Resolves the callback URL of a service.
     *
     * @param serviceName service the URL is resolved for, used for the generation event
     * @param path        configured path segments; null or empty to generate one
     * @param host        host the listener is reachable at
     * @param port        port the listener is reachable at
     * @param tlsEnabled  whether the listener serves TLS
     * @return the callback URL
     */
    public CallbackUrl resolve(String serviceName, List<String> path, String host, int port, boolean tlsEnabled) {
        String scheme = tlsEnabled ? "https" : "http";
        List<String> segments = normalize(path);
        if (!segments.isEmpty()) {
            return new CallbackUrl(scheme, host, port, segments, false);
        }

        CallbackUrl generated = new CallbackUrl(scheme, host, port, List.of(segmentGenerator.generate()), true);
        events.callbackGenerated(serviceName, generated);
        return generated;
    }

    static List<String> normalize(List<String> path) {
        List<String> segments = new ArrayList<>();
        if (path == null) {
            return segments;
        }
        for (String element : path) {
            if (element == null) {
                continue;
            }
            for (String part : element.split("/")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    segments.add(trimmed);
                }
            }
        }
        return segments;
    }
}
