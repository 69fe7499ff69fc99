package ai.pipestream.websub.config;

import io.quarkus.runtime.annotations.ConfigPhase;
import io.quarkus.runtime.annotations.ConfigRoot;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration for the Pipestream WebSub subscriber extension.
 *
 * <p>
 * Each entry under {@code pipestream.websub.services.<name>} declares one subscribing
 * service. A service either names a {@code discovery-url}, an explicit {@code hub} and
 * {@code topic}, or neither (the service is attached but not subscribed).
 */
@ConfigMapping(prefix = "pipestream.websub")
@ConfigRoot(phase = ConfigPhase.RUN_TIME)
public interface WebSubSubscriberConfig {

    /**
     * Whether subscriptions are sent on startup.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Whether every declared subscription must be acknowledged by its hub.
     * When set, a service that cannot be attached or subscribed stops the application
     * and marks it not ready. Set to {@code false} to only log such failures.
     */
    @WithDefault("true")
    boolean required();

    /**
     * Whether accepted subscriptions are cancelled at the hub on shutdown.
     */
    @WithName("unsubscribe-on-shutdown")
    @WithDefault("false")
    boolean unsubscribeOnShutdown();

    /**
     * Public address of the callback listener.
     */
    ListenerConfig listener();

    /**
     * Subscribing services, keyed by service name.
     */
    Map<String, ServiceConfig> services();

    /**
     * Public address of the listener that receives hub callbacks.
     */
    interface ListenerConfig {
        /**
         * Host the hub uses to reach this application.
         */
        @WithDefault("localhost")
        String host();

        /**
         * Port the hub uses to reach this application.
         * Defaults to quarkus.http.port, or quarkus.http.ssl-port when TLS is enabled.
         */
        Optional<Integer> port();

        /**
         * Whether callbacks are served over TLS.
         */
        @WithName("tls-enabled")
        @WithDefault("false")
        boolean tlsEnabled();
    }

    /**
     * Subscriber settings of one service.
     */
    interface ServiceConfig {
        /**
         * Resource URL whose hub and topic are discovered from its Link headers.
         */
        @WithName("discovery-url")
        Optional<String> discoveryUrl();

        /**
         * Hub URL, used together with topic instead of discovery.
         */
        Optional<String> hub();

        /**
         * Topic URL, used together with hub instead of discovery.
         */
        Optional<String> topic();

        /**
         * Shared secret the hub signs content notifications with.
         */
        Optional<String> secret();

        /**
         * Explicit callback URL sent to the hub instead of the resolved one.
         */
        Optional<String> callback();

        /**
         * Callback path segments. A random segment is generated when unset.
         */
        Optional<List<String>> path();

        /**
         * Requested lease duration in seconds.
         */
        @WithName("lease-seconds")
        Optional<Integer> leaseSeconds();

        /**
         * Discovery request settings.
         */
        DiscoveryConfig discovery();

        /**
         * Subscription request settings.
         */
        TransportConfig subscription();
    }

    /**
     * Discovery request settings.
     */
    interface DiscoveryConfig extends TransportConfig {
        /**
         * Media types sent in the Accept header.
         */
        Optional<List<String>> accept();

        /**
         * Language tags sent in the Accept-Language header.
         */
        @WithName("accept-language")
        Optional<List<String>> acceptLanguage();
    }

    /**
     * Transport settings of an outgoing request.
     */
    interface TransportConfig {
        /**
         * Request timeout.
         */
        @WithDefault("10s")
        Duration timeout();

        /**
         * Extra headers added to the request.
         */
        Map<String, String> headers();
    }
}
