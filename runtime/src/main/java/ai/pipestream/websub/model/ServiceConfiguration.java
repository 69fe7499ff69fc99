package ai.pipestream.websub.model;

import ai.pipestream.websub.exception.ConfigurationException;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Subscriber configuration of one service, attached once at registration time.
 */
public final class ServiceConfiguration {

    private final String name;
    private final SubscriptionTarget target;
    private final String secret;
    private final String callbackOverride;
    private final List<String> path;
    private final DiscoveryOptions discoveryOptions;
    private final TransportOptions subscriptionTransport;
    private final Integer leaseSeconds;

    private ServiceConfiguration(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.target = builder.target != null ? builder.target : SubscriptionTarget.none();
        this.secret = blankToNull(builder.secret);
        this.callbackOverride = blankToNull(builder.callbackOverride);
        this.path = builder.path != null ? List.copyOf(builder.path) : Collections.emptyList();
        this.discoveryOptions = builder.discoveryOptions != null ? builder.discoveryOptions : DiscoveryOptions.defaults();
        this.subscriptionTransport = builder.subscriptionTransport != null
                ? builder.subscriptionTransport : TransportOptions.defaults();
        this.leaseSeconds = builder.leaseSeconds;
        validate();
    }

    private void validate() {
        if (name.isBlank()) {
            throw new ConfigurationException(name, "service name must not be blank");
        }
        if (leaseSeconds != null && leaseSeconds <= 0) {
            throw new ConfigurationException(name, "lease-seconds must be positive, got " + leaseSeconds);
        }
        if (callbackOverride != null && !isAbsoluteHttpUrl(callbackOverride)) {
            throw new ConfigurationException(name, "callback must be an absolute http(s) URL, got '" + callbackOverride + "'");
        }
    }

    private static boolean isAbsoluteHttpUrl(String value) {
        try {
            URI uri = URI.create(value);
            String scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public String getName() {
        return name;
    }

    public SubscriptionTarget getTarget() {
        return target;
    }

    public String getSecret() {
        return secret;
    }

    public String getCallbackOverride() {
        return callbackOverride;
    }

    /**
     * Returns the configured mount path segments; empty when a path should be generated.
     */
    public List<String> getPath() {
        return path;
    }

    public DiscoveryOptions getDiscoveryOptions() {
        return discoveryOptions;
    }

    public TransportOptions getSubscriptionTransport() {
        return subscriptionTransport;
    }

    public Integer getLeaseSeconds() {
        return leaseSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ServiceConfiguration{" +
                "name='" + name + '\'' +
                ", target=" + target +
                ", secret=" + (secret != null ? "****" : "null") +
                ", callbackOverride='" + callbackOverride + '\'' +
                ", path=" + path +
                ", discoveryOptions=" + discoveryOptions +
                ", subscriptionTransport=" + subscriptionTransport +
                ", leaseSeconds=" + leaseSeconds +
                '}';
    }

    public static final class Builder {
        private String name;
        private SubscriptionTarget target;
        private String secret;
        private String callbackOverride;
        private List<String> path;
        private DiscoveryOptions discoveryOptions;
        private TransportOptions subscriptionTransport;
        private Integer leaseSeconds;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder target(SubscriptionTarget target) {
            this.target = target;
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder callbackOverride(String callbackOverride) {
            this.callbackOverride = callbackOverride;
            return this;
        }

        public Builder path(List<String> path) {
            this.path = path;
            return this;
        }

        public Builder discoveryOptions(DiscoveryOptions discoveryOptions) {
            this.discoveryOptions = discoveryOptions;
            return this;
        }

        public Builder subscriptionTransport(TransportOptions subscriptionTransport) {
            this.subscriptionTransport = subscriptionTransport;
            return this;
        }

        public Builder leaseSeconds(Integer leaseSeconds) {
            this.leaseSeconds = leaseSeconds;
            return this;
        }

        public ServiceConfiguration build() {
            return new ServiceConfiguration(this);
        }
    }
}
