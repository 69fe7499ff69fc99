package ai.pipestream.websub;

import ai.pipestream.websub.config.WebSubSubscriberConfig;
import ai.pipestream.websub.exception.ConfigurationException;
import ai.pipestream.websub.model.DiscoveryOptions;
import ai.pipestream.websub.model.ServiceConfiguration;
import ai.pipestream.websub.model.SubscriptionTarget;
import ai.pipestream.websub.model.TransportOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns the {@code pipestream.websub.services} configuration into {@link ServiceConfiguration}s.
 *
 * <p>All optional values are resolved here, once, so the subscription flow works on
 * complete objects.
 */
@ApplicationScoped
public class ServiceConfigurationCollector {

    private static final Logger LOG = Logger.getLogger(ServiceConfigurationCollector.class);

    private final WebSubSubscriberConfig config;

    @Inject
    public ServiceConfigurationCollector(WebSubSubscriberConfig config) {
        this.config = config;
    }

    /**
     * Collects the configuration of every declared service, ordered by name.
     *
     * @return the service configurations
     * @throws ConfigurationException if a service is declared inconsistently
     */
    public List<ServiceConfiguration> collect() {
        List<ServiceConfiguration> services = new ArrayList<>();
        for (Map.Entry<String, WebSubSubscriberConfig.ServiceConfig> entry : new TreeMap<>(config.services()).entrySet()) {
            services.add(collect(entry.getKey(), entry.getValue()));
        }
        LOG.debugf("Collected %d WebSub service configuration(s)", services.size());
        return services;
    }

    /**
     * Collects the configuration of one declared service.
     *
     * @throws ConfigurationException if the service is not declared or declared inconsistently
     */
    public ServiceConfiguration collect(String serviceName) {
        WebSubSubscriberConfig.ServiceConfig serviceConfig = config.services().get(serviceName);
        if (serviceConfig == null) {
            throw new ConfigurationException(serviceName, "no subscriber configuration found");
        }
        return collect(serviceName, serviceConfig);
    }

    private ServiceConfiguration collect(String name, WebSubSubscriberConfig.ServiceConfig serviceConfig) {
        ServiceConfiguration service = ServiceConfiguration.builder()
                .name(name)
                .target(resolveTarget(name, serviceConfig))
                .secret(serviceConfig.secret().orElse(null))
                .callbackOverride(serviceConfig.callback().orElse(null))
                .path(serviceConfig.path().orElse(Collections.emptyList()))
                .leaseSeconds(serviceConfig.leaseSeconds().orElse(null))
                .discoveryOptions(new DiscoveryOptions(
                        serviceConfig.discovery().accept().orElse(Collections.emptyList()),
                        serviceConfig.discovery().acceptLanguage().orElse(Collections.emptyList()),
                        transport(serviceConfig.discovery())))
                .subscriptionTransport(transport(serviceConfig.subscription()))
                .build();
        LOG.debugf("Collected WebSub service configuration: %s", service);
        return service;
    }

    static SubscriptionTarget resolveTarget(String name, WebSubSubscriberConfig.ServiceConfig serviceConfig) {
        Optional<String> discoveryUrl = nonBlank(serviceConfig.discoveryUrl());
        Optional<String> hub = nonBlank(serviceConfig.hub());
        Optional<String> topic = nonBlank(serviceConfig.topic());

        if (discoveryUrl.isPresent()) {
            if (hub.isPresent() || topic.isPresent()) {
                throw new ConfigurationException(name, "discovery-url cannot be combined with hub or topic");
            }
            return SubscriptionTarget.discoveryUrl(discoveryUrl.get());
        }
        if (hub.isPresent() && topic.isPresent()) {
            return SubscriptionTarget.hubTopicPair(hub.get(), topic.get());
        }
        if (hub.isPresent()) {
            throw new ConfigurationException(name, "hub is set but topic is missing");
        }
        if (topic.isPresent()) {
            throw new ConfigurationException(name, "topic is set but hub is missing");
        }
        return SubscriptionTarget.none();
    }

    private static TransportOptions transport(WebSubSubscriberConfig.TransportConfig transportConfig) {
        return new TransportOptions(transportConfig.timeout(), transportConfig.headers());
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        return value.map(String::trim).filter(v -> !v.isEmpty());
    }
}
