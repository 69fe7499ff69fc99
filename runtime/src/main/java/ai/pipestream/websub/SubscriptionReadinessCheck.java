package ai.pipestream.websub;

import ai.pipestream.websub.config.WebSubSubscriberConfig;
import ai.pipestream.websub.model.SubscriptionState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.util.Map;

@Readiness
@ApplicationScoped
public class SubscriptionReadinessCheck implements HealthCheck {

    static final String CHECK_NAME = "pipestream-websub";

    private final WebSubSubscriberConfig config;
    private final WebSubSubscriptionManager subscriptionManager;

    @Inject
    public SubscriptionReadinessCheck(WebSubSubscriberConfig config,
                                      WebSubSubscriptionManager subscriptionManager) {
        this.config = config;
        this.subscriptionManager = subscriptionManager;
    }

    @Override
    public HealthCheckResponse call() {
        Map<String, SubscriptionState> states = subscriptionManager.getStates();

        HealthCheckResponseBuilder response = HealthCheckResponse.named(CHECK_NAME)
                .withData("enabled", config.enabled())
                .withData("required", config.required());

        boolean allSettled = true;
        for (Map.Entry<String, SubscriptionState> entry : states.entrySet()) {
            response.withData("service." + entry.getKey(), entry.getValue().name());
            subscriptionManager.getCallbackUrl(entry.getKey())
                    .ifPresent(callback -> response.withData("service." + entry.getKey() + ".callback", callback.toString()));
            subscriptionManager.getFailure(entry.getKey())
                    .ifPresent(message -> response.withData("service." + entry.getKey() + ".failure", message));
            if (entry.getValue() != SubscriptionState.ACCEPTED && entry.getValue() != SubscriptionState.SKIPPED) {
                allSettled = false;
            }
        }

        if (!config.enabled() || !config.required() || allSettled) {
            return response.up().build();
        }
        return response.down().build();
    }
}
