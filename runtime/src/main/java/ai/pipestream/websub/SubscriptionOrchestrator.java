package ai.pipestream.websub;

import ai.pipestream.websub.discovery.ResourceDiscoveryClient;
import ai.pipestream.websub.events.SubscriptionEventListener;
import ai.pipestream.websub.exception.ResourceDiscoveryFailedException;
import ai.pipestream.websub.exception.SubscriptionInitiationFailedException;
import ai.pipestream.websub.hub.SubscriptionClient;
import ai.pipestream.websub.model.CallbackUrl;
import ai.pipestream.websub.model.DiscoveryResult;
import ai.pipestream.websub.model.ServiceConfiguration;
import ai.pipestream.websub.model.SubscriptionOutcome;
import ai.pipestream.websub.model.SubscriptionRequest;
import ai.pipestream.websub.model.SubscriptionState;
import ai.pipestream.websub.model.SubscriptionTarget;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.function.BiConsumer;

/**
 * Drives the subscription of one service: optional discovery, then the hub request.
 * <p>
 * Flow: no target → skipped; discovery URL → discover → subscribe; hub/topic pair → subscribe.
 * A single pass either completes or fails, nothing is retried.
 */
@ApplicationScoped
public class SubscriptionOrchestrator {

    private static final Logger LOG = Logger.getLogger(SubscriptionOrchestrator.class);

    private static final BiConsumer<String, SubscriptionState> NO_PROGRESS = (name, state) -> { };

    private final ResourceDiscoveryClient discoveryClient;
    private final SubscriptionClient subscriptionClient;
    private final SubscriptionEventListener events;

    @Inject
    public SubscriptionOrchestrator(ResourceDiscoveryClient discoveryClient,
                                    SubscriptionClient subscriptionClient,
                                    SubscriptionEventListener events) {
        this.discoveryClient = discoveryClient;
        this.subscriptionClient = subscriptionClient;
        this.events = events;
    }

    public Uni<SubscriptionOutcome> subscribe(ServiceConfiguration service, CallbackUrl callbackUrl) {
        return subscribe(service, callbackUrl, NO_PROGRESS);
    }

    /**
     * Subscribes a service to its configured target.
     *
     * @param service     the service configuration
     * @param callbackUrl the callback resolved when the service was attached; only read when a
     *                    subscription is sent and no callback override is configured
     * @param progress    notified when the flow enters the discovery and subscription steps
     * @return a Uni emitting an accepted or skipped outcome, or failing with
     *         {@link ResourceDiscoveryFailedException} or {@link SubscriptionInitiationFailedException}
     */
    public Uni<SubscriptionOutcome> subscribe(ServiceConfiguration service, CallbackUrl callbackUrl,
                                              BiConsumer<String, SubscriptionState> progress) {
        String name = service.getName();
        SubscriptionTarget target = service.getTarget();

        return switch (target.getKind()) {
            case NONE -> {
                events.subscriptionSkipped(name);
                yield Uni.createFrom().item(SubscriptionOutcome.skipped(name));
            }
            case DISCOVERY_URL -> reportResult(name, Uni.createFrom().deferred(() -> {
                        progress.accept(name, SubscriptionState.DISCOVERING);
                        return discoveryClient.discover(target.getDiscoveryUrl(), service.getDiscoveryOptions());
                    })
                    .onItem().transformToUni(discovered -> sendSubscription(service, discovered, callbackUrl, progress)));
            case HUB_TOPIC_PAIR -> reportResult(name, sendSubscription(service,
                    new DiscoveryResult(target.getHub(), target.getTopic()), callbackUrl, progress));
        };
    }

    private Uni<SubscriptionOutcome> sendSubscription(ServiceConfiguration service, DiscoveryResult hubAndTopic,
                                                      CallbackUrl callbackUrl,
                                                      BiConsumer<String, SubscriptionState> progress) {
        String name = service.getName();
        return Uni.createFrom().deferred(() -> {
            progress.accept(name, SubscriptionState.SUBSCRIBING);
            String callback = service.getCallbackOverride() != null
                    ? service.getCallbackOverride()
                    : callbackUrl.toString();
            SubscriptionRequest request = SubscriptionRequest.subscribe(
                    hubAndTopic.hubUrl(), hubAndTopic.topicUrl(), callback,
                    service.getSecret(), service.getLeaseSeconds());
            LOG.infof("Subscribing service %s to %s at hub %s", name, request.topic(), request.hub());
            return subscriptionClient.subscribe(request, service.getSubscriptionTransport())
                    .onFailure(failure -> !(failure instanceof SubscriptionInitiationFailedException))
                    .transform(failure -> new SubscriptionInitiationFailedException(request.hub(), failure));
        });
    }

    private Uni<SubscriptionOutcome> reportResult(String name, Uni<SubscriptionOutcome> subscription) {
        return subscription
                .onItem().transform(outcome -> outcome.forService(name))
                .onItem().invoke(events::subscriptionAccepted)
                .onFailure().invoke(failure -> events.subscriptionFailed(name, failure));
    }
}
