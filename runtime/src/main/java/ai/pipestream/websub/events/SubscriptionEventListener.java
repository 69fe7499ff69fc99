package ai.pipestream.websub.events;

import ai.pipestream.websub.model.CallbackUrl;
import ai.pipestream.websub.model.SubscriptionOutcome;

/**
 * Observes the subscription lifecycle. Implementations must not throw; nothing in the
 * subscription flow depends on what they do.
 */
public interface SubscriptionEventListener {

    /**
     * A callback path was generated because the service configured none.
     */
    void callbackGenerated(String serviceName, CallbackUrl callbackUrl);

    /**
     * The service declares no target, so no subscription request is sent.
     */
    void subscriptionSkipped(String serviceName);

    /**
     * The hub acknowledged the subscription request.
     */
    void subscriptionAccepted(SubscriptionOutcome outcome);

    /**
     * Discovery or the subscription request failed.
     */
    void subscriptionFailed(String serviceName, Throwable failure);
}
