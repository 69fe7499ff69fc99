package ai.pipestream.websub.events;

import ai.pipestream.websub.model.CallbackUrl;
import ai.pipestream.websub.model.SubscriptionOutcome;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Default {@link SubscriptionEventListener} writing every event to the log.
 */
@ApplicationScoped
public class LoggingSubscriptionEventListener implements SubscriptionEventListener {

    private static final Logger LOG = Logger.getLogger(LoggingSubscriptionEventListener.class);

    @Override
    public void callbackGenerated(String serviceName, CallbackUrl callbackUrl) {
        LOG.infof("Generated callback URL for service %s: %s", serviceName, callbackUrl);
    }

    @Override
    public void subscriptionSkipped(String serviceName) {
        LOG.warnf("No hub/topic or discovery URL configured for service %s; subscription skipped", serviceName);
    }

    @Override
    public void subscriptionAccepted(SubscriptionOutcome outcome) {
        LOG.infof("Subscription request accepted for service %s: hub=%s, topic=%s, callback=%s",
                outcome.serviceName(), outcome.hub(), outcome.topic(), outcome.callback());
    }

    @Override
    public void subscriptionFailed(String serviceName, Throwable failure) {
        LOG.errorf(failure, "Subscription failed for service %s", serviceName);
    }
}
