package ai.pipestream.websub.model;

/**
 * Successful result of one orchestration run.
 * <p>
 * {@link Status#ACCEPTED} means the hub acknowledged the request; the subscription is
 * only active once the hub has verified intent against the callback. Failures are not
 * outcomes, they are reported as exceptions.
 *
 * @param status      accepted or skipped
 * @param serviceName the service the outcome belongs to (null when produced by the hub client)
 * @param hub         hub URL (null when skipped)
 * @param topic       topic URL (null when skipped)
 * @param callback    callback URL (null when skipped)
 */
public record SubscriptionOutcome(Status status, String serviceName, String hub, String topic, String callback) {

    public enum Status {
        ACCEPTED,
        SKIPPED
    }

    public static SubscriptionOutcome accepted(String hub, String topic, String callback) {
        return new SubscriptionOutcome(Status.ACCEPTED, null, hub, topic, callback);
    }

    /**
     * Creates the outcome of a service that declares no target.
     */
    public static SubscriptionOutcome skipped(String serviceName) {
        return new SubscriptionOutcome(Status.SKIPPED, serviceName, null, null, null);
    }

    public SubscriptionOutcome forService(String serviceName) {
        return new SubscriptionOutcome(status, serviceName, hub, topic, callback);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
