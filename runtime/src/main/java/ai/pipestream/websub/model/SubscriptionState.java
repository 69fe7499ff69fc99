package ai.pipestream.websub.model;

/**
 * Subscription state of an attached service.
 */
public enum SubscriptionState {
    PENDING,
    DISCOVERING,
    SUBSCRIBING,
    ACCEPTED,
    SKIPPED,
    FAILED,
    UNSUBSCRIBED
}
