package ai.pipestream.websub.model;

import java.util.Objects;

/**
 * A subscription change sent to a hub.
 *
 * @param hub          hub URL the request is posted to
 * @param topic        topic URL ({@code hub.topic})
 * @param callback     callback URL ({@code hub.callback})
 * @param secret       shared secret ({@code hub.secret}), or null
 * @param leaseSeconds requested lease ({@code hub.lease_seconds}), or null
 * @param mode         {@code subscribe} or {@code unsubscribe}
 */
public record SubscriptionRequest(String hub, String topic, String callback, String secret,
                                  Integer leaseSeconds, String mode) {

    public static final String MODE_SUBSCRIBE = "subscribe";
    public static final String MODE_UNSUBSCRIBE = "unsubscribe";

    public SubscriptionRequest {
        Objects.requireNonNull(hub, "hub is required");
        Objects.requireNonNull(topic, "topic is required");
        Objects.requireNonNull(callback, "callback is required");
        Objects.requireNonNull(mode, "mode is required");
    }

    public static SubscriptionRequest subscribe(String hub, String topic, String callback,
                                                String secret, Integer leaseSeconds) {
        return new SubscriptionRequest(hub, topic, callback, secret, leaseSeconds, MODE_SUBSCRIBE);
    }

    public static SubscriptionRequest unsubscribe(String hub, String topic, String callback) {
        return new SubscriptionRequest(hub, topic, callback, null, null, MODE_UNSUBSCRIBE);
    }

    @Override
    public String toString() {
        // hub.secret stays out of logs
        return "SubscriptionRequest{" +
                "hub='" + hub + '\'' +
                ", topic='" + topic + '\'' +
                ", callback='" + callback + '\'' +
                ", secret=" + (secret != null ? "****" : "null") +
                ", leaseSeconds=" + leaseSeconds +
                ", mode='" + mode + '\'' +
                '}';
    }
}
