package ai.pipestream.websub.model;

import java.util.Objects;

/**
 * What a service subscribes to: nothing, a resource URL whose hub and topic must be
 * discovered, or an explicit hub and topic pair.
 */
public final class SubscriptionTarget {

    /**
     * The shape of a target.
     */
    public enum Kind {
        NONE,
        DISCOVERY_URL,
        HUB_TOPIC_PAIR
    }

    private static final SubscriptionTarget NONE = new SubscriptionTarget(Kind.NONE, null, null, null);

    private final Kind kind;
    private final String discoveryUrl;
    private final String hub;
    private final String topic;

    private SubscriptionTarget(Kind kind, String discoveryUrl, String hub, String topic) {
        this.kind = kind;
        this.discoveryUrl = discoveryUrl;
        this.hub = hub;
        this.topic = topic;
    }

    public static SubscriptionTarget none() {
        return NONE;
    }

    public static SubscriptionTarget discoveryUrl(String url) {
        return new SubscriptionTarget(Kind.DISCOVERY_URL, Objects.requireNonNull(url, "url is required"), null, null);
    }

    public static SubscriptionTarget hubTopicPair(String hub, String topic) {
        return new SubscriptionTarget(Kind.HUB_TOPIC_PAIR, null,
                Objects.requireNonNull(hub, "hub is required"),
                Objects.requireNonNull(topic, "topic is required"));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the resource URL to discover; only set for {@link Kind#DISCOVERY_URL}.
     */
    public String getDiscoveryUrl() {
        return discoveryUrl;
    }

    /**
     * Returns the hub URL; only set for {@link Kind#HUB_TOPIC_PAIR}.
     */
    public String getHub() {
        return hub;
    }

    /**
     * Returns the topic URL; only set for {@link Kind#HUB_TOPIC_PAIR}.
     */
    public String getTopic() {
        return topic;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubscriptionTarget)) {
            return false;
        }
        SubscriptionTarget that = (SubscriptionTarget) o;
        return kind == that.kind
                && Objects.equals(discoveryUrl, that.discoveryUrl)
                && Objects.equals(hub, that.hub)
                && Objects.equals(topic, that.topic);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, discoveryUrl, hub, topic);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "SubscriptionTarget{none}";
            case DISCOVERY_URL -> "SubscriptionTarget{discoveryUrl='" + discoveryUrl + "'}";
            case HUB_TOPIC_PAIR -> "SubscriptionTarget{hub='" + hub + "', topic='" + topic + "'}";
        };
    }
}
