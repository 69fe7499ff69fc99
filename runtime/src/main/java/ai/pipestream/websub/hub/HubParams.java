package ai.pipestream.websub.hub;

/**
 * Form field names of WebSub hub requests.
 */
public final class HubParams {

    public static final String CALLBACK = "hub.callback";
    public static final String LEASE_SECONDS = "hub.lease_seconds";
    public static final String MODE = "hub.mode";
    public static final String SECRET = "hub.secret";
    public static final String TOPIC = "hub.topic";

    private HubParams() {
    }
}
