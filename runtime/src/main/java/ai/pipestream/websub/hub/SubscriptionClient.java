package ai.pipestream.websub.hub;

import ai.pipestream.websub.client.WebSubClientProducer;
import ai.pipestream.websub.exception.SubscriptionInitiationFailedException;
import ai.pipestream.websub.model.SubscriptionOutcome;
import ai.pipestream.websub.model.SubscriptionRequest;
import ai.pipestream.websub.model.TransportOptions;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.MultiMap;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Sends subscription requests to WebSub hubs.
 * <p>
 * Only the hub's synchronous acknowledgment is interpreted here. Whether the
 * subscription becomes active is decided later, when the hub verifies intent
 * against the callback URL.
 */
@ApplicationScoped
public class SubscriptionClient {

    private static final Logger LOG = Logger.getLogger(SubscriptionClient.class);
    private static final int MAX_BODY_IN_MESSAGE = 256;

    private final WebClient webClient;

    @Inject
    public SubscriptionClient(@Named(WebSubClientProducer.CLIENT_NAME) WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Asks the hub to subscribe the callback to the topic.
     *
     * @param request   the subscription request; its mode must be {@code subscribe}
     * @param transport transport settings for the hub request
     * @return a Uni emitting an accepted outcome, or failing with {@link SubscriptionInitiationFailedException}
     */
    public Uni<SubscriptionOutcome> subscribe(SubscriptionRequest request, TransportOptions transport) {
        if (!SubscriptionRequest.MODE_SUBSCRIBE.equals(request.mode())) {
            return Uni.createFrom().failure(new SubscriptionInitiationFailedException(request.hub(), -1,
                    "expected mode " + SubscriptionRequest.MODE_SUBSCRIBE + ", got " + request.mode()));
        }
        return send(request, transport);
    }

    /**
     * Asks the hub to remove the callback's subscription to the topic.
     *
     * @param hub       hub URL
     * @param topic     topic URL
     * @param callback  callback URL that was subscribed
     * @param transport transport settings for the hub request
     * @return a Uni emitting the acknowledged request as an outcome
     */
    public Uni<SubscriptionOutcome> unsubscribe(String hub, String topic, String callback, TransportOptions transport) {
        return send(SubscriptionRequest.unsubscribe(hub, topic, callback), transport);
    }

    private Uni<SubscriptionOutcome> send(SubscriptionRequest request, TransportOptions transport) {
        return Uni.createFrom().deferred(() -> buildRequest(request, transport).sendForm(form(request)))
                .onItem().transform(response -> interpret(request, response))
                .onFailure(failure -> !(failure instanceof SubscriptionInitiationFailedException))
                .transform(failure -> new SubscriptionInitiationFailedException(request.hub(), failure));
    }

    private HttpRequest<Buffer> buildRequest(SubscriptionRequest request, TransportOptions transport) {
        HttpRequest<Buffer> httpRequest = webClient.postAbs(request.hub())
                .timeout(transport.timeout().toMillis());
        for (Map.Entry<String, String> header : transport.headers().entrySet()) {
            httpRequest.putHeader(header.getKey(), header.getValue());
        }
        LOG.debugf("Sending %s", request);
        return httpRequest;
    }

    static MultiMap form(SubscriptionRequest request) {
        MultiMap form = MultiMap.caseInsensitiveMultiMap();
        form.add(HubParams.MODE, request.mode());
        form.add(HubParams.TOPIC, request.topic());
        form.add(HubParams.CALLBACK, request.callback());
        if (request.secret() != null) {
            form.add(HubParams.SECRET, request.secret());
        }
        if (request.leaseSeconds() != null) {
            form.add(HubParams.LEASE_SECONDS, String.valueOf(request.leaseSeconds()));
        }
        return form;
    }

    private SubscriptionOutcome interpret(SubscriptionRequest request, HttpResponse<Buffer> response) {
        int status = response.statusCode();
        if (status >= 200 && status <= 299) {
            LOG.debugf("Hub %s acknowledged %s of %s with status %d",
                    request.hub(), request.mode(), request.topic(), status);
            return SubscriptionOutcome.accepted(request.hub(), request.topic(), request.callback());
        }
        throw new SubscriptionInitiationFailedException(request.hub(), status,
                "hub answered " + status + " " + response.statusMessage() + describeBody(response));
    }

    private static String describeBody(HttpResponse<Buffer> response) {
        String body = response.bodyAsString();
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        if (trimmed.length() > MAX_BODY_IN_MESSAGE) {
            trimmed = trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "...";
        }
        return ": " + trimmed;
    }
}
