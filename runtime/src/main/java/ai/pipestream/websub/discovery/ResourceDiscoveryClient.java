package ai.pipestream.websub.discovery;

import ai.pipestream.websub.client.WebSubClientProducer;
import ai.pipestream.websub.exception.ResourceDiscoveryFailedException;
import ai.pipestream.websub.model.DiscoveryOptions;
import ai.pipestream.websub.model.DiscoveryResult;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpHeaders;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers the hub and topic of a resource from the {@code Link} headers of its response.
 * <p>
 * Every failure surfaces as {@link ResourceDiscoveryFailedException}: transport errors,
 * non-2xx answers, malformed links, and a missing or ambiguous {@code hub} or {@code self}
 * relation.
 */
@ApplicationScoped
public class ResourceDiscoveryClient {

    private static final Logger LOG = Logger.getLogger(ResourceDiscoveryClient.class);

    static final String LINK_HEADER = "Link";
    static final String REL_HUB = "hub";
    static final String REL_SELF = "self";

    private final WebClient webClient;

    @Inject
    public ResourceDiscoveryClient(@Named(WebSubClientProducer.CLIENT_NAME) WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Retrieves the resource and extracts its hub and topic.
     *
     * @param resourceUrl absolute URL of the resource
     * @param options     content negotiation hints and transport settings
     * @return a Uni emitting the discovered pair, or failing with {@link ResourceDiscoveryFailedException}
     */
    public Uni<DiscoveryResult> discover(String resourceUrl, DiscoveryOptions options) {
        return Uni.createFrom().deferred(() -> buildRequest(resourceUrl, options).send())
                .onItem().transform(response -> extract(resourceUrl, response))
                .onFailure(failure -> !(failure instanceof ResourceDiscoveryFailedException))
                .transform(failure -> new ResourceDiscoveryFailedException(resourceUrl, failure));
    }

    private HttpRequest<Buffer> buildRequest(String resourceUrl, DiscoveryOptions options) {
        HttpRequest<Buffer> request = webClient.getAbs(resourceUrl)
                .timeout(options.transport().timeout().toMillis());
        for (Map.Entry<String, String> header : options.transport().headers().entrySet()) {
            request.putHeader(header.getKey(), header.getValue());
        }
        if (!options.acceptMediaTypes().isEmpty()) {
            request.putHeader(HttpHeaders.ACCEPT.toString(), String.join(", ", options.acceptMediaTypes()));
        }
        if (!options.acceptLanguages().isEmpty()) {
            request.putHeader(HttpHeaders.ACCEPT_LANGUAGE.toString(), String.join(", ", options.acceptLanguages()));
        }
        LOG.debugf("Discovering hub and topic of %s", resourceUrl);
        return request;
    }

    private DiscoveryResult extract(String resourceUrl, HttpResponse<Buffer> response) {
        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new ResourceDiscoveryFailedException(resourceUrl,
                    "unexpected response status " + status + " " + response.statusMessage());
        }

        List<LinkHeaderParser.Link> links;
        try {
            links = LinkHeaderParser.parse(response.headers().getAll(LINK_HEADER));
        } catch (IllegalArgumentException e) {
            throw new ResourceDiscoveryFailedException(resourceUrl, e);
        }

        String hub = single(resourceUrl, links, REL_HUB);
        String topic = single(resourceUrl, links, REL_SELF);
        LOG.debugf("Discovered hub %s and topic %s from %s", hub, topic, resourceUrl);
        return new DiscoveryResult(hub, topic);
    }

    private static String single(String resourceUrl, List<LinkHeaderParser.Link> links, String relation) {
        Set<String> targets = new LinkedHashSet<>();
        for (LinkHeaderParser.Link link : links) {
            if (link.hasRelation(relation)) {
                targets.add(resolve(resourceUrl, link.target()));
            }
        }
        if (targets.isEmpty()) {
            throw new ResourceDiscoveryFailedException(resourceUrl, "no Link with rel=\"" + relation + "\"");
        }
        if (targets.size() > 1) {
            throw new ResourceDiscoveryFailedException(resourceUrl,
                    "ambiguous Link rel=\"" + relation + "\": " + targets);
        }
        return targets.iterator().next();
    }

    private static String resolve(String resourceUrl, String target) {
        try {
            return URI.create(resourceUrl).resolve(target).toString();
        } catch (IllegalArgumentException e) {
            throw new ResourceDiscoveryFailedException(resourceUrl, "invalid Link target '" + target + "'");
        }
    }
}
