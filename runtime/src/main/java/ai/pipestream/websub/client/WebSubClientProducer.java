package ai.pipestream.websub.client;

import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/**
 * CDI producer for the Vert.x web client used for discovery and hub requests.
 */
@ApplicationScoped
public class WebSubClientProducer {

    private static final Logger LOG = Logger.getLogger(WebSubClientProducer.class);

    public static final String CLIENT_NAME = "websub";
    static final String USER_AGENT = "pipestream-websub-subscriber";

    @Produces
    @Singleton
    @Named(CLIENT_NAME)
    public WebClient webSubClient(Vertx vertx) {
        LOG.debug("Creating WebSub web client");
        return createClient(vertx);
    }

    void close(@Disposes @Named(CLIENT_NAME) WebClient client) {
        client.close();
    }

    /**
     * Creates a client with the settings used for every WebSub request.
     */
    public static WebClient createClient(Vertx vertx) {
        WebClientOptions options = new WebClientOptions()
                .setUserAgent(USER_AGENT)
                .setFollowRedirects(true);
        return WebClient.create(vertx, options);
    }
}
