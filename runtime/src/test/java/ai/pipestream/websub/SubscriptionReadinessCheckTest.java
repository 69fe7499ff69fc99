package ai.pipestream.websub;

import ai.pipestream.websub.callback.CallbackUrlResolver;
import ai.pipestream.websub.callback.PathSegmentGenerator;
import ai.pipestream.websub.client.WebSubClientProducer;
import ai.pipestream.websub.config.WebSubSubscriberConfig;
import ai.pipestream.websub.discovery.ResourceDiscoveryClient;
import ai.pipestream.websub.hub.SubscriptionClient;
import ai.pipestream.websub.listener.ConfiguredSubscriberListener;
import ai.pipestream.websub.model.ServiceConfiguration;
import ai.pipestream.websub.model.SubscriptionTarget;
import ai.pipestream.websub.testing.RecordingEventListener;
import ai.pipestream.websub.testing.TestConfigs;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class SubscriptionReadinessCheckTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static Vertx vertx;
    private static WebClient webClient;

    @BeforeAll
    static void startVertx() {
        vertx = Vertx.vertx();
        webClient = WebSubClientProducer.createClient(vertx);
    }

    @AfterAll
    static void stopVertx() {
        webClient.close();
        vertx.closeAndAwait();
    }

    private static WebSubSubscriptionManager manager(WebSubSubscriberConfig config) {
        RecordingEventListener events = new RecordingEventListener();
        SubscriptionClient subscriptionClient = new SubscriptionClient(webClient);
        return new WebSubSubscriptionManager(config,
                new ServiceConfigurationCollector(config),
                new ConfiguredSubscriberListener("localhost", 8080, false),
                new CallbackUrlResolver(new PathSegmentGenerator(), events),
                new SubscriptionOrchestrator(new ResourceDiscoveryClient(webClient), subscriptionClient, events),
                subscriptionClient);
    }

    private static ServiceConfiguration unreachable(String name) {
        return ServiceConfiguration.builder()
                .name(name)
                .target(SubscriptionTarget.hubTopicPair("http://localhost:1/hub", "https://example.org/feed"))
                .path(List.of(name))
                .build();
    }

    private static ServiceConfiguration quiet(String name) {
        return ServiceConfiguration.builder().name(name).path(List.of(name)).build();
    }

    @Test
    void up_whenEveryServiceSettled() {
        WebSubSubscriberConfig config = TestConfigs.mapping(Map.of("pipestream.websub.required", "true"));
        WebSubSubscriptionManager manager = manager(config);
        manager.attach(quiet("quiet"));
        manager.subscribeAll().await().atMost(TIMEOUT);

        HealthCheckResponse response = new SubscriptionReadinessCheck(config, manager).call();

        assertThat(response.getName()).isEqualTo(SubscriptionReadinessCheck.CHECK_NAME);
        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("service.quiet", "SKIPPED")
                .containsEntry("required", true));
    }

    @Test
    void down_whenRequiredAndAServiceFailed() {
        WebSubSubscriberConfig config = TestConfigs.mapping(Map.of("pipestream.websub.required", "true"));
        WebSubSubscriptionManager manager = manager(config);
        manager.attach(quiet("quiet"));
        manager.attach(unreachable("news"));
        catchThrowable(() -> manager.subscribeAll().await().atMost(TIMEOUT));

        HealthCheckResponse response = new SubscriptionReadinessCheck(config, manager).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("service.news", "FAILED")
                .containsKey("service.news.failure"));
    }

    @Test
    void down_whenRequiredAndStillPending() {
        WebSubSubscriberConfig config = TestConfigs.mapping(Map.of("pipestream.websub.required", "true"));
        WebSubSubscriptionManager manager = manager(config);
        manager.attach(unreachable("news"));

        assertThat(new SubscriptionReadinessCheck(config, manager).call().getStatus())
                .isEqualTo(HealthCheckResponse.Status.DOWN);
    }

    @Test
    void down_byDefaultWhenAServiceFailed() {
        WebSubSubscriberConfig config = TestConfigs.mapping(Map.of());
        WebSubSubscriptionManager manager = manager(config);
        manager.attach(unreachable("news"));
        catchThrowable(() -> manager.subscribeAll().await().atMost(TIMEOUT));

        HealthCheckResponse response = new SubscriptionReadinessCheck(config, manager).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("required", true)
                .containsEntry("service.news.callback", "http://localhost:8080/news"));
    }

    @Test
    void up_whenNotRequiredEvenIfFailed() {
        WebSubSubscriberConfig config = TestConfigs.mapping(Map.of("pipestream.websub.required", "false"));
        WebSubSubscriptionManager manager = manager(config);
        manager.attach(unreachable("news"));
        catchThrowable(() -> manager.subscribeAll().await().atMost(TIMEOUT));

        HealthCheckResponse response = new SubscriptionReadinessCheck(config, manager).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data)
                .containsEntry("service.news", "FAILED"));
    }

    @Test
    void up_whenDisabled() {
        WebSubSubscriberConfig config = TestConfigs.mapping(Map.of(
                "pipestream.websub.enabled", "false",
                "pipestream.websub.required", "true"));

        HealthCheckResponse response = new SubscriptionReadinessCheck(config, manager(config)).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> assertThat(data).containsEntry("enabled", false));
    }
}
