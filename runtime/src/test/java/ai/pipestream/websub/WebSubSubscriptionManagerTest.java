package ai.pipestream.websub;

import ai.pipestream.websub.callback.CallbackUrlResolver;
import ai.pipestream.websub.callback.PathSegmentGenerator;
import ai.pipestream.websub.client.WebSubClientProducer;
import ai.pipestream.websub.discovery.ResourceDiscoveryClient;
import ai.pipestream.websub.exception.ConfigurationException;
import ai.pipestream.websub.exception.ListenerAttachException;
import ai.pipestream.websub.exception.SubscriptionInitiationFailedException;
import ai.pipestream.websub.hub.HubParams;
import ai.pipestream.websub.hub.SubscriptionClient;
import ai.pipestream.websub.listener.ConfiguredSubscriberListener;
import ai.pipestream.websub.model.CallbackUrl;
import ai.pipestream.websub.model.ServiceConfiguration;
import ai.pipestream.websub.model.SubscriptionOutcome;
import ai.pipestream.websub.model.SubscriptionState;
import ai.pipestream.websub.model.SubscriptionTarget;
import ai.pipestream.websub.testing.RecordingEventListener;
import ai.pipestream.websub.testing.TestConfigs;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebSubSubscriptionManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String TOPIC = "https://example.org/feed";

    @RegisterExtension
    static WireMockExtension hub = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static Vertx vertx;
    private static WebClient webClient;

    private ConfiguredSubscriberListener listener;
    private WebSubSubscriptionManager manager;

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

    @BeforeEach
    void setUp() {
        RecordingEventListener events = new RecordingEventListener();
        SubscriptionClient subscriptionClient = new SubscriptionClient(webClient);
        listener = new ConfiguredSubscriberListener("localhost", 8080, false);
        manager = new WebSubSubscriptionManager(
                TestConfigs.mapping(Map.of()),
                new ServiceConfigurationCollector(TestConfigs.mapping(Map.of())),
                listener,
                new CallbackUrlResolver(new PathSegmentGenerator(), events),
                new SubscriptionOrchestrator(new ResourceDiscoveryClient(webClient), subscriptionClient, events),
                subscriptionClient);
    }

    private ServiceConfiguration pair(String name, String hubPath) {
        return ServiceConfiguration.builder()
                .name(name)
                .target(SubscriptionTarget.hubTopicPair(hub.baseUrl() + hubPath, TOPIC))
                .path(List.of(name))
                .build();
    }

    @Test
    void attach_bindsListenerAndMarksPending() {
        CallbackUrl callbackUrl = manager.attach(pair("news", "/hub"));

        assertThat(callbackUrl.toString()).isEqualTo("http://localhost:8080/news");
        assertThat(listener.attachments()).containsEntry("news", "/news");
        assertThat(manager.getState("news")).isEqualTo(SubscriptionState.PENDING);
        assertThat(manager.getCallbackUrl("news")).contains(callbackUrl);
    }

    @Test
    void attach_duplicatePath_isRefused() {
        manager.attach(pair("news", "/hub"));

        ServiceConfiguration clash = ServiceConfiguration.builder().name("other").path(List.of("news")).build();

        assertThatThrownBy(() -> manager.attach(clash)).isInstanceOf(ListenerAttachException.class);
        assertThat(manager.getState("other")).isNull();
    }

    @Test
    void subscribeAll_nothingAttached_emitsEmptyList() {
        assertThat(manager.subscribeAll().await().atMost(TIMEOUT)).isEmpty();
    }

    @Test
    void subscribeAll_recordsOutcomesInAttachOrder() {
        hub.stubFor(post("/hub").willReturn(aResponse().withStatus(202)));
        manager.attach(pair("news", "/hub"));
        manager.attach(ServiceConfiguration.builder().name("quiet").path(List.of("quiet")).build());

        List<SubscriptionOutcome> outcomes = manager.subscribeAll().await().atMost(TIMEOUT);

        assertThat(outcomes).extracting(SubscriptionOutcome::serviceName).containsExactly("news", "quiet");
        assertThat(outcomes.get(0).isAccepted()).isTrue();
        assertThat(outcomes.get(1).status()).isEqualTo(SubscriptionOutcome.Status.SKIPPED);
        assertThat(manager.getStates())
                .containsEntry("news", SubscriptionState.ACCEPTED)
                .containsEntry("quiet", SubscriptionState.SKIPPED);
        assertThat(manager.getOutcome("news")).contains(outcomes.get(0));
    }

    @Test
    void subscribeAll_failureDoesNotStopOtherServices() {
        hub.stubFor(post("/hub").willReturn(aResponse().withStatus(202)));
        hub.stubFor(post("/broken").willReturn(aResponse().withStatus(500)));
        manager.attach(pair("broken", "/broken"));
        manager.attach(pair("news", "/hub"));

        assertThatThrownBy(() -> manager.subscribeAll().await().atMost(TIMEOUT))
                .isInstanceOf(SubscriptionInitiationFailedException.class);

        assertThat(manager.getState("broken")).isEqualTo(SubscriptionState.FAILED);
        assertThat(manager.getFailure("broken")).hasValueSatisfying(message -> assertThat(message).contains("500"));
        assertThat(manager.getState("news")).isEqualTo(SubscriptionState.ACCEPTED);
        assertThat(listener.attachments()).containsKeys("broken", "news");
    }

    @Test
    void subscribe_unknownService_fails() {
        assertThatThrownBy(() -> manager.subscribe("missing").await().atMost(TIMEOUT))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not attached");
    }

    @Test
    void subscribe_singleService() {
        hub.stubFor(post("/hub").willReturn(aResponse().withStatus(204)));
        manager.attach(pair("news", "/hub"));

        SubscriptionOutcome outcome = manager.subscribe("news").await().atMost(TIMEOUT);

        assertThat(outcome.callback()).isEqualTo("http://localhost:8080/news");
        assertThat(manager.getState("news")).isEqualTo(SubscriptionState.ACCEPTED);
    }

    @Test
    void unsubscribeAll_cancelsAcceptedSubscriptions() {
        hub.stubFor(post("/hub").willReturn(aResponse().withStatus(202)));
        manager.attach(pair("news", "/hub"));
        manager.attach(ServiceConfiguration.builder().name("quiet").path(List.of("quiet")).build());
        manager.subscribeAll().await().atMost(TIMEOUT);

        manager.unsubscribeAll();

        assertThat(manager.getState("news")).isEqualTo(SubscriptionState.UNSUBSCRIBED);
        assertThat(manager.getState("quiet")).isEqualTo(SubscriptionState.SKIPPED);
        assertThat(manager.getOutcome("news")).isEmpty();
        hub.verify(postRequestedFor(urlEqualTo("/hub"))
                .withFormParam(HubParams.MODE, equalTo("unsubscribe"))
                .withFormParam(HubParams.CALLBACK, equalTo("http://localhost:8080/news")));
    }

    @Test
    void unsubscribeAll_hubFailureIsLoggedNotThrown() {
        hub.stubFor(post("/hub").withRequestBody(containing("mode=subscribe"))
                .willReturn(aResponse().withStatus(202)));
        hub.stubFor(post("/hub").withRequestBody(containing("mode=unsubscribe"))
                .willReturn(aResponse().withStatus(500)));
        manager.attach(pair("news", "/hub"));
        manager.subscribeAll().await().atMost(TIMEOUT);

        manager.unsubscribeAll();

        assertThat(manager.getState("news")).isEqualTo(SubscriptionState.ACCEPTED);
    }
}
