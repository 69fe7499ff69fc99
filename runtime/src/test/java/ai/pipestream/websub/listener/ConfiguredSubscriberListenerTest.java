package ai.pipestream.websub.listener;

import ai.pipestream.websub.exception.ListenerAttachException;
import ai.pipestream.websub.testing.TestConfigs;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredSubscriberListenerTest {

    @Test
    void attach_tracksServicesAndPaths() {
        ConfiguredSubscriberListener listener = new ConfiguredSubscriberListener("localhost", 8080, false);

        listener.attach("news", "/news");
        listener.attach("weather", "/weather/updates");

        assertThat(listener.attachments())
                .containsEntry("news", "/news")
                .containsEntry("weather", "/weather/updates");
    }

    @Test
    void attach_rejectsDuplicateServiceOrPath() {
        ConfiguredSubscriberListener listener = new ConfiguredSubscriberListener("localhost", 8080, false);
        listener.attach("news", "/news");

        assertThatThrownBy(() -> listener.attach("news", "/other"))
                .isInstanceOf(ListenerAttachException.class)
                .hasMessageContaining("already attached");
        assertThatThrownBy(() -> listener.attach("sports", "/news"))
                .isInstanceOf(ListenerAttachException.class)
                .hasMessageContaining("already bound to service 'news'");
    }

    @Test
    void attach_rejectsInvalidInput() {
        ConfiguredSubscriberListener listener = new ConfiguredSubscriberListener("localhost", 8080, false);

        assertThatThrownBy(() -> listener.attach(" ", "/x")).isInstanceOf(ListenerAttachException.class);
        assertThatThrownBy(() -> listener.attach("svc", "x")).isInstanceOf(ListenerAttachException.class);
        assertThatThrownBy(() -> listener.attach("svc", null)).isInstanceOf(ListenerAttachException.class);
    }

    @Test
    void stop_releasesAttachmentsAndRefusesNewOnes() {
        ConfiguredSubscriberListener listener = new ConfiguredSubscriberListener("localhost", 8080, false);
        listener.start();
        listener.attach("news", "/news");
        assertThat(listener.attachments()).containsEntry("news", "/news");

        listener.gracefulStop();

        assertThat(listener.attachments()).isEmpty();
        assertThatThrownBy(() -> listener.attach("news", "/news"))
                .isInstanceOf(ListenerAttachException.class)
                .hasMessageContaining("stopped");
    }

    @Test
    void detach_removesService() {
        ConfiguredSubscriberListener listener = new ConfiguredSubscriberListener("localhost", 8080, false);
        listener.attach("news", "/news");

        listener.detach("news");
        listener.detach("unknown");

        assertThat(listener.attachments()).isEmpty();
    }

    @Test
    void configuredAddress_defaultsToQuarkusPorts() {
        ConfiguredSubscriberListener plain = new ConfiguredSubscriberListener(
                TestConfigs.mapping(Map.of()), 8081, 8444);
        ConfiguredSubscriberListener secure = new ConfiguredSubscriberListener(
                TestConfigs.mapping(Map.of("pipestream.websub.listener.tls-enabled", "true")), 8081, 8444);
        ConfiguredSubscriberListener explicit = new ConfiguredSubscriberListener(
                TestConfigs.mapping(Map.of(
                        "pipestream.websub.listener.host", "subscriber.example.org",
                        "pipestream.websub.listener.port", "9000")), 8081, 8444);

        assertThat(plain.host()).isEqualTo("localhost");
        assertThat(plain.port()).isEqualTo(8081);
        assertThat(plain.tlsEnabled()).isFalse();
        assertThat(secure.port()).isEqualTo(8444);
        assertThat(secure.tlsEnabled()).isTrue();
        assertThat(explicit.host()).isEqualTo("subscriber.example.org");
        assertThat(explicit.port()).isEqualTo(9000);
    }

    @Test
    void constructor_rejectsInvalidAddress() {
        assertThatThrownBy(() -> new ConfiguredSubscriberListener("", 8080, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfiguredSubscriberListener("localhost", 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
