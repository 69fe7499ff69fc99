package ai.pipestream.websub.model;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request transport settings for discovery and hub requests.
 *
 * @param timeout request timeout
 * @param headers extra headers added to every request
 */
public record TransportOptions(Duration timeout, Map<String, String> headers) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public TransportOptions {
        Objects.requireNonNull(timeout, "timeout is required");
        headers = headers != null ? Map.copyOf(headers) : Collections.emptyMap();
    }

    /**
     * Returns options with the default timeout and no extra headers.
     */
    public static TransportOptions defaults() {
        return new TransportOptions(DEFAULT_TIMEOUT, Collections.emptyMap());
    }
}
