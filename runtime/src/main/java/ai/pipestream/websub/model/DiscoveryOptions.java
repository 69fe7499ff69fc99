package ai.pipestream.websub.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Content negotiation hints and transport settings for resource discovery.
 *
 * @param acceptMediaTypes media types sent as {@code Accept}; empty sends no header
 * @param acceptLanguages  language tags sent as {@code Accept-Language}; empty sends no header
 * @param transport        transport settings for the discovery request
 */
public record DiscoveryOptions(List<String> acceptMediaTypes, List<String> acceptLanguages, TransportOptions transport) {

    public DiscoveryOptions {
        acceptMediaTypes = acceptMediaTypes != null ? List.copyOf(acceptMediaTypes) : Collections.emptyList();
        acceptLanguages = acceptLanguages != null ? List.copyOf(acceptLanguages) : Collections.emptyList();
        Objects.requireNonNull(transport, "transport is required");
    }

    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(Collections.emptyList(), Collections.emptyList(), TransportOptions.defaults());
    }
}
