package ai.pipestream.websub.model;

import java.util.List;
import java.util.Objects;

/**
 * Publicly reachable callback URL of an attached service.
 * <p>
 * Always rendered as {@code scheme://host:port/segment(/segment)*}.
 */
public final class CallbackUrl {

    private final String scheme;
    private final String host;
    private final int port;
    private final List<String> pathSegments;
    private final boolean generatedPath;

    public CallbackUrl(String scheme, String host, int port, List<String> pathSegments, boolean generatedPath) {
        this.scheme = Objects.requireNonNull(scheme, "scheme is required");
        this.host = Objects.requireNonNull(host, "host is required");
        this.port = port;
        this.pathSegments = List.copyOf(Objects.requireNonNull(pathSegments, "pathSegments is required"));
        if (this.pathSegments.isEmpty()) {
            throw new IllegalArgumentException("at least one path segment is required");
        }
        this.generatedPath = generatedPath;
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public List<String> getPathSegments() {
        return pathSegments;
    }

    /**
     * Returns the path, each segment prefixed with {@code /}.
     */
    public String getPath() {
        StringBuilder path = new StringBuilder();
        for (String segment : pathSegments) {
            path.append('/').append(segment);
        }
        return path.toString();
    }

    /**
     * Whether the path was generated rather than configured.
     */
    public boolean isGeneratedPath() {
        return generatedPath;
    }

    public boolean isSecure() {
        return "https".equals(scheme);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallbackUrl)) {
            return false;
        }
        CallbackUrl that = (CallbackUrl) o;
        return port == that.port
                && scheme.equals(that.scheme)
                && host.equals(that.host)
                && pathSegments.equals(that.pathSegments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port, pathSegments);
    }

    @Override
    public String toString() {
        return scheme + "://" + host + ":" + port + getPath();
    }
}
