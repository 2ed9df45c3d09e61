package biz.kryukov.dev.endpoint;

import biz.kryukov.dev.endpoint.parser.EndpointFormatter;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Path endpoint: a Unix domain socket ({@code unix://}) or a file ({@code file://}).
 *
 * <p>{@code location} is the path text exactly as given: not decoded, not normalized,
 * not checked against the platform. Equality and formatting use this text.
 */
public record PathEndpoint(Scheme scheme, String location) implements Endpoint {

    public PathEndpoint {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(location, "location");
        if (scheme.isNetwork()) {
            throw new IllegalArgumentException("scheme " + scheme.label() + " is not a path scheme");
        }
    }

    /**
     * Returns the location as a platform path.
     *
     * @throws java.nio.file.InvalidPathException if the text is not a valid path on this platform
     */
    public Path path() {
        return Path.of(location);
    }

    @Override
    public String toString() {
        return EndpointFormatter.format(this);
    }
}
