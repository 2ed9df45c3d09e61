package biz.kryukov.dev.endpoint;

import biz.kryukov.dev.endpoint.parser.EndpointFormatter;
import biz.kryukov.dev.endpoint.parser.EndpointParser;

import java.nio.file.Path;

/**
 * Network or filesystem endpoint. Immutable.
 *
 * <p>Usage:
 * <pre>{@code
 * Endpoint ep = Endpoint.parse("tcp://127.0.0.1:9000");
 * String canonical = ep.toString();           // "tcp://127.0.0.1:9000"
 * List<InetSocketAddress> addrs = EndpointResolver.defaultResolver().resolve(ep);
 * }</pre>
 *
 * <p>{@link NetworkEndpoint} covers the thirteen host/port schemes,
 * {@link PathEndpoint} covers {@code unix://} and {@code file://}.
 */
public sealed interface Endpoint permits NetworkEndpoint, PathEndpoint {

    /** Returns the scheme discriminant. */
    Scheme scheme();

    /**
     * Parses a connection string.
     *
     * @param input e.g. {@code tcp://host:port} or {@code unix:///path}
     * @return parsed endpoint
     * @throws ParseEndpointException if the input is malformed or the scheme is unsupported
     */
    static Endpoint parse(String input) throws ParseEndpointException {
        return EndpointParser.parse(input);
    }

    /** Creates a network endpoint from already validated parts. */
    static NetworkEndpoint network(Scheme scheme, HostAddr host, int port) {
        return new NetworkEndpoint(scheme, host, port);
    }

    /** Creates a Unix domain socket endpoint. */
    static PathEndpoint unix(Path path) {
        return unix(path.toString());
    }

    /** Creates a Unix domain socket endpoint from verbatim path text. */
    static PathEndpoint unix(String location) {
        return new PathEndpoint(Scheme.UNIX, location);
    }

    /** Creates a file endpoint. */
    static PathEndpoint file(Path path) {
        return file(path.toString());
    }

    /** Creates a file endpoint from verbatim path text. */
    static PathEndpoint file(String location) {
        return new PathEndpoint(Scheme.FILE, location);
    }

    /** Returns the canonical string form; {@link #parse} reads it back to an equal value. */
    default String format() {
        return EndpointFormatter.format(this);
    }
}
