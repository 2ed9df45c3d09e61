package biz.kryukov.dev.endpoint.parser;

import biz.kryukov.dev.endpoint.Endpoint;
import biz.kryukov.dev.endpoint.HostAddr;
import biz.kryukov.dev.endpoint.InvalidAddressException;
import biz.kryukov.dev.endpoint.InvalidSchemeException;
import biz.kryukov.dev.endpoint.MissingPortException;
import biz.kryukov.dev.endpoint.NetworkEndpoint;
import biz.kryukov.dev.endpoint.ParseEndpointException;
import biz.kryukov.dev.endpoint.Scheme;

import com.google.common.base.CharMatcher;
import com.google.common.net.InetAddresses;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parser for endpoint connection strings.
 *
 * <p>Order of evaluation:
 * <ol>
 *   <li>{@code unix://} and {@code file://} prefixes: the remainder is kept verbatim as the path
 *       text, with no decoding, normalization or validation</li>
 *   <li>Generic URI syntax; a host is required, so {@code http:///path} is rejected</li>
 *   <li>Host classification: IP literal or domain name</li>
 *   <li>Port: explicit, else the scheme's default port, else failure</li>
 *   <li>Scheme match against the supported network schemes</li>
 * </ol>
 */
public final class EndpointParser {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointParser.class);

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private EndpointParser() {}

    /**
     * Parses a connection string into an endpoint.
     *
     * @param input connection string
     * @return parsed endpoint
     * @throws InvalidAddressException if the input is not a URL, has no host, or has no usable port
     * @throws InvalidSchemeException  if the URL scheme is not supported
     */
    public static Endpoint parse(String input) throws ParseEndpointException {
        if (input == null) {
            throw new InvalidAddressException("null");
        }

        // Path schemes are matched by prefix only; they need not be valid URIs.
        if (input.startsWith(Scheme.UNIX.prefix())) {
            return Endpoint.unix(input.substring(Scheme.UNIX.prefix().length()));
        }
        if (input.startsWith(Scheme.FILE.prefix())) {
            return Endpoint.file(input.substring(Scheme.FILE.prefix().length()));
        }

        URI uri;
        try {
            uri = new URI(input);
        } catch (URISyntaxException e) {
            LOG.debug("Rejected endpoint '{}': {}", input, e.getMessage());
            throw new InvalidAddressException(input, e);
        }
        if (uri.getScheme() == null || uri.isOpaque()) {
            throw reject(input, "no scheme or authority");
        }

        HostPort hp = extractHostPort(uri, input);
        HostAddr host = HostAddr.of(hp.host());

        String label = uri.getScheme();
        Optional<Scheme> scheme = Scheme.fromLabel(label).filter(Scheme::isNetwork);

        int port;
        if (hp.port() >= 0) {
            port = hp.port();
        } else {
            OptionalInt defaultPort = scheme.map(Scheme::defaultPort).orElse(OptionalInt.empty());
            if (defaultPort.isEmpty()) {
                LOG.debug("Rejected endpoint '{}': no port and no default port for scheme '{}'",
                        input, label);
                throw new MissingPortException(input, scheme.orElse(null));
            }
            port = defaultPort.getAsInt();
        }

        if (scheme.isEmpty()) {
            LOG.debug("Rejected endpoint '{}': unsupported scheme '{}'", input, label);
            throw new InvalidSchemeException(label);
        }
        return new NetworkEndpoint(scheme.get(), host, port);
    }

    /**
     * Extracts host and port. Uses the server-based authority when {@link URI} could derive one,
     * otherwise splits the raw authority (e.g. host names containing {@code _}).
     * A port of {@code -1} means the URL has none.
     */
    private static HostPort extractHostPort(URI uri, String input) throws InvalidAddressException {
        if (uri.getHost() != null && !uri.getHost().isEmpty()) {
            if (uri.getPort() > NetworkEndpoint.MAX_PORT) {
                throw reject(input, "port out of range (0-65535): " + uri.getPort());
            }
            return new HostPort(uri.getHost(), uri.getPort());
        }
        String authority = uri.getRawAuthority();
        if (authority == null || authority.isEmpty()) {
            throw reject(input, "no host");
        }

        // Strip userinfo (user:pass@)
        int atSign = authority.lastIndexOf('@');
        String hostPort = atSign >= 0 ? authority.substring(atSign + 1) : authority;

        String host;
        String port;
        if (hostPort.startsWith("[")) {
            // IPv6: [::1]:port
            int closeBracket = hostPort.indexOf(']');
            if (closeBracket < 0) {
                throw reject(input, "unterminated IPv6 literal");
            }
            host = hostPort.substring(0, closeBracket + 1);
            if (!InetAddresses.isInetAddress(host.substring(1, closeBracket))) {
                throw reject(input, "invalid IPv6 literal");
            }
            String remainder = hostPort.substring(closeBracket + 1);
            if (remainder.isEmpty()) {
                port = "";
            } else if (remainder.startsWith(":")) {
                port = remainder.substring(1);
            } else {
                throw reject(input, "garbage after IPv6 literal");
            }
        } else {
            int lastColon = hostPort.lastIndexOf(':');
            host = lastColon >= 0 ? hostPort.substring(0, lastColon) : hostPort;
            port = lastColon >= 0 ? hostPort.substring(lastColon + 1) : "";
            // IPv6 must be bracketed; any other colon left in the host is ambiguous
            if (host.indexOf(':') >= 0) {
                throw reject(input, "invalid host");
            }
        }

        if (host.isEmpty()) {
            throw reject(input, "empty host");
        }
        return new HostPort(host, parsePort(port, input));
    }

    private static int parsePort(String port, String input) throws InvalidAddressException {
        if (port.isEmpty()) {
            return -1;
        }
        if (!DIGITS.matchesAllOf(port) || port.length() > 5) {
            throw reject(input, "invalid port '" + port + "'");
        }
        int value = Integer.parseInt(port);
        if (value > NetworkEndpoint.MAX_PORT) {
            throw reject(input, "port out of range (0-65535): " + value);
        }
        return value;
    }

    private static InvalidAddressException reject(String input, String reason) {
        LOG.debug("Rejected endpoint '{}': {}", input, reason);
        return new InvalidAddressException(input);
    }

    private record HostPort(String host, int port) {}
}
