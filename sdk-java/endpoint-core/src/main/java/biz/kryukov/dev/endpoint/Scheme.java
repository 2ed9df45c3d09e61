package biz.kryukov.dev.endpoint;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supported endpoint schemes.
 *
 * <p>Thirteen network schemes carry a host and a port; {@link #UNIX} and {@link #FILE}
 * carry a filesystem path. Each constant also holds its default port, if any.
 */
public enum Scheme {
    HTTP("http", 80),
    HTTPS("https", 443),
    TCP("tcp", null),
    UDP("udp", null),
    MQTT("mqtt", 80),
    MQTTS("mqtts", 443),
    WS("ws", 80),
    WSS("wss", 443),
    COAP("coap", 80),
    COAPS("coaps", 443),
    REDIS("redis", 80),
    AMQP("amqp", 80),
    FTP("ftp", 80),
    UNIX("unix"),
    FILE("file");

    private static final Map<String, Scheme> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Scheme::label, Function.identity()));

    private final String label;
    private final boolean network;
    private final Integer defaultPort;

    Scheme(String label, Integer defaultPort) {
        this.label = label;
        this.network = true;
        this.defaultPort = defaultPort;
    }

    Scheme(String label) {
        this.label = label;
        this.network = false;
        this.defaultPort = null;
    }

    /** Returns the scheme name as written before {@code ://}. */
    public String label() {
        return label;
    }

    /** Returns {@code true} for host/port schemes, {@code false} for path schemes. */
    public boolean isNetwork() {
        return network;
    }

    /** Returns the port used when a URL of this scheme omits one. */
    public OptionalInt defaultPort() {
        return defaultPort == null ? OptionalInt.empty() : OptionalInt.of(defaultPort);
    }

    /** Finds a scheme by its exact name. Matching is case-sensitive. */
    public static Optional<Scheme> fromLabel(String label) {
        return Optional.ofNullable(label).map(BY_NAME::get);
    }

    /** Returns the URI prefix, e.g. {@code tcp://}. */
    public String prefix() {
        return label + "://";
    }
}
