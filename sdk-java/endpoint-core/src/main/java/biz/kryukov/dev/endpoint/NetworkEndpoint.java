package biz.kryukov.dev.endpoint;

import biz.kryukov.dev.endpoint.parser.EndpointFormatter;

import java.util.Objects;

/**
 * Host/port endpoint of one of the network schemes ({@code http}, {@code tcp}, {@code mqtt}, ...).
 */
public record NetworkEndpoint(Scheme scheme, HostAddr host, int port) implements Endpoint {

    public static final int MAX_PORT = 65535;

    public NetworkEndpoint {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        if (!scheme.isNetwork()) {
            throw new IllegalArgumentException("scheme " + scheme.label() + " has no host/port");
        }
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException("port out of range (0-65535): " + port);
        }
    }

    @Override
    public String toString() {
        return EndpointFormatter.format(this);
    }
}
