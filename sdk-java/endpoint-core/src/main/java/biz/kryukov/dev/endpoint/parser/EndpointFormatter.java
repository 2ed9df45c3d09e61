package biz.kryukov.dev.endpoint.parser;

import biz.kryukov.dev.endpoint.Endpoint;
import biz.kryukov.dev.endpoint.NetworkEndpoint;
import biz.kryukov.dev.endpoint.PathEndpoint;

/**
 * Renders endpoints in canonical form, the inverse of {@link EndpointParser}.
 *
 * <p>Network endpoints always carry an explicit port, e.g. {@code http://example.com:80};
 * IPv6 hosts are bracketed. Path endpoints render as {@code unix://<path>} or {@code file://<path>},
 * with the path text unchanged.
 */
public final class EndpointFormatter {

    private EndpointFormatter() {}

    public static String format(Endpoint endpoint) {
        if (endpoint instanceof NetworkEndpoint ne) {
            return ne.scheme().prefix() + authority(ne);
        }
        PathEndpoint pe = (PathEndpoint) endpoint;
        return pe.scheme().prefix() + pe.location();
    }

    /** Returns {@code host:port}, with IPv6 hosts in brackets. */
    public static String authority(NetworkEndpoint endpoint) {
        return endpoint.host().uriText() + ":" + endpoint.port();
    }
}
