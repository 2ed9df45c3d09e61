package biz.kryukov.dev.endpoint.resolver;

import biz.kryukov.dev.endpoint.Endpoint;
import biz.kryukov.dev.endpoint.HostAddr;
import biz.kryukov.dev.endpoint.InvalidAddressException;
import biz.kryukov.dev.endpoint.NetworkEndpoint;
import biz.kryukov.dev.endpoint.ParseEndpointException;
import biz.kryukov.dev.endpoint.metrics.ResolutionMetrics;
import biz.kryukov.dev.endpoint.metrics.ResolutionMetrics.Outcome;

import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Resolves network endpoints to socket addresses.
 *
 * <p>IP literals are returned as-is without a lookup. Domain names go through a blocking
 * {@link HostLookup} on the calling thread; the result order is kept and duplicates are not
 * removed. There is no timeout or retry: callers wrap the call if they need either.
 *
 * <p>Path endpoints ({@code unix://}, {@code file://}) have no socket address and always fail.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class EndpointResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointResolver.class);

    /** Detail of the failure raised for path endpoints. */
    public static final String NO_SOCKET_ADDRESS = "No SocketAddr available";

    private static final EndpointResolver DEFAULT = builder().build();

    private final HostLookup lookup;
    private final ResolutionMetrics metrics;

    private EndpointResolver(HostLookup lookup, ResolutionMetrics metrics) {
        this.lookup = lookup;
        this.metrics = metrics;
    }

    /** Resolver using the system name service, without metrics. */
    public static EndpointResolver defaultResolver() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves an endpoint to socket addresses.
     *
     * @param endpoint endpoint to resolve
     * @return one address for an IP literal, every looked-up address for a domain name
     * @throws InvalidAddressException if the endpoint is a path endpoint
     *                                 or the domain name cannot be resolved
     */
    public List<InetSocketAddress> resolve(Endpoint endpoint) throws InvalidAddressException {
        Objects.requireNonNull(endpoint, "endpoint");
        if (!(endpoint instanceof NetworkEndpoint ne)) {
            LOG.debug("Endpoint {} has no socket address", endpoint);
            record(endpoint, Outcome.UNSUPPORTED);
            throw new InvalidAddressException(NO_SOCKET_ADDRESS);
        }

        if (ne.host() instanceof HostAddr.Ip ip) {
            record(ne, Outcome.LITERAL);
            return List.of(new InetSocketAddress(ip.address(), ne.port()));
        }

        String domain = ((HostAddr.Domain) ne.host()).name();
        long startNs = System.nanoTime();
        InetAddress[] addresses;
        try {
            addresses = lookup.lookup(domain);
        } catch (UnknownHostException e) {
            observe(ne, startNs);
            record(ne, Outcome.ERROR);
            LOG.warn("Failed to resolve {} for {}: {}", domain, ne, e.getMessage());
            throw new InvalidAddressException(domain, e);
        }
        observe(ne, startNs);
        record(ne, Outcome.RESOLVED);

        List<InetSocketAddress> result = new ArrayList<>(addresses.length);
        for (InetAddress address : addresses) {
            result.add(new InetSocketAddress(address, ne.port()));
        }
        LOG.debug("Resolved {} to {}", ne, result);
        return Collections.unmodifiableList(result);
    }

    /**
     * Parses and resolves a connection string in one step.
     *
     * @throws ParseEndpointException if parsing or resolution fails
     */
    public List<InetSocketAddress> resolve(String input) throws ParseEndpointException {
        return resolve(Endpoint.parse(input));
    }

    private void record(Endpoint endpoint, Outcome outcome) {
        if (metrics != null) {
            metrics.recordOutcome(endpoint.scheme(), outcome);
        }
    }

    private void observe(NetworkEndpoint endpoint, long startNs) {
        if (metrics != null) {
            metrics.observeLatency(endpoint.scheme(), Duration.ofNanos(System.nanoTime() - startNs));
        }
    }

    public static final class Builder {
        private HostLookup lookup = HostLookup.SYSTEM;
        private MeterRegistry meterRegistry;

        private Builder() {}

        /** Replaces the name service, e.g. with a stub in tests. */
        public Builder lookup(HostLookup lookup) {
            this.lookup = Objects.requireNonNull(lookup, "lookup");
            return this;
        }

        /** Enables resolution metrics in the given registry. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public EndpointResolver build() {
            ResolutionMetrics metrics = meterRegistry == null ? null : new ResolutionMetrics(meterRegistry);
            return new EndpointResolver(lookup, metrics);
        }
    }
}
