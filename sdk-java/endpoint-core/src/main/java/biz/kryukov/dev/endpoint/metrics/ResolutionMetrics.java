package biz.kryukov.dev.endpoint.metrics;

import biz.kryukov.dev.endpoint.Scheme;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exports endpoint resolution metrics to a Micrometer MeterRegistry.
 *
 * <p>Metrics exported:
 * <ul>
 *   <li>{@code endpoint_resolution_total}: Counter, tags {@code scheme}, {@code outcome}</li>
 *   <li>{@code endpoint_resolution_latency_seconds}: Histogram of name lookups, tag {@code scheme}</li>
 * </ul>
 */
public final class ResolutionMetrics {

    private static final String RESOLUTION_METRIC = "endpoint_resolution_total";
    private static final String LATENCY_METRIC = "endpoint_resolution_latency_seconds";
    private static final String RESOLUTION_DESCRIPTION =
            "Number of endpoint resolutions by outcome";
    private static final String LATENCY_DESCRIPTION =
            "Latency of host name lookups in seconds";

    private static final double[] LATENCY_SLOS = {0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0};

    /** Result of a single resolution. */
    public enum Outcome {
        /** IP literal, no lookup performed. */
        LITERAL,
        /** Domain name resolved. */
        RESOLVED,
        /** Domain name lookup failed. */
        ERROR,
        /** Path endpoint, nothing to resolve. */
        UNSUPPORTED;

        /** Returns the tag value. */
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Scheme, DistributionSummary> latencySummaries =
            new ConcurrentHashMap<>();

    public ResolutionMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Increments the resolution counter for the scheme and outcome. */
    public void recordOutcome(Scheme scheme, Outcome outcome) {
        String key = scheme.label() + ":" + outcome.label();
        counters.computeIfAbsent(key, k -> Counter.builder(RESOLUTION_METRIC)
                        .description(RESOLUTION_DESCRIPTION)
                        .tags(Tags.of("scheme", scheme.label(), "outcome", outcome.label()))
                        .register(registry))
                .increment();
    }

    /** Records the duration of a host name lookup. */
    public void observeLatency(Scheme scheme, Duration duration) {
        DistributionSummary summary = latencySummaries.computeIfAbsent(scheme, s ->
                DistributionSummary.builder(LATENCY_METRIC)
                        .description(LATENCY_DESCRIPTION)
                        .tags(Tags.of("scheme", s.label()))
                        .serviceLevelObjectives(LATENCY_SLOS)
                        .register(registry));
        summary.record(duration.toNanos() / 1_000_000_000.0);
    }
}
