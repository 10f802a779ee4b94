package fr.lapetina.possibility.infrastructure.metrics;

import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityStatus;
import fr.lapetina.possibility.lifecycle.GenerationState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters of the orchestrator, exposed in Prometheus format.
 *
 * Provides:
 * - Possibility outcome counters per provider, model and terminal status
 * - Error counters by provider and error type
 * - Stream duration timers per provider
 * - Active stream and queue depth gauges
 * - Lifecycle transition counters
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> streamTimers = new ConcurrentHashMap<>();
    private final Counter tokenCounter;

    private final AtomicInteger activeStreams = new AtomicInteger(0);
    private final AtomicInteger queueDepth = new AtomicInteger(0);

    public MetricsRegistry(String prefix, boolean bindJvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (bindJvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_active_streams", activeStreams, AtomicInteger::get)
                .description("Possibilities currently loading or streaming")
                .register(registry);

        Gauge.builder(prefix + "_queue_depth", queueDepth, AtomicInteger::get)
                .description("Possibilities waiting for a connection slot")
                .register(registry);

        this.tokenCounter = Counter.builder(prefix + "_tokens_total")
                .description("Tokens received across all possibilities")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("possibility");
    }

    /**
     * Counts a possibility reaching a terminal status.
     */
    public void incrementOutcome(String provider, String model, PossibilityStatus status) {
        String key = provider + ":" + model + ":" + status.name();
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_possibilities_total")
                        .description("Possibilities by terminal status")
                        .tag("provider", provider)
                        .tag("model", model)
                        .tag("status", status.name())
                        .register(registry)
        ).increment();
    }

    public void incrementErrorCount(String provider, ErrorType errorType) {
        String key = provider + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of possibility errors")
                        .tag("provider", provider)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void incrementTokens() {
        tokenCounter.increment();
    }

    /**
     * Records time from dispatch to completion of one possibility.
     */
    public void recordStreamDuration(String provider, Duration duration) {
        streamTimers.computeIfAbsent(provider, k ->
                Timer.builder(prefix + "_stream_duration")
                        .description("Possibility stream duration")
                        .tag("provider", provider)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(duration);
    }

    public void incrementTransition(GenerationState from, GenerationState to) {
        String key = from.name() + ":" + to.name();
        transitionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_lifecycle_transitions_total")
                        .description("Lifecycle state transitions")
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry)
        ).increment();
    }

    public void setActiveStreams(int value) {
        activeStreams.set(value);
    }

    public void setQueueDepth(int value) {
        queueDepth.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
