package fr.lapetina.possibility;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.possibility.domain.event.StreamEventParser;
import fr.lapetina.possibility.domain.metadata.PossibilityMetadataService;
import fr.lapetina.possibility.infrastructure.config.ConfigLoader;
import fr.lapetina.possibility.infrastructure.config.OrchestratorConfig;
import fr.lapetina.possibility.infrastructure.http.GenerationEndpoint;
import fr.lapetina.possibility.infrastructure.http.HttpGenerationEndpoint;
import fr.lapetina.possibility.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.possibility.lifecycle.GenerationLifecycleStateMachine;
import fr.lapetina.possibility.pool.PossibilityPool;
import fr.lapetina.possibility.round.GenerationRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     try (GenerationRound round = factory.newRound()) {
 *         round.start(conversation, settings);
 *         round.awaitTermination(Duration.ofMinutes(2));
 *     }
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final PossibilityMetadataService metadataService;
    private final GenerationEndpoint endpoint;
    private final PossibilityPool pool;

    protected OrchestratorFactory(OrchestratorConfig config, GenerationEndpoint endpointOverride) {
        this.config = config;

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        this.metadataService = new PossibilityMetadataService(config.getGeneration());

        // Allow endpoint override for testing
        this.endpoint = endpointOverride != null ? endpointOverride : createEndpoint();

        this.pool = PossibilityPool.builder()
                .fromConfig(config)
                .endpoint(endpoint)
                .parser(new StreamEventParser(new ObjectMapper(), config.getEndpoint().getDataPrefix()))
                .loadTimeEstimator(metadataService::estimateLoadingTime)
                .metrics(metricsRegistry)
                .build();

        log.info("OrchestratorFactory initialized: endpoint={}, maxConcurrentConnections={}, maxRetries={}",
                config.getEndpoint().getBaseUrl(),
                config.getPool().getMaxConcurrentConnections(),
                config.getLifecycle().getMaxRetries());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);
        return new OrchestratorFactory(new ConfigLoader(configPath).load(), null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    /**
     * Creates a factory from an already loaded configuration and endpoint.
     */
    public static OrchestratorFactory create(OrchestratorConfig config, GenerationEndpoint endpoint) {
        return new OrchestratorFactory(config, endpoint);
    }

    public OrchestratorFactory start() {
        pool.start();
        log.info("Orchestrator started");
        return this;
    }

    /**
     * Creates a round on the shared pool with its own state machine.
     * Rounds on one factory are meant to run one after the other.
     */
    public GenerationRound newRound() {
        GenerationLifecycleStateMachine machine = newStateMachine();
        return new GenerationRound(pool, machine, metadataService);
    }

    public GenerationLifecycleStateMachine newStateMachine() {
        GenerationLifecycleStateMachine machine =
                new GenerationLifecycleStateMachine(config.getLifecycle().getMaxRetries());
        if (metricsRegistry != null) {
            machine.onStateChange((newState, oldState, context, event) -> {
                if (newState != oldState) {
                    metricsRegistry.incrementTransition(oldState, newState);
                }
            });
        }
        return machine;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    public PossibilityPool getPool() {
        return pool;
    }

    public PossibilityMetadataService getMetadataService() {
        return metadataService;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public GenerationEndpoint getEndpoint() {
        return endpoint;
    }

    private GenerationEndpoint createEndpoint() {
        OrchestratorConfig.EndpointConfig endpointConfig = config.getEndpoint();
        return new HttpGenerationEndpoint(
                endpointConfig.getBaseUrl(),
                endpointConfig.getPathTemplate(),
                Duration.ofMillis(endpointConfig.getConnectTimeoutMs())
        );
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            pool.close();
        } catch (Exception e) {
            log.warn("Error closing possibility pool", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("OrchestratorFactory shut down");
    }
}
