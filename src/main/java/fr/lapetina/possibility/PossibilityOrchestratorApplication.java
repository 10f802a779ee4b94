package fr.lapetina.possibility;

import fr.lapetina.possibility.domain.metadata.GenerationSettings;
import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.PossibilityResult;
import fr.lapetina.possibility.infrastructure.config.OrchestratorConfig;
import fr.lapetina.possibility.lifecycle.GenerationState;
import fr.lapetina.possibility.round.GenerationRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: runs one round for a prompt against the configured endpoint.
 *
 * <pre>
 * java -jar possibility-orchestrator.jar config.yaml "Tell me a story"
 * </pre>
 */
public class PossibilityOrchestratorApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PossibilityOrchestratorApplication.class);

    private static final Duration ROUND_TIMEOUT = Duration.ofMinutes(5);

    private final OrchestratorFactory factory;

    public PossibilityOrchestratorApplication(String configPath) {
        log.info("Starting Possibility Orchestrator...");
        this.factory = OrchestratorFactory.create(configPath).start();
    }

    /**
     * Runs one round for the prompt and returns the completed possibilities, best first.
     */
    public List<PossibilityResult> run(String prompt) throws InterruptedException {
        GenerationSettings settings = settingsFromConfig(factory.getConfig().getGeneration());
        if (settings.enabledModels().isEmpty()) {
            throw new IllegalStateException("No models configured under generation.enabledModels");
        }

        try (GenerationRound round = factory.newRound()) {
            String requestId = round.start(List.of(ChatMessage.user(prompt)), settings);
            GenerationState state = round.awaitTermination(ROUND_TIMEOUT);
            if (!state.isTerminal()) {
                log.warn("Round timed out: requestId={}, timeout={}", requestId, ROUND_TIMEOUT);
                round.cancel("timeout");
            }
            log.info("Round finished: requestId={}, state={}, status={}",
                    requestId, round.getState(), round.getMachine().getStatus());
            return round.getCompletedPossibilities();
        }
    }

    static GenerationSettings settingsFromConfig(OrchestratorConfig.GenerationConfig config) {
        List<GenerationSettings.ModelOption> models = new ArrayList<>();
        for (String entry : config.getEnabledModels()) {
            int separator = entry.indexOf('/');
            if (separator <= 0 || separator == entry.length() - 1) {
                log.warn("Ignoring malformed model entry, expected provider/model: entry={}", entry);
                continue;
            }
            models.add(new GenerationSettings.ModelOption(entry.substring(0, separator), entry.substring(separator + 1)));
        }
        return new GenerationSettings(null, models, config.getTemperatures(), List.of(), config.getDefaultMaxTokens());
    }

    public OrchestratorFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        log.info("Shutting down Possibility Orchestrator...");
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }
        log.info("Possibility Orchestrator shut down");
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            log.error("Usage: PossibilityOrchestratorApplication <config.yaml> <prompt>");
            System.exit(2);
        }

        try (PossibilityOrchestratorApplication app = new PossibilityOrchestratorApplication(args[0])) {
            List<PossibilityResult> results = app.run(args[1]);
            for (PossibilityResult result : results) {
                log.info("Possibility: id={}, probability={}, content={}",
                        result.id(), result.probability(), result.content());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for the round");
            System.exit(1);
        } catch (Exception e) {
            log.error("Failed to run Possibility Orchestrator", e);
            System.exit(1);
        }
    }
}
