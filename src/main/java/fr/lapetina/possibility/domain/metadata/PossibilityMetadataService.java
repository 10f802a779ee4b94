package fr.lapetina.possibility.domain.metadata;

import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.Priority;
import fr.lapetina.possibility.domain.model.SystemInstruction;
import fr.lapetina.possibility.infrastructure.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands user settings into the possibilities of a round.
 *
 * One possibility per (model, temperature, system instruction) combination, each with
 * a priority tier and a loading time estimate used to order and display the round.
 */
public final class PossibilityMetadataService {

    private static final Logger log = LoggerFactory.getLogger(PossibilityMetadataService.class);

    public static final SystemInstruction DEFAULT_SYSTEM_INSTRUCTION = new SystemInstruction(
            "default",
            "default",
            "You are a helpful, creative, and insightful AI assistant. You provide clear, accurate, "
                    + "and thoughtful responses while considering multiple perspectives.",
            true
    );

    private static final double STANDARD_TEMPERATURE = 0.7;
    private static final double STANDARD_TEMPERATURE_TOLERANCE = 0.1;

    private final Set<String> popularModels;
    private final Map<String, Integer> providerBaseLoadMs;
    private final int defaultBaseLoadMs;
    private final int defaultMaxTokens;
    private final double defaultTemperature;

    public PossibilityMetadataService(OrchestratorConfig.GenerationConfig config) {
        this.popularModels = Set.copyOf(config.getPopularModels());
        this.providerBaseLoadMs = Map.copyOf(config.getProviderBaseLoadMs());
        this.defaultBaseLoadMs = config.getDefaultBaseLoadMs();
        this.defaultMaxTokens = config.getDefaultMaxTokens();
        this.defaultTemperature = config.getDefaultTemperature();
    }

    public PossibilityMetadataService() {
        this(new OrchestratorConfig.GenerationConfig());
    }

    /**
     * Builds metadata for every possibility of the settings, in generation order.
     */
    public List<PossibilityMetadata> generateMetadata(GenerationSettings settings) {
        List<Double> temperatures = settings.temperatures().isEmpty()
                ? List.of(defaultTemperature)
                : settings.temperatures();
        List<SystemInstruction> instructions = settings.systemInstructions().isEmpty()
                ? List.of(DEFAULT_SYSTEM_INSTRUCTION)
                : settings.systemInstructions();
        int maxTokens = settings.maxTokens() != null ? settings.maxTokens() : defaultMaxTokens;

        List<PossibilityMetadata> result = new ArrayList<>();
        for (GenerationSettings.ModelOption option : settings.enabledModels()) {
            for (double temperature : temperatures) {
                for (SystemInstruction instruction : instructions) {
                    result.add(PossibilityMetadata.builder()
                            .id(permutationId(option.provider(), option.model(), temperature, instruction))
                            .provider(option.provider())
                            .model(option.model())
                            .temperature(temperature)
                            .systemInstruction(instruction)
                            .systemPrompt(settings.systemPrompt())
                            .priority(calculatePriority(option.model(), temperature, instruction))
                            .order(result.size())
                            .estimatedTokens(maxTokens)
                            .build());
                }
            }
        }

        log.debug("Generated possibility metadata: models={}, temperatures={}, instructions={}, total={}",
                settings.enabledModels().size(), temperatures.size(), instructions.size(), result.size());
        return result;
    }

    /**
     * Same as {@link #generateMetadata} sorted HIGH first, keeping generation order within a tier.
     */
    public List<PossibilityMetadata> generatePrioritizedMetadata(GenerationSettings settings) {
        List<PossibilityMetadata> metadata = new ArrayList<>(generateMetadata(settings));
        metadata.sort(Comparator.comparing(PossibilityMetadata::priority)
                .thenComparingInt(PossibilityMetadata::order));
        return metadata;
    }

    public Optional<PossibilityMetadata> findById(GenerationSettings settings, String id) {
        return generateMetadata(settings).stream()
                .filter(m -> m.id().equals(id))
                .findFirst();
    }

    public int countPossibilities(GenerationSettings settings) {
        int temperatures = Math.max(1, settings.temperatures().size());
        int instructions = Math.max(1, settings.systemInstructions().size());
        return settings.enabledModels().size() * temperatures * instructions;
    }

    /**
     * Builds {@code provider_model_temp{t}_inst-{id}}, with non alphanumeric model
     * characters replaced by '-'.
     */
    public static String permutationId(String provider, String model, double temperature,
                                       SystemInstruction instruction) {
        return String.join("_",
                provider,
                model.replaceAll("[^a-zA-Z0-9]", "-"),
                "temp" + formatTemperature(temperature),
                instruction != null ? "inst-" + instruction.id() : "no-inst");
    }

    static String formatTemperature(double temperature) {
        return BigDecimal.valueOf(temperature).stripTrailingZeros().toPlainString();
    }

    /**
     * HIGH: popular model at standard temperature without instruction.
     * MEDIUM: popular model or standard temperature. LOW otherwise.
     */
    Priority calculatePriority(String model, double temperature, SystemInstruction instruction) {
        boolean popular = popularModels.contains(model);
        boolean standardTemperature = Math.abs(temperature - STANDARD_TEMPERATURE) < STANDARD_TEMPERATURE_TOLERANCE;

        if (popular && standardTemperature && instruction == null) {
            return Priority.HIGH;
        }
        if (popular || standardTemperature) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    /**
     * Expected time before the first tokens arrive.
     */
    public Duration estimateLoadingTime(PossibilityMetadata metadata) {
        int baseTime = providerBaseLoadMs.getOrDefault(metadata.provider(), defaultBaseLoadMs);
        double modelMultiplier = modelSizeMultiplier(metadata.model());
        double temperatureMultiplier = 1 + metadata.temperature() * 0.2;
        double instructionMultiplier = metadata.hasSystemInstruction() ? 1.2 : 1.0;

        long millis = Math.round(baseTime * modelMultiplier * temperatureMultiplier * instructionMultiplier);
        return Duration.ofMillis(millis);
    }

    private static double modelSizeMultiplier(String model) {
        if (model.contains("gpt-4o") && !model.contains("mini")) {
            return 1.5;
        }
        if (model.contains("claude-3-5-sonnet")) {
            return 1.4;
        }
        if (model.contains("gemini-1.5-pro")) {
            return 1.3;
        }
        if (model.contains("mini") || model.contains("flash") || model.contains("haiku")) {
            return 0.8;
        }
        return 1.0;
    }
}
