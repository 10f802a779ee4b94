package fr.lapetina.possibility.domain.metadata;

import fr.lapetina.possibility.domain.model.SystemInstruction;

import java.util.List;
import java.util.Objects;

/**
 * User settings a round is generated from.
 *
 * @param systemPrompt       prompt shared by every possibility, may be null
 * @param enabledModels      provider/model pairs to query, in display order
 * @param temperatures       temperatures to try for every model; empty means the default
 * @param systemInstructions instructions to try; empty means the default instruction
 * @param maxTokens          token limit per possibility, null for the default
 */
public record GenerationSettings(
        String systemPrompt,
        List<ModelOption> enabledModels,
        List<Double> temperatures,
        List<SystemInstruction> systemInstructions,
        Integer maxTokens
) {
    public GenerationSettings {
        enabledModels = enabledModels != null ? List.copyOf(enabledModels) : List.of();
        temperatures = temperatures != null ? List.copyOf(temperatures) : List.of();
        systemInstructions = systemInstructions != null ? List.copyOf(systemInstructions) : List.of();
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }

    /**
     * A model offered by a provider.
     */
    public record ModelOption(String provider, String model) {
        public ModelOption {
            Objects.requireNonNull(provider, "Provider is required");
            Objects.requireNonNull(model, "Model is required");
        }
    }
}
