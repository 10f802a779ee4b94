package fr.lapetina.possibility.domain.model;

import java.util.Objects;

/**
 * Immutable description of one generation task of a round.
 * Created once per round from user settings and never mutated.
 */
public record PossibilityMetadata(
        String id,
        String provider,
        String model,
        double temperature,
        SystemInstruction systemInstruction,
        String systemPrompt,
        Priority priority,
        int order,
        int estimatedTokens
) {
    public PossibilityMetadata {
        Objects.requireNonNull(id, "Possibility ID is required");
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(model, "Model is required");
        if (priority == null) {
            priority = Priority.MEDIUM;
        }
        if (estimatedTokens <= 0) {
            throw new IllegalArgumentException("estimatedTokens must be positive: " + estimatedTokens);
        }
    }

    public boolean hasSystemInstruction() {
        return systemInstruction != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String provider;
        private String model;
        private double temperature = 0.7;
        private SystemInstruction systemInstruction;
        private String systemPrompt;
        private Priority priority = Priority.MEDIUM;
        private int order;
        private int estimatedTokens = 100;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder systemInstruction(SystemInstruction systemInstruction) {
            this.systemInstruction = systemInstruction;
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder order(int order) {
            this.order = order;
            return this;
        }

        public Builder estimatedTokens(int estimatedTokens) {
            this.estimatedTokens = estimatedTokens;
            return this;
        }

        public PossibilityMetadata build() {
            return new PossibilityMetadata(
                    id, provider, model, temperature, systemInstruction,
                    systemPrompt, priority, order, estimatedTokens
            );
        }
    }
}
