package fr.lapetina.possibility.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Accumulated output of one possibility.
 * Immutable; every token produces a new instance.
 */
public record PossibilityResult(
        String id,
        String provider,
        String model,
        double temperature,
        String systemInstruction,
        String content,
        Double probability,
        JsonNode logprobs,
        Instant createdAt,
        Instant completedAt
) {
    public PossibilityResult {
        Objects.requireNonNull(id, "Possibility ID is required");
        if (content == null) {
            content = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates an empty result for the given possibility.
     */
    public static PossibilityResult empty(PossibilityMetadata metadata) {
        return new PossibilityResult(
                metadata.id(),
                metadata.provider(),
                metadata.model(),
                metadata.temperature(),
                metadata.hasSystemInstruction() ? metadata.systemInstruction().name() : null,
                "",
                null,
                null,
                Instant.now(),
                null
        );
    }

    public PossibilityResult appendToken(String token) {
        if (token == null || token.isEmpty()) {
            return this;
        }
        return new PossibilityResult(id, provider, model, temperature, systemInstruction,
                content + token, probability, logprobs, createdAt, completedAt);
    }

    public PossibilityResult withProbability(Double probability, JsonNode logprobs) {
        return new PossibilityResult(id, provider, model, temperature, systemInstruction,
                content, probability, logprobs, createdAt, completedAt);
    }

    public PossibilityResult completed(Instant at) {
        return new PossibilityResult(id, provider, model, temperature, systemInstruction,
                content, probability, logprobs, createdAt, at);
    }

    public boolean hasLogprobs() {
        return logprobs != null && !logprobs.isNull();
    }

    public boolean isComplete() {
        return completedAt != null;
    }
}
