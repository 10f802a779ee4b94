package fr.lapetina.possibility.domain.model;

import java.util.Objects;

/**
 * A named system instruction that can be prepended to the conversation.
 */
public record SystemInstruction(
        String id,
        String name,
        String content,
        boolean enabled
) {
    public SystemInstruction {
        Objects.requireNonNull(id, "Instruction ID is required");
        if (name == null) {
            name = id;
        }
        if (content == null) {
            content = "";
        }
    }
}
