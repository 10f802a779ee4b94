package fr.lapetina.possibility.infrastructure.http;

import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Streaming service producing the text of one possibility.
 *
 * The returned future completes once the response body is readable, or exceptionally
 * with a {@link GenerationException} when the endpoint refuses the request.
 * Cancelling the future aborts the pending exchange.
 */
public interface GenerationEndpoint {

    CompletableFuture<GenerationStream> open(PossibilityMetadata metadata, List<ChatMessage> conversation);
}
