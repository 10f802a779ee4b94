package fr.lapetina.possibility.pool;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import fr.lapetina.possibility.domain.model.Priority;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ring buffer slot of the pool loop.
 *
 * Mutable and reused: a publisher fills the slot, the loop applies it and clears it.
 * Never read outside the loop.
 */
public final class PoolCommand {

    private PoolCommandType type;
    private String possibilityId;
    private Priority priority;
    private List<PossibilityMetadata> metadataList;
    private List<ChatMessage> conversation;
    private CancellationHandle handle;
    private String token;
    private Double probability;
    private JsonNode logprobs;
    private ErrorType errorType;
    private String errorMessage;

    // Completed by the loop once applied; null for fire-and-forget task reports
    private CompletableFuture<Void> completion;

    public void clear() {
        this.type = null;
        this.possibilityId = null;
        this.priority = null;
        this.metadataList = null;
        this.conversation = null;
        this.handle = null;
        this.token = null;
        this.probability = null;
        this.logprobs = null;
        this.errorType = null;
        this.errorMessage = null;
        this.completion = null;
    }

    public PoolCommand initialize(PoolCommandType type, String possibilityId) {
        clear();
        this.type = type;
        this.possibilityId = possibilityId;
        return this;
    }

    public PoolCommandType getType() {
        return type;
    }

    public String getPossibilityId() {
        return possibilityId;
    }

    public Priority getPriority() {
        return priority;
    }

    public PoolCommand priority(Priority priority) {
        this.priority = priority;
        return this;
    }

    public List<PossibilityMetadata> getMetadataList() {
        return metadataList;
    }

    public List<ChatMessage> getConversation() {
        return conversation;
    }

    public PoolCommand round(List<PossibilityMetadata> metadataList, List<ChatMessage> conversation) {
        this.metadataList = metadataList;
        this.conversation = conversation;
        return this;
    }

    public CancellationHandle getHandle() {
        return handle;
    }

    public PoolCommand handle(CancellationHandle handle) {
        this.handle = handle;
        return this;
    }

    public String getToken() {
        return token;
    }

    public PoolCommand token(String token) {
        this.token = token;
        return this;
    }

    public Double getProbability() {
        return probability;
    }

    public JsonNode getLogprobs() {
        return logprobs;
    }

    public PoolCommand probability(Double probability, JsonNode logprobs) {
        this.probability = probability;
        this.logprobs = logprobs;
        return this;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public PoolCommand error(ErrorType errorType, String errorMessage) {
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        return this;
    }

    public CompletableFuture<Void> getCompletion() {
        return completion;
    }

    public PoolCommand completion(CompletableFuture<Void> completion) {
        this.completion = completion;
        return this;
    }

    @Override
    public String toString() {
        return "PoolCommand{" +
                "type=" + type +
                ", possibilityId='" + possibilityId + '\'' +
                '}';
    }
}
