package fr.lapetina.possibility.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.possibility.domain.model.ChatMessage;
import fr.lapetina.possibility.domain.model.ErrorType;
import fr.lapetina.possibility.domain.model.PossibilityMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Generation endpoint reached over HTTP.
 *
 * One POST per possibility to {@code baseUrl + pathTemplate}, where {@code {id}} is
 * replaced by the possibility id. The response body stays open and is handed over as
 * a {@link GenerationStream}; non-2xx answers are turned into {@link GenerationException}.
 */
public class HttpGenerationEndpoint implements GenerationEndpoint {

    private static final Logger log = LoggerFactory.getLogger(HttpGenerationEndpoint.class);

    public static final String ID_PLACEHOLDER = "{id}";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String pathTemplate;

    public HttpGenerationEndpoint(String baseUrl, String pathTemplate, Duration connectTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.pathTemplate = pathTemplate.startsWith("/") ? pathTemplate : "/" + pathTemplate;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HttpGenerationEndpoint(String baseUrl) {
        this(baseUrl, "/api/possibility/" + ID_PLACEHOLDER, Duration.ofSeconds(10));
    }

    @Override
    public CompletableFuture<GenerationStream> open(PossibilityMetadata metadata, List<ChatMessage> conversation) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(metadata, conversation);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to build request: possibilityId={}", metadata.id(), e);
            return CompletableFuture.failedFuture(new GenerationException(
                    ErrorType.INTERNAL_ERROR, "Failed to build request: " + e.getMessage(), e));
        }

        log.debug("Opening possibility stream: possibilityId={}, provider={}, model={}, uri={}",
                metadata.id(), metadata.provider(), metadata.model(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream())
                .thenApply(response -> handleResponse(metadata, response));
    }

    URI buildUri(String possibilityId) {
        String encodedId = URLEncoder.encode(possibilityId, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUrl + pathTemplate.replace(ID_PLACEHOLDER, encodedId));
    }

    private HttpRequest buildHttpRequest(PossibilityMetadata metadata, List<ChatMessage> conversation)
            throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(buildUri(metadata.id()))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(metadata, conversation)))
                .build();
    }

    String buildRequestBody(PossibilityMetadata metadata, List<ChatMessage> conversation)
            throws JsonProcessingException {
        Map<String, Object> permutation = new LinkedHashMap<>();
        permutation.put("id", metadata.id());
        permutation.put("provider", metadata.provider());
        permutation.put("model", metadata.model());
        permutation.put("temperature", metadata.temperature());
        permutation.put("systemInstruction", metadata.systemInstruction());
        if (metadata.systemPrompt() != null) {
            permutation.put("systemPrompt", metadata.systemPrompt());
        }

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("maxTokens", metadata.estimatedTokens());
        options.put("stream", true);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("messages", conversation);
        body.put("permutation", permutation);
        body.put("options", options);

        return objectMapper.writeValueAsString(body);
    }

    private GenerationStream handleResponse(PossibilityMetadata metadata, HttpResponse<InputStream> response) {
        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            log.debug("Possibility stream opened: possibilityId={}, status={}", metadata.id(), statusCode);
            return new ReaderGenerationStream(response.body());
        }

        String message = readErrorMessage(response);
        ErrorType errorType = statusCode >= 400 && statusCode < 500 ? ErrorType.CLIENT_ERROR
                : statusCode >= 500 ? ErrorType.SERVER_ERROR
                : ErrorType.INTERNAL_ERROR;

        log.warn("Possibility request failed with HTTP error: possibilityId={}, provider={}, model={}, status={}, error={}",
                metadata.id(), metadata.provider(), metadata.model(), statusCode, message);
        throw new GenerationException(errorType, message, statusCode, null);
    }

    private String readErrorMessage(HttpResponse<InputStream> response) {
        String fallback = "HTTP " + response.statusCode();
        try (InputStream body = response.body()) {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                return fallback;
            }
            JsonNode errorBody = objectMapper.readTree(bytes);
            JsonNode error = errorBody != null ? errorBody.get("error") : null;
            if (error != null && error.isTextual()) {
                return error.asText();
            }
        } catch (IOException e) {
            log.debug("Error body not readable as JSON: status={}, error={}", response.statusCode(), e.getMessage());
        }
        return fallback;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static final class ReaderGenerationStream implements GenerationStream {

        private final InputStream body;
        private final BufferedReader reader;

        ReaderGenerationStream(InputStream body) {
            this.body = body;
            this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        }

        @Override
        public String readLine() throws IOException {
            return reader.readLine();
        }

        @Override
        public void close() throws IOException {
            body.close();
        }
    }
}
