package fr.lapetina.possibility.domain.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Parses one line of a possibility stream into a {@link StreamEvent}.
 *
 * Lines without the data prefix, unknown event types and malformed payloads
 * yield an empty result; malformed payloads are logged, never thrown.
 */
public final class StreamEventParser {

    private static final Logger log = LoggerFactory.getLogger(StreamEventParser.class);

    public static final String DEFAULT_DATA_PREFIX = "data: ";

    private final ObjectMapper objectMapper;
    private final String dataPrefix;

    public StreamEventParser(ObjectMapper objectMapper, String dataPrefix) {
        this.objectMapper = objectMapper;
        this.dataPrefix = dataPrefix;
    }

    public StreamEventParser() {
        this(new ObjectMapper(), DEFAULT_DATA_PREFIX);
    }

    public Optional<StreamEvent> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = stripLineEnding(line);
        if (!trimmed.startsWith(dataPrefix)) {
            return Optional.empty();
        }

        String payload = trimmed.substring(dataPrefix.length());
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed stream line: line={}, error={}", abbreviate(trimmed), e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject()) {
            log.warn("Skipping stream line without JSON object: line={}", abbreviate(trimmed));
            return Optional.empty();
        }

        String typeName = root.path("type").asText(null);
        Optional<StreamEventType> type = StreamEventType.fromWireName(typeName);
        if (type.isEmpty()) {
            log.debug("Ignoring stream event of unhandled type: type={}", typeName);
            return Optional.empty();
        }

        return toEvent(type.get(), root.path("data"), trimmed);
    }

    private Optional<StreamEvent> toEvent(StreamEventType type, JsonNode data, String line) {
        return switch (type) {
            case TOKEN -> {
                JsonNode token = data.get("token");
                if (token == null || !token.isTextual()) {
                    log.warn("Skipping token event without token text: line={}", abbreviate(line));
                    yield Optional.empty();
                }
                yield Optional.of(new StreamEvent.Token(token.asText()));
            }
            case PROBABILITY -> {
                JsonNode probability = data.get("probability");
                Double value = probability != null && probability.isNumber() ? probability.asDouble() : null;
                JsonNode logprobs = data.get("logprobs");
                if (logprobs != null && logprobs.isNull()) {
                    logprobs = null;
                }
                yield Optional.of(new StreamEvent.Probability(value, logprobs));
            }
            case POSSIBILITY_COMPLETE -> Optional.of(new StreamEvent.PossibilityComplete(data.path("id").asText(null)));
            case ERROR -> Optional.of(new StreamEvent.Error(data.path("message").asText("Unknown error")));
            case DONE -> Optional.of(new StreamEvent.Done());
        };
    }

    private static String stripLineEnding(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\r' || line.charAt(end - 1) == '\n')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static String abbreviate(String line) {
        return line.length() > 200 ? line.substring(0, 200) + "..." : line;
    }
}
