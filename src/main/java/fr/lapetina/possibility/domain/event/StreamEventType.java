package fr.lapetina.possibility.domain.event;

import java.util.Optional;

/**
 * Recognised {@code type} values of the possibility stream.
 */
public enum StreamEventType {
    TOKEN("token"),
    PROBABILITY("probability"),
    POSSIBILITY_COMPLETE("possibility_complete"),
    ERROR("error"),
    DONE("done");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<StreamEventType> fromWireName(String name) {
        for (StreamEventType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
