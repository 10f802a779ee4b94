package fr.lapetina.possibility.domain.model;

/**
 * Queue admission tier for a possibility.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Parses a tier name case-insensitively, falling back to MEDIUM.
     */
    public static Priority fromString(String value) {
        if (value == null) {
            return MEDIUM;
        }
        return switch (value.trim().toLowerCase()) {
            case "high" -> HIGH;
            case "low" -> LOW;
            default -> MEDIUM;
        };
    }
}
