package ai.docsite.resume.config;

/**
 * What the converter does with its inputs.
 */
public enum Mode {
    PARSE,
    GENERATE,
    ROUNDTRIP;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ROUNDTRIP;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    /** Whether the mode converts exactly one input document. */
    public boolean isSingleDocument() {
        return this != ROUNDTRIP;
    }
}
