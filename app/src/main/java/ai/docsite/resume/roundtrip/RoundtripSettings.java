package ai.docsite.resume.roundtrip;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Thresholds and artifact handling for roundtrip runs.
 *
 * @param workRoot directory under which each run gets its own work directory
 * @param keepAll keep artifacts of passing runs as well
 */
public record RoundtripSettings(int maxTextDiffs, int maxStructureDiffs, Path workRoot, boolean keepAll) {

    public RoundtripSettings {
        if (maxTextDiffs < 0 || maxStructureDiffs < 0) {
            throw new IllegalArgumentException("Diff thresholds must not be negative");
        }
        Objects.requireNonNull(workRoot, "workRoot");
    }
}
