package ai.docsite.resume.roundtrip;

import java.nio.file.Path;

/**
 * Outcome of one roundtrip. Counts are {@code -1} when the run stopped before computing them.
 */
public record RoundtripReport(String file,
                              int textDiffs,
                              int structureDiffs,
                              boolean textPassed,
                              boolean structurePassed,
                              boolean passed,
                              String error,
                              long elapsedMillis,
                              Path workDir) {

    public static RoundtripReport error(String file, String error, long elapsedMillis, Path workDir) {
        return new RoundtripReport(file, -1, -1, false, false, false, error, elapsedMillis, workDir);
    }

    public boolean hasError() {
        return error != null;
    }
}
