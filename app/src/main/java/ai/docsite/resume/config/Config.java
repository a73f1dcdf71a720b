package ai.docsite.resume.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param inputs documents or directories to convert; directories are only accepted in roundtrip mode
 * @param output target file for parse and generate; empty means standard output
 * @param typesDir directory overriding the bundled type store
 * @param profile contact profile replacing the bundled default
 */
public record Config(
        Mode mode,
        List<Path> inputs,
        Optional<Path> output,
        int maxTextDiffs,
        int maxStructureDiffs,
        Path workDir,
        boolean keepAll,
        Optional<Path> typesDir,
        Optional<Path> profile,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input file must be provided");
        }
        if (mode.isSingleDocument() && inputs.size() != 1) {
            throw new IllegalArgumentException(mode.name().toLowerCase(Locale.ROOT) + " mode takes exactly one input file");
        }
        output = output == null ? Optional.empty() : output;
        if (maxTextDiffs < 0 || maxStructureDiffs < 0) {
            throw new IllegalArgumentException("Diff thresholds must be zero or greater");
        }
        Objects.requireNonNull(workDir, "workDir");
        typesDir = typesDir == null ? Optional.empty() : typesDir;
        profile = profile == null ? Optional.empty() : profile;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }
}
