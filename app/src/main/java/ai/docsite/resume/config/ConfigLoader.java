package ai.docsite.resume.config;

import ai.docsite.resume.cli.CliArguments;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_TYPES_PATH = "RESUME_COMPONENT_TYPES_PATH";
    static final String ENV_PROFILE_PATH = "USER_PROFILE_PATH";
    static final String ENV_LOGS_PATH = "LOGS_PATH";
    static final String ENV_MAX_LATEX_DIFFS = "MAX_LATEX_DIFFS";
    static final String ENV_MAX_YAML_DIFFS = "MAX_YAML_DIFFS";

    static final int DEFAULT_MAX_TEXT_DIFFS = 6;
    static final int DEFAULT_MAX_STRUCTURE_DIFFS = 0;
    static final String DEFAULT_WORK_DIR = "roundtrip-artifacts";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        int maxTextDiffs = resolveThreshold(arguments.maxTextDiffs(), ENV_MAX_LATEX_DIFFS, DEFAULT_MAX_TEXT_DIFFS);
        int maxStructureDiffs = resolveThreshold(arguments.maxStructureDiffs(), ENV_MAX_YAML_DIFFS,
                DEFAULT_MAX_STRUCTURE_DIFFS);
        Path workDir = Optional.ofNullable(arguments.workDir())
                .or(() -> envPath(ENV_LOGS_PATH))
                .orElse(Path.of(DEFAULT_WORK_DIR));
        Optional<Path> typesDir = Optional.ofNullable(arguments.typesDir()).or(() -> envPath(ENV_TYPES_PATH));
        Optional<Path> profile = Optional.ofNullable(arguments.profile()).or(() -> envPath(ENV_PROFILE_PATH));

        return new Config(mode, arguments.inputs(), Optional.ofNullable(arguments.output()), maxTextDiffs,
                maxStructureDiffs, workDir, arguments.keepAll(), typesDir, profile, logFormat);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.ROUNDTRIP);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveThreshold(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new IllegalArgumentException("Diff thresholds must be zero or greater");
            }
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseNonNegativeInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private Optional<Path> envPath(String envKey) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of);
    }

    private static int parseNonNegativeInteger(String raw, String envKey) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(envKey + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
