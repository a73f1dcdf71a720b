package ai.docsite.resume.cli;

import ai.docsite.resume.config.LogFormat;
import ai.docsite.resume.config.Mode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "resume-converter", mixinStandardHelpOptions = true,
        description = "Converts LaTeX résumés to structured YAML and back, and validates the roundtrip")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class,
            description = "parse (LaTeX to YAML), generate (YAML to LaTeX) or roundtrip (default)")
    private Mode mode;

    @CommandLine.Parameters(paramLabel = "INPUT", arity = "0..*",
            description = "Input file; roundtrip also accepts several files and directories of .tex files")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE",
            description = "Output file for parse and generate (default: standard output)")
    private Path output;

    @CommandLine.Option(names = "--max-text-diffs", paramLabel = "COUNT",
            description = "Changed LaTeX lines tolerated by a roundtrip (default: 6)")
    private Integer maxTextDiffs;

    @CommandLine.Option(names = "--max-structure-diffs", paramLabel = "COUNT",
            description = "Differing YAML leaves tolerated by a roundtrip (default: 0)")
    private Integer maxStructureDiffs;

    @CommandLine.Option(names = "--work-dir", paramLabel = "DIR",
            description = "Directory for roundtrip artifacts (default: roundtrip-artifacts)")
    private Path workDir;

    @CommandLine.Option(names = "--keep-all", description = "Keep roundtrip artifacts of passing documents")
    private boolean keepAll;

    @CommandLine.Option(names = "--types-dir", paramLabel = "DIR",
            description = "Type store directory overriding the bundled types")
    private Path typesDir;

    @CommandLine.Option(names = "--profile", paramLabel = "FILE", description = "Contact profile YAML file")
    private Path profile;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Mode mode() {
        return mode;
    }

    public List<Path> inputs() {
        return inputs;
    }

    public Path output() {
        return output;
    }

    public Integer maxTextDiffs() {
        return maxTextDiffs;
    }

    public Integer maxStructureDiffs() {
        return maxStructureDiffs;
    }

    public Path workDir() {
        return workDir;
    }

    public boolean keepAll() {
        return keepAll;
    }

    public Path typesDir() {
        return typesDir;
    }

    public Path profile() {
        return profile;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
