package ai.docsite.resume.cli;

import ai.docsite.resume.config.Config;
import ai.docsite.resume.config.ConfigLoader;
import ai.docsite.resume.config.SystemEnvironmentReader;
import ai.docsite.resume.generate.ContactProfile;
import ai.docsite.resume.generate.DocumentGenerator;
import ai.docsite.resume.logging.LoggingConfigurator;
import ai.docsite.resume.model.DocumentYaml;
import ai.docsite.resume.model.ResumeConversionException;
import ai.docsite.resume.normalize.LatexNormalizer;
import ai.docsite.resume.parse.DocumentParser;
import ai.docsite.resume.parse.ParseResult;
import ai.docsite.resume.registry.ResourceLocator;
import ai.docsite.resume.registry.TemplateRegistry;
import ai.docsite.resume.registry.TypeRegistry;
import ai.docsite.resume.roundtrip.BatchSummary;
import ai.docsite.resume.roundtrip.RoundtripReport;
import ai.docsite.resume.roundtrip.RoundtripSettings;
import ai.docsite.resume.roundtrip.RoundtripValidator;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and converter components.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final String BUNDLED_STORE = "resume";
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode on {} input(s)", config.mode(), config.inputs().size());

        try {
            return switch (config.mode()) {
                case PARSE -> parse(config);
                case GENERATE -> generate(config);
                case ROUNDTRIP -> roundtrip(config);
            };
        } catch (RuntimeException ex) {
            LOGGER.error("Conversion failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int parse(Config config) {
        Path input = config.inputs().get(0);
        ParseResult result = parser(typeRegistry(config)).parse(read(input));
        if (result.hasFailures()) {
            LOGGER.warn("{} section(s) of {} were kept as raw content", result.failures().size(), input);
        }
        emit(config.output(), new DocumentYaml().write(result.document()));
        return EXIT_OK;
    }

    private int generate(Config config) {
        Path input = config.inputs().get(0);
        TypeRegistry types = typeRegistry(config);
        String latex = generator(types, config).generate(new DocumentYaml().read(read(input)));
        emit(config.output(), latex);
        return EXIT_OK;
    }

    private int roundtrip(Config config) {
        TypeRegistry types = typeRegistry(config);
        RoundtripValidator validator = new RoundtripValidator(new LatexNormalizer(), parser(types),
                generator(types, config), new DocumentYaml(),
                new RoundtripSettings(config.maxTextDiffs(), config.maxStructureDiffs(), config.workDir(),
                        config.keepAll()));
        BatchSummary summary = validator.validateAll(expandInputs(config.inputs()));
        for (RoundtripReport report : summary.passed()) {
            out.println("PASS  " + describe(report));
        }
        for (RoundtripReport report : summary.failed()) {
            out.println("FAIL  " + describe(report) + "  artifacts: " + report.workDir());
        }
        for (RoundtripReport report : summary.errored()) {
            out.println("ERROR " + report.file() + ": " + report.error());
        }
        out.println(summary.passed().size() + "/" + summary.total() + " passed");
        out.flush();
        return summary.allPassed() ? EXIT_OK : EXIT_FAILURE;
    }

    private static String describe(RoundtripReport report) {
        return report.file() + " (text diffs " + report.textDiffs() + ", structure diffs " + report.structureDiffs()
                + ", " + report.elapsedMillis() + " ms)";
    }

    private static TypeRegistry typeRegistry(Config config) {
        return new TypeRegistry(locator(config));
    }

    private static ResourceLocator locator(Config config) {
        ResourceLocator bundled = ResourceLocator.classpath(BUNDLED_STORE);
        return config.typesDir()
                .map(dir -> ResourceLocator.directory(dir).orElse(bundled))
                .orElse(bundled);
    }

    private static DocumentParser parser(TypeRegistry types) {
        return new DocumentParser(types);
    }

    private static DocumentGenerator generator(TypeRegistry types, Config config) {
        ContactProfile profile = config.profile()
                .map(ContactProfile::load)
                .orElseGet(ContactProfile::loadDefault);
        return new DocumentGenerator(types, new TemplateRegistry(types.locator()), profile);
    }

    static List<Path> expandInputs(List<Path> inputs) {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (!Files.isDirectory(input)) {
                files.add(input);
                continue;
            }
            try (Stream<Path> entries = Files.list(input)) {
                entries.filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().endsWith(".tex"))
                        .sorted()
                        .forEach(files::add);
            } catch (IOException ex) {
                throw new ResumeConversionException("Failed to list " + input, ex);
            }
        }
        return files;
    }

    private static String read(Path input) {
        try {
            return Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ResumeConversionException("Failed to read " + input, ex);
        }
    }

    private void emit(Optional<Path> output, String content) {
        if (output.isEmpty()) {
            out.print(content);
            out.flush();
            return;
        }
        try {
            Path target = output.get();
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            LOGGER.info("Wrote {}", target);
        } catch (IOException ex) {
            throw new ResumeConversionException("Failed to write " + output.get(), ex);
        }
    }
}
