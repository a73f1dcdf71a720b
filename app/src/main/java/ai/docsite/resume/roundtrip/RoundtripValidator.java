package ai.docsite.resume.roundtrip;

import ai.docsite.resume.generate.DocumentGenerator;
import ai.docsite.resume.model.Document;
import ai.docsite.resume.model.DocumentYaml;
import ai.docsite.resume.normalize.LatexNormalizer;
import ai.docsite.resume.parse.DocumentParser;
import ai.docsite.resume.parse.ParseResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Checks that a résumé survives LaTeX to YAML to LaTeX conversion.
 *
 * <p>The input is normalized, parsed, written as YAML, read back and regenerated. The regenerated LaTeX is
 * normalized and compared line by line with the normalized input, then parsed again and compared leaf by
 * leaf with the first parse. Every intermediate result is written to the run's work directory; the
 * directory keeps only {@code test.log} after a passing run unless keep-all is set.</p>
 */
public class RoundtripValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RoundtripValidator.class);

    static final String INPUT_NORMALIZED = "input_normalized.tex";
    static final String PARSED_YAML = "parsed.yaml";
    static final String GENERATED = "generated.tex";
    static final String GENERATED_NORMALIZED = "generated_normalized.tex";
    static final String REPARSED_YAML = "reparsed.yaml";
    static final String LATEX_DIFF = "latex.diff";
    static final String STRUCTURE_DIFF = "structure.diff";
    static final String TEST_LOG = "test.log";
    static final String MDC_DOCUMENT = "document";

    private static final DateTimeFormatter RUN_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final LatexNormalizer normalizer;
    private final DocumentParser parser;
    private final DocumentGenerator generator;
    private final DocumentYaml yaml;
    private final RoundtripSettings settings;
    private final Clock clock;

    public RoundtripValidator(LatexNormalizer normalizer, DocumentParser parser, DocumentGenerator generator,
                              DocumentYaml yaml, RoundtripSettings settings) {
        this(normalizer, parser, generator, yaml, settings, Clock.systemDefaultZone());
    }

    RoundtripValidator(LatexNormalizer normalizer, DocumentParser parser, DocumentGenerator generator,
                       DocumentYaml yaml, RoundtripSettings settings, Clock clock) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.yaml = Objects.requireNonNull(yaml, "yaml");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RoundtripReport validate(Path file) {
        Objects.requireNonNull(file, "file");
        long started = System.nanoTime();
        String name = file.getFileName().toString();
        String latex;
        try {
            latex = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("Roundtrip {}: cannot read input: {}", name, e.getMessage());
            return RoundtripReport.error(name, "Cannot read input: " + e.getMessage(), elapsedSince(started), null);
        }
        return validate(name, latex);
    }

    public RoundtripReport validate(String name, String latex) {
        MDC.put(MDC_DOCUMENT, name);
        try {
            return run(name, latex);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private RoundtripReport run(String name, String latex) {
        long started = System.nanoTime();
        Path workDir = workDirFor(name);
        RunLog log = new RunLog(name, settings);
        String stage = "normalize input";
        try {
            Files.createDirectories(workDir);
            String normalizedInput = normalizer.normalize(latex);
            write(workDir, INPUT_NORMALIZED, normalizedInput);

            stage = "parse";
            ParseResult parsed = parser.parse(normalizedInput);
            parsed.failures().forEach(failure -> log.line("Section failure on page " + failure.pageNumber() + " '"
                    + failure.sectionName() + "': " + failure.message()));
            String parsedYaml = yaml.write(parsed.document());
            write(workDir, PARSED_YAML, parsedYaml);

            stage = "generate";
            Document fromYaml = yaml.read(parsedYaml);
            String generated = generator.generate(fromYaml);
            write(workDir, GENERATED, generated);
            String normalizedOutput = normalizer.normalize(generated);
            write(workDir, GENERATED_NORMALIZED, normalizedOutput);

            TextDiff textDiff = TextDiff.compare(normalizedInput, normalizedOutput);
            if (!textDiff.isEmpty()) {
                write(workDir, LATEX_DIFF, "--- " + INPUT_NORMALIZED + "\n+++ " + GENERATED_NORMALIZED + "\n"
                        + textDiff.unified());
            }

            stage = "re-parse";
            ParseResult reparsed = parser.parse(normalizedOutput);
            write(workDir, REPARSED_YAML, yaml.write(reparsed.document()));
            StructuralDiff structuralDiff = StructuralDiff.compare(
                    yaml.toTree(parsed.document()), yaml.toTree(reparsed.document()));
            if (structuralDiff.count() > 0) {
                write(workDir, STRUCTURE_DIFF, structuralDiff.render());
            }

            boolean textPassed = textDiff.changedLines() <= settings.maxTextDiffs();
            boolean structurePassed = structuralDiff.count() <= settings.maxStructureDiffs();
            RoundtripReport report = new RoundtripReport(name, textDiff.changedLines(), structuralDiff.count(),
                    textPassed, structurePassed, textPassed && structurePassed, null, elapsedSince(started), workDir);
            log.outcome(report);
            log.writeTo(workDir);
            if (report.passed() && !settings.keepAll()) {
                removeArtifacts(workDir);
            }
            LOGGER.info("Roundtrip {}: {} (text diffs {}, structure diffs {}, {} ms)", name,
                    report.passed() ? "PASSED" : "FAILED", report.textDiffs(), report.structureDiffs(),
                    report.elapsedMillis());
            return report;
        } catch (IOException | RuntimeException e) {
            String message = stage + " failed: " + e.getMessage();
            LOGGER.error("Roundtrip {}: {}", name, message, e);
            RoundtripReport report = RoundtripReport.error(name, message, elapsedSince(started), workDir);
            log.outcome(report);
            writeLogQuietly(log, workDir);
            return report;
        }
    }

    /**
     * Validates every file independently; one document's error never stops the batch.
     */
    public BatchSummary validateAll(List<Path> files) {
        List<RoundtripReport> reports = new ArrayList<>();
        for (Path file : files) {
            reports.add(validate(file));
        }
        BatchSummary summary = BatchSummary.of(reports);
        LOGGER.info("Roundtrip batch: {} passed, {} failed, {} errored of {}", summary.passed().size(),
                summary.failed().size(), summary.errored().size(), summary.total());
        return summary;
    }

    private static void write(Path workDir, String fileName, String content) throws IOException {
        Files.writeString(workDir.resolve(fileName), content, StandardCharsets.UTF_8);
    }

    private static void removeArtifacts(Path workDir) throws IOException {
        try (Stream<Path> entries = Files.list(workDir)) {
            for (Path entry : entries.toList()) {
                if (!entry.getFileName().toString().equals(TEST_LOG)) {
                    Files.deleteIfExists(entry);
                }
            }
        }
    }

    private static void writeLogQuietly(RunLog log, Path workDir) {
        try {
            Files.createDirectories(workDir);
            log.writeTo(workDir);
        } catch (IOException e) {
            LOGGER.warn("Could not write {} in {}: {}", TEST_LOG, workDir, e.getMessage());
        }
    }

    /** Same-named inputs from different directories in one run get {@code _2}, {@code _3}, ... suffixes. */
    private Path workDirFor(String name) {
        String base = stem(name) + "_" + LocalDateTime.now(clock).format(RUN_STAMP);
        Path candidate = settings.workRoot().resolve(base);
        for (int suffix = 2; Files.exists(candidate); suffix++) {
            candidate = settings.workRoot().resolve(base + "_" + suffix);
        }
        return candidate;
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static long elapsedSince(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    /** Accumulates the human-readable run log written as {@code test.log}. */
    private static final class RunLog {

        private final StringBuilder text = new StringBuilder();

        RunLog(String name, RoundtripSettings settings) {
            line("Roundtrip test: " + name);
            line("Max text diffs: " + settings.maxTextDiffs());
            line("Max structure diffs: " + settings.maxStructureDiffs());
        }

        void line(String value) {
            text.append(value).append('\n');
        }

        void outcome(RoundtripReport report) {
            if (report.hasError()) {
                line("ERROR: " + report.error());
                return;
            }
            line("Text roundtrip: " + (report.textPassed() ? "PASS" : "FAIL") + " (" + report.textDiffs() + " diffs)");
            line("Structure roundtrip: " + (report.structurePassed() ? "PASS" : "FAIL") + " ("
                    + report.structureDiffs() + " diffs)");
            line("Time: " + report.elapsedMillis() + "ms");
            line("Validation: " + (report.passed() ? "PASSED" : "FAILED"));
        }

        void writeTo(Path workDir) throws IOException {
            write(workDir, TEST_LOG, text.toString());
        }
    }
}
