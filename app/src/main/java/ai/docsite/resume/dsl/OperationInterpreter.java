package ai.docsite.resume.dsl;

import ai.docsite.resume.latex.LatexExtractor;
import ai.docsite.resume.latex.LatexText;
import ai.docsite.resume.latex.MalformedMarkupException;
import ai.docsite.resume.latex.PatternCatalog;
import ai.docsite.resume.latex.PlaintextConverter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes parse configurations against LaTeX fragments and builds nested result maps.
 *
 * <p>Failures follow a fixed policy: unresolved configuration references raise {@link ConfigurationException},
 * an environment none of whose candidate names match raises {@link MalformedMarkupException}, and everything
 * else degrades to an absent value. A malformed chunk of a {@code recursive_parse} is kept as a raw block of type
 * {@value #RAW_TYPE} with its source under {@code content.raw} and the failure under {@code error}, so its
 * siblings still parse.</p>
 */
public class OperationInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperationInterpreter.class);

    static final String RUNNING_CONTENT = "running_content";
    static final String MATCHED_ENVIRONMENT = "matched_environment";
    static final String DEFAULT_MARKER_PATTERN = "ITEM_ALPHABETIC";
    static final String ENVIRONMENT_TYPE_PATH = "metadata.environment_type";
    static final String TRAILING_TEXT_PATH = "metadata.trailing_text";
    static final String RAW_TYPE = "unknown";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\{([^}]+)\\}\\}\\}");
    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final ParseConfigSource configs;

    public OperationInterpreter(ParseConfigSource configs) {
        this.configs = Objects.requireNonNull(configs, "configs");
    }

    public Map<String, Object> run(String configName, String content) {
        return run(requireConfig(configName, null), content, new LinkedHashMap<>());
    }

    /**
     * Runs {@code config} over {@code content}, writing into {@code seed}, which is returned.
     */
    public Map<String, Object> run(ParseConfig config, String content, Map<String, Object> seed) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(RUNNING_CONTENT, content == null ? "" : content);
        List<Operation> operations = config.operations();
        for (int index = 0; index < operations.size(); index++) {
            Step step = new Step(config, index, operations.get(index), context, seed);
            LOGGER.debug("{} step {} ({})", config.name(), index, step.label());
            try {
                execute(step);
            } catch (PatternSyntaxException ex) {
                throw step.configurationError("invalid regular expression: " + ex.getDescription(), ex);
            }
        }
        return seed;
    }

    private void execute(Step step) {
        Operation operation = step.operation();
        if (operation instanceof Operation.SetLiteral setLiteral) {
            step.write(setLiteral.value());
        } else if (operation instanceof Operation.ExtractEnvironment extract) {
            extractEnvironment(step, extract);
        } else if (operation instanceof Operation.Split split) {
            split(step, split);
        } else if (operation instanceof Operation.ParseItemize parseItemize) {
            parseItemize(step, parseItemize);
        } else if (operation instanceof Operation.RecursiveParse recursiveParse) {
            recursiveParse(step, recursiveParse);
        } else if (operation instanceof Operation.ExtractBracedAfterPattern braced) {
            extractBracedAfterPattern(step, braced);
        } else if (operation instanceof Operation.ExtractRegex regex) {
            extractRegex(step, regex);
        } else if (operation instanceof Operation.ToPlaintext) {
            step.write(plaintextOf(step.input()));
        } else {
            throw step.configurationError("unsupported operation " + operation.getClass().getSimpleName(), null);
        }
    }

    private void extractEnvironment(Step step, Operation.ExtractEnvironment operation) {
        if (operation.envName() == null || operation.envName().isEmpty()) {
            throw step.configurationError("env_name is required", null);
        }
        String text = step.inputText();
        int mandatory = valueOrZero(operation.numParams());
        int optional = valueOrZero(operation.numOptionalParams());
        MalformedMarkupException lastFailure = null;
        for (String candidate : operation.envName()) {
            String name = resolvePlaceholders(candidate, step.result());
            if (name == null) {
                continue;
            }
            LatexExtractor.ParsedEnvironment environment;
            try {
                environment = LatexExtractor.extractEnvironment(text, name, mandatory, optional, 0);
            } catch (MalformedMarkupException ex) {
                lastFailure = ex;
                continue;
            }
            writeParams(step, operation, environment, optional);
            step.context().put(MATCHED_ENVIRONMENT, environment.name());
            if (operation.matchedNamePath() != null) {
                NestedPaths.set(step.result(), operation.matchedNamePath(), environment.name());
            }
            if (Boolean.TRUE.equals(operation.captureTrailingText())) {
                String trailing = text.substring(environment.end()).strip();
                if (!trailing.isEmpty()) {
                    NestedPaths.set(step.result(), TRAILING_TEXT_PATH, trailing);
                }
            }
            step.writeOrReplaceRunning(environment.content());
            return;
        }
        String message = step.describe() + ": none of the environments " + operation.envName() + " matched";
        throw lastFailure == null
                ? new MalformedMarkupException(message)
                : new MalformedMarkupException(message + " (" + lastFailure.getMessage() + ")", lastFailure);
    }

    private void writeParams(Step step, Operation.ExtractEnvironment operation,
                             LatexExtractor.ParsedEnvironment environment, int optional) {
        List<String> names = operation.paramNames() == null ? List.of() : operation.paramNames();
        List<String> params = environment.params();
        for (int i = 0; i < environment.optionalFound() && i < names.size(); i++) {
            NestedPaths.set(step.result(), names.get(i), params.get(i));
        }
        for (int i = environment.optionalFound(); i < params.size(); i++) {
            int nameIndex = optional + i - environment.optionalFound();
            if (nameIndex < names.size()) {
                NestedPaths.set(step.result(), names.get(nameIndex), params.get(i));
            }
        }
    }

    private void split(Step step, Operation.Split operation) {
        Pattern delimiter;
        if (operation.delimiterPattern() != null) {
            delimiter = Pattern.compile("(?=" + resolvePattern(step, operation.delimiterPattern()) + ")");
        } else if (operation.delimiter() != null) {
            delimiter = Pattern.compile(resolvePattern(step, operation.delimiter()));
        } else {
            throw step.configurationError("split needs delimiter or delimiter_pattern", null);
        }
        Pattern cleanup = operation.cleanupPattern() == null
                ? null : Pattern.compile(resolvePattern(step, operation.cleanupPattern()));
        int limit = operation.maxParts() == null ? 0 : operation.maxParts();
        List<String> pieces = new ArrayList<>();
        for (String piece : delimiter.split(step.inputText(), limit)) {
            String cleaned = cleanup == null ? piece : cleanup.matcher(piece).replaceAll("");
            cleaned = cleaned.strip();
            if (!cleaned.isEmpty()) {
                pieces.add(cleaned);
            }
        }
        if (operation.outputPaths() instanceof List<?> paths) {
            for (int i = 0; i < paths.size(); i++) {
                NestedPaths.set(step.result(), String.valueOf(paths.get(i)), i < pieces.size() ? pieces.get(i) : "");
            }
            return;
        }
        step.write(pieces);
    }

    private void parseItemize(Step step, Operation.ParseItemize operation) {
        String text = step.inputText();
        List<LatexExtractor.Entry> entries;
        if (Boolean.TRUE.equals(operation.bracketedMarkers())) {
            entries = LatexExtractor.splitBracketedItems(text);
        } else {
            String reference = operation.markerPattern() == null ? DEFAULT_MARKER_PATTERN : operation.markerPattern();
            entries = LatexExtractor.splitEntries(text, Pattern.compile(resolvePattern(step, reference)));
        }
        List<Map<String, Object>> bullets = new ArrayList<>();
        for (LatexExtractor.Entry entry : entries) {
            bullets.add(entryMap(entry.marker(), entry.latexRaw(), entry.plaintext()));
        }
        step.write(bullets);
    }

    private void recursiveParse(Step step, Operation.RecursiveParse operation) {
        ParseConfig nested = requireConfig(operation.configName(), step);
        Object input = step.input();
        List<Map<String, Object>> results = new ArrayList<>();
        if (input instanceof List<?> chunks) {
            for (Object chunk : chunks) {
                Object text = chunk instanceof Map<?, ?> map ? map.get("latex_raw") : chunk;
                Object marker = chunk instanceof Map<?, ?> map ? map.get("marker") : null;
                String source = text == null ? "" : text.toString();
                String original = marker == null ? source : "\\" + marker + " " + source;
                results.add(parseChunk(step, nested, source, original, new LinkedHashMap<>()));
            }
            step.write(results);
            return;
        }
        if (operation.recursivePattern() == null) {
            throw step.configurationError("recursive_pattern is required for text input", null);
        }
        String text = input == null ? "" : input.toString();
        List<LatexExtractor.EnvironmentBlock> blocks =
                LatexExtractor.extractAllEnvironments(text, resolvePattern(step, operation.recursivePattern()));
        StringBuilder cleaned = new StringBuilder(text);
        for (int i = blocks.size() - 1; i >= 0; i--) {
            cleaned.delete(blocks.get(i).start(), blocks.get(i).end());
        }
        step.replaceInput(cleaned.toString());
        for (LatexExtractor.EnvironmentBlock block : blocks) {
            Map<String, Object> seed = new LinkedHashMap<>();
            NestedPaths.set(seed, ENVIRONMENT_TYPE_PATH, block.name());
            results.add(parseChunk(step, nested, block.source(), block.source(), seed));
        }
        step.write(results);
    }

    private Map<String, Object> parseChunk(Step step, ParseConfig nested, String source, String original,
                                           Map<String, Object> seed) {
        try {
            return run(nested, source, seed);
        } catch (MalformedMarkupException ex) {
            LOGGER.warn("{}: kept a malformed {} block as raw content: {}", step.describe(), nested.name(),
                    ex.getMessage());
            Map<String, Object> content = new LinkedHashMap<>();
            content.put("raw", original);
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("type", RAW_TYPE);
            raw.put("content", content);
            raw.put("error", ex.getMessage());
            return raw;
        }
    }

    private void extractBracedAfterPattern(Step step, Operation.ExtractBracedAfterPattern operation) {
        String reference = operation.patternName() != null ? operation.patternName() : operation.pattern();
        if (reference == null) {
            throw step.configurationError("pattern or pattern_name is required", null);
        }
        String text = step.inputText();
        Matcher matcher = Pattern.compile(resolvePattern(step, reference)).matcher(text);
        if (!matcher.find()) {
            return;
        }
        int start = matcher.end();
        if (!matcher.group().endsWith("{")) {
            while (start < text.length() && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            if (start >= text.length() || text.charAt(start) != '{') {
                return;
            }
            start++;
        }
        step.write(LatexExtractor.extractBalancedSpan(text, start, '{', '}').content());
    }

    private void extractRegex(Step step, Operation.ExtractRegex operation) {
        String reference = operation.patternName() != null ? operation.patternName() : operation.regex();
        if (reference == null) {
            throw step.configurationError("regex or pattern_name is required", null);
        }
        Pattern pattern = Pattern.compile(resolvePattern(step, reference));
        Matcher matcher = pattern.matcher(step.inputText());
        if (operation.outputPaths() instanceof Map<?, ?> paths) {
            if (!matcher.find()) {
                return;
            }
            for (Map.Entry<?, ?> entry : paths.entrySet()) {
                String group = String.valueOf(entry.getKey());
                String value;
                try {
                    value = matcher.group(group);
                } catch (IllegalArgumentException ex) {
                    throw step.configurationError("pattern has no capture group '" + group + "'", ex);
                }
                if (value != null) {
                    NestedPaths.set(step.result(), String.valueOf(entry.getValue()), value);
                }
            }
            return;
        }
        List<String> groups = namedGroups(pattern);
        List<Object> matches = new ArrayList<>();
        while (matcher.find()) {
            if (groups.size() > 1) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (String group : groups) {
                    values.put(group, matcher.group(group));
                }
                matches.add(values);
            } else if (groups.size() == 1) {
                matches.add(matcher.group(groups.get(0)));
            } else {
                matches.add(matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group());
            }
        }
        if (matches.size() == 1 && groups.size() > 1) {
            step.write(matches.get(0));
        } else {
            step.write(matches);
        }
    }

    private Object plaintextOf(Object input) {
        if (input instanceof List<?> items) {
            List<Map<String, Object>> converted = new ArrayList<>();
            for (Object item : items) {
                if (item instanceof Map<?, ?> map) {
                    Object raw = map.containsKey("latex_raw") ? map.get("latex_raw") : map.get("raw");
                    Object marker = map.get("marker");
                    String latex = raw == null ? "" : raw.toString();
                    converted.add(entryMap(marker == null ? null : marker.toString(), latex,
                            PlaintextConverter.toPlaintext(latex)));
                } else if (item != null) {
                    converted.add(entryMap(null, item.toString(), PlaintextConverter.toPlaintext(item.toString())));
                }
            }
            return converted;
        }
        return input == null ? null : PlaintextConverter.toPlaintext(input.toString());
    }

    private static Map<String, Object> entryMap(String marker, String latexRaw, String plaintext) {
        Map<String, Object> entry = new LinkedHashMap<>();
        if (marker != null) {
            entry.put("marker", marker);
        }
        entry.put("latex_raw", latexRaw);
        entry.put("plaintext", plaintext);
        return entry;
    }

    private ParseConfig requireConfig(String name, Step step) {
        if (name == null) {
            throw step == null
                    ? new ConfigurationException("config name is required")
                    : step.configurationError("config_name is required", null);
        }
        return configs.find(name).orElseThrow(() -> step == null
                ? new ConfigurationException("Unknown parse config: " + name)
                : step.configurationError("unknown nested config '" + name + "'", null));
    }

    private static String resolvePattern(Step step, String reference) {
        if (!PatternCatalog.isName(reference)) {
            return reference;
        }
        return PatternCatalog.lookup(reference)
                .orElseThrow(() -> step.configurationError("unknown pattern '" + reference + "'", null));
    }

    private static String resolvePlaceholders(String candidate, Map<String, Object> result) {
        Matcher matcher = PLACEHOLDER.matcher(candidate);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            String value = NestedPaths.getString(result, matcher.group(1).strip());
            if (value == null || value.isBlank()) {
                return null;
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static List<String> namedGroups(Pattern pattern) {
        Matcher matcher = NAMED_GROUP.matcher(pattern.pattern());
        List<String> names = new ArrayList<>();
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    /** Mutable view of one operation's execution: its input resolution and output routing. */
    private record Step(ParseConfig config, int index, Operation operation, Map<String, Object> context,
                        Map<String, Object> result) {

        String label() {
            return operation.name() != null ? operation.name() : operation.getClass().getSimpleName();
        }

        String describe() {
            return config.name() + " step " + index + " (" + label() + ")";
        }

        Object input() {
            if (operation.sourcePath() != null) {
                return NestedPaths.get(result, operation.sourcePath());
            }
            if (operation.source() != null) {
                return context.get(operation.source());
            }
            return context.get(RUNNING_CONTENT);
        }

        String inputText() {
            Object input = input();
            return input == null ? "" : input.toString();
        }

        void replaceInput(String text) {
            if (operation.sourcePath() != null) {
                NestedPaths.set(result, operation.sourcePath(), text);
            } else if (operation.source() != null) {
                context.put(operation.source(), text);
            } else {
                context.put(RUNNING_CONTENT, text);
            }
        }

        void write(Object value) {
            if (value == null) {
                return;
            }
            if (operation.outputContext() != null) {
                context.put(operation.outputContext(), value);
            }
            if (operation.outputPath() != null) {
                NestedPaths.set(result, operation.outputPath(), value);
            }
        }

        void writeOrReplaceRunning(String value) {
            if (operation.outputContext() == null && operation.outputPath() == null) {
                context.put(RUNNING_CONTENT, value);
            } else {
                write(value);
            }
        }

        ConfigurationException configurationError(String message, Throwable cause) {
            String full = describe() + ": " + message + " near '" + LatexText.snippet(inputText(), 0) + "'";
            return cause == null ? new ConfigurationException(full) : new ConfigurationException(full, cause);
        }
    }
}
