package ai.docsite.resume.parse;

import ai.docsite.resume.dsl.OperationInterpreter;
import ai.docsite.resume.latex.LatexExtractor;
import ai.docsite.resume.latex.MalformedMarkupException;
import ai.docsite.resume.latex.PatternCatalog;
import ai.docsite.resume.model.Column;
import ai.docsite.resume.model.Decoration;
import ai.docsite.resume.model.Document;
import ai.docsite.resume.model.DualField;
import ai.docsite.resume.model.Metadata;
import ai.docsite.resume.model.Page;
import ai.docsite.resume.model.PageRegions;
import ai.docsite.resume.model.Section;
import ai.docsite.resume.model.SectionType;
import ai.docsite.resume.model.Subsection;
import ai.docsite.resume.model.TopRegion;
import ai.docsite.resume.registry.TypeRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a LaTeX résumé into a {@link Document}.
 *
 * <p>The body inside {@code paracol} is split into pages at {@code \clearpage}, each page into a left and a main
 * column at {@code \switchcolumn}, and each column into sections at {@code \section*}. Decorations and the
 * {@code textblock*} literal are lifted out of a page before its sections are split. A section whose parse
 * pipeline fails is kept as raw {@code unknown} content and reported in {@link ParseResult#failures()}.</p>
 */
public class DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentParser.class);

    static final String PARACOL = "paracol";
    static final String SWITCH_COLUMN = "\\switchcolumn";
    static final String LEGACY_EDUCATION_NAME = "Education";
    static final List<String> DECORATION_COMMANDS = List.of("leftgrad", "bottombar", "topgradtri");

    private static final Pattern CLEARPAGE = Pattern.compile("\\\\clearpage\\s*");
    private static final Pattern SECTION_START = Pattern.compile(
            "\\\\section\\*?\\{|(?<legacy>\\\\noindent\\s*\\{\\\\large\\s*\\\\scshape\\s+Education\\})");
    private static final Pattern TRAILING_SPACING = Pattern.compile(
            "(\\n*(?:\\\\vspace\\{[^}]+\\}(?:[ \\t]*%[^\\n]*)?\\n*)+)$");
    private static final Pattern TEXTBLOCK = Pattern.compile(PatternCatalog.TEXTBLOCK_WITH_ARGS);
    private static final Pattern BRACED_ARGUMENT = Pattern.compile("\\{([^}]*)\\}");

    private final OperationInterpreter interpreter;
    private final MetadataExtractor metadataExtractor;
    private final SectionTypeInference typeInference;

    public DocumentParser(TypeRegistry registry) {
        this(new OperationInterpreter(registry), new MetadataExtractor(), new SectionTypeInference());
    }

    DocumentParser(OperationInterpreter interpreter, MetadataExtractor metadataExtractor,
                   SectionTypeInference typeInference) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.metadataExtractor = Objects.requireNonNull(metadataExtractor, "metadataExtractor");
        this.typeInference = Objects.requireNonNull(typeInference, "typeInference");
    }

    public ParseResult parse(String latex) {
        Objects.requireNonNull(latex, "latex");
        Metadata metadata = metadataExtractor.extract(latex);
        List<ParseResult.SectionFailure> failures = new ArrayList<>();
        List<Page> pages = parsePages(bodyOf(latex), failures);
        return new ParseResult(new Document(metadata, pages), failures);
    }

    private String bodyOf(String latex) {
        int begin = latex.indexOf(MetadataExtractor.DOCUMENT_BEGIN) + MetadataExtractor.DOCUMENT_BEGIN.length();
        int end = latex.indexOf("\\end{document}", begin);
        String body = end < 0 ? latex.substring(begin) : latex.substring(begin, end);
        if (!body.contains("\\begin{" + PARACOL + "}")) {
            LOGGER.warn("No paracol environment found; treating the whole body as page content");
            return body;
        }
        return LatexExtractor.extractEnvironment(body, PARACOL, 1, 0, 0).content();
    }

    private List<Page> parsePages(String body, List<ParseResult.SectionFailure> failures) {
        int clearpageCount = 0;
        Matcher clearpages = CLEARPAGE.matcher(body);
        while (clearpages.find()) {
            clearpageCount++;
        }
        List<Page> pages = new ArrayList<>();
        int pageNumber = 0;
        for (String pageText : CLEARPAGE.split(body, -1)) {
            if (pageText.isBlank()) {
                continue;
            }
            pageNumber++;
            pages.add(parsePage(pageText, pageNumber, pageNumber <= clearpageCount, failures));
        }
        return pages;
    }

    private Page parsePage(String pageText, int pageNumber, boolean hasClearpageAfter,
                           List<ParseResult.SectionFailure> failures) {
        List<Decoration> decorations = new ArrayList<>();
        String text = pageText;
        String literal = null;

        Matcher textblock = TEXTBLOCK.matcher(text);
        if (textblock.find()) {
            LatexExtractor.EnvironmentBlock block =
                    LatexExtractor.extractEnvironmentBlock(text, "textblock*", textblock.start());
            String arguments = textblock.group(1) + textblock.group(2);
            literal = block.content().substring(arguments.length()).strip();
            decorations.add(new Decoration(Decoration.TEXTBLOCK, List.of(
                    unwrap(textblock.group(1)), unwrap(textblock.group(2)))));
            text = text.substring(0, block.start()) + text.substring(block.end());
        }
        for (String command : DECORATION_COMMANDS) {
            Matcher matcher = decorationPattern(command).matcher(text);
            StringBuilder remaining = new StringBuilder();
            while (matcher.find()) {
                List<String> args = new ArrayList<>();
                Matcher argument = BRACED_ARGUMENT.matcher(matcher.group(1));
                while (argument.find()) {
                    args.add(argument.group(1));
                }
                decorations.add(new Decoration(command, args));
                matcher.appendReplacement(remaining, "");
            }
            matcher.appendTail(remaining);
            text = remaining.toString();
        }

        int switchIndex = text.indexOf(SWITCH_COLUMN);
        String left = switchIndex < 0 ? "" : text.substring(0, switchIndex);
        String main = switchIndex < 0 ? text : text.substring(switchIndex + SWITCH_COLUMN.length());
        PageRegions regions = new PageRegions(
                new TopRegion(pageNumber == 1),
                columnOf(parseSections(left, pageNumber, failures)),
                columnOf(parseSections(main, pageNumber, failures)),
                literal,
                decorations.isEmpty() ? null : decorations);
        return new Page(pageNumber, hasClearpageAfter, regions);
    }

    private static Column columnOf(List<Section> sections) {
        return sections.isEmpty() ? null : new Column(sections);
    }

    List<Section> parseSections(String columnText, int pageNumber, List<ParseResult.SectionFailure> failures) {
        List<SectionBounds> bounds = new ArrayList<>();
        Matcher matcher = SECTION_START.matcher(columnText);
        int searchFrom = 0;
        while (matcher.find(searchFrom)) {
            if (matcher.group("legacy") != null) {
                bounds.add(new SectionBounds(LEGACY_EDUCATION_NAME, matcher.start(), matcher.end()));
                searchFrom = matcher.end();
                continue;
            }
            try {
                LatexExtractor.Span name = LatexExtractor.extractBalancedSpan(columnText, matcher.end(), '{', '}');
                bounds.add(new SectionBounds(name.content(), matcher.start(), name.end()));
                searchFrom = name.end();
            } catch (MalformedMarkupException ex) {
                LOGGER.warn("Page {}: skipping section heading with unbalanced name: {}", pageNumber, ex.getMessage());
                searchFrom = matcher.end();
            }
            if (searchFrom >= columnText.length()) {
                break;
            }
        }
        List<Section> sections = new ArrayList<>();
        for (int i = 0; i < bounds.size(); i++) {
            SectionBounds current = bounds.get(i);
            int end = i + 1 < bounds.size() ? bounds.get(i + 1).headingStart() : columnText.length();
            String content = columnText.substring(current.contentStart(), end);
            sections.add(parseSection(current.name(), content, pageNumber, failures));
        }
        return sections;
    }

    private Section parseSection(String nameRaw, String rawContent, int pageNumber,
                                 List<ParseResult.SectionFailure> failures) {
        DualField name = DualField.of(nameRaw);
        String content = rawContent.strip();
        String spacingAfter = null;
        Matcher spacing = TRAILING_SPACING.matcher(content);
        if (spacing.find()) {
            spacingAfter = spacing.group(1).strip();
            content = content.substring(0, spacing.start()).strip();
        }
        SectionType type = typeInference.infer(content);
        if (type == SectionType.UNKNOWN) {
            LOGGER.debug("Page {}: section '{}' has no recognised structure", pageNumber, name.plaintext());
            return rawSection(name, spacingAfter, content, null);
        }
        try {
            Map<String, Object> result = interpreter.run(type.typeName(), content);
            List<Subsection> subsections = subsectionsOf(result.get("subsections"));
            if (subsections != null) {
                for (Subsection subsection : subsections) {
                    if (subsection.error() != null) {
                        failures.add(new ParseResult.SectionFailure(pageNumber, name.plaintext(), subsection.error()));
                    }
                }
            }
            return new Section(name, type.typeName(), spacingAfter,
                    mapOrNull(result.get("metadata")),
                    mapOrNull(result.get("content")),
                    subsections,
                    null);
        } catch (RuntimeException ex) {
            LOGGER.warn("Page {}: failed to parse section '{}' as {}: {}", pageNumber, name.plaintext(),
                    type.typeName(), ex.getMessage());
            failures.add(new ParseResult.SectionFailure(pageNumber, name.plaintext(), ex.getMessage()));
            return rawSection(name, spacingAfter, content, ex.getMessage());
        }
    }

    private static Section rawSection(DualField name, String spacingAfter, String content, String error) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("raw", content);
        return new Section(name, SectionType.UNKNOWN.typeName(), spacingAfter, null, raw, null, error);
    }

    private static Map<String, Object> mapOrNull(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, nested) -> copy.put(String.valueOf(key), nested));
        return copy;
    }

    private static List<Subsection> subsectionsOf(Object value) {
        if (!(value instanceof List<?> items)) {
            return null;
        }
        List<Subsection> subsections = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> map) {
                Object type = map.get("type");
                Object error = map.get("error");
                subsections.add(new Subsection(type == null ? null : type.toString(),
                        mapOrNull(map.get("metadata")), mapOrNull(map.get("content")),
                        error == null ? null : error.toString()));
            }
        }
        return subsections;
    }

    private static Pattern decorationPattern(String command) {
        return Pattern.compile("\\\\" + command + "(?![A-Za-z])((?:\\{[^}]*\\})*)[^\\n]*\\n?");
    }

    private static String unwrap(String group) {
        return group.substring(1, group.length() - 1);
    }

    private record SectionBounds(String name, int headingStart, int contentStart) {
    }
}
