package ai.docsite.resume.generate;

import ai.docsite.resume.dsl.ConfigurationException;
import ai.docsite.resume.latex.LatexText;
import ai.docsite.resume.model.Column;
import ai.docsite.resume.model.Decoration;
import ai.docsite.resume.model.Document;
import ai.docsite.resume.model.Metadata;
import ai.docsite.resume.model.Page;
import ai.docsite.resume.model.PageRegions;
import ai.docsite.resume.model.Section;
import ai.docsite.resume.model.SectionType;
import ai.docsite.resume.model.Subsection;
import ai.docsite.resume.normalize.DualFieldNormalizer;
import ai.docsite.resume.registry.TemplateRegistry;
import ai.docsite.resume.registry.TypeRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link Document} back to LaTeX, bottom-up: bullets and subsections through their type templates,
 * sections through the section wrapper, columns and decorations into pages, and pages plus the preamble into
 * the document template. The result has at most one consecutive blank line.
 *
 * <p>Raw/plaintext pairs are completed with {@link DualFieldNormalizer} first, so hand-edited YAML may carry only
 * the plaintext of an entry.</p>
 */
public class DocumentGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentGenerator.class);

    static final String DOCUMENT_TEMPLATE = "structure/document.tex";
    static final String SECTION_TEMPLATE = "structure/section.tex";
    static final String TEXTBLOCK_TEMPLATE = "structure/textblock.tex";
    static final String SWITCH_COLUMN = "\\switchcolumn";
    static final String CLEARPAGE = "\\clearpage";

    private final TemplateRegistry templates;
    private final TemplateRenderer renderer;
    private final TypeRenderer typeRenderer;
    private final PreambleRenderer preambleRenderer;
    private final DualFieldNormalizer dualFields = new DualFieldNormalizer();

    public DocumentGenerator(TypeRegistry types, TemplateRegistry templates, ContactProfile profile) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.renderer = new TemplateRenderer();
        this.typeRenderer = new TypeRenderer(types, templates, renderer);
        this.preambleRenderer = new PreambleRenderer(templates, renderer, profile);
    }

    public String generate(Document document) {
        Objects.requireNonNull(document, "document");
        Document normalized = dualFields.normalize(document);
        Metadata metadata = normalized.metadata();
        List<String> pages = new ArrayList<>();
        for (Page page : normalized.pages()) {
            String rendered = renderPage(page);
            pages.add(page.hasClearpageAfter() ? rendered + "\n\n" + CLEARPAGE : rendered);
        }
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("preamble", preambleRenderer.render(metadata));
        scope.put("pages", String.join("\n\n", pages));
        String latex = renderer.render(template(DOCUMENT_TEMPLATE), scope);
        return LatexText.limitBlankLines(LatexText.stripTrailingWhitespace(latex), 1).strip() + "\n";
    }

    String renderPage(Page page) {
        PageRegions regions = page.regions();
        List<String> parts = new ArrayList<>();
        if (regions.decorations() != null) {
            for (Decoration decoration : regions.decorations()) {
                parts.add(renderDecoration(decoration, regions.textblockLiteral()));
            }
        }
        String left = renderColumn(regions.leftColumn());
        String main = renderColumn(regions.mainColumn());
        // a page without a left column parses back as main-column only, so it carries no switch
        if (!left.isEmpty()) {
            parts.add(left);
            parts.add(SWITCH_COLUMN);
        }
        if (!main.isEmpty()) {
            parts.add(main);
        }
        return String.join("\n\n", parts);
    }

    private String renderDecoration(Decoration decoration, String literal) {
        List<String> args = decoration.args();
        if (Decoration.TEXTBLOCK.equals(decoration.name())) {
            if (args.size() != 2) {
                throw new TemplateRenderException("textblock decoration needs width and position, got " + args);
            }
            Map<String, Object> scope = new LinkedHashMap<>();
            scope.put("width", args.get(0));
            scope.put("position", args.get(1));
            scope.put("literal", literal == null ? "" : literal);
            return renderer.render(template(TEXTBLOCK_TEMPLATE), scope).strip();
        }
        return "\\" + decoration.name() + args.stream().map(arg -> "{" + arg + "}").collect(Collectors.joining());
    }

    private String renderColumn(Column column) {
        if (column == null || column.isEmpty()) {
            return "";
        }
        return column.sections().stream()
                .map(this::renderSection)
                .collect(Collectors.joining("\n\n"));
    }

    String renderSection(Section section) {
        Map<String, Object> scope = new LinkedHashMap<>();
        if (section.name() == null || section.name().raw() == null) {
            throw new TemplateRenderException("Section without a name of type " + section.type());
        }
        scope.put("name", section.name().raw());
        scope.put("body", renderSectionBody(section));
        scope.put("spacing", section.spacingAfter() == null ? "" : "\n\n" + section.spacingAfter());
        return renderer.render(template(SECTION_TEMPLATE), scope).strip();
    }

    private String renderSectionBody(Section section) {
        String type = section.type();
        boolean unknown = type == null || SectionType.UNKNOWN.typeName().equals(type);
        if (unknown || !typeRenderer.supports(type)) {
            Object raw = section.content() == null ? null : section.content().get("raw");
            if (raw != null) {
                return raw.toString();
            }
            LOGGER.warn("Section '{}' has type {} and no raw content", section.name().plaintext(), type);
            return "% Unknown section type: " + type;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type);
        data.put("metadata", section.metadata() == null ? new LinkedHashMap<>() : section.metadata());
        data.put("content", section.content() == null ? new LinkedHashMap<>() : section.content());
        if (section.subsections() != null) {
            List<Map<String, Object>> subsections = new ArrayList<>();
            for (Subsection subsection : section.subsections()) {
                subsections.add(subsectionData(subsection));
            }
            data.put("subsections", subsections);
        }
        return typeRenderer.render(type, data);
    }

    private static Map<String, Object> subsectionData(Subsection subsection) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", subsection.type());
        data.put("metadata", subsection.metadata() == null ? new LinkedHashMap<>() : subsection.metadata());
        data.put("content", subsection.content() == null ? new LinkedHashMap<>() : subsection.content());
        return data;
    }

    private String template(String path) {
        try {
            return templates.template(path);
        } catch (ConfigurationException ex) {
            throw new TemplateRenderException(ex.getMessage(), ex);
        }
    }
}
