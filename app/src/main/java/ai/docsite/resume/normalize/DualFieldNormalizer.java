package ai.docsite.resume.normalize;

import ai.docsite.resume.latex.PlaintextConverter;
import ai.docsite.resume.model.Column;
import ai.docsite.resume.model.Document;
import ai.docsite.resume.model.DualField;
import ai.docsite.resume.model.Metadata;
import ai.docsite.resume.model.Page;
import ai.docsite.resume.model.PageRegions;
import ai.docsite.resume.model.Section;
import ai.docsite.resume.model.Subsection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Completes raw/plaintext pairs of a document that was edited as YAML, so that every pair has both members.
 *
 * <p>A missing raw member is escaped from the plaintext with {@link PlaintextConverter#toLatex(String)}; a missing
 * plaintext member is derived from the raw markup with {@link PlaintextConverter#toPlaintext(String)}. Pairs are
 * the {@link DualField} values, entries carrying {@code latex_raw} or {@code plaintext}, and metadata keys
 * {@code X} with an {@code X_plaintext} companion. Members that are present are never rewritten.</p>
 */
public class DualFieldNormalizer {

    static final String RAW_KEY = "latex_raw";
    static final String PLAINTEXT_KEY = "plaintext";
    static final String COMPANION_SUFFIX = "_plaintext";

    public Document normalize(Document document) {
        Objects.requireNonNull(document, "document");
        List<Page> pages = new ArrayList<>();
        for (Page page : document.pages()) {
            PageRegions regions = page.regions();
            pages.add(new Page(page.pageNumber(), page.hasClearpageAfter(), new PageRegions(regions.top(),
                    column(regions.leftColumn()), column(regions.mainColumn()), regions.textblockLiteral(),
                    regions.decorations())));
        }
        return new Document(metadata(document.metadata()), pages);
    }

    static DualField complete(DualField field) {
        if (field == null) {
            return null;
        }
        if (field.raw() == null && field.plaintext() == null) {
            return field;
        }
        String raw = field.raw() != null ? field.raw() : PlaintextConverter.toLatex(field.plaintext());
        String plaintext = field.plaintext() != null ? field.plaintext() : PlaintextConverter.toPlaintext(field.raw());
        return new DualField(raw, plaintext);
    }

    private static Metadata metadata(Metadata metadata) {
        return new Metadata(complete(metadata.name()), complete(metadata.date()), complete(metadata.brand()),
                complete(metadata.professionalProfile()), metadata.colors(), metadata.setlengths(),
                metadata.deflens(), metadata.hlcolor(), metadata.nlinesPp(), metadata.listTitleAfterName(),
                metadata.customPackages(), metadata.fields(), metadata.customContactInfo());
    }

    private static Column column(Column column) {
        if (column == null) {
            return null;
        }
        List<Section> sections = new ArrayList<>();
        for (Section section : column.sections()) {
            sections.add(section(section));
        }
        return new Column(sections);
    }

    private static Section section(Section section) {
        List<Subsection> subsections = null;
        if (section.subsections() != null) {
            subsections = new ArrayList<>();
            for (Subsection subsection : section.subsections()) {
                subsections.add(new Subsection(subsection.type(), map(subsection.metadata()),
                        map(subsection.content()), subsection.error()));
            }
        }
        return new Section(complete(section.name()), section.type(), section.spacingAfter(), map(section.metadata()),
                map(section.content()), subsections, section.error());
    }

    private static Map<String, Object> map(Map<?, ?> source) {
        if (source == null) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), value(value)));
        completeEntry(result);
        completeCompanions(result);
        return result;
    }

    private static Object value(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return map(nested);
        }
        if (value instanceof List<?> items) {
            List<Object> result = new ArrayList<>(items.size());
            for (Object item : items) {
                result.add(value(item));
            }
            return result;
        }
        return value;
    }

    private static void completeEntry(Map<String, Object> entry) {
        Object raw = entry.get(RAW_KEY);
        Object plaintext = entry.get(PLAINTEXT_KEY);
        if (raw == null && plaintext instanceof String text) {
            entry.put(RAW_KEY, PlaintextConverter.toLatex(text));
        } else if (plaintext == null && raw instanceof String latex) {
            entry.put(PLAINTEXT_KEY, PlaintextConverter.toPlaintext(latex));
        }
    }

    private static void completeCompanions(Map<String, Object> values) {
        for (String key : List.copyOf(values.keySet())) {
            if (!key.endsWith(COMPANION_SUFFIX) || key.length() == COMPANION_SUFFIX.length()) {
                continue;
            }
            String rawKey = key.substring(0, key.length() - COMPANION_SUFFIX.length());
            Object raw = values.get(rawKey);
            Object plaintext = values.get(key);
            if (raw == null && plaintext instanceof String text) {
                values.put(rawKey, PlaintextConverter.toLatex(text));
            } else if (plaintext == null && raw instanceof String latex) {
                values.put(key, PlaintextConverter.toPlaintext(latex));
            }
        }
    }
}
