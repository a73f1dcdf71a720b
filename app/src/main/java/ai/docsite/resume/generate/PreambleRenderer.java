package ai.docsite.resume.generate;

import ai.docsite.resume.dsl.ConfigurationException;
import ai.docsite.resume.latex.LatexText;
import ai.docsite.resume.model.DualField;
import ai.docsite.resume.model.Metadata;
import ai.docsite.resume.registry.TemplateRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the preamble from document metadata and the contact profile.
 */
class PreambleRenderer {

    static final String PREAMBLE_TEMPLATE = "structure/preamble.tex";
    static final String CONTACT_ROW_TEMPLATE = "structure/contact_row.tex";

    private final TemplateRegistry templates;
    private final TemplateRenderer renderer;
    private final ContactProfile profile;

    PreambleRenderer(TemplateRegistry templates, TemplateRenderer renderer, ContactProfile profile) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    String render(Metadata metadata) {
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("custom_packages", metadata.customPackages() == null
                ? "" : String.join("\n", metadata.customPackages()));
        scope.put("lengths", String.join("\n", lengths(metadata)));
        scope.put("declarations", String.join("\n", declarations(metadata)));
        scope.put("contact_rows", String.join("\n", contactRows(profile.withOverride(metadata.customContactInfo()))));
        return renderer.render(template(PREAMBLE_TEMPLATE), scope).strip();
    }

    private static List<String> lengths(Metadata metadata) {
        List<String> lines = new ArrayList<>();
        metadata.setlengths().forEach((name, value) -> lines.add("\\setlength{\\" + name + "}{" + value + "}"));
        metadata.deflens().forEach((name, value) -> lines.add("\\deflen{" + name + "}{" + value + "}"));
        return lines;
    }

    private static List<String> declarations(Metadata metadata) {
        List<String> lines = new ArrayList<>();
        addDual(lines, "myname", metadata.name());
        addDual(lines, "mydate", metadata.date());
        addDual(lines, "brand", metadata.brand());
        addDual(lines, "ProfessionalProfile", metadata.professionalProfile());
        metadata.colors().forEach((role, value) -> lines.add(renewcommand(role, value)));
        metadata.fields().forEach((key, value) -> lines.add(renewcommand(key, value)));
        if (metadata.hlcolor() != null) {
            lines.add("\\sethlcolor{" + metadata.hlcolor() + "}");
        }
        if (metadata.nlinesPp() != null) {
            lines.add("\\def\\nlinesPP{" + metadata.nlinesPp() + "}");
        }
        boolean titleAfterName = !Boolean.FALSE.equals(metadata.listTitleAfterName());
        lines.add("\\toggle" + titleAfterName + "{list_title_after_name}");
        return lines;
    }

    private static void addDual(List<String> lines, String command, DualField field) {
        if (field != null && field.raw() != null) {
            lines.add(renewcommand(command, field.raw()));
        }
    }

    private static String renewcommand(String command, String value) {
        return "\\renewcommand{\\" + command + "}{" + value + "}";
    }

    private List<String> contactRows(ContactProfile contacts) {
        String rowTemplate = template(CONTACT_ROW_TEMPLATE);
        List<String> rows = new ArrayList<>();
        for (String key : contacts.contactSelection()) {
            ContactField field = ContactField.fromKey(key)
                    .orElseThrow(() -> new TemplateRenderException("Unknown contact field '" + key + "'"));
            String value = contacts.contactRegistry().get(key);
            if (value == null || value.isBlank()) {
                throw new TemplateRenderException("Contact field '" + key + "' is selected but has no value");
            }
            String shown = field.linkPrefix()
                    .map(prefix -> "\\href{" + LatexText.prependWithoutOverlap(prefix, value) + "}{" + value + "}")
                    .orElse(value);
            Map<String, Object> scope = new LinkedHashMap<>();
            scope.put("icon", field.icon());
            scope.put("value", shown);
            rows.add(renderer.render(rowTemplate, scope).strip());
        }
        return rows;
    }

    private String template(String path) {
        try {
            return templates.template(path);
        } catch (ConfigurationException ex) {
            throw new TemplateRenderException(ex.getMessage(), ex);
        }
    }
}
