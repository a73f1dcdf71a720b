package ai.docsite.resume.registry;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rendering schema of one section or subsection type, read from {@code types/<name>/type.yaml}.
 *
 * @param environments concrete environment names for the type; the first is the default
 * @param template template file name inside the type directory
 * @param lists lists rendered into {@code <<<list.NAME>>>} placeholders
 * @param fragments conditional snippets rendered into {@code <<<fragment.NAME>>>} placeholders
 * @param defaults values written to missing dotted paths before rendering
 */
public record TypeDefinition(String name,
                             String description,
                             List<String> environments,
                             String bulletMarker,
                             String template,
                             List<ListSpec> lists,
                             List<FragmentSpec> fragments,
                             Map<String, Object> defaults) {

    public static final String DEFAULT_TEMPLATE = "template.tex";

    public TypeDefinition {
        Objects.requireNonNull(name, "name");
        environments = environments == null ? List.of() : List.copyOf(environments);
        template = template == null || template.isBlank() ? DEFAULT_TEMPLATE : template;
        lists = lists == null ? List.of() : List.copyOf(lists);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
        defaults = defaults == null ? Map.of() : defaults;
    }

    public String defaultEnvironment() {
        return environments.isEmpty() ? null : environments.get(0);
    }

    /**
     * A list rendered item by item, either with an inline {@code itemTemplate} or by delegating each item to the
     * nested {@code itemType}.
     */
    public record ListSpec(String name, String source, String itemTemplate, String itemType, String separator) {

        public ListSpec {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(source, "source");
            separator = separator == null ? "\n\n" : separator;
        }
    }

    /**
     * Inline template emitted only when {@code when} holds a non-blank value or {@code whenPresent} holds any
     * non-null value.
     */
    public record FragmentSpec(String name, String when, String whenPresent, String template) {

        public FragmentSpec {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(template, "template");
        }
    }
}
