package ai.docsite.resume.generate;

import ai.docsite.resume.dsl.ConfigurationException;
import ai.docsite.resume.dsl.NestedPaths;
import ai.docsite.resume.registry.TemplateRegistry;
import ai.docsite.resume.registry.TypeDefinition;
import ai.docsite.resume.registry.TypeRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders one section or subsection body from its type definition and template.
 *
 * <p>Before rendering, defaults fill missing paths, {@code environment} is set from
 * {@code metadata.environment_type} or the type's first environment, every declared list is rendered into
 * {@code list.NAME} and every fragment into {@code fragment.NAME}. List items of type {@value #RAW_TYPE} are
 * emitted as their {@code content.raw} text.</p>
 */
public class TypeRenderer {

    static final String ENVIRONMENT_KEY = "environment";
    static final String ENVIRONMENT_TYPE_PATH = "metadata.environment_type";
    static final String RAW_TYPE = "unknown";
    static final String RAW_CONTENT_PATH = "content.raw";

    private final TypeRegistry types;
    private final TemplateRegistry templates;
    private final TemplateRenderer renderer;

    public TypeRenderer(TypeRegistry types, TemplateRegistry templates, TemplateRenderer renderer) {
        this.types = Objects.requireNonNull(types, "types");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public boolean supports(String typeName) {
        return typeName != null && types.findDefinition(typeName).isPresent();
    }

    public String render(String typeName, Map<String, Object> data) {
        TypeDefinition definition;
        try {
            definition = types.requireDefinition(typeName);
        } catch (ConfigurationException ex) {
            throw new TemplateRenderException("Unknown type '" + typeName + "'", ex);
        }
        Map<String, Object> scope = copyOf(data);
        definition.defaults().forEach((path, value) -> {
            if (NestedPaths.get(scope, path) == null) {
                NestedPaths.set(scope, path, value);
            }
        });
        Object environment = NestedPaths.get(scope, ENVIRONMENT_TYPE_PATH);
        if (environment == null) {
            environment = definition.defaultEnvironment();
        }
        if (environment != null) {
            scope.put(ENVIRONMENT_KEY, environment);
        }

        Map<String, Object> lists = new LinkedHashMap<>();
        for (TypeDefinition.ListSpec list : definition.lists()) {
            lists.put(list.name(), renderList(definition, list, scope));
        }
        scope.put("list", lists);

        Map<String, Object> fragments = new LinkedHashMap<>();
        for (TypeDefinition.FragmentSpec fragment : definition.fragments()) {
            fragments.put(fragment.name(), applies(fragment, scope) ? renderer.render(fragment.template(), scope) : "");
        }
        scope.put("fragment", fragments);

        String template;
        try {
            template = templates.typeTemplate(definition);
        } catch (ConfigurationException ex) {
            throw new TemplateRenderException(ex.getMessage(), ex);
        }
        try {
            return renderer.render(template, scope).strip();
        } catch (TemplateRenderException ex) {
            throw new TemplateRenderException("Type " + typeName + ": " + ex.getMessage(), ex);
        }
    }

    private String renderList(TypeDefinition definition, TypeDefinition.ListSpec list, Map<String, Object> scope) {
        Object source = NestedPaths.get(scope, list.source());
        if (source == null) {
            return "";
        }
        if (!(source instanceof List<?> items)) {
            throw new TemplateRenderException("Type " + definition.name() + ": " + list.source() + " is not a list");
        }
        List<String> rendered = new ArrayList<>();
        for (Object item : items) {
            Map<String, Object> itemScope = itemScope(item);
            if (RAW_TYPE.equals(itemScope.get("type"))) {
                rendered.add(rawContent(definition, itemScope));
            } else if (list.itemType() != null) {
                rendered.add(render(list.itemType(), itemScope));
            } else if (list.itemTemplate() != null) {
                rendered.add(renderer.render(list.itemTemplate(), itemScope).strip());
            } else {
                throw new TemplateRenderException("Type " + definition.name() + ": list " + list.name()
                        + " needs item_template or item_type");
            }
        }
        return String.join(list.separator(), rendered);
    }

    private static String rawContent(TypeDefinition definition, Map<String, Object> itemScope) {
        String raw = NestedPaths.getString(itemScope, RAW_CONTENT_PATH);
        if (raw == null) {
            throw new TemplateRenderException("Type " + definition.name() + ": raw item without " + RAW_CONTENT_PATH);
        }
        return raw.strip();
    }

    private static boolean applies(TypeDefinition.FragmentSpec fragment, Map<String, Object> scope) {
        if (fragment.whenPresent() != null) {
            return NestedPaths.get(scope, fragment.whenPresent()) != null;
        }
        if (fragment.when() != null) {
            Object value = NestedPaths.get(scope, fragment.when());
            return value != null && !value.toString().isBlank() && !Boolean.FALSE.equals(value);
        }
        return true;
    }

    private static Map<String, Object> itemScope(Object item) {
        if (item instanceof Map<?, ?> map) {
            return copyOf(map);
        }
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("value", item);
        return scope;
    }

    private static Map<String, Object> copyOf(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source == null) {
            return copy;
        }
        source.forEach((key, value) -> copy.put(String.valueOf(key),
                value instanceof Map<?, ?> nested ? copyOf(nested) : value));
        return copy;
    }
}
