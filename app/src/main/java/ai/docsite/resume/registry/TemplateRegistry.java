package ai.docsite.resume.registry;

import ai.docsite.resume.dsl.ConfigurationException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cached template text keyed by its path in the type store, e.g. {@code structure/section.tex}.
 */
public class TemplateRegistry {

    private final ResourceLocator locator;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    public TemplateRegistry(ResourceLocator locator) {
        this.locator = Objects.requireNonNull(locator, "locator");
    }

    public String template(String path) {
        return templateCache.computeIfAbsent(path, key -> locator.read(key)
                .orElseThrow(() -> new ConfigurationException("Template not found: " + key
                        + " in " + locator.describe())));
    }

    public String typeTemplate(TypeDefinition definition) {
        return template(TypeRegistry.TYPES_DIRECTORY + definition.name() + "/" + definition.template());
    }

    public boolean isCached(String path) {
        return templateCache.containsKey(path);
    }

    public void clearCache() {
        templateCache.clear();
    }
}
