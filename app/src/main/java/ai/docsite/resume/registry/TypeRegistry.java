package ai.docsite.resume.registry;

import ai.docsite.resume.dsl.ConfigurationException;
import ai.docsite.resume.dsl.ParseConfig;
import ai.docsite.resume.dsl.ParseConfigSource;
import ai.docsite.resume.model.YamlMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily loaded, process-lifetime cache of type definitions and parse configurations keyed by type name.
 * Entries are never invalidated automatically; {@link #clearCache()} empties both caches.
 */
public class TypeRegistry implements ParseConfigSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);

    static final String TYPES_DIRECTORY = "types/";
    static final String TYPE_FILE = "type.yaml";
    static final String PARSE_CONFIG_FILE = "parse_config.yaml";

    private final ResourceLocator locator;
    private final ObjectMapper mapper;
    private final Map<String, Optional<TypeDefinition>> definitions = new ConcurrentHashMap<>();
    private final Map<String, Optional<ParseConfig>> parseConfigs = new ConcurrentHashMap<>();

    public TypeRegistry(ResourceLocator locator) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.mapper = YamlMappers.create();
    }

    public ResourceLocator locator() {
        return locator;
    }

    public Optional<TypeDefinition> findDefinition(String typeName) {
        return definitions.computeIfAbsent(typeName,
                name -> load(name, TYPE_FILE, TypeDefinition.class));
    }

    public TypeDefinition requireDefinition(String typeName) {
        return findDefinition(typeName).orElseThrow(() -> new ConfigurationException(
                "No type definition for '" + typeName + "' in " + locator.describe()));
    }

    @Override
    public Optional<ParseConfig> find(String typeName) {
        return parseConfigs.computeIfAbsent(typeName,
                name -> load(name, PARSE_CONFIG_FILE, ParseConfig.class));
    }

    public boolean isCached(String typeName) {
        return definitions.containsKey(typeName) || parseConfigs.containsKey(typeName);
    }

    public void clearCache() {
        definitions.clear();
        parseConfigs.clear();
    }

    private <T> Optional<T> load(String typeName, String fileName, Class<T> type) {
        String path = TYPES_DIRECTORY + typeName + "/" + fileName;
        Optional<String> yaml = locator.read(path);
        if (yaml.isEmpty()) {
            LOGGER.debug("No {} for type {} in {}", fileName, typeName, locator.describe());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(yaml.get(), type));
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Invalid " + path + " in " + locator.describe() + ": "
                    + ex.getOriginalMessage(), ex);
        }
    }
}
