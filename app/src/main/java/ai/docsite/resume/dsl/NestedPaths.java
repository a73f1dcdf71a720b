package ai.docsite.resume.dsl;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes dotted paths such as {@code metadata.company} in nested result maps.
 */
public final class NestedPaths {

    private NestedPaths() {
    }

    public static Object get(Map<String, Object> root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return null;
        }
        Object current = root;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    public static String getString(Map<String, Object> root, String path) {
        Object value = get(root, path);
        return value == null ? null : value.toString();
    }

    /**
     * Sets a value, creating missing intermediate maps. Intermediate maps on the path are replaced by string-keyed
     * copies holding the same entries.
     */
    public static void set(Map<String, Object> root, String path, Object value) {
        String[] keys = path.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < keys.length - 1; i++) {
            Map<String, Object> child = new LinkedHashMap<>();
            if (current.get(keys[i]) instanceof Map<?, ?> existing) {
                existing.forEach((key, nested) -> child.put(String.valueOf(key), nested));
            }
            current.put(keys[i], child);
            current = child;
        }
        current.put(keys[keys.length - 1], value);
    }
}
