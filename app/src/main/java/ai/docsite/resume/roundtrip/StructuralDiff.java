package ai.docsite.resume.roundtrip;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares two parsed document trees leaf by leaf. Key order is ignored; list positions are not.
 *
 * @param differences one line per differing leaf path
 */
public record StructuralDiff(List<String> differences) {

    static final String MISSING = "<missing>";

    public StructuralDiff {
        differences = List.copyOf(differences);
    }

    public static StructuralDiff compare(JsonNode before, JsonNode after) {
        Map<String, JsonNode> beforeLeaves = leaves(before);
        Map<String, JsonNode> afterLeaves = leaves(after);
        Set<String> paths = new LinkedHashSet<>(beforeLeaves.keySet());
        paths.addAll(afterLeaves.keySet());
        List<String> differences = new ArrayList<>();
        for (String path : paths) {
            JsonNode left = beforeLeaves.get(path);
            JsonNode right = afterLeaves.get(path);
            if (!Objects.equals(left, right)) {
                differences.add(path + ": " + describe(left) + " -> " + describe(right));
            }
        }
        return new StructuralDiff(differences);
    }

    public int count() {
        return differences.size();
    }

    public String render() {
        return differences.isEmpty() ? "" : String.join("\n", differences) + "\n";
    }

    static Map<String, JsonNode> leaves(JsonNode root) {
        Map<String, JsonNode> leaves = new LinkedHashMap<>();
        if (root != null) {
            collect("", root, leaves);
        }
        return leaves;
    }

    private static void collect(String path, JsonNode node, Map<String, JsonNode> leaves) {
        if (node.isObject() && node.size() > 0) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(path.isEmpty() ? field.getKey() : path + "." + field.getKey(), field.getValue(), leaves);
            }
        } else if (node.isArray() && node.size() > 0) {
            for (int i = 0; i < node.size(); i++) {
                collect(path + "[" + i + "]", node.get(i), leaves);
            }
        } else {
            leaves.put(path.isEmpty() ? "$" : path, node);
        }
    }

    private static String describe(JsonNode node) {
        if (node == null) {
            return MISSING;
        }
        String text = node.isTextual() ? "'" + node.asText() + "'" : node.toString();
        return text.length() > 80 ? text.substring(0, 77) + "..." : text;
    }
}
