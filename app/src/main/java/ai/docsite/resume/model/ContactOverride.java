package ai.docsite.resume.model;

import java.util.List;
import java.util.Map;

/**
 * Document-specific contact rows: which fields to show and values replacing the profile's.
 */
public record ContactOverride(List<String> selection, Map<String, String> registry) {
}
