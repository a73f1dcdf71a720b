package ai.docsite.resume.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * A typed block inside a section: a work-history entry, a project or a skill category.
 *
 * @param error parse failure message when the block fell back to raw content
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Subsection(String type, Map<String, Object> metadata, Map<String, Object> content, String error) {

    public Subsection(String type, Map<String, Object> metadata, Map<String, Object> content) {
        this(type, metadata, content, null);
    }
}
