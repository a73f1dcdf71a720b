package ai.docsite.resume.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * A headed section of a column.
 *
 * @param type one of the {@link SectionType} names
 * @param spacingAfter trailing {@code \vspace} directives, verbatim
 * @param error parse failure message when the section fell back to raw content
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Section(DualField name,
                      String type,
                      String spacingAfter,
                      Map<String, Object> metadata,
                      Map<String, Object> content,
                      List<Subsection> subsections,
                      String error) {
}
