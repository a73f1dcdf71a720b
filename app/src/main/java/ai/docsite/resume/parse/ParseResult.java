package ai.docsite.resume.parse;

import ai.docsite.resume.model.Document;
import java.util.List;

/**
 * Parsed document plus the sections and nested blocks that fell back to raw content.
 */
public record ParseResult(Document document, List<SectionFailure> failures) {

    public ParseResult {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record SectionFailure(int pageNumber, String sectionName, String message) {
    }
}
