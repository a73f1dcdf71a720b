package ai.docsite.resume.model;

import java.util.List;
import java.util.Objects;

/**
 * Root of the structured résumé: preamble metadata and pages in order.
 */
public record Document(Metadata metadata, List<Page> pages) {

    public Document {
        Objects.requireNonNull(metadata, "metadata");
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
