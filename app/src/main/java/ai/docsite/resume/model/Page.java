package ai.docsite.resume.model;

import java.util.Objects;

public record Page(int pageNumber, boolean hasClearpageAfter, PageRegions regions) {

    public Page {
        Objects.requireNonNull(regions, "regions");
    }
}
