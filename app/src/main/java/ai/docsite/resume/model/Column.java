package ai.docsite.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

public record Column(List<Section> sections) {

    public Column {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sections.isEmpty();
    }
}
