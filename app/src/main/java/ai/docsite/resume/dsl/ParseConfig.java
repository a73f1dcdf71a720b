package ai.docsite.resume.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Named, ordered operation pipeline for one section or subsection type.
 */
public record ParseConfig(String name, String description, List<Operation> operations) {

    public ParseConfig {
        Objects.requireNonNull(name, "name");
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
