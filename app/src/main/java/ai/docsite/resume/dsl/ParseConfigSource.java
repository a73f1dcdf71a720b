package ai.docsite.resume.dsl;

import java.util.Optional;

/**
 * Lookup of parse configurations by type name, used for nested parsing.
 */
@FunctionalInterface
public interface ParseConfigSource {

    Optional<ParseConfig> find(String typeName);
}
