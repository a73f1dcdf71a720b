package ai.docsite.resume.dsl;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * One step of a {@link ParseConfig}. The {@code operation} key selects the kind when read from YAML.
 *
 * <p>Inputs come from the running content unless {@link #source()} names a context slot or
 * {@link #sourcePath()} names a dotted result path. Outputs go to {@link #outputContext()},
 * {@link #outputPath()} or, for operations that support it, {@code outputPaths}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "operation")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Operation.SetLiteral.class, name = "set_literal"),
        @JsonSubTypes.Type(value = Operation.ExtractEnvironment.class, name = "extract_environment"),
        @JsonSubTypes.Type(value = Operation.Split.class, name = "split"),
        @JsonSubTypes.Type(value = Operation.ParseItemize.class, name = "parse_itemize"),
        @JsonSubTypes.Type(value = Operation.RecursiveParse.class, name = "recursive_parse"),
        @JsonSubTypes.Type(value = Operation.ExtractBracedAfterPattern.class, name = "extract_braced_after_pattern"),
        @JsonSubTypes.Type(value = Operation.ExtractRegex.class, name = "extract_regex"),
        @JsonSubTypes.Type(value = Operation.ToPlaintext.class, name = "to_plaintext")
})
public interface Operation {

    /** Optional step label used in diagnostics. */
    String name();

    default String source() {
        return null;
    }

    default String sourcePath() {
        return null;
    }

    default String outputPath() {
        return null;
    }

    default String outputContext() {
        return null;
    }

    /** Writes a constant. */
    record SetLiteral(String name, String outputPath, String outputContext, Object value) implements Operation {
    }

    /**
     * Extracts the first candidate environment that matches. Candidate names may contain {@code {{{path}}}}
     * placeholders resolved against the result tree.
     */
    record ExtractEnvironment(String name,
                              @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                              List<String> envName,
                              Integer numParams,
                              Integer numOptionalParams,
                              List<String> paramNames,
                              String source,
                              String sourcePath,
                              String outputPath,
                              String outputContext,
                              String matchedNamePath,
                              Boolean captureTrailingText) implements Operation {
    }

    /** Splits on {@code delimiter}, or before every match of the named {@code delimiterPattern}. */
    record Split(String name,
                 String source,
                 String sourcePath,
                 String delimiter,
                 String delimiterPattern,
                 String cleanupPattern,
                 Integer maxParts,
                 String outputPath,
                 Object outputPaths,
                 String outputContext) implements Operation {
    }

    record ParseItemize(String name,
                        String source,
                        String sourcePath,
                        String markerPattern,
                        Boolean bracketedMarkers,
                        String outputPath,
                        String outputContext) implements Operation {
    }

    /** Runs the {@code configName} pipeline over each chunk or each nested environment block. */
    record RecursiveParse(String name,
                          String source,
                          String sourcePath,
                          String recursivePattern,
                          String configName,
                          String outputPath,
                          String outputContext) implements Operation {
    }

    record ExtractBracedAfterPattern(String name,
                                     String source,
                                     String sourcePath,
                                     String pattern,
                                     String patternName,
                                     String outputPath,
                                     String outputContext) implements Operation {
    }

    record ExtractRegex(String name,
                        String source,
                        String sourcePath,
                        String regex,
                        String patternName,
                        String outputPath,
                        Object outputPaths,
                        String outputContext) implements Operation {
    }

    record ToPlaintext(String name,
                       String source,
                       String sourcePath,
                       String outputPath,
                       String outputContext) implements Operation {
    }
}
