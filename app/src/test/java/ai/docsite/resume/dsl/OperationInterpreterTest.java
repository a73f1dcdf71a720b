package ai.docsite.resume.dsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.resume.latex.MalformedMarkupException;
import ai.docsite.resume.model.YamlMappers;
import ai.docsite.resume.registry.ResourceLocator;
import ai.docsite.resume.registry.TypeRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OperationInterpreterTest {

    private final Map<String, ParseConfig> configs = new HashMap<>();
    private final OperationInterpreter interpreter =
            new OperationInterpreter(name -> Optional.ofNullable(configs.get(name)));

    @Test
    void extractsEnvironmentParametersAndBullets() {
        register("""
                name: entry
                operations:
                  - operation: extract_environment
                    env_name: itemizeAcademic
                    num_params: 4
                    param_names: [metadata.company, metadata.title, metadata.location, metadata.dates]
                  - operation: parse_itemize
                    output_path: content.bullets
                """);

        Map<String, Object> result = interpreter.run("entry",
                "\\begin{itemizeAcademic}{Acme}{Engineer}{Remote}{2020}\n"
                        + "\\itemi Built \\textbf{things}.\n\\itemi Shipped.\n\\end{itemizeAcademic}");

        assertThat(NestedPaths.get(result, "metadata.company")).isEqualTo("Acme");
        assertThat(NestedPaths.get(result, "metadata.dates")).isEqualTo("2020");
        assertThat(bullets(result, "content.bullets")).hasSize(2);
        assertThat(bullets(result, "content.bullets").get(0))
                .containsEntry("marker", "itemi")
                .containsEntry("latex_raw", "Built \\textbf{things}.")
                .containsEntry("plaintext", "Built things.");
    }

    @Test
    void resolvesEnvironmentNamePlaceholdersFromSeed() {
        register("""
                name: block
                operations:
                  - operation: extract_environment
                    env_name: ['{{{metadata.environment_type}}}', itemizeAProject]
                    num_params: 1
                    param_names: [metadata.name]
                    matched_name_path: metadata.matched
                """);
        Map<String, Object> seed = new LinkedHashMap<>();
        NestedPaths.set(seed, "metadata.environment_type", "itemizeKeyProject");

        Map<String, Object> result = interpreter.run(configs.get("block"),
                "\\begin{itemizeKeyProject}{Search}\\itemii x\\end{itemizeKeyProject}", seed);

        assertThat(NestedPaths.get(result, "metadata.name")).isEqualTo("Search");
        assertThat(NestedPaths.get(result, "metadata.matched")).isEqualTo("itemizeKeyProject");
    }

    @Test
    void capturesTrailingTextAfterEnvironment() {
        register("""
                name: list
                operations:
                  - operation: extract_environment
                    env_name: itemize
                    capture_trailing_text: true
                    output_context: items
                """);

        Map<String, Object> result = interpreter.run("list", "\\begin{itemize}\\item a\\end{itemize}\n\nAnd more.");

        assertThat(NestedPaths.get(result, "metadata.trailing_text")).isEqualTo("And more.");
    }

    @Test
    void unmatchedEnvironmentIsMalformedMarkup() {
        register("""
                name: list
                operations:
                  - operation: extract_environment
                    env_name: [itemizeMain, itemize]
                """);

        Throwable thrown = catchThrowable(() -> interpreter.run("list", "no environments here"));

        assertThat(thrown).isInstanceOf(MalformedMarkupException.class)
                .hasMessageContaining("none of the environments");
    }

    @Test
    void splitWritesPiecesToOutputPaths() {
        register("""
                name: title
                operations:
                  - operation: split
                    source_path: metadata.title
                    delimiter: TITLE_BREAK
                    max_parts: 2
                    output_paths: [metadata.title, metadata.subtitle]
                """);
        Map<String, Object> seed = new LinkedHashMap<>();
        NestedPaths.set(seed, "metadata.title", "Engineer\\\\Platform Team");

        Map<String, Object> split = interpreter.run(configs.get("title"), "", seed);

        assertThat(NestedPaths.get(split, "metadata.title")).isEqualTo("Engineer");
        assertThat(NestedPaths.get(split, "metadata.subtitle")).isEqualTo("Platform Team");
    }

    @Test
    void splitConvertsPiecesToPlaintextEntries() {
        register("""
                name: pipes
                operations:
                  - operation: split
                    delimiter: PIPE_SEPARATOR
                    output_context: raw_items
                  - operation: to_plaintext
                    source: raw_items
                    output_path: content.items
                """);

        Map<String, Object> result = interpreter.run("pipes", "Git | \\textbf{Docker} |  Maven");

        assertThat(bullets(result, "content.items"))
                .extracting(item -> item.get("plaintext"))
                .containsExactly("Git", "Docker", "Maven");
        assertThat(bullets(result, "content.items").get(1)).doesNotContainKey("marker");
    }

    @Test
    void extractsBracedGroupAfterAnchor() {
        register("""
                name: category
                operations:
                  - operation: extract_braced_after_pattern
                    pattern_name: SKILL_CATEGORY_NAME_ANCHOR
                    output_path: metadata.name
                  - operation: extract_braced_after_pattern
                    pattern: '\\\\setlength\\{\\\\baselineskip\\}\\{'
                    output_path: metadata.skip
                """);

        Map<String, Object> result = interpreter.run("category",
                "\\item[\\faCode] {\\scshape Languages {and} tools}\n\\setlength{\\baselineskip}{10pt}");

        assertThat(NestedPaths.get(result, "metadata.name")).isEqualTo("\\scshape Languages {and} tools");
        assertThat(NestedPaths.get(result, "metadata.skip")).isEqualTo("10pt");
    }

    @Test
    void extractRegexMapsNamedGroupsToPaths() {
        register("""
                name: marker
                operations:
                  - operation: extract_regex
                    pattern_name: SKILL_CATEGORY_MARKER
                    output_paths:
                      marker: metadata.marker
                      icon: metadata.icon
                """);

        Map<String, Object> result = interpreter.run("marker", "\\item[\\faDatabase]{\\scshape Databases}");

        assertThat(NestedPaths.get(result, "metadata.marker")).isEqualTo("item[\\faDatabase]");
        assertThat(NestedPaths.get(result, "metadata.icon")).isEqualTo("\\faDatabase");
    }

    @Test
    void unknownCaptureGroupIsConfigurationError() {
        register("""
                name: marker
                operations:
                  - operation: extract_regex
                    pattern_name: SKILL_CATEGORY_MARKER
                    output_paths:
                      label: metadata.label
                """);

        Throwable thrown = catchThrowable(() -> interpreter.run("marker", "\\item[\\faCode]{\\scshape Code}"));

        assertThat(thrown).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no capture group 'label'");
    }

    @Test
    void unknownPatternNameIsConfigurationError() {
        register("""
                name: bullets
                operations:
                  - operation: parse_itemize
                    marker_pattern: NO_SUCH_PATTERN
                    output_path: content.bullets
                """);

        Throwable thrown = catchThrowable(() -> interpreter.run("bullets", "\\itemi x"));

        assertThat(thrown).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown pattern 'NO_SUCH_PATTERN'");
    }

    @Test
    void invalidRegularExpressionIsConfigurationError() {
        register("""
                name: broken
                operations:
                  - operation: split
                    delimiter: '(unclosed'
                """);

        Throwable thrown = catchThrowable(() -> interpreter.run("broken", "text"));

        assertThat(thrown).isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid regular expression");
    }

    @Test
    void unknownConfigIsConfigurationError() {
        register("""
                name: outer
                operations:
                  - operation: recursive_parse
                    recursive_pattern: itemizeAProject
                    config_name: missing
                """);

        assertThat(catchThrowable(() -> interpreter.run("nothing", "x")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown parse config: nothing");
        assertThat(catchThrowable(() -> interpreter.run("outer", "x")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("unknown nested config 'missing'");
    }

    @Test
    void bundledWorkHistoryConfigParsesNestedProjects() {
        OperationInterpreter bundled = new OperationInterpreter(new TypeRegistry(ResourceLocator.classpath("resume")));
        String latex = "\\begin{itemizeAcademic}{Acme Corp}{Senior Engineer\\\\Platform}{Remote}{2020 -- 2024}\n"
                + "\\itemi Led the migration.\n"
                + "\\begin{itemizeAProject}{{\\large $\\bullet$}}{Billing}{2021}\n"
                + "\\itemii Cut latency.\n"
                + "\\end{itemizeAProject}\n"
                + "\\end{itemizeAcademic}\n\n"
                + "\\begin{itemizeAcademic}{Initech}{Engineer}{Austin}{2018 -- 2020}\n"
                + "\\itemi Wrote reports.\n"
                + "\\end{itemizeAcademic}";

        Map<String, Object> result = bundled.run("work_history", latex);

        List<Map<String, Object>> entries = bullets(result, "subsections");
        assertThat(entries).hasSize(2);
        Map<String, Object> first = entries.get(0);
        assertThat(first).containsEntry("type", "work_experience");
        assertThat(NestedPaths.get(first, "metadata.environment_type")).isEqualTo("itemizeAcademic");
        assertThat(NestedPaths.get(first, "metadata.title")).isEqualTo("Senior Engineer");
        assertThat(NestedPaths.get(first, "metadata.subtitle")).isEqualTo("Platform");
        assertThat(bullets(first, "content.bullets"))
                .extracting(bullet -> bullet.get("latex_raw"))
                .containsExactly("Led the migration.");
        List<Map<String, Object>> projects = bullets(first, "content.projects");
        assertThat(projects).hasSize(1);
        assertThat(NestedPaths.get(projects.get(0), "metadata.name")).isEqualTo("Billing");
        assertThat(NestedPaths.get(projects.get(0), "metadata.bullet_symbol")).isEqualTo("{\\large $\\bullet$}");
        assertThat(NestedPaths.get(entries.get(1), "metadata.subtitle")).isEqualTo("");
    }

    @Test
    void singleGroupRegexYieldsListOfValues() {
        register("""
                name: years
                operations:
                  - operation: extract_regex
                    regex: '(?<year>\\d{4})'
                    output_path: content.years
                """);

        Map<String, Object> result = interpreter.run("years", "2019, 2020 and 2021");

        assertThat(NestedPaths.get(result, "content.years")).isEqualTo(List.of("2019", "2020", "2021"));
    }

    @Test
    void multiGroupRegexYieldsOneMappingPerMatch() {
        register("""
                name: lengths
                operations:
                  - operation: extract_regex
                    regex: '(?<key>[a-z]+)=(?<value>\\d+)'
                    output_path: content.lengths
                """);

        Map<String, Object> result = interpreter.run("lengths", "gap=4 width=12");

        assertThat(NestedPaths.get(result, "content.lengths")).isEqualTo(List.of(
                Map.of("key", "gap", "value", "4"),
                Map.of("key", "width", "value", "12")));
    }

    @Test
    void malformedNestedBlockIsKeptRawWhileSiblingsParse() {
        register("""
                name: job
                operations:
                  - operation: extract_environment
                    env_name: itemizeAcademic
                    num_params: 2
                    param_names: [metadata.company, metadata.title]
                  - operation: set_literal
                    output_path: type
                    value: job
                """);
        register("""
                name: jobs
                operations:
                  - operation: recursive_parse
                    recursive_pattern: ITEMIZE_ACADEMIC_ENV
                    config_name: job
                    output_path: subsections
                """);
        String broken = "\\begin{itemizeAcademic}{Beta}\n\\itemi y\n\\end{itemizeAcademic}";

        Map<String, Object> result = interpreter.run("jobs",
                "\\begin{itemizeAcademic}{Acme}{Engineer}\n\\itemi x\n\\end{itemizeAcademic}\n"
                        + broken + "\n"
                        + "\\begin{itemizeAcademic}{Gamma}{Lead}\n\\itemi z\n\\end{itemizeAcademic}");

        List<Map<String, Object>> jobs = bullets(result, "subsections");
        assertThat(jobs).extracting(job -> job.get("type")).containsExactly("job", "unknown", "job");
        assertThat(NestedPaths.get(jobs.get(0), "metadata.company")).isEqualTo("Acme");
        assertThat(NestedPaths.get(jobs.get(2), "metadata.company")).isEqualTo("Gamma");
        assertThat(NestedPaths.get(jobs.get(1), "content.raw")).isEqualTo(broken);
        assertThat(jobs.get(1).get("error").toString()).contains("parameter 2 is missing");
    }

    private void register(String yaml) {
        try {
            ParseConfig config = YamlMappers.create().readValue(yaml, ParseConfig.class);
            configs.put(config.name(), config);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private static List<Map<String, Object>> bullets(Map<String, Object> result, String path) {
        Object value = NestedPaths.get(result, path);
        assertThat(value).isInstanceOf(List.class);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Object item : (List<?>) value) {
            Map<String, Object> entry = new LinkedHashMap<>();
            ((Map<?, ?>) item).forEach((key, nested) -> entry.put(String.valueOf(key), nested));
            entries.add(entry);
        }
        return entries;
    }
}
