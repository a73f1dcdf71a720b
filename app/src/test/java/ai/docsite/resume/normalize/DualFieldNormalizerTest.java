package ai.docsite.resume.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.resume.model.Column;
import ai.docsite.resume.model.Document;
import ai.docsite.resume.model.DualField;
import ai.docsite.resume.model.Metadata;
import ai.docsite.resume.model.Page;
import ai.docsite.resume.model.PageRegions;
import ai.docsite.resume.model.Section;
import ai.docsite.resume.model.Subsection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DualFieldNormalizerTest {

    private final DualFieldNormalizer normalizer = new DualFieldNormalizer();

    @Test
    void completesEitherHalfOfADualField() {
        assertThat(DualFieldNormalizer.complete(new DualField(null, "R&D at 100%")))
                .isEqualTo(new DualField("R\\&D at 100\\%", "R&D at 100%"));
        assertThat(DualFieldNormalizer.complete(new DualField("Jordan \\textbf{Lee}", null)))
                .isEqualTo(new DualField("Jordan \\textbf{Lee}", "Jordan Lee"));
        assertThat(DualFieldNormalizer.complete(new DualField("\\textbf{A}", "kept as written")))
                .isEqualTo(new DualField("\\textbf{A}", "kept as written"));
        assertThat(DualFieldNormalizer.complete(null)).isNull();
    }

    @Test
    void fillsMissingHalvesOfListEntries() {
        Section interests = new Section(new DualField(null, "Games & Sport"), "custom_itemize", null, null,
                Map.of("bullets", List.of(
                        Map.of("marker", "item", "plaintext", "Chess & Go"),
                        Map.of("marker", "item", "latex_raw", "\\textbf{Climbing}"),
                        Map.of("marker", "item", "latex_raw", "\\emph{Go}", "plaintext", "Baduk"))),
                null, null);

        Section normalized = firstSection(normalizer.normalize(document(interests)));

        assertThat(normalized.name()).isEqualTo(new DualField("Games \\& Sport", "Games & Sport"));
        assertThat(bullets(normalized.content()))
                .containsExactly(
                        Map.of("marker", "item", "plaintext", "Chess & Go", "latex_raw", "Chess \\& Go"),
                        Map.of("marker", "item", "latex_raw", "\\textbf{Climbing}", "plaintext", "Climbing"),
                        Map.of("marker", "item", "latex_raw", "\\emph{Go}", "plaintext", "Baduk"));
    }

    @Test
    void fillsPlaintextCompanionsOfSubsectionMetadata() {
        Subsection job = new Subsection("work_experience",
                Map.of("company", "\\textbf{Acme} Corp", "title_plaintext", "R&D Lead", "dates", "2020"),
                Map.of("bullets", List.of(Map.of("marker", "itemi", "plaintext", "Saved $5"))));
        Section experience = new Section(DualField.of("Experience"), "work_history", null, null, null,
                List.of(job), null);

        Subsection normalized = firstSection(normalizer.normalize(document(experience))).subsections().get(0);

        assertThat(normalized.metadata())
                .containsEntry("company_plaintext", "Acme Corp")
                .containsEntry("title", "R\\&D Lead")
                .containsEntry("dates", "2020")
                .doesNotContainKey("dates_plaintext");
        assertThat(bullets(normalized.content()))
                .containsExactly(Map.of("marker", "itemi", "plaintext", "Saved $5", "latex_raw", "Saved \\$5"));
    }

    @Test
    void completesPreambleFieldsAndLeavesTheInputUntouched() {
        Metadata metadata = new Metadata(new DualField(null, "Jordan & Lee"), DualField.of("October 2026"), null,
                null, null, null, null, null, null, null, null, null, null);
        Document document = new Document(metadata, List.of());

        Document normalized = normalizer.normalize(document);

        assertThat(normalized.metadata().name()).isEqualTo(new DualField("Jordan \\& Lee", "Jordan & Lee"));
        assertThat(normalized.metadata().date()).isEqualTo(DualField.of("October 2026"));
        assertThat(normalized.metadata().brand()).isNull();
        assertThat(document.metadata().name().raw()).isNull();
    }

    private static Document document(Section section) {
        Metadata metadata = new Metadata(DualField.of("Jordan"), null, null, null, null, null, null, null, null, null,
                null, null, null);
        PageRegions regions = new PageRegions(null, null, new Column(List.of(section)), null, List.of());
        return new Document(metadata, List.of(new Page(1, false, regions)));
    }

    private static Section firstSection(Document document) {
        return document.pages().get(0).regions().mainColumn().sections().get(0);
    }

    private static List<Object> bullets(Map<String, Object> content) {
        Object value = content.get("bullets");
        assertThat(value).isInstanceOf(List.class);
        return new ArrayList<>((List<?>) value);
    }
}
