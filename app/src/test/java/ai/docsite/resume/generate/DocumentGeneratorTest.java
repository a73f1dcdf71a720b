package ai.docsite.resume.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.resume.Fixtures;
import ai.docsite.resume.model.Column;
import ai.docsite.resume.model.ContactOverride;
import ai.docsite.resume.model.Decoration;
import ai.docsite.resume.model.Document;
import ai.docsite.resume.model.DualField;
import ai.docsite.resume.model.Metadata;
import ai.docsite.resume.model.Page;
import ai.docsite.resume.model.PageRegions;
import ai.docsite.resume.model.Section;
import ai.docsite.resume.model.Subsection;
import ai.docsite.resume.model.TopRegion;
import ai.docsite.resume.parse.DocumentParser;
import ai.docsite.resume.registry.ResourceLocator;
import ai.docsite.resume.registry.TemplateRegistry;
import ai.docsite.resume.registry.TypeRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentGeneratorTest {

    private final TypeRegistry types = new TypeRegistry(ResourceLocator.classpath("resume"));
    private final DocumentGenerator generator =
            new DocumentGenerator(types, new TemplateRegistry(types.locator()), ContactProfile.loadDefault());

    @Test
    void regeneratesParsedResume() {
        Document document = new DocumentParser(types).parse(Fixtures.read(Fixtures.SAMPLE_RESUME)).document();

        String latex = generator.generate(document);

        assertThat(latex)
                .contains("\\renewcommand{\\myname}{Jordan \\textbf{Lee}}")
                .contains("\\togglefalse{list_title_after_name}")
                .contains("\\usepackage{tikz}")
                .contains("\\setlength{\\columnsep}{12pt}")
                .contains("\\faInbox & \\href{mailto:jordan.lee@example.com}{jordan.lee@example.com} \\\\")
                .contains("\\begin{itemizeAcademic}{Acme Corp}{Senior Engineer\\\\Platform Team}{Remote}{2020 -- 2024}")
                .contains("\\begin{itemizeAProject}{{\\large $\\bullet$}}{Billing Service}{2021}")
                .contains("\\item[\\faCode]{\\scshape Languages}\n\\addcontentsline{toc}{section}{Languages}")
                .contains("\\begin{itemize}[leftmargin=0pt]")
                .contains("Git | Docker | Maven")
                .contains("\\switchcolumn")
                .contains("\\clearpage")
                .contains("\\bottombar{4}")
                .contains("\\section*{Notes}\n\nAvailable on request.")
                .doesNotContain("\n\n\n")
                .endsWith("\\end{document}\n");
    }

    @Test
    void appliesTypeDefaultsToMissingMetadata() {
        Subsection project = new Subsection("project", Map.of("name", "Search"),
                Map.of("bullets", List.of(Map.of("marker", "itemii", "latex_raw", "Built it."))));
        Section section = new Section(DualField.of("Projects"), "projects", null, null, null, List.of(project), null);

        String rendered = generator.renderSection(section);

        assertThat(rendered).isEqualTo("\\section*{Projects}\n\n"
                + "\\begin{itemizeProjMain}\n\n"
                + "\\begin{itemizeAProject}{{\\large $\\bullet$}}{Search}{}\n\n"
                + "\\itemii Built it.\n\n"
                + "\\end{itemizeAProject}\n\n"
                + "\\end{itemizeProjMain}");
    }

    @Test
    void unknownSectionsEmitRawContent() {
        Section raw = new Section(DualField.of("Notes"), "unknown", "\\vspace{2pt}", null,
                Map.of("raw", "Free text."), null, null);
        Section unsupported = new Section(DualField.of("Odd"), "mystery", null, null, Map.of(), null, null);

        assertThat(generator.renderSection(raw)).isEqualTo("\\section*{Notes}\n\nFree text.\n\n\\vspace{2pt}");
        assertThat(generator.renderSection(unsupported)).contains("% Unknown section type: mystery");
    }

    @Test
    void plaintextOnlyYamlEditsAreEscapedOnGeneration() {
        Section interests = new Section(new DualField(null, "Games & Sport"), "custom_itemize", null, null,
                Map.of("bullets", List.of(
                        Map.of("marker", "item", "plaintext", "Chess & Go"),
                        Map.of("marker", "item", "latex_raw", "\\textbf{Climbing}"))),
                null, null);
        Page page = new Page(1, false, new PageRegions(new TopRegion(true), null, new Column(List.of(interests)),
                null, List.of()));

        String latex = generator.generate(new Document(metadata(), List.of(page)));

        assertThat(latex).contains("\\section*{Games \\& Sport}\n\n\\begin{itemize}\n\n"
                + "\\item Chess \\& Go\n\n\\item \\textbf{Climbing}\n\n\\end{itemize}");
    }

    @Test
    void malformedEntryIsEmittedVerbatimBetweenRenderedSiblings() {
        String broken = "\\begin{itemizeAcademic}{Beta}{Engineer}\n\\itemi y\n\\end{itemizeAcademic}";
        String latex = "\\begin{document}\n\\begin{paracol}{2}\n\\section*{Experience}\n\n"
                + "\\begin{itemizeAcademic}{Acme}{Engineer}{Remote}{2020}\n\\itemi x\n\\end{itemizeAcademic}\n\n"
                + broken + "\n\n"
                + "\\begin{itemizeAcademic}{Gamma}{Lead}{Berlin}{2018}\n\\itemi z\n\\end{itemizeAcademic}\n"
                + "\\end{paracol}\n\\end{document}\n";
        Section experience = new DocumentParser(types).parse(latex).document()
                .pages().get(0).regions().mainColumn().sections().get(0);

        String rendered = generator.renderSection(experience);

        assertThat(rendered).contains(broken);
        assertThat(rendered.indexOf("{Acme}")).isLessThan(rendered.indexOf(broken));
        assertThat(rendered.indexOf(broken)).isLessThan(rendered.indexOf("{Gamma}"));
    }

    @Test
    void pageWithoutLeftColumnHasNoColumnSwitch() {
        Section notes = new Section(DualField.of("Notes"), "unknown", null, null, Map.of("raw", "Text."), null, null);
        Page mainOnly = new Page(1, false, new PageRegions(new TopRegion(true), null, new Column(List.of(notes)),
                null, null));
        Page twoColumns = new Page(1, false, new PageRegions(new TopRegion(true), new Column(List.of(notes)),
                new Column(List.of(notes)), null, null));

        assertThat(generator.renderPage(mainOnly)).doesNotContain("\\switchcolumn");
        assertThat(generator.renderPage(twoColumns)).contains("Text.\n\n\\switchcolumn\n\n\\section*{Notes}");
    }

    @Test
    void rendersTextblockDecorationWithLiteral() {
        Page page = new Page(1, false, new PageRegions(new TopRegion(true), null, null, "\\centering Hi",
                List.of(new Decoration(Decoration.TEXTBLOCK, List.of("4in", "0.5in, 0.2in")),
                        new Decoration("leftgrad", List.of()))));

        assertThat(generator.renderPage(page)).isEqualTo(
                "\\begin{textblock*}{4in}(0.5in, 0.2in)\n\\centering Hi\n\\end{textblock*}\n\n\\leftgrad");
    }

    @Test
    void documentContactOverrideWins() {
        Metadata metadata = metadata().withCustomContactInfo(
                new ContactOverride(List.of("website"), Map.of("website", "jlee.io")));

        String latex = generator.generate(new Document(metadata, List.of()));

        assertThat(latex).contains("\\faGlobe & \\href{https://www.jlee.io}{jlee.io} \\\\")
                .doesNotContain("\\faPhone");
    }

    @Test
    void selectedContactWithoutValueFails() {
        Metadata metadata = metadata().withCustomContactInfo(
                new ContactOverride(List.of("website"), Map.of("website", " ")));

        Throwable thrown = catchThrowable(() -> generator.generate(new Document(metadata, List.of())));

        assertThat(thrown).isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("website");
    }

    private static Metadata metadata() {
        return new Metadata(DualField.of("Sam Doe"), null, null, null, null, null, null, null, null, null, null,
                null, null);
    }
}
