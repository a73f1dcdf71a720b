package ai.docsite.resume.latex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class LatexExtractorTest {

    @Test
    void balancedSpanSkipsEscapedDelimiters() {
        String text = "{a \\{ b {c} \\} d} tail";

        LatexExtractor.Span span = LatexExtractor.extractBalancedSpan(text, 1, '{', '}');

        assertThat(span.content()).isEqualTo("a \\{ b {c} \\} d");
        assertThat(text.substring(span.end())).isEqualTo(" tail");
    }

    @Test
    void unbalancedSpanIsMalformed() {
        Throwable thrown = catchThrowable(() -> LatexExtractor.extractBalancedSpan("{open {inner}", 1, '{', '}'));

        assertThat(thrown).isInstanceOf(MalformedMarkupException.class)
                .hasMessageContaining("Unbalanced");
    }

    @Test
    void environmentBlockClosesAtMatchingDepth() {
        String text = "x \\begin{box}outer \\begin{box}inner\\end{box} rest\\end{box} y";

        LatexExtractor.EnvironmentBlock block = LatexExtractor.extractEnvironmentBlock(text, "box", 0);

        assertThat(block.content()).isEqualTo("outer \\begin{box}inner\\end{box} rest");
        assertThat(block.source()).startsWith("\\begin{box}").endsWith("\\end{box}");
        assertThat(text.substring(block.end())).isEqualTo(" y");
    }

    @Test
    void environmentParametersAreConsumedInOrder() {
        String text = "\\begin{itemizeAcademic}{Acme}{Engineer}{Remote}{2020}\n\\itemi Built things.\n"
                + "\\end{itemizeAcademic}";

        LatexExtractor.ParsedEnvironment environment =
                LatexExtractor.extractEnvironment(text, "itemizeAcademic", 4, 0, 0);

        assertThat(environment.params()).containsExactly("Acme", "Engineer", "Remote", "2020");
        assertThat(environment.content()).isEqualTo("\\itemi Built things.");
    }

    @Test
    void missingOptionalGroupIsNotCounted() {
        String withOptions = "\\begin{itemize}[leftmargin=0pt]\n\\item One\n\\end{itemize}";
        String withoutOptions = "\\begin{itemize}\n\\item One\n\\end{itemize}";

        LatexExtractor.ParsedEnvironment first = LatexExtractor.extractEnvironment(withOptions, "itemize", 0, 1, 0);
        LatexExtractor.ParsedEnvironment second =
                LatexExtractor.extractEnvironment(withoutOptions, "itemize", 0, 1, 0);

        assertThat(first.optionalFound()).isEqualTo(1);
        assertThat(first.params()).containsExactly("leftmargin=0pt");
        assertThat(second.optionalFound()).isZero();
        assertThat(second.params()).isEmpty();
        assertThat(second.content()).isEqualTo("\\item One");
    }

    @Test
    void missingMandatoryParameterIsMalformed() {
        String text = "\\begin{itemizeAProject}{A}{B}\n\\itemii x\n\\end{itemizeAProject}";

        Throwable thrown = catchThrowable(() -> LatexExtractor.extractEnvironment(text, "itemizeAProject", 3, 0, 0));

        assertThat(thrown).isInstanceOf(MalformedMarkupException.class)
                .hasMessageContaining("parameter 3 is missing");
    }

    @Test
    void allEnvironmentsReturnsTopLevelBlocksOnly() {
        String text = "\\begin{itemizeAProject}{a}{One}{}\\begin{itemizeKeyProject}{b}{Nested}{}x"
                + "\\end{itemizeKeyProject}\\end{itemizeAProject}\n"
                + "\\begin{itemizeProjSecond}{c}{Two}{}y\\end{itemizeProjSecond}";

        List<LatexExtractor.EnvironmentBlock> blocks =
                LatexExtractor.extractAllEnvironments(text, PatternCatalog.ITEMIZE_PROJECT_ENV);

        assertThat(blocks).extracting(LatexExtractor.EnvironmentBlock::name)
                .containsExactly("itemizeAProject", "itemizeProjSecond");
    }

    @Test
    void splitEntriesUsesNamedMarkerGroup() {
        String content = "ignored \\itemi First point\n\\itemii Second \\textbf{point}\n\\itemi";

        List<LatexExtractor.Entry> entries =
                LatexExtractor.splitEntries(content, Pattern.compile(PatternCatalog.ITEM_ALPHABETIC));

        assertThat(entries).extracting(LatexExtractor.Entry::marker).containsExactly("itemi", "itemii");
        assertThat(entries).extracting(LatexExtractor.Entry::latexRaw)
                .containsExactly("First point", "Second \\textbf{point}");
        assertThat(entries.get(1).plaintext()).isEqualTo("Second point");
    }

    @Test
    void bracketedItemsKeepNestedLabels() {
        String content = "\\item[\\raisebox{-1pt}{>} 20,000] users served\n\\item plain entry";

        List<LatexExtractor.Entry> entries = LatexExtractor.splitBracketedItems(content);

        assertThat(entries).extracting(LatexExtractor.Entry::marker)
                .containsExactly("item[\\raisebox{-1pt}{>} 20,000]", "item");
        assertThat(entries).extracting(LatexExtractor.Entry::latexRaw)
                .containsExactly("users served", "plain entry");
    }

    @Test
    void entriesNeverStartWithTheirMarker() {
        List<LatexExtractor.Entry> alphabetic = LatexExtractor.splitEntries(
                "\\itemi Led \\textit{design}\n\\itemLL Java\n\\itemii \\itemii Nested twice\n\\item Last",
                Pattern.compile(PatternCatalog.ITEM_ALPHABETIC));
        List<LatexExtractor.Entry> bracketed = LatexExtractor.splitBracketedItems(
                "\\item[\\faCode]   Java\n\\item[{a [b]}]Go\n\\item\tRust\n\\item[x]\n\\item");

        assertThat(alphabetic).extracting(LatexExtractor.Entry::latexRaw)
                .containsExactly("Led \\textit{design}", "Java", "Nested twice", "Last");
        assertThat(bracketed).extracting(LatexExtractor.Entry::latexRaw).containsExactly("Java", "Go", "Rust");
        for (LatexExtractor.Entry entry : Stream.concat(alphabetic.stream(), bracketed.stream()).toList()) {
            assertThat(entry.latexRaw()).doesNotStartWith("\\" + entry.marker())
                    .doesNotContain("\\item")
                    .isEqualTo(entry.latexRaw().strip());
        }
    }
}
