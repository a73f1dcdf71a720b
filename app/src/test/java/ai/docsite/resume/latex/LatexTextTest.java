package ai.docsite.resume.latex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.jupiter.api.Test;

class LatexTextTest {

    @Test
    void limitsBlankLineRuns() {
        String text = "a\n\n\n\nb\n\nc";

        assertThat(LatexText.limitBlankLines(text, 1)).isEqualTo("a\n\nb\n\nc");
        assertThat(LatexText.limitBlankLines(text, 0)).isEqualTo("a\nb\nc");
    }

    @Test
    void rejectsNegativeBlankLineLimit() {
        assertThat(catchThrowable(() -> LatexText.limitBlankLines("a", -1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prependsPrefixWithoutDuplicatingOverlap() {
        assertThat(LatexText.prependWithoutOverlap("https://www.", "www.github.com/jlee"))
                .isEqualTo("https://www.github.com/jlee");
        assertThat(LatexText.prependWithoutOverlap("https://www.", "github.com/jlee"))
                .isEqualTo("https://www.github.com/jlee");
        assertThat(LatexText.prependWithoutOverlap("mailto:", "jlee@example.com"))
                .isEqualTo("mailto:jlee@example.com");
    }

    @Test
    void removesBlankLinesAndTrailingWhitespace() {
        assertThat(LatexText.removeBlankLines("a\n  \nb\n")).isEqualTo("a\nb");
        assertThat(LatexText.stripTrailingWhitespace("a  \nb\t")).isEqualTo("a\nb");
    }
}
