package ai.docsite.resume.latex;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Line-level text helpers shared by the parser, the generator and the normalizer.
 */
public final class LatexText {

    private static final Pattern BLANK_RUN_NONE = Pattern.compile("\\n\\s*\\n(\\s*\\n)*");
    private static final Pattern BLANK_RUN_SOME = Pattern.compile("\\n\\s*\\n(\\s*\\n)+");
    private static final int SNIPPET_LENGTH = 80;

    private LatexText() {
    }

    /**
     * Collapses every run of blank lines longer than {@code max} down to exactly {@code max} blank lines.
     */
    public static String limitBlankLines(String text, int max) {
        if (max < 0) {
            throw new IllegalArgumentException("max must not be negative: " + max);
        }
        Pattern pattern = max == 0 ? BLANK_RUN_NONE : BLANK_RUN_SOME;
        return pattern.matcher(text).replaceAll("\n".repeat(max + 1));
    }

    public static String removeBlankLines(String text) {
        return text.lines()
                .filter(line -> !line.isBlank())
                .collect(Collectors.joining("\n"));
    }

    public static String stripTrailingWhitespace(String text) {
        return text.lines()
                .map(String::stripTrailing)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Prepends {@code prefix} to {@code value}, skipping the longest suffix of the prefix that the value
     * already starts with, so {@code https://www.} + {@code www.github.com} yields a single {@code www.}.
     */
    public static String prependWithoutOverlap(String prefix, String value) {
        for (int overlap = Math.min(prefix.length(), value.length()); overlap > 0; overlap--) {
            if (value.startsWith(prefix.substring(prefix.length() - overlap))) {
                return prefix.substring(0, prefix.length() - overlap) + value;
            }
        }
        return prefix + value;
    }

    public static String snippet(String text, int from) {
        if (text == null) {
            return "";
        }
        int start = Math.max(0, Math.min(from, text.length()));
        int end = Math.min(text.length(), start + SNIPPET_LENGTH);
        String piece = text.substring(start, end).replace("\n", "\\n");
        return end < text.length() ? piece + "..." : piece;
    }
}
