package ai.docsite.resume.normalize;

import ai.docsite.resume.latex.LatexExtractor;
import ai.docsite.resume.latex.LatexText;
import ai.docsite.resume.latex.MalformedMarkupException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonicalizes LaTeX layout so that an original résumé and a regenerated one can be compared line by line.
 *
 * <p>Comments and {@code \suggest{...}} blocks are removed first, then whitespace is canonicalized and the
 * structural rules are applied until the text stops changing. Running the normalizer on its own output
 * returns it unchanged.</p>
 */
public class LatexNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatexNormalizer.class);

    static final int MAX_PASSES = 10;
    static final String SUGGEST_COMMAND = "\\suggest{";

    private static final Pattern LINE_END_PAR = Pattern.compile("(?m)^([^\\n]*?\\S)[ \\t]*\\\\par[ \\t]*$");
    private static final Pattern TEXTBLOCK_BEGIN = Pattern.compile("\\\\begin\\{textblock\\*\\}");
    private static final Pattern FOLLOWING_DECORATIONS =
            Pattern.compile("(?:\\s*\\\\(?:leftgrad|bottombar|topgradtri)(?![A-Za-z])(?:\\{[^}]*\\})*)*");
    private static final Pattern PAGE_START = Pattern.compile("\\\\clearpage|\\\\begin\\{paracol\\}\\{[^}]*\\}");

    private final List<Rule> rules = List.of(
            new Rule("tabs", text -> text.replace("\t", "    ")),
            new Rule("leading whitespace", text -> text.replaceAll("(?m)^[ ]+", "")),
            new Rule("legacy education header", text -> text
                    .replaceAll("\\\\noindent\\s*\\{\\\\large\\s*\\\\scshape\\s+Education\\}\\s*",
                            "\\\\section*{Education}\n")
                    .replaceAll("\\\\phantomsection\\s*\\\\textcolor\\{black\\}\\{\\\\bfseries\\s+\\\\large\\s+"
                                    + "Education\\}\\s*\\\\addcontentsline\\{toc\\}\\{section\\}\\{Education\\}"
                                    + "\\s*\\\\columnhrule\\s*",
                            "\\\\section*{Education}\n")),
            new Rule("vspace after switchcolumn",
                    text -> text.replaceAll("(\\\\switchcolumn)\\n+\\\\vspace\\{[^}]+\\}\\n+", "$1\n\n")),
            new Rule("vspace before switchcolumn",
                    text -> text.replaceAll("\\n+\\\\vspace\\{[^}]+\\}\\n+(\\\\switchcolumn)", "\n\n$1")),
            new Rule("preamble declarations", text -> text
                    .replaceAll("\\n\\n+(\\\\(?:renewcommand|setlength|deflen)\\{)", "\n$1")
                    .replaceAll("(\\\\(?:renewcommand|setlength|deflen)\\{[^}]+\\}\\{[^}\\n]*\\})\\n\\n+", "$1\n")),
            new Rule("blank line before item", text -> text.replaceAll("\\n+(\\\\item[^ \\n]*)", "\n\n$1")),
            new Rule("blank lines after end", text -> text.replaceAll("(\\\\end\\{[^}]+\\})\\n+", "$1\n\n\n")),
            new Rule("blank line before end", text -> text.replaceAll("\\n+(\\\\end\\{[^}]+\\})", "\n\n$1")),
            new Rule("blank lines around section", text -> text
                    .replaceAll("\\n+(\\\\section\\*\\{)", "\n\n\n$1")
                    .replaceAll("(\\\\section\\*\\{[^}\\n]+\\})\\n+", "$1\n\n\n")),
            new Rule("blank line before itemize",
                    text -> text.replaceAll("([^\\n])\\n(\\\\begin\\{itemize[^}]*\\})", "$1\n\n$2")),
            new Rule("blank line after itemize",
                    text -> text.replaceAll("(\\\\begin\\{itemize[^}]*\\})\\n+", "$1\n\n")),
            new Rule("textblock position", LatexNormalizer::relocateTextblock),
            new Rule("item label spacing", text -> text.replaceAll("(\\\\item\\[[^\\]]*\\])[ \\t]+\\{", "$1{")),
            new Rule("single space after item", text -> text.replaceAll("(\\\\item\\w+)[ \\t]{2,}", "$1 ")),
            new Rule("stray percent", text -> text.replaceAll("(?m)[ \\t]+%[ \\t]*$", "")),
            new Rule("vspace between projects", text -> text.replaceAll(
                    "(\\\\end\\{itemize[A-Za-z]*Project\\})\\n+\\\\vspace\\{[^}]+\\}\\n+(\\\\begin\\{itemize[A-Za-z]*Project\\})",
                    "$1\n\n\n$2")),
            new Rule("line break after double backslash", text -> text.replaceAll("\\\\\\\\[ \\t]+", "\\\\\\\\\n")));

    public String normalize(String latex) {
        String result = stripComments(latex);
        result = removeSuggestBlocks(result);
        result = LatexText.stripTrailingWhitespace(result);
        result = LINE_END_PAR.matcher(result).replaceAll(LatexNormalizer::lineEndPar);
        result = LatexText.limitBlankLines(result, 1);
        result = applyUntilStable(result);
        result = LatexText.stripTrailingWhitespace(result);
        return result.strip() + "\n";
    }

    String applyUntilStable(String text) {
        String previous = text;
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            String current = applyRules(previous);
            if (current.equals(previous)) {
                return current;
            }
            previous = current;
        }
        LOGGER.warn("Normalization did not settle after {} passes", MAX_PASSES);
        return previous;
    }

    private String applyRules(String text) {
        String result = text;
        for (Rule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    /**
     * Drops full-line comments and the text after an unescaped {@code %}; the {@code %} itself stays so that
     * line-ending whitespace suppression keeps its meaning.
     */
    static String stripComments(String text) {
        String[] lines = text.split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        for (String line : lines) {
            int percent = commentStart(line);
            if (percent < 0) {
                kept.add(line);
            } else if (line.substring(0, percent).isBlank()) {
                continue;
            } else {
                kept.add(line.substring(0, percent + 1));
            }
        }
        return String.join("\n", kept);
    }

    private static int commentStart(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) != '%') {
                continue;
            }
            int backslashes = 0;
            for (int j = i - 1; j >= 0 && line.charAt(j) == '\\'; j--) {
                backslashes++;
            }
            if (backslashes % 2 == 0) {
                return i;
            }
        }
        return -1;
    }

    static String removeSuggestBlocks(String text) {
        StringBuilder result = new StringBuilder();
        int from = 0;
        int index;
        while ((index = text.indexOf(SUGGEST_COMMAND, from)) >= 0) {
            result.append(text, from, index);
            try {
                from = LatexExtractor.extractBalancedSpan(text, index + SUGGEST_COMMAND.length(), '{', '}').end();
            } catch (MalformedMarkupException ex) {
                LOGGER.warn("Keeping unterminated \\suggest block: {}", ex.getMessage());
                result.append(text.substring(index));
                return result.toString();
            }
        }
        result.append(text.substring(from));
        return result.toString();
    }

    private static String lineEndPar(MatchResult match) {
        String line = match.group(1);
        if (line.contains("\\centering")) {
            return Matcher.quoteReplacement(match.group());
        }
        return Matcher.quoteReplacement(line + "\n");
    }

    /**
     * Moves a {@code textblock*} environment, with the decoration commands right after it, to the start of its
     * page, where the generator places decorations.
     */
    static String relocateTextblock(String text) {
        Matcher begin = TEXTBLOCK_BEGIN.matcher(text);
        if (!begin.find()) {
            return text;
        }
        LatexExtractor.EnvironmentBlock block;
        try {
            block = LatexExtractor.extractEnvironmentBlock(text, "textblock*", begin.start());
        } catch (MalformedMarkupException ex) {
            return text;
        }
        Matcher decorations = FOLLOWING_DECORATIONS.matcher(text);
        decorations.region(block.end(), text.length());
        int end = decorations.lookingAt() ? decorations.end() : block.end();
        int pageStart = -1;
        Matcher page = PAGE_START.matcher(text);
        while (page.find() && page.end() <= block.start()) {
            pageStart = page.end();
        }
        if (pageStart < 0) {
            return text;
        }
        String between = text.substring(pageStart, block.start());
        if (between.isBlank()) {
            return text;
        }
        String moved = text.substring(block.start(), end).strip();
        return text.substring(0, pageStart) + "\n\n" + moved + "\n\n" + between.strip() + "\n\n"
                + text.substring(end).stripLeading();
    }

    private record Rule(String name, UnaryOperator<String> operator) {

        String apply(String text) {
            return operator.apply(text);
        }
    }
}
