package ai.docsite.resume.latex;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts LaTeX fragments to readable plaintext and escapes plaintext back into LaTeX.
 *
 * <p>{@link #toLatex(String)} is not an inverse of {@link #toPlaintext(String)}: formatting is lost on the way
 * to plaintext.</p>
 *
 * <p>Text without a backslash carries no markup and only has its whitespace collapsed. Plaintext output never
 * contains a backslash, so converting it again returns it unchanged, including literal braces and dollar signs
 * restored from escapes.</p>
 */
public final class PlaintextConverter {

    private static final List<String> UNWRAPPED_COMMANDS = List.of(
            "textbf", "textit", "emph", "underline", "texttt", "textsc", "textnormal", "textup", "textsl",
            "coloremph", "uline", "hl", "mbox", "url");
    // commands whose first argument is discarded and whose second is kept
    private static final List<String> LABELLED_COMMANDS = List.of("href", "textcolor", "color");

    private static final Pattern LINE_BREAK = Pattern.compile("\\\\\\\\(\\[[^\\]]*\\])?");
    private static final Pattern STANDALONE_COLOR = Pattern.compile("\\\\color\\{[^}]*\\}");
    private static final Pattern LAYOUT_COMMANDS = Pattern.compile(
            "\\\\(centering|par|nolinebreak|nopagebreak|hfill|noindent)(?![a-zA-Z])\\s*");
    private static final Pattern SPACING_COMMANDS = Pattern.compile("\\\\[vh]space\\*?\\{[^}]*\\}");
    private static final Pattern MATH_SPAN = Pattern.compile("\\$([^$]*)\\$");
    private static final Pattern COMMAND_WITH_ARGUMENT = Pattern.compile("\\\\[a-zA-Z]+\\*?\\{[^}]*\\}");
    private static final Pattern BARE_COMMAND = Pattern.compile("\\\\[a-zA-Z]+\\*?");
    private static final Pattern STRAY_BACKSLASH = Pattern.compile("\\\\");
    private static final Pattern KEY_VALUE_OPTIONS = Pattern.compile("\\[[^\\]]*=[^\\]]*\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // "$\to$" precedes the bare "\to" rule
    private static final List<Map.Entry<Pattern, String>> SYMBOLS = List.of(
            Map.entry(Pattern.compile("\\$\\\\to\\$"), " to "),
            Map.entry(Pattern.compile("\\\\(to|rightarrow)(?![a-zA-Z])"), "->"),
            Map.entry(Pattern.compile("\\\\leftarrow(?![a-zA-Z])"), "<-"),
            Map.entry(Pattern.compile("\\\\leq(?![a-zA-Z])"), "<="),
            Map.entry(Pattern.compile("\\\\geq(?![a-zA-Z])"), ">="),
            Map.entry(Pattern.compile("\\\\neq(?![a-zA-Z])"), "!="),
            Map.entry(Pattern.compile("\\\\sim(?![a-zA-Z])"), "~"),
            Map.entry(Pattern.compile("\\\\approx(?![a-zA-Z])"), "\u2248"),
            Map.entry(Pattern.compile("\\\\(texttimes|times)(?![a-zA-Z])(\\{\\})?"), "\u00d7"),
            Map.entry(Pattern.compile("\\\\textonehalf(?![a-zA-Z])(\\{\\})?"), "half"),
            Map.entry(Pattern.compile("\\\\textasciitilde(?![a-zA-Z])(\\{\\})?"), "~"),
            Map.entry(Pattern.compile("\\\\textasciicircum(?![a-zA-Z])(\\{\\})?"), "^"),
            Map.entry(Pattern.compile("\\\\[ ;,:]"), " "),
            Map.entry(Pattern.compile("\\\\!"), ""));

    // escaped specials are parked on private-use characters until braces and commands are gone
    private static final String ESCAPABLE = "%$&#_{}";
    private static final char PARKING_BASE = '\uE000';

    private PlaintextConverter() {
    }

    public static String toPlaintext(String latex) {
        if (latex == null || latex.isEmpty()) {
            return "";
        }
        if (latex.indexOf('\\') < 0) {
            return collapseWhitespace(latex);
        }
        String text = LINE_BREAK.matcher(latex).replaceAll(" ");
        text = parkEscapes(text);
        for (String command : UNWRAPPED_COMMANDS) {
            text = unwrap(text, command, false);
        }
        for (String command : LABELLED_COMMANDS) {
            text = unwrap(text, command, true);
        }
        text = STANDALONE_COLOR.matcher(text).replaceAll("");
        text = LAYOUT_COMMANDS.matcher(text).replaceAll(" ");
        text = SPACING_COMMANDS.matcher(text).replaceAll(" ");
        for (Map.Entry<Pattern, String> symbol : SYMBOLS) {
            text = symbol.getKey().matcher(text).replaceAll(Matcher.quoteReplacement(symbol.getValue()));
        }
        text = unwrapMath(text);
        text = COMMAND_WITH_ARGUMENT.matcher(text).replaceAll("");
        text = BARE_COMMAND.matcher(text).replaceAll("");
        text = STRAY_BACKSLASH.matcher(text).replaceAll("");
        text = KEY_VALUE_OPTIONS.matcher(text).replaceAll("");
        text = text.replace("{", "").replace("}", "");
        text = restoreEscapes(text);
        return collapseWhitespace(text);
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Escapes characters that are syntactically significant in LaTeX.
     */
    public static String toLatex(String plaintext) {
        if (plaintext == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(plaintext.length() + 16);
        for (char current : plaintext.toCharArray()) {
            switch (current) {
                case '\\' -> builder.append("\\textbackslash{}");
                case '~' -> builder.append("\\textasciitilde{}");
                case '^' -> builder.append("\\textasciicircum{}");
                default -> {
                    if (ESCAPABLE.indexOf(current) >= 0) {
                        builder.append('\\');
                    }
                    builder.append(current);
                }
            }
        }
        return builder.toString();
    }

    private static String unwrap(String text, String command, boolean keepSecondArgument) {
        String token = "\\" + command + "{";
        StringBuilder builder = new StringBuilder(text.length());
        int position = 0;
        while (true) {
            int index = text.indexOf(token, position);
            if (index < 0) {
                builder.append(text, position, text.length());
                return builder.toString();
            }
            int contentStart = index + token.length();
            LatexExtractor.Span span;
            String kept;
            try {
                span = LatexExtractor.extractBalancedSpan(text, contentStart, '{', '}');
                kept = span.content();
                if (keepSecondArgument) {
                    if (span.end() < text.length() && text.charAt(span.end()) == '{') {
                        span = LatexExtractor.extractBalancedSpan(text, span.end() + 1, '{', '}');
                        kept = span.content();
                    } else if (!"href".equals(command)) {
                        // a color switch without a braced argument carries no text of its own
                        kept = "";
                    }
                }
            } catch (MalformedMarkupException ex) {
                // left in place for the generic command pass
                builder.append(text, position, contentStart);
                position = contentStart;
                continue;
            }
            builder.append(text, position, index).append(kept);
            position = span.end();
        }
    }

    private static String unwrapMath(String text) {
        Matcher matcher = MATH_SPAN.matcher(text);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            String inner = matcher.group(1);
            boolean math = inner.indexOf('\\') >= 0 || !WHITESPACE.matcher(inner).find();
            matcher.appendReplacement(builder, Matcher.quoteReplacement(math ? inner : matcher.group()));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }

    private static String parkEscapes(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char current = text.charAt(i);
            if (current == '\\' && i + 1 < text.length() && ESCAPABLE.indexOf(text.charAt(i + 1)) >= 0) {
                builder.append((char) (PARKING_BASE + ESCAPABLE.indexOf(text.charAt(i + 1))));
                i++;
            } else {
                builder.append(current);
            }
        }
        return builder.toString();
    }

    private static String restoreEscapes(String text) {
        StringBuilder builder = new StringBuilder(text.length());
        for (char current : text.toCharArray()) {
            int offset = current - PARKING_BASE;
            builder.append(offset >= 0 && offset < ESCAPABLE.length() ? ESCAPABLE.charAt(offset) : current);
        }
        return builder.toString();
    }
}
