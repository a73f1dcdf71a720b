package ai.docsite.resume.latex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Delimiter and environment extraction over raw LaTeX text.
 *
 * <p>All scans honour backslash escapes: the character following a backslash never opens or closes a group.
 * Environment matching counts only {@code \begin}/{@code \end} pairs of the requested name, so an environment
 * nested inside itself closes at the right depth while differently named environments stay opaque.</p>
 */
public final class LatexExtractor {

    private static final Pattern OPTIONAL_GROUP_START = Pattern.compile("\\s*\\[");
    private static final Pattern VANILLA_ITEM = Pattern.compile("\\\\item(?![A-Za-z])");
    private static final String MARKER_GROUP = "marker";

    private LatexExtractor() {
    }

    /**
     * Scans from {@code start}, which must sit just after an opening delimiter, to the matching close.
     *
     * @return the enclosed content and the index just after the closing delimiter
     * @throws MalformedMarkupException if the depth never returns to zero
     */
    public static Span extractBalancedSpan(String text, int start, char open, char close) {
        int depth = 1;
        int position = start;
        while (position < text.length()) {
            char current = text.charAt(position);
            if (current == '\\') {
                position += 2;
                continue;
            }
            if (current == open) {
                depth++;
            } else if (current == close) {
                depth--;
                if (depth == 0) {
                    return new Span(text.substring(start, position), position + 1);
                }
            }
            position++;
        }
        throw new MalformedMarkupException("Unbalanced " + open + close + " group starting at offset " + start
                + ": " + LatexText.snippet(text, start));
    }

    /**
     * Finds the first {@code \begin{name}} at or after {@code start} and its matching {@code \end{name}}.
     */
    public static EnvironmentBlock extractEnvironmentBlock(String text, String name, int start) {
        Objects.requireNonNull(name, "name");
        String opener = "\\begin{" + name + "}";
        String closer = "\\end{" + name + "}";
        int beginStart = text.indexOf(opener, Math.max(0, start));
        if (beginStart < 0) {
            throw new MalformedMarkupException("No \\begin{" + name + "} found");
        }
        int contentStart = beginStart + opener.length();
        int position = contentStart;
        int depth = 1;
        while (true) {
            int nextOpen = text.indexOf(opener, position);
            int nextClose = text.indexOf(closer, position);
            if (nextClose < 0) {
                throw new MalformedMarkupException("Unmatched \\begin{" + name + "} at offset " + beginStart
                        + ": " + LatexText.snippet(text, beginStart));
            }
            if (nextOpen >= 0 && nextOpen < nextClose) {
                depth++;
                position = nextOpen + opener.length();
                continue;
            }
            depth--;
            int closeEnd = nextClose + closer.length();
            if (depth == 0) {
                return new EnvironmentBlock(name, text.substring(contentStart, nextClose),
                        text.substring(beginStart, closeEnd), beginStart, closeEnd);
            }
            position = closeEnd;
        }
    }

    /**
     * Extracts an environment and consumes its arguments: {@code optionalCount} bracket groups first, then
     * {@code mandatoryCount} brace groups. A malformed optional group ends optional scanning and is dropped;
     * a missing or malformed mandatory group is fatal.
     */
    public static ParsedEnvironment extractEnvironment(String text, String name, int mandatoryCount,
                                                       int optionalCount, int start) {
        EnvironmentBlock block = extractEnvironmentBlock(text, name, start);
        String inner = block.content();
        List<String> params = new ArrayList<>();
        int position = 0;
        int optionalFound = 0;
        for (int i = 0; i < optionalCount; i++) {
            Matcher matcher = OPTIONAL_GROUP_START.matcher(inner).region(position, inner.length());
            if (!matcher.lookingAt()) {
                break;
            }
            Span span;
            try {
                span = extractBalancedSpan(inner, matcher.end(), '[', ']');
            } catch (MalformedMarkupException ex) {
                // an unterminated bracket is ordinary content, not an option group
                break;
            }
            params.add(span.content());
            position = span.end();
            optionalFound++;
        }
        for (int i = 0; i < mandatoryCount; i++) {
            int brace = skipWhitespace(inner, position);
            if (brace >= inner.length() || inner.charAt(brace) != '{') {
                throw new MalformedMarkupException("Environment " + name + " expects " + mandatoryCount
                        + " parameters but parameter " + (i + 1) + " is missing: " + LatexText.snippet(inner, 0));
            }
            Span span = extractBalancedSpan(inner, brace + 1, '{', '}');
            params.add(span.content());
            position = span.end();
        }
        String content = inner.substring(position).strip();
        return new ParsedEnvironment(name, List.copyOf(params), optionalFound, content, block.start(), block.end());
    }

    /**
     * Returns every top-level environment whose name fully matches {@code namePattern}, in document order.
     */
    public static List<EnvironmentBlock> extractAllEnvironments(String text, String namePattern) {
        Pattern opener = Pattern.compile("\\\\begin\\{(" + namePattern + ")\\}");
        Matcher matcher = opener.matcher(text);
        List<EnvironmentBlock> blocks = new ArrayList<>();
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() < consumed) {
                continue;
            }
            EnvironmentBlock block = extractEnvironmentBlock(text, matcher.group(1), matcher.start());
            blocks.add(block);
            consumed = block.end();
        }
        return List.copyOf(blocks);
    }

    /**
     * Splits content into entries at every match of {@code markerPattern}. The marker is the pattern's
     * {@code marker} group when it has one, otherwise the whole match without its leading backslash.
     * Text before the first marker and entries with no text are dropped.
     */
    public static List<Entry> splitEntries(String content, Pattern markerPattern) {
        boolean namedMarker = markerPattern.pattern().contains("(?<" + MARKER_GROUP + ">");
        Matcher matcher = markerPattern.matcher(content);
        List<Entry> entries = new ArrayList<>();
        String marker = null;
        int bodyStart = 0;
        while (matcher.find()) {
            if (marker != null) {
                addEntry(entries, marker, content.substring(bodyStart, matcher.start()));
            }
            marker = namedMarker ? matcher.group(MARKER_GROUP) : stripBackslash(matcher.group().strip());
            bodyStart = matcher.end();
        }
        if (marker != null) {
            addEntry(entries, marker, content.substring(bodyStart));
        }
        return List.copyOf(entries);
    }

    /**
     * Splits on plain {@code \item} markers whose optional label may itself contain nested brackets and
     * braces, such as {@code \item[\raisebox{-1pt}{>} 20,000]}.
     */
    public static List<Entry> splitBracketedItems(String content) {
        List<Entry> entries = new ArrayList<>();
        Matcher matcher = VANILLA_ITEM.matcher(content);
        int searchFrom = 0;
        String marker = null;
        int bodyStart = 0;
        while (searchFrom <= content.length() && matcher.find(searchFrom)) {
            if (marker != null) {
                addEntry(entries, marker, content.substring(bodyStart, matcher.start()));
            }
            int afterItem = matcher.end();
            if (afterItem < content.length() && content.charAt(afterItem) == '[') {
                Span label = extractBalancedSpan(content, afterItem + 1, '[', ']');
                marker = "item[" + label.content() + "]";
                bodyStart = label.end();
            } else {
                marker = "item";
                bodyStart = afterItem;
            }
            searchFrom = bodyStart;
        }
        if (marker != null) {
            addEntry(entries, marker, content.substring(bodyStart));
        }
        return List.copyOf(entries);
    }

    private static void addEntry(List<Entry> entries, String marker, String body) {
        String raw = body.strip();
        if (!raw.isEmpty()) {
            entries.add(new Entry(marker, raw, PlaintextConverter.toPlaintext(raw)));
        }
    }

    private static String stripBackslash(String marker) {
        return marker.startsWith("\\") ? marker.substring(1) : marker;
    }

    private static int skipWhitespace(String text, int from) {
        int position = from;
        while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
        return position;
    }

    /** Content of a balanced group and the index just past its closing delimiter. */
    public record Span(String content, int end) {
    }

    /**
     * A matched environment: its inner content (arguments included), the full source from {@code \begin} to
     * {@code \end}, and the offsets of that source within the scanned text.
     */
    public record EnvironmentBlock(String name, String content, String source, int start, int end) {
    }

    /**
     * An environment with its arguments consumed. {@code params} lists the {@code optionalFound} optional groups
     * that were present, followed by the mandatory groups.
     */
    public record ParsedEnvironment(String name, List<String> params, int optionalFound, String content,
                                    int start, int end) {
    }

    /** One marker-delimited list entry; the marker carries no leading backslash. */
    public record Entry(String marker, String latexRaw, String plaintext) {
    }
}
