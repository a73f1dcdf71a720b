package ai.docsite.resume.latex;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Named regular expressions that parse configurations refer to by name instead of repeating them inline.
 *
 * <p>Item marker patterns expose the marker through a {@code marker} named group, without the backslash.</p>
 */
public final class PatternCatalog {

    public static final String ITEM_ALPHABETIC = "\\\\(?<marker>item[A-Za-z]*)(?![A-Za-z])";
    public static final String ITEM_BRACKETED = "\\\\(?<marker>item\\[[^\\]]*\\])";
    public static final String ITEM_ANY = "\\\\(?<marker>item(?:\\[[^\\]]*\\])?[A-Za-z]*)";
    public static final String ITEM_VANILLA = "\\\\(?<marker>item)(?=\\[|\\s)";
    public static final String ITEMI = "\\\\(?<marker>itemi)(?![A-Za-z])";
    public static final String ITEMII = "\\\\(?<marker>itemii)(?![A-Za-z])";
    public static final String ITEM_LL = "\\\\(?<marker>itemLL)(?![A-Za-z])";

    public static final String ITEMIZE_PROJECT_ENV = "itemize[A-Za-z]*Proj(?:ect|Second)";
    public static final String ITEMIZE_PROJ_SECOND_ENV = "itemizeProjSecond";
    public static final String ITEMIZE_ACADEMIC_ENV = "itemizeAcademic";

    public static final String BEGIN_ITEMIZE = "\\\\begin\\{itemize\\}";
    public static final String BEGIN_ITEMIZE_ANY = "\\\\begin\\{itemize[A-Za-z]*\\}";
    public static final String BEGIN_ITEMIZE_ACADEMIC = "\\\\begin\\{itemizeAcademic\\}";
    public static final String BEGIN_ITEMIZE_PROJ_MAIN = "\\\\begin\\{itemizeProjMain\\}";
    public static final String BEGIN_ITEMIZE_MAIN = "\\\\begin\\{itemizeMain\\}";
    public static final String ITEM_BRACKET = "\\\\item\\[";

    public static final String SKILL_CATEGORY_HEADER =
            "\\\\item\\[[^\\]]*\\][^\\n]*(?=\\s*\\n[^\\n]*\\\\addcontentsline\\{toc\\}\\{section\\})";
    public static final String SKILL_CATEGORY_NAME_ANCHOR = "\\\\item\\[[^\\]]*\\]\\s*(?=\\{\\\\scshape)";
    public static final String SKILL_CATEGORY_MARKER = "\\\\(?<marker>item\\[(?<icon>[^\\]]*)\\])";
    public static final String CAPS_LIST_GROUP = "\\{(?=\\\\setlength\\{\\\\baselineskip\\})";
    public static final String CAPS_LIST_HEADER = "\\\\setlength\\{\\\\baselineskip\\}\\{[^}]*\\}\\s*\\\\scshape\\s*";
    public static final String BASELINESKIP = "\\\\setlength\\{\\\\baselineskip\\}\\{(?<baselineskip>[^}]*)\\}";
    public static final String PIPE_SEPARATOR = "\\s*\\|\\s*";
    public static final String BLANK_LINE = "\\n\\s*\\n";
    public static final String TITLE_BREAK = "\\\\\\\\";
    public static final String ITEMIZE_ENV_NAME = "\\\\begin\\{(?<env>itemize[A-Za-z]*)\\}";

    public static final String EDUCATION_ICON_BULLET = "\\\\faUserGraduate";
    public static final String EDUCATION_DEGREE =
            "\\b(?:Bachelor|Master|Doctor|Ph\\.?\\s?D|B\\.\\s?[AS]\\.|M\\.\\s?[AS]\\.|M\\.?B\\.?A|Associate)\\b";
    public static final String TEXTBLOCK_WITH_ARGS = "\\\\begin\\{textblock\\*\\}(\\{[^}]+\\})(\\([^)]+\\))";

    private static final Pattern CONSTANT_NAME = Pattern.compile("[A-Z][A-Z0-9_]*");
    private static final Map<String, String> BY_NAME = new LinkedHashMap<>();

    static {
        BY_NAME.put("ITEM_ALPHABETIC", ITEM_ALPHABETIC);
        BY_NAME.put("ITEM_BRACKETED", ITEM_BRACKETED);
        BY_NAME.put("ITEM_ANY", ITEM_ANY);
        BY_NAME.put("ITEM_VANILLA", ITEM_VANILLA);
        BY_NAME.put("ITEMI", ITEMI);
        BY_NAME.put("ITEMII", ITEMII);
        BY_NAME.put("ITEM_LL", ITEM_LL);
        BY_NAME.put("ITEMIZE_PROJECT_ENV", ITEMIZE_PROJECT_ENV);
        BY_NAME.put("ITEMIZE_PROJ_SECOND_ENV", ITEMIZE_PROJ_SECOND_ENV);
        BY_NAME.put("ITEMIZE_ACADEMIC_ENV", ITEMIZE_ACADEMIC_ENV);
        BY_NAME.put("BEGIN_ITEMIZE", BEGIN_ITEMIZE);
        BY_NAME.put("BEGIN_ITEMIZE_ANY", BEGIN_ITEMIZE_ANY);
        BY_NAME.put("BEGIN_ITEMIZE_ACADEMIC", BEGIN_ITEMIZE_ACADEMIC);
        BY_NAME.put("BEGIN_ITEMIZE_PROJ_MAIN", BEGIN_ITEMIZE_PROJ_MAIN);
        BY_NAME.put("BEGIN_ITEMIZE_MAIN", BEGIN_ITEMIZE_MAIN);
        BY_NAME.put("ITEM_BRACKET", ITEM_BRACKET);
        BY_NAME.put("SKILL_CATEGORY_HEADER", SKILL_CATEGORY_HEADER);
        BY_NAME.put("SKILL_CATEGORY_NAME_ANCHOR", SKILL_CATEGORY_NAME_ANCHOR);
        BY_NAME.put("SKILL_CATEGORY_MARKER", SKILL_CATEGORY_MARKER);
        BY_NAME.put("CAPS_LIST_GROUP", CAPS_LIST_GROUP);
        BY_NAME.put("CAPS_LIST_HEADER", CAPS_LIST_HEADER);
        BY_NAME.put("BASELINESKIP", BASELINESKIP);
        BY_NAME.put("PIPE_SEPARATOR", PIPE_SEPARATOR);
        BY_NAME.put("BLANK_LINE", BLANK_LINE);
        BY_NAME.put("TITLE_BREAK", TITLE_BREAK);
        BY_NAME.put("ITEMIZE_ENV_NAME", ITEMIZE_ENV_NAME);
        BY_NAME.put("EDUCATION_ICON_BULLET", EDUCATION_ICON_BULLET);
        BY_NAME.put("EDUCATION_DEGREE", EDUCATION_DEGREE);
        BY_NAME.put("TEXTBLOCK_WITH_ARGS", TEXTBLOCK_WITH_ARGS);
    }

    private PatternCatalog() {
    }

    public static Optional<String> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /**
     * Whether {@code reference} is written like a catalog name (upper-case with underscores) rather than an
     * inline regular expression.
     */
    public static boolean isName(String reference) {
        return reference != null && CONSTANT_NAME.matcher(reference).matches();
    }
}
