package ai.docsite.resume.parse;

import ai.docsite.resume.latex.LatexExtractor;
import ai.docsite.resume.latex.LatexText;
import ai.docsite.resume.latex.MalformedMarkupException;
import ai.docsite.resume.model.DualField;
import ai.docsite.resume.model.Metadata;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the preamble declarations that precede {@code \begin{document}}.
 */
public class MetadataExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataExtractor.class);

    /** Packages the generated preamble declares itself; anything else is kept as a custom package. */
    public static final List<String> STANDARD_PACKAGES = List.of(
            "geometry", "paracol", "fontawesome5", "textpos", "etoolbox", "xcolor", "soul", "hyperref", "enumitem",
            "fontspec");
    public static final List<String> COLOR_ROLES = List.of(
            "emphcolor", "topbarcolor", "leftbarcolor", "brandcolor", "namecolor");

    static final String NAME_FIELD = "myname";
    static final String DATE_FIELD = "mydate";
    static final String BRAND_FIELD = "brand";
    static final String PROFILE_FIELD = "ProfessionalProfile";
    static final String DOCUMENT_BEGIN = "\\begin{document}";

    private static final Pattern RENEWCOMMAND = Pattern.compile("\\\\renewcommand\\{\\\\([A-Za-z@]+)\\}\\s*\\{");
    private static final Pattern SETLENGTH = Pattern.compile("\\\\setlength\\{\\\\([^}]+)\\}\\{([^}]+)\\}");
    private static final Pattern DEFLEN = Pattern.compile("\\\\deflen\\{([^}]+)\\}\\{([^}]+)\\}");
    private static final Pattern SETHLCOLOR = Pattern.compile("\\\\sethlcolor\\{([^}]+)\\}");
    private static final Pattern NLINES_PP = Pattern.compile("\\\\def\\\\nlinesPP\\{(\\d+)\\}");
    private static final Pattern LIST_TITLE_TOGGLE = Pattern.compile("\\\\toggle(true|false)\\{list_title_after_name\\}");
    private static final Pattern USEPACKAGE = Pattern.compile("\\\\usepackage(?:\\[[^\\]]*\\])?\\{([^}]+)\\}");
    private static final Pattern NEWFONTFAMILY =
            Pattern.compile("\\\\newfontfamily\\{?\\\\[A-Za-z]+\\}?(?:\\[[^\\]]*\\])?\\{[^}]+\\}");

    public Metadata extract(String latex) {
        return extractFromPreamble(preambleOf(latex));
    }

    static String preambleOf(String latex) {
        int documentStart = latex.indexOf(DOCUMENT_BEGIN);
        if (documentStart < 0) {
            throw new MalformedMarkupException("No \\begin{document} found");
        }
        return latex.substring(0, documentStart);
    }

    Metadata extractFromPreamble(String preamble) {
        Map<String, String> fields = renewedCommands(preamble);
        DualField name = DualField.of(fields.remove(NAME_FIELD));
        DualField date = DualField.of(fields.remove(DATE_FIELD));
        DualField brand = DualField.of(fields.remove(BRAND_FIELD));
        String profileRaw = fields.remove(PROFILE_FIELD);
        DualField profile = profileRaw == null ? null : DualField.of(LatexText.limitBlankLines(profileRaw, 0).strip());

        Map<String, String> colors = new LinkedHashMap<>();
        for (String role : COLOR_ROLES) {
            String value = fields.remove(role);
            if (value != null) {
                colors.put(role, value);
            }
        }

        Matcher hlcolor = SETHLCOLOR.matcher(preamble);
        Matcher nlines = NLINES_PP.matcher(preamble);
        Matcher toggle = LIST_TITLE_TOGGLE.matcher(preamble);
        List<String> customPackages = customPackages(preamble);
        return new Metadata(name, date, brand, profile, colors,
                pairs(SETLENGTH, preamble), pairs(DEFLEN, preamble),
                hlcolor.find() ? hlcolor.group(1) : null,
                nlines.find() ? Integer.valueOf(nlines.group(1)) : null,
                !toggle.find() || "true".equals(toggle.group(1)),
                customPackages.isEmpty() ? null : customPackages,
                fields,
                null);
    }

    private Map<String, String> renewedCommands(String preamble) {
        Map<String, String> fields = new LinkedHashMap<>();
        Matcher matcher = RENEWCOMMAND.matcher(preamble);
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() < consumed) {
                continue;
            }
            try {
                LatexExtractor.Span value = LatexExtractor.extractBalancedSpan(preamble, matcher.end(), '{', '}');
                fields.put(matcher.group(1), value.content());
                consumed = value.end();
            } catch (MalformedMarkupException ex) {
                LOGGER.warn("Skipping malformed \\renewcommand of {}: {}", matcher.group(1), ex.getMessage());
            }
        }
        return fields;
    }

    private static Map<String, String> pairs(Pattern pattern, String preamble) {
        Map<String, String> values = new LinkedHashMap<>();
        Matcher matcher = pattern.matcher(preamble);
        while (matcher.find()) {
            values.put(matcher.group(1), matcher.group(2));
        }
        return values;
    }

    private static List<String> customPackages(String preamble) {
        List<String> packages = new ArrayList<>();
        Matcher usepackage = USEPACKAGE.matcher(preamble);
        while (usepackage.find()) {
            boolean standard = Arrays.stream(usepackage.group(1).split(","))
                    .map(String::strip)
                    .allMatch(STANDARD_PACKAGES::contains);
            if (!standard) {
                packages.add(usepackage.group());
            }
        }
        Matcher fontFamily = NEWFONTFAMILY.matcher(preamble);
        while (fontFamily.find()) {
            packages.add(fontFamily.group());
        }
        return packages;
    }
}
