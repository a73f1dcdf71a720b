package ai.docsite.resume.parse;

import ai.docsite.resume.latex.PatternCatalog;
import ai.docsite.resume.model.SectionType;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Infers a section's type from structural fingerprints of its content.
 *
 * <p>Rules run from most to least specific and the first match wins: several fingerprints are subsets of
 * others, so a generic itemize must only be recognised after every specialised list.</p>
 */
public class SectionTypeInference {

    private static final Pattern BEGIN_ITEMIZE = Pattern.compile(PatternCatalog.BEGIN_ITEMIZE);
    private static final Pattern BEGIN_ITEMIZE_ANY = Pattern.compile(PatternCatalog.BEGIN_ITEMIZE_ANY);
    private static final Pattern EDUCATION_DEGREE = Pattern.compile(PatternCatalog.EDUCATION_DEGREE);

    private final List<Rule> rules = List.of(
            new Rule(SectionType.PROJECTS, content -> content.contains("\\begin{itemizeProjMain}")),
            new Rule(SectionType.WORK_HISTORY, content -> content.contains("\\begin{itemizeAcademic}")),
            new Rule(SectionType.EDUCATION, content -> BEGIN_ITEMIZE.matcher(content).find()
                    && EDUCATION_DEGREE.matcher(content).find()),
            new Rule(SectionType.SKILL_CATEGORIES, content -> BEGIN_ITEMIZE.matcher(content).find()
                    && content.contains("\\item[") && content.contains("\\scshape")),
            new Rule(SectionType.SKILL_LIST_CAPS, content -> content.contains("\\setlength")
                    && content.contains("\\baselineskip") && content.contains("\\scshape")),
            // a list environment containing a pipe is still a list
            new Rule(SectionType.SKILL_LIST_PIPES, content -> content.contains("|")
                    && !content.contains("\\begin{")),
            new Rule(SectionType.PERSONALITY_ALIAS_ARRAY, content -> content.contains("\\begin{itemizeMain}")),
            // plain itemize, with or without options or labels; itemize variants fall through
            new Rule(SectionType.CUSTOM_ITEMIZE, content -> BEGIN_ITEMIZE.matcher(content).find()),
            new Rule(SectionType.SIMPLE_LIST, content -> BEGIN_ITEMIZE_ANY.matcher(content).find()));

    public SectionType infer(String content) {
        return rules.stream()
                .filter(rule -> rule.matches().test(content))
                .map(Rule::type)
                .findFirst()
                .orElse(SectionType.UNKNOWN);
    }

    private record Rule(SectionType type, Predicate<String> matches) {
    }
}
