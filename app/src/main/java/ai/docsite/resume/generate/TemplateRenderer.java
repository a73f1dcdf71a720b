package ai.docsite.resume.generate;

import ai.docsite.resume.dsl.NestedPaths;
import java.util.Map;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/**
 * Fills {@code <<<dotted.path>>>} placeholders from a nested map.
 *
 * <p>The delimiters stay clear of LaTeX syntax, and substituted values are never expanded again, so markup
 * containing braces or dollar signs passes through untouched. A placeholder without a value fails the render.</p>
 */
public class TemplateRenderer {

    static final String PREFIX = "<<<";
    static final String SUFFIX = ">>>";
    private static final char NO_ESCAPE = '\u0000';

    public String render(String template, Map<String, Object> scope) {
        StringSubstitutor substitutor = new StringSubstitutor(lookupIn(scope), PREFIX, SUFFIX, NO_ESCAPE);
        substitutor.setValueDelimiterMatcher(null);
        substitutor.setDisableSubstitutionInValues(true);
        substitutor.setEnableUndefinedVariableException(true);
        try {
            return substitutor.replace(template);
        } catch (IllegalArgumentException ex) {
            throw new TemplateRenderException("Cannot render template: " + ex.getMessage(), ex);
        }
    }

    private static StringLookup lookupIn(Map<String, Object> scope) {
        return key -> {
            Object value = NestedPaths.get(scope, key.strip());
            return value == null ? null : value.toString();
        };
    }
}
