package ai.docsite.resume.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of section types. Each name matches a directory under {@code types/}.
 */
public enum SectionType {
    PROJECTS,
    WORK_HISTORY,
    EDUCATION,
    SKILL_CATEGORIES,
    SKILL_LIST_CAPS,
    SKILL_LIST_PIPES,
    PERSONALITY_ALIAS_ARRAY,
    CUSTOM_ITEMIZE,
    SIMPLE_LIST,
    UNKNOWN;

    public String typeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SectionType> fromTypeName(String typeName) {
        return Arrays.stream(values())
                .filter(type -> type.typeName().equals(typeName))
                .findFirst();
    }
}
