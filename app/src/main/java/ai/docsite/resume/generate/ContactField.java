package ai.docsite.resume.generate;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Contact rows the preamble knows how to render, with their icon and link prefix.
 */
public enum ContactField {
    PHONE("\\faPhone", null),
    LOCATION("\\faMapMarker*", null),
    EMAIL("\\faInbox", "mailto:"),
    GITHUB("\\faGithub", "https://www."),
    LINKEDIN("\\faLinkedin", "https://www."),
    WEBSITE("\\faGlobe", "https://www.");

    private final String icon;
    private final String linkPrefix;

    ContactField(String icon, String linkPrefix) {
        this.icon = icon;
        this.linkPrefix = linkPrefix;
    }

    public String icon() {
        return icon;
    }

    public Optional<String> linkPrefix() {
        return Optional.ofNullable(linkPrefix);
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ContactField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key().equals(key))
                .findFirst();
    }
}
