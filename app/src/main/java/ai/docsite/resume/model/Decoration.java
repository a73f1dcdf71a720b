package ai.docsite.resume.model;

import java.util.List;

/**
 * An absolutely positioned drawing command such as {@code \bottombar{4}}, kept out of section content.
 */
public record Decoration(String name, List<String> args) {

    public static final String TEXTBLOCK = "textblock";

    public Decoration {
        args = args == null ? List.of() : List.copyOf(args);
    }
}
