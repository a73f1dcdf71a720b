package ai.docsite.resume.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Regions of one page. Every region is always serialized; absent ones are null.
 *
 * @param leftColumn sections before {@code \switchcolumn}, or null when the page has none
 * @param textblockLiteral inner content of the page's {@code textblock*} environment
 * @param decorations absolutely positioned commands, in extraction order
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record PageRegions(TopRegion top,
                          Column leftColumn,
                          Column mainColumn,
                          String textblockLiteral,
                          List<Decoration> decorations) {
}
