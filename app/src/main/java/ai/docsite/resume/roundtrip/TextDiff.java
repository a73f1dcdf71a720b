package ai.docsite.resume.roundtrip;

import ai.docsite.resume.latex.LatexText;
import ai.docsite.resume.model.ResumeConversionException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Line diff of two normalized LaTeX texts, ignoring blank lines.
 *
 * @param changedLines inserted plus deleted lines
 * @param unified the hunks in unified format, empty when the texts match
 */
public record TextDiff(int changedLines, String unified) {

    public static TextDiff compare(String before, String after) {
        RawText beforeText = rawText(before);
        RawText afterText = rawText(after);
        DiffAlgorithm algorithm = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);
        EditList edits = algorithm.diff(RawTextComparator.DEFAULT, beforeText, afterText);
        int changed = 0;
        for (Edit edit : edits) {
            changed += edit.getLengthA() + edit.getLengthB();
        }
        return new TextDiff(changed, edits.isEmpty() ? "" : format(edits, beforeText, afterText));
    }

    public boolean isEmpty() {
        return changedLines == 0;
    }

    private static RawText rawText(String text) {
        String compact = LatexText.removeBlankLines(text).strip();
        return new RawText((compact.isEmpty() ? "" : compact + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private static String format(EditList edits, RawText before, RawText after) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.format(edits, before, after);
            formatter.flush();
        } catch (IOException e) {
            throw new ResumeConversionException("Failed to format LaTeX diff", e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
