package ai.docsite.resume.model;

import ai.docsite.resume.latex.PlaintextConverter;

/**
 * Author-facing text kept both as raw LaTeX and as plaintext.
 */
public record DualField(String raw, String plaintext) {

    public static DualField of(String raw) {
        return raw == null ? null : new DualField(raw, PlaintextConverter.toPlaintext(raw));
    }
}
