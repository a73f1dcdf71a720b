package ai.docsite.resume.generate;

/**
 * Raised when a document cannot be rendered: a template placeholder without a value, a missing template or an
 * unusable contact field. Fatal for the document being generated.
 */
public class TemplateRenderException extends RuntimeException {

    public TemplateRenderException(String message) {
        super(message);
    }

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
