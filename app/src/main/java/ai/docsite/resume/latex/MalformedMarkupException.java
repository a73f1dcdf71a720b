package ai.docsite.resume.latex;

/**
 * Raised when delimiters or environments in LaTeX markup do not balance.
 */
public class MalformedMarkupException extends RuntimeException {

    public MalformedMarkupException(String message) {
        super(message);
    }

    public MalformedMarkupException(String message, Throwable cause) {
        super(message, cause);
    }
}
