package ai.docsite.resume.model;

/**
 * Runtime exception for I/O and serialization failures while converting a résumé.
 */
public class ResumeConversionException extends RuntimeException {

    public ResumeConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
