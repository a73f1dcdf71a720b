package ai.docsite.resume.dsl;

/**
 * Raised when a parse configuration does not fit the markup it runs against: an unknown named pattern, an
 * unknown nested configuration, or a capture group the pattern does not define.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
