package work.lcod.cosmic.config;

/**
 * Raised by a {@link ConfigParser} when the input cannot be turned into a value tree.
 */
public class ConfigParseException extends RuntimeException {
    public ConfigParseException(String message) {
        super(message);
    }

    public ConfigParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
