package work.lcod.cosmic.config;

/**
 * Raised when a measurement configuration file cannot be read or parsed.
 */
public final class MeasurementParserException extends RuntimeException {
    public MeasurementParserException(String message) {
        super(message);
    }

    public MeasurementParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
