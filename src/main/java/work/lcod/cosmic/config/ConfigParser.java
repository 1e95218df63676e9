package work.lcod.cosmic.config;

/**
 * Turns configuration text into a {@link ParsedValue} tree.
 *
 * <p>Implementations are stateless and may be shared between threads.
 */
public interface ConfigParser {
    /**
     * @throws ConfigParseException when the text is not a valid document for this parser
     */
    ParsedValue parse(String text);

    /**
     * Identifier reported in logs and run metadata.
     */
    String name();
}
