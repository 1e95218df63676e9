package work.lcod.cosmic.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.cosmic.config.yaml.SimpleYamlParser;

/**
 * Chooses the {@link ConfigParser} implementations used by the loader.
 */
public final class ConfigParsers {
    public static final String PARSER_PROPERTY = "cosmic.parser";

    private static final Logger LOG = LoggerFactory.getLogger(ConfigParsers.class);
    private static final String YAML_FACTORY_CLASS = "com.fasterxml.jackson.dataformat.yaml.YAMLFactory";

    private ConfigParsers() {}

    public static ConfigParser yaml(ParserMode mode) {
        ConfigParser parser = switch (mode) {
            case BUILTIN -> new SimpleYamlParser();
            case JACKSON -> requireJacksonYaml();
            case AUTO -> jacksonYamlAvailable() ? JacksonConfigParser.yaml() : new SimpleYamlParser();
        };
        LOG.debug("YAML parser for mode {}: {}", mode, parser.name());
        return parser;
    }

    public static ConfigParser json() {
        return JacksonConfigParser.json();
    }

    /**
     * Mode named by the {@value #PARSER_PROPERTY} system property, {@link ParserMode#AUTO} when unset.
     */
    public static ParserMode defaultMode() {
        return ParserMode.from(System.getProperty(PARSER_PROPERTY));
    }

    private static ConfigParser requireJacksonYaml() {
        if (!jacksonYamlAvailable()) {
            throw new IllegalStateException("Jackson YAML support is not on the classpath");
        }
        return JacksonConfigParser.yaml();
    }

    static boolean jacksonYamlAvailable() {
        try {
            Class.forName(YAML_FACTORY_CLASS, false, ConfigParsers.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError ex) {
            LOG.debug("Jackson YAML unavailable: {}", ex.toString());
            return false;
        }
    }
}
