package work.lcod.cosmic.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.cosmic.model.MeasurementBuilder;
import work.lcod.cosmic.model.SystemMeasurement;

/**
 * Loads a measurement definition from a YAML or JSON file.
 *
 * <p>Files ending in {@code .json} are read with Jackson; everything else goes through the YAML parser given at
 * construction time.
 */
public final class MeasurementLoader {
    private static final Logger LOG = LoggerFactory.getLogger(MeasurementLoader.class);

    private final ConfigParser yamlParser;
    private final ConfigParser jsonParser;

    public MeasurementLoader() {
        this(ConfigParsers.yaml(ConfigParsers.defaultMode()));
    }

    public MeasurementLoader(ConfigParser yamlParser) {
        this(yamlParser, ConfigParsers.json());
    }

    public MeasurementLoader(ConfigParser yamlParser, ConfigParser jsonParser) {
        this.yamlParser = Objects.requireNonNull(yamlParser, "yamlParser");
        this.jsonParser = Objects.requireNonNull(jsonParser, "jsonParser");
    }

    public SystemMeasurement load(Path path) {
        ParsedValue payload = readValue(path);
        if (!(payload instanceof ParsedValue.Mapping)) {
            throw new MeasurementParserException(
                "Measurement configuration must define a mapping with 'system' and 'functional_processes' keys."
            );
        }
        SystemMeasurement measurement = MeasurementBuilder.fromValue(payload);
        LOG.debug("Loaded '{}' with {} functional processes", measurement.name(), measurement.functionalProcesses().size());
        return measurement;
    }

    /**
     * Reads and parses the file without interpreting it as a measurement.
     */
    public ParsedValue readValue(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new MeasurementParserException("Configuration file '" + path + "' does not exist.");
        }
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new MeasurementParserException(
                "Failed to read configuration file '" + path + "': " + ex.getMessage(), ex
            );
        }

        boolean json = isJson(path);
        ConfigParser parser = json ? jsonParser : yamlParser;
        LOG.debug("Parsing {} with {}", path, parser.name());
        try {
            return parser.parse(raw);
        } catch (ConfigParseException ex) {
            throw new MeasurementParserException(
                "Failed to parse " + (json ? "JSON" : "YAML") + " configuration file '" + path + "': " + ex.getMessage(),
                ex
            );
        }
    }

    private static boolean isJson(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
