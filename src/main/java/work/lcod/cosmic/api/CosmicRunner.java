package work.lcod.cosmic.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.cosmic.calc.CosmicCalculator;
import work.lcod.cosmic.config.ConfigParsers;
import work.lcod.cosmic.config.MeasurementLoader;
import work.lcod.cosmic.report.MeasurementReport;

/**
 * Public entry point: loads a measurement, computes its CFP totals and writes the Excel report.
 */
public final class CosmicRunner {
    public static final String DEBUG_PROPERTY = "cosmic.debug";

    private static final Logger LOG = LoggerFactory.getLogger(CosmicRunner.class);

    public RunResult run(CosmicRunConfiguration configuration) {
        var started = Instant.now();
        try {
            var parser = ConfigParsers.yaml(configuration.parserMode());
            var measurement = new MeasurementLoader(parser).load(configuration.configPath());
            var calculator = new CosmicCalculator(measurement);
            var output = new MeasurementReport(measurement).export(configuration.outputPath());

            var processes = new LinkedHashMap<String, Object>();
            calculator.summarize().forEach((name, summary) -> processes.put(name, summary.totalCfp()));

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("config", configuration.configPath().toString());
            metadata.put("output", output.toAbsolutePath().toString());
            metadata.put("parser", parser.name());
            metadata.put("system", measurement.name());
            metadata.put("totalCfp", calculator.totalCfp());
            metadata.put("processes", processes);
            LOG.info("Measured '{}': {} CFP", measurement.name(), calculator.totalCfp());
            return RunResult.success(metadata, started);
        } catch (RuntimeException ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("config", configuration.configPath().toString());
            errorMeta.put("exception", ex.getClass().getSimpleName());
            if (Boolean.getBoolean(DEBUG_PROPERTY)) {
                LOG.error("Measurement run failed", ex);
            } else {
                LOG.debug("Measurement run failed", ex);
            }
            String message = ex.getMessage() != null && !ex.getMessage().isBlank()
                ? ex.getMessage()
                : ex.getClass().getSimpleName();
            return RunResult.failure(message, errorMeta, started);
        }
    }
}
