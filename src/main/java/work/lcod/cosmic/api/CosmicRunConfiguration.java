package work.lcod.cosmic.api;

import java.nio.file.Path;
import java.util.Objects;
import work.lcod.cosmic.config.ParserMode;

/**
 * Immutable configuration of one measurement-to-report run.
 */
public record CosmicRunConfiguration(
    Path configPath,
    Path outputPath,
    ParserMode parserMode
) {
    public static final Path DEFAULT_OUTPUT = Path.of("cosmic_measurement.xlsx");

    public CosmicRunConfiguration {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(parserMode, "parserMode");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path configPath;
        private Path outputPath = DEFAULT_OUTPUT;
        private ParserMode parserMode = ParserMode.AUTO;

        public Builder configPath(Path configPath) {
            this.configPath = configPath;
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder parserMode(ParserMode parserMode) {
            this.parserMode = parserMode;
            return this;
        }

        public CosmicRunConfiguration build() {
            return new CosmicRunConfiguration(configPath, outputPath, parserMode);
        }
    }
}
