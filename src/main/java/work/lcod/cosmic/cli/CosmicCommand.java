package work.lcod.cosmic.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.cosmic.api.CosmicRunConfiguration;
import work.lcod.cosmic.api.CosmicRunner;
import work.lcod.cosmic.api.LogLevel;
import work.lcod.cosmic.api.RunResult;
import work.lcod.cosmic.config.ParserMode;

@CommandLine.Command(
    name = "cosmic-fp",
    description = "Compute COSMIC function points from a measurement definition and export an Excel report.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CosmicCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "CONFIG",
        description = "Path to the measurement definition (YAML or JSON)."
    )
    private Path config;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Path for the generated Excel workbook.",
        defaultValue = "cosmic_measurement.xlsx"
    )
    private Path output;

    @CommandLine.Option(
        names = "--parser",
        description = "YAML parser (auto|builtin|jackson).",
        defaultValue = "${sys:cosmic.parser:-auto}"
    )
    private String parserRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--summary",
        description = "Print the run summary as JSON."
    )
    private boolean summary;

    @Override
    public Integer call() {
        if (logLevelRaw != null) {
            LogLevel.from(logLevelRaw).apply();
        }
        ParserMode parserMode = resolveParserMode();

        var configuration = CosmicRunConfiguration.builder()
            .configPath(config)
            .outputPath(output)
            .parserMode(parserMode)
            .build();
        RunResult result = new CosmicRunner().run(configuration);

        var out = spec.commandLine().getOut();
        if (result.isSuccess()) {
            out.println("Excel report generated at: " + result.output().orElse(String.valueOf(output)));
        } else {
            var err = spec.commandLine().getErr();
            err.println(spec.commandLine().getColorScheme().errorText(result.error().orElse("Measurement run failed")));
        }
        if (summary) {
            out.println(result.toPrettyJson());
        }
        out.flush();
        return result.status().exitCode();
    }

    private ParserMode resolveParserMode() {
        try {
            return ParserMode.from(parserRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
