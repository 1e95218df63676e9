package work.lcod.cosmic.cli;

import java.util.Locale;
import picocli.CommandLine;
import work.lcod.cosmic.config.ConfigParsers;

/**
 * Reports the jar version and the YAML parser a run would pick by default.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        var mode = ConfigParsers.defaultMode();
        return new String[] {
            "cosmic-fp (java) " + version,
            "YAML parser: " + ConfigParsers.yaml(mode).name() + " (mode " + mode.name().toLowerCase(Locale.ROOT) + ")"
        };
    }
}
