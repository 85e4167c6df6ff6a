package work.layerflow.cli;

import picocli.CommandLine;

/**
 * Reports the engine version from the jar manifest, and the Java runtime that tasks will run on.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "0.0.0-dev";

    @Override
    public String[] getVersion() {
        var engine = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "layerflow " + (engine == null ? UNRELEASED : engine),
            "java " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
