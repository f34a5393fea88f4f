package work.lcod.toon.cli;

import picocli.CommandLine;

/**
 * Reports the jar's implementation version, or {@code development} when run from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DESCRIPTION = "JSON to TOON (Token-Oriented Object Notation) encoder";

    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] { "toon-encode " + version, DESCRIPTION };
    }
}
