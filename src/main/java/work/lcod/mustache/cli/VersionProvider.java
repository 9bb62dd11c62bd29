package work.lcod.mustache.cli;

import picocli.CommandLine;

/**
 * Version from the jar manifest; {@code development} when running from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-mustache " + (implementationVersion != null ? implementationVersion : "development"),
            "runtime: Java " + Runtime.version()
        };
    }
}
