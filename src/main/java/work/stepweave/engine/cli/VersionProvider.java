package work.stepweave.engine.cli;

import picocli.CommandLine;

/**
 * Reports the engine build and the Java runtime it runs on.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var pkg = Main.class.getPackage();
        var title = pkg.getImplementationTitle() != null ? pkg.getImplementationTitle() : "stepweave-engine";
        var version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        return new String[] {
            title + " " + version,
            "Java " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
