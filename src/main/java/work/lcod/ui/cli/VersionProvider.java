package work.lcod.ui.cli;

import picocli.CommandLine;
import work.lcod.ui.ast.Program;

/** Tool version from the jar manifest, plus the program format version it reads by default. */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] { "uic " + version, "program format " + Program.DEFAULT_VERSION };
    }
}
