package work.lcod.forge.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] { "lcod-forge " + (implementationVersion != null ? implementationVersion : "development") };
    }
}
