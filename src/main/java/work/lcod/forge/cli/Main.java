package work.lcod.forge.cli;

import picocli.CommandLine;

/**
 * Entry point of the {@code lcod-forge} jar.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new ForgeCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
