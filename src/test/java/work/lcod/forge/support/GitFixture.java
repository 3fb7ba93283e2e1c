package work.lcod.forge.support;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds throwaway repositories with the real {@code git} binary for integration tests.
 */
public final class GitFixture {
    private final Path directory;

    private GitFixture(Path directory) {
        this.directory = directory;
    }

    public static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(30, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException ex) {
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Whether {@code directory} is outside of any git work tree.
     */
    public static boolean outsideWorkTree(Path directory) throws Exception {
        return run(directory, List.of("rev-parse", "--is-inside-work-tree")).exitCode() != 0;
    }

    public static GitFixture init(Path directory) throws Exception {
        Files.createDirectories(directory);
        GitFixture fixture = new GitFixture(directory);
        fixture.git("init", "-q");
        fixture.git("config", "user.name", "Ada Lovelace");
        fixture.git("config", "user.email", "ada@example.com");
        fixture.git("config", "commit.gpgsign", "false");
        fixture.git("config", "tag.gpgsign", "false");
        return fixture;
    }

    public Path directory() {
        return directory;
    }

    public String git(String... args) throws Exception {
        Result result = run(directory, List.of(args));
        if (result.exitCode() != 0) {
            throw new IllegalStateException("git " + String.join(" ", args) + " failed: " + result.output());
        }
        return result.output().trim();
    }

    /**
     * Commits every pending change, or an empty commit, and returns its hash.
     */
    public String commit(String... paragraphs) throws Exception {
        List<String> args = new ArrayList<>(List.of("commit", "-q", "--allow-empty"));
        for (String paragraph : paragraphs) {
            args.add("-m");
            args.add(paragraph);
        }
        git("add", "-A");
        git(args.toArray(String[]::new));
        return git("rev-parse", "HEAD");
    }

    public void write(String relativePath, String content) throws IOException {
        Path file = directory.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private static Result run(Path directory, List<String> args) throws Exception {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(args);
        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(directory.toFile())
            .redirectErrorStream(true);
        builder.environment().put("GIT_CONFIG_NOSYSTEM", "1");
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");
        Process process = builder.start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (!process.waitFor(60, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new IllegalStateException("git " + String.join(" ", args) + " timed out");
        }
        return new Result(process.exitValue(), output);
    }

    private record Result(int exitCode, String output) {}
}
