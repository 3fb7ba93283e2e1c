package work.lcod.forge.git;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.format.FormatDecoder;

/**
 * {@link GitRepository} that runs the {@code git} command line in a working directory and decodes
 * its formatted output.
 */
public final class GitCli implements GitRepository {
    private static final String NOT_A_REPOSITORY = "not a git repository";

    private final Path directory;
    private final GitCommandRunner runner;

    public GitCli(Path directory) {
        this(directory, new ProcessGitCommandRunner());
    }

    public GitCli(Path directory, GitCommandRunner runner) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public Path directory() {
        return directory;
    }

    @Override
    public List<Tag> listTags(TagListOptions options) {
        List<String> args = tagListArguments(options);
        String output = run(args);
        List<Tag> tags = new ArrayList<>();
        for (Map<String, Object> record : FormatDecoder.decode(GitFormats.TAG, output)) {
            String name = GitFormats.tagName(record);
            String hash = GitFormats.tagCommitHash(record);
            Commit commit = commit(hash)
                .orElseThrow(() -> new GitException("Cannot find commit " + hash + " for tag " + name));
            tags.add(GitFormats.toTag(record, commit));
        }
        return tags;
    }

    @Override
    public List<Commit> log(CommitLogOptions options) {
        List<String> args = logArguments(options);
        String output;
        try {
            output = run(args);
        } catch (NotARepositoryException ex) {
            throw ex;
        } catch (GitException ex) {
            if (!hasHead()) {
                return List.of();
            }
            throw ex;
        }
        List<Commit> commits = new ArrayList<>();
        for (Map<String, Object> record : FormatDecoder.decode(GitFormats.COMMIT, output)) {
            commits.add(GitFormats.toCommit(record));
        }
        return commits;
    }

    @Override
    public Optional<Commit> commit(String revision) {
        List<Commit> commits = log(CommitLogOptions.builder().to(revision).maxCount(1).build());
        return commits.stream().findFirst();
    }

    static List<String> tagListArguments(TagListOptions options) {
        List<String> args = new ArrayList<>();
        args.add("tag");
        args.add("--list");
        args.add("--format=" + GitFormats.TAG.formatArgument());
        options.contains().ifPresent(value -> args.addAll(List.of("--contains", value)));
        options.noContains().ifPresent(value -> args.addAll(List.of("--no-contains", value)));
        options.merged().ifPresent(value -> args.addAll(List.of("--merged", value)));
        options.noMerged().ifPresent(value -> args.addAll(List.of("--no-merged", value)));
        options.pointsAt().ifPresent(value -> args.addAll(List.of("--points-at", value)));
        if (options.sortByVersion()) {
            args.add("--sort=-version:refname");
        }
        options.name().ifPresent(args::add);
        return args;
    }

    static List<String> logArguments(CommitLogOptions options) {
        List<String> args = new ArrayList<>();
        args.add("log");
        args.add("--no-color");
        args.add("--format=" + GitFormats.COMMIT.formatArgument());
        options.maxCount().ifPresent(value -> args.add("--max-count=" + value));
        options.skip().ifPresent(value -> args.add("--skip=" + value));
        options.range().ifPresent(args::add);
        args.add("--");
        args.addAll(options.paths());
        return args;
    }

    private boolean hasHead() {
        var result = runner.run(directory, withGlobalFlags(List.of("rev-parse", "--verify", "--quiet", "HEAD")));
        return result.succeeded();
    }

    private String run(List<String> args) {
        List<String> fullArgs = withGlobalFlags(args);
        var result = runner.run(directory, fullArgs);
        if (result.succeeded()) {
            return result.stdout();
        }
        String output = result.stderr().isBlank() ? result.stdout() : result.stderr();
        String message = "Error running git command: " + args.get(0) + "\n\n" + output.strip();
        if (output.toLowerCase(Locale.ROOT).contains(NOT_A_REPOSITORY)) {
            throw new NotARepositoryException(message, result.command(), fullArgs, result.exitCode(), output);
        }
        throw new GitException(message, result.command(), fullArgs, result.exitCode(), output);
    }

    private static List<String> withGlobalFlags(List<String> args) {
        List<String> fullArgs = new ArrayList<>(args.size() + 1);
        fullArgs.add("--no-pager");
        fullArgs.addAll(args);
        return fullArgs;
    }
}
