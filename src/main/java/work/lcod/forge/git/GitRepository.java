package work.lcod.forge.git;

import java.util.List;
import java.util.Optional;

/**
 * Read-only queries against a repository. Every call reads live repository state; nothing is
 * cached between calls.
 */
public interface GitRepository {
    /** Tags matching the options, each resolved to the commit it points to. */
    List<Tag> listTags(TagListOptions options);

    /** Commits matching the options, newest first. Empty for a repository without commits. */
    List<Commit> log(CommitLogOptions options);

    /** The commit a revision resolves to. */
    Optional<Commit> commit(String revision);

    /**
     * @throws GitException when the current branch has no commits
     */
    default Commit headCommit() {
        return commit("HEAD").orElseThrow(() -> new GitException("Current branch does not have any commits"));
    }
}
