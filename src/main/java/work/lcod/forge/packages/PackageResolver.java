package work.lcod.forge.packages;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import work.lcod.forge.conventional.ConventionalCommit;
import work.lcod.forge.conventional.ConventionalCommits;
import work.lcod.forge.git.CommitLogOptions;
import work.lcod.forge.git.GitCli;
import work.lcod.forge.git.GitRepository;
import work.lcod.forge.git.NotARepositoryException;
import work.lcod.forge.git.Tag;
import work.lcod.forge.git.TagListOptions;
import work.lcod.forge.version.SemanticVersion;
import work.lcod.forge.version.UpdateType;
import work.lcod.forge.version.VersionException;

/**
 * Resolves the version of a package from its manifest, its release tags and the Conventional Commits
 * made since its latest release.
 *
 * <p>Release tags are named {@code <module>@<version>}. A commit counts for a package when one of its
 * scopes is the package module or {@code *}. Every call reads the repository again.</p>
 */
public final class PackageResolver {
    private static final String HEAD = "HEAD";
    private static final String FEATURE = "feat";

    private final ManifestLoader manifests;
    private final Function<Path, GitRepository> repositories;

    public PackageResolver() {
        this(new ManifestLoader(), GitCli::new);
    }

    /**
     * @param repositories opens the repository containing a package directory
     */
    public PackageResolver(ManifestLoader manifests, Function<Path, GitRepository> repositories) {
        this.manifests = Objects.requireNonNull(manifests, "manifests");
        this.repositories = Objects.requireNonNull(repositories, "repositories");
    }

    public Package resolve(Path directory) {
        Path normalized = directory.toAbsolutePath().normalize();
        PackageConfig config = manifests.load(normalized);
        String module = config.module().orElseGet(() -> directoryName(normalized));
        if (config.version().isEmpty()) {
            return new Package(normalized, module, config, new VersionState.Unversioned());
        }
        String declared = config.version().get();
        VersionState state;
        try {
            state = resolveState(repositories.apply(normalized), module, declared);
        } catch (NotARepositoryException ex) {
            state = new VersionState.Unreleased(declared);
        }
        return new Package(normalized, module, config, state);
    }

    private VersionState resolveState(GitRepository repository, String module, String declared) {
        Release release = findRelease(repository, module);
        List<ConventionalCommit> changelog = changelog(repository, module, release);
        if (!release.version().equals(declared)) {
            return new VersionState.Forced(release, forcedUpdate(release, declared, changelog));
        }
        if (changelog.isEmpty()) {
            return new VersionState.Released(release);
        }
        return new VersionState.Calculated(release, calculatedUpdate(release, changelog));
    }

    /**
     * Latest release: the highest release tag on HEAD, else the highest release tag not contained in
     * HEAD, else {@link Release#none()}.
     */
    static Release findRelease(GitRepository repository, String module) {
        String pattern = module + "@*";
        List<Tag> onHead = repository.listTags(
            TagListOptions.builder().name(pattern).sortByVersion(true).pointsAt(HEAD).build()
        );
        List<Tag> notOnHead = repository.listTags(
            TagListOptions.builder().name(pattern).sortByVersion(true).noContains(HEAD).build()
        );
        List<Release> current = releases(module, onHead);
        List<Release> others = releases(module, notOnHead);
        return highest(current)
            .or(() -> highest(others))
            .orElseGet(Release::none);
    }

    private static List<Release> releases(String module, List<Tag> tags) {
        List<Release> releases = new ArrayList<>(tags.size());
        for (Tag tag : tags) {
            String version = tagVersion(module, tag);
            if (!SemanticVersion.canParse(version)) {
                throw new VersionException("Cannot parse semantic version from tag: " + tag.name());
            }
            releases.add(Release.of(version, tag));
        }
        return releases;
    }

    private static Optional<Release> highest(List<Release> releases) {
        return releases.stream().max(Comparator.comparing(release -> SemanticVersion.parse(release.version())));
    }

    private static String tagVersion(String module, Tag tag) {
        String prefix = module + "@";
        if (tag.name().startsWith(prefix)) {
            return tag.name().substring(prefix.length());
        }
        int separator = tag.name().lastIndexOf('@');
        return separator < 0 ? "" : tag.name().substring(separator + 1);
    }

    private static List<ConventionalCommit> changelog(GitRepository repository, String module, Release release) {
        CommitLogOptions options = release.tag()
            .map(tag -> CommitLogOptions.builder().from(tag.commit().hash()).build())
            .orElseGet(() -> CommitLogOptions.builder().paths(List.of(".")).build());
        List<ConventionalCommit> changelog = new ArrayList<>();
        for (ConventionalCommit commit : ConventionalCommits.classifyAll(repository.log(options))) {
            if (commit.hasScope(module)) {
                changelog.add(commit);
            }
        }
        return changelog;
    }

    static Update forcedUpdate(Release release, String declared, List<ConventionalCommit> changelog) {
        SemanticVersion released = SemanticVersion.parse(release.version());
        SemanticVersion target = SemanticVersion.parse(declared);
        if (target.lessThan(released)) {
            throw new VersionException(
                "Cannot force update to an older version: " + declared + " is older than " + release.version()
            );
        }
        return new Update(Optional.ofNullable(target.differingComponent(released)), declared, changelog);
    }

    static Update calculatedUpdate(Release release, List<ConventionalCommit> changelog) {
        SemanticVersion released = SemanticVersion.parse(release.version());
        boolean breaking = changelog.stream().anyMatch(ConventionalCommit::isBreaking);
        boolean feature = changelog.stream().anyMatch(commit -> commit.isType(FEATURE));
        UpdateType type;
        if (breaking && released.major() > 0) {
            type = UpdateType.MAJOR;
        } else if (feature || breaking) {
            type = UpdateType.MINOR;
        } else {
            type = UpdateType.PATCH;
        }
        SemanticVersion next = released.increment(type)
            .withPrerelease("pre", Integer.toString(changelog.size()))
            .withBuild(changelog.get(0).shortHash());
        if (!released.lessThan(next)) {
            throw new VersionException(
                "Cannot calculate update from pre-release " + release.version() + ": " + next
                    + " would not be newer, declare the next version explicitly"
            );
        }
        return new Update(Optional.of(type), next.toString(), changelog);
    }

    private static String directoryName(Path directory) {
        Path name = directory.getFileName();
        return name == null ? directory.toString() : name.toString();
    }
}
