package work.lcod.forge.packages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static work.lcod.forge.support.ForgeTestSupport.writeDenoJson;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.forge.conventional.ConventionalCommit;
import work.lcod.forge.support.GitFixture;
import work.lcod.forge.version.UpdateType;

class PackageResolverIntegrationTest {
    @TempDir
    Path directory;

    @BeforeEach
    void requireGit() {
        assumeTrue(GitFixture.gitAvailable(), "git is not available");
    }

    @Test
    void calculatesUpdateFromRealHistory() throws Exception {
        GitFixture repo = GitFixture.init(directory);
        writeDenoJson(directory.resolve("tool/forge"), "@lcod/forge", "1.0.0");
        repo.commit("feat(forge): initial release");
        repo.git("tag", "forge@1.0.0");
        repo.write("tool/forge/mod.ts", "export {};\n");
        String feature = repo.commit("feat(forge): resolve workspaces");
        repo.write("core/git/mod.ts", "export {};\n");
        repo.commit("fix(git): unrelated");

        Package pkg = new PackageResolver().resolve(directory.resolve("tool/forge"));

        assertInstanceOf(VersionState.Calculated.class, pkg.state());
        assertEquals("forge@1.0.0", pkg.release().orElseThrow().tag().orElseThrow().name());
        Update update = pkg.update().orElseThrow();
        assertEquals(Optional.of(UpdateType.MINOR), update.type());
        assertTrue(update.version().startsWith("1.1.0-pre.1+"));
        assertTrue(feature.startsWith(update.version().substring("1.1.0-pre.1+".length())));
        assertEquals(List.of(feature), update.changelog().stream().map(ConventionalCommit::hash).toList());
    }

    @Test
    void breakingFooterNextToSignOffIsMajor() throws Exception {
        GitFixture repo = GitFixture.init(directory);
        writeDenoJson(directory, "@scope/mod", "1.2.3");
        repo.commit("feat(mod): initial");
        repo.git("tag", "mod@1.2.3");
        String breaking = repo.commit(
            "fix(mod): rename",
            "Some context.",
            "Signed-off-by: Ada Lovelace <ada@example.com>\nBREAKING CHANGE: option renamed"
        );

        Update update = new PackageResolver().resolve(directory).update().orElseThrow();

        assertEquals(Optional.of(UpdateType.MAJOR), update.type());
        assertTrue(update.version().startsWith("2.0.0-pre.1+"));
        assertEquals(Optional.of("option renamed"), update.changelog().get(0).breaking());
        assertEquals(breaking, update.changelog().get(0).hash());
    }

    @Test
    void breakingFooterSurvivesSignOff() throws Exception {
        GitFixture repo = GitFixture.init(directory);
        writeDenoJson(directory, "mod", "1.2.3");
        repo.commit("feat(mod): initial");
        repo.git("tag", "mod@1.2.3");
        repo.git("commit", "-q", "--allow-empty", "-s",
            "-m", "fix(mod): rename",
            "-m", "BREAKING CHANGE: option renamed");

        Update update = new PackageResolver().resolve(directory).update().orElseThrow();

        assertEquals(Optional.of(UpdateType.MAJOR), update.type());
        assertEquals(Optional.of("option renamed"), update.changelog().get(0).breaking());
    }

    @Test
    void releasedPackageHasNoUpdate() throws Exception {
        GitFixture repo = GitFixture.init(directory);
        writeDenoJson(directory, "forge", "2.0.0");
        repo.commit("feat(forge)!: rewrite");
        repo.git("tag", "-a", "forge@2.0.0", "-m", "Release forge 2.0.0");

        Package pkg = new PackageResolver().resolve(directory);

        assertInstanceOf(VersionState.Released.class, pkg.state());
        assertEquals(Optional.of("2.0.0"), pkg.version());
    }

    @Test
    void untaggedPackageCountsEveryCommit() throws Exception {
        GitFixture repo = GitFixture.init(directory);
        writeDenoJson(directory, "forge", "0.0.0");
        repo.commit("fix(forge): first");
        repo.commit("docs: unscoped");

        Package pkg = new PackageResolver().resolve(directory);

        Update update = pkg.update().orElseThrow();
        assertEquals(Optional.of(UpdateType.PATCH), update.type());
        assertTrue(update.version().startsWith("0.0.1-pre.1+"));
    }
}
