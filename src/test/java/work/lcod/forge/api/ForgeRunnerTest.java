package work.lcod.forge.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.forge.support.ForgeTestSupport.writeDenoJson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.forge.git.GitCommandRunner;

class ForgeRunnerTest {
    private static final GitCommandRunner OUTSIDE_REPOSITORY = (directory, arguments) -> new GitCommandRunner.CommandResult(
        "git",
        arguments,
        128,
        "",
        "fatal: not a git repository (or any of the parent directories): .git"
    );

    @TempDir
    Path root;

    private final ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();

    private ResolveReport run(ResolveConfiguration configuration) {
        var stream = new PrintStream(diagnostics, true, StandardCharsets.UTF_8);
        return new ForgeRunner(ignored -> OUTSIDE_REPOSITORY, stream).run(configuration);
    }

    @Test
    void reportsUnreleasedPackagesOutsideRepositories() throws Exception {
        writeDenoJson(root, "{ \"workspace\": [\"a\", \"b\"] }");
        writeDenoJson(root.resolve("a"), "@lcod/a", "1.0.0");
        writeDenoJson(root.resolve("b"), "@lcod/b", null);

        ResolveReport report = run(ResolveConfiguration.builder()
            .directory(root)
            .logLevel(LogLevel.INFO)
            .build());

        assertEquals(ResolveReport.Status.SUCCESS, report.status());
        assertEquals(List.of("a 1.0.0"), report.versionLines());
        JsonNode json = new ObjectMapper().readTree(report.toPrettyJson());
        assertEquals("success", json.get("status").asText());
        JsonNode first = json.get("packages").get(0);
        assertEquals("a", first.get("module").asText());
        assertEquals("@lcod/a", first.get("name").asText());
        assertEquals("unreleased", first.get("state").asText());
        assertEquals("1.0.0", first.get("version").asText());
        assertEquals("unversioned", json.get("packages").get(1).get("state").asText());
        assertTrue(diagnostics.toString(StandardCharsets.UTF_8).contains("Resolved a (Unreleased): 1.0.0"));
    }

    @Test
    void failingPackageFailsTheReport() throws Exception {
        writeDenoJson(root, "{ \"workspace\": [\"missing\", \"ok\"] }");
        writeDenoJson(root.resolve("ok"), "ok", "2.0.0");

        ResolveReport report = run(ResolveConfiguration.builder().directory(root).concurrency(1).build());

        assertEquals(ResolveReport.Status.FAILURE, report.status());
        assertEquals(1, report.status().exitCode());
        assertEquals(1, report.failures().size());
        assertEquals(1, report.resolved().size());
        JsonNode failed = new ObjectMapper().readTree(report.toPrettyJson()).get("packages").get(0);
        assertEquals("PackageException", failed.get("error").asText());
        assertTrue(diagnostics.toString(StandardCharsets.UTF_8).contains("Cannot resolve package"));
    }

    @Test
    void logLevelSilencesDiagnostics() throws Exception {
        writeDenoJson(root, "ok", "2.0.0");

        run(ResolveConfiguration.builder().directory(root).logLevel(LogLevel.FATAL).build());

        assertEquals("", diagnostics.toString(StandardCharsets.UTF_8));
    }

    @Test
    void runnerFactoryFailureBecomesReport() {
        var stream = new PrintStream(diagnostics, true, StandardCharsets.UTF_8);
        ForgeRunner runner = new ForgeRunner(configuration -> {
            throw new IllegalStateException("no git");
        }, stream);

        ResolveReport report = runner.run(ResolveConfiguration.builder().directory(root).build());

        assertEquals(ResolveReport.Status.FAILURE, report.status());
        assertEquals("no git", report.error().orElseThrow());
        assertEquals(List.of(), report.packages());
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertTrue(LogLevel.INFO.enables(LogLevel.ERROR));
        assertFalse(LogLevel.ERROR.enables(LogLevel.INFO));
    }
}
