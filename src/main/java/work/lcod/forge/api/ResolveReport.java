package work.lcod.forge.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.forge.conventional.ConventionalCommit;
import work.lcod.forge.packages.Package;
import work.lcod.forge.packages.PackageResult;
import work.lcod.forge.packages.Release;
import work.lcod.forge.packages.Update;
import work.lcod.forge.version.UpdateType;

/**
 * Outcome of a {@link ForgeRunner} run, usable by the CLI and embedding apps.
 *
 * @param error failure that prevented any package from being resolved
 */
public record ResolveReport(
    Status status,
    List<PackageResult> packages,
    Optional<String> error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ResolveReport {
        packages = List.copyOf(packages);
    }

    public static ResolveReport of(List<PackageResult> packages, Instant startedAt) {
        boolean failed = packages.stream().anyMatch(result -> result instanceof PackageResult.Failed);
        return new ResolveReport(failed ? Status.FAILURE : Status.SUCCESS, packages, Optional.empty(), startedAt, Instant.now());
    }

    public static ResolveReport failure(String message, Instant startedAt) {
        return new ResolveReport(Status.FAILURE, List.of(), Optional.ofNullable(message), startedAt, Instant.now());
    }

    public List<Package> resolved() {
        List<Package> resolved = new ArrayList<>();
        for (PackageResult result : packages) {
            if (result instanceof PackageResult.Resolved ok) {
                resolved.add(ok.pkg());
            }
        }
        return resolved;
    }

    public List<PackageResult.Failed> failures() {
        List<PackageResult.Failed> failures = new ArrayList<>();
        for (PackageResult result : packages) {
            if (result instanceof PackageResult.Failed failed) {
                failures.add(failed);
            }
        }
        return failures;
    }

    /**
     * One {@code <module> <version>} line per resolved package with a version.
     */
    public List<String> versionLines() {
        List<String> lines = new ArrayList<>();
        for (Package pkg : resolved()) {
            pkg.version().ifPresent(version -> lines.add(pkg.module() + " " + version));
        }
        return lines;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        error.ifPresent(message -> serializable.put("error", message));
        List<Map<String, Object>> entries = new ArrayList<>();
        for (PackageResult result : packages) {
            entries.add(entry(result));
        }
        serializable.put("packages", entries);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize report: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Map<String, Object> entry(PackageResult result) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("directory", result.directory().toString());
        if (result instanceof PackageResult.Failed failed) {
            entry.put("error", failed.error().getClass().getSimpleName());
            entry.put("message", String.valueOf(failed.error().getMessage()));
            return entry;
        }
        Package pkg = ((PackageResult.Resolved) result).pkg();
        entry.put("module", pkg.module());
        pkg.config().name().ifPresent(name -> entry.put("name", name));
        pkg.config().version().ifPresent(declared -> entry.put("declared", declared));
        entry.put("state", pkg.state().getClass().getSimpleName().toLowerCase(Locale.ROOT));
        pkg.version().ifPresent(version -> entry.put("version", version));
        pkg.release().ifPresent(release -> entry.put("release", release(release)));
        pkg.update().ifPresent(update -> entry.put("update", update(update)));
        return entry;
    }

    private static Map<String, Object> release(Release release) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("version", release.version());
        release.tag().ifPresent(tag -> {
            entry.put("tag", tag.name());
            entry.put("commit", tag.commit().hash());
        });
        return entry;
    }

    private static Map<String, Object> update(Update update) {
        Map<String, Object> entry = new LinkedHashMap<>();
        update.type().map(UpdateType::label).ifPresent(type -> entry.put("type", type));
        entry.put("version", update.version());
        List<Map<String, Object>> changelog = new ArrayList<>();
        for (ConventionalCommit commit : update.changelog()) {
            Map<String, Object> change = new LinkedHashMap<>();
            change.put("hash", commit.hash());
            commit.type().ifPresent(type -> change.put("type", type));
            change.put("scopes", commit.scopes());
            change.put("description", commit.description());
            commit.breaking().ifPresent(breaking -> change.put("breaking", breaking));
            changelog.add(change);
        }
        entry.put("changelog", changelog);
        return entry;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
