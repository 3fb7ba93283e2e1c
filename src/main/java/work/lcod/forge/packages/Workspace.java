package work.lcod.forge.packages;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves the packages of one or more workspace roots.
 *
 * <p>A root declaring {@code workspace} children stands for its children only; children are not
 * expanded further. Any other root stands for itself. Packages are resolved on a bounded pool and a
 * failing package never stops the others.</p>
 */
public final class Workspace {
    private final ManifestLoader manifests;
    private final PackageResolver resolver;

    public Workspace() {
        this(new ManifestLoader(), new PackageResolver());
    }

    public Workspace(ManifestLoader manifests, PackageResolver resolver) {
        this.manifests = Objects.requireNonNull(manifests, "manifests");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * @return one result per package, in declaration order
     */
    public List<PackageResult> resolve(List<Path> roots, WorkspaceOptions options) {
        List<Member> members = members(roots);
        List<PackageResult> results = resolveAll(members, options.concurrency());
        List<PathMatcher> matchers = matchers(options.filters());
        List<PackageResult> selected = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            if (matches(matchers, members.get(i), results.get(i))) {
                selected.add(results.get(i));
            }
        }
        return selected;
    }

    private List<Member> members(List<Path> roots) {
        Map<Path, Member> members = new LinkedHashMap<>();
        for (Path root : roots) {
            Path normalized = root.toAbsolutePath().normalize();
            PackageConfig config;
            try {
                config = manifests.load(normalized);
            } catch (PackageException ex) {
                members.putIfAbsent(normalized, new Member(normalized, normalized, ex));
                continue;
            }
            if (!config.isWorkspace()) {
                members.putIfAbsent(normalized, new Member(normalized, normalized, null));
                continue;
            }
            for (String child : config.workspace()) {
                Path directory = normalized.resolve(child).normalize();
                members.putIfAbsent(directory, new Member(normalized, directory, null));
            }
        }
        return new ArrayList<>(members.values());
    }

    private List<PackageResult> resolveAll(List<Member> members, int concurrency) {
        if (members.isEmpty()) {
            return List.of();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, members.size()), new WorkerFactory());
        try {
            List<Future<Package>> futures = new ArrayList<>(members.size());
            for (Member member : members) {
                futures.add(member.error() == null ? pool.submit(() -> resolver.resolve(member.directory())) : null);
            }
            List<PackageResult> results = new ArrayList<>(members.size());
            for (int i = 0; i < members.size(); i++) {
                Member member = members.get(i);
                Future<Package> future = futures.get(i);
                results.add(future == null ? new PackageResult.Failed(member.directory(), member.error()) : await(member, future));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static PackageResult await(Member member, Future<Package> future) {
        try {
            return new PackageResult.Resolved(future.get());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PackageException("Interrupted while resolving " + member.directory(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException failure) {
                return new PackageResult.Failed(member.directory(), failure);
            }
            if (cause instanceof Error error) {
                throw error;
            }
            return new PackageResult.Failed(member.directory(), new PackageException(String.valueOf(cause.getMessage()), cause));
        }
    }

    private static List<PathMatcher> matchers(List<String> filters) {
        List<PathMatcher> matchers = new ArrayList<>(filters.size());
        for (String filter : filters) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + filter));
        }
        return matchers;
    }

    private static boolean matches(List<PathMatcher> matchers, Member member, PackageResult result) {
        if (matchers.isEmpty()) {
            return true;
        }
        Path module = Path.of(result instanceof PackageResult.Resolved resolved
            ? resolved.pkg().module()
            : String.valueOf(member.directory().getFileName()));
        Path relative = member.root().relativize(member.directory());
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(module) || matcher.matches(relative)) {
                return true;
            }
        }
        return false;
    }

    private record Member(Path root, Path directory, PackageException error) {}

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "lcod-forge-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
