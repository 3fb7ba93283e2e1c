package work.lcod.forge.packages;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving the version of a package.
 */
public sealed interface VersionState
    permits VersionState.Unversioned,
        VersionState.Unreleased,
        VersionState.Released,
        VersionState.Forced,
        VersionState.Calculated {

    default Optional<Release> release() {
        return Optional.empty();
    }

    default Optional<Update> update() {
        return Optional.empty();
    }

    /** The manifest declares no version. */
    record Unversioned() implements VersionState {}

    /** The package lives outside a git repository, only the declared version is known. */
    record Unreleased(String declared) implements VersionState {
        public Unreleased {
            Objects.requireNonNull(declared, "declared");
        }
    }

    /** Nothing changed since the release. */
    record Released(Release current) implements VersionState {
        public Released {
            Objects.requireNonNull(current, "current");
        }

        @Override
        public Optional<Release> release() {
            return Optional.of(current);
        }
    }

    /** The declared version differs from the release and is taken as is. */
    record Forced(Release current, Update pending) implements VersionState {
        public Forced {
            Objects.requireNonNull(current, "current");
            Objects.requireNonNull(pending, "pending");
        }

        @Override
        public Optional<Release> release() {
            return Optional.of(current);
        }

        @Override
        public Optional<Update> update() {
            return Optional.of(pending);
        }
    }

    /** The next version is calculated from the commits since the release. */
    record Calculated(Release current, Update pending) implements VersionState {
        public Calculated {
            Objects.requireNonNull(current, "current");
            Objects.requireNonNull(pending, "pending");
        }

        @Override
        public Optional<Release> release() {
            return Optional.of(current);
        }

        @Override
        public Optional<Update> update() {
            return Optional.of(pending);
        }
    }
}
