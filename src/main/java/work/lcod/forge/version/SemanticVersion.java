package work.lcod.forge.version;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A <a href="https://semver.org">semantic version</a> with optional pre-release and build metadata.
 *
 * <p>Ordering follows SemVer precedence; build metadata does not take part in {@link #compareTo}.</p>
 */
public record SemanticVersion(
    long major,
    long minor,
    long patch,
    List<String> prerelease,
    List<String> build
) implements Comparable<SemanticVersion> {
    private static final String NUMBER = "0|[1-9]\\d*";
    private static final String PRERELEASE_ID = "(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)";
    private static final Pattern PATTERN = Pattern.compile(
        "^(?<major>" + NUMBER + ")\\.(?<minor>" + NUMBER + ")\\.(?<patch>" + NUMBER + ")"
            + "(?:-(?<prerelease>" + PRERELEASE_ID + "(?:\\." + PRERELEASE_ID + ")*))?"
            + "(?:\\+(?<build>[0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$"
    );
    private static final Pattern IDENTIFIER = Pattern.compile("[0-9a-zA-Z-]+");

    public SemanticVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
        prerelease = List.copyOf(Objects.requireNonNull(prerelease, "prerelease"));
        build = List.copyOf(Objects.requireNonNull(build, "build"));
        for (String identifier : prerelease) {
            requireIdentifier(identifier);
        }
        for (String identifier : build) {
            requireIdentifier(identifier);
        }
    }

    public static SemanticVersion of(long major, long minor, long patch) {
        return new SemanticVersion(major, minor, patch, List.of(), List.of());
    }

    public static boolean canParse(String value) {
        return value != null && PATTERN.matcher(value.trim()).matches();
    }

    public static SemanticVersion parse(String value) {
        if (value == null) {
            throw new VersionException("Cannot parse semantic version: null");
        }
        Matcher matcher = PATTERN.matcher(value.trim());
        if (!matcher.matches()) {
            throw new VersionException("Cannot parse semantic version: " + value);
        }
        try {
            return new SemanticVersion(
                Long.parseLong(matcher.group("major")),
                Long.parseLong(matcher.group("minor")),
                Long.parseLong(matcher.group("patch")),
                split(matcher.group("prerelease")),
                split(matcher.group("build"))
            );
        } catch (NumberFormatException ex) {
            throw new VersionException("Cannot parse semantic version: " + value, ex);
        }
    }

    /**
     * Next version for the given bump, dropping pre-release and build metadata.
     *
     * <p>A pre-release already on the way to the bumped version is completed instead of bumped again,
     * so {@code 2.0.0-pre.1} incremented by {@code MAJOR} is {@code 2.0.0}.</p>
     */
    public SemanticVersion increment(UpdateType type) {
        Objects.requireNonNull(type, "type");
        boolean pre = isPrerelease();
        return switch (type) {
            case MAJOR -> pre && minor == 0 && patch == 0 ? of(major, 0, 0) : of(major + 1, 0, 0);
            case MINOR -> pre && patch == 0 ? of(major, minor, 0) : of(major, minor + 1, 0);
            case PATCH -> pre ? of(major, minor, patch) : of(major, minor, patch + 1);
        };
    }

    public SemanticVersion withPrerelease(String... identifiers) {
        return new SemanticVersion(major, minor, patch, List.of(identifiers), build);
    }

    public SemanticVersion withBuild(String... identifiers) {
        return new SemanticVersion(major, minor, patch, prerelease, List.of(identifiers));
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    public boolean lessThan(SemanticVersion other) {
        return compareTo(other) < 0;
    }

    /**
     * First component that differs from {@code other}, checked major, then minor, then patch.
     */
    public UpdateType differingComponent(SemanticVersion other) {
        if (major != other.major) {
            return UpdateType.MAJOR;
        }
        if (minor != other.minor) {
            return UpdateType.MINOR;
        }
        if (patch != other.patch) {
            return UpdateType.PATCH;
        }
        return null;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Long.compare(major, other.major);
        if (result != 0) {
            return result;
        }
        result = Long.compare(minor, other.minor);
        if (result != 0) {
            return result;
        }
        result = Long.compare(patch, other.patch);
        if (result != 0) {
            return result;
        }
        if (prerelease.isEmpty() || other.prerelease.isEmpty()) {
            // a release has higher precedence than any of its pre-releases
            return Boolean.compare(prerelease.isEmpty(), other.prerelease.isEmpty());
        }
        int shared = Math.min(prerelease.size(), other.prerelease.size());
        for (int i = 0; i < shared; i++) {
            result = compareIdentifiers(prerelease.get(i), other.prerelease.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(prerelease.size(), other.prerelease.size());
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(major).append('.').append(minor).append('.').append(patch);
        if (!prerelease.isEmpty()) {
            builder.append('-').append(String.join(".", prerelease));
        }
        if (!build.isEmpty()) {
            builder.append('+').append(String.join(".", build));
        }
        return builder.toString();
    }

    private static int compareIdentifiers(String left, String right) {
        boolean leftNumeric = isNumeric(left);
        boolean rightNumeric = isNumeric(right);
        if (leftNumeric && rightNumeric) {
            int length = Integer.compare(left.length(), right.length());
            return length != 0 ? length : left.compareTo(right);
        }
        if (leftNumeric != rightNumeric) {
            return leftNumeric ? -1 : 1;
        }
        return left.compareTo(right);
    }

    private static boolean isNumeric(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return !value.isEmpty();
    }

    private static List<String> split(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return List.of(value.split("\\."));
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid version identifier: " + identifier);
        }
    }
}
