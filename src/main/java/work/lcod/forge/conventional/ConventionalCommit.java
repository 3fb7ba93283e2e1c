package work.lcod.forge.conventional;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.git.Commit;

/**
 * A commit with its <a href="https://www.conventionalcommits.org">Conventional Commits</a> details.
 *
 * @param description commit description, the raw summary when the summary is not conventional
 * @param type lowercase commit type ({@code feat}, {@code fix}, ...)
 * @param scopes lowercase scopes, possibly empty
 * @param breaking description of the breaking change when the commit is breaking
 * @param footers trailers merged with the footer block of the body
 */
public record ConventionalCommit(
    Commit commit,
    String description,
    Optional<String> type,
    List<String> scopes,
    Optional<String> breaking,
    Map<String, String> footers
) {
    /** Scope matching every module. */
    public static final String WILDCARD_SCOPE = "*";

    public ConventionalCommit {
        Objects.requireNonNull(commit, "commit");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(type, "type");
        scopes = List.copyOf(Objects.requireNonNull(scopes, "scopes"));
        Objects.requireNonNull(breaking, "breaking");
        footers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(footers, "footers")));
    }

    public boolean isBreaking() {
        return breaking.isPresent();
    }

    public boolean isType(String candidate) {
        return type.map(value -> value.equals(candidate)).orElse(false);
    }

    /**
     * Whether the commit is scoped to the module, directly or through the wildcard scope.
     */
    public boolean hasScope(String module) {
        return scopes.contains(module.toLowerCase(Locale.ROOT)) || scopes.contains(WILDCARD_SCOPE);
    }

    public String hash() {
        return commit.hash();
    }

    public String shortHash() {
        return commit.shortHash();
    }
}
