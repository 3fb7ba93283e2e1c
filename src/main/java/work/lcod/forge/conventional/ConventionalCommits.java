package work.lcod.forge.conventional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.forge.git.Commit;

/**
 * Classifies commits following the Conventional Commits convention.
 *
 * <p>Classification never fails: a summary without a conventional prefix becomes the description
 * of an untyped, unscoped commit.</p>
 */
public final class ConventionalCommits {
    public static final String BREAKING_CHANGE = "BREAKING-CHANGE";

    private static final Pattern SUMMARY = Pattern.compile(
        "^\\s*(?:(?<type>[A-Za-z]+)(?:\\((?<scopes>[^()]*)\\))?(?<breaking>!?):\\s*)?(?<description>\\S.*)$"
    );
    private static final Pattern COLON_FOOTER = Pattern.compile("^(?<key>BREAKING CHANGE|[\\w-]+): (?<value>.*)$");
    private static final Pattern HASH_FOOTER = Pattern.compile("^(?<key>[\\w-]+) #(?<value>.*)$");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n");

    private ConventionalCommits() {}

    public static ConventionalCommit classify(Commit commit) {
        Map<String, String> footers = new LinkedHashMap<>();
        commit.trailers().forEach((key, value) -> footers.put(footerKey(key), value));
        footers.putAll(bodyFooters(commit.body().orElse("")));

        String summary = commit.summary();
        Matcher matcher = SUMMARY.matcher(summary);
        if (!matcher.matches()) {
            return new ConventionalCommit(
                commit,
                summary.strip(),
                Optional.empty(),
                List.of(),
                Optional.ofNullable(footers.get(BREAKING_CHANGE)),
                footers
            );
        }

        String description = matcher.group("description").strip();
        Optional<String> type = Optional.ofNullable(matcher.group("type"))
            .map(value -> value.strip().toLowerCase(Locale.ROOT));
        List<String> scopes = parseScopes(matcher.group("scopes"));
        boolean marked = "!".equals(matcher.group("breaking"));

        Optional<String> breaking = Optional.ofNullable(footers.get(BREAKING_CHANGE));
        if (breaking.isEmpty() && marked) {
            breaking = Optional.of(description);
        }
        return new ConventionalCommit(commit, description, type, scopes, breaking, footers);
    }

    public static List<ConventionalCommit> classifyAll(List<Commit> commits) {
        List<ConventionalCommit> result = new ArrayList<>(commits.size());
        for (Commit commit : commits) {
            result.add(classify(commit));
        }
        return result;
    }

    /**
     * Footers from the last paragraph of a body, empty unless every non-empty line of that
     * paragraph is a {@code key: value} or {@code key #value} footer.
     */
    static Map<String, String> bodyFooters(String body) {
        if (body.isBlank()) {
            return Map.of();
        }
        String[] paragraphs = PARAGRAPH_BREAK.split(body.strip());
        String last = paragraphs[paragraphs.length - 1];
        Map<String, String> footers = new LinkedHashMap<>();
        for (String line : last.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            Matcher colon = COLON_FOOTER.matcher(line);
            if (colon.matches()) {
                footers.put(footerKey(colon.group("key")), colon.group("value").strip());
                continue;
            }
            Matcher hash = HASH_FOOTER.matcher(line);
            if (hash.matches()) {
                footers.put(hash.group("key").toLowerCase(Locale.ROOT), hash.group("value").strip());
                continue;
            }
            return Map.of();
        }
        return footers;
    }

    private static String footerKey(String key) {
        return "BREAKING CHANGE".equals(key) ? BREAKING_CHANGE : key;
    }

    private static List<String> parseScopes(String raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> scopes = new ArrayList<>();
        for (String scope : raw.split(",")) {
            String value = scope.strip().toLowerCase(Locale.ROOT);
            if (!value.isEmpty()) {
                scopes.add(value);
            }
        }
        return scopes;
    }
}
