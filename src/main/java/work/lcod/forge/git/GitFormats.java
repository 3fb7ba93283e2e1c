package work.lcod.forge.git;

import static work.lcod.forge.format.FieldDescriptor.group;
import static work.lcod.forge.format.FieldDescriptor.optionalText;
import static work.lcod.forge.format.FieldDescriptor.skip;
import static work.lcod.forge.format.FieldDescriptor.text;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.forge.format.FormatDescriptor;

/**
 * Pretty-format layouts for commits and tags, and the mapping from decoded records to
 * {@link Commit} and {@link Tag}.
 */
final class GitFormats {
    static final FormatDescriptor COMMIT = new FormatDescriptor(
        "<%H>",
        group()
            .field("hash", text("%H"))
            .field("short", text("%h"))
            .field("parent", group()
                .field("hash", text("%P", GitFormats::firstParent))
                .field("short", text("%p", GitFormats::firstParent))
                .optional()
                .build())
            .field("author", group()
                .field("name", text("%an"))
                .field("email", text("%ae"))
                .build())
            .field("committer", group()
                .field("name", text("%cn"))
                .field("email", text("%ce"))
                .build())
            .field("summary", text("%s"))
            // the commit hash separates the raw body from a copy of its trailer block
            .field("body", optionalText("%b%H%(trailers)", GitFormats::commitBody))
            // keeps non-trailer lines of the block, such as "BREAKING CHANGE: ..." next to a sign-off
            .field("trailers", optionalText(
                "%(trailers:unfold=true,key_value_separator=: )",
                (value, siblings) -> parseTrailers(value)
            ))
            .build()
    );

    static final FormatDescriptor TAG = new FormatDescriptor(
        "<%(objectname)>",
        group()
            .field("name", text("%(refname:short)"))
            .field("commit", group()
                .field("hash", text("%(if)%(object)%(then)%(object)%(else)%(objectname)%(end)"))
                .field("short", skip())
                .field("author", skip())
                .field("committer", skip())
                .field("summary", skip())
                .field("body", skip())
                .field("trailers", skip())
                .build())
            .field("tagger", group()
                .field("name", optionalText("%(if)%(object)%(then)%(taggername)%(else)%00%(end)"))
                .field("email", optionalText("%(if)%(object)%(then)%(taggeremail:trim)%(else)%00%(end)"))
                .optional()
                .build())
            .field("subject", optionalText(
                "%(if)%(object)%(then)%(subject)%(else)%00%(end)",
                (value, siblings) -> value.isEmpty() ? null : value
            ))
            .field("trailers", optionalText(
                "%(if)%(trailers)%(then)%(trailers)%(else)%00%(end)",
                (value, siblings) -> parseTrailers(value)
            ))
            .field("body", optionalText("%(if)%(object)%(then)%(body)%(else)%00%(end)", GitFormats::tagBody))
            .build()
    );

    private GitFormats() {}

    static Commit toCommit(Map<String, Object> record) {
        Map<String, Object> parent = map(record.get("parent"));
        return new Commit(
            string(record, "hash"),
            string(record, "short"),
            parent == null
                ? Optional.empty()
                : Optional.of(new Commit.Parent(string(parent, "hash"), string(parent, "short"))),
            user(map(record.get("author"))),
            user(map(record.get("committer"))),
            string(record, "summary"),
            Optional.ofNullable((String) record.get("body")),
            trailers(record.get("trailers"))
        );
    }

    static String tagName(Map<String, Object> record) {
        return string(record, "name");
    }

    static String tagCommitHash(Map<String, Object> record) {
        Map<String, Object> commit = map(record.get("commit"));
        if (commit == null) {
            throw new GitException("Commit hash not filled for tag " + record.get("name"));
        }
        return string(commit, "hash");
    }

    static Tag toTag(Map<String, Object> record, Commit commit) {
        Map<String, Object> tagger = map(record.get("tagger"));
        return new Tag(
            tagName(record),
            commit,
            tagger == null ? Optional.empty() : Optional.of(user(tagger)),
            Optional.ofNullable((String) record.get("subject")),
            Optional.ofNullable((String) record.get("body")),
            trailers(record.get("trailers"))
        );
    }

    static Map<String, String> parseTrailers(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Map<String, String> trailers = new LinkedHashMap<>();
        for (String line : value.split("\n")) {
            int separator = line.indexOf(": ");
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            if (!key.isEmpty()) {
                trailers.put(key, line.substring(separator + 2).trim());
            }
        }
        return trailers.isEmpty() ? null : trailers;
    }

    private static String commitBody(String value, Map<String, String> siblings) {
        String hash = siblings.get("hash");
        int anchor = hash == null || hash.isEmpty() ? -1 : value.lastIndexOf(hash);
        String body = anchor < 0 ? value : value.substring(0, anchor);
        String trailers = anchor < 0 ? "" : value.substring(anchor + hash.length());
        return stripTrailerBlock(body, trailers);
    }

    private static String tagBody(String value, Map<String, String> siblings) {
        String trailers = siblings.getOrDefault("trailers", "");
        return stripTrailerBlock(value, trailers.equals("\u0000") ? "" : trailers);
    }

    private static String stripTrailerBlock(String body, String trailers) {
        String result = body;
        if (!trailers.isBlank()) {
            String block = trailers.stripTrailing();
            String trimmed = result.stripTrailing();
            if (trimmed.endsWith(block)) {
                result = trimmed.substring(0, trimmed.length() - block.length());
            }
        }
        result = result.stripTrailing();
        return result.isEmpty() ? null : result;
    }

    private static String firstParent(String value, Map<String, String> siblings) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    private static User user(Map<String, Object> values) {
        if (values == null) {
            throw new GitException("Missing user in git output");
        }
        return new User(string(values, "name"), string(values, "email"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> trailers(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    private static String string(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (!(value instanceof String text)) {
            throw new GitException("Missing field '" + key + "' in git output");
        }
        return text;
    }
}
