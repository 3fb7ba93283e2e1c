package work.lcod.forge.packages;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;

/**
 * Reads {@link PackageConfig} from the manifest of a package directory.
 *
 * <p>The first existing file among {@code deno.json}, {@code package.json} and {@code forge.toml}
 * is used.</p>
 */
public final class ManifestLoader {
    static final List<String> MANIFEST_FILES = List.of("deno.json", "package.json", "forge.toml");

    private static final ObjectMapper JSON = new ObjectMapper();

    public PackageConfig load(Path directory) {
        for (String fileName : MANIFEST_FILES) {
            Path manifest = directory.resolve(fileName);
            if (Files.isRegularFile(manifest)) {
                return fileName.endsWith(".toml") ? readToml(manifest) : readJson(manifest);
            }
        }
        throw new PackageException("Cannot find package config in " + directory + " (expected one of " + MANIFEST_FILES + ")");
    }

    private PackageConfig readJson(Path manifest) {
        JsonNode root;
        try {
            root = JSON.readTree(Files.readString(manifest, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new PackageException("Cannot read package config: " + manifest, ex);
        }
        if (root == null || !root.isObject()) {
            throw new PackageException("Package config must be a JSON object: " + manifest);
        }
        JsonNode workspace = root.get("workspace");
        if (workspace == null && manifest.getFileName().toString().equals("package.json")) {
            workspace = root.get("workspaces");
        }
        return new PackageConfig(
            jsonString(root, "name", manifest),
            jsonString(root, "version", manifest),
            jsonStrings(workspace, manifest)
        );
    }

    private static Optional<String> jsonString(JsonNode root, String field, Path manifest) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isTextual()) {
            throw new PackageException("Field '" + field + "' must be a string in " + manifest);
        }
        return Optional.of(value.asText());
    }

    private static List<String> jsonStrings(JsonNode array, Path manifest) {
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new PackageException("Field 'workspace' must be an array of strings in " + manifest);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw new PackageException("Field 'workspace' must be an array of strings in " + manifest);
            }
            values.add(item.asText());
        }
        return values;
    }

    private PackageConfig readToml(Path manifest) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(manifest, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new PackageException("Cannot read package config: " + manifest, ex);
        }
        if (result.hasErrors()) {
            throw new PackageException("Invalid package config " + manifest + ": " + result.errors().get(0).toString());
        }
        return new PackageConfig(
            tomlString(result, "name", manifest),
            tomlString(result, "version", manifest),
            tomlStrings(result, manifest)
        );
    }

    private static Optional<String> tomlString(TomlParseResult result, String key, Path manifest) {
        if (!result.contains(key)) {
            return Optional.empty();
        }
        if (!result.isString(key)) {
            throw new PackageException("Field '" + key + "' must be a string in " + manifest);
        }
        return Optional.ofNullable(result.getString(key));
    }

    private static List<String> tomlStrings(TomlParseResult result, Path manifest) {
        if (!result.contains("workspace")) {
            return List.of();
        }
        if (!result.isArray("workspace")) {
            throw new PackageException("Field 'workspace' must be an array of strings in " + manifest);
        }
        TomlArray array = result.getArray("workspace");
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            Object item = array.get(i);
            if (!(item instanceof String text)) {
                throw new PackageException("Field 'workspace' must be an array of strings in " + manifest);
            }
            values.add(text);
        }
        return values;
    }
}
