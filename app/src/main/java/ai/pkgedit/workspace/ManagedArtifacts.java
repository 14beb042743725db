package ai.pkgedit.workspace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Managed artifacts keyed by package and target name, persisted as {@code artifacts.json}. Not thread-safe. */
public class ManagedArtifacts {
    private static final Logger logger = LogManager.getLogger(ManagedArtifacts.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    public static final String FILE_NAME = "artifacts.json";

    private record Key(String packageRef, String targetName) {}

    private final Map<Key, ManagedArtifact> artifacts = new LinkedHashMap<>();

    /** Adds {@code artifact}, replacing any artifact for the same package and target. */
    public void add(ManagedArtifact artifact) {
        artifacts.put(new Key(artifact.packageRef(), artifact.targetName()), artifact);
    }

    @Nullable
    public ManagedArtifact remove(String packageRef, String targetName) {
        return artifacts.remove(new Key(packageRef, targetName));
    }

    public Optional<ManagedArtifact> get(String packageRef, String targetName) {
        return Optional.ofNullable(artifacts.get(new Key(packageRef, targetName)));
    }

    public List<ManagedArtifact> forPackage(String packageRef) {
        return artifacts.values().stream()
                .filter(a -> a.packageRef().equals(packageRef))
                .toList();
    }

    public List<ManagedArtifact> all() {
        return List.copyOf(artifacts.values());
    }

    public int size() {
        return artifacts.size();
    }

    /** Loads from {@code file}; a missing file is an empty collection. */
    public static ManagedArtifacts load(Path file) throws IOException {
        var result = new ManagedArtifacts();
        if (!Files.exists(file)) {
            logger.debug("No artifact file at {}", file);
            return result;
        }
        List<ManagedArtifact> loaded;
        try {
            loaded = objectMapper.readValue(
                    Files.readString(file, StandardCharsets.UTF_8), new TypeReference<List<ManagedArtifact>>() {});
        } catch (JsonProcessingException e) {
            throw new IOException("malformed artifact file " + file + ": " + e.getOriginalMessage(), e);
        }
        if (loaded != null) {
            loaded.forEach(result::add);
        }
        return result;
    }

    public void save(Path file) throws IOException {
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writeValueAsString(new ArrayList<>(artifacts.values()));
        Files.writeString(file, json, StandardCharsets.UTF_8);
        logger.debug("Saved {} artifacts to {}", artifacts.size(), file);
    }
}
