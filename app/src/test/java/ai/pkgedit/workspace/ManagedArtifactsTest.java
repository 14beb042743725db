package ai.pkgedit.workspace;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManagedArtifactsTest {

    @TempDir
    Path dir;

    private static ManagedArtifact remote(String pkg, String target) {
        return new ManagedArtifact(
                pkg,
                target,
                new ManagedArtifact.Source.Remote("https://example.com/" + target + ".zip", "abc123"),
                ".build/artifacts/" + pkg + "/" + target + ".xcframework");
    }

    @Test
    void keyedByPackageAndTarget() {
        var artifacts = new ManagedArtifacts();
        artifacts.add(remote("a", "One"));
        artifacts.add(remote("a", "Two"));
        artifacts.add(remote("b", "One"));
        artifacts.add(new ManagedArtifact("a", "One", new ManagedArtifact.Source.Local(), "Local/One.xcframework"));

        assertEquals(3, artifacts.size());
        assertEquals("Local/One.xcframework", artifacts.get("a", "One").orElseThrow().path());
        assertEquals(2, artifacts.forPackage("a").size());
        assertNotNull(artifacts.remove("b", "One"));
        assertNull(artifacts.remove("b", "One"));
        assertTrue(artifacts.get("b", "One").isEmpty());
    }

    @Test
    void savesAndLoadsJson() throws Exception {
        var artifacts = new ManagedArtifacts();
        artifacts.add(remote("a", "One"));
        artifacts.add(new ManagedArtifact("b", "Two", new ManagedArtifact.Source.Local(), "Two.xcframework"));
        var file = dir.resolve(".build").resolve(ManagedArtifacts.FILE_NAME);

        artifacts.save(file);
        var json = Files.readString(file, StandardCharsets.UTF_8);
        var loaded = ManagedArtifacts.load(file);

        assertTrue(json.contains("\"type\" : \"remote\""), json);
        assertTrue(json.contains("\"type\" : \"local\""), json);
        assertEquals(artifacts.all(), loaded.all());
    }

    @Test
    void missingFileIsEmpty() throws Exception {
        assertEquals(0, ManagedArtifacts.load(dir.resolve("nothing.json")).size());
    }

    @Test
    void malformedFileIsAnError() throws Exception {
        var file = dir.resolve(ManagedArtifacts.FILE_NAME);
        Files.writeString(file, "[{\"packageRef\": 1", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> ManagedArtifacts.load(file));
    }
}
