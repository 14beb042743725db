package ai.pkgedit.git;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.model.DependencyRequirement;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitDependencyManifestFetcherTest {

    @TempDir
    Path repoDir;

    private Git git;
    private RevCommit first;
    private final GitDependencyManifestFetcher fetcher =
            new GitDependencyManifestFetcher("Package.swift", Duration.ofSeconds(30));

    @BeforeEach
    void setUp() throws Exception {
        git = TestRepos.init(repoDir, "main");
        first = TestRepos.commitManifest(git, "DepOne");
        TestRepos.tag(git, "v1.0.0");
        TestRepos.commitManifest(git, "DepTwo");
    }

    @AfterEach
    void tearDown() {
        git.close();
    }

    @Test
    void clonesVersionTagWithPrefix() throws Exception {
        var text = fetcher.fetch(TestRepos.url(git), new DependencyRequirement.UpToNextMajor("1.0.0"));

        assertTrue(text.contains("name: \"DepOne\""), text);
    }

    @Test
    void clonesBranchHead() throws Exception {
        var text = fetcher.fetch(TestRepos.url(git), new DependencyRequirement.Branch("main"));

        assertTrue(text.contains("name: \"DepTwo\""), text);
    }

    @Test
    void checksOutRevision() throws Exception {
        var text = fetcher.fetch(TestRepos.url(git), new DependencyRequirement.Revision(first.getName()));

        assertTrue(text.contains("name: \"DepOne\""), text);
    }

    @Test
    void readsLocalPackageDirectly() throws Exception {
        var text = fetcher.fetch(repoDir.toString(), new DependencyRequirement.LocalPath());

        assertEquals(Files.readString(repoDir.resolve("Package.swift"), StandardCharsets.UTF_8), text);
    }

    @Test
    void missingManifestFails() {
        var e = assertThrows(
                DependencyResolutionException.class,
                () -> fetcher.fetch(repoDir.resolve("nowhere").toString(), new DependencyRequirement.LocalPath()));
        assertTrue(e.getMessage().contains("Package.swift"));
    }
}
