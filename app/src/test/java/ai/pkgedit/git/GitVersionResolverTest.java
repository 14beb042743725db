package ai.pkgedit.git;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.model.DependencyRequirement;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitVersionResolverTest {

    @TempDir
    Path repoDir;

    private final GitVersionResolver resolver = new GitVersionResolver(List.of("main", "master"), Duration.ofSeconds(30));

    @Test
    void picksHighestReleaseTag() throws Exception {
        try (var git = TestRepos.init(repoDir, "main")) {
            TestRepos.commitManifest(git, "Dep");
            TestRepos.tag(git, "v1.0.0");
            TestRepos.tag(git, "1.2.0");
            TestRepos.tag(git, "v2.0.0-beta.1");
            TestRepos.tag(git, "nightly");

            assertEquals(new DependencyRequirement.UpToNextMajor("1.2.0"), resolver.resolve(TestRepos.url(git)));
        }
    }

    @Test
    void skipsTagsOutsideVersionRange() throws Exception {
        try (var git = TestRepos.init(repoDir, "main")) {
            TestRepos.commitManifest(git, "Dep");
            TestRepos.tag(git, "v1.1.0");
            TestRepos.tag(git, "v99999999999.0.0");

            assertEquals(new DependencyRequirement.UpToNextMajor("1.1.0"), resolver.resolve(TestRepos.url(git)));
        }
    }

    @Test
    void fallsBackToHighestPrerelease() throws Exception {
        try (var git = TestRepos.init(repoDir, "main")) {
            TestRepos.commitManifest(git, "Dep");
            TestRepos.tag(git, "v2.0.0-alpha");
            TestRepos.tag(git, "v2.0.0-beta");

            assertEquals(new DependencyRequirement.UpToNextMajor("2.0.0-beta"), resolver.resolve(TestRepos.url(git)));
        }
    }

    @Test
    void withoutTagsUsesMainWhenPresent() throws Exception {
        try (var git = TestRepos.init(repoDir, "main")) {
            TestRepos.commitManifest(git, "Dep");
            git.branchCreate().setName("master").call();

            assertEquals(new DependencyRequirement.Branch("main"), resolver.resolve(TestRepos.url(git)));
        }
    }

    @Test
    void withoutTagsOrMainUsesMaster() throws Exception {
        try (var git = TestRepos.init(repoDir, "trunk")) {
            TestRepos.commitManifest(git, "Dep");

            assertEquals(new DependencyRequirement.Branch("master"), resolver.resolve(TestRepos.url(git)));
        }
    }

    @Test
    void unreachableRemoteFails() {
        var missing = repoDir.resolve("does-not-exist").toUri().toString();

        assertThrows(DependencyResolutionException.class, () -> resolver.resolve(missing));
    }
}
