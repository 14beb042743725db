package ai.pkgedit.git;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.Version;
import ai.pkgedit.util.FileUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.jetbrains.annotations.Nullable;

/**
 * Reads a dependency's manifest from a local directory, or from a throwaway clone of the remote at the requested ref.
 */
public class GitDependencyManifestFetcher implements DependencyManifestFetcher {
    private static final Logger logger = LogManager.getLogger(GitDependencyManifestFetcher.class);

    private final String manifestFileName;
    private final Duration timeout;

    public GitDependencyManifestFetcher(String manifestFileName, Duration timeout) {
        this.manifestFileName = Objects.requireNonNull(manifestFileName);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public String fetch(String location, DependencyRequirement requirement) throws DependencyResolutionException {
        if (requirement.isLocal()) {
            return readManifest(Path.of(location));
        }

        Path tempDir;
        try {
            tempDir = Files.createTempDirectory("pkgedit-dependency-");
        } catch (IOException e) {
            throw new DependencyResolutionException("failed to create a temporary directory: " + e.getMessage(), e);
        }
        try {
            cloneAt(location, requirement, tempDir);
            return readManifest(tempDir);
        } finally {
            if (!FileUtil.deleteRecursively(tempDir)) {
                logger.warn("Failed to clean up temporary clone {}", tempDir);
            }
        }
    }

    private void cloneAt(String url, DependencyRequirement requirement, Path directory)
            throws DependencyResolutionException {
        String ref = requirement.ref();
        boolean revision = requirement instanceof DependencyRequirement.Revision;
        String branchOrTag = revision || ref == null ? null : tagOrBranchName(url, ref);

        var cloneCmd = Git.cloneRepository()
                .setURI(url)
                .setDirectory(directory.toFile())
                .setTimeout((int) timeout.toSeconds());
        if (branchOrTag != null) {
            cloneCmd.setBranch(branchOrTag);
        }
        try (var git = cloneCmd.call()) {
            if (revision) {
                git.checkout().setName(ref).call();
            }
            logger.debug("Cloned {} at {} into {}", url, ref, directory);
        } catch (GitAPIException e) {
            logger.error("Failed to clone {} (ref: {}) into {}: {}", url, ref, directory, e.getMessage(), e);
            throw new DependencyResolutionException("failed to clone '" + url + "' at '" + ref + "'", e);
        }
    }

    // Version requirements name the version, but the tag may carry a "v" prefix.
    private String tagOrBranchName(String url, String ref) throws DependencyResolutionException {
        @Nullable Version wanted = Version.tryParse(ref);
        if (wanted == null) {
            return ref;
        }
        for (var remoteRef : GitVersionResolver.listRefs(url, timeout)) {
            String name = remoteRef.getName();
            if (name.startsWith(Constants.R_TAGS)) {
                String tag = name.substring(Constants.R_TAGS.length());
                var version = Version.fromTag(tag);
                if (version != null && version.compareTo(wanted) == 0) {
                    return tag;
                }
            }
        }
        return ref;
    }

    private String readManifest(Path packageDir) throws DependencyResolutionException {
        var manifest = packageDir.resolve(manifestFileName);
        try {
            return Files.readString(manifest, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DependencyResolutionException("failed to read " + manifest + ": " + e.getMessage(), e);
        }
    }
}
