package ai.pkgedit.git;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.Version;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Ref;

/**
 * Resolves a requirement from the remote's refs: up to the next major version of the highest release tag, else of the
 * highest prerelease tag, else the first default branch that exists.
 */
public class GitVersionResolver implements VersionResolver {
    private static final Logger logger = LogManager.getLogger(GitVersionResolver.class);

    private final List<String> defaultBranches;
    private final Duration timeout;

    public GitVersionResolver(List<String> defaultBranches, Duration timeout) {
        if (defaultBranches.isEmpty()) {
            throw new IllegalArgumentException("at least one default branch is required");
        }
        this.defaultBranches = List.copyOf(defaultBranches);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public DependencyRequirement resolve(String url) throws DependencyResolutionException {
        var refs = listRefs(url, timeout);

        var versions = new ArrayList<Version>();
        Set<String> branches = new HashSet<>();
        for (var ref : refs) {
            String name = ref.getName();
            if (name.startsWith(Constants.R_TAGS)) {
                var version = Version.fromTag(name.substring(Constants.R_TAGS.length()));
                if (version != null) {
                    versions.add(version);
                }
            } else if (name.startsWith(Constants.R_HEADS)) {
                branches.add(name.substring(Constants.R_HEADS.length()));
            }
        }

        var best = versions.stream()
                .filter(v -> !v.isPrerelease())
                .max(Comparator.naturalOrder())
                .or(() -> versions.stream().max(Comparator.naturalOrder()));
        if (best.isPresent()) {
            logger.info("Resolved {} to version {}", url, best.get());
            return new DependencyRequirement.UpToNextMajor(best.get().toString());
        }

        String branch = defaultBranches.stream()
                .filter(branches::contains)
                .findFirst()
                .orElse(defaultBranches.get(defaultBranches.size() - 1));
        logger.info("No version tags at {}; using branch '{}'", url, branch);
        return new DependencyRequirement.Branch(branch);
    }

    static List<Ref> listRefs(String url, Duration timeout) throws DependencyResolutionException {
        try {
            var lsRemote = Git.lsRemoteRepository()
                    .setRemote(url)
                    .setHeads(true)
                    .setTags(true)
                    .setTimeout((int) timeout.toSeconds());
            return List.copyOf(lsRemote.call());
        } catch (GitAPIException e) {
            throw new DependencyResolutionException("failed to list refs of '" + url + "': " + e.getMessage(), e);
        }
    }
}
