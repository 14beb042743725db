package ai.pkgedit.git;

import ai.pkgedit.model.DependencyRequirement;

/** Picks a requirement for a remote dependency when the caller did not give one. */
public interface VersionResolver {
    DependencyRequirement resolve(String url) throws DependencyResolutionException;
}
