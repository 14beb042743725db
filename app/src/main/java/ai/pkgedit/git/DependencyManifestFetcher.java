package ai.pkgedit.git;

import ai.pkgedit.model.DependencyRequirement;

/** Reads the manifest text of a package that is about to become a dependency. */
public interface DependencyManifestFetcher {

    /**
     * @param location an absolute local directory when {@code requirement} is local, a URL otherwise
     */
    String fetch(String location, DependencyRequirement requirement) throws DependencyResolutionException;
}
