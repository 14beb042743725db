package ai.pkgedit.manifest;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.PackageIdentity;
import org.jetbrains.annotations.Nullable;

/** A dependency declared with {@code .package(...)}. {@code location} is the URL, or the path for local packages. */
public record PackageDependency(@Nullable String name, String location, DependencyRequirement requirement) {

    public PackageIdentity identity() {
        return PackageIdentity.fromLocation(location);
    }
}
