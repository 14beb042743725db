package ai.pkgedit.manifest;

import ai.pkgedit.model.PackageIdentity;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/** The typed result of loading a manifest: what the package declares, in declaration order. */
public record Manifest(
        String name,
        ToolsVersion toolsVersion,
        List<PackageDependency> dependencies,
        List<TargetDescription> targets,
        List<ProductDescription> products) {

    public Manifest {
        dependencies = ImmutableList.copyOf(dependencies);
        targets = ImmutableList.copyOf(targets);
        products = ImmutableList.copyOf(products);
    }

    public Optional<TargetDescription> target(String targetName) {
        return targets.stream().filter(t -> t.name().equals(targetName)).findFirst();
    }

    public Optional<ProductDescription> product(String productName) {
        return products.stream().filter(p -> p.name().equals(productName)).findFirst();
    }

    public boolean containsDependency(PackageIdentity identity) {
        return dependencies.stream().anyMatch(d -> d.identity().equals(identity));
    }
}
