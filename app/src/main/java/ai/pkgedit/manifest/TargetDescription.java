package ai.pkgedit.manifest;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public record TargetDescription(
        String name,
        TargetType type,
        List<TargetDependency> dependencies,
        @Nullable String path,
        @Nullable String url,
        @Nullable String checksum) {

    public TargetDescription {
        dependencies = ImmutableList.copyOf(dependencies);
    }

    public boolean dependsOn(String dependencyName) {
        return dependencies.stream().anyMatch(d -> d.name().equals(dependencyName));
    }
}
