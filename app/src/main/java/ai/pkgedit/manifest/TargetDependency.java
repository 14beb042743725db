package ai.pkgedit.manifest;

import org.jetbrains.annotations.Nullable;

/** One entry of a target's {@code dependencies:} array. */
public sealed interface TargetDependency {

    String name();

    /** {@code "Name"} or {@code .byName(name: "Name")}. */
    record ByName(String name) implements TargetDependency {}

    /** {@code .target(name: "Name")}. */
    record Target(String name) implements TargetDependency {}

    /** {@code .product(name: "Name", package: "pkg")}. */
    record Product(String name, @Nullable String packageName) implements TargetDependency {}
}
