package ai.pkgedit.session;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.rewrite.ManifestEditException;
import ai.pkgedit.rewrite.ManifestRewriter;
import ai.pkgedit.syntax.Syntax.SourceFile;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** One structural change an {@link EditSession} can apply. */
public sealed interface ManifestEdit {

    SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException;

    /** Short human-readable form, used in log output. */
    String describe();

    record AddPackageDependency(@Nullable String name, String location, DependencyRequirement requirement)
            implements ManifestEdit {
        public AddPackageDependency {
            Objects.requireNonNull(location);
            Objects.requireNonNull(requirement);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addPackageDependency(file, name, location, requirement);
        }

        @Override
        public String describe() {
            return "add package dependency " + location;
        }
    }

    record AddTarget(String factoryMethodName, String name) implements ManifestEdit {
        public AddTarget {
            Objects.requireNonNull(factoryMethodName);
            Objects.requireNonNull(name);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addTarget(file, factoryMethodName, name);
        }

        @Override
        public String describe() {
            return "add " + factoryMethodName + " " + name;
        }
    }

    record AddBinaryTarget(String name, String urlOrPath, @Nullable String checksum) implements ManifestEdit {
        public AddBinaryTarget {
            Objects.requireNonNull(name);
            Objects.requireNonNull(urlOrPath);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addBinaryTarget(file, name, urlOrPath, checksum);
        }

        @Override
        public String describe() {
            return "add binary target " + name;
        }
    }

    record AddTargetDependency(String targetName, String dependencyName) implements ManifestEdit {
        public AddTargetDependency {
            Objects.requireNonNull(targetName);
            Objects.requireNonNull(dependencyName);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addByNameTargetDependency(file, targetName, dependencyName);
        }

        @Override
        public String describe() {
            return "add dependency " + dependencyName + " to target " + targetName;
        }
    }

    record AddProductTargetDependency(String targetName, String productName, String packageName)
            implements ManifestEdit {
        public AddProductTargetDependency {
            Objects.requireNonNull(targetName);
            Objects.requireNonNull(productName);
            Objects.requireNonNull(packageName);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addProductTargetDependency(file, targetName, productName, packageName);
        }

        @Override
        public String describe() {
            return "add product " + packageName + "/" + productName + " to target " + targetName;
        }
    }

    record AddProduct(String name, ProductType type) implements ManifestEdit {
        public AddProduct {
            Objects.requireNonNull(name);
            Objects.requireNonNull(type);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addProduct(file, name, type);
        }

        @Override
        public String describe() {
            return "add " + type.factoryMethodName() + " product " + name;
        }
    }

    record AddProductTarget(String productName, String targetName) implements ManifestEdit {
        public AddProductTarget {
            Objects.requireNonNull(productName);
            Objects.requireNonNull(targetName);
        }

        @Override
        public SourceFile applyTo(ManifestRewriter rewriter, SourceFile file) throws ManifestEditException {
            return rewriter.addProductTarget(file, productName, targetName);
        }

        @Override
        public String describe() {
            return "add target " + targetName + " to product " + productName;
        }
    }
}
