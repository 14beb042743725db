package ai.pkgedit.rewrite;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.rewrite.ArrayInserter.EmptyLayout;
import ai.pkgedit.rewrite.ArrayInserter.TrailingSeparator;
import ai.pkgedit.rewrite.ManifestEditException.Reason;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.SyntaxRef;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Structural edits on a parsed manifest. Every operation takes a tree and returns a new tree; the input is never
 * modified and nothing is remembered between calls.
 *
 * <p>Edits touch only the array they insert into (plus, when a required array argument is absent, the argument list
 * that receives it). All other text is reproduced byte for byte.
 */
public class ManifestRewriter {
    private static final Logger logger = LogManager.getLogger(ManifestRewriter.class);

    /** Labels that a new {@code dependencies:} argument of Package must precede. */
    static final List<String> DEPENDENCIES_FOLLOWING_LABELS =
            List.of("targets", "swiftLanguageVersions", "cLanguageStandard", "cxxLanguageStandard");

    static final List<String> TARGETS_FOLLOWING_LABELS =
            List.of("swiftLanguageVersions", "cLanguageStandard", "cxxLanguageStandard");

    static final List<String> PRODUCTS_FOLLOWING_LABELS =
            List.of("dependencies", "targets", "swiftLanguageVersions", "cLanguageStandard", "cxxLanguageStandard");

    private final ArrayInserter inserter;

    public ManifestRewriter(String defaultIndentUnit) {
        this.inserter = new ArrayInserter(defaultIndentUnit);
    }

    public ManifestRewriter() {
        this("    ");
    }

    public SourceFile addPackageDependency(
            SourceFile file, @Nullable String name, String url, DependencyRequirement requirement)
            throws ManifestEditException {
        var packageArgs = findPackageInitArguments(file);
        var dependencies = findOrCreateArray(packageArgs, "dependencies", DEPENDENCIES_FOLLOWING_LABELS);
        var entry = PackageDependencySynthesizer.synthesize(name, url, requirement);
        return appendCall(dependencies, entry, CallLayout.INLINE).root();
    }

    public SourceFile addTarget(SourceFile file, String factoryMethodName, String targetName)
            throws ManifestEditException {
        var packageArgs = findPackageInitArguments(file);
        var targets = findOrCreateArray(packageArgs, "targets", TARGETS_FOLLOWING_LABELS);
        var entry = TargetSynthesizer.target(factoryMethodName, targetName);
        return appendCall(targets, entry, CallLayout.EXPANDED).root();
    }

    public SourceFile addBinaryTarget(SourceFile file, String targetName, String urlOrPath, @Nullable String checksum)
            throws ManifestEditException {
        var packageArgs = findPackageInitArguments(file);
        var targets = findOrCreateArray(packageArgs, "targets", TARGETS_FOLLOWING_LABELS);
        var entry = TargetSynthesizer.binaryTarget(targetName, urlOrPath, checksum);
        return appendCall(targets, entry, CallLayout.EXPANDED).root();
    }

    public SourceFile addByNameTargetDependency(SourceFile file, String targetName, String dependencyName)
            throws ManifestEditException {
        var dependencies = findEntityArray(file, "targets", "target", targetName, "dependencies");
        var placement = inserter.placement(dependencies, EmptyLayout.INLINE);
        var entry = TargetSynthesizer.byNameDependency(dependencyName);
        return inserter.append(dependencies, entry, TrailingSeparator.MATCH_PREVIOUS, placement).root();
    }

    public SourceFile addProductTargetDependency(
            SourceFile file, String targetName, String productName, String packageName)
            throws ManifestEditException {
        var dependencies = findEntityArray(file, "targets", "target", targetName, "dependencies");
        var entry = TargetSynthesizer.productDependency(productName, packageName);
        var placement = inserter.placement(dependencies, EmptyLayout.INLINE);
        var laidOut = CallLayout.inferFrom(dependencies.node(), CallLayout.INLINE).apply(entry, placement);
        return inserter.append(dependencies, laidOut, TrailingSeparator.MATCH_PREVIOUS, placement).root();
    }

    public SourceFile addProduct(SourceFile file, String productName, ProductType type) throws ManifestEditException {
        var packageArgs = findPackageInitArguments(file);
        var products = findOrCreateArray(packageArgs, "products", PRODUCTS_FOLLOWING_LABELS);
        var entry = ProductSynthesizer.product(productName, type);
        return appendCall(products, entry, CallLayout.EXPANDED).root();
    }

    public SourceFile addProductTarget(SourceFile file, String productName, String targetName)
            throws ManifestEditException {
        var targets = findEntityArray(file, "products", "product", productName, "targets");
        var placement = inserter.placement(targets, EmptyLayout.INLINE);
        var entry = TargetSynthesizer.byNameDependency(targetName);
        return inserter.append(targets, entry, TrailingSeparator.MATCH_PREVIOUS, placement).root();
    }

    // -- locating

    private static SyntaxRef<ArgumentList> findPackageInitArguments(SourceFile file) throws ManifestEditException {
        var result = PackageInitLocator.locate(SyntaxRef.root(file));
        if (result instanceof LocateResult.Found<CallExpr> found) {
            return found.ref().child(1).as(ArgumentList.class);
        }
        if (result instanceof LocateResult.FoundMultiple<CallExpr>) {
            throw new ManifestEditException(Reason.STRUCTURE_AMBIGUOUS, "found multiple Package initializers");
        }
        throw new ManifestEditException(Reason.STRUCTURE_NOT_FOUND, "couldn't find Package initializer");
    }

    private static SyntaxRef<ArrayLiteral> findOrCreateArray(
            SyntaxRef<ArgumentList> packageArgs, String label, List<String> followingLabels)
            throws ManifestEditException {
        var result = ArrayArgumentLocator.locate(packageArgs, label);
        if (result instanceof LocateResult.Found<ArrayLiteral> found) {
            return found.ref();
        }
        if (result instanceof LocateResult.Incompatible<ArrayLiteral> incompatible) {
            throw new ManifestEditException(Reason.STRUCTURE_AMBIGUOUS, incompatible.reason());
        }
        logger.debug("Package initializer has no '{}' argument; inserting one", label);
        return EmptyArrayArgumentWriter.insert(packageArgs, label, followingLabels);
    }

    private static SyntaxRef<ArrayLiteral> requireArray(
            SyntaxRef<ArgumentList> arguments, String label, String owner) throws ManifestEditException {
        var result = ArrayArgumentLocator.locate(arguments, label);
        if (result instanceof LocateResult.Found<ArrayLiteral> found) {
            return found.ref();
        }
        if (result instanceof LocateResult.Incompatible<ArrayLiteral> incompatible) {
            throw new ManifestEditException(Reason.STRUCTURE_AMBIGUOUS, incompatible.reason());
        }
        throw new ManifestEditException(
                Reason.STRUCTURE_NOT_FOUND, "couldn't find '" + label + "' argument of " + owner);
    }

    /** The {@code arrayLabel:} array inside the entity named {@code entityName} of the Package's {@code sectionLabel:}. */
    private static SyntaxRef<ArrayLiteral> findEntityArray(
            SourceFile file, String sectionLabel, String entityKind, String entityName, String arrayLabel)
            throws ManifestEditException {
        var packageArgs = findPackageInitArguments(file);
        var section = requireArray(packageArgs, sectionLabel, "Package initializer");
        var entity = NamedEntityLocator.locate(section, entityName);
        if (entity == null) {
            throw new ManifestEditException(
                    Reason.ENTITY_NOT_FOUND, "couldn't find " + entityKind + " '" + entityName + "'");
        }
        return requireArray(
                entity.child(1).as(ArgumentList.class), arrayLabel, entityKind + " '" + entityName + "'");
    }

    // -- inserting

    private SyntaxRef<ArrayLiteral> appendCall(SyntaxRef<ArrayLiteral> array, CallExpr entry, CallLayout fallback) {
        var placement = inserter.placement(array, EmptyLayout.MULTILINE);
        Expr laidOut = CallLayout.inferFrom(array.node(), fallback).apply(entry, placement);
        return inserter.append(array, laidOut, TrailingSeparator.MATCH_PREVIOUS, placement);
    }
}
