package ai.pkgedit.rewrite;

import ai.pkgedit.model.Locations;
import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Builds target entries and target-dependency entries. */
public final class TargetSynthesizer {
    private TargetSynthesizer() {}

    /** {@code .<factory>(name: "N", dependencies: [])}. */
    public static CallExpr target(String factoryMethodName, String name) {
        return SyntaxFactory.implicitCall(
                factoryMethodName,
                List.of(SyntaxFactory.labeledString("name", name), SyntaxFactory.labeledEmptyArray("dependencies")));
    }

    /**
     * {@code .binaryTarget(name: "N", url: "U", checksum: "C")} for remote artifacts and
     * {@code .binaryTarget(name: "N", path: "P")} for local ones. A checksum must be given exactly for remote URLs.
     */
    public static CallExpr binaryTarget(String name, String urlOrPath, @Nullable String checksum)
            throws ManifestEditException {
        boolean hasChecksum = checksum != null && !checksum.isBlank();
        var arguments = new ArrayList<Argument>();
        arguments.add(SyntaxFactory.labeledString("name", name));
        if (!Locations.isRemote(urlOrPath)) {
            if (hasChecksum) {
                throw new ManifestEditException(
                        ManifestEditException.Reason.PRECONDITION_FAILED,
                        "'" + urlOrPath + "' is a local path, but a checksum was specified for the binary target");
            }
            arguments.add(SyntaxFactory.labeledString("path", urlOrPath));
        } else {
            if (!hasChecksum) {
                throw new ManifestEditException(
                        ManifestEditException.Reason.PRECONDITION_FAILED,
                        "'" + urlOrPath + "' is a remote URL, but no checksum was specified for the binary target");
            }
            arguments.add(SyntaxFactory.labeledString("url", urlOrPath));
            arguments.add(SyntaxFactory.labeledString("checksum", checksum));
        }
        return SyntaxFactory.implicitCall("binaryTarget", arguments);
    }

    /** {@code "Name"}, a by-name dependency. */
    public static Expr byNameDependency(String dependencyName) {
        return StringLiteral.of(dependencyName);
    }

    /** {@code .product(name: "P", package: "pkg")}. */
    public static CallExpr productDependency(String productName, String packageName) {
        return SyntaxFactory.implicitCall(
                "product",
                List.of(SyntaxFactory.labeledString("name", productName), SyntaxFactory.labeledString("package", packageName)));
    }
}
