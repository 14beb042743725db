package ai.pkgedit.rewrite;

import ai.pkgedit.model.LibraryType;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.MemberAccessExpr;
import java.util.ArrayList;

/**
 * Builds {@code .library(name: "N", type: .static, targets: [])} or {@code .executable(name: "N", targets: [])}.
 * Automatic library linkage is left implicit.
 */
public final class ProductSynthesizer {
    private ProductSynthesizer() {}

    public static CallExpr product(String name, ProductType type) {
        var arguments = new ArrayList<Argument>();
        arguments.add(SyntaxFactory.labeledString("name", name));
        if (type.isLibrary() && type.libraryType() != LibraryType.AUTOMATIC) {
            arguments.add(SyntaxFactory.labeled(
                    "type", MemberAccessExpr.implicit(type.libraryType().manifestName())));
        }
        arguments.add(SyntaxFactory.labeledEmptyArray("targets"));
        return SyntaxFactory.implicitCall(type.factoryMethodName(), arguments);
    }
}
