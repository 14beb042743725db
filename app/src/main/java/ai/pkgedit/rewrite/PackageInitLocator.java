package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.ExpressionStatement;
import ai.pkgedit.syntax.Syntax.IdentifierExpr;
import ai.pkgedit.syntax.Syntax.InitializerClause;
import ai.pkgedit.syntax.Syntax.ParenExpr;
import ai.pkgedit.syntax.Syntax.SequenceExpr;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.Syntax.VariableDecl;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.SyntaxWalker;

/** Finds the {@code Package(...)} initializer call. */
public final class PackageInitLocator {
    public static final String PACKAGE_TYPE_NAME = "Package";

    private PackageInitLocator() {}

    public static LocateResult<CallExpr> locate(SyntaxRef<SourceFile> root) {
        var matches = SyntaxWalker.findAll(root, PackageInitLocator::isPackageInit, PackageInitLocator::mayContainInit);
        return switch (matches.size()) {
            case 0 -> new LocateResult.Missing<>();
            case 1 -> new LocateResult.Found<>(matches.get(0).as(CallExpr.class));
            default -> new LocateResult.FoundMultiple<>(matches.size());
        };
    }

    public static boolean isPackageInit(Syntax node) {
        return node instanceof CallExpr call
                && call.callee() instanceof IdentifierExpr id
                && id.name().equals(PACKAGE_TYPE_NAME);
    }

    // Statements and the expression wrappers around an initializer; any other expression is a settled non-match.
    private static boolean mayContainInit(Syntax node) {
        return node instanceof SourceFile
                || node instanceof VariableDecl
                || node instanceof InitializerClause
                || node instanceof ExpressionStatement
                || node instanceof ParenExpr
                || node instanceof SequenceExpr;
    }
}
