package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax;
import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayElement;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.SyntaxWalker;
import org.jetbrains.annotations.Nullable;

/**
 * Finds the entry of a targets or products array whose {@code name:} argument is a plain string literal equal to the
 * requested name. Interpolated or multi-line names never match.
 */
public final class NamedEntityLocator {
    private NamedEntityLocator() {}

    /** The first matching entry call, or null if none matches. */
    @Nullable
    public static SyntaxRef<CallExpr> locate(SyntaxRef<ArrayLiteral> array, String name) {
        var nameArgument = SyntaxWalker.findFirst(
                array, node -> isNameArgument(node, name), NamedEntityLocator::mayContainEntry);
        if (nameArgument == null) {
            return null;
        }
        var call = nameArgument.ancestor(CallExpr.class);
        if (call == null) {
            throw new RewriteInvariantException("name argument outside of a call: " + nameArgument);
        }
        return call;
    }

    private static boolean isNameArgument(Syntax node, String name) {
        return node instanceof Argument arg
                && "name".equals(arg.labelText())
                && arg.value() instanceof StringLiteral literal
                && name.equals(literal.singleSegmentValue());
    }

    // Arguments are leaves for this search: nested calls inside argument values are not entries.
    private static boolean mayContainEntry(Syntax node) {
        return node instanceof ArrayLiteral
                || node instanceof ArrayElement
                || node instanceof CallExpr
                || node instanceof ArgumentList;
    }
}
