package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.CallExpr;
import java.util.ArrayList;

/**
 * Argument layout for a synthesized call expression that becomes an array element.
 *
 * <p>Layout is copied from the last existing call in the array, so a new entry looks like its siblings. When there is
 * no sibling to copy, the caller's fallback applies.
 */
public record CallLayout(boolean argumentsOnSeparateLines, boolean closingParenOnOwnLine) {

    public static final CallLayout INLINE = new CallLayout(false, false);

    /** Each argument on its own line, one step deeper than the call, and the closing paren back at the call's indent. */
    public static final CallLayout EXPANDED = new CallLayout(true, true);

    public static CallLayout of(CallExpr call) {
        var arguments = call.arguments().arguments();
        boolean separateLines = !arguments.isEmpty() && arguments.get(0).firstToken().startsOnNewLine();
        return new CallLayout(separateLines, separateLines && call.rightParen().startsOnNewLine());
    }

    public static CallLayout inferFrom(ArrayLiteral array, CallLayout fallback) {
        var elements = array.elements();
        if (!elements.isEmpty()
                && elements.get(elements.size() - 1).value() instanceof CallExpr sibling
                && !sibling.arguments().arguments().isEmpty()) {
            return of(sibling);
        }
        return fallback;
    }

    /**
     * Lays out a single-line synthesized call. Calls placed inline in their array always stay on one line.
     */
    public CallExpr apply(CallExpr call, Placement placement) {
        if (!argumentsOnSeparateLines || !placement.isMultiline()) {
            return call;
        }
        String argumentIndent = placement.elementIndent() + placement.unit();
        var arguments = call.arguments().arguments();
        var laidOut = new ArrayList<Argument>(arguments.size());
        for (var argument : arguments) {
            var moved = argument.withFirstToken(t -> t.withLeadingTrivia("\n" + argumentIndent));
            if (moved.comma() != null) {
                moved = moved.withComma(moved.comma().withTrailingTrivia(""));
            }
            laidOut.add(moved);
        }
        var result = call.withArguments(call.arguments().withArguments(laidOut));
        if (closingParenOnOwnLine) {
            result = result.withLastToken(t -> t.withLeadingTrivia("\n" + placement.elementIndent()));
        }
        return result;
    }
}
