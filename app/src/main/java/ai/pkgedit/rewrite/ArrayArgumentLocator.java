package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.SequenceExpr;
import ai.pkgedit.syntax.SyntaxRef;

/**
 * Finds the array literal passed as a labeled argument, either directly ({@code targets: [...]}) or as the single
 * array operand of a concatenation ({@code targets: common + [...]}).
 */
public final class ArrayArgumentLocator {
    private ArrayArgumentLocator() {}

    public static LocateResult<ArrayLiteral> locate(SyntaxRef<ArgumentList> arguments, String label) {
        int index = arguments.node().indexOf(label);
        if (index < 0) {
            return new LocateResult.Missing<>();
        }
        var valueRef = arguments.child(index).as(Argument.class).child(0).as(Expr.class);
        var value = valueRef.node();
        if (value instanceof ArrayLiteral) {
            return new LocateResult.Found<>(valueRef.as(ArrayLiteral.class));
        }
        if (value instanceof SequenceExpr seq) {
            int arrayIndex = -1;
            int arrayCount = 0;
            // operands sit at even positions, operators in between
            for (int i = 0; i < seq.elements().size(); i += 2) {
                if (seq.elements().get(i) instanceof ArrayLiteral) {
                    arrayIndex = i;
                    arrayCount++;
                }
            }
            if (arrayCount == 1) {
                return new LocateResult.Found<>(valueRef.child(arrayIndex).as(ArrayLiteral.class));
            }
            if (arrayCount > 1) {
                return new LocateResult.Incompatible<>(
                        "'" + label + "' argument concatenates " + arrayCount + " array literals");
            }
        }
        return new LocateResult.Incompatible<>(
                "'" + label + "' argument is not an array literal or concatenation of array literals");
    }
}
