package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.MemberAccessExpr;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.Token;
import java.util.ArrayList;
import java.util.List;

/** Builders for freshly synthesized syntax, laid out on one line. */
final class SyntaxFactory {
    private SyntaxFactory() {}

    /** {@code .name(args...)} with {@code ", "} between arguments. */
    static CallExpr implicitCall(String name, List<Argument> arguments) {
        return CallExpr.of(MemberAccessExpr.implicit(name), argumentList(arguments));
    }

    static ArgumentList argumentList(List<Argument> arguments) {
        var result = new ArrayList<Argument>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            var argument = arguments.get(i);
            boolean last = i == arguments.size() - 1;
            result.add(argument.withComma(last ? null : Token.comma().withTrailingTrivia(" ")));
        }
        return ArgumentList.of(result.toArray(Argument[]::new));
    }

    static Argument labeledString(String label, String value) {
        return Argument.labeled(label, StringLiteral.of(value));
    }

    static Argument labeled(String label, Expr value) {
        return Argument.labeled(label, value);
    }

    static Argument labeledEmptyArray(String label) {
        return Argument.labeled(label, ArrayLiteral.empty());
    }
}
