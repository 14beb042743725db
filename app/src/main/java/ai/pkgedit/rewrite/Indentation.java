package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.Token;
import org.jetbrains.annotations.Nullable;

/** Indentation analysis over token trivia. */
final class Indentation {
    private Indentation() {}

    /** Count the number of leading whitespace characters on a single line. */
    static int countLeadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * The indentation of {@code token}'s line if the token is the first thing on its line, otherwise null.
     */
    @Nullable
    static String of(Token token) {
        String trivia = token.leadingTrivia();
        int newline = trivia.lastIndexOf('\n');
        if (newline < 0) {
            return null;
        }
        String lastLine = trivia.substring(newline + 1);
        return lastLine.substring(0, countLeadingWhitespace(lastLine));
    }

    /**
     * Indentation of the line a node sits on: the indentation of the nearest node, starting with the node itself and
     * walking up, whose first token begins a line. Empty at top level.
     */
    static String lineIndent(SyntaxRef<?> ref) {
        for (SyntaxRef<?> current = ref; current != null; current = current.parent()) {
            Token first = current.node().firstToken();
            if (first != null) {
                String indent = of(first);
                if (indent != null) {
                    return indent;
                }
            }
        }
        return "";
    }

    /** The step from {@code outer} to {@code inner}, or {@code fallback} if inner is not strictly deeper. */
    static String step(String outer, String inner, String fallback) {
        if (inner.length() > outer.length() && inner.startsWith(outer)) {
            return inner.substring(outer.length());
        }
        return fallback;
    }
}
