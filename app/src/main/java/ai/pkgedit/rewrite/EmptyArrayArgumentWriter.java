package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.Token;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Inserts {@code label: []} into an argument list.
 *
 * <p>The new argument goes in front of the first existing argument whose label is one of {@code followingLabels}, or at
 * the end of the list. It copies the line break and indentation (never the comments) from the leading trivia of the
 * list's first argument, so in a one-argument-per-line list it lands on its own line at the same indentation.
 */
public final class EmptyArrayArgumentWriter {
    private static final Logger logger = LogManager.getLogger(EmptyArrayArgumentWriter.class);

    private EmptyArrayArgumentWriter() {}

    /**
     * @return a handle on the new, empty array inside the rebuilt tree
     * @throws RewriteInvariantException if the inserted argument cannot be located again
     */
    public static SyntaxRef<ArrayLiteral> insert(
            SyntaxRef<ArgumentList> argumentsRef, String label, List<String> followingLabels) {
        var list = argumentsRef.node();
        var arguments = new ArrayList<>(list.arguments());

        int insertionIndex = arguments.size();
        for (int i = 0; i < arguments.size(); i++) {
            String existing = arguments.get(i).labelText();
            if (existing != null && followingLabels.contains(existing)) {
                insertionIndex = i;
                break;
            }
        }
        boolean atEnd = insertionIndex == arguments.size();

        var first = list.firstToken();
        String leading = layoutOnly(first == null ? "" : first.leadingTrivia());
        boolean multiline = leading.indexOf('\n') >= 0;

        var newArgument = SyntaxFactory.labeledEmptyArray(label).withFirstToken(t -> t.withLeadingTrivia(leading));
        if (!atEnd) {
            newArgument = newArgument.withComma(Token.comma().withTrailingTrivia(multiline ? "" : " "));
        } else if (!arguments.isEmpty()) {
            int lastIndex = arguments.size() - 1;
            var last = arguments.get(lastIndex);
            if (!last.hasTrailingComma()) {
                String moved = last.value().lastToken().trailingTrivia();
                var value = last.value().withLastToken(t -> t.withTrailingTrivia(""));
                String commaTrivia = multiline || !moved.isEmpty() ? moved : " ";
                arguments.set(lastIndex, last.withValue(value).withComma(Token.comma().withTrailingTrivia(commaTrivia)));
            }
        }
        arguments.add(insertionIndex, newArgument);
        logger.debug("Inserting empty '{}' argument at position {} of {}", label, insertionIndex, arguments.size());

        var newArgumentsRef = argumentsRef.replace(list.withArguments(arguments));
        var relocated = ArrayArgumentLocator.locate(newArgumentsRef, label);
        if (relocated instanceof LocateResult.Found<ArrayLiteral> found) {
            return found.ref();
        }
        throw new RewriteInvariantException("could not find just-inserted '" + label + "' array: " + relocated);
    }

    /** A newline plus the indentation of the last line when {@code trivia} spans lines; otherwise nothing. */
    static String layoutOnly(String trivia) {
        int newline = trivia.lastIndexOf('\n');
        if (newline < 0) {
            return "";
        }
        String lineBreak = newline > 0 && trivia.charAt(newline - 1) == '\r' ? "\r\n" : "\n";
        String lastLine = trivia.substring(newline + 1);
        return lineBreak + lastLine.substring(0, Indentation.countLeadingWhitespace(lastLine));
    }
}
