package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax.ArrayElement;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.Token;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Appends an element to an array literal, keeping the layout of the existing elements.
 *
 * <p>The previously last element gets a comma if it had none; a line comment that trailed it moves behind the new
 * comma. Everything outside the array is shared with the input tree.
 */
public final class ArrayInserter {

    /** Whether the appended element carries its own trailing comma. */
    public enum TrailingSeparator {
        PRESENT,
        ABSENT,
        /** Copy the previously last element; in an empty array, present when multi-line and absent when inline. */
        MATCH_PREVIOUS
    }

    /** How an empty array is opened up for its first element. */
    public enum EmptyLayout {
        /** One element per line, closing bracket on its own line. */
        MULTILINE,
        /** {@code [element]}. */
        INLINE
    }

    private final String defaultIndentUnit;

    public ArrayInserter(String defaultIndentUnit) {
        this.defaultIndentUnit = Objects.requireNonNull(defaultIndentUnit);
    }

    /** Works out where an element appended to {@code arrayRef} would go. */
    public Placement placement(SyntaxRef<ArrayLiteral> arrayRef, EmptyLayout emptyLayout) {
        var array = arrayRef.node();
        String arrayIndent = Indentation.lineIndent(arrayRef);
        if (array.elements().isEmpty()) {
            if (emptyLayout == EmptyLayout.INLINE) {
                return Placement.inline(defaultIndentUnit);
            }
            return new Placement(arrayIndent + defaultIndentUnit, defaultIndentUnit, arrayIndent);
        }

        var last = array.elements().get(array.elements().size() - 1);
        String elementIndent = Indentation.of(last.firstToken());
        if (elementIndent == null) {
            return Placement.inline(defaultIndentUnit);
        }
        String unit = Indentation.step(arrayIndent, elementIndent, defaultIndentUnit);
        return new Placement(elementIndent, unit, arrayIndent);
    }

    /**
     * Appends {@code element} at the end of the array.
     *
     * @return a handle on the new array inside the rebuilt tree
     */
    public SyntaxRef<ArrayLiteral> append(
            SyntaxRef<ArrayLiteral> arrayRef, Expr element, TrailingSeparator separator, Placement placement) {
        var array = arrayRef.node();
        var elements = new ArrayList<>(array.elements());
        boolean wasEmpty = elements.isEmpty();
        boolean previousHadComma = false;
        String previousSeparatorTrivia = "";

        if (!wasEmpty) {
            int lastIndex = elements.size() - 1;
            var last = elements.get(lastIndex);
            previousHadComma = last.hasTrailingComma();
            if (!previousHadComma) {
                String moved = last.value().lastToken().trailingTrivia();
                var value = last.value().withLastToken(t -> t.withTrailingTrivia(""));
                last = new ArrayElement(value, Token.comma().withTrailingTrivia(moved));
                elements.set(lastIndex, last);
            }
            previousSeparatorTrivia = Objects.requireNonNull(last.comma()).trailingTrivia();
        }

        Expr positioned;
        if (placement.isMultiline()) {
            positioned = element.withFirstToken(t -> t.withLeadingTrivia("\n" + placement.elementIndent()));
        } else {
            String leading = !wasEmpty && previousSeparatorTrivia.isEmpty() ? " " : "";
            positioned = element.withFirstToken(t -> t.withLeadingTrivia(leading));
        }

        boolean withComma =
                switch (separator) {
                    case PRESENT -> true;
                    case ABSENT -> false;
                    case MATCH_PREVIOUS -> wasEmpty ? placement.isMultiline() : previousHadComma;
                };
        elements.add(new ArrayElement(positioned, withComma ? Token.comma() : null));

        var updated = array.withElements(elements);
        if (wasEmpty) {
            updated = openUp(updated, placement);
        }
        return arrayRef.replace(updated);
    }

    // Drops blank padding inside "[ ]" and, for multi-line placement, moves the closing bracket to its own line.
    private static ArrayLiteral openUp(ArrayLiteral array, Placement placement) {
        var leftBracket = array.leftBracket();
        if (leftBracket.trailingTrivia().isBlank()) {
            array = array.withFirstToken(t -> t.withTrailingTrivia(""));
        }
        var rightBracket = array.rightBracket();
        if (placement.isMultiline()) {
            if (!rightBracket.startsOnNewLine()) {
                array = array.withRightBracket(rightBracket.withLeadingTrivia("\n" + placement.closingIndent()));
            }
        } else if (rightBracket.leadingTrivia().isBlank()) {
            array = array.withRightBracket(rightBracket.withLeadingTrivia(""));
        }
        return array;
    }
}
