package ai.pkgedit.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.rewrite.ArrayInserter.EmptyLayout;
import ai.pkgedit.rewrite.ArrayInserter.TrailingSeparator;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.Syntax.VariableDecl;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.parser.ManifestParser;
import org.junit.jupiter.api.Test;

class ArrayInserterTest {

    private final ArrayInserter inserter = new ArrayInserter("  ");

    // The array bound by the first statement, e.g. "let xs = [...]".
    private static SyntaxRef<ArrayLiteral> array(String text) throws Exception {
        var root = SyntaxRef.root(ManifestParser.parse(text));
        return root.child(0).as(VariableDecl.class).child(0).child(0).as(ArrayLiteral.class);
    }

    private String append(String text, EmptyLayout layout, TrailingSeparator separator) throws Exception {
        var ref = array(text);
        var placement = inserter.placement(ref, layout);
        return inserter.append(ref, StringLiteral.of("new"), separator, placement).root().toSource();
    }

    @Test
    void inlineArrayWithoutTrailingComma() throws Exception {
        assertEquals(
                "let xs = [\"a\", \"new\"]\n",
                append("let xs = [\"a\"]\n", EmptyLayout.INLINE, TrailingSeparator.MATCH_PREVIOUS));
    }

    @Test
    void multilineArrayKeepsTrailingComma() throws Exception {
        assertEquals(
                "let xs = [\n    \"a\",\n    \"new\",\n]\n",
                append("let xs = [\n    \"a\",\n]\n", EmptyLayout.INLINE, TrailingSeparator.MATCH_PREVIOUS));
    }

    @Test
    void explicitSeparatorPolicy() throws Exception {
        assertEquals(
                "let xs = [\n    \"a\",\n    \"new\"\n]\n",
                append("let xs = [\n    \"a\"\n]\n", EmptyLayout.INLINE, TrailingSeparator.ABSENT));
        assertEquals(
                "let xs = [\"a\", \"new\",]\n",
                append("let xs = [\"a\"]\n", EmptyLayout.INLINE, TrailingSeparator.PRESENT));
    }

    @Test
    void emptyArrayOpensWithDefaultIndentUnit() throws Exception {
        assertEquals(
                "let xs = [\n  \"new\",\n]\n", append("let xs = []\n", EmptyLayout.MULTILINE, TrailingSeparator.MATCH_PREVIOUS));
        assertEquals("let xs = [\"new\"]\n", append("let xs = [ ]\n", EmptyLayout.INLINE, TrailingSeparator.MATCH_PREVIOUS));
    }

    @Test
    void trailingLineCommentStaysAtEndOfLine() throws Exception {
        assertEquals(
                "let xs = [\n    \"a\", // first\n    \"new\"\n]\n",
                append("let xs = [\n    \"a\" // first\n]\n", EmptyLayout.INLINE, TrailingSeparator.MATCH_PREVIOUS));
    }

    @Test
    void placementReportsSiblingIndentation() throws Exception {
        var placement = inserter.placement(array("let xs = [\n\t\"a\",\n]\n"), EmptyLayout.MULTILINE);

        assertEquals("\t", placement.elementIndent());
        assertEquals("\t", placement.unit());
        assertEquals("", placement.closingIndent());
    }
}
