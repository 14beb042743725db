package ai.pkgedit.syntax;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.syntax.Syntax.ArrayElement;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.Syntax.VariableDecl;
import ai.pkgedit.syntax.parser.ManifestParser;
import java.util.ArrayList;
import org.junit.jupiter.api.Test;

public class SyntaxRefTest {

    private static final String TEXT =
            """
            let a = ["x", "y"]
            let b = Package(name: "b", targets: [])
            """;

    @Test
    void replace_rebuildsOnlyAncestors() throws Exception {
        var original = ManifestParser.parse(TEXT);
        var root = SyntaxRef.root(original);

        var arrayRef = SyntaxWalker.findAll(root, n -> n instanceof ArrayLiteral).get(0).as(ArrayLiteral.class);
        var array = arrayRef.node();
        var elements = new ArrayList<>(array.elements());
        elements.add(new ArrayElement(StringLiteral.of("z"), null));
        elements.set(1, elements.get(1).withComma(Token.comma().withTrailingTrivia(" ")));
        var newRef = arrayRef.replace(array.withElements(elements));

        var edited = newRef.root();
        assertEquals("let a = [\"x\", \"y\", \"z\"]\nlet b = Package(name: \"b\", targets: [])\n", edited.toSource());
        // the input tree is untouched
        assertEquals(TEXT, original.toSource());
        // the untouched statement is shared by reference
        assertSame(original.statements().get(1), edited.statements().get(1));
        assertNotSame(original.statements().get(0), edited.statements().get(0));
        assertSame(newRef.node(), ((VariableDecl) edited.statements().get(0)).initializer().value());
    }

    @Test
    void replace_returnsHandleUsableForFurtherEdits() throws Exception {
        var root = SyntaxRef.root(ManifestParser.parse(TEXT));
        var ref = SyntaxWalker.findAll(root, n -> n instanceof StringLiteral).get(0).as(StringLiteral.class);

        var first = ref.replace(StringLiteral.of("one"));
        var second = first.replace(StringLiteral.of("two"));

        assertTrue(second.root().toSource().startsWith("let a = [\"two\", \"y\"]"));
        assertTrue(first.root().toSource().startsWith("let a = [\"one\", \"y\"]"));
    }

    @Test
    void ancestor_findsNearestEnclosingType() throws Exception {
        var root = SyntaxRef.root(ManifestParser.parse(TEXT));
        var emptyArray = SyntaxWalker.findAll(root, n -> n instanceof ArrayLiteral).get(1);
        var call = emptyArray.ancestor(CallExpr.class);
        assertNotNull(call);
        assertEquals("Package", call.node().calleeName());
        assertNull(root.ancestor(CallExpr.class));
        assertEquals(0, root.depth());
    }

    @Test
    void findAll_doesNotDescendIntoMatches() throws Exception {
        var root = SyntaxRef.root(ManifestParser.parse("let a = [[\"x\"], [\"y\"]]\n"));
        var arrays = SyntaxWalker.findAll(root, n -> n instanceof ArrayLiteral);
        assertEquals(1, arrays.size());
        assertEquals(2, ((ArrayLiteral) arrays.get(0).node()).elements().size());
    }

    @Test
    void findAll_respectsDescendPredicate() throws Exception {
        var root = SyntaxRef.root(ManifestParser.parse(TEXT));
        var strings = SyntaxWalker.findAll(root, n -> n instanceof StringLiteral, n -> !(n instanceof CallExpr));
        assertEquals(2, strings.size());
        assertNull(SyntaxWalker.findFirst(root, n -> n instanceof CallExpr, n -> false));
    }

    @Test
    void as_rejectsWrongType() throws Exception {
        var root = SyntaxRef.root(ManifestParser.parse(TEXT));
        assertThrows(ClassCastException.class, () -> root.as(ArrayLiteral.class));
        assertThrows(IllegalArgumentException.class, () -> root.replace(StringLiteral.of("x")));
    }
}
