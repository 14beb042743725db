package ai.pkgedit.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.parser.ManifestParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class EmptyArrayArgumentWriterTest {

    private static SyntaxRef<ArgumentList> packageArguments(String text) throws Exception {
        var found = (LocateResult.Found<CallExpr>) PackageInitLocator.locate(SyntaxRef.root(ManifestParser.parse(text)));
        return found.ref().child(1).as(ArgumentList.class);
    }

    @Test
    void appendsAfterLastArgumentOnItsOwnLine() throws Exception {
        var args = packageArguments("let p = Package(\n    name: \"a\"\n)\n");

        var array = EmptyArrayArgumentWriter.insert(args, "targets", List.of("swiftLanguageVersions"));

        assertEquals("let p = Package(\n    name: \"a\",\n    targets: []\n)\n", array.root().toSource());
        assertEquals("[]", array.node().toSource());
    }

    @Test
    void insertsBeforeFirstFollowingLabel() throws Exception {
        var args = packageArguments("let p = Package(\n    name: \"a\",\n    targets: [],\n    cLanguageStandard: .c11\n)\n");

        var array = EmptyArrayArgumentWriter.insert(args, "dependencies", ManifestRewriter.DEPENDENCIES_FOLLOWING_LABELS);

        assertEquals(
                "let p = Package(\n    name: \"a\",\n    dependencies: [],\n    targets: [],\n    cLanguageStandard: .c11\n)\n",
                array.root().toSource());
    }

    @Test
    void inlineArgumentListStaysInline() throws Exception {
        var args = packageArguments("let p = Package(name: \"a\", targets: [])\n");

        var array = EmptyArrayArgumentWriter.insert(args, "products", ManifestRewriter.PRODUCTS_FOLLOWING_LABELS);

        assertEquals("let p = Package(name: \"a\", products: [], targets: [])\n", array.root().toSource());
    }

    @Test
    void inlineAppendAddsSpacedComma() throws Exception {
        var args = packageArguments("let p = Package(name: \"a\")\n");

        var array = EmptyArrayArgumentWriter.insert(args, "targets", List.of());

        assertEquals("let p = Package(name: \"a\", targets: [])\n", array.root().toSource());
    }

    @Test
    void trailingCommentMovesBehindNewComma() throws Exception {
        var args = packageArguments("let p = Package(\n    name: \"a\" // the name\n)\n");

        var array = EmptyArrayArgumentWriter.insert(args, "targets", List.of());

        assertEquals("let p = Package(\n    name: \"a\", // the name\n    targets: []\n)\n", array.root().toSource());
    }

    @Test
    void commentsAboveFirstArgumentAreNotCopied() throws Exception {
        var args = packageArguments(
                "let p = Package(\n    // The name of the package\n    /* short */ name: \"a\"\n)\n");

        var array = EmptyArrayArgumentWriter.insert(args, "targets", List.of());

        assertEquals(
                "let p = Package(\n    // The name of the package\n    /* short */ name: \"a\",\n    targets: []\n)\n",
                array.root().toSource());
    }

    @Test
    void layoutOnlyKeepsLineBreakAndIndent() {
        assertEquals("\n    ", EmptyArrayArgumentWriter.layoutOnly("\n    // c\n    "));
        assertEquals("\r\n\t", EmptyArrayArgumentWriter.layoutOnly("\r\n\t/* c */ "));
        assertEquals("", EmptyArrayArgumentWriter.layoutOnly(" /* c */ "));
    }
}
