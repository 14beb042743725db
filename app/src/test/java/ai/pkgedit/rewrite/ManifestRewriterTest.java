package ai.pkgedit.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.LibraryType;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.rewrite.ManifestEditException.Reason;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.parser.ManifestParser;
import org.junit.jupiter.api.Test;

class ManifestRewriterTest {

    private static final String MANIFEST =
            """
            // swift-tools-version:5.3
            import PackageDescription

            let package = Package(
                name: "MyPkg",
                dependencies: [
                    .package(url: "https://github.com/example/a.git", from: "1.0.0"),
                ],
                targets: [
                    .target(
                        name: "MyPkg",
                        dependencies: []),
                ]
            )
            """;

    private final ManifestRewriter rewriter = new ManifestRewriter();

    private static SourceFile parse(String text) throws Exception {
        return ManifestParser.parse(text);
    }

    @Test
    void addPackageDependency_appendsMatchingSiblingLayout() throws Exception {
        var edited = rewriter.addPackageDependency(
                parse(MANIFEST),
                "b",
                "https://github.com/example/b.git",
                new DependencyRequirement.Exact("2.0.0"));

        assertEquals(
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    dependencies: [
                        .package(url: "https://github.com/example/a.git", from: "1.0.0"),
                        .package(name: "b", url: "https://github.com/example/b.git", .exact("2.0.0")),
                    ],
                    targets: [
                        .target(
                            name: "MyPkg",
                            dependencies: []),
                    ]
                )
                """,
                edited.toSource());
    }

    @Test
    void addPackageDependency_writesEachRequirementShape() throws Exception {
        var cases = new Object[][] {
            {new DependencyRequirement.UpToNextMajor("1.2.0"), ".upToNextMajor(from: \"1.2.0\")"},
            {new DependencyRequirement.UpToNextMinor("1.2.0"), ".upToNextMinor(from: \"1.2.0\")"},
            {new DependencyRequirement.Branch("main"), ".branch(\"main\")"},
            {new DependencyRequirement.Revision("abc123"), ".revision(\"abc123\")"},
            {new DependencyRequirement.Range("1.0.0", "2.0.0"), "\"1.0.0\"..<\"2.0.0\""},
            {new DependencyRequirement.ClosedRange("1.0.0", "1.9.0"), "\"1.0.0\"...\"1.9.0\""},
        };
        for (var c : cases) {
            var edited = rewriter.addPackageDependency(
                    parse(MANIFEST), null, "https://example.com/c.git", (DependencyRequirement) c[0]);
            String expected = ".package(url: \"https://example.com/c.git\", " + c[1] + "),";
            assertTrue(edited.toSource().contains(expected), () -> "missing " + expected + " in\n" + edited.toSource());
        }
    }

    @Test
    void addPackageDependency_localPathWritesPathOnly() throws Exception {
        var edited = rewriter.addPackageDependency(
                parse(MANIFEST), "Local", "../Local", new DependencyRequirement.LocalPath());

        assertTrue(edited.toSource().contains("        .package(name: \"Local\", path: \"../Local\"),\n    ],"));
    }

    @Test
    void addTarget_createsMissingTargetsArgumentAtTheEnd() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg"
                )
                """;

        var edited = rewriter.addTarget(parse(text), "target", "Foo");

        assertEquals(
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    targets: [
                        .target(
                            name: "Foo",
                            dependencies: []
                        ),
                    ]
                )
                """,
                edited.toSource());
    }

    @Test
    void addTarget_insertsTargetsBeforeLanguageSettings() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    swiftLanguageVersions: [.v5]
                )
                """;

        var edited = rewriter.addTarget(parse(text), "testTarget", "FooTests");

        assertEquals(
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    targets: [
                        .testTarget(
                            name: "FooTests",
                            dependencies: []
                        ),
                    ],
                    swiftLanguageVersions: [.v5]
                )
                """,
                edited.toSource());
    }

    @Test
    void addTarget_copiesExpandedLayoutOfPreviousTarget() throws Exception {
        var edited = rewriter.addTarget(parse(MANIFEST), "target", "Second");

        assertTrue(edited.toSource()
                .contains(
                        """
                                .target(
                                    name: "MyPkg",
                                    dependencies: []),
                                .target(
                                    name: "Second",
                                    dependencies: []),
                            ]
                        """));
    }

    @Test
    void addTargetDependency_fillsEmptyArrayInline() throws Exception {
        var once = rewriter.addByNameTargetDependency(parse(MANIFEST), "MyPkg", "Dep");
        var twice = rewriter.addByNameTargetDependency(once, "MyPkg", "Other");

        assertTrue(once.toSource().contains("dependencies: [\"Dep\"]),"), once.toSource());
        assertTrue(twice.toSource().contains("dependencies: [\"Dep\", \"Other\"]),"), twice.toSource());
    }

    @Test
    void addTargetDependency_followsMultilineArray() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    targets: [
                        .target(
                            name: "MyPkg",
                            dependencies: [
                                "A",
                            ]),
                    ]
                )
                """;

        var edited = rewriter.addByNameTargetDependency(parse(text), "MyPkg", "B");

        assertTrue(
                edited.toSource()
                        .contains(
                                """
                                            dependencies: [
                                                "A",
                                                "B",
                                            ]),
                                """),
                edited.toSource());
    }

    @Test
    void addProductTargetDependency_writesProductCall() throws Exception {
        var edited = rewriter.addProductTargetDependency(parse(MANIFEST), "MyPkg", "ArgumentParser", "swift-argument-parser");

        assertTrue(edited.toSource()
                .contains("dependencies: [.product(name: \"ArgumentParser\", package: \"swift-argument-parser\")]),"));
    }

    @Test
    void addTargetDependency_unknownTarget() throws Exception {
        var e = assertThrows(
                ManifestEditException.class,
                () -> rewriter.addByNameTargetDependency(parse(MANIFEST), "Nope", "Dep"));
        assertEquals(Reason.ENTITY_NOT_FOUND, e.getReason());
        assertEquals("couldn't find target 'Nope'", e.getMessage());
    }

    @Test
    void addTargetDependency_targetWithoutDependenciesArgument() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    targets: [
                        .target(name: "MyPkg"),
                    ]
                )
                """;

        var e = assertThrows(
                ManifestEditException.class, () -> rewriter.addByNameTargetDependency(parse(text), "MyPkg", "Dep"));
        assertEquals(Reason.STRUCTURE_NOT_FOUND, e.getReason());
        assertEquals("couldn't find 'dependencies' argument of target 'MyPkg'", e.getMessage());
    }

    @Test
    void addProduct_insertsProductsBeforeDependencies() throws Exception {
        var edited = rewriter.addProduct(parse(MANIFEST), "Lib", ProductType.library(LibraryType.STATIC));

        assertTrue(
                edited.toSource()
                        .contains(
                                """
                                    name: "MyPkg",
                                    products: [
                                        .library(
                                            name: "Lib",
                                            type: .static,
                                            targets: []
                                        ),
                                    ],
                                    dependencies: [
                                """),
                edited.toSource());
    }

    @Test
    void addProductTarget_appendsTargetName() throws Exception {
        var withProduct = rewriter.addProduct(parse(MANIFEST), "tool", ProductType.executable());
        var edited = rewriter.addProductTarget(withProduct, "tool", "MyPkg");

        assertTrue(edited.toSource().contains("            targets: [\"MyPkg\"]\n        ),"), edited.toSource());
    }

    @Test
    void addProductTarget_missingProductsArgument() throws Exception {
        var e = assertThrows(
                ManifestEditException.class, () -> rewriter.addProductTarget(parse(MANIFEST), "tool", "MyPkg"));
        assertEquals(Reason.STRUCTURE_NOT_FOUND, e.getReason());
        assertEquals("couldn't find 'products' argument of Package initializer", e.getMessage());
    }

    @Test
    void insertsIntoArrayOperandOfConcatenation() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let common: [Target] = [.target(name: "Common", dependencies: [])]

                let package = Package(
                    name: "MyPkg",
                    targets: common + [
                        .target(name: "MyPkg", dependencies: []),
                    ]
                )
                """;

        var edited = rewriter.addTarget(parse(text), "target", "Extra");

        assertTrue(
                edited.toSource()
                        .contains(
                                """
                                    targets: common + [
                                        .target(name: "MyPkg", dependencies: []),
                                        .target(name: "Extra", dependencies: []),
                                    ]
                                """),
                edited.toSource());
        assertTrue(edited.toSource().contains("let common: [Target] = [.target(name: \"Common\", dependencies: [])]\n"));
    }

    @Test
    void concatenationOfTwoArraysIsAmbiguous() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    targets: [.target(name: "A")] + [.target(name: "B")]
                )
                """;

        var e = assertThrows(ManifestEditException.class, () -> rewriter.addTarget(parse(text), "target", "C"));
        assertEquals(Reason.STRUCTURE_AMBIGUOUS, e.getReason());
    }

    @Test
    void nonArrayArgumentIsAmbiguous() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "MyPkg",
                    targets: allTargets
                )
                """;

        var e = assertThrows(ManifestEditException.class, () -> rewriter.addTarget(parse(text), "target", "C"));
        assertEquals(Reason.STRUCTURE_AMBIGUOUS, e.getReason());
        assertEquals(
                "'targets' argument is not an array literal or concatenation of array literals", e.getMessage());
    }

    @Test
    void packageInitializerProblems() throws Exception {
        var missing = assertThrows(
                ManifestEditException.class,
                () -> rewriter.addTarget(parse("// swift-tools-version:5.3\nlet x = 1\n"), "target", "C"));
        assertEquals(Reason.STRUCTURE_NOT_FOUND, missing.getReason());
        assertEquals("couldn't find Package initializer", missing.getMessage());

        var multiple = assertThrows(
                ManifestEditException.class,
                () -> rewriter.addTarget(
                        parse("// swift-tools-version:5.3\nlet a = Package(name: \"a\")\nlet b = Package(name: \"b\")\n"),
                        "target",
                        "C"));
        assertEquals(Reason.STRUCTURE_AMBIGUOUS, multiple.getReason());
        assertEquals("found multiple Package initializers", multiple.getMessage());
    }

    @Test
    void inputTreeIsNotModified() throws Exception {
        var original = parse(MANIFEST);
        rewriter.addTarget(original, "target", "Other");

        assertEquals(MANIFEST, original.toSource());
    }

    @Test
    void onlyTheEditedArrayChanges() throws Exception {
        String text =
                """
                // swift-tools-version:5.3
                import PackageDescription

                // keep   this   comment
                let package = Package(
                    name:   "MyPkg" ,  // odd spacing
                    targets: [ ]
                )
                """;

        var edited = rewriter.addTarget(parse(text), "target", "T");

        assertTrue(edited.toSource()
                .startsWith(
                        """
                        // swift-tools-version:5.3
                        import PackageDescription

                        // keep   this   comment
                        let package = Package(
                            name:   "MyPkg" ,  // odd spacing
                            targets: [
                        """));
    }
}
