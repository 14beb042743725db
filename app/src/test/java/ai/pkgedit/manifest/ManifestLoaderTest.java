package ai.pkgedit.manifest;

import static org.junit.jupiter.api.Assertions.*;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.LibraryType;
import ai.pkgedit.model.PackageIdentity;
import ai.pkgedit.model.ProductType;
import java.util.List;
import org.junit.jupiter.api.Test;

class ManifestLoaderTest {

    private final ManifestLoader loader = new ManifestLoader();

    @Test
    void loadsFullManifest() throws Exception {
        var manifest = loader.load(
                """
                // swift-tools-version:5.3
                import PackageDescription

                let package = Package(
                    name: "Full",
                    products: [
                        .library(name: "Full", type: .dynamic, targets: ["Full"]),
                        .executable(name: "full-tool", targets: ["Tool"]),
                    ],
                    dependencies: [
                        .package(url: "https://github.com/apple/swift-argument-parser.git", from: "1.0.0"),
                        .package(name: "Exact", url: "https://example.com/Exact.git", .exact("1.2.3")),
                        .package(url: "https://example.com/range.git", "1.0.0"..<"2.0.0"),
                        .package(url: "https://example.com/closed.git", "1.0.0"..."1.5.0"),
                        .package(url: "https://example.com/minor.git", .upToNextMinor(from: "0.4.0")),
                        .package(url: "https://example.com/branch.git", .branch("develop")),
                        .package(url: "https://example.com/rev.git", .revision("abcdef")),
                        .package(url: "https://example.com/labeled.git", branch: "main"),
                        .package(path: "../Local"),
                    ],
                    targets: [
                        .target(name: "Full", dependencies: [
                            "Exact",
                            .product(name: "ArgumentParser", package: "swift-argument-parser"),
                        ]),
                        .target(name: "Tool", dependencies: [.target(name: "Full"), .byName(name: "Local")]),
                        .testTarget(name: "FullTests", dependencies: ["Full"]),
                        .binaryTarget(name: "Bin", url: "https://example.com/bin.zip", checksum: "ff00"),
                        .binaryTarget(name: "LocalBin", path: "Bin.xcframework"),
                    ],
                    swiftLanguageVersions: [.v5]
                )
                """);

        assertEquals("Full", manifest.name());
        assertEquals(ToolsVersion.parse("5.3"), manifest.toolsVersion());

        var requirements = manifest.dependencies().stream().map(PackageDependency::requirement).toList();
        assertEquals(
                List.of(
                        new DependencyRequirement.UpToNextMajor("1.0.0"),
                        new DependencyRequirement.Exact("1.2.3"),
                        new DependencyRequirement.Range("1.0.0", "2.0.0"),
                        new DependencyRequirement.ClosedRange("1.0.0", "1.5.0"),
                        new DependencyRequirement.UpToNextMinor("0.4.0"),
                        new DependencyRequirement.Branch("develop"),
                        new DependencyRequirement.Revision("abcdef"),
                        new DependencyRequirement.Branch("main"),
                        new DependencyRequirement.LocalPath()),
                requirements);
        assertEquals("Exact", manifest.dependencies().get(1).name());
        assertTrue(manifest.containsDependency(new PackageIdentity("swift-argument-parser")));
        assertTrue(manifest.containsDependency(new PackageIdentity("local")));

        var full = manifest.target("Full").orElseThrow();
        assertEquals(
                List.of(
                        new TargetDependency.ByName("Exact"),
                        new TargetDependency.Product("ArgumentParser", "swift-argument-parser")),
                full.dependencies());
        assertEquals(TargetType.TEST, manifest.target("FullTests").orElseThrow().type());
        var bin = manifest.target("Bin").orElseThrow();
        assertEquals(TargetType.BINARY, bin.type());
        assertEquals("ff00", bin.checksum());
        assertEquals("Bin.xcframework", manifest.target("LocalBin").orElseThrow().path());

        assertEquals(ProductType.library(LibraryType.DYNAMIC), manifest.product("Full").orElseThrow().type());
        assertEquals(List.of("Tool"), manifest.product("full-tool").orElseThrow().targets());
    }

    @Test
    void resolvesBindingsAndConcatenation() throws Exception {
        var manifest = loader.load(
                """
                // swift-tools-version:5.2
                import PackageDescription

                let common: [Target] = [.target(name: "Common", dependencies: [])]
                var extra = [Target.testTarget(name: "CommonTests", dependencies: ["Common"])]

                let package = Package(
                    name: "Bound",
                    targets: common + [
                        .target(name: "App", dependencies: ["Common"]),
                    ] + extra
                )
                """);

        assertEquals(
                List.of("Common", "App", "CommonTests"),
                manifest.targets().stream().map(TargetDescription::name).toList());
    }

    @Test
    void requiresToolsVersionHeader() {
        var e = assertThrows(
                ManifestLoadException.class, () -> loader.load("import PackageDescription\nlet p = Package(name: \"a\")\n"));
        assertTrue(e.getMessage().contains("swift-tools-version"), e.getMessage());
    }

    @Test
    void reportsSyntaxErrorsWithPosition() {
        var e = assertThrows(
                ManifestLoadException.class, () -> loader.load("// swift-tools-version:5.3\nlet p = Package(name: \n"));
        assertTrue(e.getMessage().startsWith("invalid manifest syntax: 3:"), e.getMessage());
    }

    @Test
    void rejectsSemanticProblems() {
        String header = "// swift-tools-version:5.3\n";
        var cases = List.of(
                "let p = Package(name: \"a\", targets: [.target(name: \"T\"), .target(name: \"T\")])",
                "let p = Package(name: \"a\", products: [.library(name: \"L\", targets: [\"Missing\"])])",
                "let p = Package(name: \"a\", targets: [.target(name: \"T\", dependencies: [.target(name: \"X\")])])",
                "let p = Package(name: \"a\", dependencies: [.package(path: \"../x\"), .package(path: \"../other/X\")])",
                "let p = Package(name: \"a\", targets: [.binaryTarget(name: \"B\", url: \"https://x/b.zip\")])",
                "let p = Package(name: \"a\", targets: [.binaryTarget(name: \"B\")])",
                "let p = Package(name: \"a\", targets: unknown)",
                "let p = Package(name: \"a\")\nlet q = Package(name: \"b\")");
        for (var body : cases) {
            assertThrows(ManifestLoadException.class, () -> loader.load(header + body + "\n"), body);
        }
    }

    @Test
    void rejectsSelfReferentialBindings() {
        var e = assertThrows(
                ManifestLoadException.class,
                () -> loader.load("// swift-tools-version:5.3\nlet t = t\nlet p = Package(name: \"a\", targets: t)\n"));
        assertTrue(e.getMessage().contains("itself"), e.getMessage());
    }

    @Test
    void oversizedToolsVersionIsALoadError() {
        var e = assertThrows(
                ManifestLoadException.class,
                () -> loader.load("// swift-tools-version:99999999999\nlet p = Package(name: \"a\")\n"));
        assertTrue(e.getMessage().contains("swift-tools-version"), e.getMessage());
    }

    @Test
    void malformedUnicodeEscapesAreLoadErrors() {
        for (String name : List.of("\\u", "\\u{zz}", "\\u{110000}")) {
            String text = "// swift-tools-version:5.3\nlet p = Package(name: \"" + name + "\")\n";
            var e = assertThrows(ManifestLoadException.class, () -> loader.load(text), name);
            assertTrue(e.getMessage().startsWith("invalid manifest syntax: 2:"), e.getMessage());
        }
    }
}
