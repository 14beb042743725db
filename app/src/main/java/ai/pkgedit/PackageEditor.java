package ai.pkgedit;

import ai.pkgedit.git.DependencyResolutionException;
import ai.pkgedit.manifest.Manifest;
import ai.pkgedit.manifest.ManifestLoadException;
import ai.pkgedit.manifest.TargetDependency;
import ai.pkgedit.manifest.TargetDescription;
import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.Locations;
import ai.pkgedit.model.NewTarget;
import ai.pkgedit.model.PackageIdentity;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.rewrite.ManifestEditException;
import ai.pkgedit.rewrite.ManifestEditException.Reason;
import ai.pkgedit.session.EditSession;
import ai.pkgedit.session.ManifestEdit;
import ai.pkgedit.syntax.parser.ManifestParseException;
import ai.pkgedit.util.FileUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * High-level editing operations on one package's manifest.
 *
 * <p>Every operation loads the manifest from disk, checks its preconditions, applies one or more verified edits in an
 * {@link EditSession} and writes the result back once. When anything fails the file on disk is not touched.
 */
public class PackageEditor {
    private static final Logger logger = LogManager.getLogger(PackageEditor.class);

    private final Path packageDir;
    private final Path manifestPath;
    private final PackageEditorContext context;

    public PackageEditor(Path packageDir, PackageEditorContext context) {
        this.packageDir = packageDir.toAbsolutePath().normalize();
        this.context = Objects.requireNonNull(context);
        this.manifestPath = this.packageDir.resolve(context.config().manifestFileName());
    }

    public Path manifestPath() {
        return manifestPath;
    }

    /** Loads the manifest as it currently is on disk. */
    public Manifest loadManifest() throws IOException, ManifestLoadException {
        return context.loader().load(readManifest());
    }

    /**
     * Adds a package dependency. Without a requirement, a remote dependency is resolved to its latest version (or
     * default branch); a location without a URL scheme is always a local package.
     */
    public Manifest addPackageDependency(String location, @Nullable DependencyRequirement requirement)
            throws IOException, ManifestLoadException, ManifestEditException, DependencyResolutionException {
        var loaded = openChecked();

        if (loaded.manifest().containsDependency(PackageIdentity.fromLocation(location))) {
            throw new ManifestEditException(
                    Reason.PRECONDITION_FAILED, "'" + location + "' is already a package dependency");
        }

        DependencyRequirement effective = requirement;
        String fetchLocation = location;
        if (!Locations.isRemote(location)) {
            if (requirement != null && !requirement.isLocal()) {
                throw new ManifestEditException(
                        Reason.PRECONDITION_FAILED,
                        "'" + location + "' is a local path, but a non-local requirement was specified");
            }
            effective = new DependencyRequirement.LocalPath();
            fetchLocation = packageDir.resolve(location).normalize().toString();
        } else if (requirement != null && requirement.isLocal()) {
            throw new ManifestEditException(
                    Reason.PRECONDITION_FAILED, "'" + location + "' is a URL, but a local requirement was specified");
        } else if (effective == null) {
            effective = context.versionResolver().resolve(location);
        }

        String dependencyName = dependencyPackageName(fetchLocation, effective);
        loaded.session().apply(new ManifestEdit.AddPackageDependency(dependencyName, location, effective));
        return commit(loaded.session(), "added package dependency " + location);
    }

    /** Adds a target, its by-name dependencies and, for libraries that ask for one, a matching test target. */
    public Manifest addTarget(NewTarget target) throws IOException, ManifestLoadException, ManifestEditException {
        var loaded = openChecked();
        var manifest = loaded.manifest();
        requireNoTarget(manifest, target.name());

        var session = loaded.session();
        var created = new ArrayList<NewTarget>();
        created.add(target);
        if (target instanceof NewTarget.Binary binary) {
            session.apply(new ManifestEdit.AddBinaryTarget(binary.name(), binary.urlOrPath(), binary.checksum()));
        } else {
            addTargetWithDependencies(session, target);
            if (target instanceof NewTarget.Library library && library.includeTestTarget()) {
                var testTarget = new NewTarget.Test(library.name() + "Tests", List.of(library.name()));
                requireNoTarget(manifest, testTarget.name());
                addTargetWithDependencies(session, testTarget);
                created.add(testTarget);
            }
        }

        var result = commit(session, "added target " + target.name());
        for (var newTarget : created) {
            writeTemplateFiles(newTarget);
        }
        return result;
    }

    public Manifest addBinaryTarget(String name, String urlOrPath, @Nullable String checksum)
            throws IOException, ManifestLoadException, ManifestEditException {
        return addTarget(new NewTarget.Binary(name, urlOrPath, checksum));
    }

    public Manifest addTargetDependency(String targetName, String dependencyName)
            throws IOException, ManifestLoadException, ManifestEditException {
        var loaded = openChecked();
        var target = requireTarget(loaded.manifest(), targetName);
        if (target.dependsOn(dependencyName)) {
            throw new ManifestEditException(
                    Reason.PRECONDITION_FAILED,
                    "target '" + targetName + "' already depends on '" + dependencyName + "'");
        }
        loaded.session().apply(new ManifestEdit.AddTargetDependency(targetName, dependencyName));
        return commit(loaded.session(), "added dependency " + dependencyName + " to target " + targetName);
    }

    /** Adds {@code .product(name: productName, package: packageName)} to a target's dependencies. */
    public Manifest addProductTargetDependency(String targetName, String productName, String packageName)
            throws IOException, ManifestLoadException, ManifestEditException {
        var loaded = openChecked();
        var target = requireTarget(loaded.manifest(), targetName);
        boolean present = target.dependencies().stream()
                .anyMatch(d -> d instanceof TargetDependency.Product p
                        && p.name().equals(productName)
                        && packageName.equals(p.packageName()));
        if (present) {
            throw new ManifestEditException(
                    Reason.PRECONDITION_FAILED,
                    "target '" + targetName + "' already depends on product '" + productName + "' of package '"
                            + packageName + "'");
        }
        loaded.session().apply(new ManifestEdit.AddProductTargetDependency(targetName, productName, packageName));
        return commit(loaded.session(), "added product " + productName + " to target " + targetName);
    }

    public Manifest addProduct(String name, ProductType type, List<String> targets)
            throws IOException, ManifestLoadException, ManifestEditException {
        var loaded = openChecked();
        var manifest = loaded.manifest();
        if (manifest.product(name).isPresent()) {
            throw new ManifestEditException(Reason.PRECONDITION_FAILED, "a product named '" + name + "' already exists");
        }
        for (var target : targets) {
            requireTarget(manifest, target);
        }

        var session = loaded.session();
        session.apply(new ManifestEdit.AddProduct(name, type));
        for (var target : targets) {
            session.apply(new ManifestEdit.AddProductTarget(name, target));
        }
        return commit(session, "added product " + name);
    }

    public Manifest addProductTarget(String productName, String targetName)
            throws IOException, ManifestLoadException, ManifestEditException {
        var loaded = openChecked();
        var manifest = loaded.manifest();
        var product = manifest.product(productName)
                .orElseThrow(() -> new ManifestEditException(
                        Reason.ENTITY_NOT_FOUND, "couldn't find product '" + productName + "'"));
        requireTarget(manifest, targetName);
        if (product.targets().contains(targetName)) {
            throw new ManifestEditException(
                    Reason.PRECONDITION_FAILED,
                    "product '" + productName + "' already contains target '" + targetName + "'");
        }
        loaded.session().apply(new ManifestEdit.AddProductTarget(productName, targetName));
        return commit(loaded.session(), "added target " + targetName + " to product " + productName);
    }

    // -- internals

    private record Loaded(Manifest manifest, EditSession session) {}

    private Loaded openChecked() throws IOException, ManifestLoadException, ManifestEditException {
        String text = readManifest();
        var manifest = context.loader().load(text);
        var minimum = context.config().minimumToolsVersion();
        if (!manifest.toolsVersion().isAtLeast(minimum)) {
            throw new ManifestEditException(
                    Reason.PRECONDITION_FAILED,
                    "mechanical manifest editing operations are only supported for packages with swift-tools-version "
                            + minimum + " and later");
        }
        try {
            return new Loaded(manifest, EditSession.open(text, context.rewriter(), context.verifier()));
        } catch (ManifestParseException e) {
            throw new ManifestLoadException("invalid manifest syntax: " + e.getMessage(), e);
        }
    }

    private void addTargetWithDependencies(EditSession session, NewTarget target) throws ManifestEditException {
        session.apply(new ManifestEdit.AddTarget(target.factoryMethodName(), target.name()));
        for (var dependency : target.dependencyNames()) {
            session.apply(new ManifestEdit.AddTargetDependency(target.name(), dependency));
        }
    }

    private String readManifest() throws IOException {
        return Files.readString(manifestPath, StandardCharsets.UTF_8);
    }

    private Manifest commit(EditSession session, String summary) throws IOException {
        var manifest = session.manifest();
        if (manifest == null) {
            throw new IllegalStateException("nothing to write: no edit was committed");
        }
        Files.writeString(manifestPath, session.currentText(), StandardCharsets.UTF_8);
        logger.info("{} in {} ({} edits)", summary, manifestPath, session.committedEdits());
        return manifest;
    }

    private String dependencyPackageName(String location, DependencyRequirement requirement)
            throws DependencyResolutionException {
        String text = context.manifestFetcher().fetch(location, requirement);
        try {
            return context.loader().load(text).name();
        } catch (ManifestLoadException e) {
            throw new DependencyResolutionException(
                    "failed to load manifest of dependency '" + location + "': " + e.getMessage(), e);
        }
    }

    private static void requireNoTarget(Manifest manifest, String name) throws ManifestEditException {
        if (manifest.target(name).isPresent()) {
            throw new ManifestEditException(Reason.PRECONDITION_FAILED, "a target named '" + name + "' already exists");
        }
    }

    private static TargetDescription requireTarget(Manifest manifest, String name)
            throws ManifestEditException {
        return manifest.target(name)
                .orElseThrow(() -> new ManifestEditException(
                        Reason.ENTITY_NOT_FOUND, "couldn't find target '" + name + "'"));
    }

    private void writeTemplateFiles(NewTarget target) throws IOException {
        var sourcesDir = packageDir.resolve("Sources").resolve(target.name());
        var testsDir = packageDir.resolve("Tests").resolve(target.name());
        var template = target.accept(new NewTarget.Visitor<@Nullable TemplateFile>() {
            @Override
            public TemplateFile visitLibrary(NewTarget.Library library) {
                return new TemplateFile(sourcesDir, library.name() + ".swift", "");
            }

            @Override
            public TemplateFile visitExecutable(NewTarget.Executable executable) {
                return new TemplateFile(sourcesDir, "main.swift", "");
            }

            @Override
            public TemplateFile visitTest(NewTarget.Test test) {
                return new TemplateFile(testsDir, test.name() + ".swift", testTemplate(test));
            }

            @Override
            public @Nullable TemplateFile visitBinary(NewTarget.Binary binary) {
                return null;
            }
        });
        if (template == null) {
            return;
        }
        // Templates only go into directories that do not exist yet.
        if (Files.exists(template.dir())) {
            logger.debug("{} already exists; not writing template files", template.dir());
            return;
        }
        FileUtil.writeIfAbsent(template.dir().resolve(template.fileName()), template.content());
    }

    private record TemplateFile(Path dir, String fileName, String content) {}

    static String testTemplate(NewTarget.Test test) {
        String module = test.dependencyNames().isEmpty() ? "<#Module#>" : test.dependencyNames().get(0);
        return """
                import XCTest
                @testable import %s

                final class %s: XCTestCase {
                    func testExample() {

                    }
                }
                """
                .formatted(module, test.name());
    }
}
