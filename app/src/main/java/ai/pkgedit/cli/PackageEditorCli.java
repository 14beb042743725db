package ai.pkgedit.cli;

import ai.pkgedit.EditorConfig;
import ai.pkgedit.PackageEditor;
import ai.pkgedit.PackageEditorContext;
import ai.pkgedit.git.DependencyResolutionException;
import ai.pkgedit.manifest.Manifest;
import ai.pkgedit.manifest.ManifestLoadException;
import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.LibraryType;
import ai.pkgedit.model.NewTarget;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.rewrite.ManifestEditException;
import ai.pkgedit.workspace.ManagedArtifact;
import ai.pkgedit.workspace.ManagedArtifacts;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/** Command-line entry point: one subcommand per editing operation. */
@SuppressWarnings("NullAway.Init") // fields are injected by picocli before call()
@CommandLine.Command(
        name = "pkgedit",
        mixinStandardHelpOptions = true,
        description = "Mechanically edit a Package.swift manifest.",
        subcommands = {
            PackageEditorCli.AddDependency.class,
            PackageEditorCli.AddTarget.class,
            PackageEditorCli.AddBinaryTarget.class,
            PackageEditorCli.AddTargetDependency.class,
            PackageEditorCli.AddProductDependency.class,
            PackageEditorCli.AddProduct.class,
            PackageEditorCli.AddProductTarget.class,
            PackageEditorCli.ListArtifacts.class
        })
public final class PackageEditorCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PackageEditorCli.class);

    @CommandLine.Option(
            names = "--package-path",
            description = "Directory containing the package manifest (default: current directory).",
            scope = CommandLine.ScopeType.INHERIT)
    Path packagePath = Path.of(".");

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final @Nullable PackageEditorContext context;

    public PackageEditorCli() {
        this(null);
    }

    /** @param context collaborators to use instead of the configured defaults */
    public PackageEditorCli(@Nullable PackageEditorContext context) {
        this.context = context;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new PackageEditorCli()).execute(args);
        System.exit(exitCode);
    }

    /** A command line for {@code cli} that accepts enum values in any case, e.g. {@code --type executable}. */
    public static CommandLine commandLine(PackageEditorCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    PackageEditor editor() {
        var ctx = context != null ? context : PackageEditorContext.create(EditorConfig.load());
        return new PackageEditor(packagePath, ctx);
    }

    @FunctionalInterface
    interface EditorAction {
        Manifest run(PackageEditor editor)
                throws IOException, ManifestLoadException, ManifestEditException, DependencyResolutionException;
    }

    /** Runs one editing operation and maps failures to an error message and exit code 1. */
    int run(EditorAction action) {
        var err = spec.commandLine().getErr();
        try {
            var manifest = action.run(editor());
            spec.commandLine()
                    .getOut()
                    .printf(
                            "Updated %s: %d dependencies, %d targets, %d products%n",
                            manifest.name(),
                            manifest.dependencies().size(),
                            manifest.targets().size(),
                            manifest.products().size());
            return 0;
        } catch (ManifestEditException e) {
            logger.debug("Edit rejected ({})", e.getReason(), e);
            err.println("error: " + e.getMessage());
            return 1;
        } catch (ManifestLoadException | DependencyResolutionException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("I/O failure while editing {}", packagePath, e);
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    @CommandLine.Command(name = "add-dependency", description = "Add a package dependency.")
    static final class AddDependency implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "URL or local path of the dependency.")
        String location;

        @CommandLine.Option(names = "--exact", description = "Exact version.")
        @Nullable
        String exact;

        @CommandLine.Option(names = "--revision", description = "Revision (commit id).")
        @Nullable
        String revision;

        @CommandLine.Option(names = "--branch", description = "Branch name.")
        @Nullable
        String branch;

        @CommandLine.Option(names = "--from", description = "Lower bound, up to the next major version.")
        @Nullable
        String from;

        @CommandLine.Option(names = "--up-to-next-minor-from", description = "Lower bound, up to the next minor version.")
        @Nullable
        String upToNextMinorFrom;

        @CommandLine.Option(names = "--to", description = "Exclusive upper bound, used with --from.")
        @Nullable
        String to;

        @CommandLine.Option(names = "--through", description = "Inclusive upper bound, used with --from.")
        @Nullable
        String through;

        @Override
        public Integer call() {
            @Nullable DependencyRequirement parsed;
            try {
                parsed = requirement();
            } catch (IllegalArgumentException e) {
                parent.spec.commandLine().getErr().println("error: " + e.getMessage());
                return 2;
            }
            var requirement = parsed;
            return parent.run(editor -> editor.addPackageDependency(location, requirement));
        }

        @Nullable
        DependencyRequirement requirement() {
            var chosen = new ArrayList<DependencyRequirement>();
            if (exact != null) chosen.add(new DependencyRequirement.Exact(exact));
            if (revision != null) chosen.add(new DependencyRequirement.Revision(revision));
            if (branch != null) chosen.add(new DependencyRequirement.Branch(branch));
            if (upToNextMinorFrom != null) chosen.add(new DependencyRequirement.UpToNextMinor(upToNextMinorFrom));
            if (from != null) {
                if (to != null && through != null) {
                    throw new IllegalArgumentException("--to and --through are mutually exclusive");
                }
                if (to != null) {
                    chosen.add(new DependencyRequirement.Range(from, to));
                } else if (through != null) {
                    chosen.add(new DependencyRequirement.ClosedRange(from, through));
                } else {
                    chosen.add(new DependencyRequirement.UpToNextMajor(from));
                }
            } else if (to != null || through != null) {
                throw new IllegalArgumentException("--to and --through require --from");
            }
            if (chosen.size() > 1) {
                throw new IllegalArgumentException("only one version requirement may be given");
            }
            return chosen.isEmpty() ? null : chosen.get(0);
        }
    }

    enum TargetKind {
        LIBRARY,
        EXECUTABLE,
        TEST
    }

    @CommandLine.Command(name = "add-target", description = "Add a library, executable or test target.")
    static final class AddTarget implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "Target name.")
        String name;

        @CommandLine.Option(
                names = "--type",
                description = "Target type: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
        TargetKind type = TargetKind.LIBRARY;

        @CommandLine.Option(names = "--no-test-target", description = "Do not add a test target for a library.")
        boolean noTestTarget;

        @CommandLine.Option(names = "--dependencies", split = ",", description = "Comma-separated dependency names.")
        List<String> dependencies = new ArrayList<>();

        @Override
        public Integer call() {
            NewTarget target =
                    switch (type) {
                        case LIBRARY -> new NewTarget.Library(name, !noTestTarget, dependencies);
                        case EXECUTABLE -> new NewTarget.Executable(name, dependencies);
                        case TEST -> new NewTarget.Test(name, dependencies);
                    };
            return parent.run(editor -> editor.addTarget(target));
        }
    }

    @CommandLine.Command(name = "add-binary-target", description = "Add a binary target.")
    static final class AddBinaryTarget implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "Target name.")
        String name;

        @CommandLine.Parameters(index = "1", description = "URL or local path of the artifact.")
        String urlOrPath;

        @CommandLine.Option(names = "--checksum", description = "Artifact checksum; required for URLs.")
        @Nullable
        String checksum;

        @Override
        public Integer call() {
            return parent.run(editor -> editor.addBinaryTarget(name, urlOrPath, checksum));
        }
    }

    @CommandLine.Command(name = "add-target-dependency", description = "Add a by-name dependency to a target.")
    static final class AddTargetDependency implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "Dependency name.")
        String dependency;

        @CommandLine.Parameters(index = "1", description = "Target name.")
        String target;

        @Override
        public Integer call() {
            return parent.run(editor -> editor.addTargetDependency(target, dependency));
        }
    }

    @CommandLine.Command(
            name = "add-product-dependency",
            description = "Add a product of a package dependency to a target's dependencies.")
    static final class AddProductDependency implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "Product name.")
        String product;

        @CommandLine.Parameters(index = "1", description = "Target name.")
        String target;

        @CommandLine.Option(names = "--package", required = true, description = "Package that vends the product.")
        String packageName;

        @Override
        public Integer call() {
            return parent.run(editor -> editor.addProductTargetDependency(target, product, packageName));
        }
    }

    enum ProductKind {
        LIBRARY,
        STATIC_LIBRARY,
        DYNAMIC_LIBRARY,
        EXECUTABLE
    }

    @CommandLine.Command(name = "add-product", description = "Add a product.")
    static final class AddProduct implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "Product name.")
        String name;

        @CommandLine.Option(
                names = "--type",
                description = "Product type: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
        ProductKind type = ProductKind.LIBRARY;

        @CommandLine.Option(names = "--targets", split = ",", description = "Comma-separated target names.")
        List<String> targets = new ArrayList<>();

        @Override
        public Integer call() {
            ProductType productType =
                    switch (type) {
                        case LIBRARY -> ProductType.library(LibraryType.AUTOMATIC);
                        case STATIC_LIBRARY -> ProductType.library(LibraryType.STATIC);
                        case DYNAMIC_LIBRARY -> ProductType.library(LibraryType.DYNAMIC);
                        case EXECUTABLE -> ProductType.executable();
                    };
            return parent.run(editor -> editor.addProduct(name, productType, targets));
        }
    }

    @CommandLine.Command(name = "add-product-target", description = "Add a target to an existing product.")
    static final class AddProductTarget implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Parameters(index = "0", description = "Product name.")
        String product;

        @CommandLine.Parameters(index = "1", description = "Target name.")
        String target;

        @Override
        public Integer call() {
            return parent.run(editor -> editor.addProductTarget(product, target));
        }
    }

    @CommandLine.Command(name = "artifacts", description = "List managed binary artifacts recorded for the package.")
    static final class ListArtifacts implements Callable<Integer> {
        @CommandLine.ParentCommand
        PackageEditorCli parent;

        @CommandLine.Option(
                names = "--file",
                description = "Artifact file (default: .build/" + ManagedArtifacts.FILE_NAME + " in the package).")
        @Nullable
        Path file;

        @Override
        public Integer call() {
            var out = parent.spec.commandLine().getOut();
            Path artifactsFile =
                    file != null ? file : parent.packagePath.resolve(".build").resolve(ManagedArtifacts.FILE_NAME);
            try {
                for (ManagedArtifact artifact : ManagedArtifacts.load(artifactsFile).all()) {
                    String source =
                            artifact.source() instanceof ManagedArtifact.Source.Remote remote ? remote.url() : "local";
                    out.printf("%s/%s\t%s\t%s%n", artifact.packageRef(), artifact.targetName(), source, artifact.path());
                }
                return 0;
            } catch (IOException e) {
                parent.spec.commandLine().getErr().println("error: " + e.getMessage());
                return 1;
            }
        }
    }
}
