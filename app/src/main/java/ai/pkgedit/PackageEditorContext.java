package ai.pkgedit;

import ai.pkgedit.git.DependencyManifestFetcher;
import ai.pkgedit.git.GitDependencyManifestFetcher;
import ai.pkgedit.git.GitVersionResolver;
import ai.pkgedit.git.VersionResolver;
import ai.pkgedit.manifest.ManifestLoader;
import ai.pkgedit.rewrite.ManifestRewriter;
import ai.pkgedit.session.ManifestVerifier;
import ai.pkgedit.session.ReloadingVerifier;
import java.util.Objects;

/** Collaborators shared by {@link PackageEditor} instances. */
public record PackageEditorContext(
        EditorConfig config,
        ManifestLoader loader,
        ManifestRewriter rewriter,
        ManifestVerifier verifier,
        VersionResolver versionResolver,
        DependencyManifestFetcher manifestFetcher) {

    public PackageEditorContext {
        Objects.requireNonNull(config);
        Objects.requireNonNull(loader);
        Objects.requireNonNull(rewriter);
        Objects.requireNonNull(verifier);
        Objects.requireNonNull(versionResolver);
        Objects.requireNonNull(manifestFetcher);
    }

    /** The production wiring: JGit for remote lookups and the reloading verifier. */
    public static PackageEditorContext create(EditorConfig config) {
        var loader = new ManifestLoader();
        return new PackageEditorContext(
                config,
                loader,
                new ManifestRewriter(config.indentUnit()),
                new ReloadingVerifier(loader),
                new GitVersionResolver(config.defaultBranches(), config.gitTimeout()),
                new GitDependencyManifestFetcher(config.manifestFileName(), config.gitTimeout()));
    }

    public PackageEditorContext withVerifier(ManifestVerifier newVerifier) {
        return new PackageEditorContext(config, loader, rewriter, newVerifier, versionResolver, manifestFetcher);
    }
}
