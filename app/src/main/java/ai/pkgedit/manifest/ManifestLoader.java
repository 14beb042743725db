package ai.pkgedit.manifest;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.model.LibraryType;
import ai.pkgedit.model.Locations;
import ai.pkgedit.model.PackageIdentity;
import ai.pkgedit.model.ProductType;
import ai.pkgedit.syntax.Syntax;
import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.ArgumentList;
import ai.pkgedit.syntax.Syntax.ArrayElement;
import ai.pkgedit.syntax.Syntax.ArrayLiteral;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.IdentifierExpr;
import ai.pkgedit.syntax.Syntax.MemberAccessExpr;
import ai.pkgedit.syntax.Syntax.ParenExpr;
import ai.pkgedit.syntax.Syntax.SequenceExpr;
import ai.pkgedit.syntax.Syntax.SourceFile;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.Syntax.VariableDecl;
import ai.pkgedit.syntax.SyntaxRef;
import ai.pkgedit.syntax.SyntaxWalker;
import ai.pkgedit.syntax.parser.ManifestParseException;
import ai.pkgedit.syntax.parser.ManifestParser;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Turns manifest source into a typed {@link Manifest}.
 *
 * <p>The loader evaluates the single {@code Package(...)} call statically. Top-level {@code let}/{@code var} bindings
 * may be referenced by name and arrays may be concatenated with {@code +}; anything that would need the manifest to
 * actually run is rejected with a {@link ManifestLoadException}.
 */
public class ManifestLoader {
    private static final Logger logger = LogManager.getLogger(ManifestLoader.class);

    public Manifest load(String text) throws ManifestLoadException {
        SourceFile tree;
        try {
            tree = ManifestParser.parse(text);
        } catch (ManifestParseException e) {
            throw new ManifestLoadException("invalid manifest syntax: " + e.getMessage(), e);
        }
        return load(tree);
    }

    public Manifest load(SourceFile tree) throws ManifestLoadException {
        var toolsVersion = ToolsVersion.fromManifest(tree.toSource());
        if (toolsVersion == null) {
            throw new ManifestLoadException("missing or malformed '// swift-tools-version:' header on the first line");
        }

        var packageCalls = SyntaxWalker.findAll(SyntaxRef.root(tree), ManifestLoader::isPackageCall);
        if (packageCalls.isEmpty()) {
            throw new ManifestLoadException("manifest does not declare a Package");
        }
        if (packageCalls.size() > 1) {
            throw new ManifestLoadException("manifest declares " + packageCalls.size() + " Package initializers");
        }
        var packageArgs = ((CallExpr) packageCalls.get(0).node()).arguments();
        var evaluator = new Evaluator(bindingsOf(tree));

        String name = evaluator.requiredString(packageArgs, "name", "Package");

        var dependencies = new ArrayList<PackageDependency>();
        for (var expr : evaluator.optionalArray(packageArgs, "dependencies")) {
            dependencies.add(evaluator.dependency(expr));
        }
        var targets = new ArrayList<TargetDescription>();
        for (var expr : evaluator.optionalArray(packageArgs, "targets")) {
            targets.add(evaluator.target(expr));
        }
        var products = new ArrayList<ProductDescription>();
        for (var expr : evaluator.optionalArray(packageArgs, "products")) {
            products.add(evaluator.product(expr));
        }

        var manifest = new Manifest(name, toolsVersion, dependencies, targets, products);
        validate(manifest);
        logger.debug(
                "Loaded manifest {} (tools {}): {} dependencies, {} targets, {} products",
                name,
                toolsVersion,
                dependencies.size(),
                targets.size(),
                products.size());
        return manifest;
    }

    static boolean isPackageCall(Syntax node) {
        return node instanceof CallExpr call
                && call.callee() instanceof IdentifierExpr id
                && id.name().equals("Package");
    }

    private static Map<String, Expr> bindingsOf(SourceFile tree) {
        var bindings = new HashMap<String, Expr>();
        for (var statement : tree.statements()) {
            if (statement instanceof VariableDecl decl && decl.initializer() != null) {
                bindings.put(decl.name().text(), decl.initializer().value());
            }
        }
        return bindings;
    }

    private static void validate(Manifest manifest) throws ManifestLoadException {
        var identities = new HashSet<PackageIdentity>();
        for (var dependency : manifest.dependencies()) {
            if (!identities.add(dependency.identity())) {
                throw new ManifestLoadException("duplicate package dependency '" + dependency.identity() + "'");
            }
        }

        var targetNames = new HashSet<String>();
        for (var target : manifest.targets()) {
            if (!targetNames.add(target.name())) {
                throw new ManifestLoadException("duplicate target named '" + target.name() + "'");
            }
        }
        for (var target : manifest.targets()) {
            for (var dependency : target.dependencies()) {
                if (dependency instanceof TargetDependency.Target && !targetNames.contains(dependency.name())) {
                    throw new ManifestLoadException("target '" + target.name() + "' depends on unknown target '"
                            + dependency.name() + "'");
                }
            }
            if (target.type() == TargetType.BINARY) {
                validateBinaryTarget(target);
            }
        }

        var productNames = new HashSet<String>();
        for (var product : manifest.products()) {
            if (!productNames.add(product.name())) {
                throw new ManifestLoadException("duplicate product named '" + product.name() + "'");
            }
            for (var targetName : product.targets()) {
                if (!targetNames.contains(targetName)) {
                    throw new ManifestLoadException(
                            "product '" + product.name() + "' references unknown target '" + targetName + "'");
                }
            }
        }
    }

    private static void validateBinaryTarget(TargetDescription target) throws ManifestLoadException {
        if ((target.url() == null) == (target.path() == null)) {
            throw new ManifestLoadException(
                    "binary target '" + target.name() + "' must declare exactly one of 'url' or 'path'");
        }
        if (target.url() != null) {
            if (!Locations.isRemote(target.url())) {
                throw new ManifestLoadException(
                        "binary target '" + target.name() + "' has an invalid url '" + target.url() + "'");
            }
            if (target.checksum() == null) {
                throw new ManifestLoadException("binary target '" + target.name() + "' declares a url but no checksum");
            }
        }
    }

    /** Static evaluation of manifest expressions against the file's top-level bindings. */
    private static final class Evaluator {
        private final Map<String, Expr> bindings;
        private final Set<String> resolving = new HashSet<>();

        Evaluator(Map<String, Expr> bindings) {
            this.bindings = bindings;
        }

        PackageDependency dependency(Expr expr) throws ManifestLoadException {
            var args = call(expr, "package", "package dependency").arguments();
            String name = optionalString(args, "name");
            String url = optionalString(args, "url");
            String path = optionalString(args, "path");
            if ((url == null) == (path == null)) {
                throw new ManifestLoadException("package dependency must declare exactly one of 'url' or 'path'");
            }
            if (path != null) {
                return new PackageDependency(name, path, new DependencyRequirement.LocalPath());
            }
            return new PackageDependency(name, url, requirement(args, url));
        }

        private DependencyRequirement requirement(ArgumentList args, String url) throws ManifestLoadException {
            for (var arg : args.arguments()) {
                String label = arg.labelText();
                if (label == null) {
                    return unlabeledRequirement(arg.value(), url);
                }
                switch (label) {
                    case "from":
                        return new DependencyRequirement.UpToNextMajor(string(arg.value(), label));
                    case "exact":
                        return new DependencyRequirement.Exact(string(arg.value(), label));
                    case "branch":
                        return new DependencyRequirement.Branch(string(arg.value(), label));
                    case "revision":
                        return new DependencyRequirement.Revision(string(arg.value(), label));
                    default:
                        break;
                }
            }
            throw new ManifestLoadException("package dependency '" + url + "' has no version requirement");
        }

        private DependencyRequirement unlabeledRequirement(Expr value, String url) throws ManifestLoadException {
            var expr = unwrap(value);
            if (expr instanceof SequenceExpr seq && seq.operators().size() == 1) {
                String lower = string(seq.operands().get(0), "range");
                String upper = string(seq.operands().get(1), "range");
                switch (seq.operators().get(0).symbol()) {
                    case "..<":
                        return new DependencyRequirement.Range(lower, upper);
                    case "...":
                        return new DependencyRequirement.ClosedRange(lower, upper);
                    default:
                        break;
                }
            }
            if (expr instanceof CallExpr call && call.calleeName() != null) {
                var args = call.arguments();
                switch (call.calleeName()) {
                    case "upToNextMajor":
                        return new DependencyRequirement.UpToNextMajor(requiredString(args, "from", "upToNextMajor"));
                    case "upToNextMinor":
                        return new DependencyRequirement.UpToNextMinor(requiredString(args, "from", "upToNextMinor"));
                    case "exact":
                        return new DependencyRequirement.Exact(singleUnlabeledString(args, "exact"));
                    case "branch":
                        return new DependencyRequirement.Branch(singleUnlabeledString(args, "branch"));
                    case "revision":
                        return new DependencyRequirement.Revision(singleUnlabeledString(args, "revision"));
                    default:
                        break;
                }
            }
            throw new ManifestLoadException("unsupported version requirement for package dependency '" + url + "'");
        }

        TargetDescription target(Expr expr) throws ManifestLoadException {
            var call = asCall(expr, "target");
            String factory = call.calleeName();
            var type = factory == null ? null : TargetType.fromFactoryMethod(factory);
            if (type == null) {
                throw new ManifestLoadException("unsupported target declaration '" + call.callee().toSource().strip()
                        + "'");
            }
            var args = call.arguments();
            String name = requiredString(args, "name", "target");
            var dependencies = new ArrayList<TargetDependency>();
            for (var dep : optionalArray(args, "dependencies")) {
                dependencies.add(targetDependency(dep, name));
            }
            return new TargetDescription(
                    name,
                    type,
                    dependencies,
                    optionalString(args, "path"),
                    optionalString(args, "url"),
                    optionalString(args, "checksum"));
        }

        private TargetDependency targetDependency(Expr expr, String targetName) throws ManifestLoadException {
            var value = unwrap(expr);
            if (!(value instanceof CallExpr)) {
                return new TargetDependency.ByName(string(value, "dependency of target '" + targetName + "'"));
            }
            var call = (CallExpr) value;
            String kind = call.calleeName();
            var args = call.arguments();
            if ("target".equals(kind)) {
                return new TargetDependency.Target(requiredString(args, "name", "target dependency"));
            }
            if ("product".equals(kind)) {
                return new TargetDependency.Product(
                        requiredString(args, "name", "product dependency"), optionalString(args, "package"));
            }
            if ("byName".equals(kind)) {
                return new TargetDependency.ByName(requiredString(args, "name", "byName dependency"));
            }
            throw new ManifestLoadException("unsupported dependency of target '" + targetName + "'");
        }

        ProductDescription product(Expr expr) throws ManifestLoadException {
            var call = asCall(expr, "product");
            var args = call.arguments();
            String kind = call.calleeName();
            String name = requiredString(args, "name", "product");
            var targets = new ArrayList<String>();
            for (var target : optionalArray(args, "targets")) {
                targets.add(string(target, "targets of product '" + name + "'"));
            }
            if ("executable".equals(kind)) {
                return new ProductDescription(name, ProductType.executable(), targets);
            }
            if ("library".equals(kind)) {
                return new ProductDescription(name, ProductType.library(libraryType(args, name)), targets);
            }
            throw new ManifestLoadException("unsupported product declaration for '" + name + "'");
        }

        private LibraryType libraryType(ArgumentList args, String productName) throws ManifestLoadException {
            var arg = argument(args, "type");
            if (arg == null) {
                return LibraryType.AUTOMATIC;
            }
            if (unwrap(arg.value()) instanceof MemberAccessExpr member) {
                String typeName = member.name().text();
                for (var type : LibraryType.values()) {
                    if (type != LibraryType.AUTOMATIC && type.manifestName().equals(typeName)) {
                        return type;
                    }
                }
            }
            throw new ManifestLoadException("unsupported library type for product '" + productName + "'");
        }

        // -- primitives

        private CallExpr call(Expr expr, String expectedName, String what) throws ManifestLoadException {
            var call = asCall(expr, what);
            if (!expectedName.equals(call.calleeName())) {
                throw new ManifestLoadException("expected ." + expectedName + "(...) for " + what);
            }
            return call;
        }

        private CallExpr asCall(Expr expr, String what) throws ManifestLoadException {
            var value = unwrap(expr);
            if (value instanceof CallExpr call) {
                return call;
            }
            throw new ManifestLoadException("expected a call expression for " + what);
        }

        @Nullable
        private static Argument argument(ArgumentList args, String label) {
            int index = args.indexOf(label);
            return index < 0 ? null : args.arguments().get(index);
        }

        @Nullable
        String optionalString(ArgumentList args, String label) throws ManifestLoadException {
            var arg = argument(args, label);
            return arg == null ? null : string(arg.value(), label);
        }

        String requiredString(ArgumentList args, String label, String owner) throws ManifestLoadException {
            var arg = argument(args, label);
            if (arg == null) {
                throw new ManifestLoadException("missing '" + label + "' argument of " + owner);
            }
            return string(arg.value(), label);
        }

        private String singleUnlabeledString(ArgumentList args, String owner) throws ManifestLoadException {
            if (args.arguments().size() != 1 || args.arguments().get(0).label() != null) {
                throw new ManifestLoadException("." + owner + "(...) takes exactly one unlabeled argument");
            }
            return string(args.arguments().get(0).value(), owner);
        }

        List<Expr> optionalArray(ArgumentList args, String label) throws ManifestLoadException {
            var arg = argument(args, label);
            return arg == null ? List.of() : array(arg.value(), label);
        }

        private List<Expr> array(Expr expr, String what) throws ManifestLoadException {
            var value = unwrap(expr);
            if (value instanceof ArrayLiteral array) {
                var result = new ArrayList<Expr>(array.elements().size());
                for (ArrayElement element : array.elements()) {
                    result.add(element.value());
                }
                return result;
            }
            if (value instanceof IdentifierExpr id) {
                return withBinding(id, what, bound -> array(bound, what));
            }
            if (value instanceof SequenceExpr seq
                    && seq.operators().stream().allMatch(op -> op.symbol().equals("+"))) {
                var result = new ArrayList<Expr>();
                for (var operand : seq.operands()) {
                    result.addAll(array(operand, what));
                }
                return result;
            }
            throw new ManifestLoadException("'" + what + "' is not an array");
        }

        private String string(Expr expr, String what) throws ManifestLoadException {
            var value = unwrap(expr);
            if (value instanceof StringLiteral literal) {
                String text = literal.singleSegmentValue();
                if (text == null) {
                    throw new ManifestLoadException("'" + what + "' must be a plain string literal");
                }
                return text;
            }
            if (value instanceof IdentifierExpr id) {
                return withBinding(id, what, bound -> string(bound, what));
            }
            throw new ManifestLoadException("'" + what + "' is not a string");
        }

        private <T> T withBinding(IdentifierExpr id, String what, BindingEvaluation<T> evaluation)
                throws ManifestLoadException {
            String name = id.name();
            var bound = bindings.get(name);
            if (bound == null) {
                throw new ManifestLoadException("unknown identifier '" + name + "' in '" + what + "'");
            }
            if (!resolving.add(name)) {
                throw new ManifestLoadException("'" + name + "' is defined in terms of itself");
            }
            try {
                return evaluation.evaluate(bound);
            } finally {
                resolving.remove(name);
            }
        }

        private static Expr unwrap(Expr expr) {
            var current = expr;
            while (current instanceof ParenExpr paren) {
                current = paren.expression();
            }
            return current;
        }
    }

    @FunctionalInterface
    private interface BindingEvaluation<T> {
        T evaluate(Expr bound) throws ManifestLoadException;
    }
}
