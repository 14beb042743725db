package ai.pkgedit.rewrite;

import ai.pkgedit.model.DependencyRequirement;
import ai.pkgedit.syntax.Syntax.Argument;
import ai.pkgedit.syntax.Syntax.BinaryOperatorExpr;
import ai.pkgedit.syntax.Syntax.CallExpr;
import ai.pkgedit.syntax.Syntax.Expr;
import ai.pkgedit.syntax.Syntax.SequenceExpr;
import ai.pkgedit.syntax.Syntax.StringLiteral;
import ai.pkgedit.syntax.Token;
import ai.pkgedit.syntax.TokenKind;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Builds {@code .package(name: "N", url: "U", <requirement>)} entries, or {@code .package(name: "N", path: "P")} for
 * local packages.
 */
public final class PackageDependencySynthesizer {
    private PackageDependencySynthesizer() {}

    public static CallExpr synthesize(@Nullable String name, String location, DependencyRequirement requirement) {
        var arguments = new ArrayList<Argument>();
        if (name != null) {
            arguments.add(SyntaxFactory.labeledString("name", name));
        }
        arguments.add(SyntaxFactory.labeledString(requirement.isLocal() ? "path" : "url", location));
        arguments.addAll(requirement.accept(new RequirementArguments()));
        return SyntaxFactory.implicitCall("package", arguments);
    }

    private static final class RequirementArguments implements DependencyRequirement.Visitor<List<Argument>> {
        @Override
        public List<Argument> visitExact(DependencyRequirement.Exact exact) {
            return List.of(unlabeledCall("exact", exact.version()));
        }

        @Override
        public List<Argument> visitRevision(DependencyRequirement.Revision revision) {
            return List.of(unlabeledCall("revision", revision.id()));
        }

        @Override
        public List<Argument> visitBranch(DependencyRequirement.Branch branch) {
            return List.of(unlabeledCall("branch", branch.name()));
        }

        @Override
        public List<Argument> visitUpToNextMajor(DependencyRequirement.UpToNextMajor upToNextMajor) {
            return List.of(fromCall("upToNextMajor", upToNextMajor.version()));
        }

        @Override
        public List<Argument> visitUpToNextMinor(DependencyRequirement.UpToNextMinor upToNextMinor) {
            return List.of(fromCall("upToNextMinor", upToNextMinor.version()));
        }

        @Override
        public List<Argument> visitRange(DependencyRequirement.Range range) {
            return List.of(Argument.unlabeled(range(range.lowerBound(), "..<", range.upperBound())));
        }

        @Override
        public List<Argument> visitClosedRange(DependencyRequirement.ClosedRange closedRange) {
            return List.of(Argument.unlabeled(range(closedRange.lowerBound(), "...", closedRange.upperBound())));
        }

        @Override
        public List<Argument> visitLocalPath(DependencyRequirement.LocalPath localPath) {
            return List.of();
        }

        // .exact("1.0.0")
        private static Argument unlabeledCall(String factory, String value) {
            return Argument.unlabeled(
                    SyntaxFactory.implicitCall(factory, List.of(Argument.unlabeled(StringLiteral.of(value)))));
        }

        // .upToNextMajor(from: "1.0.0")
        private static Argument fromCall(String factory, String version) {
            return Argument.unlabeled(
                    SyntaxFactory.implicitCall(factory, List.of(SyntaxFactory.labeledString("from", version))));
        }

        // "1.0.0"..<"2.0.0", unspaced
        private static Expr range(String lower, String operator, String upper) {
            return new SequenceExpr(ImmutableList.of(
                    StringLiteral.of(lower),
                    new BinaryOperatorExpr(Token.of(TokenKind.OPERATOR, operator)),
                    StringLiteral.of(upper)));
        }
    }
}
