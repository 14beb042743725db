package ai.pkgedit.rewrite;

import ai.pkgedit.syntax.Syntax;
import ai.pkgedit.syntax.SyntaxRef;

/** Outcome of a locator search. Ambiguity is always reported, never resolved by picking one candidate. */
public sealed interface LocateResult<T extends Syntax> {

    /** A handle on the match inside the tree that was searched. */
    record Found<T extends Syntax>(SyntaxRef<T> ref) implements LocateResult<T> {}

    record Missing<T extends Syntax>() implements LocateResult<T> {}

    /** Something with the expected label exists but has a shape the rewriter cannot edit. */
    record Incompatible<T extends Syntax>(String reason) implements LocateResult<T> {}

    record FoundMultiple<T extends Syntax>(int count) implements LocateResult<T> {}
}
