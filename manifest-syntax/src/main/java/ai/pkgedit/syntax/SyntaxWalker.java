package ai.pkgedit.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * Predicate-driven traversal over {@link SyntaxRef}s. One generic walk serves every search: a match predicate picks
 * the results and a descend predicate prunes subtrees that cannot contain anything interesting.
 */
public final class SyntaxWalker {
    private SyntaxWalker() {}

    /**
     * Pre-order walk from {@code start} (inclusive). A matched node is reported and not descended into; an unmatched
     * node is descended into only when {@code descendInto} accepts it.
     */
    public static List<SyntaxRef<Syntax>> findAll(
            SyntaxRef<? extends Syntax> start,
            Predicate<? super Syntax> matches,
            Predicate<? super Syntax> descendInto) {
        var results = new ArrayList<SyntaxRef<Syntax>>();
        findAllInternal(start.as(Syntax.class), matches, descendInto, results);
        return results;
    }

    /** Like {@link #findAll(SyntaxRef, Predicate, Predicate)} but descends everywhere. */
    public static List<SyntaxRef<Syntax>> findAll(SyntaxRef<? extends Syntax> start, Predicate<? super Syntax> matches) {
        return findAll(start, matches, node -> true);
    }

    /** First match in pre-order, or null. */
    public static @Nullable SyntaxRef<Syntax> findFirst(
            SyntaxRef<? extends Syntax> start,
            Predicate<? super Syntax> matches,
            Predicate<? super Syntax> descendInto) {
        return findFirstInternal(start.as(Syntax.class), matches, descendInto);
    }

    private static void findAllInternal(
            SyntaxRef<Syntax> ref,
            Predicate<? super Syntax> matches,
            Predicate<? super Syntax> descendInto,
            List<SyntaxRef<Syntax>> results) {
        var node = ref.node();
        if (matches.test(node)) {
            results.add(ref);
            return;
        }
        if (!descendInto.test(node)) {
            return;
        }
        for (var child : ref.children()) {
            findAllInternal(child, matches, descendInto, results);
        }
    }

    private static @Nullable SyntaxRef<Syntax> findFirstInternal(
            SyntaxRef<Syntax> ref, Predicate<? super Syntax> matches, Predicate<? super Syntax> descendInto) {
        var node = ref.node();
        if (matches.test(node)) {
            return ref;
        }
        if (!descendInto.test(node)) {
            return null;
        }
        for (var child : ref.children()) {
            var found = findFirstInternal(child, matches, descendInto);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
