package ai.pkgedit.syntax;

import ai.pkgedit.syntax.Syntax.SourceFile;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A handle on one node of a specific tree version: the node plus the chain of ancestors leading to the root.
 *
 * <p>Handles are tied to the tree they were obtained from. {@link #replace(Syntax)} never mutates that tree; it builds
 * a new root by copying only the ancestors of the replaced node and returns a handle into the new tree.
 */
public final class SyntaxRef<T extends Syntax> {
    @Nullable
    private final SyntaxRef<?> parent;

    private final int indexInParent;
    private final T node;

    private SyntaxRef(@Nullable SyntaxRef<?> parent, int indexInParent, T node) {
        this.parent = parent;
        this.indexInParent = indexInParent;
        this.node = Objects.requireNonNull(node);
    }

    public static SyntaxRef<SourceFile> root(SourceFile file) {
        return new SyntaxRef<>(null, -1, file);
    }

    public T node() {
        return node;
    }

    @Nullable
    public SyntaxRef<?> parent() {
        return parent;
    }

    /** Handle on the {@code index}-th child of this node. */
    public SyntaxRef<Syntax> child(int index) {
        return new SyntaxRef<>(this, index, node.children().get(index));
    }

    public List<SyntaxRef<Syntax>> children() {
        int size = node.children().size();
        var result = new ArrayList<SyntaxRef<Syntax>>(size);
        for (int i = 0; i < size; i++) {
            result.add(child(i));
        }
        return result;
    }

    /** The root of the tree this handle belongs to. */
    public SourceFile root() {
        SyntaxRef<?> ref = this;
        while (ref.parent != null) {
            ref = ref.parent;
        }
        return (SourceFile) ref.node;
    }

    public boolean is(Class<? extends Syntax> type) {
        return type.isInstance(node);
    }

    @SuppressWarnings("unchecked")
    public <U extends Syntax> SyntaxRef<U> as(Class<U> type) {
        if (!type.isInstance(node)) {
            throw new ClassCastException(
                    "node is a " + node.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return (SyntaxRef<U>) this;
    }

    /** Nearest ancestor (excluding this node) of the given type, or null. */
    @Nullable
    public <U extends Syntax> SyntaxRef<U> ancestor(Class<U> type) {
        for (SyntaxRef<?> ref = parent; ref != null; ref = ref.parent) {
            if (type.isInstance(ref.node)) {
                return ref.as(type);
            }
        }
        return null;
    }

    /**
     * Replaces this node and rebuilds its ancestors.
     *
     * @return a handle on {@code replacement} inside the new tree
     */
    public <U extends Syntax> SyntaxRef<U> replace(U replacement) {
        if (parent == null) {
            if (!(replacement instanceof SourceFile)) {
                throw new IllegalArgumentException("root can only be replaced by a SourceFile");
            }
            return new SyntaxRef<>(null, -1, replacement);
        }
        var newParent = parent.replace(parent.node.withChild(indexInParent, replacement));
        return new SyntaxRef<>(newParent, indexInParent, replacement);
    }

    /** Number of ancestors above this node. */
    public int depth() {
        int depth = 0;
        for (SyntaxRef<?> ref = parent; ref != null; ref = ref.parent) {
            depth++;
        }
        return depth;
    }

    @Override
    public String toString() {
        return "SyntaxRef[" + node.getClass().getSimpleName() + " at depth " + depth() + "]";
    }
}
