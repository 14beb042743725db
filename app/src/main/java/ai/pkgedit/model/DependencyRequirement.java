package ai.pkgedit.model;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * How a package dependency's version is constrained. {@link LocalPath} is the only variant addressed by a file system
 * path; every other variant implies a remote URL.
 *
 * <p>Consumers dispatch through {@link Visitor} so that a new variant fails to compile until every consumer handles it.
 */
public sealed interface DependencyRequirement {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitExact(Exact exact);

        R visitRevision(Revision revision);

        R visitBranch(Branch branch);

        R visitUpToNextMajor(UpToNextMajor upToNextMajor);

        R visitUpToNextMinor(UpToNextMinor upToNextMinor);

        R visitRange(Range range);

        R visitClosedRange(ClosedRange closedRange);

        R visitLocalPath(LocalPath localPath);
    }

    default boolean isLocal() {
        return this instanceof LocalPath;
    }

    /**
     * The git ref (tag version, branch or commit) a checkout should use to read the dependency's manifest; the lower
     * bound for ranges; null for local paths.
     */
    @Nullable
    default String ref() {
        return accept(new Visitor<>() {
            @Override
            public String visitExact(Exact exact) {
                return exact.version();
            }

            @Override
            public String visitRevision(Revision revision) {
                return revision.id();
            }

            @Override
            public String visitBranch(Branch branch) {
                return branch.name();
            }

            @Override
            public String visitUpToNextMajor(UpToNextMajor upToNextMajor) {
                return upToNextMajor.version();
            }

            @Override
            public String visitUpToNextMinor(UpToNextMinor upToNextMinor) {
                return upToNextMinor.version();
            }

            @Override
            public String visitRange(Range range) {
                return range.lowerBound();
            }

            @Override
            public String visitClosedRange(ClosedRange closedRange) {
                return closedRange.lowerBound();
            }

            @Override
            @Nullable
            public String visitLocalPath(LocalPath localPath) {
                return null;
            }
        });
    }

    record Exact(String version) implements DependencyRequirement {
        public Exact {
            Objects.requireNonNull(version);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExact(this);
        }
    }

    record Revision(String id) implements DependencyRequirement {
        public Revision {
            Objects.requireNonNull(id);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRevision(this);
        }
    }

    record Branch(String name) implements DependencyRequirement {
        public Branch {
            Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBranch(this);
        }
    }

    record UpToNextMajor(String version) implements DependencyRequirement {
        public UpToNextMajor {
            Objects.requireNonNull(version);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpToNextMajor(this);
        }
    }

    record UpToNextMinor(String version) implements DependencyRequirement {
        public UpToNextMinor {
            Objects.requireNonNull(version);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpToNextMinor(this);
        }
    }

    /** {@code lowerBound..<upperBound}. */
    record Range(String lowerBound, String upperBound) implements DependencyRequirement {
        public Range {
            Objects.requireNonNull(lowerBound);
            Objects.requireNonNull(upperBound);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    /** {@code lowerBound...upperBound}. */
    record ClosedRange(String lowerBound, String upperBound) implements DependencyRequirement {
        public ClosedRange {
            Objects.requireNonNull(lowerBound);
            Objects.requireNonNull(upperBound);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClosedRange(this);
        }
    }

    record LocalPath() implements DependencyRequirement {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocalPath(this);
        }
    }
}
