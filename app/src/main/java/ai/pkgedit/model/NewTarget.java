package ai.pkgedit.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** A request to add a target to a package. Owns no syntax; it only describes what to create. */
public sealed interface NewTarget {

    String name();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLibrary(Library library);

        R visitExecutable(Executable executable);

        R visitTest(Test test);

        R visitBinary(Binary binary);
    }

    /** Name of the manifest factory call that declares this kind of target. */
    default String factoryMethodName() {
        return accept(new Visitor<>() {
            @Override
            public String visitLibrary(Library library) {
                return "target";
            }

            @Override
            public String visitExecutable(Executable executable) {
                return "target";
            }

            @Override
            public String visitTest(Test test) {
                return "testTarget";
            }

            @Override
            public String visitBinary(Binary binary) {
                return "binaryTarget";
            }
        });
    }

    /** By-name dependencies of the new target; binary targets have none. */
    default List<String> dependencyNames() {
        return List.of();
    }

    record Library(String name, boolean includeTestTarget, List<String> dependencyNames) implements NewTarget {
        public Library {
            Objects.requireNonNull(name);
            dependencyNames = ImmutableList.copyOf(dependencyNames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLibrary(this);
        }
    }

    record Executable(String name, List<String> dependencyNames) implements NewTarget {
        public Executable {
            Objects.requireNonNull(name);
            dependencyNames = ImmutableList.copyOf(dependencyNames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExecutable(this);
        }
    }

    record Test(String name, List<String> dependencyNames) implements NewTarget {
        public Test {
            Objects.requireNonNull(name);
            dependencyNames = ImmutableList.copyOf(dependencyNames);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTest(this);
        }
    }

    /** A prebuilt binary; {@code checksum} is required exactly when {@code urlOrPath} is a remote URL. */
    record Binary(String name, String urlOrPath, @Nullable String checksum) implements NewTarget {
        public Binary {
            Objects.requireNonNull(name);
            Objects.requireNonNull(urlOrPath);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }
}
