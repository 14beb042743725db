package ai.pkgedit.model;

import java.util.Objects;

/** Kind of a product; {@code libraryType} is only meaningful for libraries and is AUTOMATIC otherwise. */
public record ProductType(Kind kind, LibraryType libraryType) {

    public enum Kind {
        LIBRARY,
        EXECUTABLE
    }

    public ProductType {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(libraryType);
        if (kind == Kind.EXECUTABLE && libraryType != LibraryType.AUTOMATIC) {
            throw new IllegalArgumentException("executables have no library type");
        }
    }

    public static ProductType library(LibraryType libraryType) {
        return new ProductType(Kind.LIBRARY, libraryType);
    }

    public static ProductType executable() {
        return new ProductType(Kind.EXECUTABLE, LibraryType.AUTOMATIC);
    }

    public boolean isLibrary() {
        return kind == Kind.LIBRARY;
    }

    /** Name of the manifest factory call for this product kind. */
    public String factoryMethodName() {
        return switch (kind) {
            case LIBRARY -> "library";
            case EXECUTABLE -> "executable";
        };
    }
}
