package ai.pkgedit.model;

/** Linkage of a library product. {@code AUTOMATIC} lets the build system decide and is not written out. */
public enum LibraryType {
    STATIC("static"),
    DYNAMIC("dynamic"),
    AUTOMATIC("automatic");

    private final String manifestName;

    LibraryType(String manifestName) {
        this.manifestName = manifestName;
    }

    public String manifestName() {
        return manifestName;
    }
}
