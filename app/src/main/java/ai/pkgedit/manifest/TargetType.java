package ai.pkgedit.manifest;

import org.jetbrains.annotations.Nullable;

public enum TargetType {
    REGULAR("target"),
    EXECUTABLE("executableTarget"),
    TEST("testTarget"),
    SYSTEM("systemLibrary"),
    BINARY("binaryTarget");

    private final String factoryMethodName;

    TargetType(String factoryMethodName) {
        this.factoryMethodName = factoryMethodName;
    }

    public String factoryMethodName() {
        return factoryMethodName;
    }

    @Nullable
    public static TargetType fromFactoryMethod(String name) {
        for (var type : values()) {
            if (type.factoryMethodName.equals(name)) {
                return type;
            }
        }
        return null;
    }
}
