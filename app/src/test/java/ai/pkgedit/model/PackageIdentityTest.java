package ai.pkgedit.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class PackageIdentityTest {

    @Test
    void derivesIdentityFromLocation() {
        assertEquals("swift-nio", PackageIdentity.fromLocation("https://github.com/apple/swift-nio.git").value());
        assertEquals("swift-nio", PackageIdentity.fromLocation("https://github.com/apple/Swift-NIO/").value());
        assertEquals("repo", PackageIdentity.fromLocation("git@github.com:org/repo.git").value());
        assertEquals("repo", PackageIdentity.fromLocation("git@host:repo.git").value());
        assertEquals("local", PackageIdentity.fromLocation("../deps/Local").value());
    }

    @Test
    void sameIdentityForEquivalentLocations() {
        assertEquals(
                PackageIdentity.fromLocation("https://example.com/a/Foo.git"),
                PackageIdentity.fromLocation("ssh://git@example.com/b/foo"));
    }

    @Test
    void classifiesLocations() {
        assertEquals("https", Locations.scheme("https://example.com/x"));
        assertEquals("git+ssh", Locations.scheme("git+ssh://example.com/x"));
        assertTrue(Locations.isRemote("file:///tmp/repo"));
        assertFalse(Locations.isRemote("../Local"));
        assertFalse(Locations.isRemote("git@github.com:org/repo.git"));
    }

    @Test
    void productTypeRules() {
        assertThrows(IllegalArgumentException.class, () -> new ProductType(ProductType.Kind.EXECUTABLE, LibraryType.STATIC));
        assertEquals("executable", ProductType.executable().factoryMethodName());
        assertEquals("library", ProductType.library(LibraryType.AUTOMATIC).factoryMethodName());
    }

    @Test
    void newTargetFactoryNames() {
        assertEquals("target", new NewTarget.Library("L", false, java.util.List.of()).factoryMethodName());
        assertEquals("target", new NewTarget.Executable("E", java.util.List.of()).factoryMethodName());
        assertEquals("testTarget", new NewTarget.Test("T", java.util.List.of()).factoryMethodName());
        assertEquals("binaryTarget", new NewTarget.Binary("B", "b.zip", null).factoryMethodName());
        assertNull(new DependencyRequirement.LocalPath().ref());
        assertEquals("1.0.0", new DependencyRequirement.Range("1.0.0", "2.0.0").ref());
    }
}
