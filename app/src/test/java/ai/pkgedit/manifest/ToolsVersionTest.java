package ai.pkgedit.manifest;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ToolsVersionTest {

    @Test
    void readsHeaderVariants() {
        assertEquals(new ToolsVersion(5, 2, 0), ToolsVersion.fromManifest("// swift-tools-version:5.2\n"));
        assertEquals(new ToolsVersion(5, 9, 1), ToolsVersion.fromManifest("//swift-tools-version: 5.9.1\nimport X"));
        assertEquals(new ToolsVersion(5, 0, 0), ToolsVersion.fromManifest("// swift-tools-version:5;foo\n"));
        assertNull(ToolsVersion.fromManifest("import PackageDescription\n// swift-tools-version:5.2\n"));
        assertNull(ToolsVersion.fromManifest(""));
    }

    @Test
    void ordersAndPrints() {
        assertTrue(ToolsVersion.parse("5.3").isAtLeast(ToolsVersion.parse("5.2")));
        assertFalse(ToolsVersion.parse("5.1.9").isAtLeast(ToolsVersion.parse("5.2")));
        assertEquals("5.2", ToolsVersion.parse("5.2.0").toString());
        assertEquals("5.2.1", ToolsVersion.parse("5.2.1").toString());
        assertThrows(IllegalArgumentException.class, () -> ToolsVersion.parse("five"));
    }

    @Test
    void oversizedComponentsAreRejected() {
        assertNull(ToolsVersion.fromManifest("// swift-tools-version:99999999999\n"));
        assertNull(ToolsVersion.fromManifest("// swift-tools-version:5.99999999999\n"));
        assertThrows(IllegalArgumentException.class, () -> ToolsVersion.parse("5.2.99999999999"));
    }
}
