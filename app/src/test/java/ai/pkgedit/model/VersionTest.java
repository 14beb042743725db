package ai.pkgedit.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class VersionTest {

    @Test
    void parsesSemanticVersions() {
        var v = Version.parse("1.2.3-beta.1+build.5");

        assertEquals(1, v.major());
        assertEquals(List.of("beta", "1"), v.prerelease());
        assertEquals(List.of("build", "5"), v.build());
        assertTrue(v.isPrerelease());
        assertEquals("1.2.3-beta.1+build.5", v.toString());
    }

    @Test
    void rejectsNonSemver() {
        assertNull(Version.tryParse("1.2"));
        assertNull(Version.tryParse("01.2.3"));
        assertNull(Version.tryParse("release-1"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("x"));
    }

    @Test
    void acceptsTagPrefix() {
        assertEquals(Version.of(2, 0, 0), Version.fromTag("v2.0.0"));
        assertEquals(Version.of(2, 0, 0), Version.fromTag("2.0.0"));
        assertNull(Version.fromTag("vnext"));
    }

    @Test
    void ordersByPrecedence() {
        var ordered = List.of(
                "1.0.0-alpha", "1.0.0-alpha.1", "1.0.0-alpha.beta", "1.0.0-beta", "1.0.0-beta.2", "1.0.0-beta.11",
                "1.0.0-rc.1", "1.0.0", "1.0.1", "1.10.0", "2.0.0");
        var shuffled = new ArrayList<Version>();
        for (var s : ordered) {
            shuffled.add(Version.parse(s));
        }
        Collections.reverse(shuffled);
        Collections.sort(shuffled);

        assertEquals(ordered, shuffled.stream().map(Version::toString).toList());
    }

    @Test
    void buildMetadataOnlyBreaksTies() {
        var a = Version.parse("1.0.0+a");
        var b = Version.parse("1.0.0+b");

        assertTrue(a.compareTo(b) < 0);
        assertEquals(0, a.compareTo(Version.parse("1.0.0+a")));
        assertTrue(Version.parse("1.0.0-rc.1+z").compareTo(Version.parse("1.0.0+a")) < 0);
        assertEquals(2, new TreeSet<>(List.of(a, b, Version.parse("1.0.0+a"))).size());
    }

    @Test
    void componentsBeyondIntRangeAreNotVersions() {
        assertNull(Version.fromTag("v99999999999.0.0"));
        assertNull(Version.tryParse("1.99999999999.0"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("1.0.99999999999"));
    }

    @Test
    void hugeNumericPrereleaseIdentifiersCompare() {
        var small = Version.parse("1.0.0-99999999999999999999");
        var large = Version.parse("1.0.0-100000000000000000000");

        assertTrue(small.compareTo(large) < 0);
        assertTrue(Version.parse("1.0.0-007").compareTo(Version.parse("1.0.0-7")) != 0);
    }
}
