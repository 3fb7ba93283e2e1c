package work.lcod.forge.version;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class SemanticVersionTest {
    @Test
    void parsesAllComponents() {
        SemanticVersion version = SemanticVersion.parse("1.2.3-pre.4+abc1234");

        assertEquals(1, version.major());
        assertEquals(2, version.minor());
        assertEquals(3, version.patch());
        assertEquals(List.of("pre", "4"), version.prerelease());
        assertEquals(List.of("abc1234"), version.build());
        assertEquals("1.2.3-pre.4+abc1234", version.toString());
    }

    @Test
    void rejectsInvalidVersions() {
        for (String invalid : List.of("", "1", "1.2", "v1.2.3", "01.2.3", "1.2.3-", "1.2.3+", "1.2.3-01", "latest")) {
            assertFalse(SemanticVersion.canParse(invalid), invalid);
            assertThrows(VersionException.class, () -> SemanticVersion.parse(invalid), invalid);
        }
        assertFalse(SemanticVersion.canParse(null));
    }

    @Test
    void ordersByPrecedence() {
        List<String> ordered = List.of(
            "1.0.0-alpha",
            "1.0.0-alpha.1",
            "1.0.0-alpha.beta",
            "1.0.0-beta",
            "1.0.0-beta.2",
            "1.0.0-beta.11",
            "1.0.0-rc.1",
            "1.0.0",
            "1.0.1",
            "1.1.0",
            "2.0.0"
        );
        List<SemanticVersion> shuffled = new ArrayList<>();
        for (String value : ordered) {
            shuffled.add(SemanticVersion.parse(value));
        }
        Collections.reverse(shuffled);
        Collections.sort(shuffled);

        assertEquals(ordered, shuffled.stream().map(SemanticVersion::toString).toList());
    }

    @Test
    void ignoresBuildMetadataInComparison() {
        SemanticVersion left = SemanticVersion.parse("1.0.0+one");
        SemanticVersion right = SemanticVersion.parse("1.0.0+two");

        assertEquals(0, left.compareTo(right));
        assertFalse(left.lessThan(right));
    }

    @Test
    void incrementsReleases() {
        SemanticVersion version = SemanticVersion.parse("1.2.3+build");

        assertEquals("2.0.0", version.increment(UpdateType.MAJOR).toString());
        assertEquals("1.3.0", version.increment(UpdateType.MINOR).toString());
        assertEquals("1.2.4", version.increment(UpdateType.PATCH).toString());
    }

    @Test
    void incrementCompletesPrereleases() {
        assertEquals("2.0.0", SemanticVersion.parse("2.0.0-pre.1").increment(UpdateType.MAJOR).toString());
        assertEquals("1.3.0", SemanticVersion.parse("1.3.0-rc.1").increment(UpdateType.MINOR).toString());
        assertEquals("1.2.3", SemanticVersion.parse("1.2.3-rc.1").increment(UpdateType.PATCH).toString());
        assertEquals("2.0.0", SemanticVersion.parse("1.2.3-rc.1").increment(UpdateType.MAJOR).toString());
    }

    @Test
    void appendsPrereleaseAndBuild() {
        SemanticVersion version = SemanticVersion.of(0, 1, 0).withPrerelease("pre", "3").withBuild("deadbee");

        assertEquals("0.1.0-pre.3+deadbee", version.toString());
        assertTrue(version.isPrerelease());
        assertTrue(version.lessThan(SemanticVersion.of(0, 1, 0)));
        assertThrows(IllegalArgumentException.class, () -> version.withPrerelease("pre.3"));
    }

    @Test
    void reportsFirstDifferingComponent() {
        SemanticVersion base = SemanticVersion.parse("1.2.3");

        assertEquals(UpdateType.MAJOR, SemanticVersion.parse("2.0.0").differingComponent(base));
        assertEquals(UpdateType.MINOR, SemanticVersion.parse("1.3.0").differingComponent(base));
        assertEquals(UpdateType.PATCH, SemanticVersion.parse("1.2.4").differingComponent(base));
        assertNull(SemanticVersion.parse("1.2.3-rc.1").differingComponent(base));
    }
}
