package work.mdflow.expand.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ByteSizesTest {
    @Test
    void formatsHumanReadableSizes() {
        assertEquals("512 bytes", ByteSizes.format(512));
        assertEquals("1.5KB", ByteSizes.format(1536));
        assertEquals("10.0MB", ByteSizes.format(10L * 1024 * 1024));
    }

    @Test
    void parsesUnits() {
        assertEquals(2048L, ByteSizes.parse("2KB"));
        assertEquals(5L * 1024 * 1024, ByteSizes.parse("5mb"));
        assertEquals(100L, ByteSizes.parse("100B"));
        assertEquals(42L, ByteSizes.parse("42"));
    }

    @Test
    void rejectsInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse("lots"));
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse("-1KB"));
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse(""));
    }
}
