package io.poolflow.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ByteSizesTest {
    @Test
    void parses_plain_and_suffixed_sizes() {
        assertEquals(1000, ByteSizes.parse("1000"));
        assertEquals(512L * 1024 * 1024, ByteSizes.parse("512M"));
        assertEquals(20L << 30, ByteSizes.parse("20G"));
        assertEquals(1536, ByteSizes.parse("1.5k"));
        assertEquals(1L << 40, ByteSizes.parse("1TiB"));
        assertEquals(4096, ByteSizes.parse(" 4KB "));
    }

    @Test
    void rejects_garbage() {
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse("lots"));
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse("-5M"));
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse(""));
        assertThrows(IllegalArgumentException.class, () -> ByteSizes.parse("9999999T"));
    }

    @Test
    void formats_with_largest_unit() {
        assertEquals("900", ByteSizes.format(900));
        assertEquals("1K", ByteSizes.format(1024));
        assertEquals("1.5G", ByteSizes.format(3L << 29));
        assertEquals("unbounded", ByteSizes.format(Long.MAX_VALUE));
    }
}
