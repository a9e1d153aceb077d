/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilTest {

    @Test
    void testMd5Hex_isDeterministicAndValid() {
        String h1 = HashingUtil.md5Hex("authentication|login");
        String h2 = HashingUtil.md5Hex("authentication|login");

        assertEquals(h1, h2, "MD5 must be deterministic");
        assertEquals(32, h1.length(), "MD5 hex string must be 32 chars long");
        assertTrue(HashingUtil.isMd5Hex(h1), "Generated hash must validate as MD5 hex");
        assertNotEquals(h1, HashingUtil.md5Hex("authentication|logout"), "Different input must hash differently");
    }

    @Test
    void testIsMd5Hex_rejectsMalformedInput() {
        assertFalse(HashingUtil.isMd5Hex(null));
        assertFalse(HashingUtil.isMd5Hex("abc"));
        assertFalse(HashingUtil.isMd5Hex("zz".repeat(16)), "Non-hex characters must be rejected");
    }

    @Test
    void testSha256_lengthAndDeterminism() {
        assertEquals(32, HashingUtil.sha256("x").length);
        assertArrayEquals(HashingUtil.sha256("x"), HashingUtil.sha256("x"));
    }

    @Test
    void testXxHash64_isStable() {
        assertEquals(HashingUtil.xxHash64("structural|GENERAL|3"), HashingUtil.xxHash64("structural|GENERAL|3"));
        assertNotEquals(HashingUtil.xxHash64("a"), HashingUtil.xxHash64("b"));
    }
}
