/*
 * PatternMemory — Semantic Pattern Memory Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.patternmemory.core.util;

import net.jpountz.xxhash.XXHashFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = digest("MD5");
    private static final ThreadLocal<MessageDigest> SHA256_DIGEST = digest("SHA-256");

    private HashingUtil() {}

    private static ThreadLocal<MessageDigest> digest(String algorithm) {
        return ThreadLocal.withInitial(() -> {
            try {
                return MessageDigest.getInstance(algorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(algorithm + " algorithm not available", e);
            }
        });
    }

    public static byte[] md5(String input) {
        MessageDigest md = MD5_DIGEST.get();
        md.reset();
        return md.digest(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String md5Hex(String input) {
        return HexFormat.of().formatHex(md5(input));
    }

    public static byte[] sha256(String input) {
        MessageDigest md = SHA256_DIGEST.get();
        md.reset();
        return md.digest(input.getBytes(StandardCharsets.UTF_8));
    }

    public static long xxHash64(String input) {
        byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static boolean isMd5Hex(String hex) {
        if (hex == null || hex.length() != 32) return false;
        try {
            HexFormat.of().parseHex(hex);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
