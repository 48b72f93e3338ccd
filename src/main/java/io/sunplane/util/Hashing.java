package io.sunplane.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashing {
    private static final int FNV32_OFFSET = 0x811c9dc5;
    private static final int FNV32_PRIME = 0x01000193;

    private Hashing() {
    }

    public static String sha256Hex(byte[] raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw == null ? new byte[0] : raw));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * FNV-1a over the UTF-8 bytes of {@code value}, returned as an unsigned 32-bit value.
     */
    public static long fnv1a32(String value) {
        int hash = FNV32_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV32_PRIME;
        }
        return Integer.toUnsignedLong(hash);
    }
}
