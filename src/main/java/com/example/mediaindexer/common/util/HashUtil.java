package com.example.mediaindexer.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;

public final class HashUtil {

    private static final int SHORT_DIGEST_BYTES = 16;

    private HashUtil() {
    }

    public static String md5Hex(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        return md5Hex(bytes, 0, bytes.length);
    }

    public static String md5Hex(byte[] data, int offset, int length) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            messageDigest.update(data, offset, length);
            byte[] bytes = messageDigest.digest();
            StringBuilder sb = new StringBuilder();
            for (byte b : bytes) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }

    /**
     * SHA-256 over the parts joined with ':', truncated to 16 bytes and encoded as URL-safe base64
     * without padding. Null parts hash as empty strings.
     */
    public static String shortSha256(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append(':');
            }
            joined.append(parts[i] == null ? "" : parts[i]);
        }
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("SHA-256");
            byte[] digest = messageDigest.digest(joined.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(Arrays.copyOf(digest, SHORT_DIGEST_BYTES));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }
}
