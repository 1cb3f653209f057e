package com.inkglyph.util;

import java.nio.ByteBuffer;
import java.nio.FloatBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class FloatArrayCodec {

    public static byte[] toBytes(float[] scores) {
        if (scores == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(scores.length * Float.BYTES);
        buffer.asFloatBuffer().put(scores);
        return buffer.array();
    }

    public static float[] fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        FloatBuffer buffer = ByteBuffer.wrap(bytes).asFloatBuffer();
        float[] scores = new float[buffer.remaining()];
        buffer.get(scores);
        return scores;
    }

    /**
     * Lowercase hex SHA-256 of the big-endian float encoding.
     */
    public static String sha256Hex(float[] values) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(toBytes(values));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1)
                    hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
