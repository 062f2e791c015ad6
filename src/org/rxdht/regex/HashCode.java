/*
 * @LICENSE@
 */

package org.rxdht.regex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * An immutable 512 bit SHA-512 digest, used as a DHT key.
 */
public final class HashCode {

    /** digest size in bytes */
    public static final int SIZE = 64;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bits;

    private HashCode(byte[] bits) {
        assert bits.length == SIZE;
        this.bits = bits;
    }

    /**
     * Hashes the UTF-8 encoding of <code>s</code>.
     */
    public static HashCode of(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        return of(bytes, 0, bytes.length);
    }

    public static HashCode of(byte[] data, int offset, int length) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-512");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 unavailable", e);
        }
        md.update(data, offset, length);
        return new HashCode(md.digest());
    }

    /**
     * Wraps 64 bytes starting at <code>offset</code> (copied).
     */
    public static HashCode fromBytes(byte[] data, int offset) {
        if (offset < 0 || data.length - offset < SIZE) {
            throw new IllegalArgumentException("need " + SIZE + " bytes at offset " + offset);
        }
        return new HashCode(Arrays.copyOfRange(data, offset, offset + SIZE));
    }

    public byte[] toByteArray() {
        return bits.clone();
    }

    void copyTo(byte[] dst, int offset) {
        System.arraycopy(bits, 0, dst, offset, SIZE);
    }

    public String toHexString() {
        StringBuilder sb = new StringBuilder(2 * SIZE);
        for (byte b : bits) {
            sb.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return sb.toString();
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashCode)) return false;
        return Arrays.equals(bits, ((HashCode) o).bits);
    }

    /**
     * The first eight hex digits, enough for log output.
     */
    @Override
    public String toString() {
        return toHexString().substring(0, 8);
    }
}
