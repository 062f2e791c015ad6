/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * A peer, identified by its raw 32 byte Ed25519 public key.
 */
public final class PeerIdentity {

    public static final int SIZE = 32;

    /*
     * DER prefix of an X.509 SubjectPublicKeyInfo holding an Ed25519 key
     */
    private static final byte[] X509_PREFIX = {
        0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };

    private final byte[] key;

    private PeerIdentity(byte[] key) {
        this.key = key;
    }

    public static PeerIdentity of(PublicKey publicKey) {
        byte[] encoded = publicKey.getEncoded();
        if (!"Ed25519".equals(publicKey.getAlgorithm()) && !"EdDSA".equals(publicKey.getAlgorithm())) {
            throw new IllegalArgumentException("not an Ed25519 key: " + publicKey.getAlgorithm());
        }
        if (encoded.length != X509_PREFIX.length + SIZE) {
            throw new IllegalArgumentException("unexpected key encoding, " + encoded.length + " bytes");
        }
        return new PeerIdentity(Arrays.copyOfRange(encoded, X509_PREFIX.length, encoded.length));
    }

    static PeerIdentity fromBytes(byte[] data, int offset) {
        return new PeerIdentity(Arrays.copyOfRange(data, offset, offset + SIZE));
    }

    public byte[] toByteArray() {
        return key.clone();
    }

    PublicKey toPublicKey() throws GeneralSecurityException {
        byte[] encoded = Arrays.copyOf(X509_PREFIX, X509_PREFIX.length + SIZE);
        System.arraycopy(key, 0, encoded, X509_PREFIX.length, SIZE);
        return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(encoded));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerIdentity)) return false;
        return Arrays.equals(key, ((PeerIdentity) o).key);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("peer:");
        for (int i = 0; i < 4; ++i) {
            sb.append(String.format("%02x", key[i] & 0xff));
        }
        return sb.toString();
    }
}
