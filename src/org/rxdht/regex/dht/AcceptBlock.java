/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.Signature;
import java.util.Arrays;

import org.rxdht.regex.HashCode;

/**
 * A peer's signed statement that it accepts at the state with a given key.
 * Fixed size, big-endian:
 * <pre>
 * u32 purpose_size     (80)
 * u32 purpose          (18)
 * u64 expiration       microseconds since the epoch
 * 64  state key
 * 32  Ed25519 public key of the peer
 * 64  Ed25519 signature over the first 80 bytes
 * </pre>
 */
public final class AcceptBlock {

    public static final int PURPOSE_REGEX_ACCEPT = 18;
    public static final int SIGNED_SIZE = 4 + 4 + 8 + HashCode.SIZE;
    public static final int SIGNATURE_SIZE = 64;
    public static final int SIZE = SIGNED_SIZE + PeerIdentity.SIZE + SIGNATURE_SIZE;

    private final int purpose;
    private final long expirationMicros;
    private final HashCode key;
    private final PeerIdentity peer;
    private final byte[] signed;
    private final byte[] signature;

    private AcceptBlock(int purpose, long expirationMicros, HashCode key, PeerIdentity peer,
            byte[] signed, byte[] signature) {
        this.purpose = purpose;
        this.expirationMicros = expirationMicros;
        this.key = key;
        this.peer = peer;
        this.signed = signed;
        this.signature = signature;
    }

    /**
     * Signs a claim on <code>key</code> with the peer's key pair.
     */
    public static byte[] create(KeyPair keyPair, HashCode key, long expirationMillis) {
        ByteBuffer buf = ByteBuffer.allocate(SIZE);
        buf.putInt(SIGNED_SIZE);
        buf.putInt(PURPOSE_REGEX_ACCEPT);
        buf.putLong(expirationMillis * 1000L);
        buf.put(key.toByteArray());
        buf.put(PeerIdentity.of(keyPair.getPublic()).toByteArray());
        try {
            Signature sig = Signature.getInstance("Ed25519");
            sig.initSign(keyPair.getPrivate());
            sig.update(buf.array(), 0, SIGNED_SIZE);
            buf.put(sig.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot sign accept block", e);
        }
        assert !buf.hasRemaining();
        return buf.array();
    }

    public static AcceptBlock parse(byte[] data) throws MalformedBlockException {
        if (data == null || data.length != SIZE) {
            throw new MalformedBlockException("accept block must be " + SIZE + " bytes, not "
                + (data == null ? 0 : data.length));
        }
        ByteBuffer buf = ByteBuffer.wrap(data);
        int purposeSize = buf.getInt();
        if (purposeSize != SIGNED_SIZE) {
            throw new MalformedBlockException("bad signed size " + purposeSize);
        }
        int purpose = buf.getInt();
        long expiration = buf.getLong();
        HashCode key = HashCode.fromBytes(data, buf.position());
        PeerIdentity peer = PeerIdentity.fromBytes(data, SIGNED_SIZE);
        return new AcceptBlock(purpose, expiration, key, peer,
            Arrays.copyOf(data, SIGNED_SIZE),
            Arrays.copyOfRange(data, SIGNED_SIZE + PeerIdentity.SIZE, SIZE));
    }

    public int purpose() {
        return purpose;
    }

    public long expirationMicros() {
        return expirationMicros;
    }

    public boolean isExpired(long nowMillis) {
        return expirationMicros < nowMillis * 1000L;
    }

    public HashCode key() {
        return key;
    }

    public PeerIdentity peer() {
        return peer;
    }

    /**
     * Checks the signature against the embedded public key.
     */
    public boolean verify() {
        try {
            Signature sig = Signature.getInstance("Ed25519");
            sig.initVerify(peer.toPublicKey());
            sig.update(signed);
            return sig.verify(signature);
        } catch (GeneralSecurityException e) {
            // an unusable public key can't have signed anything
            return false;
        }
    }

    @Override
    public String toString() {
        return "AcceptBlock[" + key + " by " + peer + "]";
    }
}
