/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import java.security.KeyPair;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Automaton;
import org.rxdht.regex.BlockEdge;
import org.rxdht.regex.HashCode;
import org.rxdht.regex.KeyIterator;

/**
 * A regex published into the DHT on behalf of a peer. The DFA is compiled
 * once; {@link #reannounce()} publishes the same blocks again, typically
 * before their expiration.
 */
public final class Announcement {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex.dht");

    public static final int REPLICATION = 5;
    public static final long TTL_MILLIS = 60L * 60L * 1000L;

    private final Dht dht;
    private final KeyPair keyPair;
    private final String regex;
    private Automaton dfa;

    private long blocksStored;
    private long blockBytesStored;
    private long acceptBlocksStored;

    private Announcement(Dht dht, KeyPair keyPair, String regex, Automaton dfa) {
        this.dht = dht;
        this.keyPair = keyPair;
        this.regex = regex;
        this.dfa = dfa;
    }

    /**
     * Compiles <code>regex</code> and publishes its reachable states.
     *
     * @param keyPair the announcing peer's Ed25519 key pair
     * @param compression longest edge label to create, <code>0</code> for no
     *            limit, <code>1</code> for none
     * @throws java.util.regex.PatternSyntaxException if the regex is malformed
     */
    public static Announcement announce(Dht dht, KeyPair keyPair, String regex, int compression) {
        if (dht == null || keyPair == null) {
            throw new NullPointerException("dht and key pair required");
        }
        Announcement a = new Announcement(dht, keyPair, regex, Automaton.compile(regex, compression));
        a.reannounce();
        return a;
    }

    public void reannounce() {
        if (dfa == null) {
            throw new IllegalStateException("announcement of `" + regex + "' was cancelled");
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "announcing `" + regex + "'");
        }
        final long expiration = System.currentTimeMillis() + TTL_MILLIS;
        dfa.iterateReachableEdges(new KeyIterator() {
            public boolean visit(HashCode key, String proof, boolean accepting, List<BlockEdge> edges) {
                put(key, proof, accepting, edges, expiration);
                return true;
            }
        });
    }

    private void put(HashCode key, String proof, boolean accepting, List<BlockEdge> edges,
            long expiration) {
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "put " + key + " `" + proof + "'"
                + (accepting ? " (accepting)" : "") + " edges " + edges);
        }
        byte[] block;
        try {
            block = RegexBlock.create(proof, accepting, edges);
        } catch (IllegalArgumentException e) {
            logger.log(Level.WARNING, "cannot encode state " + key + " of `" + regex + "'", e);
            return;
        }
        if (accepting) {
            dht.put(key, BlockType.REGEX_ACCEPT, REPLICATION,
                AcceptBlock.create(keyPair, key, expiration), expiration);
            acceptBlocksStored++;
        }
        dht.put(key, BlockType.REGEX, REPLICATION, block, expiration);
        blocksStored++;
        blockBytesStored += block.length;
    }

    /**
     * Drops the compiled automaton; the announcement can't be repeated
     * afterwards. Blocks already stored expire on their own.
     */
    public void cancel() {
        dfa = null;
    }

    public String regex() {
        return regex;
    }

    public long blocksStored() {
        return blocksStored;
    }

    public long blockBytesStored() {
        return blockBytesStored;
    }

    public long acceptBlocksStored() {
        return acceptBlocksStored;
    }
}
