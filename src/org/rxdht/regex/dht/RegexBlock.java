/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.rxdht.regex.BlockEdge;
import org.rxdht.regex.HashCode;

/**
 * The wire form of one published automaton state.
 * <p>
 * All integers are big-endian:
 * <pre>
 * u16 proof_len
 * i16 is_accepting
 * u16 num_edges
 * u16 num_destinations
 * num_destinations * 64 byte destination keys (no repeats)
 * num_edges * { u16 destination_index, u16 token_len }
 * proof_len bytes of proof
 * the token bytes, in edge order
 * </pre>
 * Strings are UTF-8; lengths count bytes.
 */
public final class RegexBlock {

    public static final int MAX_DESTINATIONS = 1024;

    static final int HEADER_SIZE = 8;
    static final int EDGE_INFO_SIZE = 4;

    private static final int U16_MAX = 0xffff;

    private final String proof;
    private final boolean accepting;
    private final List<BlockEdge> edges;

    private RegexBlock(String proof, boolean accepting, List<BlockEdge> edges) {
        this.proof = proof;
        this.accepting = accepting;
        this.edges = edges;
    }

    public String proof() {
        return proof;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public List<BlockEdge> edges() {
        return edges;
    }

    /**
     * The key the block is stored under: the hash of its proof.
     */
    public HashCode key() {
        return HashCode.of(proof);
    }

    /**
     * Encodes a state.
     *
     * @throws IllegalArgumentException if a length does not fit its field or
     *             there are more than {@link #MAX_DESTINATIONS} distinct
     *             destinations
     */
    public static byte[] create(String proof, boolean accepting, List<BlockEdge> edges) {
        byte[] proofBytes = proof.getBytes(StandardCharsets.UTF_8);
        if (proofBytes.length > U16_MAX) {
            throw new IllegalArgumentException("proof too long: " + proofBytes.length + " bytes");
        }
        if (edges.size() > U16_MAX) {
            throw new IllegalArgumentException("too many edges: " + edges.size());
        }

        Map<HashCode, Integer> destinations = new LinkedHashMap<HashCode, Integer>();
        byte[][] tokens = new byte[edges.size()][];
        int[] indices = new int[edges.size()];
        int tokenBytes = 0;
        for (int i = 0; i < edges.size(); ++i) {
            BlockEdge e = edges.get(i);
            Integer index = destinations.get(e.destination());
            if (index == null) {
                index = destinations.size();
                if (index >= MAX_DESTINATIONS) {
                    throw new IllegalArgumentException(
                        "more than " + MAX_DESTINATIONS + " destinations");
                }
                destinations.put(e.destination(), index);
            }
            indices[i] = index;
            tokens[i] = e.label().getBytes(StandardCharsets.UTF_8);
            if (tokens[i].length > U16_MAX) {
                throw new IllegalArgumentException("token too long: " + tokens[i].length + " bytes");
            }
            tokenBytes += tokens[i].length;
        }

        int size = HEADER_SIZE + destinations.size() * HashCode.SIZE
            + edges.size() * EDGE_INFO_SIZE + proofBytes.length + tokenBytes;
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putShort((short) proofBytes.length);
        buf.putShort((short) (accepting ? 1 : 0));
        buf.putShort((short) edges.size());
        buf.putShort((short) destinations.size());
        for (HashCode h : destinations.keySet()) {
            buf.put(h.toByteArray());
        }
        for (int i = 0; i < edges.size(); ++i) {
            buf.putShort((short) indices[i]);
            buf.putShort((short) tokens[i].length);
        }
        buf.put(proofBytes);
        for (byte[] token : tokens) {
            buf.put(token);
        }
        assert !buf.hasRemaining();
        return buf.array();
    }

    /**
     * Decodes a block, checking that the declared lengths account for every
     * byte.
     */
    public static RegexBlock parse(byte[] data) throws MalformedBlockException {
        if (data == null || data.length < HEADER_SIZE) {
            throw new MalformedBlockException("block shorter than its header");
        }
        ByteBuffer buf = ByteBuffer.wrap(data);
        int proofLen = buf.getShort() & U16_MAX;
        boolean accepting = buf.getShort() != 0;
        int numEdges = buf.getShort() & U16_MAX;
        int numDestinations = buf.getShort() & U16_MAX;

        long fixed = (long) HEADER_SIZE + (long) numDestinations * HashCode.SIZE
            + (long) numEdges * EDGE_INFO_SIZE + proofLen;
        if (fixed > data.length) {
            throw new MalformedBlockException("block truncated: " + data.length + " bytes, header needs " + fixed);
        }
        try {
            HashCode[] destinations = new HashCode[numDestinations];
            for (int i = 0; i < numDestinations; ++i) {
                destinations[i] = HashCode.fromBytes(data, buf.position());
                buf.position(buf.position() + HashCode.SIZE);
            }
            int[] indices = new int[numEdges];
            int[] tokenLens = new int[numEdges];
            long total = fixed;
            for (int i = 0; i < numEdges; ++i) {
                indices[i] = buf.getShort() & U16_MAX;
                tokenLens[i] = buf.getShort() & U16_MAX;
                if (indices[i] >= numDestinations) {
                    throw new MalformedBlockException(
                        "edge " + i + " points at destination " + indices[i] + " of " + numDestinations);
                }
                total += tokenLens[i];
            }
            if (total != data.length) {
                throw new MalformedBlockException("block size " + data.length + ", expected " + total);
            }
            String proof = decode(buf, proofLen);
            List<BlockEdge> edges = new ArrayList<BlockEdge>(numEdges);
            for (int i = 0; i < numEdges; ++i) {
                edges.add(new BlockEdge(decode(buf, tokenLens[i]), destinations[indices[i]]));
            }
            return new RegexBlock(proof, accepting, Collections.unmodifiableList(edges));
        } catch (BufferUnderflowException e) {
            throw new MalformedBlockException("block truncated", e);
        }
    }

    private static String decode(ByteBuffer buf, int len) throws MalformedBlockException {
        ByteBuffer slice = buf.slice();
        slice.limit(len);
        buf.position(buf.position() + len);
        try {
            CharBuffer cb = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(slice);
            return cb.toString();
        } catch (CharacterCodingException e) {
            throw new MalformedBlockException("string is not UTF-8", e);
        }
    }

    /**
     * @return the hash of the proof carried in <code>data</code>
     */
    public static HashCode key(byte[] data) throws MalformedBlockException {
        return parse(data).key();
    }

    /**
     * Reads only the accepting flag; <code>false</code> for anything too
     * short to be a block.
     */
    public static boolean isAccepting(byte[] data) {
        if (data == null || data.length < HEADER_SIZE) return false;
        return ByteBuffer.wrap(data, 2, 2).getShort() != 0;
    }

    @Override
    public String toString() {
        return "RegexBlock[" + proof + (accepting ? ", accepting" : "") + ", " + edges + "]";
    }
}
