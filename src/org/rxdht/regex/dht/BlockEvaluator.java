/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.BlockEdge;
import org.rxdht.regex.HashCode;

/**
 * Checks requests and replies for the two block types. An evaluator
 * remembers the replies it accepted, so one instance should serve a single
 * request: a reply seen twice is reported as {@link Evaluation#DUPLICATE}.
 * <p>
 * The extended query of a regex request is the rest of the search string,
 * NUL terminated. A regex reply is relevant only if the search can continue
 * from it: it accepts the empty rest, or one of its tokens starts the rest.
 */
public final class BlockEvaluator {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex.dht");
    private static final Level level = Level.FINER;

    private final Set<HashCode> seen = new HashSet<HashCode>();

    /**
     * @param query the key asked for, or <code>null</code> for a put
     * @param xquery the extended query; may be <code>null</code> or empty
     * @param reply the block to check, or <code>null</code> to check only
     *            the request
     */
    public Evaluation evaluate(BlockType type, HashCode query, byte[] xquery, byte[] reply) {
        Evaluation ret;
        switch (type) {
        case REGEX:
            ret = evaluateRegex(query, xquery, reply);
            break;
        case REGEX_ACCEPT:
            ret = evaluateAccept(query, xquery, reply);
            break;
        default:
            throw new AssertionError(type);
        }
        if (ret == Evaluation.VALID) {
            if (!seen.add(HashCode.of(reply, 0, reply.length))) ret = Evaluation.DUPLICATE;
        }
        if (logger.isLoggable(level)) {
            logger.log(level, type + " " + query + ": " + ret);
        }
        return ret;
    }

    private static Evaluation evaluateRegex(HashCode query, byte[] xquery, byte[] reply) {
        String rest = null;
        if (xquery != null && xquery.length > 0) {
            if (xquery[xquery.length - 1] != 0) return Evaluation.REQUEST_INVALID;
            rest = new String(xquery, 0, xquery.length - 1, StandardCharsets.UTF_8);
        }
        if (reply == null) return Evaluation.REQUEST_VALID;

        RegexBlock block;
        try {
            block = RegexBlock.parse(reply);
        } catch (MalformedBlockException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "malformed regex block: " + e.getMessage());
            }
            return Evaluation.INVALID;
        }
        if (query != null && !block.key().equals(query)) return Evaluation.INVALID;
        if (rest == null) return Evaluation.VALID;
        if (block.isAccepting() && rest.length() == 0) return Evaluation.VALID;
        for (BlockEdge e : block.edges()) {
            if (rest.startsWith(e.label())) return Evaluation.VALID;
        }
        return Evaluation.IRRELEVANT;
    }

    private static Evaluation evaluateAccept(HashCode query, byte[] xquery, byte[] reply) {
        if (xquery != null && xquery.length > 0) return Evaluation.REQUEST_INVALID;
        if (reply == null) return Evaluation.REQUEST_VALID;

        AcceptBlock block;
        try {
            block = AcceptBlock.parse(reply);
        } catch (MalformedBlockException e) {
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "malformed accept block: " + e.getMessage());
            }
            return Evaluation.INVALID;
        }
        if (block.purpose() != AcceptBlock.PURPOSE_REGEX_ACCEPT) return Evaluation.INVALID;
        if (query != null && !block.key().equals(query)) return Evaluation.INVALID;
        if (block.isExpired(System.currentTimeMillis())) return Evaluation.INVALID;
        if (!block.verify()) return Evaluation.INVALID;
        return Evaluation.VALID;
    }
}
