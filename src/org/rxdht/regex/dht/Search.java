/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.Automaton;
import org.rxdht.regex.BlockEdge;
import org.rxdht.regex.HashCode;

/**
 * Looks for peers whose announced regex matches a string, by walking the
 * published automata one DHT get per edge. The search keeps running, and
 * may report the same peer more than once, until it is cancelled.
 */
public final class Search {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex.dht");

    public interface Handler {
        /**
         * @param peer a peer announcing a regex that matches the string
         * @param key the accepting state the peer claimed
         */
        void found(PeerIdentity peer, HashCode key);
    }

    /*
     * how far into the string a branch of the search has got
     */
    private final class Context {
        final int position;

        Context(int position) {
            this.position = position;
        }

        public void result(HashCode key, byte[] data) {
            if (cancelled) return;
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "get result for " + key + " at " + position + " of `" + string + "'");
            }
            List<byte[]> cached = results.get(key);
            if (cached == null) {
                cached = new ArrayList<byte[]>();
                results.put(key, cached);
            }
            cached.add(data);
            process(key, data);
        }

        void process(HashCode key, byte[] data) {
            RegexBlock block;
            try {
                block = RegexBlock.parse(data);
            } catch (MalformedBlockException e) {
                logger.log(Level.WARNING, "dropping malformed block under " + key, e);
                return;
            }
            if (position == string.length()) {
                if (block.isAccepting()) {
                    findPath(key);
                } else if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "string consumed at non-accepting " + key);
                }
                return;
            }
            nextEdge(block);
        }

        /*
         * follows the longest token the rest of the string starts with
         */
        private void nextEdge(RegexBlock block) {
            String rest = string.substring(position);
            BlockEdge longest = null;
            for (BlockEdge e : block.edges()) {
                String token = e.label();
                if (token.length() > rest.length() || !rest.startsWith(token)) continue;
                if (longest == null || token.length() > longest.label().length()) longest = e;
            }
            if (longest == null || longest.label().length() == 0) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "no edge matches `" + rest + "'");
                }
                return;
            }
            final Context next = new Context(position + longest.label().length());
            final HashCode hash = longest.destination();
            if (!requested.add(hash)) {
                List<byte[]> cached = results.get(hash);
                if (cached == null) return;
                // later results reach the pending get's own context
                for (byte[] data : new ArrayList<byte[]>(cached)) {
                    next.process(hash, data);
                    if (cancelled) return;
                }
                return;
            }
            get(hash, next);
        }
    }

    private final Dht dht;
    private final String string;
    private final Handler handler;

    private final Set<HashCode> requested = new HashSet<HashCode>();
    private final Map<HashCode, List<byte[]>> results = new HashMap<HashCode, List<byte[]>>();
    private final List<Dht.GetHandle> gets = new ArrayList<Dht.GetHandle>();
    private final Set<HashCode> acceptRequested = new HashSet<HashCode>();
    private boolean cancelled;

    private Search(Dht dht, String string, Handler handler) {
        this.dht = dht;
        this.string = string;
        this.handler = handler;
    }

    public static Search start(Dht dht, String string, Handler handler) {
        if (dht == null || string == null || handler == null) {
            throw new NullPointerException("dht, string and handler required");
        }
        Search s = new Search(dht, string, handler);
        HashCode key = Automaton.firstKey(string);
        int size = Math.min(string.length(), Automaton.INITIAL_BYTES);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "initial key for `" + string + "' is " + key
                + " (based on `" + string.substring(0, size) + "')");
        }
        s.requested.add(key);
        s.get(key, s.new Context(size));
        return s;
    }

    private void get(HashCode key, final Context ctx) {
        if (cancelled) return;
        byte[] rest = string.substring(ctx.position).getBytes(StandardCharsets.UTF_8);
        byte[] xquery = new byte[rest.length + 1];
        System.arraycopy(rest, 0, xquery, 0, rest.length);
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "get " + key + " at " + ctx.position + " of `" + string + "'");
        }
        Dht.GetHandle h = dht.get(key, BlockType.REGEX, Announcement.REPLICATION, xquery,
            new Dht.ResultHandler() {
                public void result(HashCode key, BlockType type, byte[] data) {
                    ctx.result(key, data);
                }
            });
        if (cancelled) {
            h.cancel();
        } else {
            gets.add(h);
        }
    }

    private void findPath(HashCode key) {
        if (!acceptRequested.add(key)) return;
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "accepting state " + key + " found for `" + string + "'");
        }
        Dht.GetHandle h = dht.get(key, BlockType.REGEX_ACCEPT, Announcement.REPLICATION, null,
            new Dht.ResultHandler() {
                public void result(HashCode key, BlockType type, byte[] data) {
                    accepted(key, data);
                }
            });
        if (cancelled) {
            h.cancel();
        } else {
            gets.add(h);
        }
    }

    private void accepted(HashCode key, byte[] data) {
        if (cancelled) return;
        AcceptBlock block;
        try {
            block = AcceptBlock.parse(data);
        } catch (MalformedBlockException e) {
            logger.log(Level.WARNING, "dropping malformed accept block under " + key, e);
            return;
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "`" + string + "' accepted by " + block.peer());
        }
        handler.found(block.peer(), key);
    }

    public String string() {
        return string;
    }

    /**
     * Stops every outstanding get and drops cached results. Results
     * arriving afterwards are ignored.
     */
    public void cancel() {
        if (cancelled) return;
        cancelled = true;
        for (Dht.GetHandle h : new ArrayList<Dht.GetHandle>(gets)) {
            h.cancel();
        }
        gets.clear();
        results.clear();
        requested.clear();
        acceptRequested.clear();
    }
}
