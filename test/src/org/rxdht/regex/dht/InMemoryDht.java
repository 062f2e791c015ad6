/* @LICENSE@
 */

package org.rxdht.regex.dht;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxdht.regex.HashCode;

/**
 * A single node "DHT" for tests. Puts and gets are checked with a
 * {@link BlockEvaluator}, stored blocks are delivered synchronously from
 * {@link #get}, and later puts reach every live get for the same key and
 * type.
 */
final class InMemoryDht implements Dht {

    private static final Logger logger = Logger.getLogger("org.rxdht.regex.test");

    static final class Entry {
        final HashCode key;
        final BlockType type;
        final byte[] data;
        final long expirationMillis;

        Entry(HashCode key, BlockType type, byte[] data, long expirationMillis) {
            this.key = key;
            this.type = type;
            this.data = data;
            this.expirationMillis = expirationMillis;
        }
    }

    private final class Listener implements GetHandle {
        final HashCode key;
        final BlockType type;
        final byte[] xquery;
        final ResultHandler handler;
        final BlockEvaluator evaluator = new BlockEvaluator();
        boolean cancelled;

        Listener(HashCode key, BlockType type, byte[] xquery, ResultHandler handler) {
            this.key = key;
            this.type = type;
            this.xquery = xquery;
            this.handler = handler;
        }

        void offer(Entry e) {
            if (cancelled || e.type != type || !e.key.equals(key)) return;
            if (evaluator.evaluate(type, key, xquery, e.data) != Evaluation.VALID) return;
            delivered++;
            handler.result(e.key, e.type, e.data);
        }

        public void cancel() {
            if (cancelled) return;
            cancelled = true;
            listeners.remove(this);
        }
    }

    private final List<Entry> entries = new ArrayList<Entry>();
    private final List<Listener> listeners = new ArrayList<Listener>();

    int puts;
    int rejected;
    int gets;
    int delivered;

    public void put(HashCode key, BlockType type, int replication, byte[] data,
            long expirationMillis) {
        puts++;
        Evaluation eval = new BlockEvaluator().evaluate(type, key, null, data);
        if (eval != Evaluation.VALID) {
            logger.log(Level.FINE, "rejecting " + type + " put under " + key + ": " + eval);
            rejected++;
            return;
        }
        for (Entry e : entries) {
            if (e.type == type && e.key.equals(key) && Arrays.equals(e.data, data)) return;
        }
        Entry entry = new Entry(key, type, data, expirationMillis);
        entries.add(entry);
        for (Listener l : new ArrayList<Listener>(listeners)) {
            l.offer(entry);
        }
    }

    public GetHandle get(HashCode key, BlockType type, int replication, byte[] xquery,
            ResultHandler handler) {
        gets++;
        Listener l = new Listener(key, type, xquery, handler);
        if (l.evaluator.evaluate(type, key, xquery, null) != Evaluation.REQUEST_VALID) {
            logger.log(Level.FINE, "rejecting " + type + " get for " + key);
            l.cancelled = true;
            return l;
        }
        listeners.add(l);
        for (Entry e : new ArrayList<Entry>(entries)) {
            l.offer(e);
        }
        return l;
    }

    int size() {
        return entries.size();
    }

    int size(BlockType type) {
        int n = 0;
        for (Entry e : entries) {
            if (e.type == type) n++;
        }
        return n;
    }

    int liveGets() {
        return listeners.size();
    }

    boolean contains(HashCode key, BlockType type) {
        for (Entry e : entries) {
            if (e.type == type && e.key.equals(key)) return true;
        }
        return false;
    }
}
