/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

import org.rxdht.regex.HashCode;

/**
 * The distributed hash table announcements and searches talk to. Replies to
 * a get may arrive on any thread, at any time until the get is cancelled;
 * implementations are expected to validate replies before delivering them.
 */
public interface Dht {

    interface ResultHandler {
        void result(HashCode key, BlockType type, byte[] data);
    }

    interface GetHandle {
        /** stops delivery of further results */
        void cancel();
    }

    void put(HashCode key, BlockType type, int replication, byte[] data, long expirationMillis);

    /**
     * @param xquery extended query passed to the validators of the type, or
     *            <code>null</code>
     */
    GetHandle get(HashCode key, BlockType type, int replication, byte[] xquery,
            ResultHandler handler);
}
