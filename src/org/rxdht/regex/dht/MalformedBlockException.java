/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

/**
 * Thrown when bytes received as a block are not a well formed block.
 */
public class MalformedBlockException extends Exception {

    private static final long serialVersionUID = 1L;

    public MalformedBlockException(String msg) {
        super(msg);
    }

    public MalformedBlockException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
