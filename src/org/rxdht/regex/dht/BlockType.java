/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

/**
 * Block types stored by announcements.
 */
public enum BlockType {

    /** one automaton state: proof, accepting flag and outgoing edges */
    REGEX,

    /** a peer's signed claim to accept at a state */
    REGEX_ACCEPT
}
