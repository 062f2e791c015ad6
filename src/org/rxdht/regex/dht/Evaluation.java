/*
 * @LICENSE@
 */

package org.rxdht.regex.dht;

/**
 * Verdict of a {@link BlockEvaluator} on a request or a reply.
 */
public enum Evaluation {
    VALID,
    DUPLICATE,
    INVALID,
    IRRELEVANT,
    REQUEST_VALID,
    REQUEST_INVALID
}
