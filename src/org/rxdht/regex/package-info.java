/*
 * @LICENSE@
 */

/**
 * <h3><b>rxdht</b> - regex automata with canonical state keys, for routing
 * string lookups through a distributed hash table.</h3>
 * <p>
 * <h4>Motivation.</h4>
 * <p>
 * A peer that wants to be found by anyone whose string matches its regex
 * compiles the regex into a minimal DFA and publishes one block per state.
 * Each state is named by its <em>proof</em>, a regex describing every path
 * from the start state to it, and keyed by the SHA-512 of that proof. A
 * searcher never sees the regex: it hashes the first characters of its
 * string, fetches the block under that key and follows the edge whose label
 * its string continues with, one lookup per edge, until it reaches an
 * accepting block.
 * <p>
 * Because proofs are computed by a fixed, deterministic sequence of
 * rewrites, two peers announcing equivalent regexes usually publish
 * identical keys for the shared parts of their automata.
 * <p>
 * <h4>Syntax.</h4>
 * <p>
 * Literal characters, implicit concatenation, <code>|</code>,
 * <code>*</code>, <code>+</code>, <code>?</code> and grouping parentheses.
 * There are no escapes, classes or anchors; <code>(</code>, <code>)</code>,
 * <code>|</code>, <code>*</code>, <code>+</code> and <code>?</code> are
 * always operators. An input matches only if all of it matches.
 * <p>
 * <h4>Usage.</h4>
 * <p>
 * <pre>
 * Automaton dfa = Automaton.compile("hello(world|there)", 0);
 * dfa.eval("hellothere");             // true
 * dfa.iterateReachableEdges(iterator); // blocks to publish
 * </pre>
 * The {@linkplain org.rxdht.regex.dht dht} subpackage holds the block
 * format, its validation, and the announce and search protocols built on
 * top of a {@linkplain org.rxdht.regex.dht.Dht DHT} abstraction.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * Construction steps log to the <code>java.util.logging</code> logger
 * <code>"org.rxdht.regex"</code> at <code>FINER</code> and
 * <code>FINEST</code>; announce and search progress goes to
 * <code>"org.rxdht.regex.dht"</code> at <code>FINE</code>.
 */
package org.rxdht.regex;

