/* @LICENSE@
 */

package org.rxdht.regex.dht;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Collections;

import org.rxdht.regex.AbstractRxTestCase;
import org.rxdht.regex.BlockEdge;
import org.rxdht.regex.HashCode;

public class BlockEvaluatorTestCase extends AbstractRxTestCase {

    public BlockEvaluatorTestCase(String name) {
        super(name);
    }

    private BlockEvaluator evaluator;

    protected void setUp() throws Exception {
        super.setUp();
        evaluator = new BlockEvaluator();
    }

    private static byte[] xquery(String rest) {
        byte[] b = rest.getBytes(StandardCharsets.UTF_8);
        byte[] ret = new byte[b.length + 1];
        System.arraycopy(b, 0, ret, 0, b.length);
        return ret;
    }

    private static byte[] block(String proof, boolean accepting, String label, String dest) {
        return RegexBlock.create(proof, accepting,
            Collections.singletonList(new BlockEdge(label, HashCode.of(dest))));
    }

    public void testRegexRequests() {
        HashCode key = HashCode.of("he");
        assertEquals(Evaluation.REQUEST_VALID, evaluator.evaluate(BlockType.REGEX, key, null, null));
        assertEquals(Evaluation.REQUEST_VALID,
            evaluator.evaluate(BlockType.REGEX, key, xquery("llo"), null));
        assertEquals(Evaluation.REQUEST_VALID,
            evaluator.evaluate(BlockType.REGEX, key, new byte[0], null));
        assertEquals(Evaluation.REQUEST_INVALID,
            evaluator.evaluate(BlockType.REGEX, key, "llo".getBytes(StandardCharsets.UTF_8), null));
    }

    public void testRegexReplies() {
        HashCode key = HashCode.of("he");
        byte[] he = block("he", false, "l", "hel");

        assertEquals(Evaluation.VALID, evaluator.evaluate(BlockType.REGEX, key, xquery("llo"), he));
        assertEquals(Evaluation.DUPLICATE, evaluator.evaluate(BlockType.REGEX, key, xquery("llo"), he));

        BlockEvaluator fresh = new BlockEvaluator();
        assertEquals(Evaluation.INVALID,
            fresh.evaluate(BlockType.REGEX, HashCode.of("hel"), null, he));
        assertEquals(Evaluation.IRRELEVANT, fresh.evaluate(BlockType.REGEX, key, xquery("x"), he));
        assertEquals(Evaluation.IRRELEVANT, fresh.evaluate(BlockType.REGEX, key, xquery(""), he));
        assertEquals(Evaluation.INVALID,
            fresh.evaluate(BlockType.REGEX, key, null, new byte[] { 1, 2, 3 }));
        assertEquals(Evaluation.VALID, fresh.evaluate(BlockType.REGEX, null, null, he));
    }

    public void testAcceptingRegexReply() {
        byte[] hello = RegexBlock.create("hello", true, Collections.<BlockEdge>emptyList());
        HashCode key = HashCode.of("hello");
        assertEquals(Evaluation.VALID, evaluator.evaluate(BlockType.REGEX, key, xquery(""), hello));
        assertEquals(Evaluation.IRRELEVANT,
            new BlockEvaluator().evaluate(BlockType.REGEX, key, xquery("o"), hello));
    }

    public void testAccept() throws Exception {
        KeyPair keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        HashCode key = HashCode.of("hello");
        long future = System.currentTimeMillis() + 60 * 1000L;
        byte[] data = AcceptBlock.create(keyPair, key, future);

        assertEquals(Evaluation.REQUEST_VALID,
            evaluator.evaluate(BlockType.REGEX_ACCEPT, key, null, null));
        assertEquals(Evaluation.REQUEST_INVALID,
            evaluator.evaluate(BlockType.REGEX_ACCEPT, key, xquery(""), null));

        assertEquals(Evaluation.VALID, evaluator.evaluate(BlockType.REGEX_ACCEPT, key, null, data));
        assertEquals(Evaluation.DUPLICATE, evaluator.evaluate(BlockType.REGEX_ACCEPT, key, null, data));

        BlockEvaluator fresh = new BlockEvaluator();
        assertEquals(Evaluation.INVALID,
            fresh.evaluate(BlockType.REGEX_ACCEPT, HashCode.of("hell"), null, data));

        byte[] expired = AcceptBlock.create(keyPair, key, System.currentTimeMillis() - 1000L);
        assertEquals(Evaluation.INVALID, fresh.evaluate(BlockType.REGEX_ACCEPT, key, null, expired));

        byte[] tampered = data.clone();
        tampered[AcceptBlock.SIZE - 1] ^= 1;
        assertEquals(Evaluation.INVALID, fresh.evaluate(BlockType.REGEX_ACCEPT, key, null, tampered));

        byte[] purpose = data.clone();
        purpose[7] = 19;
        assertEquals(Evaluation.INVALID, fresh.evaluate(BlockType.REGEX_ACCEPT, key, null, purpose));

        assertEquals(Evaluation.INVALID,
            fresh.evaluate(BlockType.REGEX_ACCEPT, key, null, new byte[10]));
    }
}
