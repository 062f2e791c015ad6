/* @LICENSE@
 */

package org.rxdht.regex;

import java.util.ArrayDeque;
import java.util.Deque;

import org.rxdht.regex.NFA.Fragment;

/**
 * Single pass, operator-precedence parser building a Thompson NFA straight
 * from the regex text. Concatenations are reduced lazily: a run of atoms is
 * only joined when an alternation, a closing parenthesis or the end of the
 * expression forces it.
 */
final class RegexParser {

    private static final int EOX = -1;  // end of expression

    /*
     * saved counters of an enclosing group
     */
    private static final class Frame {
        final int altcount;
        final int atomcount;

        Frame(int altcount, int atomcount) {
            this.altcount = altcount;
            this.atomcount = atomcount;
        }
    }

    private String regex;
    private int iCurrent;

    private NFA.Builder builder;
    private Deque<Fragment> stack;
    private Deque<Frame> groups;
    private int altcount;
    private int atomcount;

    Automaton parse(String regex) {
        if (regex == null || regex.length() == 0) {
            this.regex = regex == null ? "" : regex;
            iCurrent = 0;
            syntaxError("Empty regex string provided");
        }
        this.regex = regex;
        init();

        int c;
        while ((c = next()) != EOX) {
            switch (c) {
            case '(':
                openGroup();
                break;
            case '|':
                alternative();
                break;
            case ')':
                closeGroup();
                break;
            case '*':
            case '+':
            case '?':
                postfix((char) c);
                break;
            default:
                literal((char) c);
                break;
            }
        }

        if (!groups.isEmpty()) {
            syntaxError("Unbalanced parenthesis");
        }
        if (altcount > 0 && atomcount == 0) {
            syntaxError("Missing alternative after '|'");
        }
        reduce(altcount);
        if (stack.isEmpty()) {
            syntaxError("Empty regex");
        }
        assert stack.size() == 1 : stack;
        return builder.build(stack.pop());
    }

    private void init() {
        iCurrent = -1;
        builder = new NFA.Builder(regex);
        stack = new ArrayDeque<Fragment>();
        groups = new ArrayDeque<Frame>();
        altcount = 0;
        atomcount = 0;
    }

    private int next() {
        if (++iCurrent >= regex.length()) {
            iCurrent = regex.length();
            return EOX;
        }
        return regex.charAt(iCurrent);
    }

    private void openGroup() {
        if (atomcount > 1) {
            --atomcount;
            concat();
        }
        groups.push(new Frame(altcount, atomcount));
        altcount = 0;
        atomcount = 0;
    }

    private void alternative() {
        if (atomcount == 0) {
            syntaxError("Cannot append '|' to nothing");
        }
        while (--atomcount > 0) {
            concat();
        }
        altcount++;
    }

    private void closeGroup() {
        if (groups.isEmpty()) {
            syntaxError("Missing opening '('");
        }
        if (atomcount == 0) {
            if (altcount > 0) {
                syntaxError("Missing alternative after '|'");
            }
            // "()" contributes nothing
            Frame f = groups.pop();
            altcount = f.altcount;
            atomcount = f.atomcount;
            return;
        }
        reduce(altcount);
        Frame f = groups.pop();
        altcount = f.altcount;
        atomcount = f.atomcount + 1;
    }

    private void postfix(char op) {
        if (atomcount == 0) {
            syntaxError("Cannot append '" + op + "' to nothing");
        }
        Fragment a = stack.pop();
        switch (op) {
        case '*':
            stack.push(builder.star(a));
            break;
        case '+':
            stack.push(builder.plus(a));
            break;
        case '?':
            stack.push(builder.question(a));
            break;
        default:
            throw new AssertionError(op);
        }
    }

    private void literal(char c) {
        if (atomcount > 1) {
            --atomcount;
            concat();
        }
        stack.push(builder.label(String.valueOf(c)));
        atomcount++;
    }

    /*
     * joins the pending atoms of the innermost group, then its alternatives
     */
    private void reduce(int alternatives) {
        while (--atomcount > 0) {
            concat();
        }
        for (; alternatives > 0; alternatives--) {
            Fragment b = stack.pop();
            Fragment a = stack.pop();
            stack.push(builder.alternation(a, b));
        }
    }

    private void concat() {
        Fragment b = stack.pop();
        Fragment a = stack.pop();
        stack.push(builder.concat(a, b));
    }

    private void syntaxError(String msg) {
        throw new java.util.regex.PatternSyntaxException(msg, regex, iCurrent);
    }
}
