/*
 * @LICENSE@
 */

package org.rxdht.regex;

/**
 * String level regex algebra used when building proofs. Operands are regex
 * strings in which <code>null</code> stands for "no path" and the empty
 * string for epsilon. An operand of the form <code>(|x)</code> means "x or
 * nothing".
 * <p>
 * The rewrites in {@link #simplify(String, String, String, String)} are
 * heuristics, not a complete decision procedure: two peers only derive the
 * same proof when they run exactly the same rules in exactly the same order.
 */
final class RegexAlgebra {

    private RegexAlgebra() {
    }

    /**
     * Whether <code>s</code> must be parenthesized before a postfix operator
     * or concatenation applies to all of it.
     */
    static boolean needsParentheses(String s) {
        if (s == null || s.length() < 2) return false;
        if (s.charAt(0) != '(') return true;
        int cnt = 1;
        int pos = 1;
        while (cnt > 0) {
            int cl = s.indexOf(')', pos);
            if (cl == -1) return true;
            int op;
            while ((op = s.indexOf('(', pos)) != -1 && op < cl) {
                cnt++;
                pos = op + 1;
            }
            cnt--;
            pos = cl + 1;
        }
        return pos != s.length();
    }

    /**
     * Strips one pair of parentheses enclosing all of <code>s</code>;
     * <code>(a)(b)</code> is returned unchanged.
     */
    static String removeParentheses(String s) {
        if (s == null) return null;
        final int len = s.length();
        if (len < 2 || s.charAt(0) != '(' || s.charAt(len - 1) != ')') return s;
        final int end = len - 1;
        int cnt = 0;
        int pos = 1;
        int op = indexOf(s, '(', pos, end);
        int cp = indexOf(s, ')', pos, end);
        while (cp != -1) {
            while (op != -1 && op < cp) {
                cnt++;
                pos = op + 1;
                op = indexOf(s, '(', pos, end);
            }
            while (cp != -1 && (op == -1 || cp < op)) {
                if (cnt == 0) return s;
                cnt--;
                pos = cp + 1;
                cp = indexOf(s, ')', pos, end);
            }
        }
        if (cnt != 0) return s;
        return s.substring(1, len - 1);
    }

    // indexOf restricted to [from, end)
    private static int indexOf(String s, char c, int from, int end) {
        int i = s.indexOf(c, from);
        return i < end ? i : -1;
    }

    static boolean hasEpsilon(String s) {
        return s != null && s.length() > 1 && s.charAt(0) == '(' && s.charAt(1) == '|'
            && s.charAt(s.length() - 1) == ')';
    }

    static String removeEpsilon(String s) {
        if (s == null) return null;
        if (hasEpsilon(s)) return s.substring(2, s.length() - 1);
        return s;
    }

    static boolean nullEquals(String s1, String s2) {
        return s1 == null ? s2 == null : s1.equals(s2);
    }

    // absent and empty compare equal
    static boolean same(String s1, String s2) {
        return (s1 == null ? "" : s1).equals(s2 == null ? "" : s2);
    }

    /**
     * Whether <code>s1</code> without its first <code>k</code> characters
     * equals <code>s2</code>.
     */
    static boolean suffixEquals(String s1, String s2, int k) {
        if (s1 == null || s2 == null || k < 0 || k > s1.length()) return false;
        if (s1.length() - k != s2.length()) return false;
        return s1.regionMatches(k, s2, 0, s2.length());
    }

    /**
     * Whether the first <code>n</code> characters of both strings agree.
     */
    static boolean prefixEquals(String s1, String s2, int n) {
        if (s1 == null || s2 == null) return false;
        int l1 = s1.length();
        int l2 = s2.length();
        if (l1 != l2 && (l1 < n || l2 < n)) return false;
        int max = Math.min(Math.max(l1, l2), n);
        return s1.regionMatches(0, s2, 0, max);
    }

    static String star(String s) {
        return needsParentheses(s) ? "(" + s + ")*" : s + "*";
    }

    static String plus(String s) {
        return needsParentheses(s) ? "(" + s + ")+" : s + "+";
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }

    private static boolean startsWithEpsilon(String s) {
        return s != null && s.startsWith("(|");
    }

    private static String clean(String s) {
        return removeParentheses(removeEpsilon(s));
    }

    /**
     * One step of the state elimination recurrence:
     * <code>R(i,j) | R(i,k) R(k,k)* R(k,j)</code>, rewritten into a
     * shorter equivalent where one of a fixed set of patterns applies.
     */
    static String simplify(String ij, String ik, String kk, String kj) {
        if (ij == null && (ik == null || kj == null)) return null;
        if (ik == null || kj == null) return ij;

        final boolean ijKj = nullEquals(ij, kj);
        final boolean ijIk = nullEquals(ij, ik);
        final boolean ikKk = nullEquals(ik, kk);
        final boolean kkKj = nullEquals(kk, kj);

        final String tik = clean(ik);
        final String tkk = clean(kk);
        final String tkj = clean(kj);

        final boolean cleanIkKk = nullEquals(ik, tkk);
        final boolean cleanKkKj = nullEquals(tkk, kj);

        String l = null;
        String r = null;

        if (ij != null) {
            final String tij = clean(ij);
            if (same(tij, tik) && same(tik, tkk) && same(tkk, tkj)) {
                if (tij.length() == 0) {
                    r = "";
                } else if (startsWithEpsilon(ij)
                        || (startsWithEpsilon(ik) && startsWithEpsilon(kj))) {
                    r = star(tij);
                } else {
                    r = plus(tij);
                }
            } else if (ijIk && cleanKkKj && !cleanIkKk) {
                // ij == ik, kk == kj: ij kk*
                if (length(kk) == 0) {
                    r = ij;
                } else if (needsParentheses(tkk)) {
                    r = ij + "(" + tkk + ")*";
                } else {
                    r = ij + kk + "*";
                }
            } else if (ijKj && cleanIkKk && !cleanKkKj) {
                // ij == kj, ik == kk: kk* kj
                if (length(kk) < 1) {
                    r = kj;
                } else {
                    r = star(tkk) + kj;
                }
            } else if (ijIk && kkKj && !hasEpsilon(ij) && hasEpsilon(kk)) {
                r = ij + star(tkk);
            } else if (ijKj && ikKk && !hasEpsilon(ij) && hasEpsilon(kk)) {
                r = star(tkk) + ij;
            } else {
                l = removeParentheses(ij);
            }
        }

        if (r == null) {
            final int length = length(tkk) - length(ik);
            if (length > 0 && length(kk) > 0 && length(kj) > 0 && length(ik) > 0
                    && suffixEquals(tkk, ik, length) && prefixEquals(tkk, kj, length)) {
                // ik = x, kk = yx, kj = y...: (xy)+...
                String a = kj.substring(0, length);
                String b = kj.substring(length);
                if (l != null && l.length() == 0 && b.length() == 0) {
                    r = "(" + ik + a + ")*";
                    l = null;
                } else {
                    r = "(" + ik + a + ")+" + b;
                }
            } else if (same(tik, tkk) && same(tkk, tkj)) {
                if (hasEpsilon(ik) && hasEpsilon(kj)) {
                    r = star(tkk);
                } else if (cleanIkKk && cleanKkKj && !hasEpsilon(ik)) {
                    r = plus(tkk) + tkk;
                } else {
                    int eps = (hasEpsilon(ik) ? 1 : 0) + (hasEpsilon(kk) ? 1 : 0)
                        + (hasEpsilon(kj) ? 1 : 0);
                    if (eps == 1) r = plus(tkk);
                }
            } else if (same(tik, tkk)) {
                r = (hasEpsilon(ik) ? star(tkk) : plus(tkk)) + kj;
            } else if (same(tkk, tkj)) {
                if (hasEpsilon(kj)) {
                    r = ik + star(tkk);
                } else {
                    r = needsParentheses(tkk) ? "(" + ik + ")+" + tkk : ik + "+" + tkk;
                }
            } else {
                r = length(tkk) > 0 ? ik + star(tkk) + kj : ik + kj;
            }
        }

        if (l == null) return r;
        if (r == null) return l;
        if (l.equals(r)) return l;
        return "(" + l + "|" + r + ")";
    }
}
