package io.logscope.engine.query.sql;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rejects regular expressions prone to catastrophic backtracking, i.e. a group repeated by
 * {@code +}, {@code *} or {@code {n,}} that contains a quantifier or an alternation at any
 * depth, such as {@code (a+)+}, {@code ((ab)+)+} or {@code (a|b)*}.
 */
public final class RegexGuard {

    private RegexGuard() {
    }

    public static void check(String pattern) {
        if (hasNestedQuantifier(pattern)) {
            throw new CompileException("potentially dangerous regex pattern: nested quantifiers detected");
        }
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new CompileException("invalid regex pattern: " + e.getDescription(), e);
        }
    }

    static boolean hasNestedQuantifier(String pattern) {
        Deque<Group> groups = new ArrayDeque<>();
        groups.push(new Group());
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            switch (c) {
                case '\\':
                    i += 2;
                    break;
                case '[':
                    i = skipCharacterClass(pattern, i);
                    break;
                case '(':
                    groups.push(new Group());
                    i++;
                    break;
                case ')':
                    i++;
                    if (groups.size() > 1) {
                        Group closed = groups.pop();
                        if (closed.risky && unboundedQuantifierLength(pattern, i) > 0) {
                            return true;
                        }
                        groups.peek().risky |= closed.risky;
                    }
                    break;
                case '|':
                    groups.peek().risky = true;
                    i++;
                    break;
                default:
                    int quantifier = unboundedQuantifierLength(pattern, i);
                    if (quantifier > 0) {
                        groups.peek().risky = true;
                        i += quantifier;
                    } else {
                        i++;
                    }
            }
        }
        return false;
    }

    /** Length of a {@code +}, {@code *} or {@code {n,}} quantifier starting at {@code i}, else 0. */
    private static int unboundedQuantifierLength(String pattern, int i) {
        if (i >= pattern.length()) {
            return 0;
        }
        char c = pattern.charAt(i);
        if (c == '+' || c == '*') {
            return 1;
        }
        if (c != '{') {
            return 0;
        }
        int j = i + 1;
        while (j < pattern.length() && Character.isDigit(pattern.charAt(j))) {
            j++;
        }
        if (j == i + 1 || j + 1 >= pattern.length() || pattern.charAt(j) != ',' || pattern.charAt(j + 1) != '}') {
            return 0;
        }
        return j + 2 - i;
    }

    private static int skipCharacterClass(String pattern, int start) {
        int i = start + 1;
        if (i < pattern.length() && pattern.charAt(i) == '^') {
            i++;
        }
        if (i < pattern.length() && pattern.charAt(i) == ']') {
            i++;
        }
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == ']') {
                return i + 1;
            } else {
                i++;
            }
        }
        return i;
    }

    private static final class Group {
        // holds a quantifier or an alternation somewhere inside
        private boolean risky;
    }
}
