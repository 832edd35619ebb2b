/* @LICENSE@
 */

package org.formlang;

import static org.formlang.InvalidInputException.Category.ALPHABET;
import static org.formlang.InvalidInputException.Category.REGEX_CHARACTER;
import static org.formlang.InvalidInputException.Category.REGEX_EMPTY;
import static org.formlang.InvalidInputException.Category.REGEX_OPERATOR_SEQUENCE;
import static org.formlang.InvalidInputException.Category.REGEX_RESERVED_IN_ALPHABET;
import static org.formlang.InvalidInputException.Category.REGEX_START_OPERATOR;
import static org.formlang.InvalidInputException.Category.REGEX_UNBALANCED_LEFT;
import static org.formlang.InvalidInputException.Category.REGEX_UNBALANCED_RIGHT;
import static org.formlang.InvalidInputException.Category.SHAPE;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.formlang.InvalidInputException.Category;

/**
 * Compiles a regex into an {@link NFA} with a version of Dijkstra's
 * shunting yard algorithm: a stack of automata built so far and a stack of
 * pending binary operators. An operator of lower or equal precedence (or a
 * closing parenthesis) combines the pending operators of higher precedence
 * first. Star is postfix and applies at once to the automaton on top.
 * <p>
 * One instance per compilation; not reusable.
 */
final class RegexCompiler {

    private static final Logger logger = Logger.getLogger("org.formlang");
    private static final Level level = Level.FINER;

    static final char LEFT = '(';
    static final char RIGHT = ')';
    static final char ALT = '|';
    static final char STAR = '*';
    static final char CAT = '\u2022';          // bullet
    static final char EMPTY_STRING = '\u20AC'; // euro sign, looks like an epsilon
    static final char EMPTY_SET = '\u00D8';    // slashed O

    private static final char SENTINEL = '\0';

    static final Set<String> RESERVED;
    static final Set<String> DEFAULT_ALPHABET;

    static {
        Set<String> reserved = new TreeSet<String>();
        for (char c : new char[] {LEFT, RIGHT, ALT, STAR, CAT, EMPTY_STRING, EMPTY_SET}) {
            reserved.add(String.valueOf(c));
        }
        RESERVED = Collections.unmodifiableSet(reserved);

        Set<String> printable = new TreeSet<String>();
        for (char c = ' '; c <= '~'; ++c) printable.add(String.valueOf(c));
        for (char c : new char[] {'\t', '\n', '\r', '\u000B', '\f'}) {
            printable.add(String.valueOf(c));
        }
        printable.removeAll(reserved);
        DEFAULT_ALPHABET = Collections.unmodifiableSet(printable);
    }

    /*
     * Binary operators, with the sentinel at the bottom of the operator
     * stack binding loosest.
     */
    private static int precedence(char operator) {
        switch (operator) {
        case SENTINEL:
            return 0;
        case ALT:
            return 1;
        case CAT:
            return 2;
        default:
            throw new AssertionError("not a binary operator: " + operator);
        }
    }

    private static boolean isOperator(char c) {
        return c == ALT || c == CAT || c == STAR;
    }

    private static boolean isBinary(char c) {
        return c == ALT || c == CAT;
    }

    private final String regex;
    private final Set<String> alphabet;

    private final LinkedList<NFA> machines = new LinkedList<NFA>();
    private final LinkedList<Character> operators = new LinkedList<Character>();

    RegexCompiler(String regex, Set<String> alphabet) {
        checkAlphabet(alphabet);
        if (regex == null) {
            throw new InvalidInputException(SHAPE, "Regex cannot be null.");
        }
        this.regex = regex;
        this.alphabet = Collections.unmodifiableSet(new TreeSet<String>(alphabet));
    }

    private static void checkAlphabet(Set<String> alphabet) {
        if (alphabet == null || alphabet.contains(null)) {
            throw new InvalidInputException(SHAPE,
                "Alphabet cannot be null or contain null.");
        }
        Validation.checkAlphabet(alphabet, "alphabet");
        Validation.raiseIfAny(REGEX_RESERVED_IN_ALPHABET,
            Misc.intersect(alphabet, RESERVED),
            "Alphabet cannot contain character %s.",
            "Alphabet cannot contain characters %s.");
        if (alphabet.isEmpty()) {
            throw new InvalidInputException(ALPHABET, "Alphabet cannot be empty.");
        }
    }

    private boolean isSymbol(char c) {
        return alphabet.contains(String.valueOf(c));
    }

    private boolean isOperand(char c) {
        return isSymbol(c) || c == EMPTY_STRING || c == EMPTY_SET || c == LEFT;
    }

    private void syntaxError(Category category, String msg, char c, int index) {
        throw new InvalidInputException(category,
            msg + ": '" + c + "' at index " + index + " of " + regex,
            Collections.singleton(String.valueOf(c)));
    }

    /*
     * Checks the regex and makes every concatenation explicit.
     */
    String preprocess() {
        if (regex.length() == 0) {
            throw new InvalidInputException(REGEX_EMPTY, "Regex cannot be empty.");
        }
        if (isOperator(regex.charAt(0))) {
            syntaxError(REGEX_START_OPERATOR, "Regex cannot start with an operator",
                regex.charAt(0), 0);
        }
        Set<String> disallowed = new LinkedHashSet<String>();
        for (int i = 0; i < regex.length(); ++i) {
            String c = String.valueOf(regex.charAt(i));
            if (!alphabet.contains(c) && !RESERVED.contains(c)) disallowed.add(c);
        }
        Validation.raiseIfAny(REGEX_CHARACTER, disallowed,
            "Regex contains character %s that is neither in the alphabet nor a regex character.",
            "Regex contains characters %s that are neither in the alphabet nor regex characters.");

        StringBuilder sb = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < regex.length(); ++i) {
            final char c = regex.charAt(i);
            final boolean start = sb.length() == 0;
            final char last = start ? SENTINEL : sb.charAt(sb.length() - 1);
            if (isOperand(c)) {
                if (!start && last != LEFT && !isBinary(last)) sb.append(CAT);
            } else if (isOperator(c)) {
                if (start) {
                    syntaxError(REGEX_START_OPERATOR, "Regex cannot start with an operator", c, i);
                } else if (last == LEFT) {
                    syntaxError(REGEX_START_OPERATOR, "Group cannot start with an operator", c, i);
                } else if (isBinary(last)) {
                    syntaxError(REGEX_OPERATOR_SEQUENCE, "Binary operator followed by an operator", c, i);
                }
            } else {
                assert c == RIGHT : c;
                if (depth == 0) {
                    syntaxError(REGEX_UNBALANCED_RIGHT,
                        "Right parenthesis without matching left parenthesis", c, i);
                } else if (last == LEFT) {
                    syntaxError(REGEX_EMPTY, "Empty group", c, i);
                } else if (isBinary(last)) {
                    syntaxError(REGEX_OPERATOR_SEQUENCE, "Binary operator without right operand", c, i);
                }
            }
            if (c == LEFT) ++depth;
            if (c == RIGHT) --depth;
            sb.append(c);
        }
        final char last = sb.charAt(sb.length() - 1);
        if (isBinary(last)) {
            syntaxError(REGEX_OPERATOR_SEQUENCE, "Binary operator without right operand",
                last, regex.length() - 1);
        }
        if (depth > 0) {
            syntaxError(REGEX_UNBALANCED_LEFT,
                "Left parenthesis without matching right parenthesis", LEFT, regex.lastIndexOf(LEFT));
        }
        return sb.toString();
    }

    NFA compile() {
        final String processed = preprocess();
        operators.addFirst(SENTINEL);
        for (int i = 0; i < processed.length(); ++i) {
            final char c = processed.charAt(i);
            if (c == EMPTY_STRING || c == EMPTY_SET) {
                machines.addFirst(empty(c == EMPTY_STRING));
            } else if (isSymbol(c)) {
                machines.addFirst(symbol(String.valueOf(c)));
            } else if (c == STAR) {
                machines.addFirst(machines.removeFirst().star());
            } else if (isBinary(c)) {
                while (operators.getFirst() != LEFT
                        && precedence(c) <= precedence(operators.getFirst())) {
                    binaryOperate();
                }
                operators.addFirst(c);
            } else if (c == LEFT) {
                operators.addFirst(c);
            } else {
                while (operators.getFirst() != LEFT) {
                    binaryOperate();
                }
                operators.removeFirst();
            }
        }
        while (operators.size() > 1) {
            binaryOperate();
        }
        assert machines.size() == 1 : machines.size();
        NFA ret = machines.removeFirst();
        if (logger.isLoggable(level)) {
            logger.log(level, "compiled '" + regex + "' as '" + processed + "': "
                + ret.states().size() + " states");
        }
        return ret;
    }

    private void binaryOperate() {
        NFA rhs = machines.removeFirst();
        NFA lhs = machines.removeFirst();
        char operator = operators.removeFirst();
        machines.addFirst(operator == ALT ? lhs.union(rhs) : lhs.concat(rhs));
    }

    private NFA empty(boolean acceptsEmptyString) {
        Map<Pair<String, String>, Set<String>> tf =
            new LinkedHashMap<Pair<String, String>, Set<String>>();
        for (String symbol : alphabet) {
            tf.put(Pair.of("q1", symbol), Collections.<String>emptySet());
        }
        return new NFA(tf, "q1", acceptsEmptyString
            ? Collections.singleton("q1") : Collections.<String>emptySet());
    }

    private NFA symbol(String symbol) {
        Map<Pair<String, String>, Set<String>> tf =
            new LinkedHashMap<Pair<String, String>, Set<String>>();
        for (String state : new String[] {"q1", "q2"}) {
            for (String s : alphabet) {
                tf.put(Pair.of(state, s), Collections.<String>emptySet());
            }
        }
        tf.put(Pair.of("q1", symbol), Collections.singleton("q2"));
        return new NFA(tf, "q1", Collections.singleton("q2"));
    }
}
