package dumb.lambda;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads informal lambda notation: {@code λx. body}, {@code \x. body}, curried headers such as
 * {@code λx y. body}, and whitespace-separated application chains with optional parenthesized groups.
 * Tokens that are not binders or groups become variables, so {@code x + 1} is the chain {@code ((x +) 1)}.
 */
public final class MathParser {

    private static final Pattern BINDER = Pattern.compile("^\\\\([a-z](?:\\s+[a-z])*)\\s*\\.\\s*(.+)$", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MathParser() {
    }

    public static Term parse(String math) {
        return parseTerm(math.replace('λ', '\\'));
    }

    private static Term parseTerm(String text) {
        var t = text.trim();
        if (t.isEmpty()) return Term.Constant.of(text);

        var binder = BINDER.matcher(t);
        if (binder.matches()) {
            var params = Arrays.asList(WHITESPACE.split(binder.group(1)));
            return Term.curry(params, parseTerm(binder.group(2)));
        }

        var tokens = tokenize(t);
        if (tokens == null) tokens = Arrays.asList(WHITESPACE.split(t));

        Term term = null;
        for (var token : tokens) {
            var next = parseToken(token);
            term = term == null ? next : new Term.Application(term, next);
        }
        return term;
    }

    private static Term parseToken(String token) {
        if (isGroup(token)) {
            var inner = token.substring(1, token.length() - 1);
            return inner.isBlank() ? Term.Constant.of(token) : parseTerm(inner);
        }
        if (token.startsWith("\\") && BINDER.matcher(token).matches())
            return parseTerm(token);
        return Term.Variable.of(token);
    }

    /**
     * Splits on whitespace outside parentheses. A binder after the head extends to the end of the text.
     *
     * @return null when the parentheses do not balance
     */
    @Nullable
    private static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        var current = new StringBuilder();
        var depth = 0;
        for (var i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            if (depth == 0 && current.length() == 0 && c == '\\') {
                var rest = text.substring(i);
                if (BINDER.matcher(rest).matches()) {
                    tokens.add(rest);
                    return tokens;
                }
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (--depth < 0) return null;
            } else if (depth == 0 && Character.isWhitespace(c)) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
                continue;
            }
            current.append(c);
        }
        if (depth != 0) return null;
        if (current.length() > 0) tokens.add(current.toString());
        return tokens;
    }

    /** True when the token is one parenthesized group, e.g. {@code (g x)} but not {@code (a)(b)}. */
    private static boolean isGroup(String token) {
        if (token.length() < 2 || token.charAt(0) != '(' || token.charAt(token.length() - 1) != ')')
            return false;
        var depth = 0;
        for (var i = 0; i < token.length(); i++) {
            var c = token.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && --depth == 0) return i == token.length() - 1;
        }
        return false;
    }
}
