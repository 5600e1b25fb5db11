package dumb.lambda;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static dumb.lambda.util.Log.debug;
import static dumb.lambda.util.Log.warning;

/**
 * Recognizes one JavaScript/TypeScript function in a code snippet and converts it to a curried term.
 * <p>
 * Only the first function in source order is read: a {@code function} declaration or expression, or an arrow
 * function. Its body is either the arrow's expression or the first top-level {@code return} of its block.
 * Inside that expression only identifiers, call chains, literals and nested arrow functions are converted;
 * everything else stays an opaque {@link Term.Constant} of the source snippet.
 */
public final class CodeParser {

    private static final int CONTEXT_SIZE = 50;
    private static final Pattern ARROW_FALLBACK = Pattern.compile("\\(([^)]*)\\)\\s*=>\\s*(.+)", Pattern.DOTALL);
    private static final Pattern FUNCTION_KEYWORD = Pattern.compile("(?<![\\w$])function(?![\\w$])");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern NUMBER = Pattern.compile("(\\d[\\d_]*\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?n?|0[xXbBoO][0-9a-fA-F_]+n?");
    private static final Set<String> OPAQUE_KEYWORDS = Set.of("null", "this", "super", "new", "void", "typeof", "await", "yield");
    private static final Set<String> PARAM_MODIFIERS = Set.of("public", "private", "protected", "readonly");
    private static final String OPERATOR_CHARS = "+-*/%<>=!&|^?:~,";
    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";

    private final String src;
    private final String masked; // same length as src

    private CodeParser(String src) throws ParseException {
        this.src = src;
        this.masked = mask(src);
    }

    /**
     * Never fails: a snippet without a recognizable function becomes a constant holding the snippet.
     */
    public static Term parse(String code) {
        try {
            var function = new CodeParser(code).parseFirstFunction();
            if (function != null) return function;
        } catch (ParseException e) {
            warning("Code parse failed, trying arrow pattern: " + e.getMessage());
        }

        var arrow = ARROW_FALLBACK.matcher(code);
        if (arrow.find()) {
            var params = new ArrayList<String>();
            for (var p : arrow.group(1).split(","))
                if (!p.isBlank()) params.add(p.trim());
            return Term.curry(params, expression(arrow.group(2)));
        }

        debug("No function found in code input, keeping it as a constant");
        return Term.Constant.of(code);
    }

    /**
     * Converts a single expression: identifiers, call chains, literals and arrow functions.
     */
    public static Term expression(String expr) {
        var t = stripStatementEnd(expr);
        if (t.isEmpty()) return Term.Constant.of(expr.trim());
        try {
            return new CodeParser(t).convert();
        } catch (ParseException e) {
            warning("Expression kept opaque: " + e.getMessage());
            return Term.Constant.of(t);
        }
    }

    @Nullable
    private Term parseFirstFunction() throws ParseException {
        var keyword = FUNCTION_KEYWORD.matcher(masked);
        var functionAt = keyword.find() ? keyword.start() : -1;
        var arrowAt = masked.indexOf("=>");

        if (functionAt >= 0 && (arrowAt < 0 || functionAt < arrowStartOrEnd(arrowAt)))
            return function(functionAt);
        if (arrowAt >= 0)
            return arrow(arrowAt);
        return null;
    }

    private int arrowStartOrEnd(int arrowAt) {
        try {
            return paramsStart(arrowAt);
        } catch (ParseException e) {
            return masked.length();
        }
    }

    private Term function(int at) throws ParseException {
        var pos = skipWhitespace(at + "function".length());
        if (pos < masked.length() && masked.charAt(pos) == '*') pos = skipWhitespace(pos + 1);
        while (pos < masked.length() && isIdentifierChar(masked.charAt(pos))) pos++;
        pos = skipWhitespace(pos);
        if (pos < masked.length() && masked.charAt(pos) == '<') pos = skipWhitespace(skipAngles(pos));
        if (pos >= masked.length() || masked.charAt(pos) != '(')
            throw error("Expected '(' after function", pos);

        var close = matchForward(pos);
        var params = params(pos + 1, close);

        var open = close + 1;
        while (open < masked.length() && masked.charAt(open) != '{' && masked.charAt(open) != ';') open++;
        if (open >= masked.length() || masked.charAt(open) != '{')
            throw error("Function has no body", open);

        return curry(params, block(open));
    }

    private Term arrow(int arrowAt) throws ParseException {
        var start = paramsStart(arrowAt);
        List<Param> params;
        if (masked.charAt(start) == '(') {
            params = params(start + 1, matchForward(start));
        } else {
            var end = start;
            while (end < masked.length() && isIdentifierChar(masked.charAt(end))) end++;
            params = List.of(new Param(src.substring(start, end), null));
        }

        var body = skipWhitespace(arrowAt + 2);
        if (body >= masked.length())
            throw error("Arrow function has no body", body);
        if (masked.charAt(body) == '{')
            return curry(params, block(body));
        var expr = src.substring(body, expressionEnd(body));
        if (expr.isBlank())
            throw error("Arrow function has no body", body);
        return curry(params, expression(expr));
    }

    // skips a return type annotation: (x): number =>
    private int paramsStart(int arrowAt) throws ParseException {
        var j = skipWhitespaceBack(arrowAt - 1);
        if (j < 0) throw error("Arrow function without parameters", arrowAt);
        if (masked.charAt(j) == ')') return matchBackward(j);
        if (!isIdentifierChar(masked.charAt(j))) throw error("Unexpected token before '=>'", j);

        var identStart = j;
        while (identStart > 0 && isIdentifierChar(masked.charAt(identStart - 1))) identStart--;
        var before = skipWhitespaceBack(identStart - 1);
        if (before >= 0 && masked.charAt(before) == ':') {
            var close = skipWhitespaceBack(before - 1);
            if (close >= 0 && masked.charAt(close) == ')') return matchBackward(close);
        }
        return identStart;
    }

    private Term block(int open) throws ParseException {
        var close = matchForward(open);
        var depth = 0;
        for (var i = open + 1; i < close; i++) {
            var c = masked.charAt(i);
            if (OPENERS.indexOf(c) >= 0) depth++;
            else if (CLOSERS.indexOf(c) >= 0) depth--;
            else if (depth == 0 && isWordAt("return", i)) {
                var exprStart = i + "return".length();
                var exprEnd = Math.min(expressionEnd(exprStart), close);
                var expr = src.substring(exprStart, exprEnd);
                if (!expr.isBlank()) return expression(expr);
            }
        }
        return Term.Constant.of(src.substring(open, close + 1));
    }

    private List<Param> params(int from, int to) {
        var params = new ArrayList<Param>();
        for (var raw : splitTopLevel(from, to, ',')) {
            var p = raw.trim();
            if (p.startsWith("...")) p = p.substring(3).trim();

            var words = p.split("\\s+");
            if (words.length > 1 && PARAM_MODIFIERS.contains(words[0]))
                p = p.substring(words[0].length()).trim();

            var eq = topLevelAssignment(p);
            if (eq >= 0) p = p.substring(0, eq).trim();

            String type = null;
            var colon = p.indexOf(':');
            if (colon >= 0 && IDENTIFIER.matcher(p.substring(0, colon).replace("?", "").trim()).matches()) {
                type = p.substring(colon + 1).trim();
                p = p.substring(0, colon).trim();
            }
            if (p.endsWith("?")) p = p.substring(0, p.length() - 1).trim();
            if (!p.isEmpty()) params.add(new Param(p, type == null || type.isEmpty() ? null : type));
        }
        return params;
    }

    private static Term curry(List<Param> params, Term body) {
        var term = body;
        for (var i = params.size() - 1; i >= 0; i--)
            term = new Term.Abstraction(params.get(i).name(), term, params.get(i).type());
        return term;
    }

    private Term convert() throws ParseException {
        var t = src;
        var arrowAt = topLevelIndexOf("=>");
        if (arrowAt >= 0 && isArrowHead(arrowAt))
            return arrow(arrowAt);
        if (isWordAt("function", 0))
            return function(0);

        if (IDENTIFIER.matcher(t).matches()) {
            if (t.equals("true") || t.equals("false")) return Term.Constant.of(t, Term.Constant.BOOLEAN);
            return OPAQUE_KEYWORDS.contains(t) ? Term.Constant.of(t) : Term.Variable.of(t);
        }
        if (NUMBER.matcher(t).matches())
            return Term.Constant.of(t, Term.Constant.NUMBER);
        if (isStringLiteral())
            return Term.Constant.of(t, Term.Constant.STRING);

        var last = t.length() - 1;
        if (masked.charAt(last) == ')') {
            var open = matchBackward(last);
            var callee = t.substring(0, open).trim();
            if (!callee.isEmpty() && !new CodeParser(callee).isCompound()) {
                var term = expression(callee);
                for (var arg : splitTopLevel(open + 1, last, ','))
                    if (!arg.isBlank()) term = new Term.Application(term, expression(arg));
                return term;
            }
        }

        return Term.Constant.of(isCompound() && !isParenthesized() ? "(" + t + ")" : t);
    }

    private boolean isArrowHead(int arrowAt) throws ParseException {
        var start = paramsStart(arrowAt);
        var prefix = src.substring(0, start).trim();
        return prefix.isEmpty() || prefix.equals("async");
    }

    private boolean isStringLiteral() {
        var q = src.charAt(0);
        if ((q != '"' && q != '\'' && q != '`') || src.length() < 2 || src.charAt(src.length() - 1) != q)
            return false;
        return masked.indexOf(q, 1) == src.length() - 1;
    }

    private boolean isParenthesized() throws ParseException {
        return masked.charAt(0) == '(' && matchForward(0) == masked.length() - 1;
    }

    private boolean isCompound() {
        var depth = 0;
        for (var i = 0; i < masked.length(); i++) {
            var c = masked.charAt(i);
            if (OPENERS.indexOf(c) >= 0) depth++;
            else if (CLOSERS.indexOf(c) >= 0) depth--;
            else if (depth == 0 && (Character.isWhitespace(c) || OPERATOR_CHARS.indexOf(c) >= 0)) return true;
        }
        return false;
    }

    private int expressionEnd(int from) {
        var depth = 0;
        for (var i = from; i < masked.length(); i++) {
            var c = masked.charAt(i);
            if (OPENERS.indexOf(c) >= 0) depth++;
            else if (CLOSERS.indexOf(c) >= 0) {
                if (depth == 0) return i;
                depth--;
            } else if (depth == 0 && (c == ';' || c == ',')) return i;
        }
        return masked.length();
    }

    private List<String> splitTopLevel(int from, int to, char separator) {
        var parts = new ArrayList<String>();
        var depth = 0;
        var partStart = from;
        for (var i = from; i < to; i++) {
            var c = masked.charAt(i);
            if (OPENERS.indexOf(c) >= 0) depth++;
            else if (CLOSERS.indexOf(c) >= 0) depth--;
            else if (depth == 0 && c == separator) {
                parts.add(src.substring(partStart, i));
                partStart = i + 1;
            }
        }
        parts.add(src.substring(partStart, to));
        return parts;
    }

    private int topLevelIndexOf(String token) {
        var depth = 0;
        for (var i = 0; i < masked.length(); i++) {
            var c = masked.charAt(i);
            if (OPENERS.indexOf(c) >= 0) depth++;
            else if (CLOSERS.indexOf(c) >= 0) depth--;
            else if (depth == 0 && masked.startsWith(token, i)) return i;
        }
        return -1;
    }

    private static int topLevelAssignment(String param) {
        var depth = 0;
        for (var i = 0; i < param.length(); i++) {
            var c = param.charAt(i);
            if (OPENERS.indexOf(c) >= 0) depth++;
            else if (CLOSERS.indexOf(c) >= 0) depth--;
            else if (depth == 0 && c == '=') {
                var next = i + 1 < param.length() ? param.charAt(i + 1) : ' ';
                if (next != '>' && next != '=') return i;
                i++;
            }
        }
        return -1;
    }

    private int matchForward(int open) throws ParseException {
        var expected = new ArrayDeque<Character>();
        for (var i = open; i < masked.length(); i++) {
            var c = masked.charAt(i);
            var o = OPENERS.indexOf(c);
            if (o >= 0) {
                expected.push(CLOSERS.charAt(o));
            } else if (CLOSERS.indexOf(c) >= 0) {
                if (expected.isEmpty() || expected.pop() != c)
                    throw error("Mismatched '" + c + "'", i);
                if (expected.isEmpty()) return i;
            }
        }
        throw error("Unclosed '" + masked.charAt(open) + "'", open);
    }

    private int matchBackward(int close) throws ParseException {
        var expected = new ArrayDeque<Character>();
        for (var i = close; i >= 0; i--) {
            var c = masked.charAt(i);
            var k = CLOSERS.indexOf(c);
            if (k >= 0) {
                expected.push(OPENERS.charAt(k));
            } else if (OPENERS.indexOf(c) >= 0) {
                if (expected.isEmpty() || expected.pop() != c)
                    throw error("Mismatched '" + c + "'", i);
                if (expected.isEmpty()) return i;
            }
        }
        throw error("Unopened '" + masked.charAt(close) + "'", close);
    }

    private int skipAngles(int open) throws ParseException {
        var depth = 0;
        for (var i = open; i < masked.length(); i++) {
            var c = masked.charAt(i);
            if (c == '<') depth++;
            else if (c == '>' && --depth == 0) return i + 1;
        }
        throw error("Unclosed type parameter list", open);
    }

    private int skipWhitespace(int i) {
        while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) i++;
        return i;
    }

    private int skipWhitespaceBack(int i) {
        while (i >= 0 && Character.isWhitespace(masked.charAt(i))) i--;
        return i;
    }

    private boolean isWordAt(String word, int i) {
        if (!masked.startsWith(word, i)) return false;
        var end = i + word.length();
        return (i == 0 || !isIdentifierChar(masked.charAt(i - 1)))
                && (end >= masked.length() || !isIdentifierChar(masked.charAt(end)));
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static String stripStatementEnd(String expr) {
        var t = expr.trim();
        while (t.endsWith(";")) t = t.substring(0, t.length() - 1).trim();
        return t;
    }

    /** Comments become spaces, string and template contents become {@code _}. */
    private static String mask(String src) throws ParseException {
        var out = new StringBuilder(src.length());
        var i = 0;
        while (i < src.length()) {
            var c = src.charAt(i);
            if (c == '/' && i + 1 < src.length() && src.charAt(i + 1) == '/') {
                while (i < src.length() && src.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && i + 1 < src.length() && src.charAt(i + 1) == '*') {
                var end = src.indexOf("*/", i + 2);
                if (end < 0) throw new ParseException("Unterminated comment", src, i);
                for (; i < end + 2; i++) out.append(src.charAt(i) == '\n' ? '\n' : ' ');
            } else if (c == '"' || c == '\'' || c == '`') {
                out.append(c);
                i++;
                while (i < src.length() && src.charAt(i) != c) {
                    if (src.charAt(i) == '\\' && i + 1 < src.length()) {
                        out.append('_');
                        i++;
                    }
                    out.append(src.charAt(i) == '\n' ? '\n' : '_');
                    i++;
                }
                if (i >= src.length()) throw new ParseException("Unterminated string literal", src, src.lastIndexOf(c));
                out.append(c);
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private ParseException error(String message, int offset) {
        return new ParseException(message, src, offset);
    }

    private record Param(String name, @Nullable String type) {
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message, String src, int offset) {
            super(message);
            var at = Math.max(0, Math.min(offset, src.length()));
            var lineStart = src.lastIndexOf('\n', at - 1) + 1;
            this.line = (int) src.substring(0, at).chars().filter(ch -> ch == '\n').count() + 1;
            this.col = at - lineStart;
            this.context = src.substring(Math.max(0, at - CONTEXT_SIZE / 2), Math.min(src.length(), at + CONTEXT_SIZE / 2));
        }

        @Override
        public String getMessage() {
            var contextSnippet = context.isEmpty() ? "" : " near '" + context + "'";
            return super.getMessage() + " at line " + line + ", col " + col + contextSnippet;
        }
    }
}
