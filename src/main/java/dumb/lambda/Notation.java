package dumb.lambda;

import java.util.ArrayList;

/**
 * Renders terms in the conventional {@code λx. body} notation.
 */
public final class Notation {

    public static final String LAMBDA = "λ";

    private Notation() {
    }

    public static String toNotation(Term term) {
        if (term instanceof Term.Variable v)
            return v.name();
        if (term instanceof Term.Constant c)
            return String.valueOf(c.value());
        if (term instanceof Term.Abstraction a)
            return LAMBDA + a.param() + ". " + toNotation(a.body());
        var app = (Term.Application) term;
        var arg = toNotation(app.arg());
        var needsParens = app.arg() instanceof Term.Abstraction || app.arg() instanceof Term.Application;
        return toNotation(app.func()) + " " + (needsParens ? "(" + arg + ")" : arg);
    }

    /**
     * Collapses a chain of abstractions into one header, {@code λx y z. body}.
     */
    public static String toCurriedForm(Term term) {
        if (!(term instanceof Term.Abstraction))
            return toNotation(term);

        var params = new ArrayList<String>();
        var current = term;
        while (current instanceof Term.Abstraction a) {
            params.add(a.param());
            current = a.body();
        }
        return LAMBDA + String.join(" ", params) + ". " + toNotation(current);
    }
}
