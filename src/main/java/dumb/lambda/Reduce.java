package dumb.lambda;

import java.util.HashSet;

/**
 * Beta reduction and substitution.
 * <p>
 * Untouched subtrees are returned as the same instance, so {@code betaReduce(t) == t} when no redex was contracted.
 */
public final class Reduce {

    private Reduce() {
    }

    public static Term betaReduce(Term term) {
        return betaReduce(term, false);
    }

    /**
     * One normal-order pass: function and argument are reduced first, then the outer redex is contracted.
     * The contractum itself is not reduced again, so divergent terms such as {@code (λx. x x) (λx. x x)}
     * come back after a single step.
     */
    public static Term betaReduce(Term term, boolean captureAvoiding) {
        if (term instanceof Term.Application app) {
            var func = betaReduce(app.func(), captureAvoiding);
            var arg = betaReduce(app.arg(), captureAvoiding);
            if (func instanceof Term.Abstraction abs)
                return captureAvoiding
                        ? substituteAvoidingCapture(abs.body(), abs.param(), arg)
                        : substitute(abs.body(), abs.param(), arg);
            return func == app.func() && arg == app.arg() ? app : new Term.Application(func, arg);
        }
        if (term instanceof Term.Abstraction abs)
            return abs.withBody(betaReduce(abs.body(), captureAvoiding));
        return term;
    }

    /**
     * {@code body[param := replacement]}. A binder of the same name shadows {@code param} for its whole subtree.
     * Inner binders are never renamed, so a free variable of {@code replacement} can be captured;
     * see {@link #substituteAvoidingCapture}.
     */
    public static Term substitute(Term body, String param, Term replacement) {
        if (body instanceof Term.Variable v)
            return v.name().equals(param) ? replacement : v;
        if (body instanceof Term.Abstraction abs) {
            if (abs.param().equals(param)) return abs;
            return abs.withBody(substitute(abs.body(), param, replacement));
        }
        if (body instanceof Term.Application app) {
            var func = substitute(app.func(), param, replacement);
            var arg = substitute(app.arg(), param, replacement);
            return func == app.func() && arg == app.arg() ? app : new Term.Application(func, arg);
        }
        return body;
    }

    /** Renames a clashing inner binder to {@code y'}, {@code y''}, ... before descending into it. */
    public static Term substituteAvoidingCapture(Term body, String param, Term replacement) {
        if (body instanceof Term.Variable v)
            return v.name().equals(param) ? replacement : v;
        if (body instanceof Term.Abstraction abs) {
            if (abs.param().equals(param)) return abs;

            var replacementFree = Analysis.freeVariables(replacement);
            if (replacementFree.contains(abs.param()) && Analysis.freeVariables(abs.body()).contains(param)) {
                var taken = new HashSet<>(replacementFree);
                taken.addAll(Analysis.variables(abs.body()));
                taken.add(param);
                var fresh = abs.param();
                while (taken.contains(fresh)) fresh += "'";

                var renamed = substitute(abs.body(), abs.param(), Term.Variable.of(fresh));
                return new Term.Abstraction(fresh, substituteAvoidingCapture(renamed, param, replacement), abs.paramType());
            }
            return abs.withBody(substituteAvoidingCapture(abs.body(), param, replacement));
        }
        if (body instanceof Term.Application app) {
            var func = substituteAvoidingCapture(app.func(), param, replacement);
            var arg = substituteAvoidingCapture(app.arg(), param, replacement);
            return func == app.func() && arg == app.arg() ? app : new Term.Application(func, arg);
        }
        return body;
    }
}
