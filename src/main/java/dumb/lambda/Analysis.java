package dumb.lambda;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural analyses over a term: variable enumeration, free variables, complexity and a
 * presentation-level type signature.
 */
public final class Analysis {

    public static final String ARROW = "→";

    private static final String[] TYPE_VARIABLES = {
            "α", "β", "γ", "δ", "ε", "ζ", "η", "θ", "ι", "κ", "μ", "ν",
            "ξ", "ο", "π", "ρ", "σ", "τ", "υ", "φ", "χ", "ψ", "ω"
    };

    private Analysis() {
    }

    /** Referenced and bound names, in order of first appearance. */
    public static List<String> variables(Term term) {
        var names = new LinkedHashSet<String>();
        collectVariables(term, names);
        return List.copyOf(names);
    }

    private static void collectVariables(Term term, Set<String> names) {
        if (term instanceof Term.Variable v) {
            names.add(v.name());
        } else if (term instanceof Term.Abstraction a) {
            names.add(a.param());
            collectVariables(a.body(), names);
        } else if (term instanceof Term.Application app) {
            collectVariables(app.func(), names);
            collectVariables(app.arg(), names);
        }
    }

    public static List<String> freeVariables(Term term) {
        var free = new LinkedHashSet<String>();
        collectFree(term, Set.of(), free);
        return List.copyOf(free);
    }

    private static void collectFree(Term term, Set<String> bound, Set<String> free) {
        if (term instanceof Term.Variable v) {
            if (!bound.contains(v.name())) free.add(v.name());
        } else if (term instanceof Term.Abstraction a) {
            collectFree(a.body(), bind(bound, a.param()), free);
        } else if (term instanceof Term.Application app) {
            collectFree(app.func(), bound, free);
            collectFree(app.arg(), bound, free);
        }
    }

    private static Set<String> bind(Set<String> bound, String name) {
        if (bound.contains(name)) return bound;
        var s = new HashSet<>(bound);
        s.add(name);
        return Set.copyOf(s);
    }

    public static int complexity(Term term) {
        if (term instanceof Term.Abstraction a)
            return 1 + complexity(a.body());
        if (term instanceof Term.Application app)
            return 1 + Math.max(complexity(app.func()), complexity(app.arg()));
        return 1;
    }

    /**
     * Sketch of a type signature, e.g. {@code α → β}.
     * <p>
     * No unification takes place; every variable occurrence gets its own fresh type variable and an
     * application's type is read off the textual codomain of its function's type.
     */
    public static String typeSignature(Term term) {
        return new TypeSketch().infer(term);
    }

    private static final class TypeSketch {
        private int next;

        String fresh() {
            var i = next++;
            var name = TYPE_VARIABLES[i % TYPE_VARIABLES.length];
            var round = i / TYPE_VARIABLES.length;
            return round == 0 ? name : name + round;
        }

        String infer(Term term) {
            if (term instanceof Term.Variable)
                return fresh();
            if (term instanceof Term.Constant c)
                return constantType(c);
            if (term instanceof Term.Abstraction a) {
                var domain = a.paramType() != null ? a.paramType() : fresh();
                return domain + " " + ARROW + " " + infer(a.body());
            }
            var app = (Term.Application) term;
            var funcType = infer(app.func());
            var arrow = funcType.lastIndexOf(ARROW);
            if (arrow < 0) return fresh();
            var codomain = funcType.substring(arrow + ARROW.length()).trim();
            return codomain.isEmpty() ? fresh() : codomain;
        }

        private String constantType(Term.Constant c) {
            if (c.valueType() != null) return c.valueType();
            if (c.value() instanceof Number) return Term.Constant.NUMBER;
            if (c.value() instanceof Boolean) return Term.Constant.BOOLEAN;
            return fresh();
        }
    }
}
