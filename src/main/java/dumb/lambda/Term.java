package dumb.lambda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A node of the untyped lambda calculus.
 * <p>
 * Terms are immutable. Scope is purely structural: a {@link Variable} is bound by the nearest
 * enclosing {@link Abstraction} with the same parameter name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Term.Variable.class, name = "variable"),
        @JsonSubTypes.Type(value = Term.Abstraction.class, name = "abstraction"),
        @JsonSubTypes.Type(value = Term.Application.class, name = "application"),
        @JsonSubTypes.Type(value = Term.Constant.class, name = "constant")
})
sealed public interface Term permits Term.Variable, Term.Abstraction, Term.Application, Term.Constant {

    /**
     * Wraps {@code body} in one abstraction per parameter, first parameter outermost.
     */
    static Term curry(List<String> params, Term body) {
        var term = requireNonNull(body);
        for (var i = params.size() - 1; i >= 0; i--)
            term = new Abstraction(params.get(i), term);
        return term;
    }

    record Variable(String name) implements Term {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Variable {
            requireNonNull(name);
        }

        public static Variable of(String name) {
            return new Variable(name);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Abstraction(String param, Term body, @Nullable String paramType) implements Term {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Abstraction {
            requireNonNull(param);
            requireNonNull(body);
        }

        public Abstraction(String param, Term body) {
            this(param, body, null);
        }

        public static Abstraction of(String param, Term body) {
            return new Abstraction(param, body);
        }

        Abstraction withBody(Term newBody) {
            return newBody == body ? this : new Abstraction(param, newBody, paramType);
        }
    }

    record Application(Term func, Term arg) implements Term {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Application {
            requireNonNull(func);
            requireNonNull(arg);
        }

        /**
         * Left-folds {@code args} onto {@code func}: {@code of(f, a, b)} is {@code (f a) b}.
         */
        public static Term of(Term func, Term... args) {
            var term = func;
            for (var arg : args)
                term = new Application(term, arg);
            return term;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Constant(Object value, @Nullable String valueType) implements Term {
        public static final String NUMBER = "number";
        public static final String STRING = "string";
        public static final String BOOLEAN = "boolean";

        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        public Constant {
            requireNonNull(value);
        }

        public static Constant of(Object value) {
            return new Constant(value, null);
        }

        public static Constant of(Object value, @Nullable String valueType) {
            return new Constant(value, valueType);
        }
    }
}
