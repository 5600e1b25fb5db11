package dumb.lambda;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Matches a few fixed English templates, tried in order against the lowercased input:
 * <ul>
 *     <li>{@code map X to Y} (or {@code for each X, compute Y}): {@code λX. Y}</li>
 *     <li>{@code apply F to X}: {@code F X}</li>
 *     <li>{@code compose F and G}: {@code λx. F (G x)}</li>
 * </ul>
 * Anything else is kept as a constant holding the input text.
 * <p>
 * The composition binder is always {@code x}, so {@code compose x and g} captures {@code x}
 * unless binders are renamed on request.
 */
public final class PhraseParser {

    private static final Pattern MAP = Pattern.compile("map\\s+(\\w+)\\s+to\\s+(.+)", Pattern.DOTALL);
    private static final Pattern FOR_EACH = Pattern.compile("for\\s+each\\s+(\\w+)\\s*,?\\s*compute\\s+(.+)", Pattern.DOTALL);
    private static final Pattern APPLY = Pattern.compile("apply\\s+(\\w+)\\s+to\\s+(\\w+)");
    private static final Pattern COMPOSE = Pattern.compile("compose\\s+(\\w+)\\s+and\\s+(\\w+)");
    private static final List<String> COMPOSE_BINDERS = List.of("x", "y", "z", "w", "v", "u");

    private PhraseParser() {
    }

    public static Term parse(String phrase) {
        return parse(phrase, false);
    }

    /**
     * @param renameBinders pick a composition binder distinct from the composed names
     */
    public static Term parse(String phrase, boolean renameBinders) {
        var lower = phrase.toLowerCase(Locale.ROOT);

        for (var template : List.of(MAP, FOR_EACH)) {
            var m = template.matcher(lower);
            if (m.find())
                return new Term.Abstraction(m.group(1), CodeParser.expression(m.group(2)));
        }

        var apply = APPLY.matcher(lower);
        if (apply.find())
            return new Term.Application(Term.Variable.of(apply.group(1)), Term.Variable.of(apply.group(2)));

        var compose = COMPOSE.matcher(lower);
        if (compose.find())
            return compose(compose.group(1), compose.group(2), renameBinders);

        return Term.Constant.of(phrase);
    }

    static Term compose(String f, String g, boolean renameBinder) {
        var x = !renameBinder ? COMPOSE_BINDERS.get(0) : COMPOSE_BINDERS.stream()
                .filter(b -> !b.equals(f) && !b.equals(g))
                .findFirst()
                .orElseThrow();
        var body = new Term.Application(Term.Variable.of(f),
                new Term.Application(Term.Variable.of(g), Term.Variable.of(x)));
        return new Term.Abstraction(x, body);
    }
}
