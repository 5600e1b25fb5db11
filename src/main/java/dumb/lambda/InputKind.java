package dumb.lambda;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Surface form of an input, as detected or declared by the caller.
 */
public enum InputKind {
    CODE("code"),
    MATHEMATICAL("mathematical"),
    NATURAL_LANGUAGE("natural_language");

    private static final Pattern CODE_KEYWORD = Pattern.compile("\\b(function|const|return)\\b");
    private static final Pattern LEADING_BINDER = Pattern.compile("^[a-z]\\s*\\.\\s*");

    private final String wireName;

    InputKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Heuristic classification; first match wins, anything unrecognized is natural language.
     */
    public static InputKind detect(String input) {
        if (input.contains("=>") || CODE_KEYWORD.matcher(input).find())
            return CODE;
        if (input.indexOf('λ') >= 0 || input.indexOf('\\') >= 0 || LEADING_BINDER.matcher(input).find())
            return MATHEMATICAL;
        return NATURAL_LANGUAGE;
    }

    public static Optional<InputKind> of(@Nullable String name) {
        if (name == null) return Optional.empty();
        var n = name.trim().toLowerCase(Locale.ROOT);
        for (var k : values())
            if (k.wireName.equals(n)) return Optional.of(k);
        return Optional.empty();
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
