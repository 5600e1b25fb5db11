package dumb.lambda;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InputKindTests {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "(x) => x * 2                | CODE",
            "function inc(n) { return n }| CODE",
            "const a = 1                 | CODE",
            "λx. x + 1                   | MATHEMATICAL",
            "\\x. x                      | MATHEMATICAL",
            "x. f x                      | MATHEMATICAL",
            "map x to f(x)               | NATURAL_LANGUAGE",
            "compose f and g             | NATURAL_LANGUAGE",
            "it returns a functional     | NATURAL_LANGUAGE",
            "Xy. z                       | NATURAL_LANGUAGE"
    })
    void detect(String input, InputKind expected) {
        assertEquals(expected, InputKind.detect(input));
    }

    @Test
    void codeMarkersWinOverNotation() {
        assertEquals(InputKind.CODE, InputKind.detect("λx. x => x"));
    }

    @Test
    void ofWireName() {
        assertEquals(Optional.of(InputKind.CODE), InputKind.of("code"));
        assertEquals(Optional.of(InputKind.MATHEMATICAL), InputKind.of(" Mathematical "));
        assertEquals(Optional.of(InputKind.NATURAL_LANGUAGE), InputKind.of("natural_language"));
        assertEquals(Optional.empty(), InputKind.of("bogus"));
        assertEquals(Optional.empty(), InputKind.of(null));
    }
}
