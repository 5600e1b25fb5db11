package dumb.lambda;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class PhraseParserTests extends AbstractTest {

    @Test
    void mapTemplate() {
        assertEquals(lam("x", app("f", "x")), PhraseParser.parse("map x to f(x)"));
    }

    @Test
    void templatesMatchCaseInsensitively() {
        assertEquals(lam("x", app("f", "x")), PhraseParser.parse("Map X to F(X)"));
    }

    @Test
    void forEachIsAMapTemplate() {
        assertEquals(lam("n", app("square", "n")), PhraseParser.parse("for each n, compute square(n)"));
    }

    @Test
    void applyTemplate() {
        assertEquals(app("f", "x"), PhraseParser.parse("apply f to x"));
        assertEquals(app("inc", "n"), PhraseParser.parse("please apply inc to n now"));
    }

    @Test
    void composeTemplate() {
        assertEquals(lam("x", app(v("f"), app("g", "x"))), PhraseParser.parse("compose f and g"));
    }

    @Test
    void composeBinderIsAlwaysX() {
        assertEquals(lam("x", app(v("x"), app("g", "x"))), PhraseParser.parse("compose x and g"));
    }

    @Test
    void composeBinderCanAvoidTheComposedNames() {
        assertEquals(lam("y", app(v("x"), app("g", "y"))), PhraseParser.parse("compose x and g", true));
        assertEquals(lam("z", app(v("x"), app("y", "z"))), PhraseParser.parse("compose x and y", true));
        assertEquals(lam("x", app(v("f"), app("g", "x"))), PhraseParser.parse("compose f and g", true));
    }

    @Test
    void mapTakesPriority() {
        var term = assertInstanceOf(Term.Abstraction.class, PhraseParser.parse("map x to y and compose f and g"));
        assertEquals("x", term.param());
    }

    @Test
    void unmatchedPhraseIsConstantOfTheInputText() {
        assertEquals(Term.Constant.of("Hello World"), PhraseParser.parse("Hello World"));
    }
}
