package dumb.lambda;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisTests extends AbstractTest {

    private static final Term COMPOSED = lam("x", app(v("f"), app("g", "x")));

    @Test
    void variablesInOrderOfFirstAppearance() {
        assertEquals(List.of("x", "f", "g"), Analysis.variables(COMPOSED));
        assertEquals(List.of("x"), Analysis.variables(lam("x", lam("x", v("x")))));
        assertEquals(List.of(), Analysis.variables(Term.Constant.of(1)));
    }

    @Test
    void freeVariables() {
        assertEquals(List.of("f", "g"), Analysis.freeVariables(COMPOSED));
        assertEquals(List.of(), Analysis.freeVariables(lam("x", app(lam("x", v("x")), v("x")))));
        assertEquals(List.of("x"), Analysis.freeVariables(app(lam("x", v("x")), v("x"))));
        assertEquals(List.of("y"), Analysis.freeVariables(app(lam("x", v("y")), lam("y", v("y")))));
    }

    @Test
    void complexity() {
        assertEquals(1, Analysis.complexity(v("x")));
        assertEquals(1, Analysis.complexity(Term.Constant.of("(x * 2)")));
        assertEquals(2, Analysis.complexity(lam("x", v("x"))));
        assertEquals(4, Analysis.complexity(COMPOSED));
    }

    @Test
    void complexityGrowsWithWrapping() {
        var term = COMPOSED;
        var c = Analysis.complexity(term);
        assertTrue(Analysis.complexity(lam("z", term)) > c);
        assertTrue(Analysis.complexity(app(term, v("a"))) > c);
        assertTrue(Analysis.complexity(app(v("a"), term)) > c);
    }

    @Test
    void typeSignatureOfAbstractions() {
        assertEquals("α → β", Analysis.typeSignature(lam("x", v("x"))));
        assertEquals("α → β → γ", Analysis.typeSignature(lam(List.of("x", "y"), v("x"))));
        assertEquals("α → γ", Analysis.typeSignature(COMPOSED));
    }

    @Test
    void applicationTakesCodomainOfFunction() {
        assertEquals("β", Analysis.typeSignature(app(lam("x", v("x")), v("y"))));
        assertEquals("β", Analysis.typeSignature(app("f", "x")));
    }

    @Test
    void constantTypes() {
        assertEquals("number", Analysis.typeSignature(Term.Constant.of(42)));
        assertEquals("boolean", Analysis.typeSignature(Term.Constant.of(true)));
        assertEquals("string", Analysis.typeSignature(Term.Constant.of("'hi'", Term.Constant.STRING)));
        assertEquals("α", Analysis.typeSignature(Term.Constant.of("(x * 2)")));
        assertEquals("α → number", Analysis.typeSignature(lam("x", Term.Constant.of(2))));
    }

    @Test
    void declaredParameterTypesAreUsed() {
        var term = new Term.Abstraction("a",
                new Term.Abstraction("b", app("concat", "a", "b"), "string"), "number");
        assertEquals("number → string → γ", Analysis.typeSignature(term));
    }

    @Test
    void typeVariablesGetNumberedOnceExhausted() {
        var params = new ArrayList<String>();
        for (var i = 0; i < 24; i++) params.add("p" + i);
        var signature = Analysis.typeSignature(lam(params, Term.Constant.of(0)));
        assertTrue(signature.startsWith("α → β → γ"), signature);
        assertTrue(signature.endsWith("ψ → ω → α1 → number"), signature);
    }

    @Test
    void eachCallStartsAFreshSupply() {
        assertEquals(Analysis.typeSignature(COMPOSED), Analysis.typeSignature(COMPOSED));
    }
}
