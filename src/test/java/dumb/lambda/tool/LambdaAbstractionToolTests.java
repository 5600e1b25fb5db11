package dumb.lambda.tool;

import dev.langchain4j.agent.tool.ToolSpecifications;
import dumb.lambda.Abstractor;
import dumb.lambda.Abstractor.Configuration;
import dumb.lambda.tool.LambdaAbstractionTool.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LambdaAbstractionToolTests {

    private LambdaAbstractionTool tool;

    @BeforeEach
    void setUp() {
        tool = new LambdaAbstractionTool(new Abstractor());
    }

    private String run(Map<String, Object> parameters) {
        return tool.execute(parameters).join();
    }

    @Test
    void reportsAbstraction() {
        var out = run(Map.of("input", "(x) => x * 2"));
        assertTrue(out.startsWith("**Lambda Calculus Abstraction**\n\n"), out);
        assertTrue(out.contains("**Input:** (x) => x * 2\n"), out);
        assertTrue(out.contains("**Type:** code\n"), out);
        assertTrue(out.contains("**Lambda Notation:**\n```\nλx. (x * 2)\n```\n"), out);
        assertTrue(out.contains("**Type Signature:** `α → β`"), out);
        assertTrue(out.contains("- Complexity: 2\n"), out);
        assertTrue(out.contains("- Variables: x\n"), out);
        assertTrue(out.contains("- Free Variables: none\n"), out);
        assertFalse(out.contains("**Curried Form:**"), out);
        assertFalse(out.contains("**Beta Reduced:**"), out);
    }

    @Test
    void curriedFormShownWhenDifferent() {
        var out = run(Map.of("input", "(a, b) => plus(a, b)"));
        assertTrue(out.contains("**Curried Form:**\n```\nλa b. plus a b\n```"), out);
        assertTrue(out.contains("- Free Variables: plus\n"), out);
    }

    @Test
    void typesAndReductionCanBeTurnedOff() {
        var full = run(Map.of("input", "(λx. x) y"));
        assertTrue(full.contains("**Beta Reduced:**\n```\ny\n```"), full);
        assertTrue(full.contains("**Type Signature:**"), full);

        var bare = run(Map.of("input", "(λx. x) y", "include_types", false, "simplify", "false"));
        assertFalse(bare.contains("**Beta Reduced:**"), bare);
        assertFalse(bare.contains("**Type Signature:**"), bare);
    }

    @Test
    void inputTypeHint() {
        assertTrue(run(Map.of("input", "map x to f(x)", "input_type", "mathematical")).contains("**Type:** mathematical\n"));
        assertTrue(run(Map.of("input", "map x to f(x)", "input_type", "bogus")).contains("**Type:** natural_language\n"));
    }

    @Test
    void missingInputFails() {
        var e = assertThrows(CompletionException.class, () -> run(Map.of("input_type", "code")));
        assertInstanceOf(ToolExecutionException.class, e.getCause());
    }

    @Test
    void limitsAreEnforced() {
        var small = new LambdaAbstractionTool(new Abstractor(new Configuration(10, 2, true, true, false)));

        var tooLong = assertThrows(CompletionException.class,
                () -> small.execute(Map.of("input", "compose f and g")).join());
        assertInstanceOf(ToolExecutionException.class, tooLong.getCause());

        var tooDeep = assertThrows(CompletionException.class,
                () -> small.execute(Map.of("input", "f(g(h(x)))")).join());
        assertInstanceOf(ToolExecutionException.class, tooDeep.getCause());
        assertTrue(tooDeep.getCause().getMessage().contains("3 > 2"));
    }

    @Test
    void nestingDepth() {
        assertEquals(0, LambdaAbstractionTool.nestingDepth("x"));
        assertEquals(1, LambdaAbstractionTool.nestingDepth("(a)[b]{c}"));
        assertEquals(3, LambdaAbstractionTool.nestingDepth("{ f([x]) }"));
        assertEquals(1, LambdaAbstractionTool.nestingDepth(")) (x)"));
    }

    @Test
    void callableByLanguageModel() {
        var specs = ToolSpecifications.toolSpecificationsFrom(tool);
        assertEquals(1, specs.size());
        var spec = specs.get(0);
        assertEquals(LambdaAbstractionTool.NAME, spec.name());
        assertTrue(spec.description().startsWith("Converts processes or code"), spec.description());
        assertEquals(Set.of("input"), spec.parameters().properties().keySet());

        String out = tool.execute("compose f and g");
        assertTrue(out.startsWith("**Lambda Calculus Abstraction**"), out);
        assertTrue(out.contains("λx. f (g x)"), out);
    }

    @Test
    void plainInputLimitsThrow() {
        var small = new LambdaAbstractionTool(new Abstractor(new Configuration(10, 2, true, true, false)));
        var e = assertThrows(ToolExecutionException.class, () -> small.execute("compose f and g"));
        assertTrue(e.getMessage().startsWith("Input too long"), e.getMessage());
    }
}
