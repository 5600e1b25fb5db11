package dumb.lambda.tool;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;
import dumb.lambda.Abstractor;
import dumb.lambda.Abstractor.AbstractionResult;
import dumb.lambda.InputKind;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static dumb.lambda.util.Log.error;
import static dumb.lambda.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * The {@code lambda_abstraction} operation as a calling agent sees it: a parameter map in, a markdown report out.
 * The same operation is exposed to langchain4j tool calling through {@link #execute(String)}.
 */
public class LambdaAbstractionTool {

    public static final String NAME = "lambda_abstraction";
    private static final String DESCRIPTION = "Converts processes or code into lambda calculus representations. Shows Montague-style compositional semantics with type signatures.";

    private final Abstractor abstractor;

    public LambdaAbstractionTool(Abstractor abstractor) {
        this.abstractor = requireNonNull(abstractor);
    }

    /** Markdown report of a result, the way it is shown to an end user. */
    static String report(AbstractionResult result, boolean includeTypes, boolean simplify) {
        var out = new StringBuilder("**Lambda Calculus Abstraction**\n\n");
        out.append("**Input:** ").append(result.input()).append('\n');
        out.append("**Type:** ").append(result.inputType().wireName()).append("\n\n");

        out.append("**Lambda Notation:**\n```\n").append(result.notation()).append("\n```\n\n");

        if (!result.curried().equals(result.notation()))
            out.append("**Curried Form:**\n```\n").append(result.curried()).append("\n```\n\n");

        if (result.betaReduced() != null && simplify)
            out.append("**Beta Reduced:**\n```\n").append(result.betaReduced()).append("\n```\n\n");

        if (result.typeSignature() != null && includeTypes)
            out.append("**Type Signature:** `").append(result.typeSignature()).append("`\n\n");

        out.append("**Properties:**\n");
        out.append("- Complexity: ").append(result.complexity()).append('\n');
        out.append("- Variables: ").append(listOrNone(result.variables())).append('\n');
        out.append("- Free Variables: ").append(listOrNone(result.freeVariables())).append('\n');
        return out.toString();
    }

    private static String listOrNone(List<String> names) {
        return names.isEmpty() ? "none" : String.join(", ", names);
    }

    /** Deepest bracket nesting in the text. */
    static int nestingDepth(String input) {
        var depth = 0;
        var max = 0;
        for (var i = 0; i < input.length(); i++) {
            var c = input.charAt(i);
            if (c == '(' || c == '[' || c == '{') max = Math.max(max, ++depth);
            else if ((c == ')' || c == ']' || c == '}') && depth > 0) depth--;
        }
        return max;
    }

    public String name() {
        return NAME;
    }

    public String description() {
        return DESCRIPTION;
    }

    /**
     * @throws ToolExecutionException when the input exceeds the configured limits
     */
    @Tool(name = NAME, value = DESCRIPTION)
    public String execute(@P("Process description or code to abstract") String input) {
        return run(input, null, abstractor.config.includeTypes(), abstractor.config.simplify());
    }

    /**
     * Parameters: {@code input} (required), {@code input_type}, {@code include_types}, {@code simplify}.
     * Failures complete the future exceptionally with {@link ToolExecutionException}.
     */
    public CompletableFuture<String> execute(Map<String, Object> parameters) {
        if (!(parameters.get("input") instanceof String input)) {
            error(NAME + " requires an 'input' parameter.");
            return CompletableFuture.failedFuture(new ToolExecutionException("Missing 'input' parameter."));
        }

        var kindName = parameters.get("input_type") instanceof String s ? s : null;
        var kind = InputKind.of(kindName).orElse(null);
        if (kind == null && kindName != null)
            warning("Unknown input_type '" + kindName + "', detecting instead");

        try {
            return CompletableFuture.completedFuture(run(input, kind,
                    flag(parameters, "include_types", abstractor.config.includeTypes()),
                    flag(parameters, "simplify", abstractor.config.simplify())));
        } catch (ToolExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String run(String input, @Nullable InputKind kind, boolean includeTypes, boolean simplify) {
        var config = abstractor.config;
        if (input.length() > config.maxInputLength())
            throw new ToolExecutionException("Input too long: " + input.length() + " > " + config.maxInputLength() + " characters.");
        var depth = nestingDepth(input);
        if (depth > config.maxNestingDepth())
            throw new ToolExecutionException("Input nested too deeply: " + depth + " > " + config.maxNestingDepth() + ".");

        return report(abstractor.abstraction(input, kind), includeTypes, simplify);
    }

    private static boolean flag(Map<String, Object> parameters, String name, boolean defaultValue) {
        var v = parameters.get(name);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) return Boolean.parseBoolean(s);
        return defaultValue;
    }

    public static class ToolExecutionException extends RuntimeException {
        public ToolExecutionException(String msg) {
            super(msg);
        }
    }
}
