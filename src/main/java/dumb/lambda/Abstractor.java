package dumb.lambda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.lambda.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static dumb.lambda.util.Log.debug;
import static dumb.lambda.util.Log.error;
import static dumb.lambda.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Turns code, lambda notation or a templated phrase into a lambda term and describes it.
 * <p>
 * Instances hold only their immutable {@link Configuration} and may be shared between threads.
 */
public class Abstractor {

    public static final String CONFIG_RESOURCE = "/lambda-config.json";

    static final int DEFAULT_MAX_INPUT_LENGTH = 10_000;
    static final int DEFAULT_MAX_NESTING_DEPTH = 200;
    static final boolean DEFAULT_INCLUDE_TYPES = true;
    static final boolean DEFAULT_SIMPLIFY = true;
    static final boolean DEFAULT_CAPTURE_AVOIDING = false;

    public final Configuration config;

    public Abstractor() {
        this(new Configuration());
    }

    public Abstractor(Configuration config) {
        this.config = requireNonNull(config);
    }

    public AbstractionResult abstraction(String input) {
        return abstraction(input, null);
    }

    /**
     * @param kind declared surface form; detected from the input when null
     */
    public AbstractionResult abstraction(String input, @Nullable InputKind kind) {
        requireNonNull(input, "input");
        var inputKind = kind != null ? kind : InputKind.detect(input);
        debug("Abstracting " + inputKind.wireName() + " input: " + input);

        var term = parse(input, inputKind, config.captureAvoiding());

        var notation = Notation.toNotation(term);
        var reduced = Reduce.betaReduce(term, config.captureAvoiding());
        var reducedNotation = reduced == term ? notation : Notation.toNotation(reduced);

        return new AbstractionResult(
                true,
                input,
                inputKind,
                term,
                notation,
                Notation.toCurriedForm(term),
                reducedNotation.equals(notation) ? null : reducedNotation,
                Analysis.typeSignature(term),
                Analysis.complexity(term),
                Analysis.variables(term),
                Analysis.freeVariables(term));
    }

    public static Term parse(String input, InputKind kind, boolean renameBinders) {
        return switch (kind) {
            case CODE -> CodeParser.parse(input);
            case MATHEMATICAL -> MathParser.parse(input);
            case NATURAL_LANGUAGE -> PhraseParser.parse(input, renameBinders);
        };
    }

    public static void main(String[] args) {
        String config = null;
        String json = null;
        var words = new StringBuilder();

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> config = args[++i];
                    case "--json" -> json = args[++i];
                    default -> words.append(words.length() > 0 ? " " : "").append(args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                error("Missing value for " + args[i - 1]);
                printUsageAndExit();
            }
        }

        try {
            var abstractor = new Abstractor(config != null ? Configuration.load(Path.of(config)) : Configuration.load());

            Request request;
            if (json != null) request = Json.obj(json, Request.class);
            else if (words.length() > 0) request = new Request(words.toString(), null);
            else {
                printUsageAndExit();
                return;
            }
            if (request.input() == null) {
                error("Request has no input");
                printUsageAndExit();
                return;
            }

            var kind = InputKind.of(request.inputType()).orElse(null);
            if (kind == null && request.inputType() != null)
                warning("Unknown input type '" + request.inputType() + "', detecting instead");

            System.out.println(Json.str(abstractor.abstraction(request.input(), kind)));
        } catch (IOException e) {
            error("Failed: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [-c config.json] <input>%n", Abstractor.class.getName());
        System.err.printf("   OR: java %s [-c config.json] --json '{\"input\": \"...\", \"inputType\": \"...\"}'%n", Abstractor.class.getName());
        System.exit(1);
    }

    record Request(@JsonProperty("input") String input, @JsonProperty("inputType") @Nullable String inputType) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AbstractionResult(
            @JsonProperty("success") boolean success,
            @JsonProperty("input") String input,
            @JsonProperty("inputType") InputKind inputType,
            @JsonProperty("lambdaTerm") Term lambdaTerm,
            @JsonProperty("notation") String notation,
            @JsonProperty("curried") String curried,
            @JsonProperty("betaReduced") @Nullable String betaReduced,
            @JsonProperty("typeSignature") @Nullable String typeSignature,
            @JsonProperty("complexity") int complexity,
            @JsonProperty("variables") List<String> variables,
            @JsonProperty("freeVariables") List<String> freeVariables
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("maxInputLength") int maxInputLength,
            @JsonProperty("maxNestingDepth") int maxNestingDepth,
            @JsonProperty("includeTypes") boolean includeTypes,
            @JsonProperty("simplify") boolean simplify,
            @JsonProperty("captureAvoiding") boolean captureAvoiding
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("maxInputLength") Integer maxInputLength,
                @JsonProperty("maxNestingDepth") Integer maxNestingDepth,
                @JsonProperty("includeTypes") Boolean includeTypes,
                @JsonProperty("simplify") Boolean simplify,
                @JsonProperty("captureAvoiding") Boolean captureAvoiding
        ) {
            this(
                    maxInputLength != null ? maxInputLength : DEFAULT_MAX_INPUT_LENGTH,
                    maxNestingDepth != null ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH,
                    includeTypes != null ? includeTypes : DEFAULT_INCLUDE_TYPES,
                    simplify != null ? simplify : DEFAULT_SIMPLIFY,
                    captureAvoiding != null ? captureAvoiding : DEFAULT_CAPTURE_AVOIDING
            );
        }

        public Configuration() {
            this(DEFAULT_MAX_INPUT_LENGTH, DEFAULT_MAX_NESTING_DEPTH, DEFAULT_INCLUDE_TYPES, DEFAULT_SIMPLIFY, DEFAULT_CAPTURE_AVOIDING);
        }

        /**
         * Reads {@code lambda-config.json} from the classpath, falling back to defaults when it is absent or invalid.
         */
        public static Configuration load() {
            try (var in = Abstractor.class.getResourceAsStream(CONFIG_RESOURCE)) {
                if (in == null) return new Configuration();
                return Json.obj(in, Configuration.class);
            } catch (IOException e) {
                warning("Invalid " + CONFIG_RESOURCE + ", using defaults: " + e.getMessage());
                return new Configuration();
            }
        }

        public static Configuration load(Path file) throws IOException {
            return Json.obj(Files.readString(file), Configuration.class);
        }

        public static Configuration parse(String json) throws JsonProcessingException {
            return Json.obj(json, Configuration.class);
        }
    }
}
