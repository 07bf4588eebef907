package dumb.calculus;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.calculus.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Public surface of the engine: normalize, differentiate and integrate, on trees or on text.
 * Every tree returned here has passed {@link Invariants}.
 */
public class Calculus {

    public static final String CONFIG_RESOURCE = "/calculus.json";
    public static final String CONFIG_PROPERTY = "calculus.config";
    static final ExprPrinter.Mode DEFAULT_DISPLAY_MODE = ExprPrinter.Mode.FRACTION;
    static final int DEFAULT_DECIMAL_PLACES = 6;
    static final boolean DEFAULT_INTEGRATION_CONSTANT = true;
    static final boolean DEFAULT_SHOW_STEPS = false;
    private static final Logger logger = LoggerFactory.getLogger(Calculus.class);

    public final Configuration config;

    public Calculus(Configuration config) {
        this.config = requireNonNull(config);
    }

    public static void main(String[] args) {
        var config = Configuration.load();
        var json = false;
        var requests = new ArrayList<Request>();

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-d", "--diff" -> requests.add(new Request(Operation.DIFFERENTIATE, args[++i]));
                    case "-i", "--int" -> requests.add(new Request(Operation.INTEGRATE, args[++i]));
                    case "-n", "--norm" -> requests.add(new Request(Operation.NORMALIZE, args[++i]));
                    case "--decimal" -> config = config.withDisplayMode(ExprPrinter.Mode.DECIMAL);
                    case "--steps" -> config = config.withShowSteps(true);
                    case "--json" -> json = true;
                    default -> {
                        logger.warn("Unknown option: {}", args[i]);
                        printUsageAndExit();
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                logger.error("Missing expression after {}", args[i - 1]);
                printUsageAndExit();
            }
        }
        if (requests.isEmpty()) printUsageAndExit();

        var c = new Calculus(config);
        var failed = false;
        for (var r : requests) {
            try {
                var answer = c.run(r.operation(), r.text());
                if (json) {
                    System.out.println(Json.str(answer.toJson()));
                } else {
                    answer.steps().forEach(System.out::println);
                    System.out.println(answer.text());
                }
            } catch (CalculusException e) {
                System.err.println(e.getMessage());
                failed = true;
            }
        }
        if (failed) System.exit(1);
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [--decimal] [--steps] [--json] (-n|-d|-i) EXPR ...%n", Calculus.class.getName());
        System.err.println("  -n, --norm EXPR   print the canonical form");
        System.err.println("  -d, --diff EXPR   differentiate");
        System.err.println("  -i, --int EXPR    integrate");
        System.exit(2);
    }

    public Expr normalize(Expr raw) {
        return Normalizer.normalize(raw);
    }

    public Expr differentiate(Expr canonical) {
        return Differentiator.differentiate(canonical);
    }

    public Expr integrate(Expr canonical) {
        return Integrator.integrate(canonical);
    }

    public Answer normalize(String text) {
        return run(Operation.NORMALIZE, text);
    }

    public Answer differentiate(String text) {
        return run(Operation.DIFFERENTIATE, text);
    }

    public Answer integrate(String text) {
        return run(Operation.INTEGRATE, text);
    }

    /**
     * Parses, normalizes and applies {@code op} to {@code text}, rendering the result with the
     * variable letter the input used.
     *
     * @throws CalculusException  for malformed or unsupported input
     * @throws InvariantViolation if an engine produced a non-canonical tree
     */
    public Answer run(Operation op, String text) {
        requireNonNull(text);
        logger.debug("{} '{}'", op, text);
        try {
            var parsed = ExprParser.parse(text);
            var canonical = Normalizer.normalize(parsed.tree());
            var steps = config.showSteps() ? new ArrayList<Step>() : null;
            var result = switch (op) {
                case NORMALIZE -> canonical;
                case DIFFERENTIATE -> Differentiator.differentiate(canonical, steps);
                case INTEGRATE -> Integrator.integrate(canonical, steps);
            };
            var printer = new ExprPrinter(parsed.variable(), config.displayMode(), config.decimalPlaces());
            var rendered = printer.print(result);
            if (op == Operation.INTEGRATE && config.integrationConstant()) rendered += " + C";
            var stepTexts = steps == null ? List.<String>of() : steps.stream().map(printer::print).toList();
            logger.debug("{} '{}' = {}", op, text, rendered);
            return new Answer(op, text, parsed.variable(), result, rendered, stepTexts);
        } catch (CalculusException e) {
            logger.info("{} '{}' rejected: {}", op, text, e.getMessage());
            throw e;
        } catch (InvariantViolation e) {
            logger.error("{} '{}' hit an engine defect in {}: {}", op, text, e.producer, e.violation);
            throw e;
        }
    }

    public enum Operation {
        NORMALIZE, DIFFERENTIATE, INTEGRATE
    }

    private record Request(Operation operation, String text) {
    }

    /** A rendered result: the canonical tree, its text and, when enabled, the derivation steps. */
    public record Answer(Operation operation, String input, String variable, Expr tree, String text,
                         List<String> steps) {
        public Answer {
            requireNonNull(operation);
            requireNonNull(tree);
            requireNonNull(text);
            steps = List.copyOf(steps);
        }

        public ObjectNode toJson() {
            var o = Json.node()
                    .put("operation", operation.name().toLowerCase(Locale.ROOT))
                    .put("input", input)
                    .put("variable", variable)
                    .put("text", text);
            o.set("tree", ExprJson.toJson(tree));
            var s = o.putArray("steps");
            steps.forEach(s::add);
            return o;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Configuration(
            @JsonProperty("displayMode") ExprPrinter.Mode displayMode,
            @JsonProperty("decimalPlaces") int decimalPlaces,
            @JsonProperty("integrationConstant") boolean integrationConstant,
            @JsonProperty("showSteps") boolean showSteps
    ) {
        @JsonCreator
        public Configuration(
                @JsonProperty("displayMode") @Nullable ExprPrinter.Mode displayMode,
                @JsonProperty("decimalPlaces") @Nullable Integer decimalPlaces,
                @JsonProperty("integrationConstant") @Nullable Boolean integrationConstant,
                @JsonProperty("showSteps") @Nullable Boolean showSteps
        ) {
            this(
                    displayMode != null ? displayMode : DEFAULT_DISPLAY_MODE,
                    decimalPlaces != null ? decimalPlaces : DEFAULT_DECIMAL_PLACES,
                    integrationConstant != null ? integrationConstant : DEFAULT_INTEGRATION_CONSTANT,
                    showSteps != null ? showSteps : DEFAULT_SHOW_STEPS
            );
        }

        public Configuration() {
            this(DEFAULT_DISPLAY_MODE, DEFAULT_DECIMAL_PLACES, DEFAULT_INTEGRATION_CONSTANT, DEFAULT_SHOW_STEPS);
        }

        public Configuration {
            requireNonNull(displayMode);
            if (decimalPlaces < 0) throw new IllegalArgumentException("decimalPlaces must be non-negative: " + decimalPlaces);
        }

        /**
         * The file named by the {@value #CONFIG_PROPERTY} system property, else the {@value #CONFIG_RESOURCE}
         * classpath resource, else defaults. Unreadable configuration falls back to defaults.
         */
        public static Configuration load() {
            var file = System.getProperty(CONFIG_PROPERTY);
            try {
                if (file != null) {
                    logger.info("Loading configuration from {}", file);
                    return parse(Files.readString(Path.of(file)));
                }
                try (var in = Calculus.class.getResourceAsStream(CONFIG_RESOURCE)) {
                    if (in != null) return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                }
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            }
            return new Configuration();
        }

        public static Configuration parse(String json) throws IOException {
            return Json.obj(json, Configuration.class);
        }

        public Configuration withDisplayMode(ExprPrinter.Mode mode) {
            return new Configuration(mode, decimalPlaces, integrationConstant, showSteps);
        }

        public Configuration withShowSteps(boolean show) {
            return new Configuration(displayMode, decimalPlaces, integrationConstant, show);
        }
    }
}
