package dumb.calculus;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static dumb.calculus.Expr.Fn.COS;
import static dumb.calculus.Expr.Fn.EXP;
import static dumb.calculus.Expr.Fn.SIN;

/**
 * d/dx over canonical trees by structural recursion. Every branch re-normalizes its result.
 * Products are rejected: the product rule is outside the supported rule set.
 */
public final class Differentiator {

    private final Step.Recorder steps;

    private Differentiator(@Nullable List<Step> steps) {
        this.steps = new Step.Recorder(steps);
    }

    public static Expr differentiate(Expr canonical) {
        return differentiate(canonical, null);
    }

    /**
     * @param steps optional sink receiving one {@link Step} per rule application
     * @throws CalculusException.UnsupportedOperation when a product is reached
     * @throws IllegalArgumentException               when {@code canonical} is not in canonical form
     * @throws InvariantViolation                     if the derivative is not canonical
     */
    public static Expr differentiate(Expr canonical, @Nullable List<Step> steps) {
        requireCanonical(canonical, "differentiate");
        var engine = new Differentiator(steps);
        try {
            return Invariants.require(engine.d(canonical, 0), "differentiate");
        } catch (CalculusException e) {
            engine.steps.discard();
            throw e;
        }
    }

    static void requireCanonical(Expr e, String operation) {
        Invariants.check(e).ifPresent(v -> {
            throw new IllegalArgumentException(operation + " requires a normalized expression: " + v);
        });
    }

    private Expr d(Expr e, int depth) {
        var slot = steps.reserve();
        return switch (e.kind()) {
            case CONST -> steps.record(slot, depth, "constant rule", e, Expr.ZERO);
            case VAR -> steps.record(slot, depth, "variable rule", e, Expr.ONE);
            case POWER -> {
                var n = ((Expr.Power) e).exponent();
                yield steps.record(slot, depth, "power rule", e,
                        Normalizer.scale(Rational.of(n), Normalizer.power(n - 1)));
            }
            case MUL -> steps.record(slot, depth, "constant multiple", e,
                    Normalizer.scale(e.coefficient(), d(e.body(), depth + 1)));
            case SUM -> steps.record(slot, depth, "linearity", e,
                    Normalizer.sum(((Expr.Sum) e).terms().stream().map(t -> d(t, depth + 1)).toList()));
            case PROD -> throw new CalculusException.UnsupportedOperation(
                    "Product rule is not supported: cannot differentiate " + e);
            case FUNC -> {
                var f = (Expr.Func) e;
                var r = switch (f.fn()) {
                    case SIN -> Expr.func(COS);
                    case COS -> Normalizer.scale(Rational.MINUS_ONE, Expr.func(SIN));
                    case EXP -> Expr.func(EXP);
                };
                yield steps.record(slot, depth, f.fn().label + " rule", e, r);
            }
        };
    }
}
