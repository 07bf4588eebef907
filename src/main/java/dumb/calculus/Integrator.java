package dumb.calculus;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static dumb.calculus.Expr.Fn.COS;
import static dumb.calculus.Expr.Fn.EXP;
import static dumb.calculus.Expr.Fn.SIN;
import static dumb.calculus.Expr.X;

/**
 * Antiderivatives over canonical trees. The constant of integration is never part of the tree.
 * <p>
 * No logarithm rule exists: exponents are non-negative, so x^-1 cannot reach this class.
 */
public final class Integrator {

    private final Step.Recorder steps;

    private Integrator(@Nullable List<Step> steps) {
        this.steps = new Step.Recorder(steps);
    }

    public static Expr integrate(Expr canonical) {
        return integrate(canonical, null);
    }

    /**
     * @param steps optional sink receiving one {@link Step} per rule application
     * @throws CalculusException.UnsupportedOperation  when a product is reached
     * @throws CalculusException.UnsupportedExpression when a raised exponent no longer fits an {@code int}
     * @throws IllegalArgumentException               when {@code canonical} is not in canonical form
     * @throws InvariantViolation                     if the antiderivative is not canonical
     */
    public static Expr integrate(Expr canonical, @Nullable List<Step> steps) {
        Differentiator.requireCanonical(canonical, "integrate");
        var engine = new Integrator(steps);
        try {
            return Invariants.require(engine.i(canonical, 0), "integrate");
        } catch (CalculusException e) {
            engine.steps.discard();
            throw e;
        }
    }

    private Expr i(Expr e, int depth) {
        var slot = steps.reserve();
        return switch (e.kind()) {
            case CONST -> steps.record(slot, depth, "constant rule", e,
                    Normalizer.scale(((Expr.Const) e).value(), X));
            case VAR -> steps.record(slot, depth, "power rule", e,
                    Normalizer.scale(Rational.of(1, 2), Expr.power(2)));
            case POWER -> {
                var m = Normalizer.addExponents(((Expr.Power) e).exponent(), 1);
                yield steps.record(slot, depth, "power rule", e,
                        Normalizer.scale(Rational.of(1, m), Normalizer.power(m)));
            }
            case MUL -> steps.record(slot, depth, "constant multiple", e,
                    Normalizer.scale(e.coefficient(), i(e.body(), depth + 1)));
            case SUM -> steps.record(slot, depth, "linearity", e,
                    Normalizer.sum(((Expr.Sum) e).terms().stream().map(t -> i(t, depth + 1)).toList()));
            case PROD -> throw new CalculusException.UnsupportedOperation(
                    "Integration of products is not supported: cannot integrate " + e);
            case FUNC -> {
                var f = (Expr.Func) e;
                var r = switch (f.fn()) {
                    case SIN -> Normalizer.scale(Rational.MINUS_ONE, Expr.func(COS));
                    case COS -> Expr.func(SIN);
                    case EXP -> Expr.func(EXP);
                };
                yield steps.record(slot, depth, f.fn().label + " rule", e, r);
            }
        };
    }
}
