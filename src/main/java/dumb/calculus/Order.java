package dumb.calculus;

import java.util.Comparator;
import java.util.List;

/**
 * Fixed total order over canonical nodes, used to sort Prod factors and Sum terms.
 * <p>
 * Kinds rank Var &lt; Power &lt; Func &lt; Prod &lt; Const &lt; Sum. Powers compare by exponent, functions by
 * {@link Expr.Fn} declaration order (sin &lt; cos &lt; exp), products and sums lexicographically. A Mul is placed
 * by its body, ties broken by coefficient, so a sum's terms line up by what they multiply.
 */
public final class Order implements Comparator<Expr> {

    public static final Order the = new Order();

    private Order() {
    }

    private static int rank(Expr.Kind k) {
        return switch (k) {
            case VAR -> 0;
            case POWER -> 1;
            case FUNC -> 2;
            case PROD -> 3;
            case CONST -> 4;
            case SUM -> 5;
            case MUL -> throw new IllegalStateException("Mul has no rank of its own");
        };
    }

    @Override
    public int compare(Expr a, Expr b) {
        if (a.kind() == Expr.Kind.MUL || b.kind() == Expr.Kind.MUL) {
            var c = compare(a.body(), b.body());
            return c != 0 ? c : a.coefficient().compareTo(b.coefficient());
        }
        var c = Integer.compare(rank(a.kind()), rank(b.kind()));
        if (c != 0) return c;
        return switch (a.kind()) {
            case VAR -> 0;
            case CONST -> ((Expr.Const) a).value().compareTo(((Expr.Const) b).value());
            case POWER -> Integer.compare(((Expr.Power) a).exponent(), ((Expr.Power) b).exponent());
            case FUNC -> {
                var fa = (Expr.Func) a;
                var fb = (Expr.Func) b;
                var byName = fa.fn().compareTo(fb.fn());
                yield byName != 0 ? byName : compare(fa.arg(), fb.arg());
            }
            case PROD -> lexicographic(((Expr.Prod) a).factors(), ((Expr.Prod) b).factors());
            case SUM -> lexicographic(((Expr.Sum) a).terms(), ((Expr.Sum) b).terms());
            case MUL -> throw new IllegalStateException("unreachable");
        };
    }

    private int lexicographic(List<Expr> a, List<Expr> b) {
        var n = Math.min(a.size(), b.size());
        for (var i = 0; i < n; i++) {
            var c = compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
