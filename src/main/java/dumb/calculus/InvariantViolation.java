package dumb.calculus;

/**
 * An engine returned a non-canonical tree. This is a defect in the engine, never a user error,
 * so it is an {@link AssertionError} and escapes any {@code catch (CalculusException)}.
 */
public final class InvariantViolation extends AssertionError {

    public final String producer;
    public final Invariants.Violation violation;
    public final Expr tree;

    public InvariantViolation(String producer, Invariants.Violation violation, Expr tree) {
        super("Internal defect: " + producer + " produced a non-canonical tree, " + violation + " in " + tree);
        this.producer = producer;
        this.violation = violation;
        this.tree = tree;
    }

    public Invariants.Rule rule() {
        return violation.rule();
    }
}
