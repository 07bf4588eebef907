package dumb.calculus;

/**
 * User-facing failures. A caller receives one of the nested types and no partial result.
 * Engine defects are reported separately by {@link InvariantViolation}.
 */
public abstract class CalculusException extends RuntimeException {

    protected CalculusException(String message) {
        super(message);
    }

    /** Input text or a serialized tree does not match the grammar. */
    public static class Malformed extends CalculusException {
        private final int col;
        private final String context;

        public Malformed(String message) {
            this(message, -1, "");
        }

        public Malformed(String message, int col, String context) {
            super(message);
            this.col = col;
            this.context = context;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = col != -1 ? " at col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }

    /** Grammatically valid, but outside the supported algebraic domain. */
    public static class UnsupportedExpression extends CalculusException {
        public UnsupportedExpression(String message) {
            super(message);
        }
    }

    /** A calculus rule the engines deliberately do not implement (product rule, chain rule, logarithms). */
    public static class UnsupportedOperation extends CalculusException {
        public UnsupportedOperation(String message) {
            super(message);
        }
    }

    public static class DivisionByZero extends CalculusException {
        public DivisionByZero(String message) {
            super(message);
        }
    }
}
