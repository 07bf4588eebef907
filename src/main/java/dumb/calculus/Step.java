package dumb.calculus;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One rule application of a derivation: {@code rule} turned {@code from} into {@code to}.
 * Nested applications carry a larger {@code depth}; steps are listed parent first.
 */
public record Step(int depth, String rule, Expr from, Expr to) {

    public Step {
        requireNonNull(rule);
        requireNonNull(from);
        requireNonNull(to);
    }

    /**
     * Appends steps to an optional sink, keeping a parent's slot ahead of its children.
     * A failed derivation leaves the sink as it was before.
     */
    static final class Recorder {
        @Nullable
        private final List<Step> sink;
        private final int start;

        Recorder(@Nullable List<Step> sink) {
            this.sink = sink;
            this.start = sink != null ? sink.size() : 0;
        }

        void discard() {
            if (sink != null) sink.subList(start, sink.size()).clear();
        }

        int reserve() {
            if (sink == null) return -1;
            sink.add(null);
            return sink.size() - 1;
        }

        Expr record(int slot, int depth, String rule, Expr from, Expr to) {
            if (sink != null) sink.set(slot, new Step(depth, rule, from, to));
            return to;
        }
    }
}
