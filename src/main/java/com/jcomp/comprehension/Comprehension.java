package com.jcomp.comprehension;

import com.jcomp.value.Scope;
import com.jcomp.value.Value;

/**
 * A translated comprehension, ready to run. Each evaluation builds its own container, so one
 * instance can be evaluated any number of times.
 */
public final class Comprehension {
    private final String source;
    private final OutputKind outputKind;
    private final Step root;

    Comprehension(String source, OutputKind outputKind, Step root) {
        this.source = source;
        this.outputKind = outputKind;
        this.root = root;
    }

    public String source() {
        return source;
    }

    public OutputKind outputKind() {
        return outputKind;
    }

    /**
     * Runs the nested loops in {@code scope}. Returns a list for sequence bodies, a map for
     * mapping bodies and unit for statement bodies. Any exception aborts the evaluation and
     * discards the partial container.
     */
    public Value evaluate(Scope scope) {
        Accumulator accumulator = Accumulator.forKind(outputKind);
        root.run(scope, accumulator);
        return accumulator.result();
    }

    public Value evaluate() {
        return evaluate(new Scope());
    }

    @Override
    public String toString() {
        return outputKind + "[" + source + "]";
    }
}
