package com.jcomp.comprehension;

import com.jcomp.host.HostExpression;
import com.jcomp.host.HostPattern;

/**
 * Nested loop/guard structure. Each loop or guard owns exactly one child; the innermost node
 * is always an {@link Action}.
 */
public sealed interface LoweredNode {

    record ForNode(Clause.For clause, HostPattern pattern, HostExpression iterable, LoweredNode child)
        implements LoweredNode {}

    record IfNode(Clause.If clause, HostExpression condition, LoweredNode child) implements LoweredNode {}

    record Action(AccumulationAction action) implements LoweredNode {}

    /**
     * Number of loop and guard levels above the action.
     */
    default int depth() {
        int depth = 0;
        LoweredNode node = this;
        while (true) {
            if (node instanceof ForNode f) {
                node = f.child();
            } else if (node instanceof IfNode i) {
                node = i.child();
            } else {
                return depth;
            }
            depth++;
        }
    }
}
