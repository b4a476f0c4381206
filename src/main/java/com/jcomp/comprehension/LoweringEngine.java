package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.EvaluationException;
import com.jcomp.host.HostExpression;
import com.jcomp.host.HostLanguage;
import com.jcomp.host.HostPattern;
import com.jcomp.host.HostSyntaxException;
import com.jcomp.value.Scope;
import com.jcomp.value.Value;
import com.jcomp.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps the accumulation action in one loop or guard per clause. The clause list is folded
 * from last to first, so the first clause written ends up outermost.
 */
public class LoweringEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoweringEngine.class);

    private final HostLanguage host;

    public LoweringEngine(HostLanguage host) {
        this.host = host;
    }

    public AccumulationAction action(BodyKind body) {
        if (body instanceof BodyKind.Sequence sequence) {
            return new AccumulationAction.Push(host.expression(sequence.expr()));
        } else if (body instanceof BodyKind.Mapping mapping) {
            return new AccumulationAction.Insert(host.expression(mapping.key()), host.expression(mapping.value()));
        }
        return new AccumulationAction.Execute(host.statement(((BodyKind.Statement) body).stmt()));
    }

    public LoweredNode lower(BodyKind body, ClauseList clauses) {
        LoweredNode node = new LoweredNode.Action(action(body));
        for (int i = clauses.size() - 1; i >= 0; i--) {
            node = wrap(clauses.get(i), node);
        }
        LOGGER.debug("Lowered {} body under {} nested levels", body.outputKind(), node.depth());
        return node;
    }

    /**
     * Lowers and turns the result into an executable comprehension; the tree itself is
     * not retained.
     */
    public Comprehension compile(String source, BodyKind body, ClauseList clauses) {
        return new Comprehension(source, body.outputKind(), toStep(lower(body, clauses)));
    }

    private LoweredNode wrap(Clause clause, LoweredNode child) {
        if (clause instanceof Clause.For forClause) {
            try {
                HostPattern pattern = host.pattern(forClause.pattern());
                HostExpression iterable = host.expression(forClause.iterable());
                return new LoweredNode.ForNode(forClause, pattern, iterable, child);
            } catch (HostSyntaxException e) {
                throw new ComprehensionSyntaxException(ErrorKind.MALFORMED_FOR_CLAUSE,
                    "Invalid 'for' clause: " + e.getMessage(), forClause.pattern().position(), e);
            }
        }

        Clause.If ifClause = (Clause.If) clause;
        try {
            return new LoweredNode.IfNode(ifClause, host.expression(ifClause.condition()), child);
        } catch (HostSyntaxException e) {
            throw new ComprehensionSyntaxException(ErrorKind.MALFORMED_IF_CLAUSE,
                "Invalid 'if' clause: " + e.getMessage(), ifClause.condition().position(), e);
        }
    }

    Step toStep(LoweredNode node) {
        if (node instanceof LoweredNode.ForNode forNode) {
            Step child = toStep(forNode.child());
            HostPattern pattern = forNode.pattern();
            HostExpression iterable = forNode.iterable();
            return (scope, accumulator) -> {
                for (Value element : Values.iterate(iterable.evaluate(scope))) {
                    Scope iteration = scope.child();
                    pattern.bind(element, iteration);
                    child.run(iteration, accumulator);
                }
            };
        } else if (node instanceof LoweredNode.IfNode ifNode) {
            Step child = toStep(ifNode.child());
            HostExpression condition = ifNode.condition();
            String text = ifNode.clause().condition().text();
            return (scope, accumulator) -> {
                if (test(condition.evaluate(scope), text)) {
                    child.run(scope, accumulator);
                }
            };
        }
        AccumulationAction action = ((LoweredNode.Action) node).action();
        return action::perform;
    }

    private static boolean test(Value value, String condition) {
        if (value instanceof Value.BoolValue b) {
            return b.value();
        }
        throw new EvaluationException("Condition '" + condition + "' produced "
            + Values.typeName(value) + " " + Values.show(value) + ", expected bool");
    }
}
