package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.host.HostSyntaxException;
import com.jcomp.host.ScriptLanguage;
import com.jcomp.token.Lexer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoweringEngineTest {

    private final LoweringEngine engine = new LoweringEngine(new ScriptLanguage());

    private LoweredNode lower(String source) {
        NormalizedStream stream = new Normalizer().normalize(new Lexer().tokenize(source));
        BodyKind body = new BodyClassifier().classify(stream);
        ClauseList clauses = new ClauseParser().parse(stream);
        return engine.lower(body, clauses);
    }

    @Test
    public void testFirstClauseBecomesOutermost() {
        LoweredNode root = lower("(x, y) for x in xs if x > 0 for y in ys");

        assertTrue(root instanceof LoweredNode.ForNode);
        LoweredNode.ForNode outer = (LoweredNode.ForNode) root;
        assertEquals("x", outer.clause().pattern().text());

        assertTrue(outer.child() instanceof LoweredNode.IfNode);
        LoweredNode.IfNode guard = (LoweredNode.IfNode) outer.child();
        assertEquals("x > 0", guard.clause().condition().text());

        assertTrue(guard.child() instanceof LoweredNode.ForNode);
        LoweredNode.ForNode inner = (LoweredNode.ForNode) guard.child();
        assertEquals("y", inner.clause().pattern().text());

        assertTrue(inner.child() instanceof LoweredNode.Action);
        assertEquals(3, root.depth());
    }

    @Test
    public void testActionFollowsBodyKind() {
        assertTrue(actionOf("x for x in xs") instanceof AccumulationAction.Push);
        assertTrue(actionOf("x : x for x in xs") instanceof AccumulationAction.Insert);
        assertTrue(actionOf("println(x); for x in xs") instanceof AccumulationAction.Execute);
    }

    private AccumulationAction actionOf(String source) {
        LoweredNode node = lower(source);
        while (node instanceof LoweredNode.ForNode f) {
            node = f.child();
        }
        return ((LoweredNode.Action) node).action();
    }

    @Test
    public void testInvalidPatternIsMalformedFor() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class,
            () -> lower("x for 1 in xs"));
        assertEquals(ErrorKind.MALFORMED_FOR_CLAUSE, e.getKind());
        assertTrue(e.getCause() instanceof HostSyntaxException);
    }

    @Test
    public void testInvalidIterableIsMalformedFor() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class,
            () -> lower("x for x in 1 +"));
        assertEquals(ErrorKind.MALFORMED_FOR_CLAUSE, e.getKind());
    }

    @Test
    public void testInvalidConditionIsMalformedIf() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class,
            () -> lower("x for x in xs if x >"));
        assertEquals(ErrorKind.MALFORMED_IF_CLAUSE, e.getKind());
    }

    @Test
    public void testInvalidBodyIsAHostError() {
        assertThrows(HostSyntaxException.class, () -> lower("x + for x in xs"));
    }
}
