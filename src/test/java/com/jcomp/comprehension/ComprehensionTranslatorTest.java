package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.EvaluationException;
import com.jcomp.PatternBindingException;
import com.jcomp.host.HostExpression;
import com.jcomp.host.HostLanguage;
import com.jcomp.host.HostPattern;
import com.jcomp.host.HostStatement;
import com.jcomp.host.HostSyntaxException;
import com.jcomp.host.ScriptLanguage;
import com.jcomp.token.Fragment;
import com.jcomp.value.Scope;
import com.jcomp.value.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ComprehensionTranslatorTest {

    private final ComprehensionTranslator translator = new ComprehensionTranslator();

    private Value evaluate(String source) {
        return translator.translate(source).evaluate();
    }

    private static Value ints(long... values) {
        MutableList<Value> elements = Lists.mutable.empty();
        for (long value : values) {
            elements.add(Value.of(value));
        }
        return new Value.ListValue(elements);
    }

    // ============================================================
    // Output kinds
    // ============================================================

    @Test
    public void testSequenceResult() {
        assertEquals(ints(1, 4, 9, 16, 25, 36, 49, 64, 81, 100), evaluate("x * x for x in 1..=10"));
    }

    @Test
    public void testMappingResult() {
        MutableMap<Value, Value> expected = Maps.mutable.empty();
        for (long x = 2; x <= 10; x += 2) {
            expected.put(Value.of(x), Value.of(x * x));
        }

        assertEquals(new Value.MapValue(expected), evaluate("x: x * x for x in 1..=10 if x % 2 == 0"));
    }

    @Test
    public void testStatementResultIsUnit() {
        Scope scope = new Scope().define("n", Value.of(0L));
        Comprehension comprehension = translator.translate("n += x * x; for x in 1..=10");

        assertEquals(Value.unit(), comprehension.evaluate(scope));
        assertEquals(Value.of(385L), scope.lookup("n"));
        assertEquals(OutputKind.STATEMENT, comprehension.outputKind());
    }

    // ============================================================
    // Nesting order
    // ============================================================

    @Test
    public void testTextualOrderIsNestingOrder() {
        Value result = evaluate("x * 10 + y for x in 1..=2 for y in 1..=3");

        assertEquals(ints(11, 12, 13, 21, 22, 23), result);
    }

    @Test
    public void testInnerLoopSeesOuterVariable() {
        Value result = evaluate("x * 10 + y for x in 1..=3 for y in x..=3");

        assertEquals(ints(11, 12, 13, 22, 23, 33), result);
    }

    @Test
    public void testGuardSkipsWholeInnerLoop() {
        Scope scope = new Scope().define("calls", Value.of(0L));
        translator.translate("calls += 1; for x in 1..=4 if x > 2 for y in 1..=5").evaluate(scope);

        assertEquals(Value.of(10L), scope.lookup("calls"));
    }

    @Test
    public void testFalseGuardNeverEvaluatesBody() {
        assertEquals(ints(2, 1), evaluate("2 / x for x in 0..=3 if x != 0 if x < 3"));
        assertEquals(ints(), evaluate("1 / 0 for x in 1..=3 if false"));
    }

    @Test
    public void testEquivalentToNestedLoops() {
        Value result = evaluate("x * y for x in 1..=10 if x % 2 != 0 for y in -2..=2 if x > y");

        MutableList<Value> expected = Lists.mutable.empty();
        for (long x = 1; x <= 10; x++) {
            if (x % 2 != 0) {
                for (long y = -2; y <= 2; y++) {
                    if (x > y) {
                        expected.add(Value.of(x * y));
                    }
                }
            }
        }
        assertEquals(new Value.ListValue(expected), result);
    }

    // ============================================================
    // Scoping and reuse
    // ============================================================

    @Test
    public void testLoopVariableShadowsWithoutClobbering() {
        Scope scope = new Scope().define("x", Value.of(100L));
        Value result = translator.translate("x for x in 1..=2").evaluate(scope);

        assertEquals(ints(1, 2), result);
        assertEquals(Value.of(100L), scope.lookup("x"));
    }

    @Test
    public void testComprehensionCanBeEvaluatedRepeatedly() {
        Comprehension comprehension = translator.translate("x + k for x in 1..=3");

        Value first = comprehension.evaluate(new Scope().define("k", Value.of(0L)));
        Value second = comprehension.evaluate(new Scope().define("k", Value.of(10L)));

        assertEquals(ints(1, 2, 3), first);
        assertEquals(ints(11, 12, 13), second);
    }

    // ============================================================
    // Translation errors
    // ============================================================

    @Test
    public void testMissingLoopClause() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class,
            () -> translator.translate("x if x > 1"));
        assertEquals(ErrorKind.MISSING_LOOP_CLAUSE, e.getKind());
    }

    @Test
    public void testTranslationFailsBeforeAnythingRuns() {
        CountingHost counting = new CountingHost();

        assertThrows(ComprehensionSyntaxException.class,
            () -> new ComprehensionTranslator(counting).translate("println(x); for x in 1..=3 if x >"));
        assertEquals(0, counting.evaluations);
        assertEquals(2, counting.compiled);
    }

    @Test
    public void testUnparenthesizedTernaryInSequenceBodyIsSplitAsMapping() {
        assertThrows(HostSyntaxException.class, () -> translator.translate("x > 1 ? x : 0 for x in 1..=2"));
        assertEquals(ints(0, 2), evaluate("(x > 1 ? x : 0) for x in 1..=2"));
    }

    // ============================================================
    // Evaluation errors
    // ============================================================

    @Test
    public void testPatternMismatchAbortsAndKeepsEarlierSideEffects() {
        Scope scope = new Scope().define("n", Value.of(0L));
        Comprehension comprehension = translator.translate("n += a; for (a, b) in [(1, 2), (3, 4, 5), (6, 7)]");

        PatternBindingException e = assertThrows(PatternBindingException.class, () -> comprehension.evaluate(scope));
        assertEquals("(a, b)", e.getPattern());
        assertEquals(Value.of(1L), scope.lookup("n"));
    }

    @Test
    public void testNonBooleanCondition() {
        assertThrows(EvaluationException.class, () -> evaluate("x for x in 1..=3 if x"));
    }

    @Test
    public void testNonIterableSource() {
        assertThrows(EvaluationException.class, () -> evaluate("x for x in 5"));
    }

    @Test
    public void testStatementOutputGoesToScopeStream() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Scope scope = new Scope(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        translator.translate("println(x, y); for x in 1..=2 for y in 'a'..='b'").evaluate(scope);

        String expected = String.join(System.lineSeparator(), "1 a", "1 b", "2 a", "2 b") + System.lineSeparator();
        assertEquals(expected, buffer.toString(StandardCharsets.UTF_8));
    }

    /**
     * Delegating host that counts compilations and evaluations.
     */
    private static final class CountingHost implements HostLanguage {
        private int evaluations;
        private int compiled;
        private final ScriptLanguage delegate = new ScriptLanguage();

        @Override
        public HostExpression expression(Fragment fragment) {
            compiled++;
            HostExpression expression = delegate.expression(fragment);
            return scope -> {
                evaluations++;
                return expression.evaluate(scope);
            };
        }

        @Override
        public HostStatement statement(Fragment fragment) {
            compiled++;
            HostStatement statement = delegate.statement(fragment);
            return scope -> {
                evaluations++;
                statement.execute(scope);
            };
        }

        @Override
        public HostPattern pattern(Fragment fragment) {
            compiled++;
            return delegate.pattern(fragment);
        }
    }
}
