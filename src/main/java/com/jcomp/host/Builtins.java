package com.jcomp.host;

import com.jcomp.EvaluationException;
import com.jcomp.value.Scope;
import com.jcomp.value.Value;
import com.jcomp.value.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Functions callable from script expressions.
 */
public final class Builtins {

    @FunctionalInterface
    private interface Function {
        Value apply(ImmutableList<Value> arguments, Scope scope);
    }

    private record Builtin(int minArity, int maxArity, Function function) {}

    private static final int VARARGS = Integer.MAX_VALUE;
    private static final ImmutableMap<String, Builtin> FUNCTIONS;

    static {
        MutableMap<String, Builtin> functions = Maps.mutable.empty();
        functions.put("len", new Builtin(1, 1, (args, scope) -> Value.of(length(args.get(0)))));
        functions.put("str", new Builtin(1, 1, (args, scope) -> Value.of(display(args.get(0)))));
        functions.put("abs", new Builtin(1, 1, (args, scope) -> abs(args.get(0))));
        functions.put("min", new Builtin(1, VARARGS, (args, scope) -> extreme(args, true)));
        functions.put("max", new Builtin(1, VARARGS, (args, scope) -> extreme(args, false)));
        functions.put("upper", new Builtin(1, 1, (args, scope) -> Value.of(display(args.get(0)).toUpperCase())));
        functions.put("lower", new Builtin(1, 1, (args, scope) -> Value.of(display(args.get(0)).toLowerCase())));
        functions.put("repeat", new Builtin(2, 2, (args, scope) -> repeat(args.get(0), args.get(1))));
        functions.put("format", new Builtin(1, VARARGS, (args, scope) -> format(args)));
        functions.put("println", new Builtin(0, VARARGS, (args, scope) -> {
            scope.out().println(args.collect(Builtins::display).makeString(" "));
            return Value.unit();
        }));
        FUNCTIONS = functions.toImmutable();
    }

    private Builtins() {
    }

    public static boolean isDefined(String name) {
        return FUNCTIONS.containsKey(name);
    }

    public static Value call(String name, ImmutableList<Value> arguments, Scope scope) {
        Builtin builtin = FUNCTIONS.get(name);
        if (builtin == null) {
            throw new EvaluationException("Unknown function '" + name + "'");
        }
        if (arguments.size() < builtin.minArity() || arguments.size() > builtin.maxArity()) {
            throw new EvaluationException("Function '" + name + "' called with " + arguments.size() + " arguments");
        }
        return builtin.function().apply(arguments, scope);
    }

    /**
     * Text of a value as it reads in output: strings and chars without quotes.
     */
    public static String display(Value value) {
        if (value instanceof Value.StrValue s) {
            return s.value();
        } else if (value instanceof Value.CharValue c) {
            return String.valueOf(c.value());
        }
        return Values.show(value);
    }

    private static long length(Value value) {
        if (value instanceof Value.StrValue s) {
            return s.value().length();
        } else if (value instanceof Value.ListValue l) {
            return l.elements().size();
        } else if (value instanceof Value.TupleValue t) {
            return t.arity();
        } else if (value instanceof Value.MapValue m) {
            return m.entries().size();
        } else if (value instanceof Value.RangeValue r) {
            return r.size();
        }
        throw new EvaluationException("len() does not apply to " + Values.typeName(value));
    }

    private static Value abs(Value value) {
        if (value instanceof Value.IntValue i) {
            if (i.value() == Long.MIN_VALUE) {
                throw new EvaluationException("abs() overflows for " + i.value());
            }
            return Value.of(Math.abs(i.value()));
        } else if (value instanceof Value.FloatValue f) {
            return Value.of(Math.abs(f.value()));
        }
        throw new EvaluationException("abs() does not apply to " + Values.typeName(value));
    }

    private static Value extreme(ImmutableList<Value> args, boolean min) {
        Iterable<Value> candidates = args.size() == 1 ? Values.iterate(args.get(0)) : args;
        Value best = null;
        for (Value candidate : candidates) {
            if (!ScriptEvaluator.isNumber(candidate)) {
                throw new EvaluationException((min ? "min" : "max") + "() expects numbers, got "
                    + Values.typeName(candidate));
            }
            if (best == null) {
                best = candidate;
                continue;
            }
            double c = ScriptEvaluator.toDouble(candidate);
            double b = ScriptEvaluator.toDouble(best);
            if (min ? c < b : c > b) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new EvaluationException((min ? "min" : "max") + "() of an empty sequence");
        }
        return best;
    }

    private static Value repeat(Value text, Value count) {
        if (!(count instanceof Value.IntValue n) || n.value() < 0) {
            throw new EvaluationException("repeat() count must be a non-negative int");
        }
        return Value.of(display(text).repeat((int) n.value()));
    }

    private static Value format(ImmutableList<Value> args) {
        if (!(args.get(0) instanceof Value.StrValue template)) {
            throw new EvaluationException("format() template must be a string");
        }
        String pattern = template.value();
        StringBuilder sb = new StringBuilder();
        int next = 1;
        int i = 0;
        while (i < pattern.length()) {
            if (pattern.startsWith("{}", i)) {
                if (next >= args.size()) {
                    throw new EvaluationException("format() has more placeholders than arguments");
                }
                sb.append(display(args.get(next++)));
                i += 2;
            } else {
                sb.append(pattern.charAt(i++));
            }
        }
        return Value.of(sb.toString());
    }
}
