package com.jcomp.host;

import com.jcomp.EvaluationException;
import com.jcomp.PatternBindingException;
import com.jcomp.value.Scope;
import com.jcomp.value.Value;
import com.jcomp.value.Values;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

public class ScriptEvaluator {

    public Value evaluate(Expr expr, Scope scope) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        } else if (expr instanceof Expr.Variable variable) {
            return scope.lookup(variable.name());
        } else if (expr instanceof Expr.Unary unary) {
            return unary(unary.operator(), evaluate(unary.operand(), scope));
        } else if (expr instanceof Expr.Binary binary) {
            return binary(binary, scope);
        } else if (expr instanceof Expr.Conditional conditional) {
            return requireBool(evaluate(conditional.condition(), scope), "condition")
                ? evaluate(conditional.whenTrue(), scope)
                : evaluate(conditional.whenFalse(), scope);
        } else if (expr instanceof Expr.Range range) {
            return range(evaluate(range.start(), scope), evaluate(range.end(), scope), range.inclusive());
        } else if (expr instanceof Expr.TupleExpr tuple) {
            return new Value.TupleValue(tuple.elements().collect(e -> evaluate(e, scope)));
        } else if (expr instanceof Expr.ListExpr list) {
            return new Value.ListValue(list.elements().collect(e -> evaluate(e, scope)).toList());
        } else if (expr instanceof Expr.MapExpr map) {
            MutableMap<Value, Value> entries = Maps.mutable.empty();
            for (Expr.Entry entry : map.entries()) {
                entries.put(evaluate(entry.key(), scope), evaluate(entry.value(), scope));
            }
            return new Value.MapValue(entries);
        } else if (expr instanceof Expr.Call call) {
            ImmutableList<Value> arguments = call.arguments().collect(e -> evaluate(e, scope));
            return Builtins.call(call.function(), arguments, scope);
        } else if (expr instanceof Expr.Index index) {
            return index(evaluate(index.target(), scope), evaluate(index.index(), scope));
        }
        throw new IllegalStateException("Unhandled expression: " + expr);
    }

    public void execute(Stmt stmt, Scope scope) {
        if (stmt instanceof Stmt.ExprStmt exprStmt) {
            evaluate(exprStmt.expression(), scope);
        } else if (stmt instanceof Stmt.Block block) {
            for (Stmt inner : block.statements()) {
                execute(inner, scope);
            }
        } else if (stmt instanceof Stmt.Assign assign) {
            Value value = evaluate(assign.value(), scope);
            if (!assign.operator().equals("=")) {
                String op = assign.operator().substring(0, assign.operator().length() - 1);
                value = arithmetic(op, evaluate(assign.target(), scope), value);
            }
            store(assign.target(), value, scope);
        }
    }

    public void bind(Pattern pattern, Value value, Scope scope) {
        if (pattern instanceof Pattern.Bind bind) {
            scope.define(bind.name(), value);
        } else if (pattern instanceof Pattern.TuplePattern tuple) {
            ImmutableList<Value> elements;
            if (value instanceof Value.TupleValue t) {
                elements = t.elements();
            } else if (value instanceof Value.ListValue l) {
                elements = l.elements().toImmutable();
            } else {
                throw new PatternBindingException(describe(pattern), value, "expected a tuple of "
                    + tuple.elements().size() + " but got " + Values.typeName(value));
            }
            if (elements.size() != tuple.elements().size()) {
                throw new PatternBindingException(describe(pattern), value, "expected " + tuple.elements().size()
                    + " elements but got " + elements.size());
            }
            for (int i = 0; i < elements.size(); i++) {
                bind(tuple.elements().get(i), elements.get(i), scope);
            }
        }
        // Wildcard binds nothing
    }

    static String describe(Pattern pattern) {
        if (pattern instanceof Pattern.Bind bind) {
            return bind.name();
        } else if (pattern instanceof Pattern.TuplePattern tuple) {
            return tuple.elements().collect(ScriptEvaluator::describe).makeString("(", ", ", ")");
        }
        return "_";
    }

    private void store(Expr target, Value value, Scope scope) {
        if (target instanceof Expr.Variable variable) {
            scope.assign(variable.name(), value);
            return;
        }
        Expr.Index index = (Expr.Index) target;
        Value container = evaluate(index.target(), scope);
        Value key = evaluate(index.index(), scope);
        if (container instanceof Value.MapValue map) {
            map.entries().put(key, value);
        } else if (container instanceof Value.ListValue list) {
            list.elements().set(position(key, list.elements().size()), value);
        } else {
            throw new EvaluationException("Cannot assign into a value of type " + Values.typeName(container));
        }
    }

    private Value index(Value target, Value key) {
        if (target instanceof Value.MapValue map) {
            Value value = map.entries().get(key);
            if (value == null) {
                throw new EvaluationException("Key not found: " + Values.show(key));
            }
            return value;
        } else if (target instanceof Value.ListValue list) {
            return list.elements().get(position(key, list.elements().size()));
        } else if (target instanceof Value.TupleValue tuple) {
            return tuple.elements().get(position(key, tuple.arity()));
        } else if (target instanceof Value.StrValue str) {
            return Value.of(str.value().charAt(position(key, str.value().length())));
        }
        throw new EvaluationException("Cannot index a value of type " + Values.typeName(target));
    }

    private static int position(Value key, int size) {
        if (!(key instanceof Value.IntValue i)) {
            throw new EvaluationException("Index must be an int, got " + Values.typeName(key));
        }
        if (i.value() < 0 || i.value() >= size) {
            throw new EvaluationException("Index " + i.value() + " out of bounds for length " + size);
        }
        return (int) i.value();
    }

    private Value unary(String op, Value operand) {
        if (op.equals("!")) {
            return Value.of(!requireBool(operand, "operand of '!'"));
        }
        if (operand instanceof Value.IntValue i) {
            return Value.of(negateExact(i.value()));
        } else if (operand instanceof Value.FloatValue f) {
            return Value.of(-f.value());
        }
        throw new EvaluationException("Cannot negate a value of type " + Values.typeName(operand));
    }

    private Value binary(Expr.Binary binary, Scope scope) {
        String op = binary.operator();
        Value left = evaluate(binary.left(), scope);
        switch (op) {
            case "&&" -> {
                return Value.of(requireBool(left, "operand of '&&'")
                    && requireBool(evaluate(binary.right(), scope), "operand of '&&'"));
            }
            case "||" -> {
                return Value.of(requireBool(left, "operand of '||'")
                    || requireBool(evaluate(binary.right(), scope), "operand of '||'"));
            }
            default -> {
                Value right = evaluate(binary.right(), scope);
                return switch (op) {
                    case "==" -> Value.of(equal(left, right));
                    case "!=" -> Value.of(!equal(left, right));
                    case "<" -> Value.of(compare(left, right) < 0);
                    case "<=" -> Value.of(compare(left, right) <= 0);
                    case ">" -> Value.of(compare(left, right) > 0);
                    case ">=" -> Value.of(compare(left, right) >= 0);
                    default -> arithmetic(op, left, right);
                };
            }
        }
    }

    Value arithmetic(String op, Value left, Value right) {
        if (op.equals("+")) {
            if (left instanceof Value.StrValue || right instanceof Value.StrValue) {
                return Value.of(Builtins.display(left) + Builtins.display(right));
            }
            if (left instanceof Value.ListValue l && right instanceof Value.ListValue r) {
                MutableList<Value> joined = Lists.mutable.withAll(l.elements());
                joined.addAll(r.elements());
                return new Value.ListValue(joined);
            }
        }

        if (left instanceof Value.IntValue l && right instanceof Value.IntValue r) {
            try {
                long result = switch (op) {
                    case "+" -> Math.addExact(l.value(), r.value());
                    case "-" -> Math.subtractExact(l.value(), r.value());
                    case "*" -> Math.multiplyExact(l.value(), r.value());
                    case "/" -> divide(l.value(), r.value());
                    case "%" -> l.value() % r.value();
                    default -> throw new IllegalStateException("Unknown operator " + op);
                };
                return Value.of(result);
            } catch (ArithmeticException e) {
                throw new EvaluationException("Arithmetic error in " + l.value() + " " + op + " " + r.value()
                    + ": " + e.getMessage(), e);
            }
        }

        if (isNumber(left) && isNumber(right)) {
            double a = toDouble(left);
            double b = toDouble(right);
            double result = switch (op) {
                case "+" -> a + b;
                case "-" -> a - b;
                case "*" -> a * b;
                case "/" -> a / b;
                case "%" -> a % b;
                default -> throw new IllegalStateException("Unknown operator " + op);
            };
            return Value.of(result);
        }

        throw new EvaluationException("Operator '" + op + "' does not apply to "
            + Values.typeName(left) + " and " + Values.typeName(right));
    }

    private Value range(Value start, Value end, boolean inclusive) {
        if (start instanceof Value.IntValue s && end instanceof Value.IntValue e) {
            return new Value.RangeValue(s.value(), e.value(), inclusive, false);
        }
        if (start instanceof Value.CharValue s && end instanceof Value.CharValue e) {
            return new Value.RangeValue(s.value(), e.value(), inclusive, true);
        }
        throw new EvaluationException("Range bounds must both be ints or both be chars, got "
            + Values.typeName(start) + " and " + Values.typeName(end));
    }

    private static long divide(long dividend, long divisor) {
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            throw new ArithmeticException("long overflow");
        }
        return dividend / divisor;
    }

    private static boolean equal(Value left, Value right) {
        if (left instanceof Value.IntValue l && right instanceof Value.IntValue r) {
            return l.value() == r.value();
        }
        if (isNumber(left) && isNumber(right)) {
            return toDouble(left) == toDouble(right);
        }
        return left.equals(right);
    }

    private static int compare(Value left, Value right) {
        if (left instanceof Value.IntValue l && right instanceof Value.IntValue r) {
            return Long.compare(l.value(), r.value());
        }
        if (isNumber(left) && isNumber(right)) {
            return Double.compare(toDouble(left), toDouble(right));
        }
        if (left instanceof Value.StrValue l && right instanceof Value.StrValue r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof Value.CharValue l && right instanceof Value.CharValue r) {
            return Character.compare(l.value(), r.value());
        }
        throw new EvaluationException("Cannot compare " + Values.typeName(left) + " with " + Values.typeName(right));
    }

    static boolean requireBool(Value value, String role) {
        if (value instanceof Value.BoolValue b) {
            return b.value();
        }
        throw new EvaluationException("Expected a bool for " + role + ", got " + Values.typeName(value)
            + " " + Values.show(value));
    }

    static boolean isNumber(Value value) {
        return value instanceof Value.IntValue || value instanceof Value.FloatValue;
    }

    static double toDouble(Value value) {
        return value instanceof Value.IntValue i ? i.value() : ((Value.FloatValue) value).value();
    }

    private static long negateExact(long value) {
        try {
            return Math.negateExact(value);
        } catch (ArithmeticException e) {
            throw new EvaluationException("Integer overflow negating " + value, e);
        }
    }
}
