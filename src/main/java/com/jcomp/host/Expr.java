package com.jcomp.host;

import com.jcomp.value.Value;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Syntax tree of a script expression.
 */
public sealed interface Expr {
    record Literal(Value value) implements Expr {}
    record Variable(String name) implements Expr {}
    record Unary(String operator, Expr operand) implements Expr {}
    record Binary(String operator, Expr left, Expr right) implements Expr {}
    record Conditional(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {}
    record Range(Expr start, Expr end, boolean inclusive) implements Expr {}
    record TupleExpr(ImmutableList<Expr> elements) implements Expr {}
    record ListExpr(ImmutableList<Expr> elements) implements Expr {}
    record MapExpr(ImmutableList<Entry> entries) implements Expr {}
    record Call(String function, ImmutableList<Expr> arguments) implements Expr {}
    record Index(Expr target, Expr index) implements Expr {}

    record Entry(Expr key, Expr value) {}
}
