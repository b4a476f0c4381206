package com.jcomp.host;

import org.eclipse.collections.api.list.ImmutableList;

public sealed interface Stmt {
    /** {@code operator} is {@code "="} or a compound form such as {@code "+="}. */
    record Assign(Expr target, String operator, Expr value) implements Stmt {}
    record ExprStmt(Expr expression) implements Stmt {}
    record Block(ImmutableList<Stmt> statements) implements Stmt {}
}
