package com.jcomp.host;

import com.jcomp.token.Fragment;
import com.jcomp.token.Token;
import com.jcomp.token.TokenKind;
import com.jcomp.value.Value;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Recursive descent parser for the script language. One instance parses one fragment.
 */
public class ScriptParser {
    private static final ImmutableSet<String> ASSIGNMENT_OPERATORS = Sets.immutable.of("=", "+=", "-=", "*=", "/=", "%=");

    private final Fragment fragment;
    private int pos;

    public ScriptParser(Fragment fragment) {
        this.fragment = fragment;
    }

    public Expr parseExpression() {
        requireNotEmpty("expression");
        Expr expr = expression();
        expectEnd();
        return expr;
    }

    public Stmt parseStatement() {
        requireNotEmpty("statement");
        MutableList<Stmt> statements = Lists.mutable.empty();
        statements.add(statement());
        while (match(";")) {
            if (atEnd()) {
                break;
            }
            statements.add(statement());
        }
        expectEnd();
        return statements.size() == 1 ? statements.getFirst() : new Stmt.Block(statements.toImmutable());
    }

    public Pattern parsePattern() {
        requireNotEmpty("pattern");
        Pattern pattern = pattern();
        expectEnd();
        return pattern;
    }

    private Stmt statement() {
        Expr expr = expression();
        Token next = peek();
        if (next != null && next.kind() == TokenKind.PUNCT && ASSIGNMENT_OPERATORS.contains(next.text())) {
            if (!(expr instanceof Expr.Variable) && !(expr instanceof Expr.Index)) {
                throw error("Cannot assign to this expression", next);
            }
            advance();
            return new Stmt.Assign(expr, next.text(), expression());
        }
        return new Stmt.ExprStmt(expr);
    }

    private Pattern pattern() {
        Token token = advance();
        if (token == null) {
            throw error("Pattern ends unexpectedly", null);
        }
        if (token.kind() == TokenKind.IDENTIFIER) {
            return token.text().equals("_") ? new Pattern.Wildcard() : new Pattern.Bind(token.text());
        }
        if (token.isPunct("(") || token.isPunct("[")) {
            String close = token.isPunct("(") ? ")" : "]";
            MutableList<Pattern> elements = Lists.mutable.empty();
            boolean trailingComma = false;
            while (!check(close)) {
                elements.add(pattern());
                trailingComma = match(",");
                if (!trailingComma) {
                    break;
                }
            }
            expect(close);
            // (x) groups like in expressions; (x,) is the one-element tuple
            if (token.isPunct("(") && elements.size() == 1 && !trailingComma) {
                return elements.getFirst();
            }
            return new Pattern.TuplePattern(elements.toImmutable());
        }
        throw error("Invalid pattern", token);
    }

    private Expr expression() {
        return conditional();
    }

    private Expr conditional() {
        Expr condition = or();
        if (match("?")) {
            Expr whenTrue = expression();
            expect(":");
            Expr whenFalse = conditional();
            return new Expr.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private Expr or() {
        Expr left = and();
        while (check("||")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, and());
        }
        return left;
    }

    private Expr and() {
        Expr left = equality();
        while (check("&&")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, equality());
        }
        return left;
    }

    private Expr equality() {
        Expr left = comparison();
        while (check("==") || check("!=")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, comparison());
        }
        return left;
    }

    private Expr comparison() {
        Expr left = range();
        while (check("<") || check("<=") || check(">") || check(">=")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, range());
        }
        return left;
    }

    private Expr range() {
        Expr start = additive();
        if (check("..") || check("..=")) {
            boolean inclusive = advance().text().equals("..=");
            return new Expr.Range(start, additive(), inclusive);
        }
        return start;
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (check("+") || check("-")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, multiplicative());
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (check("*") || check("/") || check("%")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, unary());
        }
        return left;
    }

    private Expr unary() {
        if (check("-") || check("!")) {
            String op = advance().text();
            return new Expr.Unary(op, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (check("(") && expr instanceof Expr.Variable variable) {
                Token open = advance();
                if (!Builtins.isDefined(variable.name())) {
                    throw error("Unknown function '" + variable.name() + "'", open);
                }
                expr = new Expr.Call(variable.name(), arguments(")"));
            } else if (match("[")) {
                Expr index = expression();
                expect("]");
                expr = new Expr.Index(expr, index);
            } else {
                return expr;
            }
        }
    }

    private Expr primary() {
        Token token = advance();
        if (token == null) {
            throw error("Expression ends unexpectedly", null);
        }

        switch (token.kind()) {
            case INTEGER -> {
                try {
                    return new Expr.Literal(Value.of(Long.parseLong(token.text())));
                } catch (NumberFormatException e) {
                    throw error("Integer literal out of range", token);
                }
            }
            case FLOAT -> {
                return new Expr.Literal(Value.of(Double.parseDouble(token.text())));
            }
            case STRING -> {
                return new Expr.Literal(Value.of(token.text()));
            }
            case CHAR -> {
                return new Expr.Literal(Value.of(token.text().charAt(0)));
            }
            case IDENTIFIER -> {
                return new Expr.Variable(token.text());
            }
            case KEYWORD -> {
                if (token.text().equals("true") || token.text().equals("false")) {
                    return new Expr.Literal(Value.of(Boolean.parseBoolean(token.text())));
                }
                throw error("Unexpected keyword '" + token.text() + "'", token);
            }
            case PUNCT -> {
                return group(token);
            }
            default -> throw error("Unexpected '" + token.text() + "'", token);
        }
    }

    private Expr group(Token open) {
        switch (open.text()) {
            case "(" -> {
                if (match(")")) {
                    return new Expr.Literal(Value.unit());
                }
                Expr first = expression();
                if (match(")")) {
                    return first;
                }
                expect(",");
                MutableList<Expr> elements = Lists.mutable.of(first);
                while (!check(")")) {
                    elements.add(expression());
                    if (!match(",")) {
                        break;
                    }
                }
                expect(")");
                return new Expr.TupleExpr(elements.toImmutable());
            }
            case "[" -> {
                return new Expr.ListExpr(arguments("]"));
            }
            case "{" -> {
                MutableList<Expr.Entry> entries = Lists.mutable.empty();
                while (!check("}")) {
                    Expr key = expression();
                    expect(":");
                    entries.add(new Expr.Entry(key, expression()));
                    if (!match(",")) {
                        break;
                    }
                }
                expect("}");
                return new Expr.MapExpr(entries.toImmutable());
            }
            default -> throw error("Unexpected '" + open.text() + "'", open);
        }
    }

    private ImmutableList<Expr> arguments(String close) {
        MutableList<Expr> arguments = Lists.mutable.empty();
        while (!check(close)) {
            arguments.add(expression());
            if (!match(",")) {
                break;
            }
        }
        expect(close);
        return arguments.toImmutable();
    }

    private void requireNotEmpty(String what) {
        if (fragment.isEmpty()) {
            throw new HostSyntaxException("Empty " + what, "", -1);
        }
    }

    private Token peek() {
        return pos < fragment.size() ? fragment.get(pos) : null;
    }

    private Token advance() {
        Token token = peek();
        if (token != null) {
            pos++;
        }
        return token;
    }

    private boolean atEnd() {
        return pos >= fragment.size();
    }

    private boolean check(String punct) {
        Token token = peek();
        return token != null && token.isPunct(punct);
    }

    private boolean match(String punct) {
        if (check(punct)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(String punct) {
        if (!match(punct)) {
            throw error("Expected '" + punct + "'", peek());
        }
    }

    private void expectEnd() {
        if (!atEnd()) {
            throw error("Unexpected '" + peek().source() + "'", peek());
        }
    }

    private HostSyntaxException error(String message, Token at) {
        int position = at != null ? at.position() : endPosition();
        return new HostSyntaxException(message, fragment.text(), position);
    }

    private int endPosition() {
        if (fragment.isEmpty()) {
            return -1;
        }
        Token last = fragment.get(fragment.size() - 1);
        return last.position() + last.text().length();
    }
}
