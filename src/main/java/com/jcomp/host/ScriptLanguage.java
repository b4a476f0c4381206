package com.jcomp.host;

import com.jcomp.token.Fragment;

/**
 * The default host language: a small expression language with ints, floats, strings, chars,
 * tuples, lists, maps and ranges.
 */
public class ScriptLanguage implements HostLanguage {
    private final ScriptEvaluator evaluator = new ScriptEvaluator();

    @Override
    public HostExpression expression(Fragment fragment) {
        Expr expr = new ScriptParser(fragment).parseExpression();
        return scope -> evaluator.evaluate(expr, scope);
    }

    @Override
    public HostStatement statement(Fragment fragment) {
        Stmt stmt = new ScriptParser(fragment).parseStatement();
        return scope -> evaluator.execute(stmt, scope);
    }

    @Override
    public HostPattern pattern(Fragment fragment) {
        Pattern pattern = new ScriptParser(fragment).parsePattern();
        return (value, scope) -> evaluator.bind(pattern, value, scope);
    }
}
