package com.tsplate.ast;

import com.tsplate.Position;

/**
 * {@code {{ expression }}}: the stringified value is written through the runtime escaper.
 */
public record InlineEscapedStatement(
    Position position,
    Expression expression
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.INLINE_ESCAPED;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitInlineEscaped(this);
    }
}
