package com.tsplate.ast;

import com.tsplate.Position;

/**
 * {@code !{{ expression }}}: the stringified value is written without escaping.
 */
public record InlineRawStatement(
    Position position,
    Expression expression
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.INLINE_RAW;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitInlineRaw(this);
    }
}
