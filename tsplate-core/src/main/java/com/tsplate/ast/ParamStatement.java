package com.tsplate.ast;

import com.tsplate.Position;

public record ParamStatement(
    Position position,
    Expression name,
    Expression type,
    Expression defaultValue  // Can be null
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.PARAM;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitParam(this);
    }
}
