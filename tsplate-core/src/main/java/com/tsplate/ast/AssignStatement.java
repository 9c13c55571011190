package com.tsplate.ast;

import com.tsplate.Position;

public record AssignStatement(
    Position position,
    Expression name,
    Expression value
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.ASSIGN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}
