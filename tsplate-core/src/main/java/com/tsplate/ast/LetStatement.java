package com.tsplate.ast;

import com.tsplate.Position;

public record LetStatement(
    Position position,
    Expression name,
    Expression value  // Can be null
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.LET;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLet(this);
    }
}
