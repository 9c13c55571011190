package com.tsplate.ast;

import com.tsplate.Position;

public record TextStatement(
    Position position,
    String value
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.TEXT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
