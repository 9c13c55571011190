package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

public record EachStatement(
    Position position,
    Expression variable,
    Expression iterator,
    List<Statement> children
) implements Statement {
    public EachStatement {
        children = List.copyOf(children);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.EACH;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitEach(this);
    }
}
