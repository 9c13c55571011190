package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

public record ElseStatement(
    Position position,
    List<Statement> children
) implements IfBranch {
    public ElseStatement {
        children = List.copyOf(children);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ELSE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitElse(this);
    }

    @Override
    public boolean mustBeConsumedByParse() {
        return true;
    }
}
