package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

public record ElseIfStatement(
    Position position,
    Expression condition,
    List<Statement> children,
    IfBranch next  // Can be null
) implements IfBranch {
    public ElseIfStatement {
        children = List.copyOf(children);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ELSE_IF;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitElseIf(this);
    }

    @Override
    public boolean mustBeConsumedByParse() {
        return true;
    }
}
