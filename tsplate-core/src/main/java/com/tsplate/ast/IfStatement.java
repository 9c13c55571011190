package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

/**
 * Head of a conditional chain. When {@code next} is present the position ends where
 * the continuation starts.
 */
public record IfStatement(
    Position position,
    Expression condition,
    List<Statement> children,
    IfBranch next  // Can be null
) implements Statement {
    public IfStatement {
        children = List.copyOf(children);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.IF;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
