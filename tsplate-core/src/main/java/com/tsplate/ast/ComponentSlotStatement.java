package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

public record ComponentSlotStatement(
    Position position,
    Expression name,
    Expression paramsVariable,  // Can be null
    List<Statement> children
) implements Statement {
    public ComponentSlotStatement {
        children = List.copyOf(children);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMPONENT_SLOT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitComponentSlot(this);
    }

    @Override
    public boolean mustBeConsumedByParse() {
        return true;
    }
}
