package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

public record ComponentMainSlotStatement(
    Position position,
    List<Statement> children
) implements Statement {
    public ComponentMainSlotStatement {
        children = List.copyOf(children);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMPONENT_MAIN_SLOT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitComponentMainSlot(this);
    }

    @Override
    public boolean mustBeConsumedByParse() {
        return true;
    }
}
