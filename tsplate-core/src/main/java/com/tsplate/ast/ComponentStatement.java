package com.tsplate.ast;

import com.tsplate.Position;

import java.util.List;

/**
 * {@code @component(Ref, params) ... @end}. Body content outside any {@code @slot}
 * ends up, in source order, in {@code mainSlot}.
 */
public record ComponentStatement(
    Position position,
    Expression component,
    Expression params,
    ComponentMainSlotStatement mainSlot,
    List<ComponentSlotStatement> slots
) implements Statement {
    public ComponentStatement {
        slots = List.copyOf(slots);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMPONENT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitComponent(this);
    }
}
