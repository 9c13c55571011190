package com.tsplate.ast;

import com.tsplate.Position;

/**
 * {@code @defslot(name[: ArgumentType])}: declares a slot the template accepts.
 */
public record DefineSlotStatement(
    Position position,
    Expression name,
    Expression argumentType  // Can be null
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.DEFINE_SLOT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDefineSlot(this);
    }
}
