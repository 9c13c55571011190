package com.tsplate.ast;

import com.tsplate.Position;

/**
 * Block terminator. Never holds children and contributes nothing to any output.
 */
public record EndStatement(
    Position position
) implements Statement {

    @Override
    public StatementKind kind() {
        return StatementKind.END;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitEnd(this);
    }
}
