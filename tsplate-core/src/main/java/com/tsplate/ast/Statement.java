package com.tsplate.ast;

import com.tsplate.Position;

/**
 * A parsed template statement. The hierarchy is closed; generators dispatch over it
 * through {@link StatementVisitor}.
 */
public sealed interface Statement permits
    TextStatement,
    InlineRawStatement,
    InlineEscapedStatement,
    EachStatement,
    IfStatement,
    IfBranch,
    LetStatement,
    AssignStatement,
    ParamStatement,
    ImportStatement,
    DefineSlotStatement,
    ComponentStatement,
    ComponentMainSlotStatement,
    ComponentSlotStatement,
    EndStatement {

    Position position();

    StatementKind kind();

    <R> R accept(StatementVisitor<R> visitor);

    /**
     * True for statements that only exist as part of an enclosing construct (chain
     * continuations and component slots). The parser rejects them at the top level.
     */
    default boolean mustBeConsumedByParse() {
        return false;
    }
}
