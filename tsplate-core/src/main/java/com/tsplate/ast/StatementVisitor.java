package com.tsplate.ast;

public interface StatementVisitor<R> {
    R visitText(TextStatement statement);

    R visitInlineRaw(InlineRawStatement statement);

    R visitInlineEscaped(InlineEscapedStatement statement);

    R visitEach(EachStatement statement);

    R visitIf(IfStatement statement);

    R visitElseIf(ElseIfStatement statement);

    R visitElse(ElseStatement statement);

    R visitLet(LetStatement statement);

    R visitAssign(AssignStatement statement);

    R visitParam(ParamStatement statement);

    R visitImport(ImportStatement statement);

    R visitDefineSlot(DefineSlotStatement statement);

    R visitComponent(ComponentStatement statement);

    R visitComponentMainSlot(ComponentMainSlotStatement statement);

    R visitComponentSlot(ComponentSlotStatement statement);

    R visitEnd(EndStatement statement);
}
