package com.tsplate.ast;

/**
 * Discriminator for {@link Statement} variants. The type name is what the plain
 * description reports; the tag is what a template author writes.
 */
public enum StatementKind {
    TEXT("TextStatement", null),
    INLINE_RAW("InlineRawStatement", "!{{"),
    INLINE_ESCAPED("InlineEscapedStatement", "{{"),
    EACH("EachStatement", "@each"),
    IF("IfStatement", "@if"),
    ELSE_IF("ElseIfStatement", "@elseif"),
    ELSE("ElseStatement", "@else"),
    LET("LetStatement", "@let"),
    ASSIGN("AssignStatement", "@assign"),
    PARAM("ParamStatement", "@param"),
    IMPORT("ImportStatement", "@import"),
    DEFINE_SLOT("DefineSlotStatement", "@defslot"),
    COMPONENT("ComponentStatement", "@component"),
    COMPONENT_MAIN_SLOT("ComponentMainSlotStatement", "@component"),
    COMPONENT_SLOT("ComponentSlotStatement", "@slot"),
    END("EndStatement", "@end");

    private final String typeName;
    private final String tag;

    StatementKind(String typeName, String tag) {
        this.typeName = typeName;
        this.tag = tag;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Source syntax that opens this statement, or null for plain text.
     */
    public String tag() {
        return tag;
    }
}
