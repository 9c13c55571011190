package com.tsplate;

import com.tsplate.ast.Statement;

/**
 * Thrown on the first syntax error in a template. Parsing never recovers, so a
 * template either yields a complete statement list or exactly one of these.
 */
public class ParserException extends RuntimeException {
    private final ErrorKind kind;
    private final Position position;
    private final String filePath;
    private final String baseMessage;
    private final int line;
    private final int column;

    public ParserException(ErrorKind kind, Position position, String filePath, String code, String message) {
        this(kind, position, filePath, message, position.locate(code).start());
    }

    private ParserException(ErrorKind kind, Position position, String filePath, String message,
                            SourceLocation.Point start) {
        super(message + "\nIn " + filePath + ":" + (start.line() + 1) + ":" + start.column() + " (" + position.start() + ")");
        this.kind = kind;
        this.position = position;
        this.filePath = filePath;
        this.baseMessage = message;
        this.line = start.line() + 1;
        this.column = start.column();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Position getPosition() {
        return position;
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * The message without the file/line suffix.
     */
    public String getBaseMessage() {
        return baseMessage;
    }

    /**
     * 1-based line of the error start.
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return position.start();
    }

    // ==================== Factories ====================

    static ParserException unexpected(Position position, String filePath, String code, String expected, String got) {
        String message = "Expected '" + expected + "'" + (got != null ? " and not '" + got + "'" : "") + "!";
        return new ParserException(ErrorKind.UNEXPECTED_TOKEN, position, filePath, code, message);
    }

    static ParserException invalidTagName(Position position, String filePath, String code, String tagName) {
        return new ParserException(ErrorKind.INVALID_TAG_NAME, position, filePath, code,
            "Invalid tag name '" + tagName + "'!");
    }

    static ParserException disallowedTagContext(Statement statement, String filePath, String code) {
        return new ParserException(ErrorKind.DISALLOWED_TAG_CONTEXT, statement.position(), filePath, code,
            "The tag '" + statement.kind().tag() + "' is not allowed here!");
    }

    static ParserException unexpectedArgumentCount(Position position, String filePath, String code,
                                                   int expectedCount, int gotCount) {
        return new ParserException(ErrorKind.WRONG_ARGUMENT_COUNT, position, filePath, code,
            "Expected " + expectedCount + " arguments, but instead got " + gotCount + "!");
    }

    static ParserException emptyExpression(Position position, String filePath, String code) {
        return new ParserException(ErrorKind.EMPTY_EXPRESSION, position, filePath, code,
            "Expected non empty expression!");
    }

    static ParserException invalidDeclarationOrder(Position position, String filePath, String code) {
        return new ParserException(ErrorKind.INVALID_DECLARATION_ORDER, position, filePath, code,
            "The imports, slots or params are in the wrong order. "
                + "First imports, then define the slots and last the params!");
    }

    static ParserException slotOutsideComponent(Position position, String filePath, String code) {
        return new ParserException(ErrorKind.SLOT_OUTSIDE_COMPONENT, position, filePath, code,
            "Slots can only exist inside components! If you meant to define a slot use '@defslot' instead.");
    }

    static ParserException reservedSlotName(Position position, String filePath, String code) {
        return new ParserException(ErrorKind.RESERVED_SLOT_NAME, position, filePath, code,
            "Cannot define slots named main, they are already predefined!");
    }
}
