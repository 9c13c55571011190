package com.tsplate;

/**
 * Categories of template syntax errors reported through {@link ParserException}.
 */
public enum ErrorKind {
    UNEXPECTED_TOKEN,
    INVALID_TAG_NAME,
    DISALLOWED_TAG_CONTEXT,
    WRONG_ARGUMENT_COUNT,
    EMPTY_EXPRESSION,
    INVALID_DECLARATION_ORDER,
    SLOT_OUTSIDE_COMPONENT,
    RESERVED_SLOT_NAME
}
