package com.tsplate.codegen;

/**
 * One source map entry: {@code length} generated characters starting at
 * {@code generatedOffset} were produced by the expression starting at
 * {@code sourceOffset} in the template.
 */
public record MapItem(
    int sourceOffset,
    int generatedOffset,
    int length
) {
    MapItem shift(int generatedBase) {
        return new MapItem(sourceOffset, generatedBase + generatedOffset, length);
    }

    public boolean containsGenerated(int offset) {
        return offset >= generatedOffset && offset < generatedOffset + length;
    }
}
