package com.tsplate.ast;

import com.tsplate.Position;

/**
 * Raw TypeScript snippet embedded in a template. The compiler never looks inside it;
 * the text is copied verbatim into generated code.
 */
public record Expression(
    Position position,
    String rawText
) {
    @Override
    public String toString() {
        return rawText;
    }
}
