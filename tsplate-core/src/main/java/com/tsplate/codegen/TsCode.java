package com.tsplate.codegen;

import com.tsplate.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable fragment of generated TypeScript: literal text with child fragments
 * spliced in at fixed offsets of that text.
 *
 * <p>Fragments are composed with {@link Builder}, which records each child's splice
 * offset as the length of the literal text written before it. {@link #toMappedString()}
 * flattens the tree and reports, for every fragment marked as mapped, which template
 * offset produced which range of the output.</p>
 */
public final class TsCode {
    private final int sourceOffset;
    private final boolean shouldBeMapped;
    private final String literal;
    private final List<Child> children;

    private record Child(int parentOffset, TsCode code) {}

    private TsCode(int sourceOffset, boolean shouldBeMapped, String literal, List<Child> children) {
        this.sourceOffset = sourceOffset;
        this.shouldBeMapped = shouldBeMapped;
        this.literal = literal;
        this.children = Collections.unmodifiableList(children);
    }

    /**
     * A mapped leaf for a raw expression, copied verbatim.
     */
    public static TsCode expression(Position position, String text) {
        return new TsCode(position.start(), true, text, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Joins fragments with {@code delimiter}. Null entries contribute nothing and get
     * no delimiter of their own.
     */
    public static TsCode join(List<TsCode> codes, String delimiter) {
        List<Child> children = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        for (TsCode code : codes) {
            if (code == null) {
                continue;
            }
            children.add(new Child(literal.length(), code));
            literal.append(delimiter);
        }

        if (!children.isEmpty()) {
            literal.setLength(literal.length() - delimiter.length());
        }

        return new TsCode(0, false, literal.toString(), children);
    }

    public int sourceOffset() {
        return sourceOffset;
    }

    public boolean shouldBeMapped() {
        return shouldBeMapped;
    }

    public String literal() {
        return literal;
    }

    public int childCount() {
        return children.size();
    }

    public MappedCode toMappedString() {
        StringBuilder generated = new StringBuilder();
        List<MapItem> maps = new ArrayList<>();
        flatten(generated, maps);
        return new MappedCode(generated.toString(), maps);
    }

    private void flatten(StringBuilder generated, List<MapItem> maps) {
        int lastLiteralIndex = 0;

        for (Child child : children) {
            generated.append(literal, lastLiteralIndex, child.parentOffset());
            lastLiteralIndex = child.parentOffset();

            MappedCode childCode = child.code().toMappedString();
            int childStart = generated.length();

            if (child.code().shouldBeMapped) {
                maps.add(new MapItem(child.code().sourceOffset, childStart, childCode.code().length()));
            }
            for (MapItem childMap : childCode.mappings()) {
                maps.add(childMap.shift(childStart));
            }

            generated.append(childCode.code());
        }

        generated.append(literal, lastLiteralIndex, literal.length());
    }

    @Override
    public String toString() {
        return toMappedString().code();
    }

    /**
     * Collects literal pieces and child fragments in order. Each child is spliced at
     * the length of the literal text appended before it.
     */
    public static final class Builder {
        private final StringBuilder literal = new StringBuilder();
        private final List<Child> children = new ArrayList<>();

        private Builder() {
        }

        public Builder text(String text) {
            literal.append(text);
            return this;
        }

        /**
         * Splices {@code code} at the current end of the literal text. Null is ignored.
         */
        public Builder code(TsCode code) {
            if (code != null) {
                children.add(new Child(literal.length(), code));
            }
            return this;
        }

        public TsCode build(int sourceOffset) {
            return new TsCode(sourceOffset, false, literal.toString(), new ArrayList<>(children));
        }
    }
}
