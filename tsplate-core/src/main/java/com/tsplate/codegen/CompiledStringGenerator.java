package com.tsplate.codegen;

import com.tsplate.CompilerOptions;
import com.tsplate.SafeString;
import com.tsplate.ast.*;

import java.util.List;
import java.util.StringJoiner;

/**
 * Emits the executable renderer body. Every statement that produces output appends
 * to the implicit {@code out} variable in document order; component slots are
 * closures with their own local {@code out}.
 *
 * <p>Declarations ({@code @param}, {@code @import}, {@code @defslot}) and {@code @end}
 * emit nothing here.</p>
 */
public final class CompiledStringGenerator implements StatementVisitor<String> {
    private final CompilerOptions options;

    public CompiledStringGenerator() {
        this(CompilerOptions.defaults());
    }

    public CompiledStringGenerator(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Compiles the top-level statements, one per line.
     */
    public String generate(List<Statement> statements) {
        StringJoiner joiner = new StringJoiner("\n");
        for (Statement statement : statements) {
            joiner.add(statement.accept(this));
        }
        return joiner.toString();
    }

    public String toCompiledString(Statement statement) {
        return statement.accept(this);
    }

    private String children(List<? extends Statement> statements) {
        StringBuilder sb = new StringBuilder("\n");
        for (Statement statement : statements) {
            sb.append(statement.accept(this)).append('\n');
        }
        return sb.toString();
    }

    private String lineMarker(int line) {
        return "$line = " + (line + 1);
    }

    private String withLine(Statement statement, String compiled) {
        if (!options.lineMarkers()) {
            return compiled;
        }
        return lineMarker(statement.position().lineStart()) + "\n\t" + compiled;
    }

    // Chain continuations carry their marker inside the braces so "} else" stays adjacent
    private String openBranch(Statement statement, String header) {
        if (!options.lineMarkers()) {
            return header + " {";
        }
        return header + " {\n" + lineMarker(statement.position().lineStart());
    }

    private String next(IfBranch next) {
        return next != null ? "\n" + next.accept(this) : "";
    }

    @Override
    public String visitText(TextStatement statement) {
        return "out += \"" + SafeString.escape(statement.value()) + "\"";
    }

    @Override
    public String visitInlineRaw(InlineRawStatement statement) {
        return withLine(statement, "out += String(" + statement.expression().rawText() + ")");
    }

    @Override
    public String visitInlineEscaped(InlineEscapedStatement statement) {
        return withLine(statement,
            "out += " + options.runtimeIdentifier() + ".safeString(String(" + statement.expression().rawText() + "))");
    }

    @Override
    public String visitEach(EachStatement statement) {
        return withLine(statement,
            "for (const " + statement.variable().rawText() + " of " + statement.iterator().rawText() + ") {"
                + children(statement.children()) + "}");
    }

    @Override
    public String visitIf(IfStatement statement) {
        return withLine(statement,
            "if (" + statement.condition().rawText() + ") {" + children(statement.children()) + "}"
                + next(statement.next()));
    }

    @Override
    public String visitElseIf(ElseIfStatement statement) {
        return openBranch(statement, "else if (" + statement.condition().rawText() + ")")
            + children(statement.children()) + "}" + next(statement.next());
    }

    @Override
    public String visitElse(ElseStatement statement) {
        return openBranch(statement, "else") + children(statement.children()) + "}";
    }

    @Override
    public String visitLet(LetStatement statement) {
        String value = statement.value() != null ? " = " + statement.value().rawText() : "";
        return withLine(statement, "let " + statement.name().rawText() + value);
    }

    @Override
    public String visitAssign(AssignStatement statement) {
        return withLine(statement, statement.name().rawText() + " = " + statement.value().rawText());
    }

    @Override
    public String visitParam(ParamStatement statement) {
        return "";
    }

    @Override
    public String visitImport(ImportStatement statement) {
        return "";
    }

    @Override
    public String visitDefineSlot(DefineSlotStatement statement) {
        return "";
    }

    @Override
    public String visitComponent(ComponentStatement statement) {
        return withLine(statement,
            "out += await " + options.runtimeIdentifier() + ".renderComponent("
                + statement.component().rawText() + ", " + statement.params().rawText() + ", {\n"
                + statement.mainSlot().accept(this)
                + children(statement.slots()) + "})");
    }

    @Override
    public String visitComponentMainSlot(ComponentMainSlotStatement statement) {
        return "main: async () => {\n\tlet out = \"\"" + children(statement.children()) + "return out\n}, ";
    }

    @Override
    public String visitComponentSlot(ComponentSlotStatement statement) {
        String parameter = statement.paramsVariable() != null ? statement.paramsVariable().rawText() : "";
        return statement.name().rawText() + ": async (" + parameter + ") => {\n\tlet out = \"\""
            + children(statement.children()) + "return out\n}, ";
    }

    @Override
    public String visitEnd(EndStatement statement) {
        return "";
    }
}
