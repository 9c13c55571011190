package com.tsplate.codegen;

import com.tsplate.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the source-mapped TypeScript surface of a template: declarations, imports,
 * control flow scaffolding and every inline expression site, nested the same way as
 * the template. Only the raw expressions are mapped back to the template.
 *
 * <p>Text and {@code @end} produce no fragment (null).</p>
 */
public final class TsCodeGenerator implements StatementVisitor<TsCode> {
    public static final TsCodeGenerator INSTANCE = new TsCodeGenerator();

    private TsCodeGenerator() {
    }

    /**
     * Generates and flattens the top-level statements, one per line.
     */
    public MappedCode generate(List<Statement> statements) {
        return children(statements).toMappedString();
    }

    public TsCode toTsCode(Statement statement) {
        return statement.accept(this);
    }

    private TsCode children(List<? extends Statement> statements) {
        return join(statements, "\n");
    }

    private TsCode join(List<? extends Statement> statements, String delimiter) {
        List<TsCode> codes = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            codes.add(statement.accept(this));
        }
        return TsCode.join(codes, delimiter);
    }

    private static TsCode expression(Expression expression) {
        return TsCode.expression(expression.position(), expression.rawText());
    }

    @Override
    public TsCode visitText(TextStatement statement) {
        return null;
    }

    // Raw and escaped inline statements share the same surface; escaping only exists at render time
    @Override
    public TsCode visitInlineRaw(InlineRawStatement statement) {
        return inline(statement.position().start(), statement.expression());
    }

    @Override
    public TsCode visitInlineEscaped(InlineEscapedStatement statement) {
        return inline(statement.position().start(), statement.expression());
    }

    private static TsCode inline(int sourceOffset, Expression expression) {
        return TsCode.builder()
            .text("String(").code(expression(expression)).text(")")
            .build(sourceOffset);
    }

    @Override
    public TsCode visitEach(EachStatement statement) {
        return TsCode.builder()
            .text("for (const ").code(expression(statement.variable()))
            .text(" of ").code(expression(statement.iterator()))
            .text(") {\n").code(children(statement.children()))
            .text("\n}")
            .build(statement.position().start());
    }

    @Override
    public TsCode visitIf(IfStatement statement) {
        return conditional("if (", statement.condition(), statement.children(), statement.next(),
            statement.position().start());
    }

    @Override
    public TsCode visitElseIf(ElseIfStatement statement) {
        return conditional("else if (", statement.condition(), statement.children(), statement.next(),
            statement.position().start());
    }

    private TsCode conditional(String keyword, Expression condition, List<Statement> children, IfBranch next,
                               int sourceOffset) {
        TsCode.Builder builder = TsCode.builder()
            .text(keyword).code(expression(condition))
            .text(") {\n").code(children(children))
            .text("\n}");
        if (next != null) {
            builder.text("\n").code(next.accept(this));
        }
        return builder.build(sourceOffset);
    }

    @Override
    public TsCode visitElse(ElseStatement statement) {
        return TsCode.builder()
            .text("else {\n").code(children(statement.children()))
            .text("\n}")
            .build(statement.position().start());
    }

    @Override
    public TsCode visitLet(LetStatement statement) {
        TsCode.Builder builder = TsCode.builder()
            .text("let ").code(expression(statement.name()));
        if (statement.value() != null) {
            builder.text(" = ").code(expression(statement.value()));
        }
        return builder.build(statement.position().start());
    }

    @Override
    public TsCode visitAssign(AssignStatement statement) {
        return TsCode.builder()
            .code(expression(statement.name()))
            .text(" = ").code(expression(statement.value()))
            .build(statement.position().start());
    }

    @Override
    public TsCode visitParam(ParamStatement statement) {
        TsCode.Builder builder = TsCode.builder();
        if (statement.defaultValue() != null) {
            builder.text("const ").code(expression(statement.name()))
                .text(": ").code(expression(statement.type()))
                .text(" = ").code(expression(statement.defaultValue()));
        } else {
            builder.text("declare const ").code(expression(statement.name()))
                .text(": ").code(expression(statement.type()));
        }
        return builder.build(statement.position().start());
    }

    @Override
    public TsCode visitImport(ImportStatement statement) {
        return TsCode.builder()
            .text("import ").code(expression(statement.clause()))
            .build(statement.position().start());
    }

    @Override
    public TsCode visitDefineSlot(DefineSlotStatement statement) {
        TsCode.Builder builder = TsCode.builder()
            .text("interface $Slots {\n").code(expression(statement.name()))
            .text(": ");
        if (statement.argumentType() != null) {
            builder.code(expression(statement.argumentType()));
        } else {
            builder.text("{}");
        }
        return builder.text("\n}").build(statement.position().start());
    }

    @Override
    public TsCode visitComponent(ComponentStatement statement) {
        return TsCode.builder()
            .text("await ").code(expression(statement.component()))
            .text(".$render(").code(expression(statement.params()))
            .text(", {\n").code(statement.mainSlot().accept(this))
            .text(", \n").code(join(statement.slots(), ", \n"))
            .text("\n})")
            .build(statement.position().start());
    }

    @Override
    public TsCode visitComponentMainSlot(ComponentMainSlotStatement statement) {
        return TsCode.builder()
            .text("main: async () => {\n").code(children(statement.children()))
            .text("\n\treturn \"\"\n}")
            .build(statement.position().start());
    }

    @Override
    public TsCode visitComponentSlot(ComponentSlotStatement statement) {
        TsCode.Builder builder = TsCode.builder()
            .code(expression(statement.name()))
            .text(": async (");
        if (statement.paramsVariable() != null) {
            builder.code(expression(statement.paramsVariable()));
        }
        return builder
            .text(") => {\n").code(children(statement.children()))
            .text("\n\treturn \"\"\n}")
            .build(statement.position().start());
    }

    @Override
    public TsCode visitEnd(EndStatement statement) {
        return null;
    }
}
