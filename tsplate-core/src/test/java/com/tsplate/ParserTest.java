package com.tsplate;

import com.tsplate.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static List<Statement> parse(String source) {
        return Parser.parse(source, "test.tsplate");
    }

    @Test
    void testTextAndInlineExpression() {
        List<Statement> statements = parse("Hello {{ name }}!");

        assertEquals(3, statements.size());
        assertEquals(new TextStatement(new Position(0, 6, 0), "Hello "), statements.get(0));

        InlineEscapedStatement inline = assertInstanceOf(InlineEscapedStatement.class, statements.get(1));
        assertEquals(new Position(6, 16, 0), inline.position());
        assertEquals("name", inline.expression().rawText());
        assertEquals(new Position(9, 13, 0), inline.expression().position());

        assertEquals(new TextStatement(new Position(16, 17, 0), "!"), statements.get(2));
    }

    @Test
    void testRawInlineExpression() {
        List<Statement> statements = parse("!{{ html }}");

        InlineRawStatement raw = assertInstanceOf(InlineRawStatement.class, statements.get(0));
        assertEquals("html", raw.expression().rawText());
        assertEquals(new Position(0, 11, 0), raw.position());
    }

    @Test
    void testInlineExpressionWithBraces() {
        List<Statement> statements = parse("{{ format({ a: 1 }) }}");

        InlineEscapedStatement inline = assertInstanceOf(InlineEscapedStatement.class, statements.get(0));
        assertEquals("format({ a: 1 })", inline.expression().rawText());
    }

    @Test
    void testEscapesProduceLiteralText() {
        List<Statement> statements = parse("a \\{{ b \\@ c");

        assertEquals(1, statements.size());
        TextStatement text = assertInstanceOf(TextStatement.class, statements.get(0));
        assertEquals("a {{ b @ c", text.value());
    }

    @Test
    void testCommentsAreDiscarded() {
        List<Statement> statements = parse("a{{-- hidden {{ x }} --}}b");

        assertEquals(2, statements.size());
        assertEquals("a", ((TextStatement) statements.get(0)).value());
        assertEquals("b", ((TextStatement) statements.get(1)).value());
        assertEquals(new Position(25, 26, 0), statements.get(1).position());
    }

    @Test
    void testTrailingCommentProducesNoStatement() {
        assertEquals(List.of(), parse("{{-- only a comment --}}"));
        assertEquals(1, parse("text {{-- note --}}").size());
    }

    @Test
    void testEachStatement() {
        List<Statement> statements = parse("@each(item in items)<li>{{ item }}</li>@end");

        assertEquals(1, statements.size());
        EachStatement each = assertInstanceOf(EachStatement.class, statements.get(0));
        assertEquals("item", each.variable().rawText());
        assertEquals("items", each.iterator().rawText());
        assertEquals(3, each.children().size());
        assertEquals(new Position(0, 43, 0), each.position());
    }

    @Test
    void testIfChain() {
        List<Statement> statements = parse("@if(a)A@elseif(b)B@else C@end");

        assertEquals(1, statements.size());
        IfStatement ifStatement = assertInstanceOf(IfStatement.class, statements.get(0));
        assertEquals("a", ifStatement.condition().rawText());
        assertEquals(List.of(new TextStatement(new Position(6, 7, 0), "A")), ifStatement.children());
        assertEquals(new Position(0, 7, 0), ifStatement.position());

        ElseIfStatement elseIf = assertInstanceOf(ElseIfStatement.class, ifStatement.next());
        assertEquals("b", elseIf.condition().rawText());
        assertEquals(new Position(7, 18, 0), elseIf.position());

        ElseStatement elseStatement = assertInstanceOf(ElseStatement.class, elseIf.next());
        assertEquals(" C", ((TextStatement) elseStatement.children().get(0)).value());
        assertEquals(new Position(18, 29, 0), elseStatement.position());
    }

    @Test
    @DisplayName("if chains are ElseIf* followed by an optional Else and always terminate")
    void testIfChainShape() {
        IfStatement ifStatement = (IfStatement) parse("@if(a)1@elseif(b)2@elseif(c)3@else 4@end").get(0);

        int elseIfs = 0;
        boolean sawElse = false;
        Statement current = ifStatement.next();
        while (current != null) {
            assertFalse(sawElse, "nothing may follow an else");
            if (current instanceof ElseIfStatement elseIf) {
                elseIfs++;
                current = elseIf.next();
            } else {
                assertInstanceOf(ElseStatement.class, current);
                sawElse = true;
                current = null;
            }
        }

        assertEquals(2, elseIfs);
        assertTrue(sawElse);
    }

    @Test
    void testIfWithoutElse() {
        IfStatement ifStatement = (IfStatement) parse("@if(ok)yes@end").get(0);

        assertNull(ifStatement.next());
        assertEquals(new Position(0, 14, 0), ifStatement.position());
    }

    @Test
    void testNestedBracketsInArguments() {
        IfStatement ifStatement = (IfStatement) parse("@if(fn(a, (b)) && c[0])x@end").get(0);

        assertEquals("fn(a, (b)) && c[0]", ifStatement.condition().rawText());
    }

    @Test
    void testLetAndAssign() {
        List<Statement> statements = parse("@let(x = 1)@let(y)@assign(x = x + 1)");

        LetStatement let = assertInstanceOf(LetStatement.class, statements.get(0));
        assertEquals("x", let.name().rawText());
        assertEquals("1", let.value().rawText());

        LetStatement bare = assertInstanceOf(LetStatement.class, statements.get(1));
        assertEquals("y", bare.name().rawText());
        assertNull(bare.value());

        AssignStatement assign = assertInstanceOf(AssignStatement.class, statements.get(2));
        assertEquals("x", assign.name().rawText());
        assertEquals("x + 1", assign.value().rawText());
    }

    @Test
    void testParams() {
        List<Statement> statements = parse("@param(name: string = \"World\")@param(count: number)");

        ParamStatement withDefault = assertInstanceOf(ParamStatement.class, statements.get(0));
        assertEquals("name", withDefault.name().rawText());
        assertEquals("string", withDefault.type().rawText());
        assertEquals("\"World\"", withDefault.defaultValue().rawText());

        ParamStatement required = assertInstanceOf(ParamStatement.class, statements.get(1));
        assertEquals("number", required.type().rawText());
        assertNull(required.defaultValue());
    }

    @Test
    void testImport() {
        ImportStatement importStatement = (ImportStatement) parse("@import({ Foo } from \"./foo\")").get(0);

        assertEquals("{ Foo } from \"./foo\"", importStatement.clause().rawText());
        assertEquals("./foo", importStatement.modulePath().orElseThrow());
    }

    @Test
    void testImportModulePathQuotes() {
        ImportStatement single = (ImportStatement) parse("@import(x from './single')").get(0);
        ImportStatement backtick = (ImportStatement) parse("@import(x from `./tick`)").get(0);
        ImportStatement none = (ImportStatement) parse("@import(x)").get(0);

        assertEquals("./single", single.modulePath().orElseThrow());
        assertEquals("./tick", backtick.modulePath().orElseThrow());
        assertTrue(none.modulePath().isEmpty());
    }

    @Test
    void testDefineSlot() {
        List<Statement> statements = parse("@defslot(header: { title: string })@defslot(footer)");

        DefineSlotStatement header = assertInstanceOf(DefineSlotStatement.class, statements.get(0));
        assertEquals("header", header.name().rawText());
        assertEquals("{ title: string }", header.argumentType().rawText());

        DefineSlotStatement footer = assertInstanceOf(DefineSlotStatement.class, statements.get(1));
        assertNull(footer.argumentType());
    }

    @Test
    @DisplayName("component body splits into the main slot and explicit slots")
    void testComponentPartition() {
        List<Statement> statements = parse("@component(Foo, {x:1}) body @slot(header) H @end @end");

        assertEquals(1, statements.size());
        ComponentStatement component = assertInstanceOf(ComponentStatement.class, statements.get(0));
        assertEquals("Foo", component.component().rawText());
        assertEquals("{x:1}", component.params().rawText());

        List<Statement> mainChildren = component.mainSlot().children();
        assertEquals(2, mainChildren.size());
        assertEquals("body", ((TextStatement) mainChildren.get(0)).value().strip());
        assertTrue(((TextStatement) mainChildren.get(1)).value().isBlank());

        assertEquals(1, component.slots().size());
        ComponentSlotStatement header = component.slots().get(0);
        assertEquals("header", header.name().rawText());
        assertNull(header.paramsVariable());
        assertEquals(List.of(new TextStatement(new Position(41, 44, 0), " H ")), header.children());
    }

    @Test
    void testComponentSlotWithParamsVariable() {
        ComponentStatement component =
            (ComponentStatement) parse("@component(Card, props)@slot(row, item){{ item.name }}@end@end").get(0);

        ComponentSlotStatement row = component.slots().get(0);
        assertEquals("row", row.name().rawText());
        assertEquals("item", row.paramsVariable().rawText());
        assertTrue(component.mainSlot().children().isEmpty());
    }

    @Test
    void testMainSlotKeepsSourceOrder() {
        ComponentStatement component =
            (ComponentStatement) parse("@component(C, p)a@slot(s)x@end{{ b }}@slot(t)y@end c@end").get(0);

        List<Statement> main = component.mainSlot().children();
        assertEquals(3, main.size());
        assertInstanceOf(TextStatement.class, main.get(0));
        assertInstanceOf(InlineEscapedStatement.class, main.get(1));
        assertInstanceOf(TextStatement.class, main.get(2));

        assertEquals("s", component.slots().get(0).name().rawText());
        assertEquals("t", component.slots().get(1).name().rawText());
    }

    @Test
    void testOrphanEndIsKept() {
        List<Statement> statements = parse("a@end");

        assertEquals(2, statements.size());
        assertInstanceOf(EndStatement.class, statements.get(1));
    }

    @Test
    void testLineTracking() {
        List<Statement> statements = parse("line1\n{{ x }}\n@if(\n  y\n)z@end");

        assertEquals(0, statements.get(0).position().lineStart());
        assertEquals(1, statements.get(1).position().lineStart());

        IfStatement ifStatement = (IfStatement) statements.get(3);
        assertEquals(2, ifStatement.position().lineStart());
        assertEquals(3, ifStatement.condition().position().lineStart());
        assertEquals("y", ifStatement.condition().rawText());
    }

    @Test
    void testDeclarationsAfterTextAreAllowed() {
        List<Statement> statements = parse("Title\n@import(a)\n@defslot(s)\n@param(p: T)\nBody");

        assertEquals(List.of(
            StatementKind.TEXT, StatementKind.IMPORT, StatementKind.TEXT, StatementKind.DEFINE_SLOT,
            StatementKind.TEXT, StatementKind.PARAM, StatementKind.TEXT),
            statements.stream().map(Statement::kind).toList());
    }

    @Test
    void testParserIsSingleUse() {
        Parser parser = new Parser("x", "test.tsplate");
        parser.parse();

        assertThrows(IllegalStateException.class, parser::parse);
    }

    @Test
    void testResultIsImmutable() {
        List<Statement> statements = parse("@each(x in xs)a@end");

        assertThrows(UnsupportedOperationException.class, () -> statements.add(null));
        EachStatement each = (EachStatement) statements.get(0);
        assertThrows(UnsupportedOperationException.class, () -> each.children().clear());
    }
}
