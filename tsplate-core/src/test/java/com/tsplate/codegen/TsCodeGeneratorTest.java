package com.tsplate.codegen;

import com.tsplate.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TsCodeGeneratorTest {

    private static MappedCode generate(String source) {
        return TsCodeGenerator.INSTANCE.generate(Parser.parse(source, "test.tsplate"));
    }

    @Test
    void testInlineExpression() {
        MappedCode mapped = generate("Hello {{ name }}!");

        assertEquals("String(name)", mapped.code());
        assertEquals(List.of(new MapItem(9, 7, 4)), mapped.mappings());
    }

    @Test
    void testRawAndEscapedShareSurface() {
        assertEquals(generate("{{ html }}").code(), generate("!{{ html }}").code());
        assertEquals("String(html)", generate("!{{ html }}").code());
    }

    @Test
    void testIfElse() {
        MappedCode mapped = generate("@if(x > 0)A@else B@end");

        assertEquals("if (x > 0) {\n\n}\nelse {\n\n}", mapped.code());
        assertEquals(List.of(new MapItem(4, 4, 5)), mapped.mappings());
    }

    @Test
    void testElseIfChain() {
        assertEquals("if (a) {\n\n}\nelse if (b) {\nString(x)\n}",
            generate("@if(a)@elseif(b){{ x }}@end").code());
    }

    @Test
    void testEach() {
        MappedCode mapped = generate("@each(item in items){{ item }}@end");

        assertEquals("for (const item of items) {\nString(item)\n}", mapped.code());
        assertEquals(List.of(new MapItem(6, 11, 4), new MapItem(14, 19, 5), new MapItem(23, 35, 4)),
            mapped.mappings());
    }

    @Test
    void testParams() {
        assertEquals("const name: string = \"World\"\ndeclare const n: number",
            generate("@param(name: string = \"World\")\n@param(n: number)").code());
    }

    @Test
    void testDefineSlot() {
        assertEquals("interface $Slots {\nheader: { title: string }\n}",
            generate("@defslot(header: { title: string })").code());
        assertEquals("interface $Slots {\nfooter: {}\n}", generate("@defslot(footer)").code());
    }

    @Test
    void testLetAssignImport() {
        assertEquals("let x = 1\nx = 2\nlet y", generate("@let(x = 1)@assign(x = 2)@let(y)").code());
        assertEquals("import { Foo } from \"./foo\"", generate("@import({ Foo } from \"./foo\")").code());
    }

    @Test
    void testComponent() {
        assertEquals("await Card.$render({ title: \"x\" }, {\n"
                + "main: async () => {\n\n\treturn \"\"\n}, \n"
                + "footer: async (props) => {\n\n\treturn \"\"\n}\n})",
            generate("@component(Card, { title: \"x\" })Body@slot(footer, props)F@end@end").code());
    }

    @Test
    void testTextOnlyProducesNothing() {
        MappedCode mapped = generate("just text\n");

        assertEquals("", mapped.code());
        assertTrue(mapped.mappings().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("every mapping covers text identical to the template expression it came from")
    @ValueSource(strings = {
        "Hello {{ name }}!",
        "@import({ A } from \"./a\")\n@defslot(s: { n: number })\n@param(p: string = 'x')\n{{ p }}",
        "@each(row in rows)\n  @if(row.ok)\n    !{{ row.html }}\n  @elseif(row.warn)\n    {{ row.text }}\n  @else\n  @end\n@end",
        "@let(total = 0)@each(x in xs)@assign(total = total + x)@end{{ total }}",
        "@component(Layout, { title })\n  {{ body }}\n  @slot(aside, info)\n    {{ info.text }}\n  @end\n@end"
    })
    void testMappingsRoundTrip(String source) {
        MappedCode mapped = generate(source);

        assertFalse(mapped.mappings().isEmpty());
        for (MapItem item : mapped.mappings()) {
            String templateText = source.substring(item.sourceOffset(), item.sourceOffset() + item.length());
            assertEquals(templateText, mapped.generatedText(item));
        }
    }
}
