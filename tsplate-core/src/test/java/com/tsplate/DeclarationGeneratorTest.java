package com.tsplate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationGeneratorTest {

    private static final String HEADER = "// Autogenerated code by typescript templating engine\n";

    @Test
    void testParamsWithImports() {
        String source = "@import({ A } from \"./a\")\n"
            + "@param(name: string)\n"
            + "@param(count: number = 1)\n"
            + "Body {{ name }}\n";

        assertEquals(HEADER
                + "\nimport { A } from \"./a\"\n"
                + "\nexport interface Params {\n"
                + "\tname: string\n"
                + "\tcount?: number\n"
                + "}",
            DeclarationGenerator.paramsToCodeString(Parser.parse(source, "test.tsplate")));
    }

    @Test
    void testParamsWithoutImports() {
        assertEquals(HEADER + "\nexport interface Params {\n\tx: T\n}",
            Parser.paramsToCodeString(Parser.parse("@param(x: T)", "test.tsplate")));
    }

    @Test
    void testNoParams() {
        assertEquals(HEADER + "\nexport interface Params {\n}",
            DeclarationGenerator.paramsToCodeString(Parser.parse("just text", "test.tsplate")));
    }

    @Test
    void testSlots() {
        String source = "@defslot(header: { title: string })@defslot(footer)@param(p: P)";

        assertEquals(HEADER + "\nexport interface Slots {\n\theader: { title: string }\n\tfooter: {}\n}",
            DeclarationGenerator.slotsToCodeString(Parser.parse(source, "test.tsplate")));
    }

    @Test
    void testOnlyHeaderIsConsidered() {
        String source = "@param(a: A){{ a }}@let(b = 1)";

        assertEquals(HEADER + "\nexport interface Params {\n\ta: A\n}",
            DeclarationGenerator.paramsToCodeString(Parser.parse(source, "test.tsplate")));
    }
}
