package com.tsplate;

import com.tsplate.ast.DefineSlotStatement;
import com.tsplate.ast.ImportStatement;
import com.tsplate.ast.ParamStatement;
import com.tsplate.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds standalone TypeScript declarations from the declaration header of a parsed
 * template (the leading run of imports, slot definitions and params).
 */
public final class DeclarationGenerator {
    static final String HEADER = "// Autogenerated code by typescript templating engine\n";

    private DeclarationGenerator() {
    }

    /**
     * Emits the imports verbatim followed by a {@code Params} interface with one
     * property per {@code @param}. Params with a default value are optional.
     */
    public static String paramsToCodeString(List<Statement> statements) {
        List<ImportStatement> imports = new ArrayList<>();
        List<ParamStatement> params = new ArrayList<>();

        for (Statement statement : header(statements)) {
            if (statement instanceof ImportStatement importStatement) {
                imports.add(importStatement);
            } else if (statement instanceof ParamStatement param) {
                params.add(param);
            }
        }

        StringBuilder code = new StringBuilder(HEADER);

        for (ImportStatement importStatement : imports) {
            code.append('\n').append(importStatement.toImportTsStatement());
        }
        if (!imports.isEmpty()) {
            code.append('\n');
        }

        code.append("\nexport interface Params {\n");
        for (ParamStatement param : params) {
            code.append('\t')
                .append(param.name().rawText())
                .append(param.defaultValue() != null ? "?" : "")
                .append(": ")
                .append(param.type().rawText())
                .append('\n');
        }
        code.append('}');

        return code.toString();
    }

    /**
     * Emits a {@code Slots} interface with one property per {@code @defslot}; slots
     * without an argument type take {@code {}}.
     */
    public static String slotsToCodeString(List<Statement> statements) {
        StringBuilder code = new StringBuilder(HEADER);
        code.append("\nexport interface Slots {\n");
        for (Statement statement : header(statements)) {
            if (statement instanceof DefineSlotStatement slot) {
                code.append('\t')
                    .append(slot.name().rawText())
                    .append(": ")
                    .append(slot.argumentType() != null ? slot.argumentType().rawText() : "{}")
                    .append('\n');
            }
        }
        code.append('}');
        return code.toString();
    }

    private static List<Statement> header(List<Statement> statements) {
        List<Statement> header = new ArrayList<>();
        for (Statement statement : statements) {
            if (!Parser.PARAM_ALLOWED_AFTER.contains(statement.kind())) {
                break;
            }
            header.add(statement);
        }
        return header;
    }
}
