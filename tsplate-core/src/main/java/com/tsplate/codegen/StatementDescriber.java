package com.tsplate.codegen;

import com.tsplate.ast.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces a plain structural description of statements: nested maps with a
 * {@code type} entry, expression fields as their raw text and described children.
 * Absent optional fields are left out, and so are {@code @end} statements.
 */
public final class StatementDescriber implements StatementVisitor<Map<String, Object>> {
    public static final StatementDescriber INSTANCE = new StatementDescriber();

    private StatementDescriber() {
    }

    public List<Map<String, Object>> describe(List<? extends Statement> statements) {
        List<Map<String, Object>> described = new ArrayList<>();
        for (Statement statement : statements) {
            Map<String, Object> description = statement.accept(this);
            if (description != null) {
                described.add(description);
            }
        }
        return described;
    }

    /**
     * @return the description, or null for statements that contribute nothing
     */
    public Map<String, Object> describe(Statement statement) {
        return statement.accept(this);
    }

    private static Map<String, Object> object(Statement statement) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("type", statement.kind().typeName());
        return object;
    }

    private static void putExpression(Map<String, Object> object, String key, Expression expression) {
        if (expression != null) {
            object.put(key, expression.rawText());
        }
    }

    @Override
    public Map<String, Object> visitText(TextStatement statement) {
        Map<String, Object> object = object(statement);
        object.put("value", statement.value());
        return object;
    }

    @Override
    public Map<String, Object> visitInlineRaw(InlineRawStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "expression", statement.expression());
        return object;
    }

    @Override
    public Map<String, Object> visitInlineEscaped(InlineEscapedStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "expression", statement.expression());
        return object;
    }

    @Override
    public Map<String, Object> visitEach(EachStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "variable", statement.variable());
        putExpression(object, "iterator", statement.iterator());
        object.put("children", describe(statement.children()));
        return object;
    }

    @Override
    public Map<String, Object> visitIf(IfStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "expression", statement.condition());
        object.put("children", describe(statement.children()));
        if (statement.next() != null) {
            object.put("next", statement.next().accept(this));
        }
        return object;
    }

    @Override
    public Map<String, Object> visitElseIf(ElseIfStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "expression", statement.condition());
        object.put("children", describe(statement.children()));
        if (statement.next() != null) {
            object.put("next", statement.next().accept(this));
        }
        return object;
    }

    @Override
    public Map<String, Object> visitElse(ElseStatement statement) {
        Map<String, Object> object = object(statement);
        object.put("children", describe(statement.children()));
        return object;
    }

    @Override
    public Map<String, Object> visitLet(LetStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "variableName", statement.name());
        putExpression(object, "variableValue", statement.value());
        return object;
    }

    @Override
    public Map<String, Object> visitAssign(AssignStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "variableName", statement.name());
        putExpression(object, "variableValue", statement.value());
        return object;
    }

    @Override
    public Map<String, Object> visitParam(ParamStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "paramName", statement.name());
        putExpression(object, "paramType", statement.type());
        putExpression(object, "paramDefaultValue", statement.defaultValue());
        return object;
    }

    @Override
    public Map<String, Object> visitImport(ImportStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "expression", statement.clause());
        return object;
    }

    @Override
    public Map<String, Object> visitDefineSlot(DefineSlotStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "slotName", statement.name());
        putExpression(object, "slotArguments", statement.argumentType());
        return object;
    }

    @Override
    public Map<String, Object> visitComponent(ComponentStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "component", statement.component());
        putExpression(object, "params", statement.params());
        object.put("mainSlot", statement.mainSlot().accept(this));
        object.put("slots", describe(statement.slots()));
        return object;
    }

    @Override
    public Map<String, Object> visitComponentMainSlot(ComponentMainSlotStatement statement) {
        Map<String, Object> object = object(statement);
        object.put("children", describe(statement.children()));
        return object;
    }

    @Override
    public Map<String, Object> visitComponentSlot(ComponentSlotStatement statement) {
        Map<String, Object> object = object(statement);
        putExpression(object, "slotName", statement.name());
        putExpression(object, "paramsVariable", statement.paramsVariable());
        object.put("children", describe(statement.children()));
        return object;
    }

    @Override
    public Map<String, Object> visitEnd(EndStatement statement) {
        return null;
    }
}
