package com.tsplate;

import com.tsplate.ast.Statement;
import com.tsplate.codegen.MappedCode;

import java.util.List;

/**
 * Everything produced from one template.
 *
 * @param filePath          label the template was compiled under
 * @param statements        top-level statements
 * @param typeSurface       source-mapped TypeScript surface for tooling
 * @param renderBody        executable renderer body writing to {@code out}
 * @param paramsDeclaration {@code Params} interface declaration
 * @param slotsDeclaration  {@code Slots} interface declaration
 * @param importPaths       module paths extracted from {@code @import} clauses
 */
public record CompiledTemplate(
    String filePath,
    List<Statement> statements,
    MappedCode typeSurface,
    String renderBody,
    String paramsDeclaration,
    String slotsDeclaration,
    List<String> importPaths
) {
    public CompiledTemplate {
        statements = List.copyOf(statements);
        importPaths = List.copyOf(importPaths);
    }
}
