package com.tsplate;

import com.tsplate.ast.ImportStatement;
import com.tsplate.ast.Statement;
import com.tsplate.codegen.CompiledStringGenerator;
import com.tsplate.codegen.MappedCode;
import com.tsplate.codegen.TsCodeGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parses a template and runs every generator over the result.
 *
 * <p>Instances are immutable and may be shared between threads; each call to
 * {@link #compile(String, String)} uses its own parser.</p>
 */
public class TemplateCompiler {
    private static final Logger LOG = Logger.getLogger(TemplateCompiler.class.getName());

    private final CompilerOptions options;
    private final CompiledStringGenerator compiledStringGenerator;

    public TemplateCompiler() {
        this(CompilerOptions.defaults());
    }

    public TemplateCompiler(CompilerOptions options) {
        this.options = options;
        this.compiledStringGenerator = new CompiledStringGenerator(options);
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * @throws ParserException when the template is malformed
     */
    public CompiledTemplate compile(String source, String filePath) {
        List<Statement> statements = Parser.parse(source, filePath);

        MappedCode typeSurface = TsCodeGenerator.INSTANCE.generate(statements);
        String renderBody = compiledStringGenerator.generate(statements);

        List<String> importPaths = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement instanceof ImportStatement importStatement) {
                importStatement.modulePath().ifPresent(importPaths::add);
            }
        }

        LOG.fine(() -> "Compiled " + filePath + ": " + statements.size() + " statements, "
            + typeSurface.mappings().size() + " mapped expressions");

        return new CompiledTemplate(
            filePath,
            statements,
            typeSurface,
            renderBody,
            DeclarationGenerator.paramsToCodeString(statements),
            DeclarationGenerator.slotsToCodeString(statements),
            importPaths);
    }
}
