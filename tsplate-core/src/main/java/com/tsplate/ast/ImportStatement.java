package com.tsplate.ast;

import com.tsplate.Position;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code @import(clause)}. The clause is re-emitted verbatim after {@code import}.
 */
public record ImportStatement(
    Position position,
    Expression clause
) implements Statement {
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"|'([^']*)'|`([^`]*)`");

    @Override
    public StatementKind kind() {
        return StatementKind.IMPORT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitImport(this);
    }

    /**
     * Best-effort module path: the contents of the first quoted string in the clause.
     * Clauses with nested quotes or template interpolation may be mis-read.
     */
    public Optional<String> modulePath() {
        Matcher matcher = QUOTED.matcher(clause.rawText());
        if (!matcher.find()) {
            return Optional.empty();
        }
        for (int group = 1; group <= matcher.groupCount(); group++) {
            if (matcher.group(group) != null) {
                return Optional.of(matcher.group(group));
            }
        }
        return Optional.empty();
    }

    public String toImportTsStatement() {
        return "import " + clause.rawText();
    }
}
