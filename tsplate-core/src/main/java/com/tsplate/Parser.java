package com.tsplate;

import com.tsplate.ast.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recursive-descent parser turning template source into a list of top-level
 * {@link Statement}s.
 *
 * <p>The parser keeps a single forward cursor (offset and line). Text is collected
 * until an inline expression opener ({@code {{} or {@code !{{}), a directive
 * ({@code @tag}) or the end of input. A parser instance parses exactly once; use
 * {@link #parse(String, String)} for one-shot parsing.</p>
 *
 * <p>Declarations are ordered: imports come first, then slot definitions, then
 * params. Each of those is only accepted at the top level while nothing outside
 * its allowed set has been seen, and once closed the gate stays closed.</p>
 */
public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    private static final String PAREN_START = "([{";
    private static final String PAREN_END = ")]}";

    private static final Set<StatementKind> IMPORT_ALLOWED_AFTER =
        EnumSet.of(StatementKind.TEXT, StatementKind.IMPORT);
    private static final Set<StatementKind> DEFINE_SLOT_ALLOWED_AFTER =
        EnumSet.of(StatementKind.TEXT, StatementKind.IMPORT, StatementKind.DEFINE_SLOT);
    static final Set<StatementKind> PARAM_ALLOWED_AFTER =
        EnumSet.of(StatementKind.TEXT, StatementKind.IMPORT, StatementKind.DEFINE_SLOT, StatementKind.PARAM);

    private static final Set<StatementKind> CHAIN_TERMINATORS =
        EnumSet.of(StatementKind.ELSE_IF, StatementKind.ELSE, StatementKind.END);
    private static final Set<StatementKind> END_TERMINATOR = EnumSet.of(StatementKind.END);

    private final String code;
    private final String filePath;
    private int index = 0;
    private int line = 0;
    private boolean parsed = false;

    // Trimmed result of a terminator scan and the terminator that ended it
    private record Scanned(String value, Position position, String terminator) {}

    // Children of a block and the statement that closed it
    private record Block(List<Statement> children, Statement terminator) {}

    // Which context-sensitive statements the next statement may be
    private record Context(boolean allowImport, boolean allowDefineSlot, boolean allowParam, boolean allowSlot) {
        static final Context BLOCK = new Context(false, false, false, false);
        static final Context COMPONENT_BODY = new Context(false, false, false, true);
    }

    public Parser(String code, String filePath) {
        this.code = Objects.requireNonNull(code, "code");
        this.filePath = Objects.requireNonNull(filePath, "filePath");
    }

    public static List<Statement> parse(String code, String filePath) {
        return new Parser(code, filePath).parse();
    }

    /**
     * Builds the parameter interface declaration from the leading imports and params.
     *
     * @see DeclarationGenerator#paramsToCodeString(List)
     */
    public static String paramsToCodeString(List<Statement> statements) {
        return DeclarationGenerator.paramsToCodeString(statements);
    }

    /**
     * Parses the whole input.
     *
     * @return the top-level statements in source order
     * @throws ParserException on the first syntax error
     */
    public List<Statement> parse() {
        if (parsed) {
            throw new IllegalStateException("Parser for " + filePath + " has already been used");
        }
        parsed = true;

        List<Statement> statements = new ArrayList<>();
        boolean allowImport = true;
        boolean allowDefineSlot = true;
        boolean allowParam = true;

        while (!isAtEnd()) {
            Statement statement = parseOnce(new Context(allowImport, allowDefineSlot, allowParam, false));
            if (statement == null) {
                break;
            }

            StatementKind kind = statement.kind();
            allowImport = allowImport && IMPORT_ALLOWED_AFTER.contains(kind);
            allowDefineSlot = allowDefineSlot && DEFINE_SLOT_ALLOWED_AFTER.contains(kind);
            allowParam = allowParam && PARAM_ALLOWED_AFTER.contains(kind);

            if (statement.mustBeConsumedByParse()) {
                throw ParserException.disallowedTagContext(statement, filePath, code);
            }

            statements.add(statement);
        }

        LOG.fine(() -> "Parsed " + statements.size() + " top-level statements from " + filePath);
        return List.copyOf(statements);
    }

    // ========================================================================
    // Cursor
    // ========================================================================

    private boolean isAtEnd() {
        return index >= code.length();
    }

    private char currentChar() {
        return code.charAt(index);
    }

    private void advance() {
        if (isAtEnd()) {
            return;
        }
        if (currentChar() == '\n') {
            line++;
        }
        index++;
    }

    private void advance(int times) {
        for (int i = 0; i < times; i++) {
            advance();
        }
    }

    private boolean areNextChars(String expected) {
        return code.startsWith(expected, index);
    }

    private void consume(char expected) {
        if (isAtEnd() || currentChar() != expected) {
            throw ParserException.unexpected(here(), filePath, code, String.valueOf(expected), describeCurrent());
        }
        advance();
    }

    private Position here() {
        return Position.at(index, line);
    }

    private String describeCurrent() {
        return isAtEnd() ? "end of input" : String.valueOf(currentChar());
    }

    // ========================================================================
    // Statements
    // ========================================================================

    /**
     * Parses one statement, or returns null when only comments remained before the
     * end of input.
     */
    private Statement parseOnce(Context context) {
        StringBuilder text = new StringBuilder();
        int textStart = index;
        int textLine = line;

        while (!isAtEnd()) {
            if (areNextChars("\\{{")) {
                text.append("{{");
                advance(3);
                continue;
            }
            if (areNextChars("\\@")) {
                text.append('@');
                advance(2);
                continue;
            }

            int openerLength = areNextChars("{{") ? 2 : areNextChars("!{{") ? 3 : 0;
            if (openerLength > 0) {
                if (text.length() > 0) {
                    return new TextStatement(new Position(textStart, index, textLine), text.toString());
                }
                if (code.startsWith("--", index + openerLength)) {
                    skipComment(openerLength);
                    textStart = index;
                    textLine = line;
                    continue;
                }
                return parseInline(openerLength == 3);
            }

            if (currentChar() == '@') {
                if (text.length() > 0) {
                    return new TextStatement(new Position(textStart, index, textLine), text.toString());
                }
                return parseTag(context);
            }

            text.append(currentChar());
            advance();
        }

        if (text.length() == 0) {
            return null;
        }
        return new TextStatement(new Position(textStart, index, textLine), text.toString());
    }

    private Block parseUntil(Set<StatementKind> terminators, Context context) {
        List<Statement> children = new ArrayList<>();

        while (!isAtEnd()) {
            Statement statement = parseOnce(context);
            if (statement == null) {
                break;
            }
            if (terminators.contains(statement.kind())) {
                return new Block(children, statement);
            }
            boolean slotInComponent = context.allowSlot() && statement instanceof ComponentSlotStatement;
            if (statement.mustBeConsumedByParse() && !slotInComponent) {
                throw ParserException.disallowedTagContext(statement, filePath, code);
            }
            children.add(statement);
        }

        List<String> expected = new ArrayList<>();
        for (StatementKind kind : terminators) {
            expected.add(kind.tag());
        }
        throw ParserException.unexpected(here(), filePath, code, String.join("' or '", expected), "end of input");
    }

    private Statement parseInline(boolean raw) {
        int startIndex = index;
        int startLine = line;

        advance(raw ? 3 : 2);
        Scanned scanned = scanUntil(false, "}}");

        Position position = new Position(startIndex, index, startLine);
        Expression expression = toExpression(scanned);
        if (raw) {
            return new InlineRawStatement(position, expression);
        }
        return new InlineEscapedStatement(position, expression);
    }

    private void skipComment(int openerLength) {
        Position start = here();
        int close = code.indexOf("--}}", index + openerLength + 2);
        if (close < 0) {
            throw ParserException.unexpected(start, filePath, code, "--}}", "end of input");
        }
        advance(close + 4 - index);
    }

    private Statement parseTag(Context context) {
        int startIndex = index;
        int startLine = line;

        advance();
        int nameStart = index;
        while (!isAtEnd() && isValidTagChar(currentChar())) {
            advance();
        }
        String tagName = code.substring(nameStart, index);
        Position tagPosition = new Position(startIndex, index, startLine);

        return switch (tagName) {
            case "each" -> parseEach(startIndex, startLine);
            case "if" -> parseIf(startIndex, startLine);
            case "elseif" -> parseElseIf(startIndex, startLine);
            case "else" -> parseElse(startIndex, startLine);
            case "let" -> parseLet(startIndex, startLine);
            case "assign" -> parseAssign(startIndex, startLine);
            case "component" -> parseComponent(startIndex, startLine);
            case "import" -> {
                if (!context.allowImport()) {
                    throw ParserException.invalidDeclarationOrder(tagPosition, filePath, code);
                }
                yield parseImport(startIndex, startLine);
            }
            case "defslot" -> {
                if (!context.allowDefineSlot()) {
                    throw ParserException.invalidDeclarationOrder(tagPosition, filePath, code);
                }
                yield parseDefineSlot(startIndex, startLine);
            }
            case "param" -> {
                if (!context.allowParam()) {
                    throw ParserException.invalidDeclarationOrder(tagPosition, filePath, code);
                }
                yield parseParam(startIndex, startLine);
            }
            case "slot" -> {
                if (!context.allowSlot()) {
                    throw ParserException.slotOutsideComponent(tagPosition, filePath, code);
                }
                yield parseComponentSlot(startIndex, startLine);
            }
            case "end" -> new EndStatement(tagPosition);
            default -> throw ParserException.invalidTagName(tagPosition, filePath, code, tagName);
        };
    }

    private static boolean isValidTagChar(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || c == '_'
            || c == '-';
    }

    // @each(variable in iterator) ... @end
    private EachStatement parseEach(int startIndex, int startLine) {
        consume('(');

        Scanned variable = scanUntil(false, " in ", ")");
        if (!" in ".equals(variable.terminator())) {
            Position position = Position.at(variable.position().end(), variable.position().lineStart());
            throw ParserException.unexpected(position, filePath, code, "in", ")");
        }
        Scanned iterator = scanUntil(false, ")");

        Block body = parseUntil(END_TERMINATOR, Context.BLOCK);

        return new EachStatement(
            new Position(startIndex, index, startLine),
            toExpression(variable),
            toExpression(iterator),
            body.children());
    }

    // @if(condition) ... [@elseif(condition) ...]* [@else ...] @end
    private IfStatement parseIf(int startIndex, int startLine) {
        consume('(');

        Scanned condition = scanUntil(false, ")");
        Block body = parseUntil(CHAIN_TERMINATORS, Context.BLOCK);
        IfBranch next = body.terminator() instanceof IfBranch branch ? branch : null;

        return new IfStatement(
            new Position(startIndex, next != null ? next.position().start() : index, startLine),
            toExpression(condition),
            body.children(),
            next);
    }

    private ElseIfStatement parseElseIf(int startIndex, int startLine) {
        consume('(');

        Scanned condition = scanUntil(false, ")");
        Block body = parseUntil(CHAIN_TERMINATORS, Context.BLOCK);
        IfBranch next = body.terminator() instanceof IfBranch branch ? branch : null;

        return new ElseIfStatement(
            new Position(startIndex, next != null ? next.position().start() : index, startLine),
            toExpression(condition),
            body.children(),
            next);
    }

    private ElseStatement parseElse(int startIndex, int startLine) {
        parseArguments(0);

        Block body = parseUntil(END_TERMINATOR, Context.BLOCK);

        return new ElseStatement(new Position(startIndex, index, startLine), body.children());
    }

    // @let(name) or @let(name = value)
    private LetStatement parseLet(int startIndex, int startLine) {
        consume('(');

        Scanned name = scanUntil(false, "=", ")");
        Scanned value = null;
        if ("=".equals(name.terminator())) {
            value = scanUntil(false, ")");
        }

        return new LetStatement(
            new Position(startIndex, index, startLine),
            toExpression(name),
            value != null ? toExpression(value) : null);
    }

    // @assign(name = value)
    private AssignStatement parseAssign(int startIndex, int startLine) {
        consume('(');

        Scanned name = scanUntil(false, "=");
        Scanned value = scanUntil(false, ")");

        return new AssignStatement(
            new Position(startIndex, index, startLine),
            toExpression(name),
            toExpression(value));
    }

    // @param(name: Type) or @param(name: Type = default)
    private ParamStatement parseParam(int startIndex, int startLine) {
        consume('(');

        Scanned name = scanUntil(false, ":");
        Scanned type = scanUntil(false, "=", ")");
        Scanned defaultValue = null;
        if ("=".equals(type.terminator())) {
            defaultValue = scanUntil(false, ")");
        }

        return new ParamStatement(
            new Position(startIndex, index, startLine),
            toExpression(name),
            toExpression(type),
            defaultValue != null ? toExpression(defaultValue) : null);
    }

    private ImportStatement parseImport(int startIndex, int startLine) {
        consume('(');

        Scanned clause = scanUntil(false, ")");

        return new ImportStatement(new Position(startIndex, index, startLine), toExpression(clause));
    }

    // @defslot(name) or @defslot(name: ArgumentType)
    private DefineSlotStatement parseDefineSlot(int startIndex, int startLine) {
        consume('(');

        Scanned name = scanUntil(false, ":", ")");
        if ("main".equals(name.value())) {
            throw ParserException.reservedSlotName(name.position(), filePath, code);
        }
        Scanned argumentType = null;
        if (":".equals(name.terminator())) {
            argumentType = scanUntil(false, ")");
        }

        return new DefineSlotStatement(
            new Position(startIndex, index, startLine),
            toExpression(name),
            argumentType != null ? toExpression(argumentType) : null);
    }

    // @component(Component, params) ... [@slot(name[, variable]) ... @end]* @end
    private ComponentStatement parseComponent(int startIndex, int startLine) {
        List<Scanned> arguments = parseArguments(2);

        Block body = parseUntil(END_TERMINATOR, Context.COMPONENT_BODY);

        List<ComponentSlotStatement> slots = new ArrayList<>();
        List<Statement> mainSlotChildren = new ArrayList<>();
        for (Statement statement : body.children()) {
            if (statement instanceof ComponentSlotStatement slot) {
                slots.add(slot);
            } else {
                mainSlotChildren.add(statement);
            }
        }

        Position position = new Position(startIndex, index, startLine);
        return new ComponentStatement(
            position,
            toExpression(arguments.get(0)),
            toExpression(arguments.get(1)),
            new ComponentMainSlotStatement(position, mainSlotChildren),
            slots);
    }

    private ComponentSlotStatement parseComponentSlot(int startIndex, int startLine) {
        consume('(');

        Scanned name = scanUntil(false, ",", ")");
        if ("main".equals(name.value())) {
            throw ParserException.reservedSlotName(name.position(), filePath, code);
        }
        Scanned paramsVariable = null;
        if (",".equals(name.terminator())) {
            paramsVariable = scanUntil(false, ")");
        }

        Block body = parseUntil(END_TERMINATOR, Context.BLOCK);

        return new ComponentSlotStatement(
            new Position(startIndex, index, startLine),
            toExpression(name),
            paramsVariable != null ? toExpression(paramsVariable) : null,
            body.children());
    }

    // ========================================================================
    // Argument scanning
    // ========================================================================

    /**
     * Scans forward until one of {@code terminators} appears outside any bracket pair
     * and consumes it. The scanned text is returned trimmed, with a position covering
     * only the trimmed text.
     */
    private Scanned scanUntil(boolean allowEmpty, String... terminators) {
        int startIndex = index;
        int startLine = line;
        int depth = 0;

        while (!isAtEnd()) {
            char c = currentChar();
            if (PAREN_START.indexOf(c) >= 0) {
                depth++;
                advance();
                continue;
            } else if (depth > 0 && PAREN_END.indexOf(c) >= 0) {
                depth--;
                advance();
                continue;
            }

            if (depth == 0) {
                for (String terminator : terminators) {
                    if (!areNextChars(terminator)) {
                        continue;
                    }
                    int endIndex = index;
                    advance(terminator.length());
                    return trim(startIndex, endIndex, startLine, terminator, allowEmpty);
                }
            }

            advance();
        }

        throw ParserException.unexpected(here(), filePath, code, String.join("' or '", terminators), "end of input");
    }

    private Scanned trim(int startIndex, int endIndex, int startLine, String terminator, boolean allowEmpty) {
        String raw = code.substring(startIndex, endIndex);
        String trimmedStart = raw.stripLeading();
        String value = trimmedStart.stripTrailing();

        if (!allowEmpty && value.isEmpty()) {
            Position position = new Position(startIndex, startIndex == endIndex ? startIndex + 1 : endIndex, startLine);
            throw ParserException.emptyExpression(position, filePath, code);
        }

        int leading = raw.length() - trimmedStart.length();
        int lineStart = startLine;
        for (int i = 0; i < leading; i++) {
            if (raw.charAt(i) == '\n') {
                lineStart++;
            }
        }

        int start = startIndex + leading;
        int end = endIndex - (trimmedStart.length() - value.length());
        return new Scanned(value, new Position(start, end, lineStart), terminator);
    }

    /**
     * Parses a parenthesized, comma separated argument list of exactly
     * {@code expectedCount} entries. A single trailing empty argument is dropped.
     * Without an opening parenthesis the list counts as empty.
     */
    private List<Scanned> parseArguments(int expectedCount) {
        if (isAtEnd() || currentChar() != '(') {
            if (expectedCount != 0) {
                throw ParserException.unexpectedArgumentCount(here(), filePath, code, expectedCount, 0);
            }
            return List.of();
        }

        advance();

        List<Scanned> arguments = new ArrayList<>();
        Scanned argument;
        do {
            argument = scanUntil(true, ",", ")");
            arguments.add(argument);
        } while (!")".equals(argument.terminator()));

        if (arguments.get(arguments.size() - 1).value().isEmpty()) {
            arguments.remove(arguments.size() - 1);
        }

        if (arguments.size() != expectedCount) {
            throw ParserException.unexpectedArgumentCount(here(), filePath, code, expectedCount, arguments.size());
        }

        for (Scanned scanned : arguments) {
            if (scanned.value().isEmpty()) {
                Position position = new Position(scanned.position().start(), scanned.position().start() + 1,
                    scanned.position().lineStart());
                throw ParserException.emptyExpression(position, filePath, code);
            }
        }

        return arguments;
    }

    private static Expression toExpression(Scanned scanned) {
        return new Expression(scanned.position(), scanned.value());
    }
}
