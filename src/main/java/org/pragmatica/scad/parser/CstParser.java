package org.pragmatica.scad.parser;

import org.pragmatica.scad.error.ParseError;
import org.pragmatica.scad.tree.CstNode;
import org.pragmatica.scad.tree.SourceLocation;
import org.pragmatica.scad.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Recursive-descent producer of OpenSCAD concrete syntax trees.
 *
 * <p>Emits the node types and field names of the tree-sitter OpenSCAD grammar. It never fails:
 * unparseable statements become {@code ERROR} nodes, absent tokens become zero-width missing
 * leaves, and every recovery is reported as a syntax error.
 */
public final class CstParser {
    private static final Logger log = LoggerFactory.getLogger(CstParser.class);
    private static final String SYNTAX = "syntax";

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
        Map.entry("||", 1),
        Map.entry("&&", 2),
        Map.entry("==", 3),
        Map.entry("!=", 3),
        Map.entry("<", 4),
        Map.entry("<=", 4),
        Map.entry(">", 4),
        Map.entry(">=", 4),
        Map.entry("+", 5),
        Map.entry("-", 5),
        Map.entry("*", 6),
        Map.entry("/", 6),
        Map.entry("%", 6),
        Map.entry("^", 7));

    private static final Set<String> MODIFIERS = Set.of("#", "!", "%", "*");
    private static final Set<String> STATEMENT_KEYWORDS = Set.of("module", "function", "include", "use", "if", "for");
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
        "true", "false", "undef", "function", "let", "echo", "assert", "each");

    private final String source;
    private final ParserConfig config;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Token.Comment> comments = new ArrayList<>();
    private final List<ParseError> errors = new ArrayList<>();
    private int pos;
    private int commentCursor;

    private CstParser(String source, ParserConfig config) {
        this.source = source;
        this.config = config;
        for (var token : OpenScadLexer.tokenize(source)) {
            if (token instanceof Token.Comment comment) {
                comments.add(comment);
            } else {
                tokens.add(token);
            }
        }
    }

    public static SyntaxTree parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    public static SyntaxTree parse(String source, ParserConfig config) {
        return new CstParser(source, config).parseSourceFile();
    }

    private SyntaxTree parseSourceFile() {
        var children = new ArrayList<CstNode>();
        while (!isAtEnd()) {
            collectComments(children, peek().start());
            children.add(parseStatement());
        }
        collectComments(children, Integer.MAX_VALUE);
        var span = SourceSpan.of(SourceLocation.START, peek().span().end());
        var root = new CstNode.Branch(SOURCE_FILE, CstNode.NO_FIELD, source, span, children);
        log.debug("Parsed {} characters, {} syntax errors", source.length(), errors.size());
        return new SyntaxTree(source, root, errors);
    }

    // === Statements ===

    private CstNode parseStatement() {
        CstNode inner;
        if (isPunct(";")) {
            inner = consumeToken();
        } else if (isPunct("{")) {
            inner = parseBlock();
        } else if (peek() instanceof Token.Keyword keyword) {
            inner = switch (keyword.text()) {
                case "module" -> parseModuleDefinition();
                case "function" -> parseFunctionDefinition();
                case "include" -> parseInclude(INCLUDE_STATEMENT);
                case "use" -> parseInclude(USE_STATEMENT);
                case "if" -> parseIf();
                case "for" -> parseFor();
                case "let" -> parseLetStatement();
                case "echo" -> parseEchoStatement();
                case "assert" -> parseAssertStatement();
                default -> null;
            };
            if (inner == null) {
                return recover();
            }
        } else if (startsInstantiation()) {
            inner = parseModuleInstantiation();
        } else if (isVariable(peek()) && peekIsPunct(1, "=")) {
            inner = parseAssignment();
        } else {
            return recover();
        }
        return new NodeBuilder(STATEMENT).add(inner).build();
    }

    private CstNode recover() {
        var first = peek();
        errors.add(ParseError.error(SYNTAX, "Unexpected '" + first.text() + "'", first.span()));
        var skipped = new ArrayList<CstNode>();
        do {
            var token = advance();
            skipped.add(leafFor(token));
            if (token instanceof Token.Punct punct && punct.text().equals(";")) {
                break;
            }
        } while (!isAtEnd() && !isPunct("}") && !startsStatementKeyword());
        return errorNode(skipped);
    }

    private CstNode parseBlock() {
        var block = new NodeBuilder(BLOCK).add(consumeToken());
        while (!isAtEnd() && !isPunct("}")) {
            collectComments(block.children, peek().start());
            block.add(parseStatement());
        }
        collectComments(block.children, peek().start());
        return block.add(expectPunct("}")).build();
    }

    private CstNode parseBodyStatement() {
        if (isAtEnd() || isPunct("}")) {
            return missing(STATEMENT, true, "Expected statement");
        }
        return parseStatement();
    }

    private CstNode parseModuleDefinition() {
        return new NodeBuilder(MODULE_DEFINITION)
            .add(consumeToken())
            .add("name", expectIdentifier())
            .add("parameters", parseParameterList())
            .add("body", parseBodyStatement())
            .build();
    }

    private CstNode parseFunctionDefinition() {
        return new NodeBuilder(FUNCTION_DEFINITION)
            .add(consumeToken())
            .add("name", expectIdentifier())
            .add("parameters", parseParameterList())
            .add(expectPunct("="))
            .add("value", parseExpression())
            .add(expectPunct(";"))
            .build();
    }

    private CstNode parseParameterList() {
        var list = new NodeBuilder(PARAMETER_LIST).add(expectPunct("("));
        if (!isPunct(")") && isVariable(peek())) {
            var declarations = new NodeBuilder(PARAMETER_DECLARATIONS).add(parseParameterDeclaration());
            while (isPunct(",")) {
                declarations.add(consumeToken());
                if (isPunct(")")) {
                    break;
                }
                declarations.add(parseParameterDeclaration());
            }
            list.add(declarations.build());
        }
        return closeWith(list, ")").build();
    }

    private CstNode parseParameterDeclaration() {
        var declaration = new NodeBuilder(PARAMETER_DECLARATION).add("name", expectIdentifier());
        if (isPunct("=")) {
            declaration.add(consumeToken())
                       .add("value", parseExpression());
        }
        return declaration.build();
    }

    private CstNode parseInclude(String type) {
        var statement = new NodeBuilder(type).add(consumeToken());
        var token = peek();
        if (token instanceof Token.Path) {
            statement.add("path", consumeAs(ANGLE_BRACKET_STRING));
        } else if (token instanceof Token.StringLiteral) {
            statement.add("path", consumeAs(STRING));
        } else {
            statement.add("path", missing(ANGLE_BRACKET_STRING, true, "Expected path after '" + type + "'"));
        }
        if (isPunct(";")) {
            statement.add(consumeToken());
        }
        return statement.build();
    }

    private CstNode parseIf() {
        var statement = new NodeBuilder(IF_STATEMENT)
            .add(consumeToken())
            .add(expectPunct("("))
            .add("condition", parseExpression());
        closeWith(statement, ")").add("consequence", parseBodyStatement());
        if (isKeyword("else")) {
            statement.add(consumeToken())
                     .add("alternative", parseBodyStatement());
        }
        return statement.build();
    }

    private CstNode parseFor() {
        var statement = new NodeBuilder(FOR_STATEMENT)
            .add(consumeToken())
            .add(expectPunct("("));
        parseForAssignments(statement);
        return closeWith(statement, ")")
            .add("body", parseBodyStatement())
            .build();
    }

    private void parseForAssignments(NodeBuilder owner) {
        owner.add(parseForAssignment());
        while (isPunct(",")) {
            owner.add(consumeToken())
                 .add(parseForAssignment());
        }
    }

    private CstNode parseForAssignment() {
        return new NodeBuilder(FOR_ASSIGNMENT)
            .add("iterator", expectIdentifier())
            .add(expectPunct("="))
            .add("range", parseExpression())
            .build();
    }

    private CstNode parseLetStatement() {
        return new NodeBuilder(LET_STATEMENT)
            .add(consumeToken())
            .add("arguments", parseArgumentList())
            .add("body", parseBodyStatement())
            .build();
    }

    private CstNode parseEchoStatement() {
        return new NodeBuilder(ECHO_STATEMENT)
            .add(consumeToken())
            .add("arguments", parseArgumentList())
            .add(expectPunct(";"))
            .build();
    }

    private CstNode parseAssertStatement() {
        var statement = new NodeBuilder(ASSERT_STATEMENT)
            .add(consumeToken())
            .add(expectPunct("("))
            .add("condition", parseExpression());
        if (isPunct(",")) {
            statement.add(consumeToken())
                     .add("message", parseExpression());
        }
        return closeWith(statement, ")").add(expectPunct(";")).build();
    }

    private CstNode parseModuleInstantiation() {
        var instantiation = new NodeBuilder(MODULE_INSTANTIATION);
        while (peek() instanceof Token.Punct punct && MODIFIERS.contains(punct.text())) {
            instantiation.add("modifier", consumeAs(MODIFIER));
        }
        instantiation.add("name", expectIdentifier())
                     .add("arguments", parseArgumentList());
        if (isPunct(";")) {
            instantiation.add(consumeToken());
        } else if (startsChildStatement()) {
            instantiation.add("body", parseStatement());
        } else {
            instantiation.add(missing(";", false, "Missing ';'"));
        }
        return instantiation.build();
    }

    private CstNode parseAssignment() {
        return new NodeBuilder(ASSIGNMENT_STATEMENT)
            .add("name", consumeAs(variableType(peek())))
            .add(consumeToken())
            .add("value", parseExpression())
            .add(expectPunct(";"))
            .build();
    }

    private CstNode parseArgumentList() {
        var list = new NodeBuilder(ARGUMENT_LIST).add(expectPunct("("));
        if (!isPunct(")") && canStartExpression()) {
            var arguments = new NodeBuilder(ARGUMENTS).add(parseArgument());
            while (isPunct(",")) {
                arguments.add(consumeToken());
                if (isPunct(")")) {
                    break;
                }
                arguments.add(parseArgument());
            }
            list.add(arguments.build());
        }
        return closeWith(list, ")").build();
    }

    private CstNode parseArgument() {
        var argument = new NodeBuilder(ARGUMENT);
        if (isVariable(peek()) && peekIsPunct(1, "=")) {
            argument.add("name", consumeAs(variableType(peek())))
                    .add(consumeToken())
                    .add("value", parseExpression());
        } else {
            argument.add(parseExpression());
        }
        return argument.build();
    }

    // === Expressions ===

    private CstNode parseExpression() {
        if (peek() instanceof Token.Keyword keyword) {
            switch (keyword.text()) {
                case "function" -> {
                    return parseFunctionLiteral();
                }
                case "let" -> {
                    return parseLetExpression();
                }
                case "echo" -> {
                    return parseEchoExpression();
                }
                case "assert" -> {
                    return parseAssertExpression();
                }
                case "each" -> {
                    return parseEach();
                }
                default -> {}
            }
        }
        return parseConditional();
    }

    private CstNode parseConditional() {
        var condition = parseBinary(1);
        if (!isPunct("?")) {
            return condition;
        }
        return new NodeBuilder(CONDITIONAL_EXPRESSION)
            .add("condition", condition)
            .add(consumeToken())
            .add("consequence", parseExpression())
            .add(expectPunct(":"))
            .add("alternative", parseExpression())
            .build();
    }

    private CstNode parseBinary(int minPrecedence) {
        var left = parseUnary();
        while (true) {
            int precedence = operatorPrecedence();
            if (precedence < minPrecedence) {
                return left;
            }
            boolean rightAssociative = isPunct("^");
            left = new NodeBuilder(BINARY_EXPRESSION)
                .add("left", left)
                .add("operator", consumeToken())
                .add("right", parseBinary(rightAssociative ? precedence : precedence + 1))
                .build();
        }
    }

    private CstNode parseUnary() {
        if (isPunct("!") || isPunct("-") || isPunct("+")) {
            return new NodeBuilder(UNARY_EXPRESSION)
                .add("operator", consumeToken())
                .add("operand", parseUnary())
                .build();
        }
        return parsePostfix();
    }

    private CstNode parsePostfix() {
        var expression = parsePrimary();
        while (true) {
            if (isPunct("(")) {
                expression = new NodeBuilder(CALL_EXPRESSION)
                    .add("function", expression)
                    .add("arguments", parseArgumentList())
                    .build();
            } else if (isPunct("[")) {
                var index = new NodeBuilder(INDEX_EXPRESSION)
                    .add("array", expression)
                    .add(consumeToken())
                    .add("index", parseExpression());
                expression = closeWith(index, "]").build();
            } else if (isPunct(".")) {
                expression = new NodeBuilder(MEMBER_EXPRESSION)
                    .add("object", expression)
                    .add(consumeToken())
                    .add("property", expectIdentifier())
                    .build();
            } else {
                return expression;
            }
        }
    }

    private CstNode parsePrimary() {
        var token = peek();
        if (token instanceof Token.Number) {
            return consumeAs(NUMBER);
        }
        if (token instanceof Token.StringLiteral) {
            return consumeAs(STRING);
        }
        if (token instanceof Token.Identifier || token instanceof Token.SpecialVariable) {
            return consumeAs(variableType(token));
        }
        if (token instanceof Token.Keyword keyword) {
            var word = keyword.text();
            if (word.equals("true") || word.equals("false")) {
                return consumeAs(BOOLEAN);
            }
            if (word.equals("undef")) {
                return consumeAs(UNDEF);
            }
            if (EXPRESSION_KEYWORDS.contains(word)) {
                return parseExpression();
            }
            errors.add(ParseError.error(SYNTAX, "Reserved keyword '" + word + "' cannot be used as an expression",
                                        token.span()));
            return consumeAs(IDENTIFIER);
        }
        if (isPunct("(")) {
            var parenthesized = new NodeBuilder(PARENTHESIZED_EXPRESSION)
                .add(consumeToken())
                .add(parseExpression());
            return closeWith(parenthesized, ")").build();
        }
        if (isPunct("[")) {
            return parseBracket();
        }
        return missing(IDENTIFIER, true, "Expected expression");
    }

    private CstNode parseBracket() {
        var open = consumeToken();
        if (isPunct("]")) {
            return new NodeBuilder(VECTOR_EXPRESSION).add(open).add(consumeToken()).build();
        }
        if (isKeyword("for")) {
            return parseListComprehension(open);
        }
        if (isPunct(":")) {
            return parseRange(open, missing(IDENTIFIER, true, "Missing range start"));
        }
        var first = parseExpression();
        if (isPunct(":")) {
            return parseRange(open, first);
        }
        var vector = new NodeBuilder(VECTOR_EXPRESSION).add(open).add(first);
        while (isPunct(",")) {
            vector.add(consumeToken());
            if (isPunct("]")) {
                break;
            }
            vector.add(parseExpression());
        }
        return closeWith(vector, "]").build();
    }

    private CstNode parseRange(CstNode open, CstNode start) {
        var range = new NodeBuilder(RANGE_EXPRESSION)
            .add(open)
            .add("start", start)
            .add(consumeToken());
        var second = rangeBound("Missing range end");
        if (isPunct(":")) {
            range.add("step", second)
                 .add(consumeToken())
                 .add("end", rangeBound("Missing range end"));
        } else {
            range.add("end", second);
        }
        return closeWith(range, "]").build();
    }

    private CstNode rangeBound(String message) {
        if (isPunct("]") || isPunct(":")) {
            return missing(IDENTIFIER, true, message);
        }
        return parseExpression();
    }

    private CstNode parseListComprehension(CstNode open) {
        var comprehension = new NodeBuilder(LIST_COMPREHENSION).add(open);
        while (isKeyword("for")) {
            var clause = new NodeBuilder(LIST_COMPREHENSION_FOR)
                .add(consumeToken())
                .add(expectPunct("("));
            parseForAssignments(clause);
            comprehension.add(closeWith(clause, ")").build());
        }
        if (isKeyword("if")) {
            comprehension.add(consumeToken())
                         .add(expectPunct("("))
                         .add("condition", parseExpression());
            closeWith(comprehension, ")");
        }
        comprehension.add("expr", parseExpression());
        return closeWith(comprehension, "]").build();
    }

    private CstNode parseEach() {
        return new NodeBuilder(EACH_EXPRESSION)
            .add(consumeToken())
            .add("expression", parseExpression())
            .build();
    }

    private CstNode parseFunctionLiteral() {
        return new NodeBuilder(FUNCTION_LITERAL)
            .add(consumeToken())
            .add("parameters", parseParameterList())
            .add("body", parseExpression())
            .build();
    }

    private CstNode parseLetExpression() {
        var let = new NodeBuilder(LET_EXPRESSION)
            .add(consumeToken())
            .add(expectPunct("("));
        if (isVariable(peek())) {
            let.add(parseLetAssignment());
            while (isPunct(",")) {
                let.add(consumeToken());
                if (isPunct(")")) {
                    break;
                }
                let.add(parseLetAssignment());
            }
        }
        return closeWith(let, ")")
            .add("body", parseExpression())
            .build();
    }

    private CstNode parseLetAssignment() {
        return new NodeBuilder(LET_ASSIGNMENT)
            .add("name", expectIdentifier())
            .add(expectPunct("="))
            .add("value", parseExpression())
            .build();
    }

    private CstNode parseEchoExpression() {
        var echo = new NodeBuilder(ECHO_EXPRESSION)
            .add(consumeToken())
            .add("arguments", parseArgumentList());
        if (canStartExpression()) {
            echo.add("expression", parseExpression());
        }
        return echo.build();
    }

    private CstNode parseAssertExpression() {
        var assertion = new NodeBuilder(ASSERT_EXPRESSION)
            .add(consumeToken())
            .add(expectPunct("("))
            .add("condition", parseExpression());
        if (isPunct(",")) {
            assertion.add(consumeToken())
                     .add("message", parseExpression());
        }
        closeWith(assertion, ")");
        if (canStartExpression()) {
            assertion.add("expression", parseExpression());
        }
        return assertion.build();
    }

    // === Token helpers ===

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token advance() {
        var token = tokens.get(pos);
        if (!(token instanceof Token.Eof)) {
            pos++;
        }
        return token;
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private boolean isPunct(String text) {
        return peek() instanceof Token.Punct punct && punct.text().equals(text);
    }

    private boolean peekIsPunct(int ahead, String text) {
        return peekAt(ahead) instanceof Token.Punct punct && punct.text().equals(text);
    }

    private boolean isKeyword(String text) {
        return peek() instanceof Token.Keyword keyword && keyword.text().equals(text);
    }

    private static boolean isVariable(Token token) {
        return token instanceof Token.Identifier || token instanceof Token.SpecialVariable;
    }

    private static String variableType(Token token) {
        return token instanceof Token.SpecialVariable ? SPECIAL_VARIABLE : IDENTIFIER;
    }

    private boolean startsInstantiation() {
        if (peek() instanceof Token.Punct punct && MODIFIERS.contains(punct.text())) {
            return true;
        }
        return peek() instanceof Token.Identifier && peekIsPunct(1, "(");
    }

    private boolean startsChildStatement() {
        if (isPunct("{") || startsInstantiation()) {
            return true;
        }
        return peek() instanceof Token.Keyword keyword
               && Set.of("if", "for", "let", "echo", "assert").contains(keyword.text());
    }

    private boolean startsStatementKeyword() {
        return peek() instanceof Token.Keyword keyword && STATEMENT_KEYWORDS.contains(keyword.text());
    }

    private boolean canStartExpression() {
        var token = peek();
        if (token instanceof Token.Number || token instanceof Token.StringLiteral || isVariable(token)) {
            return true;
        }
        if (token instanceof Token.Keyword keyword) {
            return EXPRESSION_KEYWORDS.contains(keyword.text());
        }
        return isPunct("(") || isPunct("[") || isPunct("!") || isPunct("-") || isPunct("+");
    }

    private int operatorPrecedence() {
        if (peek() instanceof Token.Punct punct) {
            return PRECEDENCE.getOrDefault(punct.text(), -1);
        }
        return -1;
    }

    private SourceLocation previousEnd() {
        return pos > 0 ? tokens.get(pos - 1).span().end() : SourceLocation.START;
    }

    // === Node construction ===

    private CstNode.Leaf consumeAs(String type) {
        var token = advance();
        return new CstNode.Leaf(type, CstNode.NO_FIELD, token.text(), token.span(), true, false);
    }

    private CstNode.Leaf consumeToken() {
        var token = advance();
        return new CstNode.Leaf(token.text(), CstNode.NO_FIELD, token.text(), token.span(), false, false);
    }

    private CstNode.Leaf expectPunct(String text) {
        if (isPunct(text)) {
            return consumeToken();
        }
        return missing(text, false, "Missing '" + text + "'");
    }

    private CstNode.Leaf expectIdentifier() {
        if (isVariable(peek())) {
            return consumeAs(variableType(peek()));
        }
        return missing(IDENTIFIER, true, "Expected identifier");
    }

    private CstNode.Leaf missing(String type, boolean named, String message) {
        var at = SourceSpan.at(previousEnd());
        errors.add(ParseError.error(SYNTAX, message, at));
        return new CstNode.Leaf(type, CstNode.NO_FIELD, "", at, named, true);
    }

    private NodeBuilder closeWith(NodeBuilder owner, String closer) {
        if (!isPunct(closer)) {
            var skipped = new ArrayList<CstNode>();
            while (!isAtEnd() && !isPunct(closer) && !isPunct(";") && !isPunct("{") && !isPunct("}")) {
                skipped.add(leafFor(advance()));
            }
            if (!skipped.isEmpty()) {
                var error = errorNode(skipped);
                errors.add(ParseError.error(SYNTAX, "Unexpected '" + error.text() + "'", error.span()));
                owner.add(error);
            }
        }
        return owner.add(expectPunct(closer));
    }

    private CstNode leafFor(Token token) {
        String type;
        if (token instanceof Token.Identifier) {
            type = IDENTIFIER;
        } else if (token instanceof Token.SpecialVariable) {
            type = SPECIAL_VARIABLE;
        } else if (token instanceof Token.Number) {
            type = NUMBER;
        } else if (token instanceof Token.StringLiteral) {
            type = STRING;
        } else if (token instanceof Token.Path) {
            type = ANGLE_BRACKET_STRING;
        } else {
            return new CstNode.Leaf(token.text(), CstNode.NO_FIELD, token.text(), token.span(), false, false);
        }
        return new CstNode.Leaf(type, CstNode.NO_FIELD, token.text(), token.span(), true, false);
    }

    private CstNode.Error errorNode(List<CstNode> skipped) {
        var span = spanOf(skipped);
        return new CstNode.Error(CstNode.NO_FIELD, slice(span), span, skipped);
    }

    private void collectComments(List<CstNode> target, int limit) {
        while (commentCursor < comments.size() && comments.get(commentCursor).start() < limit) {
            var comment = comments.get(commentCursor++);
            if (config.captureComments() && comment.start() >= previousEnd().offset()) {
                target.add(new CstNode.Leaf(COMMENT, CstNode.NO_FIELD, comment.text(), comment.span(), true, false));
            }
        }
    }

    private SourceSpan spanOf(List<CstNode> children) {
        return children.stream()
                       .map(CstNode::span)
                       .reduce(SourceSpan::merge)
                       .orElseGet(() -> SourceSpan.at(previousEnd()));
    }

    private String slice(SourceSpan span) {
        return source.substring(span.start().offset(), span.end().offset());
    }

    private final class NodeBuilder {
        private final String type;
        private final List<CstNode> children = new ArrayList<>();

        NodeBuilder(String type) {
            this.type = type;
        }

        NodeBuilder add(CstNode node) {
            children.add(node);
            return this;
        }

        NodeBuilder add(String field, CstNode node) {
            children.add(node.withField(field));
            return this;
        }

        CstNode.Branch build() {
            var span = spanOf(children);
            return new CstNode.Branch(type, CstNode.NO_FIELD, slice(span), span, children);
        }
    }
}
