package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.AstNode;
import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.Expression.BinaryOperator;
import org.pragmatica.scad.ast.Expression.UnaryOperator;
import org.pragmatica.scad.ast.LoopVariable;
import org.pragmatica.scad.ast.Parameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.scad.tree.NodeTypes.*;

/**
 * Builds expression nodes. Range syntax is handed to {@link RangeExpressionVisitor}.
 *
 * <p>Statement-level calls are not expressions, so {@link #visitModuleInstantiation} always returns
 * {@code null}; call expressions become {@link Expression.FunctionCall}s.
 */
public class ExpressionVisitor extends BaseVisitor {
    private final RangeExpressionVisitor ranges;

    public ExpressionVisitor(ErrorHandler errorHandler) {
        super(errorHandler);
        this.ranges = new RangeExpressionVisitor(this, errorHandler);
    }

    @Override
    protected ExpressionVisitor expressions() {
        return this;
    }

    @Override
    protected boolean handlesCall(String name) {
        return true;
    }

    @Override
    protected AstNode createNodeForCall(SyntaxNode node, String name, List<Parameter> arguments) {
        return new Expression.FunctionCall(name, arguments, SourceSpan.of(node));
    }

    @Override
    public AstNode visitModuleInstantiation(SyntaxNode node) {
        return null;
    }

    @Override
    public AstNode visitCallExpression(SyntaxNode node) {
        var callee = node.childForFieldName("function");
        if (callee == null || callee.isMissing()) {
            errorHandler.logError("Call without a callee: " + node.text(), node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Call expression has no function", node);
        }
        return createNodeForCall(node, callee.text(), arguments(node.childForFieldName("arguments")));
    }

    @Override
    public Expression visitExpression(SyntaxNode node) {
        if (node == null) {
            return null;
        }
        if (node.isError()) {
            errorHandler.logError("Syntax error in expression: " + node.text(), node);
            return ErrorNode.of(ErrorCode.SYNTAX_ERROR, "Syntax error: " + node.text(), node);
        }
        if (node.isMissing()) {
            errorHandler.logError("Missing expression", node);
            return ErrorNode.of(ErrorCode.MISSING_CHILD_NODE, "Missing " + node.type(), node);
        }
        return switch (node.type()) {
            case NUMBER -> number(node);
            case STRING -> Expression.Literal.string(unquote(node.text()), SourceSpan.of(node));
            case BOOLEAN -> Expression.Literal.bool(Boolean.parseBoolean(node.text()), SourceSpan.of(node));
            case UNDEF -> Expression.Literal.undef(SourceSpan.of(node));
            case IDENTIFIER -> identifier(node);
            case SPECIAL_VARIABLE -> new Expression.Identifier(node.text(), SourceSpan.of(node));
            case BINARY_EXPRESSION -> binary(node);
            case UNARY_EXPRESSION -> unary(node);
            case CONDITIONAL_EXPRESSION -> new Expression.Ternary(operand(node, "condition"),
                                                                  operand(node, "consequence"),
                                                                  operand(node, "alternative"),
                                                                  SourceSpan.of(node));
            case PARENTHESIZED_EXPRESSION -> operand(node, FieldReader.firstNamed(node), "inner expression");
            case CALL_EXPRESSION -> (Expression) visitCallExpression(node);
            case INDEX_EXPRESSION -> new Expression.Index(operand(node, "array"),
                                                          operand(node, "index"),
                                                          SourceSpan.of(node));
            case MEMBER_EXPRESSION -> member(node);
            case RANGE_EXPRESSION -> ranges.visitRangeExpression(node);
            case VECTOR_EXPRESSION -> vector(node);
            case EACH_EXPRESSION -> each(node);
            case LET_EXPRESSION -> letExpression(node);
            case LIST_COMPREHENSION -> listComprehension(node);
            case FUNCTION_LITERAL -> new Expression.FunctionLiteral(parameters(node.childForFieldName("parameters")),
                                                                    operand(node, "body"),
                                                                    SourceSpan.of(node));
            case ECHO_EXPRESSION -> new Expression.EchoExpression(arguments(node.childForFieldName("arguments")),
                                                                  optional(node, "expression"),
                                                                  SourceSpan.of(node));
            case ASSERT_EXPRESSION -> new Expression.AssertExpression(operand(node, "condition"),
                                                                      optional(node, "message"),
                                                                      optional(node, "expression"),
                                                                      SourceSpan.of(node));
            default -> null;
        };
    }

    /**
     * Loop clauses of a {@code for} statement or list comprehension clause.
     */
    public List<LoopVariable> loopVariables(SyntaxNode owner) {
        var result = new ArrayList<LoopVariable>();
        var clauses = FieldReader.childrenOfType(owner, FOR_ASSIGNMENT);
        if (clauses.isEmpty() && owner.childForFieldName("iterator") != null) {
            clauses = List.of(owner);
        }
        for (var clause : clauses) {
            var iterator = clause.childForFieldName("iterator");
            if (iterator == null || iterator.isMissing()) {
                errorHandler.logWarning("Loop clause without a variable: " + clause.text(), clause);
                continue;
            }
            result.add(new LoopVariable(iterator.text(), operand(clause, "range")));
        }
        return result;
    }

    // === Expression kinds ===

    private Expression number(SyntaxNode node) {
        try {
            return Expression.Literal.number(Double.parseDouble(node.text()), SourceSpan.of(node));
        } catch (NumberFormatException e) {
            errorHandler.logError("Invalid number '" + node.text() + "'", node);
            return ErrorNode.of(ErrorCode.INVALID_NUMBER, "Invalid number: " + e.getMessage(), node);
        }
    }

    private Expression identifier(SyntaxNode node) {
        if (RESERVED_KEYWORDS.contains(node.text())) {
            errorHandler.logError("Reserved keyword '" + node.text() + "' used as an identifier", node);
            return ErrorNode.of(ErrorCode.RESERVED_KEYWORD_AS_IDENTIFIER,
                                "Reserved keyword '" + node.text() + "' cannot be used as an expression", node);
        }
        return new Expression.Identifier(node.text(), SourceSpan.of(node));
    }

    private Expression binary(SyntaxNode node) {
        var operatorNode = node.childForFieldName("operator");
        var operator = operatorNode == null ? Optional.<BinaryOperator>empty()
                                            : BinaryOperator.fromSymbol(operatorNode.text());
        if (operator.isEmpty()) {
            errorHandler.logError("Unknown binary operator in '" + node.text() + "'", node);
            return ErrorNode.of(ErrorCode.UNPARSABLE_EXPRESSION, "Unknown binary operator", node);
        }
        return new Expression.Binary(operator.get(), operand(node, "left"), operand(node, "right"),
                                     SourceSpan.of(node));
    }

    private Expression unary(SyntaxNode node) {
        var operatorNode = node.childForFieldName("operator");
        var operator = operatorNode == null ? Optional.<UnaryOperator>empty()
                                            : UnaryOperator.fromSymbol(operatorNode.text());
        if (operator.isEmpty()) {
            errorHandler.logError("Unknown unary operator in '" + node.text() + "'", node);
            return ErrorNode.of(ErrorCode.UNPARSABLE_EXPRESSION, "Unknown unary operator", node);
        }
        return new Expression.Unary(operator.get(), operand(node, "operand"), SourceSpan.of(node));
    }

    private Expression member(SyntaxNode node) {
        var property = node.childForFieldName("property");
        if (property == null || property.isMissing()) {
            errorHandler.logError("Member access without a member name: " + node.text(), node);
            return ErrorNode.of(ErrorCode.MISSING_OPERAND, "Member access has no member name", node);
        }
        return new Expression.Member(operand(node, "object"), property.text(), SourceSpan.of(node));
    }

    private Expression vector(SyntaxNode node) {
        var elements = new ArrayList<Expression>();
        for (var child : node.namedChildren()) {
            if (COMMENT.equals(child.type())) {
                continue;
            }
            elements.add(operand(node, child, "vector element"));
        }
        return new Expression.Vector(elements, SourceSpan.of(node));
    }

    private Expression each(SyntaxNode node) {
        if (root() != this && root().visitEachExpression(node) instanceof Expression expression) {
            return expression;
        }
        return new Expression.Each(operand(node, "expression"), SourceSpan.of(node));
    }

    private Expression letExpression(SyntaxNode node) {
        var assignments = new LinkedHashMap<String, Expression>();
        for (var assignment : FieldReader.childrenOfType(node, LET_ASSIGNMENT)) {
            var name = FieldReader.text(assignment, "name");
            if (name == null) {
                errorHandler.logWarning("Let binding without a name: " + assignment.text(), assignment);
                continue;
            }
            assignments.put(name, operand(assignment, "value"));
        }
        return new Expression.LetExpression(assignments, operand(node, "body"), SourceSpan.of(node));
    }

    private Expression listComprehension(SyntaxNode node) {
        var variables = new ArrayList<LoopVariable>();
        for (var clause : FieldReader.childrenOfType(node, LIST_COMPREHENSION_FOR)) {
            variables.addAll(loopVariables(clause));
        }
        return new Expression.ListComprehension(variables,
                                                optional(node, "condition"),
                                                operand(node, "expr"),
                                                SourceSpan.of(node));
    }

    // === Operand helpers ===

    private Expression operand(SyntaxNode parent, String field) {
        return operand(parent, parent.childForFieldName(field), field);
    }

    /**
     * Required sub-expression. Never {@code null}: absence and unsupported shapes become error nodes.
     */
    private Expression operand(SyntaxNode parent, SyntaxNode child, String role) {
        if (child == null || child.isMissing()) {
            errorHandler.logError("Missing " + role + " in '" + parent.text() + "'", parent);
            return ErrorNode.of(ErrorCode.MISSING_OPERAND, "Missing " + role + " in " + parent.type(), parent);
        }
        var result = visitExpression(child);
        if (result == null) {
            errorHandler.logError("Unexpected " + child.type() + " as " + role, child);
            return ErrorNode.of(ErrorCode.UNEXPECTED_NODE_TYPE,
                                "Expected an expression for " + role + ", found " + child.type(), child);
        }
        return result;
    }

    private Optional<Expression> optional(SyntaxNode parent, String field) {
        var child = parent.childForFieldName(field);
        return child == null ? Optional.empty() : Optional.of(operand(parent, child, field));
    }

    private static String unquote(String text) {
        if (text.length() < 2 || !text.startsWith("\"") || !text.endsWith("\"")) {
            return text;
        }
        var body = text.substring(1, text.length() - 1);
        var sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
