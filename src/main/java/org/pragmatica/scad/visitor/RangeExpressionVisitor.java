package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorCode.RangeBound;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.NodeTypes;
import org.pragmatica.scad.tree.SourceSpan;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.Optional;

/**
 * Builds {@code [start:end]} and {@code [start:step:end]} ranges.
 *
 * <p>Never throws and never returns {@code null}: each failure yields an {@link ErrorNode} whose code
 * names the offending bound.
 */
public final class RangeExpressionVisitor {
    private final ExpressionVisitor expressions;
    private final ErrorHandler errorHandler;

    public RangeExpressionVisitor(ExpressionVisitor expressions, ErrorHandler errorHandler) {
        this.expressions = expressions;
        this.errorHandler = errorHandler;
    }

    public Expression visitRangeExpression(SyntaxNode node) {
        if (!NodeTypes.RANGE_EXPRESSION.equals(node.type())) {
            errorHandler.logError("Expected range_expression, got " + node.type(), node);
            return ErrorNode.of(ErrorCode.UNEXPECTED_NODE_TYPE,
                                "Expected range_expression, got '" + node.type() + "'", node);
        }
        errorHandler.logDebug("Processing range expression: " + node.text());

        var startNode = node.childForFieldName("start");
        var stepNode = node.childForFieldName("step");
        var endNode = node.childForFieldName("end");

        if (isAbsent(startNode)) {
            return missing(node, RangeBound.START);
        }
        if (isAbsent(endNode)) {
            return missing(node, RangeBound.END);
        }

        var start = visitBound(node, startNode, RangeBound.START);
        if (start instanceof ErrorNode) {
            return start;
        }
        var end = visitBound(node, endNode, RangeBound.END);
        if (end instanceof ErrorNode) {
            return end;
        }

        var step = Optional.<Expression>empty();
        if (stepNode != null) {
            if (isAbsent(stepNode)) {
                return missing(node, RangeBound.STEP);
            }
            var stepValue = visitBound(node, stepNode, RangeBound.STEP);
            if (stepValue instanceof ErrorNode) {
                return stepValue;
            }
            step = Optional.of(stepValue);
        }
        return new Expression.RangeExpression(start, step, end, SourceSpan.of(node));
    }

    private Expression visitBound(SyntaxNode range, SyntaxNode bound, RangeBound which) {
        if (NodeTypes.FORBIDDEN_IN_RANGE.contains(bound.type())) {
            errorHandler.logError("Forbidden " + bound.type() + " used as range " + which.fieldName(), bound);
            return new ErrorNode(which.invalidSyntax(),
                                 "Invalid syntax: '" + bound.type() + "' cannot be used as the " + which.fieldName()
                                 + " of range " + range.text(),
                                 bound.type(), bound.text(), SourceSpan.of(bound), Optional.empty());
        }
        var result = expressions.visitExpression(bound);
        if (result == null) {
            errorHandler.logError("No expression for range " + which.fieldName() + " '" + bound.text() + "'", bound);
            return ErrorNode.of(which.noResult(),
                                "Failed to parse " + which.fieldName() + " expression in range: " + bound.text(),
                                range);
        }
        if (result instanceof ErrorNode error) {
            if (isReservedKeyword(bound)) {
                errorHandler.logError("Keyword '" + bound.text() + "' used as range " + which.fieldName(), bound);
                return new ErrorNode(which.invalidSyntax(),
                                     "Invalid syntax: reserved keyword '" + bound.text()
                                     + "' cannot be used as the " + which.fieldName() + " of range " + range.text(),
                                     range.type(), bound.text(), SourceSpan.of(bound), Optional.of(error));
            }
            errorHandler.logError("Range " + which.fieldName() + " expression failed: " + error.message(), bound);
            return ErrorNode.of(which.unparsable(),
                                "Failed to parse " + which.fieldName() + " expression '" + bound.text()
                                + "' in range " + range.text() + ": " + error.message(),
                                range, error);
        }
        return result;
    }

    private ErrorNode missing(SyntaxNode range, RangeBound which) {
        errorHandler.logError("Invalid or missing range " + which.fieldName() + ": " + range.text(), range);
        return ErrorNode.of(which.missing(), "Missing " + which.fieldName() + " expression in range: " + range.text(),
                            range);
    }

    private static boolean isAbsent(SyntaxNode bound) {
        return bound == null || bound.isMissing() || bound.isError();
    }

    private static boolean isReservedKeyword(SyntaxNode bound) {
        return NodeTypes.IDENTIFIER.equals(bound.type()) && NodeTypes.RESERVED_KEYWORDS.contains(bound.text());
    }
}
