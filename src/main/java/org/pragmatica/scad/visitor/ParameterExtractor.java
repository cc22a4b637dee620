package org.pragmatica.scad.visitor;

import org.pragmatica.scad.ast.ErrorNode;
import org.pragmatica.scad.ast.Expression;
import org.pragmatica.scad.ast.ModuleParameter;
import org.pragmatica.scad.error.ErrorCode;
import org.pragmatica.scad.error.ErrorHandler;
import org.pragmatica.scad.tree.FieldReader;
import org.pragmatica.scad.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.scad.tree.NodeTypes.PARAMETER_DECLARATION;
import static org.pragmatica.scad.tree.NodeTypes.PARAMETER_DECLARATIONS;

/**
 * Turns a {@code parameter_list} into declared {@link ModuleParameter}s, keeping declaration order.
 * Default values are converted into full expressions.
 */
public final class ParameterExtractor {
    private ParameterExtractor() {}

    public static List<ModuleParameter> extract(SyntaxNode parameterList, ExpressionVisitor expressions,
                                                ErrorHandler errorHandler) {
        var result = new ArrayList<ModuleParameter>();
        if (parameterList == null || parameterList.isMissing()) {
            return result;
        }
        var container = FieldReader.firstOfType(parameterList, PARAMETER_DECLARATIONS);
        var owner = container == null ? parameterList : container;
        for (var declaration : FieldReader.childrenOfType(owner, PARAMETER_DECLARATION)) {
            var nameNode = FieldReader.fieldOrPositional(declaration, "name", 0);
            if (nameNode == null || nameNode.isMissing()) {
                errorHandler.logWarning("Skipping parameter without a name: " + declaration.text(), declaration);
                continue;
            }
            var valueNode = FieldReader.fieldOrPositional(declaration, "value", 1);
            result.add(new ModuleParameter(nameNode.text(), defaultValue(valueNode, expressions, errorHandler)));
        }
        return result;
    }

    private static Optional<Expression> defaultValue(SyntaxNode valueNode, ExpressionVisitor expressions,
                                                     ErrorHandler errorHandler) {
        if (valueNode == null) {
            return Optional.empty();
        }
        var value = expressions.visitExpression(valueNode);
        if (value == null) {
            errorHandler.logError("Cannot convert default value '" + valueNode.text() + "'", valueNode);
            return Optional.of(ErrorNode.of(ErrorCode.UNPARSABLE_EXPRESSION,
                                            "Unsupported default value of type " + valueNode.type(), valueNode));
        }
        return Optional.of(value);
    }
}
