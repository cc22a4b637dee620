package org.pragmatica.scad.ast;

import org.pragmatica.scad.tree.SourceSpan;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed OpenSCAD syntax tree. Nodes are immutable values and keep no reference to the CST.
 *
 * <p>Lists returned from any builder may contain {@link ErrorNode}s wherever an expression is
 * expected; callers check {@link #type()} before treating a node as geometry or control flow.
 */
public sealed interface AstNode
permits AstNode.ModuleDefinition, AstNode.FunctionDefinition, AstNode.ModuleInstantiation,
        AstNode.Primitive, AstNode.Transform, AstNode.Csg, AstNode.If, AstNode.ForLoop,
        AstNode.Let, AstNode.Assignment, AstNode.Echo, AstNode.Assert, AstNode.Include, Expression {

    /**
     * Discriminator tag.
     */
    String type();

    /**
     * Source span, {@code null} only on degraded paths.
     */
    SourceSpan span();

    default Optional<SourceSpan> location() {
        return Optional.ofNullable(span());
    }

    record ModuleDefinition(Expression.Identifier name,
                            List<ModuleParameter> parameters,
                            List<AstNode> body,
                            SourceSpan span) implements AstNode {
        public ModuleDefinition {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public String type() {
            return "module_definition";
        }
    }

    record FunctionDefinition(Expression.Identifier name,
                              List<ModuleParameter> parameters,
                              Expression expression,
                              SourceSpan span) implements AstNode {
        public FunctionDefinition {
            parameters = List.copyOf(parameters);
        }

        @Override
        public String type() {
            return "function_definition";
        }
    }

    /**
     * Call of a user module, e.g. {@code gear(teeth = 12);}.
     */
    record ModuleInstantiation(String name,
                               List<Parameter> arguments,
                               List<AstNode> children,
                               Optional<Modifier> modifier,
                               SourceSpan span) implements AstNode {
        public ModuleInstantiation {
            arguments = List.copyOf(arguments);
            children = List.copyOf(children);
        }

        @Override
        public String type() {
            return "module_instantiation";
        }
    }

    record Primitive(PrimitiveKind kind,
                     List<Parameter> arguments,
                     Optional<Modifier> modifier,
                     SourceSpan span) implements AstNode {
        public Primitive {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String type() {
            return kind.keyword();
        }

        public Optional<Expression> argument(String name) {
            return Parameter.resolve(arguments, kind.signature(), name);
        }
    }

    record Transform(TransformKind kind,
                     List<Parameter> arguments,
                     List<AstNode> children,
                     Optional<Modifier> modifier,
                     SourceSpan span) implements AstNode {
        public Transform {
            arguments = List.copyOf(arguments);
            children = List.copyOf(children);
        }

        @Override
        public String type() {
            return kind.keyword();
        }

        public Optional<Expression> argument(String name) {
            return Parameter.resolve(arguments, kind.signature(), name);
        }
    }

    record Csg(CsgKind kind,
               List<Parameter> arguments,
               List<AstNode> children,
               Optional<Modifier> modifier,
               SourceSpan span) implements AstNode {
        public Csg {
            arguments = List.copyOf(arguments);
            children = List.copyOf(children);
        }

        @Override
        public String type() {
            return kind.keyword();
        }
    }

    /**
     * Conditional statement. An else-if chain is an else branch holding a single nested {@code If}.
     */
    record If(Expression condition,
              List<AstNode> thenBranch,
              Optional<List<AstNode>> elseBranch,
              SourceSpan span) implements AstNode {
        public If {
            thenBranch = List.copyOf(thenBranch);
            elseBranch = elseBranch.map(List::copyOf);
        }

        @Override
        public String type() {
            return "if";
        }
    }

    record ForLoop(List<LoopVariable> variables, List<AstNode> body, SourceSpan span) implements AstNode {
        public ForLoop {
            variables = List.copyOf(variables);
            body = List.copyOf(body);
        }

        @Override
        public String type() {
            return "for_loop";
        }
    }

    /**
     * Statement form of {@code let}. Assignments keep declaration order.
     */
    record Let(Map<String, Expression> assignments, List<AstNode> body, SourceSpan span) implements AstNode {
        public Let {
            assignments = Expression.orderedCopy(assignments);
            body = List.copyOf(body);
        }

        @Override
        public String type() {
            return "let";
        }
    }

    record Assignment(Expression.Identifier variable, Expression value, SourceSpan span) implements AstNode {
        @Override
        public String type() {
            return "assignment";
        }
    }

    record Echo(List<Parameter> arguments, SourceSpan span) implements AstNode {
        public Echo {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String type() {
            return "echo";
        }
    }

    record Assert(Expression condition, Optional<Expression> message, SourceSpan span) implements AstNode {
        @Override
        public String type() {
            return "assert";
        }
    }

    record Include(String path, Kind kind, SourceSpan span) implements AstNode {
        public enum Kind {
            INCLUDE,
            USE
        }

        @Override
        public String type() {
            return kind == Kind.INCLUDE ? "include" : "use";
        }
    }
}
