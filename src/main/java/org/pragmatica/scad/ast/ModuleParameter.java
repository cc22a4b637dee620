package org.pragmatica.scad.ast;

import java.util.Optional;

/**
 * Parameter declared by a module, function or function literal.
 */
public record ModuleParameter(String name, Optional<Expression> defaultValue) {

    public static ModuleParameter required(String name) {
        return new ModuleParameter(name, Optional.empty());
    }

    public static ModuleParameter withDefault(String name, Expression defaultValue) {
        return new ModuleParameter(name, Optional.of(defaultValue));
    }
}
