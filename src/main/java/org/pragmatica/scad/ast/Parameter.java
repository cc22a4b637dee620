package org.pragmatica.scad.ast;

import java.util.List;
import java.util.Optional;

/**
 * Argument passed at a call site. Positional arguments have no name.
 */
public record Parameter(Optional<String> name, Expression value) {

    public static Parameter positional(Expression value) {
        return new Parameter(Optional.empty(), value);
    }

    public static Parameter named(String name, Expression value) {
        return new Parameter(Optional.of(name), value);
    }

    public boolean isNamed() {
        return name.isPresent();
    }

    /**
     * Resolve an argument by name first, then by its position in the signature.
     */
    public static Optional<Expression> resolve(List<Parameter> arguments, List<String> signature, String name) {
        for (var argument : arguments) {
            if (argument.name().filter(name::equals).isPresent()) {
                return Optional.of(argument.value());
            }
        }
        int position = signature.indexOf(name);
        if (position < 0) {
            return Optional.empty();
        }
        var positional = arguments.stream()
                                  .filter(argument -> !argument.isNamed())
                                  .toList();
        return position < positional.size()
               ? Optional.of(positional.get(position).value())
               : Optional.empty();
    }
}
