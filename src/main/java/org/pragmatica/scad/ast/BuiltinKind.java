package org.pragmatica.scad.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A built-in module recognised by name, with its positional parameter order.
 */
public interface BuiltinKind {

    String keyword();

    List<String> signature();

    static <K extends Enum<K> & BuiltinKind> Optional<K> byKeyword(Class<K> kinds, String keyword) {
        return Arrays.stream(kinds.getEnumConstants())
                     .filter(kind -> kind.keyword().equals(keyword))
                     .findFirst();
    }
}
