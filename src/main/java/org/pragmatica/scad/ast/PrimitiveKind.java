package org.pragmatica.scad.ast;

import java.util.List;

public enum PrimitiveKind implements BuiltinKind {
    CUBE("cube", "size", "center"),
    SPHERE("sphere", "r", "d"),
    CYLINDER("cylinder", "h", "r1", "r2", "center"),
    SQUARE("square", "size", "center"),
    CIRCLE("circle", "r", "d"),
    POLYGON("polygon", "points", "paths", "convexity"),
    POLYHEDRON("polyhedron", "points", "faces", "convexity"),
    TEXT("text", "text", "size", "font", "halign", "valign", "spacing", "direction", "language", "script");

    private final String keyword;
    private final List<String> signature;

    PrimitiveKind(String keyword, String... signature) {
        this.keyword = keyword;
        this.signature = List.of(signature);
    }

    @Override
    public String keyword() {
        return keyword;
    }

    @Override
    public List<String> signature() {
        return signature;
    }
}
