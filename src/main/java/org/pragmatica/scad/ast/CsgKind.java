package org.pragmatica.scad.ast;

import java.util.List;

public enum CsgKind implements BuiltinKind {
    UNION("union"),
    DIFFERENCE("difference"),
    INTERSECTION("intersection"),
    HULL("hull"),
    MINKOWSKI("minkowski", "convexity");

    private final String keyword;
    private final List<String> signature;

    CsgKind(String keyword, String... signature) {
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
