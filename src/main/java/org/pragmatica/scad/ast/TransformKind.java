package org.pragmatica.scad.ast;

import java.util.List;

public enum TransformKind implements BuiltinKind {
    TRANSLATE("translate", "v"),
    ROTATE("rotate", "a", "v"),
    SCALE("scale", "v"),
    MIRROR("mirror", "v"),
    MULTMATRIX("multmatrix", "m"),
    COLOR("color", "c", "alpha"),
    OFFSET("offset", "r", "delta", "chamfer"),
    RESIZE("resize", "newsize", "auto"),
    LINEAR_EXTRUDE("linear_extrude", "height", "center", "convexity", "twist", "slices", "scale"),
    ROTATE_EXTRUDE("rotate_extrude", "angle", "convexity"),
    PROJECTION("projection", "cut");

    private final String keyword;
    private final List<String> signature;

    TransformKind(String keyword, String... signature) {
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
