package org.desugar.ast.expr;

import org.desugar.ast.decl.VarDecl;

/**
 * One entry of a closure's capture list.
 */
public final class LambdaCapture {

    public enum Kind {
        THIS,
        STAR_THIS,
        BY_COPY,
        BY_REF,
        VLA_TYPE
    }

    private final Kind kind;
    private final VarDecl capturedVar;
    private final boolean implicit;

    public LambdaCapture(Kind kind, VarDecl capturedVar, boolean implicit) {
        this.kind = kind;
        this.capturedVar = capturedVar;
        this.implicit = implicit;
    }

    public static LambdaCapture byCopy(VarDecl var) {
        return new LambdaCapture(Kind.BY_COPY, var, false);
    }

    public static LambdaCapture byRef(VarDecl var) {
        return new LambdaCapture(Kind.BY_REF, var, false);
    }

    public static LambdaCapture ofThis() {
        return new LambdaCapture(Kind.THIS, null, false);
    }

    public static LambdaCapture ofStarThis() {
        return new LambdaCapture(Kind.STAR_THIS, null, false);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean capturesVariable() {
        return capturedVar != null;
    }

    public boolean capturesThis() {
        return kind == Kind.THIS || kind == Kind.STAR_THIS;
    }

    public boolean capturesVLAType() {
        return kind == Kind.VLA_TYPE;
    }

    public VarDecl getCapturedVar() {
        return capturedVar;
    }

    /**
     * True for captures introduced by a capture default ({@code [=]} or {@code [&]}).
     */
    public boolean isImplicit() {
        return implicit;
    }
}
