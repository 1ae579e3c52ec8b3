package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.FunctionProtoType;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A member function: ordinary method, constructor, destructor or conversion operator.
 */
public class MethodDecl extends FunctionDecl {

    public enum Kind {
        METHOD,
        CONSTRUCTOR,
        DESTRUCTOR,
        CONVERSION
    }

    private final Kind kind;
    private RecordDecl parent;
    private AccessSpecifier access = AccessSpecifier.PUBLIC;
    private boolean isStatic;
    private boolean isVirtual;
    private boolean isConst;
    private boolean isVolatile;
    private boolean userProvided = true;
    private final List<CtorInitializer> ctorInitializers = new ArrayList<>();

    public MethodDecl(Position begin, Kind kind, String name, FunctionProtoType type, List<ParmVarDecl> params) {
        super(begin, name, type, params);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConstructor() {
        return kind == Kind.CONSTRUCTOR;
    }

    public boolean isDestructor() {
        return kind == Kind.DESTRUCTOR;
    }

    public boolean isConversion() {
        return kind == Kind.CONVERSION;
    }

    public RecordDecl getParent() {
        return parent;
    }

    void setParent(RecordDecl parent) {
        this.parent = parent;
    }

    public AccessSpecifier getAccess() {
        return access;
    }

    public MethodDecl setAccess(AccessSpecifier access) {
        this.access = access;
        return this;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public MethodDecl setStatic(boolean isStatic) {
        this.isStatic = isStatic;
        return this;
    }

    public boolean isVirtual() {
        return isVirtual;
    }

    public MethodDecl setVirtual(boolean isVirtual) {
        this.isVirtual = isVirtual;
        return this;
    }

    public boolean isConst() {
        return isConst;
    }

    public MethodDecl setConst(boolean isConst) {
        this.isConst = isConst;
        return this;
    }

    public boolean isVolatile() {
        return isVolatile;
    }

    public MethodDecl setVolatile(boolean isVolatile) {
        this.isVolatile = isVolatile;
        return this;
    }

    /**
     * False for special members the compiler declared implicitly.
     */
    public boolean isUserProvided() {
        return userProvided;
    }

    public MethodDecl setUserProvided(boolean userProvided) {
        this.userProvided = userProvided;
        return this;
    }

    public List<CtorInitializer> getCtorInitializers() {
        return Collections.unmodifiableList(ctorInitializers);
    }

    public MethodDecl addCtorInitializer(CtorInitializer initializer) {
        ctorInitializers.add(initializer);
        return this;
    }

    @Override
    public List<Node> getChildNodes() {
        List<Node> children = new ArrayList<>(getParams());
        for (CtorInitializer initializer : ctorInitializers) {
            children.add(initializer.getInit());
        }
        children.addAll(childrenOf(getBody()));
        return Collections.unmodifiableList(children);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
