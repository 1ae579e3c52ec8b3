package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class VarDecl extends ValueDecl {

    private Expr init;
    private StorageClass storageClass = StorageClass.NONE;
    private boolean local;
    private boolean inline;
    private boolean constexpr;
    private boolean nrvoVariable;

    public VarDecl(Position begin, String name, Type type, Expr init) {
        super(begin, name, type);
        this.init = init;
    }

    public Expr getInit() {
        return init;
    }

    public boolean hasInit() {
        return init != null;
    }

    /**
     * Sets the initializer after construction, for initializers that refer back to the variable.
     */
    public VarDecl setInit(Expr init) {
        this.init = init;
        return this;
    }

    public StorageClass getStorageClass() {
        return storageClass;
    }

    public VarDecl setStorageClass(StorageClass storageClass) {
        this.storageClass = storageClass;
        return this;
    }

    /**
     * Declared inside a function body.
     */
    public boolean isLocal() {
        return local;
    }

    public VarDecl setLocal(boolean local) {
        this.local = local;
        return this;
    }

    public boolean isStaticLocal() {
        return local && storageClass == StorageClass.STATIC;
    }

    public boolean isInline() {
        return inline;
    }

    public VarDecl setInline(boolean inline) {
        this.inline = inline;
        return this;
    }

    public boolean isConstexpr() {
        return constexpr;
    }

    public VarDecl setConstexpr(boolean constexpr) {
        this.constexpr = constexpr;
        return this;
    }

    /**
     * Whether the front end selected this variable for the named return value optimization.
     */
    public boolean isNRVOVariable() {
        return nrvoVariable;
    }

    public VarDecl setNRVOVariable(boolean nrvoVariable) {
        this.nrvoVariable = nrvoVariable;
        return this;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(init);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
