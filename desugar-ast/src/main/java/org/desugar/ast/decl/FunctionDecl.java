package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.TemplateArgument;
import org.desugar.ast.stmt.CompoundStmt;
import org.desugar.ast.type.FunctionProtoType;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FunctionDecl extends ValueDecl {

    private final List<ParmVarDecl> params;
    private CompoundStmt body;
    private StorageClass storageClass = StorageClass.NONE;
    private boolean inline;
    private boolean constexpr;
    private boolean deleted;
    private boolean defaulted;
    private List<TemplateArgument> templateSpecializationArgs;
    private final List<FunctionDecl> specializations = new ArrayList<>();

    public FunctionDecl(Position begin, String name, FunctionProtoType type, List<ParmVarDecl> params) {
        super(begin, name, type);
        this.params = List.copyOf(params);
    }

    @Override
    public FunctionProtoType getType() {
        return (FunctionProtoType) super.getType();
    }

    public Type getReturnType() {
        return getType().getReturnType();
    }

    public List<ParmVarDecl> getParams() {
        return params;
    }

    public CompoundStmt getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public FunctionDecl setBody(CompoundStmt body) {
        this.body = body;
        return this;
    }

    public StorageClass getStorageClass() {
        return storageClass;
    }

    public FunctionDecl setStorageClass(StorageClass storageClass) {
        this.storageClass = storageClass;
        return this;
    }

    public boolean isInline() {
        return inline;
    }

    public FunctionDecl setInline(boolean inline) {
        this.inline = inline;
        return this;
    }

    public boolean isConstexpr() {
        return constexpr;
    }

    public FunctionDecl setConstexpr(boolean constexpr) {
        this.constexpr = constexpr;
        return this;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public FunctionDecl setDeleted(boolean deleted) {
        this.deleted = deleted;
        return this;
    }

    public boolean isDefaulted() {
        return defaulted;
    }

    public FunctionDecl setDefaulted(boolean defaulted) {
        this.defaulted = defaulted;
        return this;
    }

    /**
     * The arguments this function was instantiated with, or null when it is not a template
     * specialization.
     */
    public List<TemplateArgument> getTemplateSpecializationArgs() {
        return templateSpecializationArgs;
    }

    public FunctionDecl setTemplateSpecializationArgs(List<TemplateArgument> args) {
        this.templateSpecializationArgs = List.copyOf(args);
        return this;
    }

    /**
     * For a function template, the instantiations the front end produced. Empty otherwise.
     */
    public List<FunctionDecl> getSpecializations() {
        return Collections.unmodifiableList(specializations);
    }

    public FunctionDecl addSpecialization(FunctionDecl specialization) {
        specializations.add(specialization);
        return this;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(params, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
