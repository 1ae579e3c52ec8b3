package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.TemplateArgument;
import org.desugar.ast.decl.ValueDecl;
import org.desugar.ast.type.ReferenceType;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A reference to a declared variable, function or enumerator.
 */
public class DeclRefExpr extends Expr {

    private final ValueDecl decl;
    private String qualifier = "";
    private List<TemplateArgument> templateArguments = List.of();

    public DeclRefExpr(Position begin, ValueDecl decl) {
        this(begin, nonReference(decl.getType()), decl);
    }

    public DeclRefExpr(Position begin, Type type, ValueDecl decl) {
        super(begin, type);
        this.decl = decl;
    }

    private static Type nonReference(Type type) {
        return type instanceof ReferenceType ? ((ReferenceType) type).getPointeeType() : type;
    }

    public ValueDecl getDecl() {
        return decl;
    }

    /**
     * The nested-name-specifier as written, e.g. {@code std::}. Empty when unqualified.
     */
    public String getQualifier() {
        return qualifier;
    }

    public DeclRefExpr setQualifier(String qualifier) {
        this.qualifier = qualifier;
        return this;
    }

    /**
     * The explicitly written template arguments, e.g. the {@code <0>} of {@code get<0>}.
     */
    public List<TemplateArgument> getTemplateArguments() {
        return templateArguments;
    }

    public DeclRefExpr setTemplateArguments(List<TemplateArgument> templateArguments) {
        this.templateArguments = List.copyOf(templateArguments);
        return this;
    }

    /**
     * The qualified name of the referenced declaration. Empty for unnamed declarations.
     */
    public String getName() {
        return qualifier + decl.getName();
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
