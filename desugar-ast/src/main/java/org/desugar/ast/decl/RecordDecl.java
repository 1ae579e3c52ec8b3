package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.TemplateArgument;
import org.desugar.ast.type.RecordType;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A class or struct. Closure classes are records too: they carry their call operator, conversion
 * function and static invoker and have no definition of their own in the source.
 */
public class RecordDecl extends NamedDecl {

    public enum TagKind {
        CLASS("class"),
        STRUCT("struct"),
        UNION("union");

        private final String keyword;

        TagKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final TagKind tagKind;
    private final RecordType typeForDecl;
    private final List<BaseSpecifier> bases = new ArrayList<>();
    private final List<Decl> decls = new ArrayList<>();
    private boolean hasDefinition = true;
    private List<TemplateArgument> templateArgs = List.of();

    private boolean lambda;
    private boolean genericLambda;
    private MethodDecl lambdaCallOperator;
    private final List<MethodDecl> conversions = new ArrayList<>();
    private MethodDecl lambdaStaticInvoker;

    public RecordDecl(Position begin, TagKind tagKind, String name, boolean trivial) {
        super(begin, name);
        this.tagKind = tagKind;
        this.typeForDecl = new RecordType(name, trivial);
    }

    public TagKind getTagKind() {
        return tagKind;
    }

    public RecordType getTypeForDecl() {
        return typeForDecl;
    }

    public List<BaseSpecifier> getBases() {
        return Collections.unmodifiableList(bases);
    }

    public RecordDecl addBase(BaseSpecifier base) {
        bases.add(base);
        return this;
    }

    public List<Decl> getDecls() {
        return Collections.unmodifiableList(decls);
    }

    public RecordDecl addDecl(Decl decl) {
        if (decl instanceof MethodDecl) {
            ((MethodDecl) decl).setParent(this);
        }
        decls.add(decl);
        return this;
    }

    public boolean hasDefinition() {
        return hasDefinition;
    }

    public RecordDecl setHasDefinition(boolean hasDefinition) {
        this.hasDefinition = hasDefinition;
        return this;
    }

    /**
     * Non-empty for a class template specialization.
     */
    public List<TemplateArgument> getTemplateArgs() {
        return templateArgs;
    }

    public RecordDecl setTemplateArgs(List<TemplateArgument> templateArgs) {
        this.templateArgs = List.copyOf(templateArgs);
        return this;
    }

    public boolean isLambda() {
        return lambda;
    }

    public boolean isGenericLambda() {
        return genericLambda;
    }

    /**
     * Marks this record as a closure class.
     *
     * @param callOperator  the call operator; for a generic closure the template whose
     *                      {@link FunctionDecl#getSpecializations()} are the instantiations
     * @param conversion    the conversion to function pointer, null for capturing closures
     * @param staticInvoker the static function the conversion returns, may be null
     */
    public RecordDecl setLambda(MethodDecl callOperator, MethodDecl conversion, MethodDecl staticInvoker,
                                boolean generic) {
        this.lambda = true;
        this.genericLambda = generic;
        this.lambdaCallOperator = callOperator;
        callOperator.setParent(this);
        if (conversion != null) {
            conversion.setParent(this);
            conversions.add(conversion);
        }
        this.lambdaStaticInvoker = staticInvoker;
        if (staticInvoker != null) {
            staticInvoker.setParent(this);
        }
        return this;
    }

    public MethodDecl getLambdaCallOperator() {
        return lambdaCallOperator;
    }

    public List<MethodDecl> getConversions() {
        return Collections.unmodifiableList(conversions);
    }

    public MethodDecl getLambdaStaticInvoker() {
        return lambdaStaticInvoker;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(decls);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
