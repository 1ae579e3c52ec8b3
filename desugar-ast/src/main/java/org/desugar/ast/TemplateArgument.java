package org.desugar.ast;

import org.desugar.ast.decl.ValueDecl;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.type.Type;

import java.math.BigInteger;
import java.util.List;

/**
 * One resolved template argument of a specialization.
 */
public final class TemplateArgument {

    public enum Kind {
        NULL,
        TYPE,
        DECLARATION,
        NULLPTR,
        INTEGRAL,
        TEMPLATE,
        TEMPLATE_EXPANSION,
        EXPRESSION,
        PACK
    }

    private final Kind kind;
    private final Type type;
    private final ValueDecl declaration;
    private final BigInteger integral;
    private final String templateName;
    private final Expr expression;
    private final List<TemplateArgument> packElements;

    private TemplateArgument(Kind kind, Type type, ValueDecl declaration, BigInteger integral, String templateName,
                             Expr expression, List<TemplateArgument> packElements) {
        this.kind = kind;
        this.type = type;
        this.declaration = declaration;
        this.integral = integral;
        this.templateName = templateName;
        this.expression = expression;
        this.packElements = packElements;
    }

    public static TemplateArgument ofNull() {
        return new TemplateArgument(Kind.NULL, null, null, null, null, null, List.of());
    }

    public static TemplateArgument ofType(Type type) {
        return new TemplateArgument(Kind.TYPE, type, null, null, null, null, List.of());
    }

    public static TemplateArgument ofDeclaration(ValueDecl declaration) {
        return new TemplateArgument(Kind.DECLARATION, declaration.getType(), declaration, null, null, null, List.of());
    }

    public static TemplateArgument ofNullPtr(Type type) {
        return new TemplateArgument(Kind.NULLPTR, type, null, null, null, null, List.of());
    }

    public static TemplateArgument ofIntegral(long value) {
        return ofIntegral(BigInteger.valueOf(value));
    }

    public static TemplateArgument ofIntegral(BigInteger value) {
        return new TemplateArgument(Kind.INTEGRAL, null, null, value, null, null, List.of());
    }

    public static TemplateArgument ofTemplate(String templateName) {
        return new TemplateArgument(Kind.TEMPLATE, null, null, null, templateName, null, List.of());
    }

    public static TemplateArgument ofTemplateExpansion(String templateName) {
        return new TemplateArgument(Kind.TEMPLATE_EXPANSION, null, null, null, templateName, null, List.of());
    }

    public static TemplateArgument ofExpression(Expr expression) {
        return new TemplateArgument(Kind.EXPRESSION, expression.getType(), null, null, null, expression, List.of());
    }

    public static TemplateArgument ofPack(List<TemplateArgument> elements) {
        return new TemplateArgument(Kind.PACK, null, null, null, null, null, List.copyOf(elements));
    }

    public Kind getKind() {
        return kind;
    }

    public Type getAsType() {
        return type;
    }

    public ValueDecl getAsDeclaration() {
        return declaration;
    }

    public BigInteger getAsIntegral() {
        return integral;
    }

    public String getAsTemplateName() {
        return templateName;
    }

    public Expr getAsExpression() {
        return expression;
    }

    public List<TemplateArgument> getPackElements() {
        return packElements;
    }
}
