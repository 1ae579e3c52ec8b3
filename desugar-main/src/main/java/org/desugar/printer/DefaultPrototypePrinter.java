package org.desugar.printer;

import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.MethodDecl;
import org.desugar.ast.decl.ParmVarDecl;
import org.desugar.ast.decl.StorageClass;
import org.desugar.ast.type.TypeNamePrinter;

import java.util.StringJoiner;

public class DefaultPrototypePrinter implements PrototypePrinter {

    private final TypeNamePrinter typeNamePrinter;

    public DefaultPrototypePrinter(TypeNamePrinter typeNamePrinter) {
        this.typeNamePrinter = typeNamePrinter;
    }

    @Override
    public String getPrototype(FunctionDecl decl, boolean commentOutConstexpr) {
        StringBuilder sb = new StringBuilder();
        MethodDecl method = decl instanceof MethodDecl ? (MethodDecl) decl : null;

        if (method == null) {
            if (decl.getStorageClass() == StorageClass.STATIC) {
                sb.append("static ");
            } else if (decl.getStorageClass() == StorageClass.EXTERN) {
                sb.append("extern ");
            }
        }
        if (decl.isInline()) {
            sb.append("inline ");
        }
        if (method != null) {
            if (method.isStatic()) {
                sb.append("static ");
            }
            if (method.isVirtual()) {
                sb.append("virtual ");
            }
            if (method.isVolatile()) {
                sb.append("volatile ");
            }
        }
        if (decl.isConstexpr()) {
            sb.append(commentOutConstexpr ? "/*constexpr */ " : "constexpr ");
        }

        if (method != null && method.isConversion()) {
            // the target type may not be spellable here, the caller introduces a retType alias
            sb.append("operator retType (");
        } else {
            if (method == null || !(method.isConstructor() || method.isDestructor())) {
                sb.append(typeNamePrinter.getName(decl.getReturnType())).append(' ');
            }
            sb.append(decl.getName()).append('(');
        }

        StringJoiner params = new StringJoiner(", ");
        for (ParmVarDecl param : decl.getParams()) {
            params.add(typeNamePrinter.getTypeNameAsParameter(param.getType(), param.getName()));
        }
        sb.append(params).append(')');

        if (method != null && method.isConst()) {
            sb.append(" const");
        }
        if (decl.getType().isNoexcept()) {
            sb.append(" noexcept");
        }
        return sb.toString();
    }
}
