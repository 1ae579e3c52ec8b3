package org.desugar.printer;

import org.desugar.ast.type.TypeNamePrinter;
import org.desugar.diagnostics.Diagnostics;

/**
 * Collaborators shared by the generators of one lowering run.
 */
public final class LoweringContext {

    private final TypeNamePrinter typeNamePrinter;
    private final PrototypePrinter prototypePrinter;
    private final Diagnostics diagnostics;

    public LoweringContext(TypeNamePrinter typeNamePrinter, PrototypePrinter prototypePrinter, Diagnostics diagnostics) {
        this.typeNamePrinter = typeNamePrinter;
        this.prototypePrinter = prototypePrinter;
        this.diagnostics = diagnostics;
    }

    public TypeNamePrinter getTypeNamePrinter() {
        return typeNamePrinter;
    }

    public PrototypePrinter getPrototypePrinter() {
        return prototypePrinter;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }
}
