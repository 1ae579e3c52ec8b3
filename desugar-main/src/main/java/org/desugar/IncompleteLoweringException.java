package org.desugar;

import org.desugar.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown in strict mode when a run reported errors.
 */
public class IncompleteLoweringException extends DesugarException {

    private final String generatedSource;
    private final List<Diagnostic> diagnostics;

    public IncompleteLoweringException(String message, String generatedSource, List<Diagnostic> diagnostics) {
        super(message);
        this.generatedSource = generatedSource;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getGeneratedSource() {
        return generatedSource;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
