package org.desugar;

import org.desugar.diagnostics.Diagnostic;
import org.desugar.diagnostics.Severity;

import java.util.List;

/**
 * Output of one {@link Desugar#lower(org.desugar.ast.Node)} call.
 */
public final class LoweringResult {

    private final String source;
    private final List<Diagnostic> diagnostics;

    LoweringResult(String source, List<Diagnostic> diagnostics) {
        this.source = source;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getSource() {
        return source;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * False when a construct could not be lowered and the source contains a placeholder for it,
     * that is when an error or a warning was reported.
     */
    public boolean isComplete() {
        return diagnostics.stream().noneMatch(d -> d.getSeverity() == Severity.ERROR || d.getSeverity() == Severity.WARNING);
    }

    @Override
    public String toString() {
        return source;
    }
}
