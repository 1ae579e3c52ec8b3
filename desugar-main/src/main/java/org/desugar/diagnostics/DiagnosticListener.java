package org.desugar.diagnostics;

@FunctionalInterface
public interface DiagnosticListener {

    void report(Diagnostic diagnostic);
}
