package org.desugar.diagnostics;

public enum Severity {
    NOTE,
    WARNING,
    ERROR
}
