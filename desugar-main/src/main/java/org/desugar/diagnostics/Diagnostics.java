package org.desugar.diagnostics;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one lowering run, logs each of them and forwards them to an optional
 * downstream listener.
 */
public class Diagnostics implements DiagnosticListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> collected = new ArrayList<>();
    private final DiagnosticListener downstream;

    public Diagnostics() {
        this(null);
    }

    public Diagnostics(DiagnosticListener downstream) {
        this.downstream = downstream;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        switch (diagnostic.getSeverity()) {
            case ERROR:
                LOGGER.error("{}", diagnostic);
                break;
            case WARNING:
                LOGGER.warn("{}", diagnostic);
                break;
            default:
                LOGGER.info("{}", diagnostic);
        }
        collected.add(diagnostic);
        if (downstream != null) {
            downstream.report(diagnostic);
        }
    }

    public void error(Node node, String message) {
        report(new Diagnostic(Severity.ERROR, message, positionOf(node)));
    }

    public void warning(Node node, String message) {
        report(new Diagnostic(Severity.WARNING, message, positionOf(node)));
    }

    private static Position positionOf(Node node) {
        return node == null ? null : node.getBegin().orElse(null);
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(collected);
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }

    /**
     * True when nothing was reported at warning level or above.
     */
    public boolean isClean() {
        return collected.stream().allMatch(d -> d.getSeverity() == Severity.NOTE);
    }

    public long count(Severity severity) {
        return collected.stream().filter(d -> d.getSeverity() == severity).count();
    }
}
