package org.desugar.diagnostics;

import com.github.javaparser.Position;

import java.util.Objects;
import java.util.Optional;

/**
 * A message about the input tree, attached to a source location when one is known.
 */
public final class Diagnostic {

    private final Severity severity;
    private final String message;
    private final Position position;

    public Diagnostic(Severity severity, String message, Position position) {
        this.severity = Objects.requireNonNull(severity);
        this.message = Objects.requireNonNull(message);
        this.position = position;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Optional<Position> getPosition() {
        return Optional.ofNullable(position);
    }

    @Override
    public String toString() {
        String location = position == null ? "" : position.line + ":" + position.column + ": ";
        return location + severity.name().toLowerCase() + ": " + message;
    }
}
