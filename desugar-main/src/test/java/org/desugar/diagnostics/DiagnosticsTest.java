package org.desugar.diagnostics;

import com.github.javaparser.Position;
import org.desugar.ast.expr.IntegerLiteralExpr;
import org.desugar.ast.type.BuiltinType;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticsTest {

    @Test
    void collectsAndCountsBySeverity() {
        Diagnostics diagnostics = new Diagnostics();
        IntegerLiteralExpr node = new IntegerLiteralExpr(new Position(3, 7), BuiltinType.INT, BigInteger.ONE);

        diagnostics.warning(node, "first");
        diagnostics.error(node, "second");
        diagnostics.report(new Diagnostic(Severity.NOTE, "third", null));

        assertThat(diagnostics.getAll()).extracting(Diagnostic::getMessage).containsExactly("first", "second", "third");
        assertThat(diagnostics.count(Severity.WARNING)).isEqualTo(1);
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.isClean()).isFalse();
    }

    @Test
    void notesKeepRunClean() {
        Diagnostics diagnostics = new Diagnostics();
        diagnostics.report(new Diagnostic(Severity.NOTE, "fyi", null));

        assertThat(diagnostics.isClean()).isTrue();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void forwardsToDownstreamListener() {
        List<Diagnostic> forwarded = new ArrayList<>();
        Diagnostics diagnostics = new Diagnostics(forwarded::add);

        diagnostics.error(null, "no location");

        assertThat(forwarded).hasSize(1);
        assertThat(forwarded.get(0).getPosition()).isEmpty();
    }

    @Test
    void toString_includesLocationWhenKnown() {
        assertThat(new Diagnostic(Severity.ERROR, "bad", new Position(4, 2))).hasToString("4:2: error: bad");
        assertThat(new Diagnostic(Severity.WARNING, "odd", null)).hasToString("warning: odd");
    }

    @Test
    void collectedListIsReadOnly() {
        Diagnostics diagnostics = new Diagnostics();

        assertThatThrownBy(() -> diagnostics.getAll().add(new Diagnostic(Severity.NOTE, "x", null)))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
