package org.desugar;

import com.github.javaparser.printer.configuration.Indentation.IndentType;
import org.desugar.ast.decl.UnsupportedDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.ArrayInitIndexExpr;
import org.desugar.ast.type.BuiltinType;
import org.desugar.diagnostics.Diagnostic;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.CONFIGURATION;
import static org.desugar.test.Ast.at;
import static org.desugar.test.Ast.block;
import static org.desugar.test.Ast.declStmt;
import static org.desugar.test.Ast.intLit;
import static org.desugar.test.Ast.local;

class DesugarTest {

    @Test
    void listener_receivesEveryDiagnostic() {
        List<Diagnostic> seen = new ArrayList<>();
        Desugar desugar = Desugar.builder().configuration(CONFIGURATION).listener(seen::add).build();

        LoweringResult result = desugar.lower(new ArrayInitIndexExpr(at(2, 1)));

        assertThat(seen).containsExactlyElementsOf(result.getDiagnostics());
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    void instance_isReusableBetweenRuns() {
        Desugar desugar = Desugar.builder().configuration(CONFIGURATION).build();

        LoweringResult first = desugar.lower(new UnsupportedDecl(at(1), "ConceptDecl"));
        LoweringResult second = desugar.lower(local(1, "x", BuiltinType.INT, intLit(1)));

        assertThat(first.getDiagnostics()).hasSize(1);
        // nothing carries over from the first run
        assertThat(second.getDiagnostics()).isEmpty();
        assertThat(second.getSource()).isEqualTo("int x = 1;\n");
        assertThat(second.toString()).isEqualTo(second.getSource());
    }

    @Test
    void configuration_drivesIndentationAndLineEnds() {
        Desugar desugar = Desugar.builder()
            .configuration(new DesugarConfiguration(1, IndentType.TABS, "\r\n", false))
            .build();
        VarDecl x = local(1, "x", BuiltinType.INT, intLit(1));

        String source = desugar.lower(block(declStmt(x))).getSource();

        assertThat(source).startsWith("{\r\n\tint x = 1;\r\n");
        assertThat(source).doesNotContain(";\n");
    }
}
