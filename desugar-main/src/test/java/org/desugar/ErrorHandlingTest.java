package org.desugar;

import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.UnsupportedDecl;
import org.desugar.ast.expr.ArrayInitIndexExpr;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.FunctionProtoType;
import org.desugar.diagnostics.Severity;
import org.desugar.printer.OutputBuffer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.desugar.test.Ast.CONFIGURATION;
import static org.desugar.test.Ast.at;

class ErrorHandlingTest {

    // 1. IncompleteLoweringException - strict mode turns errors into a failure
    @Test
    void strictMode_failsWithPartialSourceAndDiagnostics() {
        Desugar strict = Desugar.builder().configuration(CONFIGURATION.withStrict(true)).build();

        assertThatThrownBy(() -> strict.lower(new ArrayInitIndexExpr(at(4, 9))))
            .isInstanceOf(IncompleteLoweringException.class)
            .satisfies(e -> {
                IncompleteLoweringException ile = (IncompleteLoweringException) e;
                assertThat(ile.getMessage()).isEqualTo("lowering of ArrayInitIndexExpr is incomplete: 1 error(s)");
                assertThat(ile.getGeneratedSource()).isEqualTo("/* [TODO] unsupported: ArrayInitIndexExpr */");
                assertThat(ile.getDiagnostics()).extracting(d -> d.getSeverity()).contains(Severity.ERROR);
                assertThat(ile).isInstanceOf(DesugarException.class);
            });
    }

    // 2. Warnings alone never fail strict mode, the result still reports the placeholder
    @Test
    void strictMode_toleratesWarnings() {
        Desugar strict = Desugar.builder().configuration(CONFIGURATION.withStrict(true)).build();

        LoweringResult result = strict.lower(new UnsupportedDecl(at(1), "ConceptDecl"));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getSource()).isEqualTo("/* [TODO] unsupported: ConceptDecl */\n");
        assertThat(result.getDiagnostics()).hasSize(1);
    }

    // 3. LoweringException - a failing collaborator is wrapped with the node being lowered
    @Test
    void collaboratorFailure_isWrappedWithNode() {
        Desugar desugar = Desugar.builder()
            .configuration(CONFIGURATION)
            .prototypePrinter((decl, commentOutConstexpr) -> {
                throw new IllegalStateException("no prototype for " + decl.getName());
            })
            .build();
        FunctionDecl f = new FunctionDecl(at(3), "f", new FunctionProtoType(BuiltinType.VOID, List.of()), List.of());

        assertThatThrownBy(() -> desugar.lower(f))
            .isInstanceOf(LoweringException.class)
            .hasCauseInstanceOf(IllegalStateException.class)
            .satisfies(e -> {
                LoweringException le = (LoweringException) e;
                assertThat(le.getMessage()).contains("no prototype for f");
                assertThat(le.getNodeDescription()).isEqualTo(f.toString());
            });
    }

    // 4. LoweringException - unbalanced scopes are an internal error
    @Test
    void unbalancedScope_isInternalError() {
        OutputBuffer out = new OutputBuffer(CONFIGURATION.toPrinterConfiguration());

        assertThatThrownBy(out::closeScope)
            .isInstanceOf(LoweringException.class)
            .hasMessageContaining("unbalanced scope")
            .satisfies(e -> assertThat(((LoweringException) e).getNodeDescription()).isNull());
    }

    // 5. Invalid input to the facade
    @Test
    void nullRoot_isRejected() {
        Desugar desugar = Desugar.builder().configuration(CONFIGURATION).build();

        assertThatThrownBy(() -> desugar.lower(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("root must not be null");
    }

    @Test
    void builder_requiresConfiguration() {
        assertThatThrownBy(() -> Desugar.builder().configuration(null).build())
            .isInstanceOf(IllegalStateException.class);
    }
}
