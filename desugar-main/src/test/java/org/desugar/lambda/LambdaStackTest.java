package org.desugar.lambda;

import org.desugar.LoweringException;
import org.desugar.printer.OutputBuffer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.desugar.test.Ast.CONFIGURATION;

class LambdaStackTest {

    private final LambdaStack stack = new LambdaStack();
    private final OutputBuffer ambient = new OutputBuffer(CONFIGURATION.toPrinterConfiguration());

    @Test
    void closing_insertsSideBufferAtPushPosition() {
        ambient.appendNewLine("int a;");
        try (LambdaScope scope = stack.push(LambdaCallerType.VAR_DECL, ambient)) {
            ambient.append("auto l = X{};");
            scope.getContext().getBuffer().appendNewLine("class X {};");
        }

        assertThat(ambient.getString()).isEqualTo("int a;\nclass X {};\nauto l = X{};");
        assertThat(stack.isEmpty()).isTrue();
    }

    @Test
    void explicitPosition_appliesToAmbientOnly() {
        ambient.append("do {} ");
        try (LambdaScope scope = stack.push(LambdaCallerType.CONTROL_STMT, ambient, 0)) {
            ambient.append("while(c());");
            scope.getContext().getBuffer().appendNewLine("class X {};");
            try (LambdaScope inner = stack.push(LambdaCallerType.CALL_EXPR, ambient, 0)) {
                assertThat(inner.getContext().getTarget()).isSameAs(scope.getContext().getBuffer());
                assertThat(inner.getContext().getInsertPosition()).isEqualTo("class X {};\n".length());
            }
        }

        assertThat(ambient.getString()).isEqualTo("class X {};\ndo {} while(c());");
    }

    @Test
    void nestedContext_targetsOutermostAnchor() {
        try (LambdaScope outer = stack.push(LambdaCallerType.VAR_DECL, ambient);
             LambdaScope inner = stack.push(LambdaCallerType.CALL_EXPR, ambient)) {
            assertThat(inner.getContext().getTarget()).isSameAs(outer.getContext().getBuffer());
            assertThat(stack.back()).isSameAs(inner.getContext());
            assertThat(stack.size()).isEqualTo(2);
        }
    }

    @Test
    void lambdaExprContext_doesNotAnchor() {
        try (LambdaScope outer = stack.push(LambdaCallerType.LAMBDA_EXPR, ambient);
             LambdaScope inner = stack.push(LambdaCallerType.CALL_EXPR, ambient)) {
            assertThat(inner.getContext().getTarget()).isSameAs(ambient);
        }
    }

    @Test
    void inits_areWrittenOnceThenCleared() {
        try (LambdaScope scope = stack.push(LambdaCallerType.CALL_EXPR, ambient)) {
            LambdaContext context = scope.getContext();
            context.appendInits("{a, b}");
            context.insertInits(ambient);
            context.insertInits(ambient);
            assertThat(context.getInits()).isEmpty();
        }
        assertThat(ambient.getString()).isEqualTo("{a, b}");
    }

    @Test
    void closingOutOfOrder_fails() {
        LambdaScope outer = stack.push(LambdaCallerType.VAR_DECL, ambient);
        stack.push(LambdaCallerType.CALL_EXPR, ambient);

        assertThatThrownBy(outer::close)
            .isInstanceOf(LoweringException.class)
            .hasMessageContaining("out of order");
    }

    @Test
    void back_onEmptyStack_fails() {
        assertThatThrownBy(stack::back).isInstanceOf(LoweringException.class);
    }

    @Test
    void close_isIdempotent() {
        LambdaScope scope = stack.push(LambdaCallerType.RETURN_STMT, ambient);
        scope.close();
        scope.close();
        assertThat(stack.isEmpty()).isTrue();
    }
}
