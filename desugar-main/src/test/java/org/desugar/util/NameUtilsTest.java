package org.desugar.util;

import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.type.BuiltinType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.at;

class NameUtilsTest {

    @Test
    void internalNames_areDerivedFromNameAndLine() {
        assertThat(NameUtils.buildInternalVarName("range")).isEqualTo("__range");
        assertThat(NameUtils.buildInternalVarName("range", at(4, 17))).isEqualTo("__range4");
        assertThat(NameUtils.buildGuardName("__s")).isEqualTo("__sB");
    }

    @Test
    void lambdaName_usesLineAndColumnOfClosure() {
        RecordDecl closure = new RecordDecl(at(3, 12), RecordDecl.TagKind.CLASS, "", false);
        assertThat(NameUtils.getLambdaName(closure)).isEqualTo("__lambda_3_12");
        assertThat(NameUtils.buildLambdaName(null)).isEqualTo("__lambda");
    }

    @Test
    void functionPointerAlias_usesLine() {
        VarDecl fp = new VarDecl(at(7, 3), "fp", BuiltinType.INT, null);
        assertThat(NameUtils.buildFunctionPointerAliasName(fp)).isEqualTo("FuncPtr_7");
    }
}
