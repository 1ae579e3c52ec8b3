package org.desugar.printer;

import com.github.javaparser.printer.configuration.Indentation.IndentType;
import org.desugar.DesugarConfiguration;
import org.desugar.LoweringException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.desugar.test.Ast.CONFIGURATION;

class OutputBufferTest {

    private final OutputBuffer out = new OutputBuffer(CONFIGURATION.toPrinterConfiguration());

    @Test
    void scope_indentsContentAndClosesOnOwnLine() {
        out.appendNewLine("void f()");
        out.openScope();
        out.append("int x");
        out.appendSemiNewLine();
        out.closeScope();

        assertThat(out.getString()).isEqualTo("void f()\n{\n  int x;\n}");
        assertThat(out.getIndentLevel()).isZero();
    }

    @Test
    void nestedScopes_indentOneLevelEach() {
        out.openScope();
        out.openScope();
        out.append("x");
        assertThat(out.getIndentLevel()).isEqualTo(2);
        out.closeScope();
        out.closeScope();

        assertThat(out.getString()).isEqualTo("{\n  {\n    x\n  }\n}");
        assertThat(out.getIndentLevel()).isZero();
    }

    @Test
    void emptyLines_carryNoIndent() {
        out.openScope();
        out.appendNewLine();
        out.append("a");
        out.closeScopeWithSemi();

        assertThat(out.getString()).isEqualTo("{\n\n  a\n};");
    }

    @Test
    void closeScope_withoutOpenScope_fails() {
        assertThatThrownBy(out::closeScope)
            .isInstanceOf(LoweringException.class)
            .hasMessageContaining("unbalanced");
    }

    @Test
    void insertAt_placesTextInFrontOfRecordedPosition() {
        out.append("int a;").appendNewLine();
        int mark = out.length();
        out.append("use();");
        out.insertAt(mark, "class X;\n");

        assertThat(out.getString()).isEqualTo("int a;\nclass X;\nuse();");
        assertThatThrownBy(() -> out.insertAt(1000, "x")).isInstanceOf(LoweringException.class);
    }

    @Test
    void newChild_startsEmptyAtSameIndent() {
        out.openScope();
        OutputBuffer child = out.newChild();
        child.append("x");

        assertThat(child.getString()).isEqualTo("  x");
        assertThat(child.getIndentLevel()).isEqualTo(1);
    }

    @Test
    void configuration_tabsAndWindowsLineEnds() {
        DesugarConfiguration config = CONFIGURATION.withIndentType(IndentType.TABS).withIndentSize(1).withEndOfLine("\r\n");
        OutputBuffer buffer = new OutputBuffer(config.toPrinterConfiguration());
        buffer.openScope();
        buffer.append("x");
        buffer.closeScope();

        assertThat(buffer.getString()).isEqualTo("{\r\n\tx\r\n}");
    }

    @Test
    void lastCharAndLineStart() {
        assertThat(out.isAtLineStart()).isTrue();
        assertThat(out.lastChar()).isEqualTo((char) 0);
        out.append("a>");
        assertThat(out.isAtLineStart()).isFalse();
        assertThat(out.lastChar()).isEqualTo('>');
        assertThat(out.endsWith("a>")).isTrue();
    }
}
