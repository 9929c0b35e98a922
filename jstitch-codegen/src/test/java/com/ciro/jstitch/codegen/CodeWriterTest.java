package com.ciro.jstitch.codegen;

import com.ciro.jstitch.diagnostics.InternalCompilerException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeWriterTest {

    @Test
    void indentsInsideLambdas() {
        CodeWriter writer = new CodeWriter();
        writer.write("run(");
        CodeWriter.ClosureHandle closure = writer.buildLambda("b");
        writer.writeLine("b.go();");
        closure.end();
        writer.writeEndMethodInvocation();

        assertThat(writer.generatedCode()).isEqualTo("""
                run((b) -> {
                    b.go();
                });
                """);
        assertThat(writer.indentLevel()).isZero();
    }

    @Test
    void escapesStringLiterals() {
        CodeWriter writer = new CodeWriter();
        writer.writeStringLiteral("di \"hola\"\n\tadiós\\");

        assertThat(writer.generatedCode()).isEqualTo("\"di \\\"hola\\\"\\n\\tadiós\\\\\"");
    }

    @Test
    void writesMethodInvocations() {
        CodeWriter writer = new CodeWriter();
        writer.writeStartMethodInvocation("builder", "closeElement").writeEndMethodInvocation();

        assertThat(writer.generatedCode()).isEqualTo("builder.closeElement();\n");
    }

    @Test
    void closureEndsOnlyOnce() {
        CodeWriter writer = new CodeWriter();
        CodeWriter.ClosureHandle closure = writer.buildLambda("b");
        closure.end();

        assertThat(closure.isEnded()).isTrue();
        assertThatThrownBy(closure::end)
                .isInstanceOf(InternalCompilerException.class)
                .hasMessageContaining("closure ended twice");
    }
}
