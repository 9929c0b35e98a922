package com.ciro.jstitch;

import com.ciro.jstitch.diagnostics.DiagnosticFactory;
import com.ciro.jstitch.diagnostics.InternalCompilerException;
import com.ciro.jstitch.diagnostics.IrDiagnostic;
import com.ciro.jstitch.ir.ConstructAttributeNode;
import com.ciro.jstitch.ir.ConstructBodyNode;
import com.ciro.jstitch.ir.ConstructNode;
import com.ciro.jstitch.ir.DocumentNode;
import com.ciro.jstitch.ir.ElementNode;
import com.ciro.jstitch.ir.ExpressionValueNode;
import com.ciro.jstitch.ir.MarkupNode;
import com.ciro.jstitch.passes.ComponentClassifier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ciro.jstitch.ir.NodeAssert.element;
import static org.assertj.core.api.Assertions.assertThat;

class StitchCompilerTest {

    private final StitchCompiler compiler = new StitchCompiler(StitchOptions.defaults(), ComponentClassifier.byTagCase());

    private static DocumentNode document(String name, String markup) {
        DocumentNode document = new DocumentNode(name);
        document.children.add(MarkupNode.of(markup));
        return document;
    }

    @Test
    void compilesStructureAndLowersOrphans() {
        // <form>@<input bind="@x"><b>hola</b></input></form>
        ConstructNode input = new ConstructNode("input", List.of("bind"));
        ConstructBodyNode body = new ConstructBodyNode();
        body.children.add(MarkupNode.of("<b>hola</b>"));
        ConstructAttributeNode bind = new ConstructAttributeNode("bind");
        bind.children.add(ExpressionValueNode.of("x"));
        input.children.add(body);
        input.children.add(bind);

        DocumentNode document = new DocumentNode("form");
        document.children.add(MarkupNode.of("<form>"));
        document.children.add(input);
        document.children.add(MarkupNode.of("</form>"));

        CompileResult result = compiler.compile(document);

        assertThat(result.isSuccess()).isTrue();
        ElementNode form = element(document.children.get(0), "form");
        ElementNode lowered = element(form.children.get(0), "input");
        assertThat(lowered.attributes()).hasSize(1);
        element(lowered.body().get(0), "b");
    }

    @Test
    void reportsDiagnosticsInDocumentOrder() {
        CompileResult result = compiler.compile(document("diag", "<a><i></b></a><p></q>"));

        assertThat(result.isAborted()).isFalse();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.diagnostics())
                .extracting(IrDiagnostic::id)
                .containsExactly(DiagnosticFactory.MISMATCHED_CLOSING_TAG, DiagnosticFactory.MISMATCHED_CLOSING_TAG);
        assertThat(result.diagnostics().get(0).message()).contains("</b>", "</i>");
        assertThat(result.diagnostics().get(1).message()).contains("</q>", "</p>");
    }

    @Test
    void internalErrorAbortsOnlyThatDocument() {
        List<CompileResult> results = compiler.compileAll(List.of(
                document("first", "<p>uno</p>"),
                document("broken", "<div>sin cerrar"),
                document("third", "<p>tres</p>")));

        assertThat(results).hasSize(3);
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(1).isAborted()).isTrue();
        assertThat(results.get(1).failure())
                .isInstanceOf(InternalCompilerException.class)
                .hasMessageContaining("<div>");
        assertThat(results.get(2).isSuccess()).isTrue();
        element(results.get(2).document().children.get(0), "p");
    }

    @Test
    void collectsDiagnosticsFromWholeTree() {
        DocumentNode document = new DocumentNode("tree");
        ElementNode outer = new ElementNode("div");
        ElementNode inner = new ElementNode("span");
        IrDiagnostic first = new IrDiagnostic("JST1", IrDiagnostic.Severity.WARNING, null, "primero");
        IrDiagnostic second = new IrDiagnostic("JST2", IrDiagnostic.Severity.WARNING, null, "segundo");
        IrDiagnostic third = new IrDiagnostic("JST3", IrDiagnostic.Severity.WARNING, null, "tercero");
        outer.diagnostics.add(first);
        inner.diagnostics.add(second);
        outer.children.add(inner);
        document.children.add(outer);
        document.diagnostics.add(third);

        assertThat(StitchCompiler.collectDiagnostics(document)).containsExactly(third, first, second);
    }
}
