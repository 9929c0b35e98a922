package com.ciro.jstitch.passes;

import com.ciro.jstitch.StitchOptions;
import com.ciro.jstitch.ir.AttributeNode;
import com.ciro.jstitch.ir.AttributeValueNode;
import com.ciro.jstitch.ir.CodeBlockNode;
import com.ciro.jstitch.ir.ConstructBodyNode;
import com.ciro.jstitch.ir.ConstructNode;
import com.ciro.jstitch.ir.DocumentNode;
import com.ciro.jstitch.ir.ElementNode;
import com.ciro.jstitch.ir.ExpressionNode;
import com.ciro.jstitch.ir.ExpressionValueNode;
import com.ciro.jstitch.ir.MarkupNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ciro.jstitch.ir.NodeAssert.attribute;
import static com.ciro.jstitch.ir.NodeAssert.content;
import static com.ciro.jstitch.ir.NodeAssert.element;
import static com.ciro.jstitch.ir.NodeAssert.whitespace;
import static org.assertj.core.api.Assertions.assertThat;

class StructuringPassTest {

    private StructuringPass pass;

    @BeforeEach
    void setUp() {
        pass = new StructuringPass(StitchOptions.defaults());
    }

    @Test
    void rewritesBasicHtml() {
        DocumentNode document = new DocumentNode("basic");
        document.children.add(MarkupNode.of("""

                <html>
                  <head cool="beans">
                    Hello, World!
                  </head>
                </html>"""));

        pass.execute(document);

        assertThat(document.children).hasSize(1);
        ElementNode html = element(document.children.get(0), "html");
        assertThat(html.children).hasSize(3);
        whitespace(html.children.get(0));
        ElementNode head = element(html.children.get(1), "head");
        whitespace(html.children.get(2));

        assertThat(head.children).hasSize(2);
        attribute(head.children.get(0), "cool", "beans");
        content(head.children.get(1), "Hello, World!");
    }

    @Test
    void rewritesHtmlWithCodeAttributes() {
        // <head cool="beans" code="@yes" mixed="hi @there">
        AttributeNode code = new AttributeNode("code");
        code.children.add(ExpressionValueNode.of("yes"));
        AttributeNode mixed = new AttributeNode("mixed");
        mixed.children.add(AttributeValueNode.of("hi "));
        mixed.children.add(ExpressionValueNode.of("there"));

        DocumentNode document = new DocumentNode("mixed");
        document.children.add(MarkupNode.of("\n<html>\n  <head cool=\"beans\""));
        document.children.add(code);
        document.children.add(mixed);
        document.children.add(MarkupNode.of(">\n  </head>\n</html>"));

        pass.execute(document);

        ElementNode html = element(document.children.get(0), "html");
        ElementNode head = element(html.children.get(1), "head");
        assertThat(head.children).hasSize(4);
        attribute(head.children.get(0), "cool", "beans");
        assertThat(head.children.get(1)).isSameAs(code);
        assertThat(head.children.get(2)).isSameAs(mixed);
        whitespace(head.children.get(3));

        assertThat(mixed.children.get(0)).isInstanceOf(AttributeValueNode.class);
        assertThat(mixed.children.get(1)).isInstanceOf(ExpressionValueNode.class);
    }

    @Test
    void rewritesHtmlInterleavedWithCode() {
        // <html>
        //   @if (some_bool)
        //   {
        //   <head cool="beans">
        //     @hello
        //   </head>
        //   }
        // </html>
        DocumentNode document = new DocumentNode("code");
        document.children.add(MarkupNode.of("\n<html>\n  "));
        document.children.add(CodeBlockNode.of("if (some_bool)\n  {\n"));
        document.children.add(MarkupNode.of("  <head cool=\"beans\">\n    "));
        document.children.add(ExpressionNode.of("hello"));
        document.children.add(MarkupNode.of("\n  </head>\n"));
        document.children.add(CodeBlockNode.of("  }\n"));
        document.children.add(MarkupNode.of("</html>"));

        pass.execute(document);

        ElementNode html = element(document.children.get(0), "html");
        assertThat(html.children).hasSize(6);
        whitespace(html.children.get(0));
        assertThat(html.children.get(1)).isInstanceOf(CodeBlockNode.class);
        whitespace(html.children.get(2));
        ElementNode head = element(html.children.get(3), "head");
        whitespace(html.children.get(4));
        assertThat(html.children.get(5)).isInstanceOf(CodeBlockNode.class);

        assertThat(head.children).hasSize(4);
        attribute(head.children.get(0), "cool", "beans");
        whitespace(head.children.get(1));
        assertThat(head.children.get(2)).isInstanceOf(ExpressionNode.class);
        whitespace(head.children.get(3));
    }

    @Test
    void structuresConstructBodiesBeforeTheirParent() {
        ConstructNode test = new ConstructNode("test", List.of("test"));
        ConstructBodyNode body = new ConstructBodyNode();
        body.children.add(MarkupNode.of("\n    <head cool=\"beans\">\n      Hello, World!\n    </head>\n  "));
        test.children.add(body);

        DocumentNode document = new DocumentNode("construct");
        document.children.add(MarkupNode.of("\n<html>\n  "));
        document.children.add(test);
        document.children.add(MarkupNode.of("\n</html>"));

        pass.execute(document);

        ElementNode html = element(document.children.get(0), "html");
        assertThat(html.children).hasSize(3);
        whitespace(html.children.get(0));
        assertThat(html.children.get(1)).isSameAs(test);
        whitespace(html.children.get(2));

        // El cuerpo es su propio contenedor: el blanco exterior se descarta
        assertThat(body.children).hasSize(1);
        ElementNode head = element(body.children.get(0), "head");
        attribute(head.children.get(0), "cool", "beans");
        content(head.children.get(1), "Hello, World!");
    }

    @Test
    void nestedConstructsAreEachStructuredInPlace() {
        ConstructNode inner = new ConstructNode("Inner");
        ConstructBodyNode innerBody = new ConstructBodyNode();
        innerBody.children.add(MarkupNode.of("<b>dentro</b>"));
        inner.children.add(innerBody);

        ConstructNode outer = new ConstructNode("Outer");
        ConstructBodyNode outerBody = new ConstructBodyNode();
        outerBody.children.add(MarkupNode.of("<div>"));
        outerBody.children.add(inner);
        outerBody.children.add(MarkupNode.of("</div>"));
        outer.children.add(outerBody);

        DocumentNode document = new DocumentNode("nested");
        document.children.add(outer);

        pass.execute(document);

        element(innerBody.children.get(0), "b");
        ElementNode div = element(outerBody.children.get(0), "div");
        assertThat(div.children).containsExactly(inner);
        assertThat(document.children).containsExactly(outer);
    }

    @Test
    void leavesContainersWithoutMarkupAlone() {
        ExpressionNode expression = ExpressionNode.of("x");
        DocumentNode document = new DocumentNode("plain");
        document.children.add(expression);

        pass.execute(document);

        assertThat(document.children).containsExactly(expression);
    }

    @Test
    void runsEarlyInThePipeline() {
        assertThat(pass.order()).isLessThan(OrphanLoweringPass.ORDER);
    }
}
