package org.sysmlite.frontend.elements;

import org.sysmlite.diagnostics.DiagnosticsEngine;
import org.sysmlite.frontend.lexer.Lexer;
import org.sysmlite.frontend.parser.Parser;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;
import org.sysmlite.frontend.parser.features.attribute.AttributeNode;
import org.sysmlite.frontend.parser.features.part.PartNode;
import org.sysmlite.frontend.parser.features.port.PortNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the parsing of <code>part</code> elements: names, specialization,
 * terminated declarations and bodies.
 */
public class PartElementTest {

    private List<AstNode> parse(String source, DiagnosticsEngine diagnostics) {
        return new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse().getChildren();
    }

    /**
     * Verifies that a part body holds its members in source order.
     */
    @Test
    @Tag("unit")
    void testPartWithBody() {
        // Arrange
        String source = String.join("\n",
                "part Engine specializes PowerUnit {",
                "  attribute displacement : Real = 2.0;",
                "  port fuel : FuelPort;",
                "}"
        );
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        List<AstNode> ast = parse(source, diagnostics);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        PartNode part = (PartNode) ast.get(0);
        assertThat(part.name()).isEqualTo("Engine");
        assertThat(part.specializes()).isEqualTo("PowerUnit");
        assertThat(part.body()).hasSize(2);
        assertThat(part.body().get(0)).isInstanceOf(AttributeNode.class);
        assertThat(part.body().get(1)).isInstanceOf(PortNode.class);
    }

    /**
     * Verifies that <code>specializes</code> without a following name leaves the property absent.
     */
    @Test
    @Tag("unit")
    void testSpecializesWithoutTarget() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<AstNode> ast = parse("part Wheel specializes;", diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(ast).singleElement().satisfies(n -> {
            assertThat(n.properties()).containsOnlyKeys(PropertyKeys.NAME);
            assertThat(n.type()).isEqualTo(NodeType.PART);
        });
    }

    /**
     * Verifies that a part without terminator or body simply ends before the next element.
     */
    @Test
    @Tag("unit")
    void testPartWithoutTerminator() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<AstNode> ast = parse("part A part B;", diagnostics);

        assertThat(ast).extracting(n -> n.getName().orElse(null)).containsExactly("A", "B");
    }

    /**
     * Verifies that an unclosed part body is reported as an error at the end of input.
     */
    @Test
    @Tag("unit")
    void testUnclosedPartBody() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<AstNode> ast = parse("part A {\n  part B;", diagnostics);

        assertThat(ast).isEmpty();
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("Expected PUNCTUATION '}' but got EOF");
    }
}
