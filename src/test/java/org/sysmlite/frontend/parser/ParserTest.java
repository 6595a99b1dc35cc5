package org.sysmlite.frontend.parser;

import org.sysmlite.diagnostics.Diagnostic;
import org.sysmlite.diagnostics.DiagnosticsEngine;
import org.sysmlite.frontend.AstPrinter;
import org.sysmlite.frontend.lexer.Lexer;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.GenericNode;
import org.sysmlite.frontend.parser.ast.NodeKey;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;
import org.sysmlite.frontend.parser.ast.RootNode;
import org.sysmlite.frontend.parser.features.attribute.AttributeNode;
import org.sysmlite.frontend.parser.features.connection.ConnectionNode;
import org.sysmlite.frontend.parser.features.part.PartNode;
import org.sysmlite.frontend.parser.features.pkg.PackageNode;
import org.sysmlite.junit.extensions.logging.ExpectLog;
import org.sysmlite.junit.extensions.logging.LogLevel;
import org.sysmlite.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.entry;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify that the parser transforms a token stream into an Abstract Syntax Tree,
 * and that the first structural failure stops parsing, is logged, and leaves the elements
 * completed before it in the returned tree.
 */
@ExtendWith(LogWatchExtension.class)
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private RootNode parse(String source) {
        diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        return new Parser(tokens, diagnostics).parse();
    }

    /**
     * Verifies that an empty package becomes one top-level package node with its name and no children.
     */
    @Test
    @Tag("unit")
    void testEmptyPackage() {
        // Act
        RootNode root = parse("package P { }");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root.type()).isEqualTo(NodeType.ROOT);
        assertThat(root.getChildren()).singleElement().isInstanceOf(PackageNode.class);
        AstNode pkg = root.getChildren().get(0);
        assertThat(pkg.type().tag()).isEqualTo("package");
        assertThat(pkg.properties()).containsExactly(entry(PropertyKeys.NAME, "P"));
        assertThat(pkg.getChildren()).isEmpty();
    }

    /**
     * Verifies that an attribute keeps its type and a numeric (not textual) default value.
     */
    @Test
    @Tag("unit")
    void testAttributeWithTypeAndDefault() {
        RootNode root = parse("attribute mass : Real = 1500.0;");

        assertThat(root.getChildren()).singleElement().isInstanceOf(AttributeNode.class);
        Map<String, Object> properties = root.getChildren().get(0).properties();
        assertThat(properties).containsEntry(PropertyKeys.NAME, "mass")
                .containsEntry(PropertyKeys.PROP_TYPE, "Real")
                .containsEntry(PropertyKeys.DEFAULT_VALUE, 1500.0);
        assertThat(properties.get(PropertyKeys.DEFAULT_VALUE)).isInstanceOf(Double.class);
    }

    /**
     * Verifies that the specialized part name is captured.
     */
    @Test
    @Tag("unit")
    void testPartSpecialization() {
        RootNode root = parse("part Engine specializes PowerUnit { }");

        PartNode part = (PartNode) root.getChildren().get(0);
        assertThat(part.name()).isEqualTo("Engine");
        assertThat(part.properties()).containsEntry(PropertyKeys.SPECIALIZES, "PowerUnit");
    }

    /**
     * Verifies that a dotted endpoint is not consumed by the connection: the remainder becomes
     * a nameless generic sibling.
     */
    @Test
    @Tag("unit")
    void testConnectionWithQualifiedEndpointLeavesGenericSibling() {
        RootNode root = parse("connection c : a B.c;");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root.getChildren()).hasSize(2);
        ConnectionNode connection = (ConnectionNode) root.getChildren().get(0);
        assertThat(connection.properties()).containsExactly(
                entry(PropertyKeys.NAME, "c"), entry(PropertyKeys.FROM_REF, "a"), entry(PropertyKeys.TO_REF, "B"));
        AstNode remainder = root.getChildren().get(1);
        assertThat(remainder).isInstanceOf(GenericNode.class);
        assertThat(remainder.properties()).isEmpty();
    }

    /**
     * Verifies that an unclosed body fails at the end of input, that the failure is logged,
     * and that only the elements completed before the failing one are returned.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Parser", messagePattern = "Parse error: Expected PUNCTUATION '\\}' but got EOF")
    void testUnclosedBodyKeepsPriorSiblings() {
        RootNode root = parse("part A;\npackage Before { }\npackage Open {\n  part Inner;\n");

        assertThat(root.getChildren()).extracting(AstNode::type).containsExactly(NodeType.PART, NodeType.PACKAGE);
        assertThat(root.getChildren()).extracting(n -> n.getName().orElse(null)).containsExactly("A", "Before");
        assertThat(diagnostics.hasErrors()).isTrue();
        Diagnostic error = diagnostics.firstError().orElseThrow();
        assertThat(error.message()).isEqualTo("Expected PUNCTUATION '}' but got EOF");
        assertThat(error.lineNumber()).isEqualTo(5);
    }

    /**
     * Verifies that a closing brace without an open body stops parsing instead of looping,
     * and that nothing after it is parsed.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Parse error: Unexpected '\\}'.*")
    void testStrayClosingBraceStopsParsing() {
        RootNode root = parse("part A; } part C;");

        assertThat(root.getChildren()).extracting(n -> n.getName().orElse(null)).containsExactly("A");
        assertThat(diagnostics.firstError()).get()
                .extracting(Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(1, 9);
    }

    /**
     * Verifies that a keyword without its own rule becomes a nameless generic element
     * and that parsing continues with the next member.
     */
    @Test
    @Tag("unit")
    void testUnhandledKeywordBecomesGenericElement() {
        RootNode root = parse("package P { state S; part Q; }");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(root.getChildren()).singleElement().isInstanceOf(PackageNode.class);
        List<AstNode> body = root.getChildren().get(0).getChildren();
        assertThat(body).extracting(AstNode::type).containsExactly(NodeType.GENERIC, NodeType.PART);
        assertThat(body.get(0).properties()).isEmpty();
        assertThat(body.get(1).getName()).contains("Q");
    }

    /**
     * Verifies that the generic rule stops at the closing brace of an unhandled keyword's block.
     * That brace closes the enclosing package early, so the package's real closing brace is
     * left over at the top level and stops the parse.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Parse error: Unexpected '\\}'.*")
    void testUnhandledKeywordBlockEndsEnclosingBody() {
        RootNode root = parse("package P { state S { } part Q; }");

        assertThat(root.getChildren()).extracting(AstNode::type)
                .containsExactly(NodeType.PACKAGE, NodeType.PART);
        assertThat(root.getChildren().get(0).getChildren()).singleElement()
                .satisfies(n -> assertThat(n.type()).isEqualTo(NodeType.GENERIC));
        assertThat(diagnostics.firstError()).get()
                .extracting(Diagnostic::columnNumber).isEqualTo(33);
    }

    /**
     * Verifies that a leading identifier names the generic element and that the rest of the
     * statement is skipped.
     */
    @Test
    @Tag("unit")
    void testGenericElementNamedByLeadingIdentifier() {
        RootNode root = parse("foo bar baz; part A;");

        assertThat(root.getChildren()).extracting(AstNode::type).containsExactly(NodeType.GENERIC, NodeType.PART);
        assertThat(root.getChildren().get(0).properties()).containsExactly(entry(PropertyKeys.NAME, "foo"));
    }

    /**
     * Verifies that a keyword where a type name is expected ends the attribute without a type,
     * and is parsed as the next element.
     */
    @Test
    @Tag("unit")
    void testKeywordInTypePositionStartsNextElement() {
        RootNode root = parse("attribute a : part;");

        assertThat(root.getChildren()).extracting(AstNode::type).containsExactly(NodeType.ATTRIBUTE, NodeType.PART);
        assertThat(root.getChildren().get(0).properties()).containsExactly(entry(PropertyKeys.NAME, "a"));
        assertThat(root.getChildren().get(1).properties()).isEmpty();
    }

    /**
     * Verifies that a nameless part has no properties and an identity with a null name.
     */
    @Test
    @Tag("unit")
    void testNamelessPart() {
        RootNode root = parse("part;");

        AstNode part = root.getChildren().get(0);
        assertThat(part.properties()).isEmpty();
        assertThat(part.key()).isEqualTo(new NodeKey(NodeType.PART, null));
    }

    /**
     * Verifies that comments are dropped before any grammar decision.
     */
    @Test
    @Tag("unit")
    void testCommentsDoNotChangeTheTree() {
        String plain = "package P { part A specializes B; attribute x : Real = 1; }";
        String commented = "// header\npackage /* n */ P { part A /* s */ specializes B; // t\n attribute x : /* u */ Real = 1; } /* end */";

        String expected = AstPrinter.print(parse(plain));
        String actual = AstPrinter.print(parse(commented));

        assertThat(actual).isEqualTo(expected);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    /**
     * Verifies that parsing the same text twice yields structurally identical trees.
     */
    @Test
    @Tag("unit")
    void testParsingIsIdempotent() {
        String source = "package Vehicle {\n  part Engine specializes PowerUnit {\n    port fuel : FuelPort;\n  }\n  connection c : a b;\n}";

        RootNode first = parse(source);
        RootNode second = parse(source);

        assertThat(first).isEqualTo(second);
        assertThat(first).isNotSameAs(second);
    }

    /**
     * Verifies that a token list without an end-of-file token is treated as ending after its last token.
     */
    @Test
    @Tag("unit")
    void testTokensWithoutEndOfFile() {
        List<Token> tokens = List.of(
                new Token(TokenType.KEYWORD, "part", "part", 1, 1, "<test>"),
                new Token(TokenType.IDENTIFIER, "A", "A", 1, 6, "<test>"));

        RootNode root = new Parser(tokens).parse();

        assertThat(root.getChildren()).singleElement()
                .satisfies(n -> assertThat(n.properties()).containsExactly(entry(PropertyKeys.NAME, "A")));
    }

    /**
     * Verifies that an empty source gives an empty root without diagnostics.
     */
    @Test
    @Tag("unit")
    void testEmptySource() {
        RootNode root = parse("  // only a comment\n");

        assertThat(root.getChildren()).isEmpty();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    /**
     * Verifies that {@link Parser#expect} names the expected and the actual token on mismatch.
     */
    @Test
    @Tag("unit")
    void testExpectMismatchMessage() {
        Parser parser = new Parser(new Lexer("part X").scanTokens());

        assertThat(parser.expect(TokenType.KEYWORD, "part").value()).isEqualTo("part");
        ParseException ex = catchThrowableOfType(() -> parser.expect(TokenType.PUNCTUATION, ";"), ParseException.class);
        assertThat(ex).hasMessage("Expected PUNCTUATION ';' but got IDENTIFIER 'X'");
        assertThat(ex.getToken().column()).isEqualTo(6);
    }

    /**
     * Verifies that nesting beyond the limit stops the parse through the normal error path
     * instead of overflowing the stack, and that earlier siblings are kept.
     */
    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*Parser", messagePattern = "Parse error: Nesting too deep.*")
    void testExcessiveNestingIsReportedAsParseError() {
        // Arrange
        String source = "package A { }\n" + "package { ".repeat(20000) + "} ".repeat(20000);

        // Act
        RootNode root = parse(source);

        // Assert
        assertThat(root.getChildren()).singleElement()
                .satisfies(n -> assertThat(n.getName()).contains("A"));
        assertThat(diagnostics.firstError()).get()
                .extracting(Diagnostic::message)
                .isEqualTo("Nesting too deep: more than " + Parser.MAX_NESTING_DEPTH + " levels");
    }

    /**
     * Verifies that nesting up to the limit is accepted.
     */
    @Test
    @Tag("unit")
    void testNestingAtLimitIsAccepted() {
        int depth = Parser.MAX_NESTING_DEPTH;

        RootNode root = parse("package { ".repeat(depth) + "part Leaf; " + "} ".repeat(depth));

        assertThat(diagnostics.hasErrors()).isFalse();
        AstNode node = root.getChildren().get(0);
        for (int i = 1; i < depth; i++) {
            node = node.getChildren().get(0);
        }
        assertThat(node.getChildren()).singleElement()
                .satisfies(n -> assertThat(n.type()).isEqualTo(NodeType.PART));
    }
}
