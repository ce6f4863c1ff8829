package org.metricshub.romanloop.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.metricshub.romanloop.automaton.Grammar;
import org.metricshub.romanloop.automaton.InternalParserError;
import org.metricshub.romanloop.automaton.Nonterminal;
import org.metricshub.romanloop.automaton.ParseTablesBuilder;

public class LrParserTest {

	private static final Tokenizer TOKENIZER = new Tokenizer();
	private static final LrParser PARSER = new LrParser();

	private static AstNode parse(String text) throws Exception {
		return PARSER.parse(TOKENIZER.tokenize(text));
	}

	private static AstNode leaf(NodeKind kind, String text) {
		return AstNode.leaf(kind, text);
	}

	@Test
	public void testSingleLoop() throws Exception {
		AstNode program = parse("while (x < V) y := I done");

		AstNode expected = AstNode
				.of(
						NodeKind.PROGRAM,
						AstNode
								.of(
										NodeKind.STATEMENT_LIST,
										AstNode
												.of(
														NodeKind.WHILE_LOOP,
														AstNode
																.of(
																		NodeKind.CONDITION,
																		leaf(NodeKind.IDENTIFIER, "x"),
																		leaf(NodeKind.REL_OP, "<"),
																		leaf(NodeKind.ROMAN_NUMERAL, "V")),
														AstNode
																.of(
																		NodeKind.ASSIGNMENT,
																		leaf(NodeKind.L_VALUE, "y"),
																		leaf(NodeKind.ROMAN_NUMERAL, "I")))));
		assertEquals(expected, program);
	}

	@Test
	public void testTwoLoops() throws Exception {
		AstNode program = parse("while (a = I) b := X done; while (n > III) m := a done");

		assertEquals(NodeKind.PROGRAM, program.getKind());
		assertEquals(1, program.getChildren().size());
		AstNode statements = program.getChild(0);
		assertEquals(NodeKind.STATEMENT_LIST, statements.getKind());
		assertEquals(2, statements.getChildren().size());

		AstNode first = statements.getChild(0);
		assertEquals(NodeKind.WHILE_LOOP, first.getKind());
		assertEquals(leaf(NodeKind.REL_OP, "="), first.getChild(0).getChild(1));
		assertEquals(leaf(NodeKind.ROMAN_NUMERAL, "X"), first.getChild(1).getChild(1));

		AstNode second = statements.getChild(1);
		AstNode condition = second.getChild(0);
		assertEquals(leaf(NodeKind.IDENTIFIER, "n"), condition.getChild(0));
		assertEquals(leaf(NodeKind.REL_OP, ">"), condition.getChild(1));
		assertEquals(leaf(NodeKind.ROMAN_NUMERAL, "III"), condition.getChild(2));
		AstNode assignment = second.getChild(1);
		assertEquals(leaf(NodeKind.L_VALUE, "m"), assignment.getChild(0));
		assertEquals(leaf(NodeKind.IDENTIFIER, "a"), assignment.getChild(1));
	}

	@Test
	public void testStatementListIsFlat() throws Exception {
		StringBuilder program = new StringBuilder();
		int count = 25;
		for (int i = 0; i < count; i++) {
			if (i > 0) {
				program.append("; ");
			}
			program.append("while (i").append(i).append(" < X) i").append(i).append(" := I done");
		}
		AstNode statements = parse(program.toString()).getChild(0);
		assertEquals(count, statements.getChildren().size());
		for (int i = 0; i < count; i++) {
			AstNode loop = statements.getChild(i);
			assertEquals(NodeKind.WHILE_LOOP, loop.getKind());
			assertEquals("i" + i, loop.getChild(1).getChild(0).getText());
		}
	}

	@Test
	public void testDeterministic() throws Exception {
		String text = "while (a = I) b := X done; while (n > III) m := a done";
		assertEquals(parse(text), parse(text));
	}

	@Test
	public void testNoTokenLeavesInTree() throws Exception {
		assertNoTokenLeaves(parse("while (a = I) b := X done; while (XVI > n) m := a done"));
	}

	private static void assertNoTokenLeaves(AstNode node) {
		assertNotEquals(NodeKind.TOKEN, node.getKind());
		if (node.isLeaf()) {
			assertFalse("leaf " + node.getKind() + " must carry text", node.getText().isEmpty());
		} else {
			assertEquals("internal node must not carry text", "", node.getText());
		}
		if (node.getKind() == NodeKind.ROMAN_NUMERAL) {
			assertTrue(node.getText().matches("[IVX]+"));
		}
		if (node.getKind() == NodeKind.IDENTIFIER) {
			assertFalse(node.getText().matches("[IVX]+"));
		}
		for (AstNode child : node.getChildren()) {
			assertNoTokenLeaves(child);
		}
	}

	@Test
	public void testDoubleRelationalOperator() throws Exception {
		List<Token> tokens = TOKENIZER.tokenize("while (x <> V) y := I done");
		ParserException e = assertThrows(ParserException.class, () -> PARSER.parse(tokens));
		assertEquals(TokenKind.GREATER, e.getTokenKind());
		assertEquals(">", e.getTokenText());
		assertEquals(10, e.getPosition());
		assertEquals(14, e.getState());
		assertEquals("Unexpected token GREATER ('>') at position 10 in state 14", e.getMessage());
	}

	@Test
	public void testMissingDone() throws Exception {
		ParserException e = assertThrows(ParserException.class, () -> parse("while (x < V) y := I"));
		assertEquals(TokenKind.END_OF_INPUT, e.getTokenKind());
	}

	@Test
	public void testSourceDescriptionInError() throws Exception {
		List<Token> tokens = TOKENIZER.tokenize("done");
		ParserException e = assertThrows(ParserException.class, () -> PARSER.parse(tokens, "prog.rl"));
		assertEquals("prog.rl", e.getSourceDescription());
		assertEquals(0, e.getState());
		assertEquals(TokenKind.DONE, e.getTokenKind());
	}

	@Test
	public void testTokensMustEndWithEndOfInput() {
		assertThrows(
				IllegalArgumentException.class,
				() -> PARSER.parse(List.of(new Token(TokenKind.WHILE, "while", 0))));
		assertThrows(IllegalArgumentException.class, () -> PARSER.parse(List.<Token>of()));
	}

	@Test
	public void testParserIsReusable() throws Exception {
		assertThrows(ParserException.class, () -> parse("while ("));
		assertEquals(1, parse("while (x < V) y := I done").getChild(0).getChildren().size());
	}

	@Test(timeout = 10000)
	public void testLongProgram() throws Exception {
		int count = 40000;
		StringBuilder program = new StringBuilder("while (a < X) b := I done");
		for (int i = 1; i < count; i++) {
			program.append("; while (a < X) b := I done");
		}
		assertEquals(count, parse(program.toString()).getChild(0).getChildren().size());
	}

	private static List<Token> tokens(TokenKind... kinds) {
		List<Token> tokens = new ArrayList<Token>();
		int position = 0;
		for (TokenKind kind : kinds) {
			String text = kind == TokenKind.END_OF_INPUT ? "" : "x";
			tokens.add(new Token(kind, text, position));
			position += text.length();
		}
		return tokens;
	}

	@Test
	public void testShiftToStateWithoutRow() {
		LrParser parser = new LrParser(new ParseTablesBuilder().shift(0, TokenKind.WHILE, 4).build());
		InternalParserError e = assertThrows(
				InternalParserError.class,
				() -> parser.parse(tokens(TokenKind.WHILE, TokenKind.END_OF_INPUT)));
		assertTrue(e.getMessage(), e.getMessage().contains("no ACTION row for state 4"));
	}

	@Test
	public void testMissingGoto() {
		LrParser parser = new LrParser(
				new ParseTablesBuilder()
						.shift(0, TokenKind.IDENTIFIER, 1)
						.reduce(1, TokenKind.END_OF_INPUT, Grammar.EXPRESSION_IDENTIFIER)
						.build());
		InternalParserError e = assertThrows(
				InternalParserError.class,
				() -> parser.parse(tokens(TokenKind.IDENTIFIER, TokenKind.END_OF_INPUT)));
		assertTrue(e.getMessage(), e.getMessage().contains("no GOTO for " + Nonterminal.EXPRESSION + " in state 0"));
	}

	@Test
	public void testAcceptWithTwoValues() {
		LrParser parser = new LrParser(
				new ParseTablesBuilder()
						.shift(0, TokenKind.IDENTIFIER, 1)
						.shift(1, TokenKind.IDENTIFIER, 2)
						.accept(2, TokenKind.END_OF_INPUT)
						.build());
		InternalParserError e = assertThrows(
				InternalParserError.class,
				() -> parser.parse(tokens(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.END_OF_INPUT)));
		assertTrue(e.getMessage(), e.getMessage().contains("accept with 2 values"));
	}

	@Test
	public void testStackUnderflow() {
		LrParser parser = new LrParser(
				new ParseTablesBuilder()
						.shift(0, TokenKind.IDENTIFIER, 1)
						.reduce(1, TokenKind.END_OF_INPUT, Grammar.WHILE_STATEMENT)
						.build());
		InternalParserError e = assertThrows(
				InternalParserError.class,
				() -> parser.parse(tokens(TokenKind.IDENTIFIER, TokenKind.END_OF_INPUT)));
		assertTrue(e.getMessage(), e.getMessage().contains("stack underflow"));
	}

	@Test
	public void testInjectedTablesStillRejectInput() {
		LrParser parser = new LrParser(new ParseTablesBuilder().shift(0, TokenKind.WHILE, 4).build());
		ParserException e = assertThrows(ParserException.class, () -> parser.parse(tokens(TokenKind.DONE, TokenKind.END_OF_INPUT)));
		assertEquals(0, e.getState());
	}
}
