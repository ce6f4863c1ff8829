package org.metricshub.romanloop.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Programs that tokenize but are not derivable from the grammar. Each must be
 * rejected with a {@link ParserException} at the expected token.
 */
@RunWith(Parameterized.class)
public class MalformedProgramTest {

	@Parameter(0)
	public String program;

	@Parameter(1)
	public TokenKind expectedKind;

	@Parameter(2)
	public int expectedPosition;

	@Parameters(name = "{0}")
	public static Collection<Object[]> data() {
		return Arrays
				.asList(
						new Object[][] {
								{ "", TokenKind.END_OF_INPUT, 0 },
								{ "while (x < V y := I done", TokenKind.IDENTIFIER, 13 },
								{ "while x < V) y := I done", TokenKind.IDENTIFIER, 6 },
								{ "while (x < V) y := I", TokenKind.END_OF_INPUT, 20 },
								{ "while (x <> V) y := I done", TokenKind.GREATER, 10 },
								{ "while (x == V) y := I done", TokenKind.EQUAL, 10 },
								{ "while (x) y := I done", TokenKind.RPAREN, 8 },
								{ "while (x < V) done", TokenKind.DONE, 14 },
								{ "while (x < V) I := I done", TokenKind.ROMAN_NUMERAL, 14 },
								{ "while (x < V) y = I done", TokenKind.EQUAL, 16 },
								{ "while (x < V) y := done", TokenKind.DONE, 19 },
								{ "while (x < V) y := I z := I done", TokenKind.IDENTIFIER, 21 },
								{ "while (x < V) y := I done;", TokenKind.END_OF_INPUT, 26 },
								{ "while (x < V) y := I done while (x < V) y := I done", TokenKind.WHILE, 26 },
								{ "while (x < V) while (a < I) b := I done done", TokenKind.WHILE, 14 },
								{ "y := I", TokenKind.IDENTIFIER, 0 },
								{ "; while (x < V) y := I done", TokenKind.SEMICOLON, 0 },
								{ "while (x < V) y := I done;; while (x < V) y := I done", TokenKind.SEMICOLON, 26 },
								{ "while (() y := I done", TokenKind.LPAREN, 7 },
								{ "while (x < V)) y := I done", TokenKind.RPAREN, 13 } });
	}

	@Test
	public void testRejected() throws Exception {
		Tokenizer tokenizer = new Tokenizer();
		LrParser parser = new LrParser();
		ParserException e = assertThrows(ParserException.class, () -> parser.parse(tokenizer.tokenize(program)));
		assertEquals(expectedKind, e.getTokenKind());
		assertEquals(expectedPosition, e.getPosition());
	}
}
