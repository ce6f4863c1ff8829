package org.metricshub.romanloop.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Romanloop
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.romanloop.util.RomanloopLogger;
import org.slf4j.Logger;

/**
 * Converts program text into the token sequence consumed by the {@link LrParser}.
 * <p>
 * The scan goes left to right, skipping whitespace, and tries in order:
 * the keyword {@code while}, the keyword {@code done}, the punctuation
 * {@code ; ( )}, the operator {@code :=}, the relational operators
 * {@code < > =}, and finally a maximal run of letters and digits starting
 * with a letter. Keywords are matched on the raw characters, so
 * {@code whiley} yields {@code WHILE} followed by the identifier {@code y}.
 * <p>
 * A run made only of {@code I}, {@code V} and {@code X} is a Roman numeral;
 * any other run is an identifier.
 * <p>
 * Instances are stateless and may be shared.
 */
public class Tokenizer {

	private static final Logger LOG = RomanloopLogger.getLogger(Tokenizer.class);

	private static final String KW_WHILE = "while";
	private static final String KW_DONE = "done";

	/**
	 * Tokenizes the given text.
	 *
	 * @param input the program text
	 * @return an unmodifiable token list ending with exactly one
	 *         {@link TokenKind#END_OF_INPUT}
	 * @throws LexerException at the first character that cannot start a token
	 */
	public List<Token> tokenize(String input) throws LexerException {
		return tokenize(input, null);
	}

	/**
	 * Tokenizes the given text, naming the source in any error.
	 *
	 * @param input the program text
	 * @param sourceDescription description of where the text comes from, may be {@code null}
	 * @return an unmodifiable token list ending with exactly one
	 *         {@link TokenKind#END_OF_INPUT}
	 * @throws LexerException at the first character that cannot start a token
	 */
	public List<Token> tokenize(String input, String sourceDescription) throws LexerException {
		List<Token> tokens = new ArrayList<Token>();
		int length = input.length();
		int i = 0;

		while (i < length) {
			char c = input.charAt(i);
			if (isWhitespace(c)) {
				i++;
				continue;
			}

			if (input.startsWith(KW_WHILE, i)) {
				tokens.add(new Token(TokenKind.WHILE, KW_WHILE, i));
				i += KW_WHILE.length();
			} else if (input.startsWith(KW_DONE, i)) {
				tokens.add(new Token(TokenKind.DONE, KW_DONE, i));
				i += KW_DONE.length();
			} else if (c == ';') {
				tokens.add(new Token(TokenKind.SEMICOLON, ";", i++));
			} else if (c == '(') {
				tokens.add(new Token(TokenKind.LPAREN, "(", i++));
			} else if (c == ')') {
				tokens.add(new Token(TokenKind.RPAREN, ")", i++));
			} else if (input.startsWith(":=", i)) {
				tokens.add(new Token(TokenKind.ASSIGN, ":=", i));
				i += 2;
			} else if (c == '<') {
				tokens.add(new Token(TokenKind.LESS, "<", i++));
			} else if (c == '>') {
				tokens.add(new Token(TokenKind.GREATER, ">", i++));
			} else if (c == '=') {
				tokens.add(new Token(TokenKind.EQUAL, "=", i++));
			} else if (isLetter(c)) {
				int start = i;
				while (i < length && isLetterOrDigit(input.charAt(i))) {
					i++;
				}
				String word = input.substring(start, i);
				TokenKind kind = isRomanNumeral(word) ? TokenKind.ROMAN_NUMERAL : TokenKind.IDENTIFIER;
				tokens.add(new Token(kind, word, start));
			} else {
				LOG.debug("Rejecting character '{}' at position {}", c, i);
				throw new LexerException(c, i, sourceDescription);
			}
		}

		tokens.add(new Token(TokenKind.END_OF_INPUT, "", length));
		LOG.debug("Tokenized {} characters into {} tokens", length, tokens.size());
		return Collections.unmodifiableList(tokens);
	}

	/**
	 * @param word a non-null run of letters and digits
	 * @return {@code true} if the word is non-empty and made only of I, V and X
	 */
	static boolean isRomanNumeral(String word) {
		if (word.isEmpty()) {
			return false;
		}
		for (int i = 0; i < word.length(); i++) {
			char ch = word.charAt(i);
			if (ch != 'I' && ch != 'V' && ch != 'X') {
				return false;
			}
		}
		return true;
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\u000B' || c == '\f';
	}

	private static boolean isLetter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isLetterOrDigit(char c) {
		return isLetter(c) || (c >= '0' && c <= '9');
	}
}
