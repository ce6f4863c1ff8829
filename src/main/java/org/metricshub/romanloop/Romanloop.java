package org.metricshub.romanloop;

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

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import org.metricshub.romanloop.automaton.ParseTables;
import org.metricshub.romanloop.frontend.AstNode;
import org.metricshub.romanloop.frontend.LexerException;
import org.metricshub.romanloop.frontend.LrParser;
import org.metricshub.romanloop.frontend.ParserException;
import org.metricshub.romanloop.frontend.Token;
import org.metricshub.romanloop.frontend.Tokenizer;
import org.metricshub.romanloop.util.ParserSettings;
import org.metricshub.romanloop.util.RomanloopLogger;
import org.metricshub.romanloop.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the tokenization and parsing of a program.
 * This entry point is used both when Romanloop is used as a library and when
 * invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Tokenize the program text, producing a token sequence.
 * <li>Run the shift-reduce automaton over the tokens, producing an
 * abstract syntax tree.
 * </ul>
 * Either step may reject the input with a
 * {@link org.metricshub.romanloop.frontend.SourceException}; no partial tree
 * is ever returned.
 */
public class Romanloop {

	private static final Logger LOG = RomanloopLogger.getLogger(Romanloop.class);

	private final Tokenizer tokenizer;
	private final LrParser parser;

	/**
	 * The last parsed {@link AstNode}.
	 */
	private AstNode lastAst;

	/**
	 * Create a new instance over the shared automaton tables.
	 */
	public Romanloop() {
		this(ParseTables.getInstance());
	}

	/**
	 * Create a new instance over the given automaton tables.
	 *
	 * @param tables the tables driving the parser
	 */
	public Romanloop(ParseTables tables) {
		this.tokenizer = new Tokenizer();
		this.parser = new LrParser(tables);
	}

	/**
	 * @param text program text
	 * @return the token sequence
	 * @throws LexerException on an invalid character
	 */
	public List<Token> tokenize(String text) throws LexerException {
		return tokenizer.tokenize(text);
	}

	/**
	 * Tokenizes and parses a program.
	 *
	 * @param text program text
	 * @return the {@code Program} node
	 * @throws LexerException on an invalid character
	 * @throws ParserException on a token the grammar does not allow
	 */
	public AstNode parse(String text) throws LexerException, ParserException {
		return parse(text, null);
	}

	/**
	 * Parses an already tokenized program.
	 *
	 * @param tokens tokens ending with end of input
	 * @return the {@code Program} node
	 * @throws ParserException on a token the grammar does not allow
	 */
	public AstNode parse(List<Token> tokens) throws ParserException {
		AstNode ast = parser.parse(tokens);
		lastAst = ast;
		return ast;
	}

	/**
	 * Reads, tokenizes and parses a program source.
	 *
	 * @param source where the program text comes from
	 * @return the {@code Program} node
	 * @throws IOException upon an IO error
	 * @throws LexerException on an invalid character
	 * @throws ParserException on a token the grammar does not allow
	 */
	public AstNode parse(ScriptSource source) throws IOException, LexerException, ParserException {
		return parse(source.readText(), source.getDescription());
	}

	private AstNode parse(String text, String description) throws LexerException, ParserException {
		List<Token> tokens = tokenizer.tokenize(text, description);
		AstNode ast = parser.parse(tokens, description);
		lastAst = ast;
		return ast;
	}

	/**
	 * Tokenizes and parses a program source, printing what the settings ask for.
	 *
	 * @param source where the program text comes from
	 * @param settings output stream and dump flags
	 * @return the {@code Program} node
	 * @throws IOException upon an IO error
	 * @throws LexerException on an invalid character
	 * @throws ParserException on a token the grammar does not allow
	 */
	public AstNode invoke(ScriptSource source, ParserSettings settings)
			throws IOException,
			LexerException,
			ParserException {
		PrintStream out = settings.getOutputStream();
		String description = source.getDescription();
		List<Token> tokens = tokenizer.tokenize(source.readText(), description);
		if (settings.isDumpTokens()) {
			for (Token token : tokens) {
				out.println(token);
			}
		}
		AstNode ast = parser.parse(tokens, description);
		lastAst = ast;
		LOG.debug("Parsed {} into {} statement(s)", description, ast.getChild(0).getChildren().size());
		if (settings.isDumpSyntaxTree()) {
			ast.dump(out);
		}
		return ast;
	}

	/**
	 * @return the last successfully parsed tree, or {@code null} if none
	 */
	public AstNode getLastAst() {
		return lastAst;
	}
}
