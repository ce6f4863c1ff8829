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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.metricshub.romanloop.automaton.Action;
import org.metricshub.romanloop.automaton.InternalParserError;
import org.metricshub.romanloop.automaton.ParseTables;
import org.metricshub.romanloop.automaton.Production;
import org.metricshub.romanloop.util.RomanloopLogger;
import org.slf4j.Logger;

/**
 * Table-driven shift-reduce parser.
 * <p>
 * Runs the automaton of {@link ParseTables} over a token sequence with two
 * stacks kept in lock-step: the state stack always holds exactly one more
 * entry than the value stack, its bottom being
 * {@link ParseTables#INITIAL_STATE}. Shifts push a {@link NodeKind#TOKEN}
 * leaf and consume one token; reductions pop the right-hand side, call the
 * production's builder and follow the GOTO table without consuming input.
 * <p>
 * The parser holds no per-parse state, so one instance may serve concurrent
 * parses.
 *
 * @see ParseTables
 */
public class LrParser {

	private static final Logger LOG = RomanloopLogger.getLogger(LrParser.class);

	private final ParseTables tables;

	/**
	 * Creates a parser over the shared tables.
	 */
	public LrParser() {
		this(ParseTables.getInstance());
	}

	/**
	 * <p>
	 * Constructor for LrParser.
	 * </p>
	 *
	 * @param tables the automaton to run
	 */
	public LrParser(ParseTables tables) {
		this.tables = tables;
	}

	/**
	 * Parses a token sequence.
	 *
	 * @param tokens the tokens, ending with {@link TokenKind#END_OF_INPUT}
	 * @return the {@code Program} node
	 * @throws ParserException if a token is not allowed in the current state
	 */
	public AstNode parse(List<Token> tokens) throws ParserException {
		return parse(tokens, null);
	}

	/**
	 * Parses a token sequence, naming the source in any error.
	 *
	 * @param tokens the tokens, ending with {@link TokenKind#END_OF_INPUT}
	 * @param sourceDescription description of the source, may be {@code null}
	 * @return the {@code Program} node
	 * @throws ParserException if a token is not allowed in the current state
	 */
	public AstNode parse(List<Token> tokens, String sourceDescription) throws ParserException {
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getKind() != TokenKind.END_OF_INPUT) {
			throw new IllegalArgumentException("Token sequence must end with " + TokenKind.END_OF_INPUT);
		}

		Deque<Integer> stateStack = new ArrayDeque<Integer>();
		Deque<AstNode> valueStack = new ArrayDeque<AstNode>();
		stateStack.push(ParseTables.INITIAL_STATE);
		int cursor = 0;

		while (true) {
			int state = stateStack.peek();
			Token token = tokens.get(cursor);

			Map<TokenKind, Action> row = tables.getActionRow(state);
			if (row == null) {
				throw new InternalParserError("no ACTION row for state " + state);
			}
			Action action = row.get(token.getKind());
			if (action == null) {
				LOG.debug("Rejecting {} in state {}", token, state);
				throw new ParserException(token, state, sourceDescription);
			}

			switch (action.getType()) {
			case SHIFT:
				LOG.trace("Shift {} -> state {}", token, action.getValue());
				stateStack.push(action.getValue());
				valueStack.push(AstNode.leaf(NodeKind.TOKEN, token.getText()));
				// the only place where input is consumed
				cursor++;
				break;
			case REDUCE:
				reduce(tables.getProduction(action.getValue()), stateStack, valueStack);
				break;
			case ACCEPT:
				if (valueStack.size() != 1) {
					throw new InternalParserError("accept with " + valueStack.size() + " values on the stack");
				}
				LOG.trace("Accept in state {}", state);
				return valueStack.pop();
			default:
				throw new InternalParserError("unknown action " + action);
			}
		}
	}

	private void reduce(Production production, Deque<Integer> stateStack, Deque<AstNode> valueStack) {
		int count = production.getRhsLength();
		// the rightmost symbol is popped first
		AstNode[] popped = new AstNode[count];
		for (int i = count - 1; i >= 0; i--) {
			if (valueStack.isEmpty() || stateStack.size() <= 1) {
				throw new InternalParserError("stack underflow while reducing by " + production);
			}
			stateStack.pop();
			popped[i] = valueStack.pop();
		}
		List<AstNode> children = new ArrayList<AstNode>(count);
		for (AstNode node : popped) {
			children.add(node);
		}
		AstNode node = production.getBuilder().build(children);
		valueStack.push(node);

		int uncovered = stateStack.peek();
		Integer next = tables.getGoto(uncovered, production.getLhs());
		if (next == null) {
			throw new InternalParserError("no GOTO for " + production.getLhs() + " in state " + uncovered);
		}
		stateStack.push(next);
		LOG.trace("Reduce {} -> state {}", production, next);
	}
}
