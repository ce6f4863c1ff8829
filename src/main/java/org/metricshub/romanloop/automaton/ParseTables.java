package org.metricshub.romanloop.automaton;

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

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.metricshub.romanloop.frontend.TokenKind;
import org.metricshub.romanloop.util.RomanloopLogger;
import org.slf4j.Logger;

/**
 * The ACTION and GOTO tables of the shift-reduce automaton.
 * <p>
 * The states are the LR(0) item sets of the {@link Grammar}; each reduce
 * entry lists only the lookaheads that may follow its left-hand side in
 * that state. The tables are populated once, validated, and never mutated
 * afterwards, so one instance can be shared by any number of concurrent parses.
 */
public final class ParseTables {

	private static final Logger LOG = RomanloopLogger.getLogger(ParseTables.class);

	/** The initial state, bottom of every state stack. */
	public static final int INITIAL_STATE = 0;

	/** The only state in which end of input is accepted. */
	public static final int ACCEPT_STATE = 1;

	private static final TokenKind[] EXPRESSION_FOLLOW = {
			TokenKind.LESS,
			TokenKind.GREATER,
			TokenKind.EQUAL,
			TokenKind.RPAREN,
			TokenKind.DONE };

	private static final TokenKind[] STATEMENT_FOLLOW = { TokenKind.END_OF_INPUT, TokenKind.SEMICOLON };

	private static final TokenKind[] EXPRESSION_FIRST = { TokenKind.IDENTIFIER, TokenKind.ROMAN_NUMERAL };

	private final Map<Integer, Map<TokenKind, Action>> actionTable = new TreeMap<Integer, Map<TokenKind, Action>>();
	private final Map<Integer, Map<Nonterminal, Integer>> gotoTable = new TreeMap<Integer, Map<Nonterminal, Integer>>();
	private final List<Production> productions;

	/**
	 * Lazy holder of the shared instance.
	 */
	private static final class Holder {
		private static final ParseTables INSTANCE = new ParseTables();
	}

	/**
	 * @return the process-wide tables
	 */
	public static ParseTables getInstance() {
		return Holder.INSTANCE;
	}

	private ParseTables() {
		this.productions = Grammar.getProductions();
		initializeTables();
		freeze();
		validate();
	}

	/**
	 * Builds tables from the given rows, without validating them, so that a
	 * defective automaton can be handed to the parser.
	 *
	 * @param actions ACTION rows by state
	 * @param gotos GOTO rows by state
	 */
	ParseTables(Map<Integer, Map<TokenKind, Action>> actions, Map<Integer, Map<Nonterminal, Integer>> gotos) {
		this.productions = Grammar.getProductions();
		for (Map.Entry<Integer, Map<TokenKind, Action>> row : actions.entrySet()) {
			for (Map.Entry<TokenKind, Action> entry : row.getValue().entrySet()) {
				put(row.getKey(), entry.getKey(), entry.getValue());
			}
		}
		for (Map.Entry<Integer, Map<Nonterminal, Integer>> row : gotos.entrySet()) {
			for (Map.Entry<Nonterminal, Integer> entry : row.getValue().entrySet()) {
				gotoOn(row.getKey(), entry.getKey(), entry.getValue());
			}
		}
		freeze();
	}

	private void initializeTables() {
		// S' -> . Program, Program -> . StatementList, StatementList -> . Statement | . StatementList ; Statement
		shift(0, TokenKind.WHILE, 4);
		gotoOn(0, Nonterminal.PROGRAM, 1);
		gotoOn(0, Nonterminal.STATEMENT_LIST, 2);
		gotoOn(0, Nonterminal.STATEMENT, 3);

		// S' -> Program .
		accept(1, TokenKind.END_OF_INPUT);

		// Program -> StatementList . | StatementList -> StatementList . ; Statement
		reduce(2, Grammar.PROGRAM, TokenKind.END_OF_INPUT);
		shift(2, TokenKind.SEMICOLON, 5);

		reduce(3, Grammar.STATEMENT_LIST_SINGLE, STATEMENT_FOLLOW);

		shift(4, TokenKind.LPAREN, 6);

		// StatementList -> StatementList ; . Statement
		shift(5, TokenKind.WHILE, 4);
		gotoOn(5, Nonterminal.STATEMENT, 7);

		// Statement -> while ( . Condition ) Body done
		shift(6, TokenKind.IDENTIFIER, 10);
		shift(6, TokenKind.ROMAN_NUMERAL, 11);
		gotoOn(6, Nonterminal.CONDITION, 8);
		gotoOn(6, Nonterminal.EXPRESSION, 9);

		reduce(7, Grammar.STATEMENT_LIST_APPEND, STATEMENT_FOLLOW);

		shift(8, TokenKind.RPAREN, 12);

		// Condition -> Expression . RelOp Expression
		shift(9, TokenKind.LESS, 14);
		shift(9, TokenKind.GREATER, 15);
		shift(9, TokenKind.EQUAL, 16);
		gotoOn(9, Nonterminal.REL_OP, 13);

		reduce(10, Grammar.EXPRESSION_IDENTIFIER, EXPRESSION_FOLLOW);
		reduce(11, Grammar.EXPRESSION_ROMAN, EXPRESSION_FOLLOW);

		// Statement -> while ( Condition ) . Body done
		shift(12, TokenKind.IDENTIFIER, 19);
		gotoOn(12, Nonterminal.BODY, 17);
		gotoOn(12, Nonterminal.ASSIGNMENT, 18);

		// Condition -> Expression RelOp . Expression
		shift(13, TokenKind.IDENTIFIER, 10);
		shift(13, TokenKind.ROMAN_NUMERAL, 11);
		gotoOn(13, Nonterminal.EXPRESSION, 20);

		reduce(14, Grammar.REL_OP_LESS, EXPRESSION_FIRST);
		reduce(15, Grammar.REL_OP_GREATER, EXPRESSION_FIRST);
		reduce(16, Grammar.REL_OP_EQUAL, EXPRESSION_FIRST);

		shift(17, TokenKind.DONE, 21);

		reduce(18, Grammar.BODY, TokenKind.DONE);

		shift(19, TokenKind.ASSIGN, 22);

		reduce(20, Grammar.CONDITION, TokenKind.RPAREN);

		reduce(21, Grammar.WHILE_STATEMENT, STATEMENT_FOLLOW);

		// Assignment -> Identifier := . Expression
		shift(22, TokenKind.IDENTIFIER, 10);
		shift(22, TokenKind.ROMAN_NUMERAL, 11);
		gotoOn(22, Nonterminal.EXPRESSION, 23);

		reduce(23, Grammar.ASSIGNMENT, TokenKind.DONE);
	}

	private void shift(int state, TokenKind kind, int target) {
		put(state, kind, Action.shift(target));
	}

	private void reduce(int state, int production, TokenKind... lookaheads) {
		for (TokenKind kind : lookaheads) {
			put(state, kind, Action.reduce(production));
		}
	}

	private void accept(int state, TokenKind kind) {
		put(state, kind, Action.accept());
	}

	private void put(int state, TokenKind kind, Action action) {
		Map<TokenKind, Action> row = actionTable.get(state);
		if (row == null) {
			row = new EnumMap<TokenKind, Action>(TokenKind.class);
			actionTable.put(state, row);
		}
		Action previous = row.put(kind, action);
		if (previous != null) {
			throw new InternalParserError(
					"conflict in state " + state + " on " + kind + ": " + previous + " vs " + action);
		}
	}

	private void gotoOn(int state, Nonterminal nonterminal, int target) {
		Map<Nonterminal, Integer> row = gotoTable.get(state);
		if (row == null) {
			row = new EnumMap<Nonterminal, Integer>(Nonterminal.class);
			gotoTable.put(state, row);
		}
		if (row.put(nonterminal, target) != null) {
			throw new InternalParserError("duplicate goto in state " + state + " on " + nonterminal);
		}
	}

	private void freeze() {
		for (Map.Entry<Integer, Map<TokenKind, Action>> entry : actionTable.entrySet()) {
			entry.setValue(Collections.unmodifiableMap(entry.getValue()));
		}
		for (Map.Entry<Integer, Map<Nonterminal, Integer>> entry : gotoTable.entrySet()) {
			entry.setValue(Collections.unmodifiableMap(entry.getValue()));
		}
	}

	/**
	 * Checks that every shift and goto target is a state with an ACTION row,
	 * that every reduce names an existing production other than the augmented
	 * start, and that exactly one entry accepts, on end of input, in
	 * {@link #ACCEPT_STATE}.
	 *
	 * @throws InternalParserError on the first violation
	 */
	void validate() {
		int acceptCount = 0;
		for (Map.Entry<Integer, Map<TokenKind, Action>> row : actionTable.entrySet()) {
			int state = row.getKey();
			for (Map.Entry<TokenKind, Action> entry : row.getValue().entrySet()) {
				Action action = entry.getValue();
				switch (action.getType()) {
				case SHIFT:
					if (!actionTable.containsKey(action.getValue())) {
						throw new InternalParserError("state " + state + " shifts to unknown state " + action.getValue());
					}
					break;
				case REDUCE:
					if (action.getValue() <= Grammar.START || action.getValue() >= productions.size()) {
						throw new InternalParserError(
								"state " + state + " reduces by unknown production " + action.getValue());
					}
					break;
				case ACCEPT:
					if (state != ACCEPT_STATE || entry.getKey() != TokenKind.END_OF_INPUT) {
						throw new InternalParserError("unexpected accept in state " + state + " on " + entry.getKey());
					}
					acceptCount++;
					break;
				default:
					throw new InternalParserError("unknown action " + action);
				}
			}
		}
		if (acceptCount != 1) {
			throw new InternalParserError("expected exactly one accepting entry, found " + acceptCount);
		}
		for (Map.Entry<Integer, Map<Nonterminal, Integer>> row : gotoTable.entrySet()) {
			for (Integer target : row.getValue().values()) {
				if (!actionTable.containsKey(target)) {
					throw new InternalParserError("state " + row.getKey() + " goes to unknown state " + target);
				}
			}
		}
		LOG.debug("Validated {} states and {} productions", actionTable.size(), productions.size());
	}

	/**
	 * @param state an automaton state
	 * @return the ACTION row of the state, or {@code null} if the state is unknown
	 */
	public Map<TokenKind, Action> getActionRow(int state) {
		return actionTable.get(state);
	}

	/**
	 * @param state the state uncovered by a reduction
	 * @param nonterminal the left-hand side just reduced
	 * @return the next state, or {@code null} if the table has no entry
	 */
	public Integer getGoto(int state, Nonterminal nonterminal) {
		Map<Nonterminal, Integer> row = gotoTable.get(state);
		return row == null ? null : row.get(nonterminal);
	}

	/**
	 * @return the unmodifiable GOTO row of a state, empty if it has none
	 */
	public Map<Nonterminal, Integer> getGotoRow(int state) {
		Map<Nonterminal, Integer> row = gotoTable.get(state);
		return row == null ? Collections.<Nonterminal, Integer>emptyMap() : row;
	}

	public Production getProduction(int index) {
		return productions.get(index);
	}

	public List<Production> getProductions() {
		return productions;
	}

	/**
	 * @return the number of states, numbered from 0
	 */
	public int getStateCount() {
		return actionTable.size();
	}
}
