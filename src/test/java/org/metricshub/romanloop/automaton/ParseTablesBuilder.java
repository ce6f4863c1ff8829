package org.metricshub.romanloop.automaton;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import org.metricshub.romanloop.frontend.TokenKind;

/**
 * Assembles small, possibly defective automata for driver tests.
 */
public final class ParseTablesBuilder {

	private final Map<Integer, Map<TokenKind, Action>> actions = new TreeMap<Integer, Map<TokenKind, Action>>();
	private final Map<Integer, Map<Nonterminal, Integer>> gotos = new TreeMap<Integer, Map<Nonterminal, Integer>>();

	public ParseTablesBuilder shift(int state, TokenKind kind, int target) {
		return action(state, kind, Action.shift(target));
	}

	public ParseTablesBuilder reduce(int state, TokenKind kind, int production) {
		return action(state, kind, Action.reduce(production));
	}

	public ParseTablesBuilder accept(int state, TokenKind kind) {
		return action(state, kind, Action.accept());
	}

	public ParseTablesBuilder gotoOn(int state, Nonterminal nonterminal, int target) {
		gotos.computeIfAbsent(state, s -> new EnumMap<Nonterminal, Integer>(Nonterminal.class)).put(nonterminal, target);
		return this;
	}

	private ParseTablesBuilder action(int state, TokenKind kind, Action action) {
		actions.computeIfAbsent(state, s -> new EnumMap<TokenKind, Action>(TokenKind.class)).put(kind, action);
		return this;
	}

	/**
	 * @return unvalidated tables holding exactly the entries added so far
	 */
	public ParseTables build() {
		return new ParseTables(actions, gotos);
	}
}
