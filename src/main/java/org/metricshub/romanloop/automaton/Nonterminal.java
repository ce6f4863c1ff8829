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

/**
 * Nonterminals of the grammar. These key the columns of the GOTO table.
 */
public enum Nonterminal {
	START("S'"),
	PROGRAM("Program"),
	STATEMENT_LIST("StatementList"),
	STATEMENT("Statement"),
	CONDITION("Condition"),
	BODY("Body"),
	ASSIGNMENT("Assignment"),
	EXPRESSION("Expression"),
	REL_OP("RelOp");

	private final String symbol;

	Nonterminal(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the grammar symbol as written in productions
	 */
	public String getSymbol() {
		return symbol;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
