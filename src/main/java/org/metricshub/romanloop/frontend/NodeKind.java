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

/**
 * Tags of the syntax tree nodes.
 */
public enum NodeKind {
	PROGRAM("Program"),
	STATEMENT_LIST("StatementList"),
	WHILE_LOOP("WhileLoop"),
	CONDITION("Condition"),
	REL_OP("RelOp"),
	ASSIGNMENT("Assignment"),
	L_VALUE("LValue"),
	IDENTIFIER("Identifier"),
	ROMAN_NUMERAL("RomanNumeral"),

	/**
	 * A terminal freshly shifted by the automaton. Reductions always build new
	 * nodes, so these never survive into a completed tree.
	 */
	TOKEN("Token");

	private final String label;

	NodeKind(String label) {
		this.label = label;
	}

	/**
	 * @return the name under which the node is rendered
	 */
	public String getLabel() {
		return label;
	}
}
