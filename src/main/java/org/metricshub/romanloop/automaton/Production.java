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

import java.util.Objects;

/**
 * A grammar rule together with its tree-building action.
 * Reducing by a production pops exactly {@link #getRhsLength()} symbols.
 */
public final class Production {

	private final Nonterminal lhs;
	private final String rhs;
	private final int rhsLength;
	private final NodeBuilder builder;

	/**
	 * <p>
	 * Constructor for Production.
	 * </p>
	 *
	 * @param lhs the left-hand side
	 * @param rhs the right-hand side symbols separated by spaces
	 * @param builder the semantic action
	 */
	public Production(Nonterminal lhs, String rhs, NodeBuilder builder) {
		this.lhs = Objects.requireNonNull(lhs, "lhs");
		this.rhs = rhs.trim();
		this.rhsLength = this.rhs.isEmpty() ? 0 : this.rhs.split("\\s+").length;
		this.builder = Objects.requireNonNull(builder, "builder");
	}

	public Nonterminal getLhs() {
		return lhs;
	}

	public String getRhs() {
		return rhs;
	}

	public int getRhsLength() {
		return rhsLength;
	}

	public NodeBuilder getBuilder() {
		return builder;
	}

	@Override
	public String toString() {
		return lhs + " -> " + rhs;
	}
}
