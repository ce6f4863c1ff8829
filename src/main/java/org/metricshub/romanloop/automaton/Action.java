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
 * One entry of the ACTION table.
 * <ul>
 * <li>For {@link Type#SHIFT}, {@code value} is the state to push.</li>
 * <li>For {@link Type#REDUCE}, {@code value} is the index of the production to reduce by.</li>
 * <li>For {@link Type#ACCEPT}, {@code value} is unused and always 0.</li>
 * </ul>
 * A missing entry is the error action, so there is no explicit error type.
 */
public final class Action {

	/** Driver operations. */
	public enum Type {
		SHIFT,
		REDUCE,
		ACCEPT
	}

	private static final Action ACCEPT = new Action(Type.ACCEPT, 0);

	private final Type type;
	private final int value;

	private Action(Type type, int value) {
		this.type = type;
		this.value = value;
	}

	public static Action shift(int nextState) {
		return new Action(Type.SHIFT, nextState);
	}

	public static Action reduce(int productionIndex) {
		return new Action(Type.REDUCE, productionIndex);
	}

	public static Action accept() {
		return ACCEPT;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the target state of a shift, or the production index of a reduce
	 */
	public int getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Action)) {
			return false;
		}
		Action other = (Action) o;
		return type == other.type && value == other.value;
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + value;
	}

	/**
	 * @return the usual textbook notation: {@code s4}, {@code r8} or {@code acc}
	 */
	@Override
	public String toString() {
		switch (type) {
		case SHIFT:
			return "s" + value;
		case REDUCE:
			return "r" + value;
		default:
			return "acc";
		}
	}
}
