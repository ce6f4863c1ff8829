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
 * Thrown by the {@link LrParser} when the ACTION table has no entry for the
 * lookahead token in the current automaton state, i.e. the input is not
 * derivable from that state.
 */
public class ParserException extends SourceException {

	private static final long serialVersionUID = 1L;

	private final TokenKind tokenKind;
	private final String tokenText;
	private final int state;

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param token the unexpected lookahead token
	 * @param state the automaton state that rejected it
	 * @param sourceDescription description of the source, may be {@code null}
	 */
	public ParserException(Token token, int state, String sourceDescription) {
		super(
				"Unexpected token " + token.getKind().name() + " ('" + token.getText() + "') at position "
						+ token.getPosition() + " in state " + state,
				sourceDescription,
				token.getPosition());
		this.tokenKind = token.getKind();
		this.tokenText = token.getText();
		this.state = state;
	}

	public TokenKind getTokenKind() {
		return tokenKind;
	}

	public String getTokenText() {
		return tokenText;
	}

	/**
	 * @return the automaton state in which the token was rejected
	 */
	public int getState() {
		return state;
	}
}
