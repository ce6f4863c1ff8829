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
 * Thrown by the {@link Tokenizer} when a character cannot start any token.
 * Tokenization halts at the first such character.
 */
public class LexerException extends SourceException {

	private static final long serialVersionUID = 1L;

	private final char character;

	/**
	 * <p>
	 * Constructor for LexerException.
	 * </p>
	 *
	 * @param character the offending character
	 * @param position its zero-based offset
	 * @param sourceDescription description of the source, may be {@code null}
	 */
	public LexerException(char character, int position, String sourceDescription) {
		super("Invalid character '" + character + "' at position " + position, sourceDescription, position);
		this.character = character;
	}

	public char getCharacter() {
		return character;
	}
}
