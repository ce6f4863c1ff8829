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

import java.util.Objects;

/**
 * One lexeme produced by the {@link Tokenizer}.
 * <p>
 * Tokens are immutable. The position is the zero-based character offset of
 * the first character of the lexeme in the source text.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final int position;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param kind the token value
	 * @param text the spelling of the token, empty for {@link TokenKind#END_OF_INPUT}
	 * @param position zero-based offset in the source
	 */
	public Token(TokenKind kind, String text, int position) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = text == null ? "" : text;
		this.position = position;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public int getPosition() {
		return position;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return kind == other.kind && position == other.position && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, position);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		if (text.isEmpty()) {
			return kind.name() + "@" + position;
		}
		return kind.name() + "(" + text + ")@" + position;
	}
}
