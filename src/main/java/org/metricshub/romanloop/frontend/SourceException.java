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
 * Base class of the exceptions that reject an input program.
 * <p>
 * These represent invalid input, never a defect of the parser itself;
 * see {@link org.metricshub.romanloop.automaton.InternalParserError} for the latter.
 */
public abstract class SourceException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int position;

	protected SourceException(String message, String sourceDescription, int position) {
		super(message);
		this.sourceDescription = sourceDescription;
		this.position = position;
	}

	/**
	 * @return the description of the source that was being processed,
	 *         or {@code null} if none was supplied
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}

	/**
	 * @return zero-based character offset of the offending input
	 */
	public int getPosition() {
		return position;
	}
}
