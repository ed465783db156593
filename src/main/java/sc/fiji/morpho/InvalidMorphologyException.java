/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2025 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.morpho;

import java.util.Arrays;

/**
 * Thrown when a reconstruction cannot be loaded because its data is
 * malformed or violates the structural rules of a neuronal tree.
 */
public class InvalidMorphologyException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;
	private final int[] lineNumbers;

	/**
	 * @param kind the fatal condition
	 * @param message the rendered diagnostic
	 * @param lineNumbers the 1-based line(s) involved, in any order
	 */
	public InvalidMorphologyException(final ErrorKind kind, final String message, final int... lineNumbers) {
		super(message);
		this.kind = kind;
		this.lineNumbers = (lineNumbers == null) ? new int[0] : lineNumbers.clone();
		Arrays.sort(this.lineNumbers);
	}

	public ErrorKind getKind() {
		return kind;
	}

	/** @return the offending line numbers, in ascending order */
	public int[] getLineNumbers() {
		return lineNumbers.clone();
	}

	/** @return the first offending line number, or -1 if none is known */
	public int getLineNumber() {
		return (lineNumbers.length == 0) ? -1 : lineNumbers[0];
	}
}
