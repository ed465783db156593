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

package sc.fiji.morpho.io;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sc.fiji.morpho.InvalidMorphologyException;

/**
 * Simple stream parser for the line oriented SWC format. Skips comments and
 * blank lines, and lets the caller read integers and floats while keeping
 * track of the (1-based) current line.
 */
class SWCTokenizer {

	private static final Pattern INT_PATTERN = Pattern.compile("[+-]?\\d+");
	private static final Pattern FLOAT_PATTERN = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

	private final String contents;
	private final ErrorMessages err;
	private int pos;
	private int line;

	SWCTokenizer(final String contents, final ErrorMessages err) {
		this.contents = (contents == null) ? "" : contents;
		this.err = err;
		pos = 0;
		line = 1;
	}

	boolean done() {
		return pos >= contents.length();
	}

	int lineNumber() {
		return line;
	}

	private static boolean isBlank(final char c) {
		return c == ' ' || c == '\t' || c == '\r';
	}

	private boolean isDelimiter(final int index) {
		if (index >= contents.length()) return true;
		final char c = contents.charAt(index);
		return isBlank(c) || c == '\n' || c == '#';
	}

	private void skipTo(final char value) {
		final int index = contents.indexOf(value, pos);
		pos = (index < 0) ? contents.length() : index;
	}

	private void advanceToNonWhitespace() {
		while (!done() && isBlank(contents.charAt(pos)))
			pos++;
	}

	/**
	 * Moves the cursor to the start of the next numeral, skipping blank and
	 * comment lines.
	 *
	 * @throws InvalidMorphologyException if input is exhausted or if a
	 *           non-numeric character is found
	 */
	void advanceToNumber() throws InvalidMorphologyException {
		while (!done() && consumeLineAndTrailingComments()) {
			// keep skipping blank and comment lines
		}
		if (done()) {
			throw err.earlyEndOfFile(line);
		}
		final char c = contents.charAt(pos);
		if (Character.isDigit(c) || c == '-' || c == '+' || c == '.') {
			return;
		}
		throw err.lineNonParsable(line);
	}

	private String readNumeral(final Pattern pattern) throws InvalidMorphologyException {
		advanceToNumber();
		final Matcher matcher = pattern.matcher(contents).region(pos, contents.length());
		if (!matcher.lookingAt() || !isDelimiter(matcher.end())) {
			throw err.lineNonParsable(line);
		}
		pos = matcher.end();
		return matcher.group();
	}

	int readInt() throws InvalidMorphologyException {
		final String numeral = readNumeral(INT_PATTERN);
		try {
			return Integer.parseInt(numeral);
		} catch (final NumberFormatException e) {
			final InvalidMorphologyException ex = err.lineNonParsable(line);
			ex.initCause(e);
			throw ex;
		}
	}

	long readLong() throws InvalidMorphologyException {
		final String numeral = readNumeral(INT_PATTERN);
		try {
			return Long.parseLong(numeral);
		} catch (final NumberFormatException e) {
			final InvalidMorphologyException ex = err.lineNonParsable(line);
			ex.initCause(e);
			throw ex;
		}
	}

	double readFloat() throws InvalidMorphologyException {
		return Double.parseDouble(readNumeral(FLOAT_PATTERN));
	}

	/**
	 * Skips the remainder of the current line, along with any following blank
	 * or comment lines.
	 *
	 * @return true if at least one newline was crossed or input is exhausted
	 */
	boolean consumeLineAndTrailingComments() {
		boolean foundNewline = false;
		advanceToNonWhitespace();
		while (!done() && (contents.charAt(pos) == '#' || contents.charAt(pos) == '\n')) {
			if (contents.charAt(pos) == '#') {
				skipTo('\n');
			} else {
				line++;
				pos++;
				foundNewline = true;
			}
			advanceToNonWhitespace();
		}
		return foundNewline || done();
	}
}
