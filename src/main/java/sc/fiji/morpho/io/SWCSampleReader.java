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

import java.util.ArrayList;
import java.util.List;

import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Converts SWC text into an ordered list of {@link Sample}s. Ids are read as
 * unsigned 32-bit values. Only per-record
 * syntax is checked here: duplicate ids and dangling parents can only be
 * judged once the whole file has been read (see {@link SampleGraph}).
 */
public class SWCSampleReader {

	private static final long SWC_UNDEFINED_PARENT = -1;

	private final String contents;
	private final ErrorMessages err;

	public SWCSampleReader(final String contents, final ErrorMessages err) {
		this.contents = contents;
		this.err = err;
	}

	/**
	 * Reads all records.
	 *
	 * @return the samples, in file order
	 * @throws InvalidMorphologyException if a record is malformed
	 */
	public List<Sample> read() throws InvalidMorphologyException {
		final List<Sample> samples = new ArrayList<>();
		final SWCTokenizer tokenizer = new SWCTokenizer(contents, err);
		tokenizer.consumeLineAndTrailingComments();

		while (!tokenizer.done()) {
			final int lineNumber = tokenizer.lineNumber();

			final long id = tokenizer.readLong();
			if (id < 0) {
				throw err.negativeId(lineNumber);
			} else if (id > Sample.MAX_ID) {
				throw err.lineNonParsable(lineNumber);
			}
			final int type = tokenizer.readInt();
			final double x = tokenizer.readFloat();
			final double y = tokenizer.readFloat();
			final double z = tokenizer.readFloat();
			final double diameter = 2 * tokenizer.readFloat();

			long parentId = tokenizer.readLong();
			if (parentId < SWC_UNDEFINED_PARENT) {
				throw err.negativeId(lineNumber);
			} else if (parentId > Sample.MAX_ID) {
				throw err.lineNonParsable(lineNumber);
			} else if (parentId == SWC_UNDEFINED_PARENT) {
				parentId = Sample.ROOT;
			}

			if (!tokenizer.consumeLineAndTrailingComments()) {
				throw err.lineNonParsable(lineNumber);
			}
			samples.add(new Sample(id, type, new MorphoPoint(x, y, z), diameter, parentId, lineNumber));
		}
		return samples;
	}
}
