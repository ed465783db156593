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

import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.WarningHandler;
import sc.fiji.morpho.mut.MutableMorphology;

/**
 * {@link MorphologyReader} for SWC files.
 */
public class SWCReader implements MorphologyReader {

	public static final String FORMAT_NAME = "swc";

	@Override
	public String getFormatName() {
		return FORMAT_NAME;
	}

	@Override
	public MutableMorphology read(final String path, final String contents, final WarningHandler handler)
			throws InvalidMorphologyException {
		return new SWCMorphologyBuilder(path, handler).build(contents);
	}
}
