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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;

import sc.fiji.morpho.CollectingWarningHandler;
import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.ModifierOption;
import sc.fiji.morpho.MorphoUtils;
import sc.fiji.morpho.WarningHandler;
import sc.fiji.morpho.mut.MutableMorphology;
import sc.fiji.morpho.util.Logger;

/**
 * Entry point for loading SWC reconstructions. Loading is synchronous and
 * keeps no shared state: independent loads can run concurrently.
 */
public class SWCLoader {

	private SWCLoader() {}

	/**
	 * Loads an SWC file.
	 *
	 * @param file the SWC file (UTF-8)
	 * @param options the {@link ModifierOption} flags
	 * @return the outcome of loading
	 * @throws IOException if the file could not be read
	 */
	public static LoadResult load(final File file, final int options) throws IOException {
		final String contents = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
		return load(file.getAbsolutePath(), contents, options);
	}

	/**
	 * Loads SWC data held in memory.
	 *
	 * @param path the file path or identifier used in diagnostics
	 * @param contents the SWC data
	 * @param options the {@link ModifierOption} flags
	 * @return the outcome of loading: the read-only properties of the cell or
	 *         the fatal error found, along with all warnings
	 */
	public static LoadResult load(final String path, final String contents, final int options) {
		final Logger logger = new Logger(SWCLoader.class);
		final CollectingWarningHandler handler = new CollectingWarningHandler(logger);
		try {
			final MutableMorphology morphology = loadMutable(path, contents, options, handler);
			return LoadResult.success(morphology.buildReadOnly(), handler.getWarnings());
		} catch (final InvalidMorphologyException e) {
			logger.error("Could not load " + path, e);
			return LoadResult.failure(e, handler.getWarnings());
		}
	}

	/**
	 * Loads SWC data into an editable morphology.
	 *
	 * @param path the file path or identifier used in diagnostics
	 * @param contents the SWC data
	 * @param options the {@link ModifierOption} flags
	 * @param handler the channel receiving warnings
	 * @return the assembled (and modified) morphology
	 * @throws InvalidMorphologyException on the first fatal condition found
	 */
	public static MutableMorphology loadMutable(final String path, final String contents, final int options,
			final WarningHandler handler) throws InvalidMorphologyException {
		ModifierOption.validate(options);
		final Logger logger = new Logger(SWCLoader.class);
		long start = System.currentTimeMillis();
		final MutableMorphology morphology = new SWCReader().read(path, contents, handler);
		logger.debug(MorphoUtils.getReadableVersion() + ": read " + path + " (" + morphology + ") in "
				+ MorphoUtils.getElapsedTime(start));
		if (options != ModifierOption.NO_MODIFIER) {
			start = System.currentTimeMillis();
			morphology.applyModifiers(options);
			logger.debug("Applied " + ModifierOption.toString(options) + " in " + MorphoUtils.getElapsedTime(start));
		}
		return morphology;
	}
}
