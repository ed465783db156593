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

import java.util.List;

import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.WarningMessage;
import sc.fiji.morpho.properties.Properties;

/**
 * Outcome of loading a reconstruction: either the read-only
 * {@link Properties} of the cell, or the fatal error that aborted loading.
 * In both cases the warnings emitted while reading are available.
 */
public final class LoadResult {

	private final Properties properties;
	private final InvalidMorphologyException error;
	private final List<WarningMessage> warnings;

	private LoadResult(final Properties properties, final InvalidMorphologyException error,
			final List<WarningMessage> warnings) {
		this.properties = properties;
		this.error = error;
		this.warnings = List.copyOf(warnings);
	}

	public static LoadResult success(final Properties properties, final List<WarningMessage> warnings) {
		if (properties == null) throw new IllegalArgumentException("Properties cannot be null");
		return new LoadResult(properties, null, warnings);
	}

	public static LoadResult failure(final InvalidMorphologyException error, final List<WarningMessage> warnings) {
		if (error == null) throw new IllegalArgumentException("Error cannot be null");
		return new LoadResult(null, error, warnings);
	}

	public boolean isSuccess() {
		return properties != null;
	}

	/**
	 * @return the loaded properties
	 * @throws IllegalStateException if loading failed
	 */
	public Properties getProperties() throws IllegalStateException {
		if (!isSuccess()) throw new IllegalStateException("Loading failed: " + error.getMessage());
		return properties;
	}

	/**
	 * @return the error that aborted loading
	 * @throws IllegalStateException if loading succeeded
	 */
	public InvalidMorphologyException getError() throws IllegalStateException {
		if (isSuccess()) throw new IllegalStateException("Loading succeeded");
		return error;
	}

	/**
	 * @return the loaded properties
	 * @throws InvalidMorphologyException the error that aborted loading
	 */
	public Properties orElseThrow() throws InvalidMorphologyException {
		if (!isSuccess()) throw error;
		return properties;
	}

	/** @return the warnings emitted while loading, in file-scan order */
	public List<WarningMessage> getWarnings() {
		return warnings;
	}

	@Override
	public String toString() {
		return (isSuccess() ? "Success: " + properties : "Failure: " + error.getKind()) + " (" + warnings.size()
				+ " warning(s))";
	}
}
