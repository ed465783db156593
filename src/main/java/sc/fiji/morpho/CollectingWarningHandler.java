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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sc.fiji.morpho.util.Logger;

/**
 * Default {@link WarningHandler}: keeps every warning and echoes it to the
 * log.
 */
public class CollectingWarningHandler implements WarningHandler {

	private final List<WarningMessage> warnings;
	private final Logger logger;

	public CollectingWarningHandler() {
		this(new Logger(CollectingWarningHandler.class));
	}

	public CollectingWarningHandler(final Logger logger) {
		this.logger = logger;
		warnings = new ArrayList<>();
	}

	@Override
	public void emit(final WarningMessage warning) {
		warnings.add(warning);
		if (logger != null) logger.warn(warning.message());
	}

	@Override
	public List<WarningMessage> getWarnings() {
		return Collections.unmodifiableList(warnings);
	}

	/**
	 * @param kind the warning category
	 * @return the number of warnings of the specified kind
	 */
	public long count(final Warning kind) {
		return warnings.stream().filter(w -> w.kind() == kind).count();
	}

	public boolean isEmpty() {
		return warnings.isEmpty();
	}
}
