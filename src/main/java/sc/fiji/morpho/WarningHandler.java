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

import java.util.List;

/**
 * Channel through which readers report {@link WarningMessage}s. Readers emit
 * warnings in the order records are scanned.
 */
public interface WarningHandler {

	/**
	 * Reports a warning.
	 *
	 * @param warning the warning to be reported
	 */
	void emit(WarningMessage warning);

	/** @return all the warnings emitted so far, in emission order */
	List<WarningMessage> getWarnings();

}
