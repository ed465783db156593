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

import sc.fiji.morpho.SectionType;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * One record of an SWC file. The type is kept as its raw code: range
 * validation happens when samples are indexed by {@link SampleGraph}.
 *
 * @param id the unique sample id, an unsigned 32-bit value
 * @param type the SWC type code
 * @param point the sample location
 * @param diameter twice the radius read from file
 * @param parentId the id of the parent sample or {@link #ROOT}
 * @param lineNumber the 1-based line the record starts at
 */
public record Sample(long id, int type, MorphoPoint point, double diameter, long parentId, int lineNumber) {

	/** Parent id of samples without parent */
	public static final long ROOT = -1;

	/** Largest id allowed in SWC files (unsigned 32-bit) */
	public static final long MAX_ID = 0xFFFFFFFFL;

	public boolean isRoot() {
		return parentId == ROOT;
	}

	public boolean isSoma() {
		return type == SectionType.SOMA.code();
	}

	/** @return the record as it would appear in an SWC file */
	public String toSWCString() {
		return id + " " + type + " " + point.x() + " " + point.y() + " " + point.z() + " " + diameter / 2 + " "
				+ parentId;
	}
}
