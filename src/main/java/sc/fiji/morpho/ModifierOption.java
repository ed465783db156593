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
import java.util.List;

/**
 * Bit flags selecting the modifiers run on a reconstruction once it has been
 * assembled. Flags can be combined, e.g.,
 * {@code NO_DUPLICATES | NRN_ORDER}.
 */
public final class ModifierOption {

	public static final int NO_MODIFIER = 0;
	/** Keep only the first and last point of each section */
	public static final int TWO_POINTS_SECTIONS = 1;
	/** Simplify the soma to a single point sphere */
	public static final int SOMA_SPHERE = 2;
	/** Drop the boundary points duplicated at the start of child sections */
	public static final int NO_DUPLICATES = 4;
	/** Sort root sections by type, as NEURON does */
	public static final int NRN_ORDER = 8;

	private static final int ALL = TWO_POINTS_SECTIONS | SOMA_SPHERE | NO_DUPLICATES | NRN_ORDER;

	private ModifierOption() {}

	public static boolean isSet(final int options, final int flag) {
		return (options & flag) != 0;
	}

	/**
	 * @param options the bit field to validate
	 * @throws IllegalArgumentException if options contains unknown bits
	 */
	public static void validate(final int options) throws IllegalArgumentException {
		if ((options & ~ALL) != 0)
			throw new IllegalArgumentException("Unknown modifier option(s): " + Integer.toBinaryString(options & ~ALL));
	}

	public static String toString(final int options) {
		if (options == NO_MODIFIER) return "NO_MODIFIER";
		final List<String> names = new ArrayList<>();
		if (isSet(options, TWO_POINTS_SECTIONS)) names.add("TWO_POINTS_SECTIONS");
		if (isSet(options, SOMA_SPHERE)) names.add("SOMA_SPHERE");
		if (isSet(options, NO_DUPLICATES)) names.add("NO_DUPLICATES");
		if (isSet(options, NRN_ORDER)) names.add("NRN_ORDER");
		return String.join(" | ", names);
	}
}
