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

/**
 * The representations a soma may take once a reconstruction has been loaded.
 */
public enum SomaType {

	/** No soma samples */
	UNDEFINED,
	/** A single sample: a sphere */
	SINGLE_POINT,
	/**
	 * The NeuroMorpho.org encoding: a center and two children displaced along
	 * the Y axis by the soma radius
	 */
	NEUROMORPHO_THREE_POINT_CYLINDERS,
	/** A chain of stacked cylinders */
	CYLINDERS,
	/** A closed contour. Never produced from SWC data */
	SIMPLE_CONTOUR;

}
