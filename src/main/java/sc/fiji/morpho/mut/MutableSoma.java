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

package sc.fiji.morpho.mut;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sc.fiji.morpho.SomaType;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * The soma of a {@link MutableMorphology}: a shape tag plus parallel lists
 * of points and diameters.
 */
public class MutableSoma {

	private SomaType type = SomaType.UNDEFINED;
	private final List<MorphoPoint> points = new ArrayList<>();
	private final List<Double> diameters = new ArrayList<>();

	public SomaType getType() {
		return type;
	}

	public void setType(final SomaType type) {
		this.type = type;
	}

	public List<MorphoPoint> getPoints() {
		return Collections.unmodifiableList(points);
	}

	public List<Double> getDiameters() {
		return Collections.unmodifiableList(diameters);
	}

	public void addPoint(final MorphoPoint point, final double diameter) {
		points.add(point);
		diameters.add(diameter);
	}

	/**
	 * Replaces all points of this soma.
	 *
	 * @throws IllegalArgumentException if lists differ in size
	 */
	public void setPoints(final List<MorphoPoint> points, final List<Double> diameters) {
		if (points.size() != diameters.size())
			throw new IllegalArgumentException("Soma points (" + points.size() + ") and diameters ("
					+ diameters.size() + ") must have the same size");
		this.points.clear();
		this.points.addAll(points);
		this.diameters.clear();
		this.diameters.addAll(diameters);
	}

	public int size() {
		return points.size();
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}

	/** @return the centroid of the soma points, or null if soma is empty */
	public MorphoPoint getCenter() {
		return MorphoPoint.average(points);
	}
}
