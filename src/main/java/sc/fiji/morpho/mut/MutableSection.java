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

import sc.fiji.morpho.SectionType;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * A node of a {@link MutableMorphology}: an unbranched run of points of a
 * single {@link SectionType}. Sections are owned by their morphology and
 * refer to their parent and children through integer handles.
 */
public class MutableSection {

	/** Parent handle of root sections */
	public static final int NO_PARENT = -1;

	private final int id;
	private SectionType type;
	private final List<MorphoPoint> points;
	private final List<Double> diameters;
	private final int parent;
	private final List<Integer> children;

	MutableSection(final int id, final int parent, final SectionType type, final List<MorphoPoint> points,
			final List<Double> diameters) {
		checkAlignment(points, diameters);
		this.id = id;
		this.parent = parent;
		this.type = type;
		this.points = new ArrayList<>(points);
		this.diameters = new ArrayList<>(diameters);
		children = new ArrayList<>();
	}

	private static void checkAlignment(final List<MorphoPoint> points, final List<Double> diameters) {
		if (points.size() != diameters.size())
			throw new IllegalArgumentException("Section points (" + points.size() + ") and diameters ("
					+ diameters.size() + ") must have the same size");
	}

	/** @return the handle of this section in its morphology */
	public int getId() {
		return id;
	}

	public SectionType getType() {
		return type;
	}

	public void setType(final SectionType type) {
		this.type = type;
	}

	public List<MorphoPoint> getPoints() {
		return Collections.unmodifiableList(points);
	}

	public List<Double> getDiameters() {
		return Collections.unmodifiableList(diameters);
	}

	/**
	 * Replaces the points of this section.
	 *
	 * @throws IllegalArgumentException if lists differ in size
	 */
	public void setPoints(final List<MorphoPoint> points, final List<Double> diameters) {
		checkAlignment(points, diameters);
		this.points.clear();
		this.points.addAll(points);
		this.diameters.clear();
		this.diameters.addAll(diameters);
	}

	public MorphoPoint getFirstPoint() {
		return points.get(0);
	}

	public MorphoPoint getLastPoint() {
		return points.get(points.size() - 1);
	}

	public double getLastDiameter() {
		return diameters.get(diameters.size() - 1);
	}

	public int size() {
		return points.size();
	}

	/** @return the handle of the parent section or {@link #NO_PARENT} */
	public int getParentId() {
		return parent;
	}

	public boolean isRoot() {
		return parent == NO_PARENT;
	}

	/** @return the handles of child sections, in insertion order */
	public List<Integer> getChildIds() {
		return Collections.unmodifiableList(children);
	}

	void addChild(final int childId) {
		children.add(childId);
	}

	@Override
	public String toString() {
		return "Section " + id + " (" + type + ", " + points.size() + " points)";
	}
}
