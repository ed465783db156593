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

package sc.fiji.morpho.properties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import sc.fiji.morpho.CellFamily;
import sc.fiji.morpho.SectionType;
import sc.fiji.morpho.SomaType;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Read-only, flattened representation of a loaded reconstruction. Points and
 * diameters of all sections are stored contiguously; the structure table
 * holds, for each section, the offset of its first point, its type and the
 * index of its parent section (-1 for root sections). Sections are numbered
 * in depth-first order, so that parents always precede their children.
 * <p>
 * Instances are immutable and can be freely shared across threads.
 * </p>
 */
public final class Properties {

	/** Structure column holding the offset of a section's first point */
	public static final int SECTION_START_OFFSET = 0;
	/** Structure column holding a section's type code */
	public static final int SECTION_TYPE = 1;
	/** Structure column holding a section's parent index */
	public static final int SECTION_PARENT_OFFSET = 2;

	private final List<MorphoPoint> points;
	private final List<Double> diameters;
	private final int[][] structure;
	private final List<List<Integer>> children;
	private final List<Integer> rootSections;
	private final SomaType somaType;
	private final List<MorphoPoint> somaPoints;
	private final List<Double> somaDiameters;
	private final CellFamily cellFamily;
	private final FormatVersion version;

	/**
	 * @param points the flattened points of all sections
	 * @param diameters the diameters matching each point
	 * @param structure one {offset, type code, parent index} row per section
	 * @param somaType the soma representation
	 * @param somaPoints the soma points
	 * @param somaDiameters the diameters matching each soma point
	 * @param cellFamily the cell family
	 * @param version the format the data was read from
	 * @throws IllegalArgumentException if the tables are inconsistent
	 */
	public Properties(final List<MorphoPoint> points, final List<Double> diameters, final int[][] structure,
			final SomaType somaType, final List<MorphoPoint> somaPoints, final List<Double> somaDiameters,
			final CellFamily cellFamily, final FormatVersion version) throws IllegalArgumentException {
		if (points.size() != diameters.size())
			throw new IllegalArgumentException("Points and diameters differ in size");
		if (somaPoints.size() != somaDiameters.size())
			throw new IllegalArgumentException("Soma points and diameters differ in size");
		this.points = List.copyOf(points);
		this.diameters = List.copyOf(diameters);
		this.structure = new int[structure.length][];
		final List<List<Integer>> childLists = new ArrayList<>(structure.length);
		final List<Integer> roots = new ArrayList<>();
		int previousOffset = 0;
		for (int i = 0; i < structure.length; i++) {
			final int[] row = structure[i];
			if (row.length != 3)
				throw new IllegalArgumentException("Structure row " + i + " must have 3 columns");
			final int offset = row[SECTION_START_OFFSET];
			final int parent = row[SECTION_PARENT_OFFSET];
			if (offset < previousOffset || offset > points.size())
				throw new IllegalArgumentException("Invalid start offset for section " + i + ": " + offset);
			if (parent < -1 || parent >= i)
				throw new IllegalArgumentException("Invalid parent for section " + i + ": " + parent);
			SectionType.fromCode(row[SECTION_TYPE]);
			previousOffset = offset;
			this.structure[i] = row.clone();
			childLists.add(new ArrayList<>());
			if (parent == -1)
				roots.add(i);
			else
				childLists.get(parent).add(i);
		}
		final List<List<Integer>> frozen = new ArrayList<>(childLists.size());
		childLists.forEach(list -> frozen.add(Collections.unmodifiableList(list)));
		children = Collections.unmodifiableList(frozen);
		rootSections = Collections.unmodifiableList(roots);
		this.somaType = somaType;
		this.somaPoints = List.copyOf(somaPoints);
		this.somaDiameters = List.copyOf(somaDiameters);
		this.cellFamily = cellFamily;
		this.version = version;
	}

	public int getSectionCount() {
		return structure.length;
	}

	public int getSectionStartOffset(final int section) {
		return structure[section][SECTION_START_OFFSET];
	}

	private int getSectionEndOffset(final int section) {
		return (section + 1 < structure.length) ? structure[section + 1][SECTION_START_OFFSET] : points.size();
	}

	public SectionType getSectionType(final int section) {
		return SectionType.fromCode(structure[section][SECTION_TYPE]);
	}

	/** @return the parent index of the specified section or -1 if it is a root */
	public int getSectionParent(final int section) {
		return structure[section][SECTION_PARENT_OFFSET];
	}

	public List<MorphoPoint> getSectionPoints(final int section) {
		return points.subList(getSectionStartOffset(section), getSectionEndOffset(section));
	}

	public List<Double> getSectionDiameters(final int section) {
		return diameters.subList(getSectionStartOffset(section), getSectionEndOffset(section));
	}

	public List<Integer> getChildren(final int section) {
		return children.get(section);
	}

	public List<Integer> getRootSections() {
		return rootSections;
	}

	/** @return a copy of the structure table */
	public int[][] getStructure() {
		final int[][] copy = new int[structure.length][];
		for (int i = 0; i < structure.length; i++)
			copy[i] = structure[i].clone();
		return copy;
	}

	public List<MorphoPoint> getPoints() {
		return points;
	}

	public List<Double> getDiameters() {
		return diameters;
	}

	public SomaType getSomaType() {
		return somaType;
	}

	public List<MorphoPoint> getSomaPoints() {
		return somaPoints;
	}

	public List<Double> getSomaDiameters() {
		return somaDiameters;
	}

	public CellFamily getCellFamily() {
		return cellFamily;
	}

	public FormatVersion getVersion() {
		return version;
	}

	@Override
	public String toString() {
		return version + " " + cellFamily + ": " + structure.length + " sections, " + points.size()
				+ " points, soma " + somaType;
	}
}
