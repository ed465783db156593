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

import java.util.Comparator;
import java.util.List;

import sc.fiji.morpho.MorphoUtils;
import sc.fiji.morpho.SomaType;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Post-loading simplifications of a {@link MutableMorphology}, selected with
 * {@link sc.fiji.morpho.ModifierOption} flags. All modifiers operate in
 * place and keep points and diameters aligned.
 */
public final class Modifiers {

	private Modifiers() {}

	/** Keeps only the first and last point of every section. */
	public static void twoPointsSections(final MutableMorphology morphology) {
		for (final MutableSection section : morphology.getSections()) {
			final int n = section.size();
			if (n <= 2) continue;
			final List<MorphoPoint> points = section.getPoints();
			final List<Double> diameters = section.getDiameters();
			section.setPoints(List.of(points.get(0), points.get(n - 1)),
					List.of(diameters.get(0), diameters.get(n - 1)));
		}
	}

	/**
	 * Replaces a multi-point soma by a sphere centered at the centroid of its
	 * points, with a radius equal to the mean distance of those points to the
	 * centroid.
	 */
	public static void somaSphere(final MutableMorphology morphology) {
		final MutableSoma soma = morphology.getSoma();
		if (soma.size() < 2) return;
		final MorphoPoint center = soma.getCenter();
		final double meanRadius = soma.getPoints().stream().mapToDouble(p -> p.distanceTo(center)).average()
				.orElse(0d);
		soma.setPoints(List.of(center), List.of(2 * meanRadius));
		soma.setType(SomaType.SINGLE_POINT);
		MorphoUtils.log("Soma simplified to sphere at " + center);
	}

	/**
	 * Removes the first point of every child section when it duplicates the
	 * last point of its parent.
	 */
	public static void noDuplicates(final MutableMorphology morphology) {
		for (final MutableSection section : morphology.getSections()) {
			if (section.isRoot() || section.size() < 2) continue;
			final MutableSection parent = morphology.getParent(section);
			if (!parent.getLastPoint().equals(section.getFirstPoint())) continue;
			final List<MorphoPoint> points = section.getPoints();
			final List<Double> diameters = section.getDiameters();
			section.setPoints(List.copyOf(points.subList(1, points.size())),
					List.copyOf(diameters.subList(1, diameters.size())));
		}
	}

	/** Sorts root sections by type code, preserving file order among equal types. */
	public static void nrnOrder(final MutableMorphology morphology) {
		morphology.sortRootSections(Comparator.comparingInt(section -> section.getType().code()));
	}
}
