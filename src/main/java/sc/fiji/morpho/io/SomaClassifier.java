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

import java.util.ArrayList;
import java.util.List;

import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.MorphoUtils;
import sc.fiji.morpho.SomaType;
import sc.fiji.morpho.WarningHandler;
import sc.fiji.morpho.mut.MutableSoma;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Decides how the soma samples of a file are to be interpreted:
 * <ul>
 * <li>no samples: {@link SomaType#UNDEFINED}</li>
 * <li>one sample: {@link SomaType#SINGLE_POINT}</li>
 * <li>three samples in which the 2nd and 3rd have the 1st as parent:
 * {@link SomaType#NEUROMORPHO_THREE_POINT_CYLINDERS} (see
 * <a href="https://neuromorpho.org/SomaFormat.html">NeuroMorpho's soma
 * format</a>)</li>
 * <li>anything else: {@link SomaType#CYLINDERS}, provided samples form a
 * single, unbranched chain</li>
 * </ul>
 */
public class SomaClassifier {

	private final SampleGraph graph;
	private final ErrorMessages err;
	private final WarningHandler handler;

	public SomaClassifier(final SampleGraph graph, final ErrorMessages err, final WarningHandler handler) {
		this.graph = graph;
		this.err = err;
		this.handler = handler;
	}

	/**
	 * Populates a soma from the soma samples of the graph.
	 *
	 * @param soma the (empty) soma to be populated
	 * @throws InvalidMorphologyException if soma samples are not valid
	 */
	public void classify(final MutableSoma soma) throws InvalidMorphologyException {
		final List<Sample> somaSamples = graph.getSomaSamples();

		if (somaSamples.isEmpty()) {
			soma.setType(SomaType.UNDEFINED);
			return;
		}
		if (somaSamples.size() == 1) {
			final Sample sample = somaSamples.get(0);
			if (!sample.isRoot() && !graph.get(sample.parentId()).isSoma()) {
				throw err.somaWithNeuriteParent(sample);
			}
			soma.setType(SomaType.SINGLE_POINT);
			soma.addPoint(sample.point(), sample.diameter());
			return;
		}
		if (somaSamples.size() == 3) {
			final Sample center = somaSamples.get(0);
			final Sample child1 = somaSamples.get(1);
			final Sample child2 = somaSamples.get(2);
			// any soma whose first sample has the other two as children is a 3-point soma
			if (center.id() == child1.parentId() && center.id() == child2.parentId()) {
				soma.setType(SomaType.NEUROMORPHO_THREE_POINT_CYLINDERS);
				soma.addPoint(center.point(), center.diameter());
				soma.addPoint(child1.point(), child1.diameter());
				soma.addPoint(child2.point(), child2.diameter());
				if (!isConformThreePointSoma(center, child1, child2)) {
					handler.emit(err.somaNonConform(center, child1, child2));
				}
				return;
			}
		}
		buildCylinders(somaSamples, soma);
	}

	/*
	 * The only valid 3-point soma is: 1 1 x y z r -1 / 2 1 x (y-r) z r 1 / 3 1
	 * x (y+r) z r 1. Children may be listed in either order.
	 */
	private static boolean isConformThreePointSoma(final Sample center, final Sample child1, final Sample child2) {
		final MorphoPoint c = center.point();
		final double r = center.diameter() / 2;
		final MorphoPoint below = new MorphoPoint(c.x(), c.y() - r, c.z());
		final MorphoPoint above = new MorphoPoint(c.x(), c.y() + r, c.z());
		return (near(child1, below) && near(child2, above)) || (near(child1, above) && near(child2, below));
	}

	private static boolean near(final Sample sample, final MorphoPoint expected) {
		return sample.point().equalsWithin(expected, MorphoUtils.EPSILON);
	}

	private void buildCylinders(final List<Sample> somaSamples, final MutableSoma soma) {
		soma.setType(SomaType.CYLINDERS);
		final List<Sample> unparented = new ArrayList<>();
		for (final Sample sample : somaSamples) {
			if (sample.isRoot()) {
				unparented.add(sample);
			} else if (!graph.contains(sample.parentId())) {
				throw err.missingParent(sample);
			} else if (!graph.get(sample.parentId()).isSoma()) {
				throw err.somaWithNeuriteParent(sample);
			}

			if (graph.getChildCount(sample.id()) > 1) {
				final List<Sample> somaChildren = new ArrayList<>();
				for (final long childId : graph.getChildren(sample.id())) {
					final Sample child = graph.get(childId);
					if (child.isSoma()) somaChildren.add(child);
				}
				if (somaChildren.size() > 1) {
					throw err.somaBifurcation(sample, somaChildren);
				}
			}
			soma.addPoint(sample.point(), sample.diameter());
		}
		if (unparented.size() > 1) {
			throw err.multipleSomata(unparented);
		}
	}
}
