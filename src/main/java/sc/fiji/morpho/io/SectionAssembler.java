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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import sc.fiji.morpho.SectionType;
import sc.fiji.morpho.SomaType;
import sc.fiji.morpho.WarningHandler;
import sc.fiji.morpho.mut.MutableMorphology;
import sc.fiji.morpho.mut.MutableSection;
import sc.fiji.morpho.mut.MutableSoma;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Assembles the sections of a {@link MutableMorphology} from a validated
 * {@link SampleGraph}. Runs of single-child samples of the same type are
 * merged into one section; a new section starts at every bifurcation and at
 * every change of type. Each non-root section starts with a copy of the last
 * point of its parent, and sections attached to the soma start with the
 * first soma point.
 * <p>
 * Sections are created in depth-first pre-order. An explicit stack is used
 * so that deep trees do not exhaust the call stack.
 * </p>
 */
public class SectionAssembler {

	private final SampleGraph graph;
	private final MutableMorphology morphology;
	private final ErrorMessages err;
	private final WarningHandler handler;
	/* maps the id of the last sample of a section to the section handle */
	private final Map<Long, Integer> declaredToSection;

	/** A section waiting to be assembled */
	private record PendingSection(long sampleId, long parentSampleId, MorphoPoint startPoint, double startDiameter,
			boolean isRoot) {}

	/** A newly created section and the last sample merged into it */
	private record AssembledSection(int sectionId, Sample last) {}

	public SectionAssembler(final SampleGraph graph, final MutableMorphology morphology, final ErrorMessages err,
			final WarningHandler handler) {
		this.graph = graph;
		this.morphology = morphology;
		this.err = err;
		this.handler = handler;
		declaredToSection = new HashMap<>(graph.size());
	}

	/**
	 * Assembles all the trees of the graph. The soma of the morphology must
	 * have been classified beforehand.
	 */
	public void assemble() {
		final MutableSoma soma = morphology.getSoma();
		for (final Sample root : graph.getRootSamples()) {
			final List<Long> childIds = graph.getChildren(root.id());
			if (childIds.isEmpty()) {
				continue;
			}
			// https://neuromorpho.org/SomaFormat.html: "all starting points (roots) of
			// dendritic and axonal arbors have this first point as the parent"
			if (soma.getType() == SomaType.NEUROMORPHO_THREE_POINT_CYLINDERS && root.isSoma() && root.id() != 1) {
				handler.emit(err.wrongRootPoint(root));
			}
			for (final long childId : childIds) {
				if (graph.get(childId).isSoma()) {
					continue;
				}
				if (root.isSoma()) {
					assembleTree(new PendingSection(childId, root.id(), soma.getPoints().get(0),
							soma.getDiameters().get(0), true));
				} else {
					// neurite without parent: the tree starts at the root itself
					assembleTree(new PendingSection(root.id(), Sample.ROOT, null, 0, true));
					break;
				}
			}
		}
	}

	private void assembleTree(final PendingSection first) {
		final Deque<PendingSection> stack = new ArrayDeque<>();
		stack.push(first);
		while (!stack.isEmpty()) {
			final PendingSection pending = stack.pop();
			final AssembledSection assembled = appendSection(pending);
			final Sample last = assembled.last();
			final List<Long> childIds = graph.getChildren(last.id());
			if (childIds.isEmpty()) {
				continue;
			}
			// either a type change (one child) or a bifurcation
			final MutableSection section = morphology.getSection(assembled.sectionId());
			final MorphoPoint startPoint = section.getLastPoint();
			final double startDiameter = section.getLastDiameter();
			for (int i = childIds.size() - 1; i >= 0; i--) {
				stack.push(new PendingSection(childIds.get(i), last.id(), startPoint, startDiameter, false));
			}
		}
	}

	/**
	 * @return the handle of the new section and the last sample merged into it
	 */
	private AssembledSection appendSection(final PendingSection pending) {
		final List<MorphoPoint> points = new ArrayList<>();
		final List<Double> diameters = new ArrayList<>();

		if (pending.startPoint() != null) {
			points.add(pending.startPoint());
			diameters.add(pending.startDiameter());
		}

		Sample sample = graph.get(pending.sampleId());
		while (graph.getChildCount(sample.id()) == 1) {
			final Sample child = graph.get(graph.getChildren(sample.id()).get(0));
			if (child.type() != sample.type()) {
				break;
			}
			points.add(sample.point());
			diameters.add(sample.diameter());
			sample = child;
		}
		points.add(sample.point());
		diameters.add(sample.diameter());

		final SectionType type = SectionType.fromCode(sample.type());
		final int sectionId;
		if (pending.isRoot()) {
			sectionId = morphology.appendRootSection(points, diameters, type);
		} else {
			sectionId = morphology.appendSection(declaredToSection.get(pending.parentSampleId()), points, diameters,
					type);
		}
		declaredToSection.put(sample.id(), sectionId);
		return new AssembledSection(sectionId, sample);
	}
}
