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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.MorphoUtils;
import sc.fiji.morpho.SectionType;
import sc.fiji.morpho.WarningHandler;

/**
 * Indexes the samples of a file by id and by parent id. Building the graph
 * validates the cross-record rules of the SWC format:
 * <ol>
 * <li>Per sample, in file order: zero diameters (warning), self parents,
 * unsupported types, disconnected neurites (warning) and repeated ids</li>
 * <li>Once all samples are known (forward references are legal): missing
 * parents</li>
 * <li>Parent cycles</li>
 * </ol>
 */
public class SampleGraph {

	private final Map<Long, Sample> samples;
	private final Map<Long, List<Long>> children;
	private final List<Sample> somaSamples;
	private final List<Sample> rootSamples;

	private SampleGraph(final int expectedSize) {
		samples = new LinkedHashMap<>(expectedSize * 2);
		children = new HashMap<>(expectedSize * 2);
		somaSamples = new ArrayList<>();
		rootSamples = new ArrayList<>();
	}

	/**
	 * Indexes and validates a sequence of samples.
	 *
	 * @param samples the samples, in file order
	 * @param err the renderer of diagnostics
	 * @param handler the channel receiving warnings
	 * @return the validated graph
	 * @throws InvalidMorphologyException on the first fatal condition found
	 */
	public static SampleGraph build(final List<Sample> samples, final ErrorMessages err,
			final WarningHandler handler) throws InvalidMorphologyException {
		final SampleGraph graph = new SampleGraph(samples.size());
		for (final Sample sample : samples) {
			graph.add(sample, err, handler);
		}
		// forward references are legal: parents can only be resolved now
		for (final Sample sample : samples) {
			if (!sample.isRoot() && !graph.contains(sample.parentId())) {
				throw err.missingParent(sample);
			}
		}
		graph.checkCycles(err);
		return graph;
	}

	private void add(final Sample sample, final ErrorMessages err, final WarningHandler handler) {
		if (sample.diameter() < MorphoUtils.EPSILON) {
			handler.emit(err.zeroDiameter(sample));
		}
		if (sample.parentId() == sample.id()) {
			throw err.selfParent(sample);
		}
		if (!SectionType.isValid(sample.type())) {
			throw err.unsupportedSectionType(sample);
		}
		if (sample.isRoot() && !sample.isSoma()) {
			handler.emit(err.disconnectedNeurite(sample));
		}

		final Sample existing = samples.putIfAbsent(sample.id(), sample);
		if (existing != null) {
			throw err.repeatedId(existing, sample);
		}
		if (sample.isSoma()) {
			somaSamples.add(sample);
		}
		if (sample.isRoot() || sample.isSoma()) {
			rootSamples.add(sample);
		}
		if (!sample.isRoot()) {
			children.computeIfAbsent(sample.parentId(), k -> new ArrayList<>()).add(sample.id());
		}
	}

	private void checkCycles(final ErrorMessages err) {
		final Graph<Long, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		samples.keySet().forEach(graph::addVertex);
		for (final Sample sample : samples.values()) {
			if (!sample.isRoot()) graph.addEdge(sample.parentId(), sample.id());
		}
		final CycleDetector<Long, DefaultEdge> detector = new CycleDetector<>(graph);
		if (detector.detectCycles()) {
			final Set<Long> ids = new TreeSet<>(detector.findCycles());
			final List<Sample> cycle = new ArrayList<>(ids.size());
			ids.forEach(id -> cycle.add(samples.get(id)));
			throw err.cyclicParentage(cycle);
		}
	}

	public boolean contains(final long id) {
		return samples.containsKey(id);
	}

	/**
	 * @param id the sample id
	 * @return the sample with the specified id
	 * @throws IllegalArgumentException if no such sample exists
	 */
	public Sample get(final long id) throws IllegalArgumentException {
		final Sample sample = samples.get(id);
		if (sample == null) throw new IllegalArgumentException("Unknown sample id: " + id);
		return sample;
	}

	/**
	 * @param id the parent id
	 * @return the ids of the samples declaring id as parent, in file order
	 */
	public List<Long> getChildren(final long id) {
		final List<Long> ids = children.get(id);
		return (ids == null) ? Collections.emptyList() : Collections.unmodifiableList(ids);
	}

	public int getChildCount(final long id) {
		final List<Long> ids = children.get(id);
		return (ids == null) ? 0 : ids.size();
	}

	/** @return the soma samples, in file order */
	public List<Sample> getSomaSamples() {
		return Collections.unmodifiableList(somaSamples);
	}

	/**
	 * @return the samples that may start a tree, in file order: samples
	 *         without parent and soma samples
	 */
	public List<Sample> getRootSamples() {
		return Collections.unmodifiableList(rootSamples);
	}

	/** @return all samples, in file order */
	public Collection<Sample> getSamples() {
		return Collections.unmodifiableCollection(samples.values());
	}

	public int size() {
		return samples.size();
	}
}
