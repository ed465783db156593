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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import sc.fiji.morpho.CellFamily;
import sc.fiji.morpho.ModifierOption;
import sc.fiji.morpho.SectionType;
import sc.fiji.morpho.properties.FormatVersion;
import sc.fiji.morpho.properties.Properties;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Editable representation of a reconstruction: a {@link MutableSoma} and a
 * forest of {@link MutableSection}s. Sections live in an arena owned by this
 * class and are addressed by stable integer handles (their index in the
 * arena), so parent and children edges never hold object references.
 * <p>
 * A MutableMorphology is not thread-safe. Once assembled it can be frozen
 * into an immutable {@link Properties} table with {@link #buildReadOnly()}.
 * </p>
 */
public class MutableMorphology {

	private final List<MutableSection> sections;
	private final List<Integer> rootSections;
	private final MutableSoma soma;
	private CellFamily cellFamily;
	private FormatVersion version;

	public MutableMorphology() {
		sections = new ArrayList<>();
		rootSections = new ArrayList<>();
		soma = new MutableSoma();
		cellFamily = CellFamily.NEURON;
		version = FormatVersion.SWC_1_0;
	}

	/**
	 * Creates a new root section.
	 *
	 * @param points the section points
	 * @param diameters the diameter of each point
	 * @param type the section type
	 * @return the handle of the new section
	 * @throws IllegalArgumentException if points and diameters differ in size
	 */
	public int appendRootSection(final List<MorphoPoint> points, final List<Double> diameters,
			final SectionType type) throws IllegalArgumentException {
		final MutableSection section = new MutableSection(sections.size(), MutableSection.NO_PARENT, type, points,
				diameters);
		sections.add(section);
		rootSections.add(section.getId());
		return section.getId();
	}

	/**
	 * Creates a new section as the last child of an existing one.
	 *
	 * @param parentId the handle of the parent section
	 * @param points the section points
	 * @param diameters the diameter of each point
	 * @param type the section type
	 * @return the handle of the new section
	 * @throws IllegalArgumentException if parentId is unknown or if points and
	 *           diameters differ in size
	 */
	public int appendSection(final int parentId, final List<MorphoPoint> points, final List<Double> diameters,
			final SectionType type) throws IllegalArgumentException {
		final MutableSection parent = getSection(parentId);
		final MutableSection section = new MutableSection(sections.size(), parentId, type, points, diameters);
		sections.add(section);
		parent.addChild(section.getId());
		return section.getId();
	}

	/**
	 * @param id the section handle
	 * @return the section associated with the handle
	 * @throws IllegalArgumentException if handle is unknown
	 */
	public MutableSection getSection(final int id) throws IllegalArgumentException {
		if (id < 0 || id >= sections.size())
			throw new IllegalArgumentException("Unknown section id: " + id);
		return sections.get(id);
	}

	/** @return the parent of the section or null if section is a root */
	public MutableSection getParent(final MutableSection section) {
		return section.isRoot() ? null : sections.get(section.getParentId());
	}

	public List<MutableSection> getChildren(final MutableSection section) {
		final List<MutableSection> children = new ArrayList<>(section.getChildIds().size());
		section.getChildIds().forEach(id -> children.add(sections.get(id)));
		return children;
	}

	public List<MutableSection> getRootSections() {
		final List<MutableSection> roots = new ArrayList<>(rootSections.size());
		rootSections.forEach(id -> roots.add(sections.get(id)));
		return roots;
	}

	/** @return all sections in creation order */
	public List<MutableSection> getSections() {
		return Collections.unmodifiableList(sections);
	}

	/**
	 * @return all sections in depth-first pre-order, visiting root sections
	 *         (and the children of each section) in order
	 */
	public List<MutableSection> depthFirst() {
		final List<MutableSection> visited = new ArrayList<>(sections.size());
		final Deque<Integer> stack = new ArrayDeque<>();
		for (int i = rootSections.size() - 1; i >= 0; i--)
			stack.push(rootSections.get(i));
		while (!stack.isEmpty()) {
			final MutableSection section = sections.get(stack.pop());
			visited.add(section);
			final List<Integer> children = section.getChildIds();
			for (int i = children.size() - 1; i >= 0; i--)
				stack.push(children.get(i));
		}
		return visited;
	}

	public int size() {
		return sections.size();
	}

	public MutableSoma getSoma() {
		return soma;
	}

	public CellFamily getCellFamily() {
		return cellFamily;
	}

	public void setCellFamily(final CellFamily cellFamily) {
		this.cellFamily = cellFamily;
	}

	public FormatVersion getVersion() {
		return version;
	}

	public void setVersion(final FormatVersion version) {
		this.version = version;
	}

	void sortRootSections(final Comparator<MutableSection> comparator) {
		final List<MutableSection> roots = getRootSections();
		roots.sort(comparator); // List.sort is stable
		rootSections.clear();
		roots.forEach(root -> rootSections.add(root.getId()));
	}

	/**
	 * Runs the modifiers encoded in the specified bit field, in the order
	 * listed by {@link ModifierOption}.
	 *
	 * @param options the {@link ModifierOption} flags
	 * @throws IllegalArgumentException if options contains unknown flags
	 */
	public void applyModifiers(final int options) throws IllegalArgumentException {
		ModifierOption.validate(options);
		if (ModifierOption.isSet(options, ModifierOption.TWO_POINTS_SECTIONS))
			Modifiers.twoPointsSections(this);
		if (ModifierOption.isSet(options, ModifierOption.SOMA_SPHERE))
			Modifiers.somaSphere(this);
		if (ModifierOption.isSet(options, ModifierOption.NO_DUPLICATES))
			Modifiers.noDuplicates(this);
		if (ModifierOption.isSet(options, ModifierOption.NRN_ORDER))
			Modifiers.nrnOrder(this);
	}

	/**
	 * Flattens this morphology into an immutable table. Sections are
	 * renumbered in depth-first order.
	 *
	 * @return the read-only properties of this morphology
	 */
	public Properties buildReadOnly() {
		final List<MutableSection> ordered = depthFirst();
		final int[] newIndex = new int[sections.size()];
		final int[][] structure = new int[ordered.size()][];
		final List<MorphoPoint> points = new ArrayList<>();
		final List<Double> diameters = new ArrayList<>();
		for (int i = 0; i < ordered.size(); i++) {
			final MutableSection section = ordered.get(i);
			newIndex[section.getId()] = i;
			final int parent = section.isRoot() ? -1 : newIndex[section.getParentId()];
			structure[i] = new int[] { points.size(), section.getType().code(), parent };
			points.addAll(section.getPoints());
			diameters.addAll(section.getDiameters());
		}
		return new Properties(points, diameters, structure, soma.getType(), soma.getPoints(), soma.getDiameters(),
				cellFamily, version);
	}

	@Override
	public String toString() {
		return "MutableMorphology[" + sections.size() + " sections, " + rootSections.size() + " roots, soma "
				+ soma.getType() + "]";
	}
}
