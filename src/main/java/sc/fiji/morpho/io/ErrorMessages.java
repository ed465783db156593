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

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

import sc.fiji.morpho.ErrorKind;
import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.Warning;
import sc.fiji.morpho.WarningMessage;

/**
 * Renders the diagnostics of the SWC reader. Every message is prefixed with
 * {@code <path>:<line>:error} or {@code <path>:<line>:warning} so that it can
 * be located by editors.
 */
public class ErrorMessages {

	private static final String ERROR = "error";
	private static final String WARNING = "warning";

	private final String path;

	public ErrorMessages(final String path) {
		this.path = StringUtils.defaultIfBlank(path, "");
	}

	public String getPath() {
		return path;
	}

	private String render(final int lineNumber, final String level, final String msg) {
		return path + ":" + lineNumber + ":" + level + System.lineSeparator() + msg;
	}

	private InvalidMorphologyException error(final ErrorKind kind, final int lineNumber, final String msg,
			final int... lineNumbers) {
		return new InvalidMorphologyException(kind, render(lineNumber, ERROR, msg),
				(lineNumbers.length == 0) ? new int[] { lineNumber } : lineNumbers);
	}

	private WarningMessage warning(final Warning kind, final int lineNumber, final String msg) {
		return new WarningMessage(kind, lineNumber, render(lineNumber, WARNING, msg));
	}

	private static String lines(final Collection<Sample> samples) {
		return samples.stream().map(s -> s.lineNumber() + ": " + s.toSWCString())
				.collect(Collectors.joining(System.lineSeparator()));
	}

	private static int[] lineNumbers(final Collection<Sample> samples) {
		return samples.stream().mapToInt(Sample::lineNumber).toArray();
	}

	/* Tokenizer and reader errors */

	public InvalidMorphologyException earlyEndOfFile(final int lineNumber) {
		return error(ErrorKind.EARLY_END_OF_FILE, lineNumber, "Hit end of file while consuming a neuron");
	}

	public InvalidMorphologyException lineNonParsable(final int lineNumber) {
		return error(ErrorKind.LINE_NON_PARSABLE, lineNumber, "Unable to parse this line");
	}

	public InvalidMorphologyException negativeId(final int lineNumber) {
		return error(ErrorKind.NEGATIVE_ID, lineNumber, "Negative IDs are not supported");
	}

	/* Graph errors */

	public InvalidMorphologyException selfParent(final Sample sample) {
		return error(ErrorKind.SELF_PARENT, sample.lineNumber(),
				"Parent ID can not be itself (sample id: " + sample.id() + ")");
	}

	public InvalidMorphologyException unsupportedSectionType(final Sample sample) {
		return error(ErrorKind.UNSUPPORTED_SECTION_TYPE, sample.lineNumber(),
				"Unsupported section type: " + sample.type());
	}

	public InvalidMorphologyException repeatedId(final Sample original, final Sample repeated) {
		return error(ErrorKind.REPEATED_ID, repeated.lineNumber(),
				"Repeated ID: " + repeated.id() + System.lineSeparator() + "ID already appears here: "
						+ System.lineSeparator() + lines(List.of(original)),
				original.lineNumber(), repeated.lineNumber());
	}

	public InvalidMorphologyException missingParent(final Sample sample) {
		return error(ErrorKind.MISSING_PARENT, sample.lineNumber(),
				"Sample id: " + sample.id() + " refers to non-existent parent ID: " + sample.parentId());
	}

	public InvalidMorphologyException cyclicParentage(final Collection<Sample> cycle) {
		final String ids = cycle.stream().map(s -> String.valueOf(s.id())).collect(Collectors.joining(", "));
		final int first = cycle.stream().mapToInt(Sample::lineNumber).min().orElse(-1);
		return error(ErrorKind.CYCLIC_PARENTAGE, first, "Samples form a parent cycle (ids: " + ids + ")",
				lineNumbers(cycle));
	}

	/* Soma errors */

	public InvalidMorphologyException somaWithNeuriteParent(final Sample sample) {
		return error(ErrorKind.SOMA_WITH_NEURITE_PARENT, sample.lineNumber(),
				"Found a soma point with a neurite as parent (parent ID: " + sample.parentId() + ")");
	}

	public InvalidMorphologyException multipleSomata(final Collection<Sample> roots) {
		final int first = roots.stream().mapToInt(Sample::lineNumber).min().orElse(-1);
		return error(ErrorKind.MULTIPLE_SOMATA, first,
				"Multiple somata found: (only one allowed)" + System.lineSeparator() + lines(roots),
				lineNumbers(roots));
	}

	public InvalidMorphologyException somaBifurcation(final Sample sample, final Collection<Sample> children) {
		final int[] involved = new int[children.size() + 1];
		involved[0] = sample.lineNumber();
		System.arraycopy(lineNumbers(children), 0, involved, 1, children.size());
		return error(ErrorKind.SOMA_BIFURCATION, sample.lineNumber(),
				"Found soma bifurcation" + System.lineSeparator() + "The following children have been found:"
						+ System.lineSeparator() + lines(children),
				involved);
	}

	/* Warnings */

	public WarningMessage zeroDiameter(final Sample sample) {
		return warning(Warning.ZERO_DIAMETER, sample.lineNumber(), "Zero diameter in file");
	}

	public WarningMessage disconnectedNeurite(final Sample sample) {
		return warning(Warning.DISCONNECTED_NEURITE, sample.lineNumber(),
				"Found a disconnected neurite." + System.lineSeparator()
						+ "Neurites are not supposed to have parentId: -1" + System.lineSeparator()
						+ "(although this is normal if this neuron has no soma)");
	}

	public WarningMessage somaNonConform(final Sample center, final Sample child1, final Sample child2) {
		return warning(Warning.SOMA_NON_CONFORM, center.lineNumber(),
				"The soma does not conform to the three point soma format" + System.lineSeparator()
						+ "The only valid neuro-morpho soma is:" + System.lineSeparator()
						+ "1 1 x   y   z r -1" + System.lineSeparator()
						+ "2 1 x (y-r) z r  1" + System.lineSeparator()
						+ "3 1 x (y+r) z r  1" + System.lineSeparator() + System.lineSeparator() + "Got:"
						+ System.lineSeparator() + lines(List.of(center, child1, child2)));
	}

	public WarningMessage wrongRootPoint(final Sample sample) {
		return warning(Warning.WRONG_ROOT_POINT, sample.lineNumber(),
				"With a 3 points soma, neurites must be connected to the first soma point:"
						+ System.lineSeparator() + lines(List.of(sample)));
	}
}
