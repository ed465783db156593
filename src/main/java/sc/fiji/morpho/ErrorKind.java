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
 * Fatal conditions aborting the loading of a reconstruction.
 */
public enum ErrorKind {

	EARLY_END_OF_FILE("Early end of file"),
	LINE_NON_PARSABLE("Non-parsable line"),
	NEGATIVE_ID("Negative id"),
	SELF_PARENT("Self parent"),
	UNSUPPORTED_SECTION_TYPE("Unsupported section type"),
	REPEATED_ID("Repeated id"),
	MISSING_PARENT("Missing parent"),
	SOMA_WITH_NEURITE_PARENT("Soma with neurite parent"),
	MULTIPLE_SOMATA("Multiple somata"),
	SOMA_BIFURCATION("Soma bifurcation"),
	CYCLIC_PARENTAGE("Cyclic parentage");

	private final String label;

	ErrorKind(final String label) {
		this.label = label;
	}

	/** @return true if this error concerns the soma samples of a file */
	public boolean isSomaError() {
		return this == SOMA_WITH_NEURITE_PARENT || this == MULTIPLE_SOMATA || this == SOMA_BIFURCATION;
	}

	@Override
	public String toString() {
		return label;
	}
}
