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
 * Structural identifiers of neuronal compartments, as encoded in the type
 * column of SWC files. Codes 5 to 19 are reserved for custom compartments.
 */
public enum SectionType {

	UNDEFINED(0, "Undefined"),
	SOMA(1, "Soma"),
	AXON(2, "Axon"),
	BASAL_DENDRITE(3, "(Basal) Dendrite"),
	APICAL_DENDRITE(4, "Apical Dendrite"),
	CUSTOM_5(5), CUSTOM_6(6), CUSTOM_7(7), CUSTOM_8(8), CUSTOM_9(9),
	CUSTOM_10(10), CUSTOM_11(11), CUSTOM_12(12), CUSTOM_13(13), CUSTOM_14(14),
	CUSTOM_15(15), CUSTOM_16(16), CUSTOM_17(17), CUSTOM_18(18), CUSTOM_19(19);

	/** First type code that is no longer supported */
	public static final int OUT_OF_RANGE_START = 20;

	private static final SectionType[] BY_CODE = new SectionType[OUT_OF_RANGE_START];
	static {
		for (final SectionType type : values())
			BY_CODE[type.code] = type;
	}

	private final int code;
	private final String label;

	SectionType(final int code) {
		this(code, "Custom (" + code + ")");
	}

	SectionType(final int code, final String label) {
		this.code = code;
		this.label = label;
	}

	/** @return the numeric SWC code of this type */
	public int code() {
		return code;
	}

	/**
	 * Checks whether a type code may appear in a sample record. Note that
	 * {@link #UNDEFINED} is not a valid sample type.
	 *
	 * @param code the SWC type code
	 * @return true if code is in the supported [1, 20[ range
	 */
	public static boolean isValid(final int code) {
		return code > 0 && code < OUT_OF_RANGE_START;
	}

	/**
	 * @param code the SWC type code
	 * @return the type associated with code
	 * @throws IllegalArgumentException if code is outside the [0, 20[ range
	 */
	public static SectionType fromCode(final int code) throws IllegalArgumentException {
		if (code < 0 || code >= OUT_OF_RANGE_START)
			throw new IllegalArgumentException("Unsupported section type: " + code);
		return BY_CODE[code];
	}

	@Override
	public String toString() {
		return label;
	}
}
