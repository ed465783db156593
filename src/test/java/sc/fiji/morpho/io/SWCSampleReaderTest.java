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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import sc.fiji.morpho.ErrorKind;
import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.util.MorphoPoint;

/**
 * Tests for {@link SWCSampleReader}
 */
public class SWCSampleReaderTest {

	private final double precision = 1e-12;

	private static List<Sample> read(final String contents) {
		return new SWCSampleReader(contents, new ErrorMessages("reader.swc")).read();
	}

	private static InvalidMorphologyException readInvalid(final String contents) {
		try {
			read(contents);
		} catch (final InvalidMorphologyException e) {
			return e;
		}
		fail("InvalidMorphologyException expected for: " + contents);
		return null;
	}

	@Test
	public void testRecords() {
		final List<Sample> samples = read("# comment\n\n1 1 0 0 0 1 -1\n2 3 1 2 3 0.25 1 # trailing\n");
		assertEquals(2, samples.size());

		final Sample root = samples.get(0);
		assertEquals(1, root.id());
		assertEquals(Sample.ROOT, root.parentId());
		assertTrue(root.isRoot());
		assertTrue(root.isSoma());
		assertEquals(3, root.lineNumber());

		final Sample child = samples.get(1);
		assertEquals(2, child.id());
		assertEquals(3, child.type());
		assertEquals(new MorphoPoint(1, 2, 3), child.point());
		assertEquals("Diameter is twice the radius", 0.5, child.diameter(), precision);
		assertEquals(1, child.parentId());
		assertEquals(4, child.lineNumber());
	}

	@Test
	public void testEmptyInput() {
		assertTrue(read("").isEmpty());
		assertTrue(read("# nothing but comments\n\n").isEmpty());
	}

	@Test
	public void testNonPositiveRadiiAreDeferred() {
		final List<Sample> samples = read("1 1 0 0 0 0 -1\n2 3 0 0 0 -1 1");
		assertEquals(0, samples.get(0).diameter(), precision);
		assertEquals(-2, samples.get(1).diameter(), precision);
	}

	@Test
	public void testUnsupportedTypesAreDeferred() {
		assertEquals(42, read("1 42 0 0 0 1 -1").get(0).type());
	}

	@Test
	public void testNegativeIds() {
		InvalidMorphologyException e = readInvalid("1 1 0 0 0 1 -1\n-1 1 0 0 0 1 -1\n");
		assertEquals(ErrorKind.NEGATIVE_ID, e.getKind());
		assertEquals(2, e.getLineNumber());

		e = readInvalid("1 1 0 0 0 1 -2\n");
		assertEquals(ErrorKind.NEGATIVE_ID, e.getKind());
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testUnsignedIds() {
		final List<Sample> samples = read("4294967295 1 0 0 0 1 -1\n2147483648 3 0 1 0 1 4294967295\n");
		assertEquals(Sample.MAX_ID, samples.get(0).id());
		assertEquals(2_147_483_648L, samples.get(1).id());
		assertEquals(Sample.MAX_ID, samples.get(1).parentId());
	}

	@Test
	public void testIdsBeyondUnsignedRange() {
		InvalidMorphologyException e = readInvalid("4294967296 1 0 0 0 1 -1\n");
		assertEquals(ErrorKind.LINE_NON_PARSABLE, e.getKind());
		assertEquals(1, e.getLineNumber());

		e = readInvalid("1 1 0 0 0 1 -1\n2 3 0 1 0 1 4294967296\n");
		assertEquals(ErrorKind.LINE_NON_PARSABLE, e.getKind());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testRecordsMustEndLines() {
		final InvalidMorphologyException e = readInvalid("# header\n1 1 0 0 0 1 -1 5\n");
		assertEquals(ErrorKind.LINE_NON_PARSABLE, e.getKind());
		assertEquals("Line of the offending record", 2, e.getLineNumber());
	}

	@Test
	public void testTruncatedRecord() {
		final InvalidMorphologyException e = readInvalid("1 1 0 0 0 1 -1\n2 3 0 0 0 1\n");
		assertEquals(ErrorKind.EARLY_END_OF_FILE, e.getKind());
	}

	@Test
	public void testNonNumericField() {
		final InvalidMorphologyException e = readInvalid("1 soma 0 0 0 1 -1\n");
		assertEquals(ErrorKind.LINE_NON_PARSABLE, e.getKind());
		assertEquals(1, e.getLineNumber());
	}

}
