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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import sc.fiji.morpho.CollectingWarningHandler;
import sc.fiji.morpho.ErrorKind;
import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.Warning;

/**
 * Tests for {@link SampleGraph}
 */
public class SampleGraphTest {

	private ErrorMessages err;
	private CollectingWarningHandler handler;

	@Before
	public void setUp() {
		err = new ErrorMessages("graph.swc");
		handler = new CollectingWarningHandler();
	}

	private SampleGraph build(final String contents) {
		return SampleGraph.build(new SWCSampleReader(contents, err).read(), err, handler);
	}

	private InvalidMorphologyException buildInvalid(final String contents) {
		try {
			build(contents);
		} catch (final InvalidMorphologyException e) {
			return e;
		}
		fail("InvalidMorphologyException expected for: " + contents);
		return null;
	}

	@Test
	public void testIndexes() {
		final SampleGraph graph = build("1 1 0 0 0 1 -1\n2 3 0 1 0 1 1\n3 2 0 -1 0 1 1\n4 3 0 2 0 1 2\n");
		assertEquals(4, graph.size());
		assertTrue(graph.contains(3));
		assertFalse(graph.contains(5));
		assertEquals("Children in file order", List.of(2L, 3L), graph.getChildren(1));
		assertEquals(List.of(4L), graph.getChildren(2));
		assertEquals(0, graph.getChildCount(4));
		assertTrue(graph.getChildren(4).isEmpty());
		assertEquals(1, graph.getSomaSamples().size());
		assertEquals(1, graph.getRootSamples().size());
		assertTrue(handler.isEmpty());
	}

	@Test
	public void testForwardReferences() {
		final SampleGraph graph = build("3 3 0 2 0 1 2\n2 3 0 1 0 1 1\n1 1 0 0 0 1 -1\n");
		assertEquals(List.of(3L), graph.getChildren(2));
		assertEquals(List.of(2L), graph.getChildren(1));
		assertEquals("Insertion order is file order", 3, graph.getSamples().iterator().next().id());
	}

	@Test
	public void testUnsignedIds() {
		final long somaId = 3_000_000_000L;
		final SampleGraph graph = build("3000000000 1 0 0 0 1 -1\n4294967295 3 0 1 0 1 3000000000\n");
		assertTrue(graph.contains(somaId));
		assertEquals(List.of(Sample.MAX_ID), graph.getChildren(somaId));
		assertEquals(somaId, graph.get(Sample.MAX_ID).parentId());
		assertEquals(2, graph.size());
	}

	@Test
	public void testSelfParent() {
		final InvalidMorphologyException e = buildInvalid("1 1 0 0 0 1 -1\n2 3 0 0 0 1 2\n");
		assertEquals(ErrorKind.SELF_PARENT, e.getKind());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testRepeatedId() {
		final InvalidMorphologyException e = buildInvalid("1 1 0 0 0 1 -1\n2 3 0 1 0 1 1\n2 3 0 2 0 1 1\n");
		assertEquals(ErrorKind.REPEATED_ID, e.getKind());
		assertArrayEquals(new int[] { 2, 3 }, e.getLineNumbers());
	}

	@Test
	public void testMissingParent() {
		final InvalidMorphologyException e = buildInvalid("1 1 0 0 0 1 -1\n2 3 0 0 0 1 7\n");
		assertEquals(ErrorKind.MISSING_PARENT, e.getKind());
		assertEquals(2, e.getLineNumber());
		assertTrue(e.getMessage().contains("non-existent parent ID: 7"));
	}

	@Test
	public void testUnsupportedSectionTypes() {
		assertEquals(ErrorKind.UNSUPPORTED_SECTION_TYPE, buildInvalid("1 20 0 0 0 1 -1\n").getKind());
		assertEquals(ErrorKind.UNSUPPORTED_SECTION_TYPE, buildInvalid("1 0 0 0 0 1 -1\n").getKind());
		assertEquals(ErrorKind.UNSUPPORTED_SECTION_TYPE, buildInvalid("1 -3 0 0 0 1 -1\n").getKind());
		// custom types are accepted
		assertEquals(19, build("1 19 0 0 0 1 -1\n").get(1).type());
	}

	@Test
	public void testCycles() {
		final InvalidMorphologyException e = buildInvalid("1 1 0 0 0 1 -1\n2 3 0 0 0 1 3\n3 3 0 1 0 1 2\n");
		assertEquals(ErrorKind.CYCLIC_PARENTAGE, e.getKind());
		assertArrayEquals(new int[] { 2, 3 }, e.getLineNumbers());
	}

	@Test
	public void testWarnings() {
		build("1 1 0 0 0 0 -1\n2 3 0 1 0 1 1\n3 2 5 5 5 1 -1\n4 2 5 6 5 0 3\n");
		assertEquals(3, handler.getWarnings().size());
		assertEquals(2, handler.count(Warning.ZERO_DIAMETER));
		assertEquals(1, handler.count(Warning.DISCONNECTED_NEURITE));
		assertEquals("Warnings in file order", Warning.ZERO_DIAMETER, handler.getWarnings().get(0).kind());
		assertEquals(1, handler.getWarnings().get(0).lineNumber());
		assertEquals(Warning.DISCONNECTED_NEURITE, handler.getWarnings().get(1).kind());
		assertEquals(3, handler.getWarnings().get(1).lineNumber());
		assertTrue(handler.getWarnings().get(1).message().startsWith("graph.swc:3:warning"));
	}

	@Test
	public void testSampleChecksPrecedeMissingParents() {
		// the missing parent on line 1 is only detected after all samples were indexed
		final InvalidMorphologyException e = buildInvalid("1 3 0 0 0 1 9\n2 3 0 0 0 1 2\n");
		assertEquals(ErrorKind.SELF_PARENT, e.getKind());
	}

}
