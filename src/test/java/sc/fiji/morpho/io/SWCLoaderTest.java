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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scijava.log.LogService;
import org.scijava.log.StderrLogService;

import sc.fiji.morpho.CellFamily;
import sc.fiji.morpho.CollectingWarningHandler;
import sc.fiji.morpho.ErrorKind;
import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.ModifierOption;
import sc.fiji.morpho.MorphoUtils;
import sc.fiji.morpho.SomaType;
import sc.fiji.morpho.Warning;
import sc.fiji.morpho.properties.FormatVersion;
import sc.fiji.morpho.properties.Properties;

/**
 * Tests for {@link SWCLoader}
 */
public class SWCLoaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testSuccess() throws IOException {
		final LoadResult result = SWCLoader.load("neuron.swc", SectionAssemblerTest.readResource("neuron.swc"),
				ModifierOption.NO_MODIFIER);
		assertTrue(result.isSuccess());
		final Properties props = result.getProperties();
		assertEquals(4, props.getSectionCount());
		assertEquals(CellFamily.NEURON, props.getCellFamily());
		assertEquals(FormatVersion.SWC_1_0, props.getVersion());
		assertEquals("swc", props.getVersion().name());
		assertEquals(1, props.getVersion().major());
		assertEquals(0, props.getVersion().minor());
		assertTrue(result.getWarnings().isEmpty());
		assertSame(props, result.orElseThrow());
	}

	@Test
	public void testFailure() {
		final LoadResult result = SWCLoader.load("broken.swc", "1 1 0 0 0 0 -1\n2 3 0 1 0 1 9\n",
				ModifierOption.NO_MODIFIER);
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.MISSING_PARENT, result.getError().getKind());
		assertEquals(2, result.getError().getLineNumber());
		assertTrue(result.getError().getMessage().startsWith("broken.swc:2:error"));
		assertEquals("Warnings emitted before the error are kept", 1, result.getWarnings().size());
		assertEquals(Warning.ZERO_DIAMETER, result.getWarnings().get(0).kind());
		try {
			result.getProperties();
			fail("IllegalStateException expected");
		} catch (final IllegalStateException expected) {
			// failed result holds no properties
		}
		try {
			result.orElseThrow();
			fail("InvalidMorphologyException expected");
		} catch (final InvalidMorphologyException e) {
			assertSame(result.getError(), e);
		}
	}

	@Test
	public void testWarningsOnSuccess() {
		final LoadResult result = SWCLoader.load("warn.swc",
				"1 1 0 0 0 1 -1\n2 1 0 -2 0 1 1\n3 1 0 1 0 1 1\n4 3 0 3 0 0 1\n", ModifierOption.NO_MODIFIER);
		assertTrue(result.isSuccess());
		assertEquals(2, result.getWarnings().size());
		assertEquals(Warning.ZERO_DIAMETER, result.getWarnings().get(0).kind());
		assertEquals(Warning.SOMA_NON_CONFORM, result.getWarnings().get(1).kind());
	}

	@Test
	public void testEmptyFile() {
		final LoadResult result = SWCLoader.load("empty.swc", "# no samples\n", ModifierOption.NO_MODIFIER);
		assertTrue(result.isSuccess());
		assertEquals(0, result.getProperties().getSectionCount());
		assertEquals(SomaType.UNDEFINED, result.getProperties().getSomaType());
	}

	@Test
	public void testLoadFile() throws IOException {
		final File file = folder.newFile("neuron.swc");
		FileUtils.writeStringToFile(file, SectionAssemblerTest.readResource("neuron.swc"), StandardCharsets.UTF_8);
		final LoadResult result = SWCLoader.load(file, ModifierOption.NO_MODIFIER);
		assertTrue(result.isSuccess());
		assertEquals(11, result.getProperties().getPoints().size());
	}

	@Test
	public void testErrorMessageNamesFile() throws IOException {
		final File file = folder.newFile("bad.swc");
		FileUtils.writeStringToFile(file, "1 1 0 0 0 1 -1\n1 3 0 1 0 1 -1\n", StandardCharsets.UTF_8);
		final LoadResult result = SWCLoader.load(file, ModifierOption.NO_MODIFIER);
		assertEquals(ErrorKind.REPEATED_ID, result.getError().getKind());
		assertTrue(result.getError().getMessage().startsWith(file.getAbsolutePath() + ":2:error"));
	}

	@Test
	public void testModifiers() throws IOException {
		final LoadResult result = SWCLoader.load("neuron.swc", SectionAssemblerTest.readResource("neuron.swc"),
				ModifierOption.TWO_POINTS_SECTIONS | ModifierOption.NRN_ORDER);
		final Properties props = result.getProperties();
		assertEquals("Axon sorted first", 2, props.getSectionType(0).code());
		assertEquals(8, props.getPoints().size());
	}

	@Test
	public void testUnsignedIds() {
		final LoadResult result = SWCLoader.load("big.swc",
				"3000000000 1 0 0 0 1 -1\n3000000001 3 0 1 0 1 3000000000\n4294967295 3 0 2 0 1 3000000001\n",
				ModifierOption.NO_MODIFIER);
		assertTrue(result.isSuccess());
		assertEquals(1, result.getProperties().getSectionCount());
		assertEquals(3, result.getProperties().getPoints().size());

		final LoadResult tooLarge = SWCLoader.load("big.swc", "4294967296 1 0 0 0 1 -1\n",
				ModifierOption.NO_MODIFIER);
		assertEquals(ErrorKind.LINE_NON_PARSABLE, tooLarge.getError().getKind());
	}

	@Test
	public void testStagesLoggedInDebugMode() throws IOException {
		final LogService service = new StderrLogService();
		final List<String> messages = new ArrayList<>();
		service.addLogListener(message -> messages.add(message.text()));
		MorphoUtils.setLogService(service);
		MorphoUtils.setDebugMode(true);
		try {
			SWCLoader.loadMutable("neuron.swc", SectionAssemblerTest.readResource("neuron.swc"),
					ModifierOption.NRN_ORDER, new CollectingWarningHandler());
		} finally {
			MorphoUtils.setDebugMode(false);
			MorphoUtils.setLogService(null);
		}
		assertTrue(messages.stream().anyMatch(m -> m.startsWith("SWCLoader: ") && m.contains("read neuron.swc")));
		assertTrue(messages.stream().anyMatch(m -> m.startsWith("SWCLoader: Applied NRN_ORDER")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownModifier() {
		SWCLoader.load("neuron.swc", "1 1 0 0 0 1 -1\n", 64);
	}

}
