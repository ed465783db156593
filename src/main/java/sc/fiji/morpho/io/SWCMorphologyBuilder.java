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

import java.util.List;

import sc.fiji.morpho.CellFamily;
import sc.fiji.morpho.InvalidMorphologyException;
import sc.fiji.morpho.WarningHandler;
import sc.fiji.morpho.mut.MutableMorphology;
import sc.fiji.morpho.properties.FormatVersion;

/**
 * Builds a {@link MutableMorphology} from SWC samples: samples are indexed
 * and validated, the soma is classified and sections are assembled.
 * <p>
 * See <a href=
 * "http://www.neuronland.org/NLMorphologyConverter/MorphologyFormats/SWC/Spec.html">the
 * SWC format description</a>. Builders hold no state across calls to
 * {@link #build(List)} other than the path used in diagnostics.
 * </p>
 */
public class SWCMorphologyBuilder {

	private final ErrorMessages err;
	private final WarningHandler handler;

	/**
	 * @param path the file path or identifier used in diagnostics
	 * @param handler the channel receiving warnings
	 */
	public SWCMorphologyBuilder(final String path, final WarningHandler handler) {
		err = new ErrorMessages(path);
		this.handler = handler;
	}

	/**
	 * Parses and builds SWC text.
	 *
	 * @param contents the SWC data
	 * @return the assembled morphology
	 * @throws InvalidMorphologyException on the first fatal condition found
	 */
	public MutableMorphology build(final String contents) throws InvalidMorphologyException {
		return build(new SWCSampleReader(contents, err).read());
	}

	/**
	 * Builds a morphology from samples read by any front end.
	 *
	 * @param samples the samples, in file order
	 * @return the assembled morphology
	 * @throws InvalidMorphologyException on the first fatal condition found
	 */
	public MutableMorphology build(final List<Sample> samples) throws InvalidMorphologyException {
		final SampleGraph graph = SampleGraph.build(samples, err, handler);
		final MutableMorphology morphology = new MutableMorphology();
		new SomaClassifier(graph, err, handler).classify(morphology.getSoma());
		new SectionAssembler(graph, morphology, err, handler).assemble();
		morphology.setCellFamily(CellFamily.NEURON);
		morphology.setVersion(FormatVersion.SWC_1_0);
		return morphology;
	}
}
