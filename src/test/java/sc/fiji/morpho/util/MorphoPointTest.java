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

package sc.fiji.morpho.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

/**
 * Tests for {@link MorphoPoint}
 */
public class MorphoPointTest {

	private final double precision = 1e-12;

	@Test
	public void testDistance() {
		final MorphoPoint a = new MorphoPoint(1, 2, 3);
		final MorphoPoint b = new MorphoPoint(4, 6, 3);
		assertEquals(5, a.distanceTo(b), precision);
		assertEquals(0, a.distanceTo(a), precision);
	}

	@Test
	public void testAverage() {
		final MorphoPoint center = MorphoPoint.average(
				List.of(new MorphoPoint(0, 0, 0), new MorphoPoint(2, 4, 0), new MorphoPoint(4, 2, 6)));
		assertTrue(center.equalsWithin(new MorphoPoint(2, 2, 2), precision));
		assertNull("Empty collection", MorphoPoint.average(List.of()));
	}

	@Test
	public void testEqualsWithin() {
		final MorphoPoint p = new MorphoPoint(1, 1, 1);
		assertTrue(p.equalsWithin(new MorphoPoint(1 + 1e-9, 1, 1), 1e-6));
		assertFalse(p.equalsWithin(new MorphoPoint(1.1, 1, 1), 1e-6));
	}

}
