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

import java.util.Collection;

/**
 * An immutable point in 3D space, always in real world coordinates.
 *
 * @param x the X-coordinate of the point
 * @param y the Y-coordinate of the point
 * @param z the Z-coordinate of the point
 */
public record MorphoPoint(double x, double y, double z) {

	public double distanceTo(final MorphoPoint other) {
		final double xd = x - other.x;
		final double yd = y - other.y;
		final double zd = z - other.z;
		return Math.sqrt(xd * xd + yd * yd + zd * zd);
	}

	/**
	 * Compares coordinates allowing for floating point noise.
	 *
	 * @param other the point to compare to
	 * @param tolerance the maximum absolute difference allowed on each axis
	 * @return true if all coordinates differ by less than tolerance
	 */
	public boolean equalsWithin(final MorphoPoint other, final double tolerance) {
		return other != null && Math.abs(x - other.x) < tolerance && Math.abs(y - other.y) < tolerance
				&& Math.abs(z - other.z) < tolerance;
	}

	/**
	 * Computes the average position of a collection of points.
	 *
	 * @param points the collection of points to average
	 * @return the average point, or null if the collection is null or empty
	 */
	public static MorphoPoint average(final Collection<MorphoPoint> points) {
		if (points == null || points.isEmpty())
			return null;
		double x = 0;
		double y = 0;
		double z = 0;
		int n = 0;
		for (final MorphoPoint p : points) {
			if (p != null) {
				x += p.x;
				y += p.y;
				z += p.z;
				n++;
			}
		}
		return (n == 0) ? null : new MorphoPoint(x / n, y / n, z / n);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ", " + z + ")";
	}
}
