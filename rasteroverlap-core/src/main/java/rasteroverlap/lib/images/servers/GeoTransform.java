/*-
 * #%L
 * This file is part of RasterOverlap.
 * %%
 * Copyright (C) 2025 RasterOverlap developers
 * %%
 * RasterOverlap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * RasterOverlap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with RasterOverlap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package rasteroverlap.lib.images.servers;

import java.util.Arrays;
import java.util.Locale;

import rasteroverlap.lib.common.GeneralTools;

/**
 * Six-parameter affine transform from pixel to geographic coordinates.
 * <p>
 * Coefficients are stored in the order {@code [originX, pixelWidth, rowRotation, originY, columnRotation, pixelHeight]}, 
 * so that for pixel (x, y) measured from the top left corner of the image:
 * <pre>
 *   geoX = t[0] + x * t[1] + y * t[2]
 *   geoY = t[3] + x * t[4] + y * t[5]
 * </pre>
 * This matches the ordering used by GDAL.
 */
public class GeoTransform {
	
	private final double[] coefficients;
	
	private GeoTransform(double[] coefficients) {
		this.coefficients = coefficients;
	}
	
	/**
	 * Create a transform from six coefficients in GDAL order.
	 * @param coefficients
	 * @return
	 * @throws IllegalArgumentException if the array does not contain exactly 6 finite values
	 */
	public static GeoTransform create(double... coefficients) {
		if (coefficients == null || coefficients.length != 6)
			throw new IllegalArgumentException("An affine transform requires exactly 6 coefficients, but got " + 
					(coefficients == null ? "null" : coefficients.length));
		for (double c : coefficients) {
			if (!Double.isFinite(c))
				throw new IllegalArgumentException("Affine transform coefficients must be finite: " + Arrays.toString(coefficients));
		}
		return new GeoTransform(coefficients.clone());
	}
	
	/**
	 * Create a transform with no rotation terms.
	 * @param originX x coordinate of the top left corner of the top left pixel
	 * @param originY y coordinate of the top left corner of the top left pixel
	 * @param pixelWidth
	 * @param pixelHeight usually negative for north-up images
	 * @return
	 */
	public static GeoTransform createNorthUp(double originX, double originY, double pixelWidth, double pixelHeight) {
		return create(originX, pixelWidth, 0, originY, 0, pixelHeight);
	}
	
	/**
	 * Get the x coordinate for the specified pixel position.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getGeoX(double x, double y) {
		return coefficients[0] + x * coefficients[1] + y * coefficients[2];
	}

	/**
	 * Get the y coordinate for the specified pixel position.
	 * @param x
	 * @param y
	 * @return
	 */
	public double getGeoY(double x, double y) {
		return coefficients[3] + x * coefficients[4] + y * coefficients[5];
	}
	
	/**
	 * Get coefficient i, in GDAL order.
	 * @param i
	 * @return
	 */
	public double get(int i) {
		return coefficients[i];
	}
	
	/**
	 * Get a copy of the six coefficients, in GDAL order.
	 * @return
	 */
	public double[] getCoefficients() {
		return coefficients.clone();
	}
	
	/**
	 * Returns true if either rotation (shear) term is non-zero.
	 * In this case, a rectangle in pixel space is not axis-aligned in geographic space.
	 * @return
	 */
	public boolean hasRotation() {
		return coefficients[2] != 0 || coefficients[4] != 0;
	}
	
	@Override
	public String toString() {
		return "[" + GeneralTools.arrayToString(Locale.US, coefficients, ", ", 10) + "]";
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(coefficients);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof GeoTransform))
			return false;
		return Arrays.equals(coefficients, ((GeoTransform)obj).coefficients);
	}

}
