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

package rasteroverlap.lib.regions;

import java.util.Locale;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import rasteroverlap.lib.common.GeneralTools;

/**
 * Bounding box in geographic coordinates, defined by the projected upper left and lower right corners 
 * of a {@link PixelBoundingBox}.
 * <p>
 * The corners are stored as projected. Depending upon the sign of the pixel height, the 'upper' y value 
 * may be smaller or larger than the 'lower' one; use {@link #toEnvelope()} for normalized limits.
 */
public class GeoBoundingBox {
	
	private final double ulx, uly, lrx, lry;
	
	private GeoBoundingBox(double ulx, double uly, double lrx, double lry) {
		this.ulx = ulx;
		this.uly = uly;
		this.lrx = lrx;
		this.lry = lry;
	}
	
	/**
	 * Create a box from projected corners.
	 * @param upperLeft projection of the upper left pixel corner
	 * @param lowerRight projection of the exclusive lower right pixel corner
	 * @return
	 */
	public static GeoBoundingBox createInstance(Coordinate upperLeft, Coordinate lowerRight) {
		return new GeoBoundingBox(upperLeft.x, upperLeft.y, lowerRight.x, lowerRight.y);
	}
	
	/**
	 * x coordinate of the upper left corner.
	 * @return
	 */
	public double getUpperLeftX() {
		return ulx;
	}

	/**
	 * y coordinate of the upper left corner.
	 * @return
	 */
	public double getUpperLeftY() {
		return uly;
	}

	/**
	 * x coordinate of the lower right corner.
	 * @return
	 */
	public double getLowerRightX() {
		return lrx;
	}

	/**
	 * y coordinate of the lower right corner.
	 * @return
	 */
	public double getLowerRightY() {
		return lry;
	}
	
	/**
	 * Minimum x value of the two corners.
	 * @return
	 */
	public double getMinX() {
		return Math.min(ulx, lrx);
	}

	/**
	 * Minimum y value of the two corners.
	 * @return
	 */
	public double getMinY() {
		return Math.min(uly, lry);
	}

	/**
	 * Maximum x value of the two corners.
	 * @return
	 */
	public double getMaxX() {
		return Math.max(ulx, lrx);
	}

	/**
	 * Maximum y value of the two corners.
	 * @return
	 */
	public double getMaxY() {
		return Math.max(uly, lry);
	}
	
	/**
	 * Convert to a JTS envelope.
	 * @return
	 */
	public Envelope toEnvelope() {
		return new Envelope(ulx, lrx, uly, lry);
	}
	
	@Override
	public String toString() {
		return "[" + format(ulx) + "," + format(uly) + "] - [" + format(lrx) + "," + format(lry) + "]";
	}
	
	private static String format(double value) {
		return GeneralTools.formatNumber(Locale.US, value, 6);
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(ulx);
		result = 31 * result + Double.hashCode(uly);
		result = 31 * result + Double.hashCode(lrx);
		result = 31 * result + Double.hashCode(lry);
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof GeoBoundingBox))
			return false;
		GeoBoundingBox other = (GeoBoundingBox) obj;
		return Double.compare(ulx, other.ulx) == 0 && Double.compare(uly, other.uly) == 0
				&& Double.compare(lrx, other.lrx) == 0 && Double.compare(lry, other.lry) == 0;
	}

}
