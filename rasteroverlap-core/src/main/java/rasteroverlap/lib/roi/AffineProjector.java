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

package rasteroverlap.lib.roi;

import org.locationtech.jts.geom.Coordinate;

import rasteroverlap.lib.images.servers.GeoTransform;

/**
 * Convert pixel coordinates to geographic coordinates.
 * <p>
 * Pixel coordinates are measured from the top left corner of the image, so that (0, 0) is the 
 * top left corner of the first pixel.
 */
public class AffineProjector {
	
	// Suppressed default constructor for non-instantiability
	private AffineProjector() {
		throw new AssertionError();
	}
	
	/**
	 * Project a pixel coordinate.
	 * <p>
	 * If a transform is available, the standard affine mapping is applied. Otherwise x is unchanged and 
	 * y is flipped using the image height, i.e. {@code (x, height - y)}, so that ungeoreferenced rasters 
	 * still give a y-up coordinate space.
	 * 
	 * @param x pixel x coordinate
	 * @param y pixel y coordinate
	 * @param transform the affine transform, or null if the raster is not georeferenced
	 * @param height the image height, used only when there is no transform
	 * @return the projected coordinate
	 */
	public static Coordinate project(double x, double y, GeoTransform transform, int height) {
		if (transform == null)
			return new Coordinate(x, height - y);
		return new Coordinate(transform.getGeoX(x, y), transform.getGeoY(x, y));
	}

}
