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
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasteroverlap.lib.common.LogTools;
import rasteroverlap.lib.images.servers.GeoTransform;
import rasteroverlap.lib.regions.GeoBoundingBox;
import rasteroverlap.lib.regions.PixelBoundingBox;

/**
 * Build a closed polygon representing the extent of valid pixels in geographic coordinates.
 * <p>
 * The polygon is always the rectangle of the pixel bounding box, not the outline of the valid pixels. 
 * Only the upper left and lower right corners are projected, so if the transform contains rotation terms the 
 * result is a rectangle aligned with the geographic axes rather than with the pixel grid. 
 * This is a known approximation: the extent for rotated rasters is not exact.
 */
public class ExtentPolygonBuilder {
	
	private static final Logger logger = LoggerFactory.getLogger(ExtentPolygonBuilder.class);
	
	// Suppressed default constructor for non-instantiability
	private ExtentPolygonBuilder() {
		throw new AssertionError();
	}
	
	/**
	 * Project the corners of a pixel bounding box.
	 * The upper left corner is {@code (minX, minY)} and the lower right corner is {@code (maxX+1, maxY+1)}, 
	 * so that the box covers the full area of the last valid column and row.
	 * 
	 * @param box the pixel bounding box, with inclusive limits
	 * @param height the image height, used only if there is no transform
	 * @param transform the affine transform, or null if the raster is not georeferenced
	 * @return
	 */
	public static GeoBoundingBox project(PixelBoundingBox box, int height, GeoTransform transform) {
		var upperLeft = AffineProjector.project(box.getMinX(), box.getMinY(), transform, height);
		var lowerRight = AffineProjector.project(box.getMaxX() + 1, box.getMaxY() + 1, transform, height);
		return GeoBoundingBox.createInstance(upperLeft, lowerRight);
	}
	
	/**
	 * Build the extent polygon for a pixel bounding box.
	 * @param box the pixel bounding box, with inclusive limits
	 * @param width the image width
	 * @param height the image height, used only if there is no transform
	 * @param transform the affine transform, or null if the raster is not georeferenced
	 * @return a polygon with exactly 5 coordinates, ordered 
	 *         {@code (ulx,uly) -> (lrx,uly) -> (lrx,lry) -> (ulx,lry) -> (ulx,uly)}
	 */
	public static Polygon build(PixelBoundingBox box, int width, int height, GeoTransform transform) {
		if (box.getMaxX() >= width || box.getMaxY() >= height)
			logger.warn("Pixel bounds {} extend beyond the image size {}x{}", box, width, height);
		if (transform != null && transform.hasRotation())
			LogTools.warnOnce(logger, "Affine transform has rotation terms - extent polygons will not follow the rotated pixel grid");
		return build(project(box, height, transform));
	}
	
	/**
	 * Build the extent polygon for projected corners.
	 * @param bounds
	 * @return a polygon with exactly 5 coordinates, ordered 
	 *         {@code (ulx,uly) -> (lrx,uly) -> (lrx,lry) -> (ulx,lry) -> (ulx,uly)}
	 */
	public static Polygon build(GeoBoundingBox bounds) {
		double ulx = bounds.getUpperLeftX();
		double uly = bounds.getUpperLeftY();
		double lrx = bounds.getLowerRightX();
		double lry = bounds.getLowerRightY();
		return GeometryTools.createQuadrilateral(
				new Coordinate(ulx, uly),
				new Coordinate(lrx, uly),
				new Coordinate(lrx, lry),
				new Coordinate(ulx, lry)
				);
	}

}
