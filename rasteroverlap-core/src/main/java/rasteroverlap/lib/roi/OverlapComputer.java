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

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compute the overlap between the extent polygons of two rasters.
 * <p>
 * {@link GeometryEngine#initialize()} must have been called first.
 */
public class OverlapComputer {
	
	private static final Logger logger = LoggerFactory.getLogger(OverlapComputer.class);
	
	// Suppressed default constructor for non-instantiability
	private OverlapComputer() {
		throw new AssertionError();
	}
	
	/**
	 * Intersect two extent polygons.
	 * <p>
	 * If either polygon is missing (because the raster had no valid pixels) the result is empty.
	 * A failure of the geometry operation is logged and also treated as an empty result.
	 * Any other non-empty intersection is returned, including a line or point where the extents only touch.
	 * 
	 * @param a extent of the first raster, or null
	 * @param b extent of the second raster, or null
	 * @return
	 * @throws IllegalStateException if the geometry engine has not been initialized
	 */
	public static OverlapResult computeOverlap(Polygon a, Polygon b) {
		if (a == null || b == null)
			return OverlapResult.empty();
		Geometry intersection;
		try {
			intersection = GeometryEngine.intersection(a, b);
		} catch (TopologyException | IllegalArgumentException e) {
			logger.warn("Unable to compute intersection: {}", e.getMessage());
			logger.debug(e.getMessage(), e);
			return OverlapResult.empty();
		}
		if (intersection == null || GeometryEngine.isEmpty(intersection))
			return OverlapResult.empty();
		return OverlapResult.of(intersection);
	}

}
