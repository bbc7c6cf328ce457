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

import java.util.Objects;
import java.util.Optional;

import org.locationtech.jts.geom.Geometry;

/**
 * Result of intersecting two extent polygons.
 * This is either empty or holds a non-empty geometry.
 */
public class OverlapResult {
	
	private static final OverlapResult EMPTY = new OverlapResult(null);
	
	private final Geometry geometry;
	
	private OverlapResult(Geometry geometry) {
		this.geometry = geometry;
	}
	
	/**
	 * Get the empty result.
	 * @return
	 */
	public static OverlapResult empty() {
		return EMPTY;
	}
	
	/**
	 * Create a result for an intersection geometry.
	 * @param geometry
	 * @return an empty result if the geometry is empty
	 */
	public static OverlapResult of(Geometry geometry) {
		Objects.requireNonNull(geometry);
		if (geometry.isEmpty())
			return EMPTY;
		return new OverlapResult(geometry);
	}
	
	/**
	 * Query if there is no overlap.
	 * @return
	 */
	public boolean isEmpty() {
		return geometry == null;
	}
	
	/**
	 * Get the overlap geometry, if present.
	 * @return
	 */
	public Optional<Geometry> getGeometry() {
		return Optional.ofNullable(geometry);
	}
	
	@Override
	public String toString() {
		if (geometry == null)
			return "OverlapResult[empty]";
		return "OverlapResult[" + geometry.getGeometryType() + ", area=" + geometry.getArea() + "]";
	}

}
