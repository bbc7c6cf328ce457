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

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * Helper methods for creating Java Topology Suite geometries in geographic coordinates.
 */
public class GeometryTools {
	
	/**
	 * Geographic coordinates need full double precision, unlike pixel coordinates.
	 */
	private static final GeometryFactory DEFAULT_FACTORY = new GeometryFactory(
			new PrecisionModel(PrecisionModel.FLOATING),
			0);
	
	// Suppressed default constructor for non-instantiability
	private GeometryTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the default GeometryFactory used to construct geometries.
	 * @return
	 */
	public static GeometryFactory getDefaultFactory() {
		return DEFAULT_FACTORY;
	}
	
	/**
	 * Create a polygon from the four corners of a quadrilateral, given in ring order.
	 * The ring is closed by repeating the first corner.
	 * @param c0
	 * @param c1
	 * @param c2
	 * @param c3
	 * @return a polygon with exactly 5 exterior ring coordinates
	 */
	public static Polygon createQuadrilateral(Coordinate c0, Coordinate c1, Coordinate c2, Coordinate c3) {
		var coords = new Coordinate[] {
				Objects.requireNonNull(c0).copy(),
				Objects.requireNonNull(c1).copy(),
				Objects.requireNonNull(c2).copy(),
				Objects.requireNonNull(c3).copy(),
				c0.copy()
		};
		return DEFAULT_FACTORY.createPolygon(coords);
	}
	
	/**
	 * Create a rectangular polygon for an envelope.
	 * The ring starts at the minimum corner and proceeds 
	 * {@code (minX,minY) -> (maxX,minY) -> (maxX,maxY) -> (minX,maxY) -> (minX,minY)}.
	 * @param envelope
	 * @return
	 * @throws IllegalArgumentException if the envelope is null (i.e. empty)
	 */
	public static Polygon envelopeToPolygon(Envelope envelope) {
		if (envelope == null || envelope.isNull())
			throw new IllegalArgumentException("Cannot create a polygon for an empty envelope");
		return createQuadrilateral(
				new Coordinate(envelope.getMinX(), envelope.getMinY()),
				new Coordinate(envelope.getMaxX(), envelope.getMinY()),
				new Coordinate(envelope.getMaxX(), envelope.getMaxY()),
				new Coordinate(envelope.getMinX(), envelope.getMaxY())
				);
	}

}
