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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

@SuppressWarnings("javadoc")
public class TestOverlapComputer {
	
	@BeforeEach
	public void initialize() {
		assertTrue(GeometryEngine.initialize());
	}
	
	@AfterEach
	public void shutdown() {
		GeometryEngine.shutdown();
	}
	
	private static Polygon rectangle(double minX, double minY, double maxX, double maxY) {
		return GeometryTools.envelopeToPolygon(new Envelope(minX, maxX, minY, maxY));
	}
	
	@Test
	public void test_overlap() {
		var result = OverlapComputer.computeOverlap(rectangle(0, 0, 10, 10), rectangle(5, 5, 10, 10));
		assertFalse(result.isEmpty());
		var geometry = result.getGeometry().orElseThrow();
		assertEquals(new Envelope(5, 10, 5, 10), geometry.getEnvelopeInternal());
		assertEquals(25, geometry.getArea(), 1e-12);
	}
	
	@Test
	public void test_noOverlap() {
		var result = OverlapComputer.computeOverlap(rectangle(0, 0, 1, 1), rectangle(5, 5, 6, 6));
		assertTrue(result.isEmpty());
		assertFalse(result.getGeometry().isPresent());
	}
	
	@Test
	public void test_missingPolygon() {
		var polygon = rectangle(0, 0, 1, 1);
		assertSame(OverlapResult.empty(), OverlapComputer.computeOverlap(polygon, null));
		assertSame(OverlapResult.empty(), OverlapComputer.computeOverlap(null, polygon));
		assertSame(OverlapResult.empty(), OverlapComputer.computeOverlap(null, null));
	}
	
	@Test
	public void test_sharedEdge() {
		// Touching rectangles give a non-empty (line) intersection
		var result = OverlapComputer.computeOverlap(rectangle(0, 0, 5, 5), rectangle(5, 0, 10, 5));
		assertFalse(result.isEmpty());
		assertEquals(1, result.getGeometry().orElseThrow().getDimension());
	}
	
	@Test
	public void test_contained() {
		var inner = rectangle(2, 3, 4, 5);
		var result = OverlapComputer.computeOverlap(rectangle(0, 0, 10, 10), inner);
		assertTrue(result.getGeometry().orElseThrow().equalsTopo(inner));
	}
	
	@Test
	public void test_resultFactory() {
		var factory = GeometryTools.getDefaultFactory();
		assertTrue(OverlapResult.of(factory.createPolygon()).isEmpty());
		assertThrows(NullPointerException.class, () -> OverlapResult.of(null));
	}
	
	@Test
	public void test_envelopeToPolygon() {
		var polygon = GeometryTools.envelopeToPolygon(new Envelope(1, 3, 2, 4));
		assertArrayEquals(new Coordinate[] {
				new Coordinate(1, 2), new Coordinate(3, 2), new Coordinate(3, 4), new Coordinate(1, 4), new Coordinate(1, 2)
		}, polygon.getCoordinates());
		assertThrows(IllegalArgumentException.class, () -> GeometryTools.envelopeToPolygon(new Envelope()));
	}

}
