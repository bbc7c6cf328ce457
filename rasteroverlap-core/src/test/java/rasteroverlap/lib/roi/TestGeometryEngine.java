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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

@SuppressWarnings("javadoc")
public class TestGeometryEngine {
	
	@AfterEach
	public void shutdown() {
		GeometryEngine.shutdown();
	}
	
	@Test
	public void test_lifecycle() {
		assertTrue(GeometryEngine.isAvailable());
		GeometryEngine.shutdown();
		assertFalse(GeometryEngine.isInitialized());
		
		assertTrue(GeometryEngine.initialize());
		assertTrue(GeometryEngine.isInitialized());
		// A second user keeps the engine alive until both have shut down
		assertTrue(GeometryEngine.initialize());
		assertTrue(GeometryEngine.isInitialized());
		
		GeometryEngine.shutdown();
		assertTrue(GeometryEngine.isInitialized());
		GeometryEngine.shutdown();
		assertFalse(GeometryEngine.isInitialized());
		// Unmatched shutdown is harmless, and does not leave a negative count behind
		GeometryEngine.shutdown();
		assertFalse(GeometryEngine.isInitialized());
		assertTrue(GeometryEngine.initialize());
		assertTrue(GeometryEngine.isInitialized());
	}
	
	@Test
	public void test_operationsWhileAnotherUserShutsDown() {
		assertTrue(GeometryEngine.initialize());
		assertTrue(GeometryEngine.initialize());
		GeometryEngine.shutdown();
		var polygon = GeometryTools.envelopeToPolygon(new Envelope(0, 1, 0, 1));
		assertEquals(new Envelope(0, 1, 0, 1), GeometryEngine.envelope(polygon));
		GeometryEngine.shutdown();
		assertThrows(IllegalStateException.class, () -> GeometryEngine.envelope(polygon));
	}
	
	@Test
	public void test_requiresInitialization() {
		GeometryEngine.shutdown();
		var polygon = GeometryTools.envelopeToPolygon(new Envelope(0, 1, 0, 1));
		assertThrows(IllegalStateException.class, () -> GeometryEngine.intersection(polygon, polygon));
		assertThrows(IllegalStateException.class, () -> GeometryEngine.envelope(polygon));
		assertThrows(IllegalStateException.class, () -> GeometryEngine.isEmpty(polygon));
	}
	
	@Test
	public void test_operations() {
		GeometryEngine.initialize();
		var a = GeometryTools.envelopeToPolygon(new Envelope(0, 10, 0, 10));
		var b = GeometryTools.envelopeToPolygon(new Envelope(5, 20, -5, 5));
		var intersection = GeometryEngine.intersection(a, b);
		assertFalse(GeometryEngine.isEmpty(intersection));
		assertEquals(new Envelope(5, 10, 0, 5), GeometryEngine.envelope(intersection));
		assertEquals(25, intersection.getArea(), 1e-12);
	}
	
	@Test
	public void test_overlayDefaults() {
		// Accessing the engine ensures the static initializer has run
		GeometryEngine.isAvailable();
		assertTrue(System.getProperty("jts.overlay") != null);
		assertTrue(System.getProperty("jts.relate") != null);
	}

}
