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

import java.util.concurrent.atomic.AtomicInteger;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide access to the geometry library used for overlap calculations.
 * <p>
 * The engine has an explicit lifecycle: {@link #initialize()} must be called before any geometry 
 * operation, and {@link #shutdown()} afterwards. Operations requested outside this window fail with 
 * an {@link IllegalStateException}.
 * <p>
 * Initialization is reference counted, so that independent callers (e.g. pipelines running on different threads) 
 * can each hold the engine. It is only released once every {@link #initialize()} has been matched by a {@link #shutdown()}.
 * <p>
 * Availability is resolved once, when this class is loaded. It can be disabled by setting the system property 
 * {@code rasteroverlap.geometry=false}, in which case {@link #initialize()} returns false and callers are 
 * expected to skip overlap calculations altogether.
 */
public final class GeometryEngine {
	
	private static final Logger logger = LoggerFactory.getLogger(GeometryEngine.class);
	
	/**
	 * System property used to enable or disable the geometry engine.
	 */
	public static final String PROP_GEOMETRY = "rasteroverlap.geometry";
	
	private static final boolean AVAILABLE = resolveAvailability();
	
	private static final AtomicInteger users = new AtomicInteger(0);
	
	static {
		/*
		 * Use OverlayNG with floating precision by default, unless the user requests otherwise
		 */
		var overlay = System.getProperty("jts.overlay");
		if (overlay == null) {
			logger.debug("Setting -Djts.overlay=ng");
			System.setProperty("jts.overlay", "ng");
		}
		var relate = System.getProperty("jts.relate");
		if (relate == null) {
			logger.debug("Setting -Djts.relate=ng");
			System.setProperty("jts.relate", "ng");
		}
	}
	
	// Suppressed default constructor for non-instantiability
	private GeometryEngine() {
		throw new AssertionError();
	}
	
	private static boolean resolveAvailability() {
		String prop = System.getProperty(PROP_GEOMETRY);
		if (prop != null && "false".equalsIgnoreCase(prop.strip())) {
			logger.debug("Geometry engine disabled by system property {}", PROP_GEOMETRY);
			return false;
		}
		try {
			Class.forName("org.locationtech.jts.geom.Geometry", false, GeometryEngine.class.getClassLoader());
			return true;
		} catch (ClassNotFoundException e) {
			logger.debug("JTS not found on the classpath: {}", e.getMessage());
			return false;
		}
	}
	
	/**
	 * Query whether the geometry engine can be used in this process.
	 * @return
	 */
	public static boolean isAvailable() {
		return AVAILABLE;
	}
	
	/**
	 * Query whether at least one {@link #initialize()} call is still waiting for its matching {@link #shutdown()}.
	 * @return
	 */
	public static boolean isInitialized() {
		return users.get() > 0;
	}
	
	/**
	 * Initialize the engine, or register another user if it is already initialized.
	 * Each successful call should be paired with a call to {@link #shutdown()}.
	 * @return true if the engine is available and ready for use, false if it is not available
	 */
	public static boolean initialize() {
		if (!AVAILABLE) {
			logger.debug("Geometry engine requested, but not available");
			return false;
		}
		if (users.getAndIncrement() == 0)
			logger.debug("Geometry engine initialized (jts.overlay={})", System.getProperty("jts.overlay"));
		return true;
	}
	
	/**
	 * Release one use of the engine, shutting it down when no users remain.
	 * Calling this when not initialized has no effect.
	 */
	public static void shutdown() {
		int previous = users.getAndUpdate(n -> n > 0 ? n - 1 : 0);
		if (previous == 1)
			logger.debug("Geometry engine shut down");
	}
	
	private static void checkInitialized() {
		if (users.get() <= 0)
			throw new IllegalStateException("Geometry engine has not been initialized");
	}
	
	/**
	 * Compute the intersection of two geometries.
	 * @param a
	 * @param b
	 * @return
	 * @throws IllegalStateException if the engine has not been initialized
	 * @throws org.locationtech.jts.geom.TopologyException if the intersection could not be computed
	 */
	public static Geometry intersection(Geometry a, Geometry b) {
		checkInitialized();
		return a.intersection(b);
	}
	
	/**
	 * Compute the axis-aligned envelope of a geometry.
	 * @param geometry
	 * @return
	 * @throws IllegalStateException if the engine has not been initialized
	 */
	public static Envelope envelope(Geometry geometry) {
		checkInitialized();
		return new Envelope(geometry.getEnvelopeInternal());
	}
	
	/**
	 * Query whether a geometry is empty.
	 * @param geometry
	 * @return
	 * @throws IllegalStateException if the engine has not been initialized
	 */
	public static boolean isEmpty(Geometry geometry) {
		checkInitialized();
		return geometry.isEmpty();
	}

}
