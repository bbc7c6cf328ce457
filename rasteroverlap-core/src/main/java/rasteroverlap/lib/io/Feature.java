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

package rasteroverlap.lib.io;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.locationtech.jts.geom.Geometry;

/**
 * A GeoJSON feature: a geometry with a map of properties.
 */
public class Feature {
	
	private final Geometry geometry;
	private final Map<String, Object> properties;
	
	private Feature(Geometry geometry, Map<String, ?> properties) {
		this.geometry = Objects.requireNonNull(geometry, "Feature geometry must not be null");
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
	}
	
	/**
	 * Create a feature with a single {@code name} property.
	 * @param name
	 * @param geometry
	 * @return
	 */
	public static Feature create(String name, Geometry geometry) {
		return new Feature(geometry, Map.of("name", name));
	}
	
	/**
	 * Create a feature with arbitrary properties.
	 * Property iteration order is retained when writing.
	 * @param geometry
	 * @param properties
	 * @return
	 */
	public static Feature create(Geometry geometry, Map<String, ?> properties) {
		return new Feature(geometry, properties);
	}
	
	/**
	 * Get the feature geometry.
	 * @return
	 */
	public Geometry getGeometry() {
		return geometry;
	}
	
	/**
	 * Get an unmodifiable view of the properties.
	 * @return
	 */
	public Map<String, Object> getProperties() {
		return properties;
	}
	
	/**
	 * Get the {@code name} property, or null if it is not set.
	 * @return
	 */
	public String getName() {
		var name = properties.get("name");
		return name == null ? null : name.toString();
	}
	
	@Override
	public String toString() {
		return "Feature[" + properties + ", " + geometry.getGeometryType() + "]";
	}

}
