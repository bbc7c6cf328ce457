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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasteroverlap.lib.roi.GeometryEngine;
import rasteroverlap.lib.roi.GeometryTools;
import rasteroverlap.lib.roi.OverlapResult;

/**
 * Write an overlap result as a GeoJSON FeatureCollection.
 * <p>
 * An empty result gives a collection with no features. Otherwise the collection contains a single feature named 
 * {@value #FEATURE_NAME}, whose polygon is the axis-aligned envelope of the overlap geometry 
 * rather than its exact outline.
 */
public class GeoJsonSerializer {
	
	private static final Logger logger = LoggerFactory.getLogger(GeoJsonSerializer.class);
	
	/**
	 * Value of the {@code name} property of the overlap feature.
	 */
	public static final String FEATURE_NAME = "Intersection Area";
	
	// Suppressed default constructor for non-instantiability
	private GeoJsonSerializer() {
		throw new AssertionError();
	}
	
	/**
	 * Get the polygon that is written for an overlap result, i.e. its envelope.
	 * @param result
	 * @return the envelope polygon, or null if the result is empty
	 * @throws IllegalStateException if the geometry engine has not been initialized
	 */
	public static Polygon envelopeOf(OverlapResult result) {
		var geometry = result.getGeometry().orElse(null);
		if (geometry == null)
			return null;
		var envelope = GeometryEngine.envelope(geometry);
		return GeometryTools.envelopeToPolygon(envelope);
	}
	
	/**
	 * Create the feature collection for an overlap result.
	 * @param result
	 * @return
	 */
	public static FeatureCollection toFeatureCollection(OverlapResult result) {
		var envelope = envelopeOf(result);
		if (envelope == null)
			return FeatureCollection.empty();
		return FeatureCollection.wrap(Collections.singletonList(Feature.create(FEATURE_NAME, envelope)));
	}
	
	/**
	 * Serialize an overlap result as a GeoJSON string, with 4-space indentation.
	 * @param result
	 * @return
	 */
	public static String serialize(OverlapResult result) {
		return serialize(toFeatureCollection(result));
	}
	
	/**
	 * Serialize a feature collection as a GeoJSON string, with 4-space indentation.
	 * @param collection
	 * @return
	 */
	public static String serialize(FeatureCollection collection) {
		return GsonTools.toJson(collection, GsonTools.DEFAULT_INDENT);
	}
	
	/**
	 * Write a document to a file using UTF-8, replacing any existing file.
	 * @param path
	 * @param document
	 * @throws IOException
	 */
	public static void writeDocument(Path path, String document) throws IOException {
		var parent = path.toAbsolutePath().getParent();
		if (parent != null && !Files.isDirectory(parent))
			Files.createDirectories(parent);
		Files.writeString(path, document, StandardCharsets.UTF_8);
		logger.debug("Written {} characters to {}", document.length(), path);
	}
	
	/**
	 * Read a GeoJSON feature collection from a file.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static FeatureCollection readFeatureCollection(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return GsonTools.getInstance().fromJson(reader, FeatureCollection.class);
		}
	}

}
