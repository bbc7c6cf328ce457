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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import rasteroverlap.lib.roi.GeometryTools;

/**
 * Type adapters for writing and reading GeoJSON.
 * <p>
 * Keys are written in a fixed order: {@code type, features} for a collection and 
 * {@code type, properties, geometry} for a feature. Coordinates are written as JSON numbers at full precision.
 */
class GeoJsonTypeAdapters {
	
	static final TypeAdapter<Geometry> GEOMETRY_ADAPTER_INSTANCE = new GeometryTypeAdapter();
	static final TypeAdapter<Feature> FEATURE_ADAPTER_INSTANCE = new FeatureTypeAdapter();
	static final TypeAdapter<FeatureCollection> FEATURE_COLLECTION_ADAPTER_INSTANCE = new FeatureCollectionTypeAdapter();
	
	private static final Gson gson = new Gson();
	
	
	static class GeometryTypeAdapter extends TypeAdapter<Geometry> {

		@Override
		public void write(JsonWriter out, Geometry geometry) throws IOException {
			if (geometry == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			writeGeometry(geometry, out);
			out.endObject();
		}

		@Override
		public Geometry read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			if (obj == null)
				return null;
			return parseGeometry(obj, GeometryTools.getDefaultFactory());
		}
		
	}
	
	
	static class FeatureTypeAdapter extends TypeAdapter<Feature> {

		@Override
		public void write(JsonWriter out, Feature feature) throws IOException {
			out.beginObject();
			out.name("type");
			out.value("Feature");
			out.name("properties");
			out.beginObject();
			for (var entry : feature.getProperties().entrySet()) {
				out.name(entry.getKey());
				var value = entry.getValue();
				if (value == null)
					out.nullValue();
				else if (value instanceof Number)
					out.value((Number)value);
				else if (value instanceof Boolean)
					out.value((Boolean)value);
				else
					out.value(value.toString());
			}
			out.endObject();
			out.name("geometry");
			GEOMETRY_ADAPTER_INSTANCE.write(out, feature.getGeometry());
			out.endObject();
		}

		@Override
		public Feature read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			return parseFeature(obj);
		}
		
	}
	
	
	static class FeatureCollectionTypeAdapter extends TypeAdapter<FeatureCollection> {

		@Override
		public void write(JsonWriter out, FeatureCollection collection) throws IOException {
			out.beginObject();
			out.name("type");
			out.value("FeatureCollection");
			out.name("features");
			out.beginArray();
			for (var feature : collection.getFeatures())
				FEATURE_ADAPTER_INSTANCE.write(out, feature);
			out.endArray();
			out.endObject();
		}

		@Override
		public FeatureCollection read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			if (obj == null || !obj.has("type") || !"FeatureCollection".equals(obj.get("type").getAsString()))
				throw new JsonParseException("Expected a FeatureCollection, but got " + obj);
			List<Feature> features = new ArrayList<>();
			if (obj.has("features")) {
				for (var element : obj.getAsJsonArray("features"))
					features.add(parseFeature(element.getAsJsonObject()));
			}
			return FeatureCollection.wrap(features);
		}
		
	}
	
	
	static Feature parseFeature(JsonObject obj) {
		if (obj == null || !obj.has("geometry") || !obj.get("geometry").isJsonObject())
			throw new JsonParseException("Feature has no geometry: " + obj);
		var geometry = parseGeometry(obj.getAsJsonObject("geometry"), GeometryTools.getDefaultFactory());
		Map<String, Object> properties = new LinkedHashMap<>();
		if (obj.has("properties") && obj.get("properties").isJsonObject()) {
			for (Map.Entry<String, JsonElement> entry : obj.getAsJsonObject("properties").entrySet()) {
				var value = entry.getValue();
				if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber())
					properties.put(entry.getKey(), value.getAsDouble());
				else if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean())
					properties.put(entry.getKey(), value.getAsBoolean());
				else if (value.isJsonPrimitive())
					properties.put(entry.getKey(), value.getAsString());
				else if (!value.isJsonNull())
					properties.put(entry.getKey(), value.toString());
			}
		}
		return Feature.create(geometry, properties);
	}
	
	
	static void writeGeometry(Geometry geometry, JsonWriter out) throws IOException {
		out.name("type");
		out.value(geometry.getGeometryType());

		if (Geometry.TYPENAME_GEOMETRYCOLLECTION.equals(geometry.getGeometryType())) {
			out.name("geometries");
			out.beginArray();
			for (int i = 0; i < geometry.getNumGeometries(); i++) {
				out.beginObject();
				writeGeometry(geometry.getGeometryN(i), out);
				out.endObject();
			}
			out.endArray();
		} else {
			out.name("coordinates");
			writeCoordinates(geometry, out);
		}
	}

	static void writeCoordinates(Geometry geometry, JsonWriter out) throws IOException {
		if (geometry instanceof Point)
			writeCoordinate(((Point)geometry).getCoordinate(), out);
		else if (geometry instanceof LineString)
			writeCoordinates(geometry.getCoordinates(), out);
		else if (geometry instanceof MultiPoint)
			writeCoordinates(geometry.getCoordinates(), out);
		else if (geometry instanceof Polygon)
			writeCoordinates((Polygon)geometry, out);
		else if (geometry instanceof MultiLineString || geometry instanceof MultiPolygon) {
			out.beginArray();
			for (int i = 0; i < geometry.getNumGeometries(); i++)
				writeCoordinates(geometry.getGeometryN(i), out);
			out.endArray();
		} else
			throw new IllegalArgumentException("Unable to write coordinates for geometry type " + geometry.getGeometryType());
	}

	static void writeCoordinates(Polygon polygon, JsonWriter out) throws IOException {
		out.beginArray();
		writeCoordinates(polygon.getExteriorRing().getCoordinates(), out);
		for (int i = 0; i < polygon.getNumInteriorRing(); i++)
			writeCoordinates(polygon.getInteriorRingN(i).getCoordinates(), out);
		out.endArray();
	}
	
	static void writeCoordinates(Coordinate[] coords, JsonWriter out) throws IOException {
		out.beginArray();
		for (Coordinate c : coords)
			writeCoordinate(c, out);
		out.endArray();
	}
	
	static void writeCoordinate(Coordinate c, JsonWriter out) throws IOException {
		out.beginArray();
		out.value(c.x);
		out.value(c.y);
		out.endArray();
	}
	

	static Geometry parseGeometry(JsonObject obj, GeometryFactory factory) {
		if (!obj.has("type"))
			throw new JsonParseException("No geometry type found for object " + obj);
		String type = obj.get("type").getAsString();
		if (Geometry.TYPENAME_GEOMETRYCOLLECTION.equals(type)) {
			var array = obj.getAsJsonArray("geometries");
			var geometries = new Geometry[array.size()];
			for (int i = 0; i < geometries.length; i++)
				geometries[i] = parseGeometry(array.get(i).getAsJsonObject(), factory);
			return factory.createGeometryCollection(geometries);
		}
		JsonArray coordinates = obj.getAsJsonArray("coordinates");
		switch (type) {
		case "Point":
			return factory.createPoint(parseCoordinate(coordinates));
		case "MultiPoint":
			return factory.createMultiPointFromCoords(parseCoordinateArray(coordinates));
		case "LineString":
			return factory.createLineString(parseCoordinateArray(coordinates));
		case "MultiLineString":
			var lines = new LineString[coordinates.size()];
			for (int i = 0; i < lines.length; i++)
				lines[i] = factory.createLineString(parseCoordinateArray(coordinates.get(i).getAsJsonArray()));
			return factory.createMultiLineString(lines);
		case "Polygon":
			return parsePolygon(coordinates, factory);
		case "MultiPolygon":
			var polygons = new Polygon[coordinates.size()];
			for (int i = 0; i < polygons.length; i++)
				polygons[i] = parsePolygon(coordinates.get(i).getAsJsonArray(), factory);
			return factory.createMultiPolygon(polygons);
		default:
			throw new JsonParseException("Unsupported geometry type " + type);
		}
	}
	
	static Polygon parsePolygon(JsonArray coords, GeometryFactory factory) {
		int n = coords.size();
		if (n == 0)
			return factory.createPolygon();
		LinearRing shell = factory.createLinearRing(parseCoordinateArray(coords.get(0).getAsJsonArray()));
		var holes = new LinearRing[n - 1];
		for (int i = 1; i < n; i++)
			holes[i - 1] = factory.createLinearRing(parseCoordinateArray(coords.get(i).getAsJsonArray()));
		return factory.createPolygon(shell, holes);
	}

	static Coordinate parseCoordinate(JsonArray array) {
		return new Coordinate(array.get(0).getAsDouble(), array.get(1).getAsDouble());
	}

	static Coordinate[] parseCoordinateArray(JsonArray array) {
		Coordinate[] coordinates = new Coordinate[array.size()];
		for (int i = 0; i < array.size(); i++)
			coordinates[i] = parseCoordinate(array.get(i).getAsJsonArray());
		return coordinates;
	}

}
