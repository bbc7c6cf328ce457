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

import java.io.StringWriter;

import org.locationtech.jts.geom.Geometry;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonWriter;

/**
 * Access a {@link Gson} instance that supports GeoJSON geometries, features and feature collections.
 */
public class GsonTools {
	
	/**
	 * Indentation used for pretty printing, which matches the documents written by other GIS tools.
	 */
	public static final String DEFAULT_INDENT = "    ";
	
	private static final Gson gson = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new GeoJsonTypeAdapterFactory())
			.create();
	
	// Suppressed default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get a default Gson, capable of handling JTS geometries and GeoJSON features.
	 * Use {@code getInstance().newBuilder()} to derive a customized instance.
	 * @return
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return gson;
	}
	
	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * @param pretty if true, request pretty-printing (2-space indentation)
	 * @return
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	/**
	 * Convert an object to JSON using the default Gson, with a specific indentation.
	 * @param src the object to convert
	 * @param indent the indentation for each nesting level; use an empty string for compact output
	 * @return
	 */
	public static String toJson(Object src, String indent) {
		var writer = new StringWriter();
		var jsonWriter = new JsonWriter(writer);
		jsonWriter.setIndent(indent);
		getInstance().toJson(src, src.getClass(), jsonWriter);
		return writer.toString();
	}
	
	
	static class GeoJsonTypeAdapterFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			return getTypeAdaptor(type.getRawType());
		}
		
		@SuppressWarnings("unchecked")
		static <T> TypeAdapter<T> getTypeAdaptor(Class<? super T> cls) {
			if (FeatureCollection.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)GeoJsonTypeAdapters.FEATURE_COLLECTION_ADAPTER_INSTANCE;
			
			if (Feature.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)GeoJsonTypeAdapters.FEATURE_ADAPTER_INSTANCE;
			
			if (Geometry.class.isAssignableFrom(cls))
				return (TypeAdapter<T>)GeoJsonTypeAdapters.GEOMETRY_ADAPTER_INSTANCE;
			
			return null;
		}
		
	}

}
