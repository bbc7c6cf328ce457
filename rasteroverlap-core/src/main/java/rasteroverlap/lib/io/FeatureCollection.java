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

import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Wrapper for a collection of features, so that it is serialized as a GeoJSON FeatureCollection 
 * rather than a plain JSON array.
 * 
 * @see #wrap(Collection)
 */
public class FeatureCollection {
	
	private static final FeatureCollection EMPTY = new FeatureCollection(Collections.emptyList());
	
	private final List<Feature> features;
	
	private FeatureCollection(Collection<? extends Feature> features) {
		this.features = List.copyOf(features);
	}
	
	/**
	 * Wrap a collection of features.
	 * @param features
	 * @return
	 */
	public static FeatureCollection wrap(Collection<? extends Feature> features) {
		if (features.isEmpty())
			return EMPTY;
		return new FeatureCollection(features);
	}
	
	/**
	 * Get a collection containing no features.
	 * @return
	 */
	public static FeatureCollection empty() {
		return EMPTY;
	}
	
	/**
	 * Get an unmodifiable list of the features.
	 * @return
	 */
	public List<Feature> getFeatures() {
		return features;
	}
	
	/**
	 * Query if the collection contains no features.
	 * @return
	 */
	public boolean isEmpty() {
		return features.isEmpty();
	}
	
	@Override
	public String toString() {
		return "FeatureCollection[" + features.size() + " features]";
	}

}
