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

package rasteroverlap.lib.overlap;

import java.util.Objects;
import java.util.Optional;

import org.locationtech.jts.geom.Polygon;

import rasteroverlap.lib.analysis.images.ValidityMaskScanner;
import rasteroverlap.lib.images.servers.RasterImage;
import rasteroverlap.lib.regions.GeoBoundingBox;
import rasteroverlap.lib.regions.PixelBoundingBox;
import rasteroverlap.lib.roi.ExtentPolygonBuilder;

/**
 * The extent of valid data within a single raster, in pixel and geographic coordinates.
 */
public class RasterExtent {
	
	private final String name;
	private final PixelBoundingBox pixelBounds;
	private final GeoBoundingBox geoBounds;
	private final Polygon polygon;
	
	private RasterExtent(String name, PixelBoundingBox pixelBounds, GeoBoundingBox geoBounds, Polygon polygon) {
		this.name = Objects.requireNonNull(name);
		this.pixelBounds = pixelBounds;
		this.geoBounds = geoBounds;
		this.polygon = polygon;
	}
	
	/**
	 * Scan the validity mask of a raster and build its extent polygon.
	 * @param raster
	 * @return an extent, which will have no polygon if the raster has no valid pixels
	 */
	public static RasterExtent compute(RasterImage raster) {
		var box = ValidityMaskScanner.scan(raster).orElse(null);
		if (box == null)
			return new RasterExtent(raster.getName(), null, null, null);
		var transform = raster.getTransform().orElse(null);
		var geoBounds = ExtentPolygonBuilder.project(box, raster.getHeight(), transform);
		var polygon = ExtentPolygonBuilder.build(box, raster.getWidth(), raster.getHeight(), transform);
		return new RasterExtent(raster.getName(), box, geoBounds, polygon);
	}
	
	/**
	 * Name of the raster.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	public RasterState getState() {
		return polygon == null ? RasterState.NO_DATA : RasterState.DATA;
	}
	
	public boolean hasData() {
		return polygon != null;
	}
	
	public Optional<PixelBoundingBox> getPixelBounds() {
		return Optional.ofNullable(pixelBounds);
	}
	
	public Optional<GeoBoundingBox> getGeoBounds() {
		return Optional.ofNullable(geoBounds);
	}
	
	public Optional<Polygon> getPolygon() {
		return Optional.ofNullable(polygon);
	}
	
	@Override
	public String toString() {
		if (pixelBounds == null)
			return name + ": no data";
		return name + ": pixels " + pixelBounds + ", geo " + geoBounds;
	}

}
