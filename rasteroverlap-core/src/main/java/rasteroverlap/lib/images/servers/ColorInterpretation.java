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

package rasteroverlap.lib.images.servers;

/**
 * Interpretation of the values stored in a single raster band.
 * <p>
 * Display names follow the color interpretation names used by GDAL, so that diagnostic output 
 * can be compared directly with {@code gdalinfo}.
 */
public enum ColorInterpretation {
	
	/**
	 * Band meaning is not known
	 */
	UNDEFINED("Undefined"),
	/**
	 * Grayscale intensity
	 */
	GRAY("Gray"),
	/**
	 * Index into a color table
	 */
	PALETTE("Palette"),
	/**
	 * Red component of an RGB image
	 */
	RED("Red"),
	/**
	 * Green component of an RGB image
	 */
	GREEN("Green"),
	/**
	 * Blue component of an RGB image
	 */
	BLUE("Blue"),
	/**
	 * Alpha (transparency); 255 is fully opaque
	 */
	ALPHA("Alpha");
	
	private final String name;
	
	private ColorInterpretation(String name) {
		this.name = name;
	}
	
	/**
	 * Get the display name, e.g. "Alpha".
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	@Override
	public String toString() {
		return name;
	}

}
