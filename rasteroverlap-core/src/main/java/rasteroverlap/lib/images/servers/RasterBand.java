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

import java.util.Objects;

/**
 * The index and color interpretation of a single raster band.
 */
public class RasterBand {
	
	private final int index;
	private final ColorInterpretation interpretation;
	
	private RasterBand(int index, ColorInterpretation interpretation) {
		this.index = index;
		this.interpretation = interpretation;
	}
	
	/**
	 * Create a band description.
	 * @param index 1-based band index, as reported to the user
	 * @param interpretation color interpretation of the band values
	 * @return
	 */
	public static RasterBand create(int index, ColorInterpretation interpretation) {
		if (index < 1)
			throw new IllegalArgumentException("Band index must be >= 1, but was " + index);
		return new RasterBand(index, Objects.requireNonNull(interpretation));
	}
	
	/**
	 * Get the 1-based band index.
	 * @return
	 */
	public int getIndex() {
		return index;
	}
	
	/**
	 * Get the color interpretation.
	 * @return
	 */
	public ColorInterpretation getColorInterpretation() {
		return interpretation;
	}
	
	@Override
	public String toString() {
		return "Band " + index + ": " + interpretation.getName();
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, interpretation);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof RasterBand))
			return false;
		RasterBand other = (RasterBand) obj;
		return index == other.index && interpretation == other.interpretation;
	}

}
