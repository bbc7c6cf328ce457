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

package rasteroverlap.lib.analysis.images;

import rasteroverlap.lib.images.servers.RasterImage;

/**
 * Summary of the number of valid pixels within a raster's validity mask.
 */
public class MaskStatistics {
	
	private final long nValid;
	private final long nPixels;
	
	private MaskStatistics(long nValid, long nPixels) {
		this.nValid = nValid;
		this.nPixels = nPixels;
	}
	
	/**
	 * Compute statistics for the mask of a raster.
	 * @param raster
	 * @return
	 */
	public static MaskStatistics compute(RasterImage raster) {
		long nValid = ValidityMaskScanner.countValid(raster.getMaskBuffer(), raster.getWidth(), raster.getHeight());
		return new MaskStatistics(nValid, (long)raster.getWidth() * raster.getHeight());
	}
	
	/**
	 * Number of valid (opaque) pixels.
	 * @return
	 */
	public long getValidCount() {
		return nValid;
	}
	
	/**
	 * Total number of pixels.
	 * @return
	 */
	public long getPixelCount() {
		return nPixels;
	}
	
	/**
	 * Percentage of pixels that are valid, or NaN if there are no pixels.
	 * @return
	 */
	public double getValidPercentage() {
		if (nPixels == 0)
			return Double.NaN;
		return nValid * 100.0 / nPixels;
	}
	
	@Override
	public String toString() {
		return "Valid pixels: " + nValid + " / " + nPixels;
	}

}
