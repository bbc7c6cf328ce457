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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasteroverlap.lib.analysis.images.MaskStatistics;
import rasteroverlap.lib.common.GeneralTools;
import rasteroverlap.lib.images.servers.RasterImage;

/**
 * Describe a loaded raster for the user: size, bands, valid pixels and georeferencing.
 */
public class RasterDiagnostics {
	
	private static final Logger logger = LoggerFactory.getLogger(RasterDiagnostics.class);
	
	// Suppressed default constructor for non-instantiability
	private RasterDiagnostics() {
		throw new AssertionError();
	}
	
	/**
	 * Create the lines describing a raster.
	 * @param raster
	 * @return
	 */
	public static List<String> describe(RasterImage raster) {
		List<String> lines = new ArrayList<>();
		lines.add("File: " + raster.getName());
		lines.add("Size: " + raster.getWidth() + " x " + raster.getHeight());
		lines.add("Number of bands: " + raster.nBands());
		for (var band : raster.getBands())
			lines.add("  " + band);
		if (raster.getMaskBand() > 0)
			lines.add("Mask band: " + raster.getMaskBand());
		var stats = MaskStatistics.compute(raster);
		lines.add("Opaque pixels: " + stats.getValidCount() + " of " + stats.getPixelCount() +
				" (" + GeneralTools.formatNumber(Locale.US, stats.getValidPercentage(), 2) + "%)");
		var transform = raster.getTransform().orElse(null);
		if (transform == null)
			lines.add("No geotransform found");
		else
			lines.add("Geotransform: " + GeneralTools.arrayToString(Locale.US, transform.getCoefficients(), ", ", 6));
		return lines;
	}
	
	/**
	 * Log the description of a raster at INFO level.
	 * @param raster
	 */
	public static void report(RasterImage raster) {
		for (var line : describe(raster))
			logger.info(line);
	}

}
