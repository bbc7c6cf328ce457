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

import java.nio.file.Path;

/**
 * Exception thrown when a raster has no band that can be used as a validity mask, 
 * i.e. there is no alpha band and fewer than 4 bands.
 */
public class MissingAlphaChannelException extends RasterLoadException {

	private static final long serialVersionUID = 1L;
	
	private final int nBands;

	/**
	 * Constructor.
	 * @param path the raster
	 * @param nBands the number of bands available
	 */
	public MissingAlphaChannelException(Path path, int nBands) {
		super(path, "alpha band not found (" + nBands + (nBands == 1 ? " band)" : " bands)"));
		this.nBands = nBands;
	}
	
	/**
	 * Get the number of bands in the raster.
	 * @return
	 */
	public int getBandCount() {
		return nBands;
	}

}
