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
 * Interface for reading a raster file into a {@link RasterImage}.
 */
public interface RasterReader {
	
	/**
	 * Read the raster, including its validity mask and any georeferencing.
	 * @param path the raster file
	 * @return the decoded raster
	 * @throws RasterLoadException if the file cannot be opened or decoded, or lacks a usable validity mask
	 */
	RasterImage read(Path path) throws RasterLoadException;

}
