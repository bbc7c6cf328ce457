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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Exception thrown when a raster cannot be opened or decoded.
 * <p>
 * This is always fatal for the raster concerned, since an overlap cannot be computed without both inputs.
 */
public class RasterLoadException extends IOException {

	private static final long serialVersionUID = 1L;
	
	private final Path path;

	/**
	 * Constructor.
	 * @param path the raster that could not be loaded
	 * @param message
	 */
	public RasterLoadException(Path path, String message) {
		super(createMessage(path, message));
		this.path = path;
	}

	/**
	 * Constructor with a cause.
	 * @param path the raster that could not be loaded
	 * @param message
	 * @param cause
	 */
	public RasterLoadException(Path path, String message, Throwable cause) {
		super(createMessage(path, message), cause);
		this.path = path;
	}
	
	private static String createMessage(Path path, String message) {
		return "Unable to open " + path + ": " + message;
	}
	
	/**
	 * Get the path to the raster that could not be loaded.
	 * @return
	 */
	public Path getPath() {
		return path;
	}

}
