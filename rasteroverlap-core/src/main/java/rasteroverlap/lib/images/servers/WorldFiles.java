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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasteroverlap.lib.common.GeneralTools;

/**
 * Static methods to read world files (e.g. {@code .tfw}, {@code .pgw}, {@code .wld}) that store an affine 
 * transform alongside an image.
 * <p>
 * A world file contains six lines: pixel width, row rotation, column rotation, pixel height, 
 * and the x and y coordinates of the <i>center</i> of the top left pixel.
 */
public class WorldFiles {
	
	private static final Logger logger = LoggerFactory.getLogger(WorldFiles.class);
	
	// Suppressed default constructor for non-instantiability
	private WorldFiles() {
		throw new AssertionError();
	}
	
	/**
	 * Get candidate world file paths for an image, in the order they should be checked.
	 * For {@code image.tif} these are {@code image.tfw}, {@code image.tifw} and {@code image.wld}.
	 * @param imagePath
	 * @return
	 */
	public static List<Path> getCandidatePaths(Path imagePath) {
		var file = imagePath.toFile();
		String base = GeneralTools.getNameWithoutExtension(file);
		String ext = GeneralTools.getExtension(file).orElse("");
		Set<String> names = new LinkedHashSet<>();
		if (ext.length() >= 3) {
			// Strip the dot, then use first and last characters
			String e = ext.substring(1);
			names.add(base + "." + e.charAt(0) + e.charAt(e.length()-1) + "w");
		}
		if (ext.length() >= 2)
			names.add(base + ext + "w");
		names.add(base + ".wld");
		var list = new ArrayList<Path>();
		for (var name : names)
			list.add(imagePath.resolveSibling(name));
		return list;
	}
	
	/**
	 * Search for a world file for the specified image and read it if found.
	 * Both lower and upper case extensions are checked.
	 * @param imagePath
	 * @return the transform, or null if no world file was found
	 * @throws IOException if a world file is found but cannot be read or parsed
	 */
	public static GeoTransform findTransform(Path imagePath) throws IOException {
		for (var candidate : getCandidatePaths(imagePath)) {
			for (var path : List.of(candidate, upperCaseExtension(candidate))) {
				if (Files.isRegularFile(path)) {
					logger.debug("Reading world file {}", path);
					return readTransform(path);
				}
			}
		}
		return null;
	}
	
	private static Path upperCaseExtension(Path path) {
		String name = path.getFileName().toString();
		int ind = name.lastIndexOf('.');
		return path.resolveSibling(name.substring(0, ind) + name.substring(ind).toUpperCase());
	}
	
	/**
	 * Read a world file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or does not contain 6 numeric values
	 */
	public static GeoTransform readTransform(Path path) throws IOException {
		var values = new ArrayList<Double>();
		for (var line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
			line = line.strip();
			if (line.isEmpty())
				continue;
			try {
				values.add(Double.parseDouble(line));
			} catch (NumberFormatException e) {
				throw new IOException("Invalid world file " + path + ": cannot parse '" + line + "'", e);
			}
			if (values.size() == 6)
				break;
		}
		if (values.size() < 6)
			throw new IOException("Invalid world file " + path + ": expected 6 values, found " + values.size());
		return fromWorldFileValues(values.get(0), values.get(1), values.get(2), values.get(3), values.get(4), values.get(5));
	}
	
	/**
	 * Convert world file values into a transform referring to the top left corner of the top left pixel.
	 * @param a pixel width
	 * @param d row rotation
	 * @param b column rotation
	 * @param e pixel height (usually negative)
	 * @param c x coordinate of the center of the top left pixel
	 * @param f y coordinate of the center of the top left pixel
	 * @return
	 */
	public static GeoTransform fromWorldFileValues(double a, double d, double b, double e, double c, double f) {
		return GeoTransform.create(
				c - 0.5 * a - 0.5 * b,
				a,
				b,
				f - 0.5 * d - 0.5 * e,
				d,
				e);
	}

}
