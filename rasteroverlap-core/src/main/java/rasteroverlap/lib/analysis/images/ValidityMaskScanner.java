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

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasteroverlap.lib.images.servers.RasterImage;
import rasteroverlap.lib.regions.PixelBoundingBox;

/**
 * Find the pixel extent of valid data within a validity mask.
 * <p>
 * Every pixel is visited, since valid pixels may occur anywhere in the image.
 */
public class ValidityMaskScanner {
	
	private static final Logger logger = LoggerFactory.getLogger(ValidityMaskScanner.class);
	
	// Suppressed default constructor for non-instantiability
	private ValidityMaskScanner() {
		throw new AssertionError();
	}
	
	/**
	 * Find the smallest box containing all valid pixels of a raster.
	 * @param raster
	 * @return the bounding box, or an empty optional if there are no valid pixels
	 * @see #scan(ByteBuffer, int, int)
	 */
	public static Optional<PixelBoundingBox> scan(RasterImage raster) {
		return scan(raster.getMaskBuffer(), raster.getWidth(), raster.getHeight());
	}
	
	/**
	 * Find the smallest box containing all valid pixels of a mask.
	 * A pixel at (x, y) is valid if {@code mask[y*width+x]} is 255 (when interpreted as unsigned).
	 * <p>
	 * An empty result means that no geometry can be derived from the mask; it is not an error.
	 * 
	 * @param mask row-major mask values
	 * @param width mask width
	 * @param height mask height
	 * @return the bounding box, with inclusive limits, or an empty optional if there are no valid pixels
	 * @throws IllegalArgumentException if the mask length does not match width * height
	 */
	public static Optional<PixelBoundingBox> scan(byte[] mask, int width, int height) {
		Objects.requireNonNull(mask, "Mask must not be null!");
		return scan(ByteBuffer.wrap(mask), width, height);
	}
	
	/**
	 * Find the smallest box containing all valid pixels of a mask buffer, as {@link #scan(byte[], int, int)}.
	 * Values are read by absolute index, so the buffer position is ignored and left unchanged.
	 * 
	 * @param mask row-major mask values, with capacity width * height
	 * @param width mask width
	 * @param height mask height
	 * @return the bounding box, with inclusive limits, or an empty optional if there are no valid pixels
	 */
	public static Optional<PixelBoundingBox> scan(ByteBuffer mask, int width, int height) {
		checkMask(mask, width, height);
		
		int minX = width, minY = height, maxX = -1, maxY = -1;
		for (int y = 0; y < height; y++) {
			int offset = y * width;
			for (int x = 0; x < width; x++) {
				if (isValid(mask.get(offset + x))) {
					if (x < minX)
						minX = x;
					if (x > maxX)
						maxX = x;
					// Rows are visited in order, so the first valid row is the minimum
					if (minY > y)
						minY = y;
					maxY = y;
				}
			}
		}
		if (maxX < 0) {
			logger.debug("No valid pixels found in {}x{} mask", width, height);
			return Optional.empty();
		}
		var box = PixelBoundingBox.createInstance(minX, minY, maxX, maxY);
		logger.debug("Valid pixel bounds: {}", box);
		return Optional.of(box);
	}
	
	/**
	 * Count the valid pixels in a mask.
	 * @param mask
	 * @param width
	 * @param height
	 * @return
	 */
	public static long countValid(byte[] mask, int width, int height) {
		Objects.requireNonNull(mask, "Mask must not be null!");
		return countValid(ByteBuffer.wrap(mask), width, height);
	}
	
	/**
	 * Count the valid pixels in a mask buffer, reading by absolute index.
	 * @param mask
	 * @param width
	 * @param height
	 * @return
	 */
	public static long countValid(ByteBuffer mask, int width, int height) {
		checkMask(mask, width, height);
		long count = 0;
		int n = mask.capacity();
		for (int i = 0; i < n; i++) {
			if (isValid(mask.get(i)))
				count++;
		}
		return count;
	}
	
	/**
	 * Returns true if a mask value indicates a valid pixel.
	 * @param value
	 * @return
	 */
	public static boolean isValid(byte value) {
		return (value & 0xFF) == RasterImage.VALID_MASK_VALUE;
	}
	
	private static void checkMask(ByteBuffer mask, int width, int height) {
		Objects.requireNonNull(mask, "Mask must not be null!");
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Mask dimensions must not be negative, but were " + width + "x" + height);
		if ((long)width * height != mask.capacity())
			throw new IllegalArgumentException("Mask length " + mask.capacity() + " does not match " + width + "x" + height);
	}

}
