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

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded raster, reduced to what is needed to find its valid-data extent: 
 * dimensions, band descriptions, an 8-bit validity mask and an optional affine transform.
 * <p>
 * Mask values of 255 indicate valid (opaque) pixels; all other values are invalid.
 * The mask is stored in row-major order, with length {@code width * height}.
 * <p>
 * Instances are immutable.
 */
public class RasterImage {
	
	/**
	 * Mask value indicating a valid pixel.
	 */
	public static final int VALID_MASK_VALUE = 255;
	
	private String name;
	private Path path;
	private int width;
	private int height;
	private List<RasterBand> bands = Collections.emptyList();
	private int maskBand = -1;
	private byte[] mask;
	private GeoTransform transform;
	
	private RasterImage() {}
	
	/**
	 * Get a name for the raster, suitable for display.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * Get the file that the raster was read from, if known.
	 * @return
	 */
	public Optional<Path> getPath() {
		return Optional.ofNullable(path);
	}
	
	/**
	 * Raster width in pixels.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Raster height in pixels.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get an unmodifiable list of the bands in the original raster.
	 * @return
	 */
	public List<RasterBand> getBands() {
		return bands;
	}
	
	/**
	 * Get the number of bands in the original raster.
	 * @return
	 */
	public int nBands() {
		return bands.size();
	}
	
	/**
	 * Get the 1-based index of the band used for the validity mask, or -1 if this is not known 
	 * (e.g. because the mask was provided directly).
	 * @return
	 */
	public int getMaskBand() {
		return maskBand;
	}
	
	/**
	 * Get a copy of the validity mask.
	 * @return
	 * @see #getMaskBuffer()
	 */
	public byte[] getMask() {
		return mask.clone();
	}
	
	/**
	 * Get a read-only view of the validity mask, without copying it.
	 * Values are accessed by absolute index, {@code y * width + x}.
	 * @return
	 */
	public ByteBuffer getMaskBuffer() {
		return ByteBuffer.wrap(mask).asReadOnlyBuffer();
	}
	
	/**
	 * Get the mask value for a single pixel, in the range 0-255.
	 * @param x
	 * @param y
	 * @return
	 */
	public int getMaskValue(int x, int y) {
		return mask[y * width + x] & 0xFF;
	}
	
	/**
	 * Returns true if the pixel is valid according to the mask.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean isValid(int x, int y) {
		return getMaskValue(x, y) == VALID_MASK_VALUE;
	}
	
	/**
	 * Get the affine transform, if the raster is georeferenced.
	 * @return
	 */
	public Optional<GeoTransform> getTransform() {
		return Optional.ofNullable(transform);
	}
	
	@Override
	public String toString() {
		return "RasterImage: " + name + " (" + width + "x" + height + ")";
	}
	
	
	/**
	 * Builder to create a {@link RasterImage}.
	 */
	public static class Builder {
		
		private RasterImage raster;
		
		/**
		 * Builder for a raster with the specified dimensions.
		 * @param width
		 * @param height
		 */
		public Builder(final int width, final int height) {
			if (width <= 0 || height <= 0)
				throw new IllegalArgumentException("Raster dimensions must be positive, but were " + width + "x" + height);
			raster = new RasterImage();
			raster.width = width;
			raster.height = height;
		}
		
		/**
		 * Specify the display name.
		 * @param name
		 * @return
		 */
		public Builder name(final String name) {
			raster.name = name;
			return this;
		}
		
		/**
		 * Specify the source file. If no name is set, the file name is used.
		 * @param path
		 * @return
		 */
		public Builder path(final Path path) {
			raster.path = path;
			return this;
		}
		
		/**
		 * Specify the bands of the original raster.
		 * @param bands
		 * @return
		 */
		public Builder bands(final Collection<RasterBand> bands) {
			raster.bands = Collections.unmodifiableList(new ArrayList<>(bands));
			return this;
		}
		
		/**
		 * Specify the 1-based index of the band from which the mask was read.
		 * @param band
		 * @return
		 */
		public Builder maskBand(final int band) {
			raster.maskBand = band;
			return this;
		}
		
		/**
		 * Specify the validity mask. The array is copied.
		 * @param mask row-major mask values, where 255 means valid
		 * @return
		 */
		public Builder mask(final byte[] mask) {
			Objects.requireNonNull(mask, "Mask must not be null!");
			if (mask.length != (long)raster.width * raster.height)
				throw new IllegalArgumentException("Mask length " + mask.length + " does not match raster size " + raster.width + "x" + raster.height);
			raster.mask = mask.clone();
			return this;
		}
		
		/**
		 * Specify the affine transform, or null if the raster is not georeferenced.
		 * @param transform
		 * @return
		 */
		public Builder transform(final GeoTransform transform) {
			raster.transform = transform;
			return this;
		}
		
		/**
		 * Build the raster. A mask must have been provided.
		 * @return
		 */
		public RasterImage build() {
			if (raster.mask == null)
				throw new IllegalStateException("A validity mask is required");
			if (raster.name == null)
				raster.name = raster.path == null ? "Unnamed raster" : String.valueOf(raster.path.getFileName());
			var temp = raster;
			raster = null;
			return temp;
		}
		
	}

}
