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

package rasteroverlap.lib.regions;

/**
 * Bounding box in pixel coordinates.
 * <p>
 * Both minimum and maximum values are <i>inclusive</i>: {@code maxX} and {@code maxY} are the last column and row 
 * that contain valid pixels. The exclusive corner of the box is therefore {@code (maxX+1, maxY+1)}.
 */
public class PixelBoundingBox {
	
	private final int minX;
	private final int minY;
	private final int maxX;
	private final int maxY;
	
	private PixelBoundingBox(int minX, int minY, int maxX, int maxY) {
		this.minX = minX;
		this.minY = minY;
		this.maxX = maxX;
		this.maxY = maxY;
	}
	
	/**
	 * Create a bounding box from inclusive pixel limits.
	 * @param minX
	 * @param minY
	 * @param maxX
	 * @param maxY
	 * @return
	 * @throws IllegalArgumentException if minX &gt; maxX or minY &gt; maxY
	 */
	public static PixelBoundingBox createInstance(int minX, int minY, int maxX, int maxY) {
		if (minX > maxX)
			throw new IllegalArgumentException("minX must be <= maxX! Requested " + minX + " > " + maxX);
		if (minY > maxY)
			throw new IllegalArgumentException("minY must be <= maxY! Requested " + minY + " > " + maxY);
		return new PixelBoundingBox(minX, minY, maxX, maxY);
	}
	
	/**
	 * First valid column.
	 * @return
	 */
	public int getMinX() {
		return minX;
	}

	/**
	 * First valid row.
	 * @return
	 */
	public int getMinY() {
		return minY;
	}

	/**
	 * Last valid column (inclusive).
	 * @return
	 */
	public int getMaxX() {
		return maxX;
	}

	/**
	 * Last valid row (inclusive).
	 * @return
	 */
	public int getMaxY() {
		return maxY;
	}
	
	/**
	 * Number of columns covered by the box.
	 * @return
	 */
	public int getWidth() {
		return maxX - minX + 1;
	}
	
	/**
	 * Number of rows covered by the box.
	 * @return
	 */
	public int getHeight() {
		return maxY - minY + 1;
	}
	
	/**
	 * Returns true if the pixel lies inside the box.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(int x, int y) {
		return x >= minX && x <= maxX && y >= minY && y <= maxY;
	}
	
	@Override
	public String toString() {
		return "[" + minX + "," + minY + "] - [" + maxX + "," + maxY + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + minX;
		result = prime * result + minY;
		result = prime * result + maxX;
		result = prime * result + maxY;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PixelBoundingBox))
			return false;
		PixelBoundingBox other = (PixelBoundingBox) obj;
		return minX == other.minX && minY == other.minY && maxX == other.maxX && maxY == other.maxY;
	}

}
