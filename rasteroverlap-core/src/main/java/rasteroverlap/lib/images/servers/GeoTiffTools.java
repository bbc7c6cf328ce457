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

import java.util.Arrays;

import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static methods to extract an affine transform from GeoTIFF tags, using the TIFF plugin included with the JDK.
 * <p>
 * Supported tags are {@code ModelTransformationTag}, or {@code ModelPixelScaleTag} together with {@code ModelTiepointTag}.
 * Where the {@code GTRasterTypeGeoKey} indicates {@code RasterPixelIsPoint}, the transform is shifted by half a pixel 
 * so that it always refers to the top left corner of the top left pixel.
 */
public class GeoTiffTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GeoTiffTools.class);
	
	/**
	 * Name of the native metadata format used by the JDK TIFF plugin.
	 */
	public static final String TIFF_METADATA_FORMAT = "javax_imageio_tiff_image_1.0";
	
	static final int KEY_RASTER_TYPE = 1025;
	static final int RASTER_PIXEL_IS_POINT = 2;
	
	// Suppressed default constructor for non-instantiability
	private GeoTiffTools() {
		throw new AssertionError();
	}
	
	/**
	 * Returns true if the metadata can be interpreted as a TIFF directory.
	 * @param metadata
	 * @return
	 */
	public static boolean isTiffMetadata(IIOMetadata metadata) {
		return metadata != null && Arrays.asList(metadata.getMetadataFormatNames()).contains(TIFF_METADATA_FORMAT);
	}
	
	/**
	 * Read an affine transform from image metadata.
	 * @param metadata image metadata, as returned by {@code ImageReader.getImageMetadata(int)}
	 * @return the transform, or null if the metadata does not contain GeoTIFF georeferencing
	 */
	public static GeoTransform readTransform(IIOMetadata metadata) {
		if (!isTiffMetadata(metadata))
			return null;
		TIFFDirectory dir;
		try {
			dir = TIFFDirectory.createFromMetadata(metadata);
		} catch (IIOInvalidTreeException e) {
			logger.warn("Unable to parse TIFF metadata: {}", e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return null;
		}
		return readTransform(dir);
	}
	
	/**
	 * Read an affine transform from a TIFF directory.
	 * @param dir
	 * @return the transform, or null if the directory does not contain GeoTIFF georeferencing
	 */
	public static GeoTransform readTransform(TIFFDirectory dir) {
		var transform = fromModelTransformation(dir.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION));
		if (transform != null) {
			logger.debug("Read transform from ModelTransformationTag");
			return transform;
		}
		boolean pixelIsPoint = getGeoKey(dir, KEY_RASTER_TYPE) == RASTER_PIXEL_IS_POINT;
		transform = fromScaleAndTiepoint(
				dir.getTIFFField(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE),
				dir.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TIE_POINT),
				pixelIsPoint);
		if (transform != null)
			logger.debug("Read transform from ModelPixelScaleTag and ModelTiepointTag (PixelIsPoint={})", pixelIsPoint);
		return transform;
	}
	
	/**
	 * Create a transform from the 16 values of a 4x4 {@code ModelTransformationTag} matrix.
	 * @param field
	 * @return
	 */
	static GeoTransform fromModelTransformation(TIFFField field) {
		if (field == null)
			return null;
		if (field.getCount() != 16) {
			logger.warn("Ignoring ModelTransformationTag with {} values (expected 16)", field.getCount());
			return null;
		}
		double[] m = toDoubles(field);
		return GeoTransform.create(m[3], m[0], m[1], m[7], m[4], m[5]);
	}
	
	/**
	 * Create a transform from {@code ModelPixelScaleTag} and the first {@code ModelTiepointTag}.
	 * @param scaleField
	 * @param tiepointField
	 * @param pixelIsPoint if true, the tiepoint refers to the pixel center rather than its top left corner
	 * @return
	 */
	static GeoTransform fromScaleAndTiepoint(TIFFField scaleField, TIFFField tiepointField, boolean pixelIsPoint) {
		if (scaleField == null || tiepointField == null)
			return null;
		if (scaleField.getCount() < 2 || tiepointField.getCount() < 6) {
			logger.warn("Ignoring incomplete GeoTIFF tags (pixel scale count={}, tiepoint count={})", scaleField.getCount(), tiepointField.getCount());
			return null;
		}
		if (tiepointField.getCount() > 6)
			logger.debug("Multiple tiepoints found - only the first will be used");
		double[] scale = toDoubles(scaleField);
		double[] tiepoint = toDoubles(tiepointField);
		double sx = scale[0];
		double sy = scale[1];
		double originX = tiepoint[3] - tiepoint[0] * sx;
		double originY = tiepoint[4] + tiepoint[1] * sy;
		if (pixelIsPoint) {
			originX -= sx * 0.5;
			originY += sy * 0.5;
		}
		return GeoTransform.createNorthUp(originX, originY, sx, -sy);
	}
	
	/**
	 * Get the value of a short-valued key from the {@code GeoKeyDirectoryTag}.
	 * @param dir
	 * @param key
	 * @return the value, or -1 if the key is not found
	 */
	static int getGeoKey(TIFFDirectory dir, int key) {
		var field = dir.getTIFFField(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY);
		if (field == null || field.getCount() < 4)
			return -1;
		// Header is KeyDirectoryVersion, KeyRevision, MinorRevision, NumberOfKeys
		int nKeys = field.getAsInt(3);
		for (int i = 0; i < nKeys; i++) {
			int ind = 4 + i * 4;
			if (ind + 3 >= field.getCount())
				break;
			// Entries are KeyID, TIFFTagLocation, Count, Value_Offset; location 0 means the value is stored directly
			if (field.getAsInt(ind) == key && field.getAsInt(ind + 1) == 0)
				return field.getAsInt(ind + 3);
		}
		return -1;
	}
	
	private static double[] toDoubles(TIFFField field) {
		double[] values = new double[field.getCount()];
		for (int i = 0; i < values.length; i++)
			values[i] = field.getAsDouble(i);
		return values;
	}

}
