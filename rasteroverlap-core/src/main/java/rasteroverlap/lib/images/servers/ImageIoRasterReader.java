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

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFImageReadParam;
import javax.imageio.stream.ImageInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of a {@link RasterReader} using Java's ImageIO.
 * <p>
 * GeoTIFF georeferencing is read with the TIFF plugin included in the JDK; for other formats 
 * (or TIFFs without GeoTIFF tags) a world file is used if one is available.
 * <p>
 * The validity mask is taken from the first band interpreted as alpha. If there is no such band 
 * but the image has at least 4 bands, the last band is used.
 */
public class ImageIoRasterReader implements RasterReader {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageIoRasterReader.class);
	
	private final boolean useWorldFiles;
	
	/**
	 * Create a reader that checks for world files if no GeoTIFF tags are found.
	 */
	public ImageIoRasterReader() {
		this(true);
	}
	
	/**
	 * Create a reader.
	 * @param useWorldFiles if true, check for world files if no GeoTIFF tags are found
	 */
	public ImageIoRasterReader(boolean useWorldFiles) {
		this.useWorldFiles = useWorldFiles;
	}

	@Override
	public RasterImage read(Path path) throws RasterLoadException {
		if (!Files.isRegularFile(path))
			throw new RasterLoadException(path, "file not found");
		
		try (ImageInputStream stream = ImageIO.createImageInputStream(path.toFile())) {
			if (stream == null)
				throw new RasterLoadException(path, "unable to create image input stream");
			var readers = ImageIO.getImageReaders(stream);
			if (!readers.hasNext())
				throw new RasterLoadException(path, "no ImageIO reader found");
			ImageReader reader = readers.next();
			try {
				reader.setInput(stream, true, false);
				var img = reader.read(0, createReadParam(reader));
				var transform = GeoTiffTools.readTransform(reader.getImageMetadata(0));
				if (transform == null && useWorldFiles)
					transform = WorldFiles.findTransform(path);
				return createRaster(path, img, transform);
			} finally {
				reader.dispose();
			}
		} catch (RasterLoadException e) {
			throw e;
		} catch (IOException | RuntimeException e) {
			logger.debug("Error reading " + path, e);
			throw new RasterLoadException(path, e.getLocalizedMessage(), e);
		}
	}
	
	/**
	 * Ensure that GeoTIFF tags are retained when reading TIFF metadata.
	 */
	private static ImageReadParam createReadParam(ImageReader reader) {
		var param = reader.getDefaultReadParam();
		if (param instanceof TIFFImageReadParam) {
			var tiffParam = (TIFFImageReadParam)param;
			if (!tiffParam.getAllowedTagSets().contains(GeoTIFFTagSet.getInstance()))
				tiffParam.addAllowedTagSet(GeoTIFFTagSet.getInstance());
		}
		return param;
	}
	
	/**
	 * Create a raster from an image that has already been read.
	 * @param path path to the original file; used for naming and error messages
	 * @param img the decoded image
	 * @param transform the affine transform, or null if the image is not georeferenced
	 * @return
	 * @throws MissingAlphaChannelException if no band can be used as a validity mask
	 */
	public static RasterImage createRaster(Path path, BufferedImage img, GeoTransform transform) throws MissingAlphaChannelException {
		var bands = getBands(img);
		int alphaBand = findAlphaBand(bands);
		if (alphaBand < 0)
			throw new MissingAlphaChannelException(path, bands.size());
		
		logger.debug("Reading validity mask from band {} of {}", alphaBand, path);
		byte[] mask = readMask(img.getRaster(), alphaBand - 1);
		
		return new RasterImage.Builder(img.getWidth(), img.getHeight())
				.path(path)
				.bands(bands)
				.maskBand(alphaBand)
				.mask(mask)
				.transform(transform)
				.build();
	}
	
	/**
	 * Describe the bands of an image, determining a color interpretation for each.
	 * @param img
	 * @return
	 */
	public static List<RasterBand> getBands(BufferedImage img) {
		int nBands = img.getRaster().getNumBands();
		ColorModel cm = img.getColorModel();
		var list = new ArrayList<RasterBand>();
		for (int b = 0; b < nBands; b++) {
			list.add(RasterBand.create(b+1, getColorInterpretation(cm, b)));
		}
		return list;
	}
	
	static ColorInterpretation getColorInterpretation(ColorModel cm, int band) {
		if (cm == null)
			return ColorInterpretation.UNDEFINED;
		if (cm instanceof IndexColorModel)
			return band == 0 ? ColorInterpretation.PALETTE : ColorInterpretation.UNDEFINED;
		int nColor = cm.getNumColorComponents();
		if (band < nColor) {
			switch (cm.getColorSpace().getType()) {
			case ColorSpace.TYPE_RGB:
				if (nColor != 3)
					return ColorInterpretation.UNDEFINED;
				return band == 0 ? ColorInterpretation.RED : band == 1 ? ColorInterpretation.GREEN : ColorInterpretation.BLUE;
			case ColorSpace.TYPE_GRAY:
				return ColorInterpretation.GRAY;
			default:
				return ColorInterpretation.UNDEFINED;
			}
		}
		if (band == nColor && cm.hasAlpha())
			return ColorInterpretation.ALPHA;
		return ColorInterpretation.UNDEFINED;
	}
	
	/**
	 * Find the band to use as a validity mask.
	 * @param bands
	 * @return the 1-based index of the first alpha band; otherwise the last band if there are at least 4, or -1 if no band is suitable
	 */
	public static int findAlphaBand(List<RasterBand> bands) {
		for (var band : bands) {
			if (band.getColorInterpretation() == ColorInterpretation.ALPHA)
				return band.getIndex();
		}
		if (bands.size() >= 4)
			return bands.size();
		return -1;
	}
	
	/**
	 * Read one band of a raster as 8-bit mask values, clamping to the range 0-255.
	 * @param raster
	 * @param band 0-based band index
	 * @return
	 */
	static byte[] readMask(Raster raster, int band) {
		int w = raster.getWidth();
		int h = raster.getHeight();
		int[] samples = raster.getSamples(raster.getMinX(), raster.getMinY(), w, h, band, (int[])null);
		byte[] mask = new byte[samples.length];
		for (int i = 0; i < samples.length; i++) {
			int v = samples[i];
			mask[i] = (byte)(v < 0 ? 0 : v > 255 ? 255 : v);
		}
		return mask;
	}

}
