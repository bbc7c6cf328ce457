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

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rasteroverlap.lib.images.servers.ImageIoRasterReader;
import rasteroverlap.lib.images.servers.RasterImage;
import rasteroverlap.lib.images.servers.RasterLoadException;
import rasteroverlap.lib.images.servers.RasterReader;
import rasteroverlap.lib.io.GeoJsonSerializer;
import rasteroverlap.lib.overlap.OverlapReport.Status;
import rasteroverlap.lib.roi.GeometryEngine;
import rasteroverlap.lib.roi.OverlapComputer;
import rasteroverlap.lib.roi.OverlapResult;

/**
 * Compute the overlap between the valid data of two rasters and write it as GeoJSON.
 * <p>
 * Each raster is scanned independently. A raster without valid pixels does not stop the pipeline: 
 * the overlap is then empty, and a document with no features is still produced. 
 * Each run holds the geometry engine from start to end, releasing it on every exit path; 
 * runs on different threads may overlap.
 * <p>
 * Instances are immutable and may be reused; create them with {@link #builder()}.
 */
public class OverlapPipeline {
	
	private static final Logger logger = LoggerFactory.getLogger(OverlapPipeline.class);
	
	/**
	 * Default name of the output file.
	 */
	public static final String DEFAULT_OUTPUT = "intersection_obchaja_2.geojson";
	
	private final RasterReader reader;
	private final Path outputPath;
	private final boolean parallel;
	private final boolean geometryAvailable;
	
	private OverlapPipeline(Builder builder) {
		this.reader = builder.reader;
		this.outputPath = builder.outputPath;
		this.parallel = builder.parallel;
		this.geometryAvailable = builder.geometryAvailable;
	}
	
	/**
	 * Create a new builder, with default settings.
	 * @return
	 */
	public static Builder builder() {
		return new Builder();
	}
	
	/**
	 * Get the path to which {@link #runFiles(Path, Path)} writes its document.
	 * @return
	 */
	public Path getOutputPath() {
		return outputPath;
	}
	
	/**
	 * Query whether the two rasters are scanned in parallel.
	 * @return
	 */
	public boolean isParallel() {
		return parallel;
	}
	
	/**
	 * Load two raster files, compute their overlap and write the result to the output path.
	 * If the geometry engine is not available, the rasters are still loaded and scanned but no file is written.
	 * 
	 * @param pathA
	 * @param pathB
	 * @return the report for the run
	 * @throws RasterLoadException if either raster cannot be read
	 * @throws IOException if the output file cannot be written
	 */
	public OverlapReport runFiles(Path pathA, Path pathB) throws RasterLoadException, IOException {
		var rasterA = load(pathA);
		var rasterB = load(pathB);
		var report = run(rasterA, rasterB);
		var document = report.getDocument().orElse(null);
		if (document == null) {
			logger.info("No document written to {}", outputPath);
			return report;
		}
		GeoJsonSerializer.writeDocument(outputPath, document);
		logger.info("File created: {}", outputPath);
		return report;
	}
	
	private RasterImage load(Path path) throws RasterLoadException {
		var raster = reader.read(path);
		logger.info("Loaded {}", path);
		RasterDiagnostics.report(raster);
		return raster;
	}
	
	/**
	 * Compute the overlap of two rasters that have already been loaded.
	 * Nothing is written to disk.
	 * 
	 * @param rasterA
	 * @param rasterB
	 * @return the report for the run, including the serialized document unless the geometry engine is not available
	 */
	public OverlapReport run(RasterImage rasterA, RasterImage rasterB) {
		Objects.requireNonNull(rasterA, "Raster A must not be null");
		Objects.requireNonNull(rasterB, "Raster B must not be null");
		
		boolean engineReady = geometryAvailable && GeometryEngine.initialize();
		try {
			var extents = computeExtents(rasterA, rasterB);
			var extentA = extents.get(0);
			var extentB = extents.get(1);
			if (!extentA.hasData())
				logger.warn("Raster A had no data: {}", extentA.getName());
			if (!extentB.hasData())
				logger.warn("Raster B had no data: {}", extentB.getName());
			
			if (!engineReady) {
				logger.warn("Geometry engine not available - overlap will not be computed");
				return new OverlapReport(extentA, extentB, Status.UNAVAILABLE, OverlapResult.empty(), null);
			}
			
			logger.info("Computing overlap");
			var overlap = OverlapComputer.computeOverlap(
					extentA.getPolygon().orElse(null),
					extentB.getPolygon().orElse(null));
			
			Status status;
			if (!extentA.hasData() || !extentB.hasData())
				status = Status.NO_DATA;
			else if (overlap.isEmpty())
				status = Status.NO_OVERLAP;
			else
				status = Status.OVERLAP;
			
			if (overlap.isEmpty())
				logger.info("No overlap found");
			else
				logger.info("Overlap found: {}", overlap);
			
			var document = GeoJsonSerializer.serialize(overlap);
			return new OverlapReport(extentA, extentB, status, overlap, document);
		} finally {
			if (engineReady)
				GeometryEngine.shutdown();
		}
	}
	
	private List<RasterExtent> computeExtents(RasterImage rasterA, RasterImage rasterB) {
		var stream = List.of(rasterA, rasterB).stream();
		if (parallel)
			stream = stream.parallel();
		var extents = stream.map(RasterExtent::compute).collect(Collectors.toList());
		for (var extent : extents)
			logger.debug("{}", extent);
		return extents;
	}
	
	
	/**
	 * Builder for an {@link OverlapPipeline}.
	 */
	public static class Builder {
		
		private RasterReader reader = new ImageIoRasterReader();
		private Path outputPath = Paths.get(DEFAULT_OUTPUT);
		private boolean parallel = false;
		private boolean geometryAvailable = GeometryEngine.isAvailable();
		
		private Builder() {}
		
		/**
		 * Reader used to load rasters in {@link OverlapPipeline#runFiles(Path, Path)}.
		 * @param reader
		 * @return this builder
		 */
		public Builder reader(RasterReader reader) {
			this.reader = Objects.requireNonNull(reader);
			return this;
		}
		
		/**
		 * Path of the output document.
		 * @param path
		 * @return this builder
		 */
		public Builder outputPath(Path path) {
			this.outputPath = Objects.requireNonNull(path);
			return this;
		}
		
		/**
		 * Scan the two rasters in parallel. The output is the same either way.
		 * @param parallel
		 * @return this builder
		 */
		public Builder parallel(boolean parallel) {
			this.parallel = parallel;
			return this;
		}
		
		/**
		 * Override whether the geometry engine should be used.
		 * By default this is {@link GeometryEngine#isAvailable()}; setting it to true has no effect if 
		 * the engine is not available.
		 * @param available
		 * @return this builder
		 */
		public Builder geometryAvailable(boolean available) {
			this.geometryAvailable = available;
			return this;
		}
		
		/**
		 * Build the pipeline.
		 * @return
		 */
		public OverlapPipeline build() {
			return new OverlapPipeline(this);
		}
		
	}

}
