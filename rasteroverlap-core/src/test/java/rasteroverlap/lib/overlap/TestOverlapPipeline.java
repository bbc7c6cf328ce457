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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import com.google.gson.JsonParser;

import rasteroverlap.lib.images.servers.GeoTransform;
import rasteroverlap.lib.images.servers.RasterImage;
import rasteroverlap.lib.images.servers.RasterLoadException;
import rasteroverlap.lib.overlap.OverlapReport.Status;
import rasteroverlap.lib.regions.PixelBoundingBox;
import rasteroverlap.lib.roi.GeometryEngine;

@SuppressWarnings("javadoc")
public class TestOverlapPipeline {
	
	private static final String EMPTY_DOCUMENT = "{\"type\":\"FeatureCollection\",\"features\":[]}";
	
	@TempDir
	Path tempDir;
	
	private static RasterImage createRaster(String name, int width, int height, int maskValue, GeoTransform transform) {
		var mask = new byte[width * height];
		Arrays.fill(mask, (byte)maskValue);
		return new RasterImage.Builder(width, height)
				.name(name)
				.mask(mask)
				.transform(transform)
				.build();
	}
	
	private static Coordinate[] coords(double... xy) {
		var coords = new Coordinate[xy.length / 2];
		for (int i = 0; i < coords.length; i++)
			coords[i] = new Coordinate(xy[i*2], xy[i*2+1]);
		return coords;
	}
	
	private static OverlapPipeline createPipeline() {
		return OverlapPipeline.builder().build();
	}
	
	@Test
	public void test_overlappingRasters() {
		var rasterA = createRaster("A", 10, 10, 255, GeoTransform.create(0, 1, 0, 0, 0, 1));
		var rasterB = createRaster("B", 5, 5, 255, GeoTransform.create(5, 1, 0, 5, 0, 1));
		var report = createPipeline().run(rasterA, rasterB);
		
		assertEquals(Status.OVERLAP, report.getStatus());
		assertEquals(RasterState.DATA, report.getExtentA().getState());
		assertEquals(RasterState.DATA, report.getExtentB().getState());
		assertTrue(report.getRastersWithoutData().isEmpty());
		
		assertArrayEquals(coords(0, 0, 10, 0, 10, 10, 0, 10, 0, 0), 
				report.getExtentA().getPolygon().orElseThrow().getCoordinates());
		assertArrayEquals(coords(5, 5, 10, 5, 10, 10, 5, 10, 5, 5), 
				report.getExtentB().getPolygon().orElseThrow().getCoordinates());
		assertEquals(PixelBoundingBox.createInstance(0, 0, 4, 4), report.getExtentB().getPixelBounds().orElseThrow());
		
		var overlap = report.getOverlap().getGeometry().orElseThrow();
		assertEquals(new Envelope(5, 10, 5, 10), overlap.getEnvelopeInternal());
		
		var document = JsonParser.parseString(report.getDocument().orElseThrow()).getAsJsonObject();
		var features = document.getAsJsonArray("features");
		assertEquals(1, features.size());
		assertEquals(JsonParser.parseString("[[[5.0,5.0],[10.0,5.0],[10.0,10.0],[5.0,10.0],[5.0,5.0]]]"),
				features.get(0).getAsJsonObject().getAsJsonObject("geometry").get("coordinates"));
		
		// Engine is released after each run
		assertFalse(GeometryEngine.isInitialized());
	}
	
	@Test
	public void test_rasterWithoutData() {
		var rasterA = createRaster("A", 10, 10, 255, GeoTransform.create(0, 1, 0, 0, 0, 1));
		var rasterB = createRaster("B", 10, 10, 0, GeoTransform.create(0, 1, 0, 0, 0, 1));
		var report = createPipeline().run(rasterA, rasterB);
		
		assertEquals(Status.NO_DATA, report.getStatus());
		assertEquals(RasterState.DATA, report.getExtentA().getState());
		assertEquals(RasterState.NO_DATA, report.getExtentB().getState());
		assertFalse(report.getExtentB().getPolygon().isPresent());
		assertFalse(report.getExtentB().getGeoBounds().isPresent());
		assertEquals(List.of("B"), report.getRastersWithoutData());
		assertTrue(report.getOverlap().isEmpty());
		assertEquals(JsonParser.parseString(EMPTY_DOCUMENT), JsonParser.parseString(report.getDocument().orElseThrow()));
	}
	
	@Test
	public void test_bothRastersWithoutData() {
		var rasterA = createRaster("A", 4, 4, 0, null);
		var rasterB = createRaster("B", 4, 4, 128, null);
		var report = createPipeline().run(rasterA, rasterB);
		assertEquals(Status.NO_DATA, report.getStatus());
		assertEquals(List.of("A", "B"), report.getRastersWithoutData());
		assertEquals(JsonParser.parseString(EMPTY_DOCUMENT), JsonParser.parseString(report.getDocument().orElseThrow()));
		assertFalse(GeometryEngine.isInitialized());
	}
	
	@Test
	public void test_disjointRasters() {
		var rasterA = createRaster("A", 1, 1, 255, GeoTransform.create(0, 1, 0, 0, 0, 1));
		var rasterB = createRaster("B", 1, 1, 255, GeoTransform.create(5, 1, 0, 5, 0, 1));
		var report = createPipeline().run(rasterA, rasterB);
		
		assertEquals(Status.NO_OVERLAP, report.getStatus());
		assertArrayEquals(coords(0, 0, 1, 0, 1, 1, 0, 1, 0, 0), report.getExtentA().getPolygon().orElseThrow().getCoordinates());
		assertArrayEquals(coords(5, 5, 6, 5, 6, 6, 5, 6, 5, 5), report.getExtentB().getPolygon().orElseThrow().getCoordinates());
		assertTrue(report.getOverlap().isEmpty());
		assertEquals(JsonParser.parseString(EMPTY_DOCUMENT), JsonParser.parseString(report.getDocument().orElseThrow()));
	}
	
	@Test
	public void test_ungeoreferenced() {
		// Both rasters use the (x, height - y) fallback
		var maskA = new byte[6 * 6];
		for (int y = 0; y < 3; y++)
			Arrays.fill(maskA, y * 6, y * 6 + 6, (byte)255);
		var rasterA = new RasterImage.Builder(6, 6).name("A").mask(maskA).build();
		var rasterB = createRaster("B", 6, 6, 255, null);
		var report = createPipeline().run(rasterA, rasterB);
		
		assertEquals(Status.OVERLAP, report.getStatus());
		assertArrayEquals(coords(0, 6, 6, 6, 6, 3, 0, 3, 0, 6), report.getExtentA().getPolygon().orElseThrow().getCoordinates());
		assertEquals(new Envelope(0, 6, 3, 6), report.getOverlap().getGeometry().orElseThrow().getEnvelopeInternal());
	}
	
	@Test
	public void test_parallelGivesSameDocument() {
		var rasterA = createRaster("A", 20, 10, 255, GeoTransform.createNorthUp(100, 200, 0.5, -0.5));
		var rasterB = createRaster("B", 10, 20, 255, GeoTransform.createNorthUp(103, 198, 0.5, -0.5));
		var sequential = OverlapPipeline.builder().parallel(false).build().run(rasterA, rasterB);
		var parallel = OverlapPipeline.builder().parallel(true).build().run(rasterA, rasterB);
		assertEquals(Status.OVERLAP, sequential.getStatus());
		assertEquals(sequential.getDocument().orElseThrow(), parallel.getDocument().orElseThrow());
		assertEquals("A", parallel.getExtentA().getName());
		assertEquals("B", parallel.getExtentB().getName());
	}
	
	@Test
	public void test_concurrentRunsShareEngine() throws InterruptedException, ExecutionException {
		var rasterA = createRaster("A", 10, 10, 255, GeoTransform.create(0, 1, 0, 0, 0, 1));
		var rasterB = createRaster("B", 5, 5, 255, GeoTransform.create(5, 1, 0, 5, 0, 1));
		var pipeline = OverlapPipeline.builder().parallel(true).build();
		var expected = pipeline.run(rasterA, rasterB).getDocument().orElseThrow();
		
		var pool = Executors.newFixedThreadPool(8);
		try {
			List<Future<OverlapReport>> futures = new ArrayList<>();
			for (int i = 0; i < 200; i++)
				futures.add(pool.submit(() -> pipeline.run(rasterA, rasterB)));
			for (var future : futures) {
				var report = future.get();
				assertEquals(Status.OVERLAP, report.getStatus());
				assertEquals(expected, report.getDocument().orElseThrow());
			}
		} finally {
			pool.shutdown();
			assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
		}
		// Every run released its hold on the engine
		assertFalse(GeometryEngine.isInitialized());
	}
	
	@Test
	public void test_geometryUnavailable() throws IOException {
		var rasterA = createRaster("A", 10, 10, 255, GeoTransform.create(0, 1, 0, 0, 0, 1));
		var rasterB = createRaster("B", 5, 5, 255, GeoTransform.create(5, 1, 0, 5, 0, 1));
		var pipeline = OverlapPipeline.builder()
				.geometryAvailable(false)
				.outputPath(tempDir.resolve("unavailable.geojson"))
				.build();
		var report = pipeline.run(rasterA, rasterB);
		assertEquals(Status.UNAVAILABLE, report.getStatus());
		// Rasters are still scanned
		assertTrue(report.getExtentA().hasData());
		assertTrue(report.getExtentB().hasData());
		assertFalse(report.getDocument().isPresent());
		assertFalse(GeometryEngine.isInitialized());
		
		writeRaster("a.png", 4, 4, "1\n0\n0\n1\n0.5\n0.5\n");
		writeRaster("b.png", 4, 4, "1\n0\n0\n1\n2.5\n2.5\n");
		report = pipeline.runFiles(tempDir.resolve("a.png"), tempDir.resolve("b.png"));
		assertEquals(Status.UNAVAILABLE, report.getStatus());
		assertFalse(Files.exists(pipeline.getOutputPath()));
	}
	
	private Path writeRaster(String name, int width, int height, String worldFile) throws IOException {
		var img = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				img.setRGB(x, y, 0xFF808080);
		}
		var path = tempDir.resolve(name);
		assertTrue(ImageIO.write(img, "png", path.toFile()));
		if (worldFile != null) {
			var worldName = name.substring(0, name.lastIndexOf('.')) + ".pgw";
			Files.writeString(tempDir.resolve(worldName), worldFile, StandardCharsets.UTF_8);
		}
		return path;
	}
	
	@Test
	public void test_runFiles() throws IOException {
		// World files equivalent to transforms [0,1,0,0,0,1] and [5,1,0,5,0,1]
		var pathA = writeRaster("orto1.png", 10, 10, "1\n0\n0\n1\n0.5\n0.5\n");
		var pathB = writeRaster("orto2.png", 5, 5, "1\n0\n0\n1\n5.5\n5.5\n");
		var output = tempDir.resolve("intersection.geojson");
		var pipeline = OverlapPipeline.builder()
				.outputPath(output)
				.build();
		var report = pipeline.runFiles(pathA, pathB);
		
		assertEquals(Status.OVERLAP, report.getStatus());
		assertEquals("orto1.png", report.getExtentA().getName());
		var written = Files.readString(output, StandardCharsets.UTF_8);
		assertEquals(report.getDocument().orElseThrow(), written);
		var coordinates = JsonParser.parseString(written).getAsJsonObject()
				.getAsJsonArray("features").get(0).getAsJsonObject()
				.getAsJsonObject("geometry").get("coordinates");
		assertEquals(JsonParser.parseString("[[[5.0,5.0],[10.0,5.0],[10.0,10.0],[5.0,10.0],[5.0,5.0]]]"), coordinates);
	}
	
	@Test
	public void test_runFilesLoadFailure() throws IOException {
		var pathA = writeRaster("orto1.png", 4, 4, null);
		var missing = tempDir.resolve("missing.tif");
		var output = tempDir.resolve("out.geojson");
		var pipeline = OverlapPipeline.builder().outputPath(output).build();
		
		var e = assertThrows(RasterLoadException.class, () -> pipeline.runFiles(pathA, missing));
		assertEquals(missing, e.getPath());
		assertThrows(RasterLoadException.class, () -> pipeline.runFiles(missing, pathA));
		assertFalse(Files.exists(output));
		assertFalse(GeometryEngine.isInitialized());
	}
	
	@Test
	public void test_diagnostics() {
		var mask = new byte[] {(byte)255, 0, 0, (byte)255};
		var raster = new RasterImage.Builder(2, 2).name("diag.tif").mask(mask)
				.transform(GeoTransform.createNorthUp(10, 20, 0.5, -0.5)).build();
		var lines = RasterDiagnostics.describe(raster);
		assertTrue(lines.contains("File: diag.tif"));
		assertTrue(lines.contains("Size: 2 x 2"));
		assertTrue(lines.contains("Opaque pixels: 2 of 4 (50%)"));
		assertTrue(lines.contains("Geotransform: 10, 0.5, 0, 20, 0, -0.5"));
		
		var plain = new RasterImage.Builder(2, 2).mask(mask).build();
		assertTrue(RasterDiagnostics.describe(plain).contains("No geotransform found"));
	}

}
