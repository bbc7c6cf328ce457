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

package rasteroverlap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParser;

import rasteroverlap.logging.LogManager;
import rasteroverlap.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestRasterOverlap {
	
	@TempDir
	Path tempDir;
	
	@AfterEach
	public void resetLogging() {
		LogManager.stopLoggingToFile();
		LogManager.setRootLogLevel(LogLevel.INFO);
	}
	
	private Path writeRaster(String name, int size, double originX, double originY, boolean opaque) throws IOException {
		var img = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
		int argb = opaque ? 0xFF4080C0 : 0x004080C0;
		for (int y = 0; y < size; y++) {
			for (int x = 0; x < size; x++)
				img.setRGB(x, y, argb);
		}
		var path = tempDir.resolve(name + ".png");
		assertTrue(ImageIO.write(img, "png", path.toFile()));
		// North-up world file with 1-unit pixels
		var worldFile = "1\n0\n0\n-1\n" + (originX + 0.5) + "\n" + (originY - 0.5) + "\n";
		Files.writeString(tempDir.resolve(name + ".pgw"), worldFile, StandardCharsets.UTF_8);
		return path;
	}
	
	@Test
	public void test_overlap() throws IOException {
		var a = writeRaster("orto1", 10, 0, 10, true);
		var b = writeRaster("orto2", 10, 5, 15, true);
		var output = tempDir.resolve("result.geojson");
		int exitCode = RasterOverlap.execute("-o", output.toString(), a.toString(), b.toString());
		assertEquals(0, exitCode);
		
		var features = JsonParser.parseString(Files.readString(output, StandardCharsets.UTF_8))
				.getAsJsonObject().getAsJsonArray("features");
		assertEquals(1, features.size());
		var coordinates = features.get(0).getAsJsonObject().getAsJsonObject("geometry").get("coordinates");
		assertEquals(JsonParser.parseString("[[[5.0,5.0],[10.0,5.0],[10.0,10.0],[5.0,10.0],[5.0,5.0]]]"), coordinates);
	}
	
	@Test
	public void test_noData() throws IOException {
		var a = writeRaster("orto1", 4, 0, 4, true);
		var b = writeRaster("orto2", 4, 0, 4, false);
		var output = tempDir.resolve("result.geojson");
		int exitCode = RasterOverlap.execute("--parallel", "--log", "warn", "-o", output.toString(), a.toString(), b.toString());
		assertEquals(0, exitCode);
		assertEquals(JsonParser.parseString("{\"type\":\"FeatureCollection\",\"features\":[]}"),
				JsonParser.parseString(Files.readString(output, StandardCharsets.UTF_8)));
	}
	
	@Test
	public void test_loadFailure() throws IOException {
		var a = writeRaster("orto1", 4, 0, 4, true);
		var output = tempDir.resolve("result.geojson");
		int exitCode = RasterOverlap.execute("-o", output.toString(), a.toString(), tempDir.resolve("missing.tif").toString());
		assertEquals(1, exitCode);
		assertFalse(Files.exists(output));
	}
	
	@Test
	public void test_logFile() throws IOException {
		var a = writeRaster("orto1", 4, 0, 4, true);
		var b = writeRaster("orto2", 4, 2, 6, true);
		var output = tempDir.resolve("result.geojson");
		var logFile = tempDir.resolve("overlap.log");
		int exitCode = RasterOverlap.execute("--log", "info", "--log-file", logFile.toString(), "-o", output.toString(), a.toString(), b.toString());
		assertEquals(0, exitCode);
		assertTrue(Files.exists(output));
		assertTrue(Files.exists(logFile));
		assertTrue(Files.readString(logFile, StandardCharsets.UTF_8).contains("File created"));
		// The log file is closed once the command completes
		assertFalse(LogManager.isLoggingToFile());
	}
	
	@Test
	public void test_help() {
		assertEquals(0, RasterOverlap.execute("--help"));
		assertEquals(0, RasterOverlap.execute("--version"));
		assertEquals(2, RasterOverlap.execute("--no-such-option"));
	}

}
