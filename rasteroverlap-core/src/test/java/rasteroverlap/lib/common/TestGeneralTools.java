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

package rasteroverlap.lib.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_getExtension() {
		assertEquals(".tif", GeneralTools.getExtension("orto1.tif").orElse(null));
		assertEquals(".tif", GeneralTools.getExtension("ORTO1.TIF").orElse(null));
		assertEquals(".pgw", GeneralTools.getExtension(new File("/some/dir/image.with.dots.pgw")).orElse(null));
		assertFalse(GeneralTools.getExtension("no_extension").isPresent());
		assertFalse(GeneralTools.getExtension("trailing.").isPresent());
		assertFalse(GeneralTools.getExtension("odd.ex t").isPresent());
	}
	
	@Test
	public void test_getNameWithoutExtension() {
		assertEquals("orto1", GeneralTools.getNameWithoutExtension(new File("orto1.tif")));
		assertEquals("image.with.dots", GeneralTools.getNameWithoutExtension(new File("image.with.dots.PNG")));
		assertEquals("no_extension", GeneralTools.getNameWithoutExtension(new File("no_extension")));
	}
	
	@Test
	public void test_formatNumber() {
		assertEquals("1.5", GeneralTools.formatNumber(Locale.US, 1.5, 2));
		assertEquals("1.33", GeneralTools.formatNumber(Locale.US, 4.0/3.0, 2));
		assertEquals("123456789", GeneralTools.formatNumber(Locale.US, 123456789, 2));
		assertEquals("-0.1", GeneralTools.formatNumber(Locale.US, -0.1, 3));
	}
	
	@Test
	public void test_arrayToString() {
		assertEquals("0, 1.5, -2", GeneralTools.arrayToString(Locale.US, new double[] {0, 1.5, -2}, ", ", 2));
		assertEquals("", GeneralTools.arrayToString(Locale.US, new double[0], ", ", 2));
	}
	
	@Test
	public void test_readInputStreamAsString() throws IOException {
		var text = "Первая строка\nsecond line";
		var stream = new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
		assertEquals(text, GeneralTools.readInputStreamAsString(stream));
	}
	
	@Test
	public void test_packageVersion() {
		// Classes loaded from a directory have no manifest, and there is no VERSION resource for tests
		var version = GeneralTools.getPackageVersion(TestGeneralTools.class);
		assertTrue(version == null || !version.isBlank());
	}

}
