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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.text.NumberFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static helpers for file names, version lookup and number formatting.
 */
public final class GeneralTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GeneralTools.class);
	
	private static final String VERSION_RESOURCE = "/VERSION";
	
	/**
	 * Prototype formats per locale. These are cloned before use, since NumberFormat is not thread-safe.
	 */
	private static final Map<Locale, NumberFormat> prototypes = new ConcurrentHashMap<>();
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}
	
	/**
	 * Look up the version of the jar that provides a class.
	 * The manifest implementation version is used if present, otherwise a {@code VERSION} resource 
	 * at the root of the classpath.
	 * 
	 * @param cls the class whose package should be checked
	 * @return the version, or null if it cannot be determined
	 */
	public static String getPackageVersion(Class<?> cls) {
		var pkg = cls.getPackage();
		String version = pkg == null ? null : pkg.getImplementationVersion();
		if (version == null)
			version = readVersionResource(cls);
		return version == null || version.isBlank() ? null : version.strip();
	}
	
	private static String readVersionResource(Class<?> cls) {
		try (var stream = cls.getResourceAsStream(VERSION_RESOURCE)) {
			return stream == null ? null : readInputStreamAsString(stream);
		} catch (IOException e) {
			logger.error("Unable to read {}: {}", VERSION_RESOURCE, e.getLocalizedMessage(), e);
			return null;
		}
	}
	
	/**
	 * Get the lower-case extension of a file name, including the leading dot.
	 * <p>
	 * Only the text after the final dot is considered, and it must consist of word characters.
	 * A name ending with a dot has no extension.
	 * 
	 * @param name
	 * @return the extension, or an empty optional if none is found
	 * @see #getNameWithoutExtension(File)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name);
		int dot = name.lastIndexOf('.');
		if (dot < 0 || dot == name.length() - 1)
			return Optional.empty();
		for (int i = dot + 1; i < name.length(); i++) {
			char c = name.charAt(i);
			if (!(Character.isLetterOrDigit(c) || c == '_'))
				return Optional.empty();
		}
		return Optional.of(name.substring(dot).toLowerCase(Locale.ROOT));
	}
	
	/**
	 * Get the extension of a file, as {@link #getExtension(String)}.
	 * @param file
	 * @return
	 */
	public static Optional<String> getExtension(File file) {
		return getExtension(Objects.requireNonNull(file).getName());
	}
	
	/**
	 * Strip the extension (if any) from a file name.
	 * @param file
	 * @return the name of the file, without its extension
	 * @see #getExtension(File)
	 */
	public static String getNameWithoutExtension(File file) {
		String name = file.getName();
		int extLength = getExtension(name).map(String::length).orElse(0);
		return name.substring(0, name.length() - extLength);
	}
	
	/**
	 * Read all remaining bytes of a stream as UTF-8 text. The stream is left open.
	 * @param stream
	 * @return
	 * @throws IOException
	 */
	public static String readInputStreamAsString(final InputStream stream) throws IOException {
		return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
	}
	
	/**
	 * Format a number for display, without grouping separators.
	 * 
	 * @param locale locale controlling the decimal separator
	 * @param value
	 * @param maxDecimalPlaces maximum number of digits after the decimal separator
	 * @return
	 */
	public static String formatNumber(final Locale locale, final double value, final int maxDecimalPlaces) {
		var prototype = prototypes.computeIfAbsent(locale, l -> {
			var format = NumberFormat.getInstance(l);
			format.setGroupingUsed(false);
			return format;
		});
		var format = (NumberFormat)prototype.clone();
		format.setMaximumFractionDigits(maxDecimalPlaces);
		return format.format(value);
	}
	
	/**
	 * Join the values of an array, each formatted with {@link #formatNumber(Locale, double, int)}.
	 * 
	 * @param locale
	 * @param array
	 * @param delimiter
	 * @param nDecimalPlaces
	 * @return
	 */
	public static String arrayToString(final Locale locale, final double[] array, final String delimiter, final int nDecimalPlaces) {
		return Arrays.stream(array)
				.mapToObj(v -> formatNumber(locale, v, nDecimalPlaces))
				.collect(Collectors.joining(delimiter));
	}

}
