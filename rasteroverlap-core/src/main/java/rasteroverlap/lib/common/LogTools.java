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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Logging helpers for messages that should only be shown once per run, 
 * e.g. a limitation that applies to every raster sharing some property.
 */
public class LogTools {
	
	private static final Set<String> logged = ConcurrentHashMap.newKeySet();
	
	// Suppressed default constructor for non-instantiability
	private LogTools() {
		throw new AssertionError();
	}
	
	/**
	 * Log a message, unless the same logger has already logged it at the same level.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged now, false if it had been logged before
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		String key = logger.getName() + "|" + level + "|" + message;
		if (!logged.add(key))
			return false;
		logger.atLevel(level).log(message);
		return true;
	}

	/**
	 * Log a message once at INFO level.
	 * @param logger
	 * @param message
	 * @return true if the message was logged now, false if it had been logged before
	 * @see #logOnce(Logger, Level, String)
	 */
	public static boolean logOnce(Logger logger, String message) {
		return logOnce(logger, Level.INFO, message);
	}

	/**
	 * Log a warning once.
	 * @param logger
	 * @param message
	 * @return true if the message was logged now, false if it had been logged before
	 * @see #logOnce(Logger, Level, String)
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}

}
