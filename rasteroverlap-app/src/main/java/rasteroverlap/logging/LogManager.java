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

package rasteroverlap.logging;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Control the logging level and destination at runtime.
 * <p>
 * This requires logback to be the SLF4J backend; otherwise a warning is logged and requests are ignored.
 */
public class LogManager {
	
	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);
	
	private static LogLevel rootLevel = LogLevel.INFO;
	
	/**
	 * Name of the appender added by {@link #logToFile(File)}.
	 */
	static final String FILE_APPENDER_NAME = "rasteroverlap-file";
	
	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * No log messages
		 */
		OFF
	}
	
	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}
	
	static Level getLevel(LogLevel logLevel) {
		switch (logLevel) {
		case TRACE:
			return Level.TRACE;
		case DEBUG:
			return Level.DEBUG;
		case WARN:
			return Level.WARN;
		case ERROR:
			return Level.ERROR;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case INFO:
		default:
			return Level.INFO;
		}
	}
	
	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		return null;
	}
	
	/**
	 * Set the root log level.
	 * @param level
	 * @return true if the level could be applied, false otherwise
	 */
	public static synchronized boolean setRootLogLevel(LogLevel level) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot set log level without logback!");
			return false;
		}
		context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(getLevel(level));
		rootLevel = level;
		return true;
	}
	
	/**
	 * Get the root log level, as set by this manager.
	 * This is not guaranteed to match the actual root log level, in case it has been set elsewhere.
	 * @return
	 */
	public static synchronized LogLevel getRootLogLevel() {
		return rootLevel;
	}
	
	/**
	 * Send logging messages to the specified file, in addition to any existing destinations.
	 * Only one log file is used at a time: any file previously set here is closed first.
	 * @param file
	 * @return true if a file appender was added, false otherwise
	 * @see #stopLoggingToFile()
	 */
	public static synchronized boolean logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to file without logback!");
			return false;
		}
		detachFileAppender(context);
		
		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] [%-5level] %logger{36} - %msg%n");
		encoder.start();
		
		FileAppender<ILoggingEvent> appender = new FileAppender<>();
		appender.setFile(file.getAbsolutePath());
		appender.setContext(context);
		appender.setEncoder(encoder);
		appender.setName(FILE_APPENDER_NAME);
		appender.start();
		context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
		logger.debug("Logging to {}", file.getAbsolutePath());
		return true;
	}
	
	/**
	 * Stop sending messages to the file set with {@link #logToFile(File)}, and close it.
	 * @return true if a log file was closed, false if there was none
	 */
	public static synchronized boolean stopLoggingToFile() {
		var context = getLoggerContext();
		return context != null && detachFileAppender(context);
	}
	
	/**
	 * Query whether messages are currently being written to a file set with {@link #logToFile(File)}.
	 * @return
	 */
	public static synchronized boolean isLoggingToFile() {
		var context = getLoggerContext();
		return context != null && context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(FILE_APPENDER_NAME) != null;
	}
	
	private static boolean detachFileAppender(LoggerContext context) {
		var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
		var appender = root.getAppender(FILE_APPENDER_NAME);
		if (appender == null)
			return false;
		root.detachAppender(appender);
		appender.stop();
		return true;
	}

}
