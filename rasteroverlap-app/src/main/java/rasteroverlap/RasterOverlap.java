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

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import rasteroverlap.lib.common.GeneralTools;
import rasteroverlap.lib.images.servers.RasterLoadException;
import rasteroverlap.lib.overlap.OverlapPipeline;
import rasteroverlap.logging.LogManager;
import rasteroverlap.logging.LogManager.LogLevel;

/**
 * Command line entry point.
 * <p>
 * Computes the overlap between the valid data of two georeferenced rasters and writes it as GeoJSON.
 */
@Command(name = "rasteroverlap",
	description = "Compute the overlap of the valid (opaque) areas of two rasters and write it as GeoJSON.",
	footer = {"", "Copyright(c) RasterOverlap developers (2025)"},
	mixinStandardHelpOptions = true, versionProvider = RasterOverlap.VersionProvider.class)
public class RasterOverlap implements Callable<Integer> {
	
	private static final Logger logger = LoggerFactory.getLogger(RasterOverlap.class);
	
	@Parameters(index = "0", arity = "0..1", description = "First raster (default = ${DEFAULT-VALUE}).")
	private Path rasterA = Path.of("orto1.tif");
	
	@Parameters(index = "1", arity = "0..1", description = "Second raster (default = ${DEFAULT-VALUE}).")
	private Path rasterB = Path.of("orto2.tif");
	
	@Option(names = {"-o", "--output"}, description = "Output GeoJSON file (default = ${DEFAULT-VALUE}).")
	private Path output = Path.of(OverlapPipeline.DEFAULT_OUTPUT);
	
	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"})
	private LogLevel logLevel = LogLevel.INFO;
	
	@Option(names = {"--log-file"}, description = "Also write log messages to this file.")
	private File logFile;
	
	@Option(names = {"-p", "--parallel"}, description = "Scan both rasters in parallel.")
	private boolean parallel;
	
	/**
	 * Main method to run from the command line.
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = execute(args);
		if (exitCode != 0)
			logger.warn("Calling System.exit with exit code {}", exitCode);
		System.exit(exitCode);
	}
	
	/**
	 * Parse the arguments and run, without exiting the JVM.
	 * @param args
	 * @return the exit code
	 */
	static int execute(String... args) {
		CommandLine cmd = new CommandLine(new RasterOverlap());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		cmd.setExitCodeExceptionMapper(t -> 1);
		return cmd.execute(args);
	}
	
	@Override
	public Integer call() throws Exception {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
		if (logFile != null)
			LogManager.logToFile(logFile);
		
		var pipeline = OverlapPipeline.builder()
				.outputPath(output)
				.parallel(parallel)
				.build();
		
		try {
			var report = pipeline.runFiles(rasterA, rasterB);
			logger.debug("{}", report);
			return 0;
		} catch (RasterLoadException e) {
			logger.error(e.getLocalizedMessage());
			logger.debug(e.getLocalizedMessage(), e);
			return 1;
		} finally {
			if (logFile != null)
				LogManager.stopLoggingToFile();
		}
	}
	
	
	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = GeneralTools.getPackageVersion(RasterOverlap.class);
			var strings = new ArrayList<String>();
			if (version == null)
				strings.add("RasterOverlap (version unknown)");
			else
				strings.add("RasterOverlap v" + version);
			strings.add("Java " + System.getProperty("java.version"));
			return strings.toArray(String[]::new);
		}
		
	}

}
