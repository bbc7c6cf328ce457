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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import rasteroverlap.lib.roi.OverlapResult;

/**
 * Outcome of running an {@link OverlapPipeline} for two rasters.
 * <p>
 * The report records which raster (if any) lacked valid data. This information is not 
 * included in the GeoJSON document.
 */
public class OverlapReport {
	
	/**
	 * Overall status of the overlap calculation.
	 */
	public enum Status {
		/**
		 * Both rasters have data and their extents overlap.
		 */
		OVERLAP,
		/**
		 * Both rasters have data but their extents do not overlap (or the intersection failed).
		 */
		NO_OVERLAP,
		/**
		 * At least one raster has no valid pixels.
		 */
		NO_DATA,
		/**
		 * The geometry engine is not available, so no overlap was computed and no document was created.
		 */
		UNAVAILABLE
	}
	
	private final RasterExtent extentA;
	private final RasterExtent extentB;
	private final Status status;
	private final OverlapResult overlap;
	private final String document;
	
	OverlapReport(RasterExtent extentA, RasterExtent extentB, Status status, OverlapResult overlap, String document) {
		this.extentA = Objects.requireNonNull(extentA);
		this.extentB = Objects.requireNonNull(extentB);
		this.status = Objects.requireNonNull(status);
		this.overlap = overlap == null ? OverlapResult.empty() : overlap;
		this.document = document;
	}
	
	public RasterExtent getExtentA() {
		return extentA;
	}
	
	public RasterExtent getExtentB() {
		return extentB;
	}
	
	public Status getStatus() {
		return status;
	}
	
	/**
	 * Get the overlap result, which is empty unless the status is {@link Status#OVERLAP}.
	 * @return
	 */
	public OverlapResult getOverlap() {
		return overlap;
	}
	
	/**
	 * Get the serialized GeoJSON document.
	 * @return the document, or an empty optional if the status is {@link Status#UNAVAILABLE}
	 */
	public Optional<String> getDocument() {
		return Optional.ofNullable(document);
	}
	
	/**
	 * Get the names of rasters that had no valid pixels.
	 * @return
	 */
	public List<String> getRastersWithoutData() {
		List<String> names = new ArrayList<>();
		if (!extentA.hasData())
			names.add(extentA.getName());
		if (!extentB.hasData())
			names.add(extentB.getName());
		return names;
	}
	
	@Override
	public String toString() {
		return "OverlapReport[" + status + ", A=" + extentA.getState() + ", B=" + extentB.getState() + "]";
	}

}
