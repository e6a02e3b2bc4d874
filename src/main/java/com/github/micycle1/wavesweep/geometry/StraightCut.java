package com.github.micycle1.wavesweep.geometry;

import java.util.Collections;
import java.util.List;

/**
 * A cut along a single meridian.
 */
public class StraightCut extends AbstractCut {

	private final double longitude;

	public StraightCut(double longitude) {
		if (!Double.isFinite(longitude)) {
			throw new IllegalArgumentException("Longitude must be finite: " + longitude);
		}
		this.longitude = longitude;
	}

	public double getLongitude() {
		return longitude;
	}

	@Override
	public double longitudeAt(double latitude) {
		return longitude;
	}

	@Override
	public double getMinLongitude() {
		return longitude;
	}

	@Override
	public double getMaxLongitude() {
		return longitude;
	}

	@Override
	public List<CutPosition> breakpointsBetween(double fromLat, double toLat) {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return super.toString() + "[lng=" + longitude + "]";
	}
}
