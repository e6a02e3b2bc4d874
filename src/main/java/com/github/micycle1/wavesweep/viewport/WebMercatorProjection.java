package com.github.micycle1.wavesweep.viewport;

import com.github.micycle1.wavesweep.SweepConstants;

/**
 * Spherical Web Mercator. Latitudes are clamped to the projection's bound of
 * about ±85.05° so polar inputs stay finite.
 */
public class WebMercatorProjection implements MapProjection {

	@Override
	public double projectLongitude(double longitude) {
		return Math.toRadians(longitude);
	}

	@Override
	public double projectLatitude(double latitude) {
		double lat = Math.max(-SweepConstants.MAX_MERCATOR_LATITUDE, Math.min(SweepConstants.MAX_MERCATOR_LATITUDE, latitude));
		return Math.log(Math.tan(Math.PI / 4 + Math.toRadians(lat) / 2));
	}

	@Override
	public double unprojectLatitude(double y) {
		return Math.toDegrees(Math.atan(Math.sinh(y)));
	}
}
