package com.github.micycle1.wavesweep.geometry;

import static com.github.micycle1.wavesweep.SweepConstants.EARTH_RADIUS;

/**
 * Spherical distance helpers. Distances are in metres, angles in degrees.
 */
public final class GeoUtils {

	private GeoUtils() {
	}

	/**
	 * Great-circle (haversine) distance between two positions.
	 */
	public static double haversine(Position a, Position b) {
		double dLat = Math.toRadians(b.getLat() - a.getLat());
		double dLng = Math.toRadians(b.getLng() - a.getLng());
		double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
				+ Math.cos(Math.toRadians(a.getLat())) * Math.cos(Math.toRadians(b.getLat())) * Math.sin(dLng / 2) * Math.sin(dLng / 2);
		h = Math.min(1.0, Math.max(0.0, h)); // rounding can push h outside [0, 1]
		return 2 * EARTH_RADIUS * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
	}

	/**
	 * Haversine distance between two longitudes taken on the same latitude. Near
	 * the poles this tends to zero; it never returns NaN.
	 *
	 * @param lng1     first longitude
	 * @param lng2     second longitude
	 * @param latitude the shared latitude
	 * @return the distance in metres
	 */
	public static double distanceAlongLatitude(double lng1, double lng2, double latitude) {
		double cosLat = Math.cos(Math.toRadians(latitude));
		double s = cosLat * Math.sin(Math.toRadians(lng2 - lng1) / 2);
		double h = Math.min(1.0, s * s);
		return 2 * EARTH_RADIUS * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
	}

	/**
	 * Length of the parallel arc between two longitudes ({@code R·Δλ·cos φ}).
	 * Cheaper than {@link #distanceAlongLatitude(double, double, double)} and
	 * linear in the longitude difference.
	 */
	public static double arcLengthAlongLatitude(double lng1, double lng2, double latitude) {
		return Math.abs(EARTH_RADIUS * Math.toRadians(lng2 - lng1) * Math.cos(Math.toRadians(latitude)));
	}

	/**
	 * Whether a longitude lies within [west, east], where {@code west > east}
	 * denotes a range wrapping the antimeridian.
	 */
	public static boolean isLongitudeInRange(double lng, double west, double east) {
		double l = normalizeLongitude(lng);
		double w = normalizeLongitude(west);
		double e = normalizeLongitude(east);
		if (w <= e) {
			return l >= w && l <= e;
		}
		return l >= w || l <= e;
	}

	/**
	 * Maps a longitude into [-180, 180).
	 */
	public static double normalizeLongitude(double lng) {
		if (lng >= -180 && lng < 180) {
			return lng;
		}
		double l = (lng + 180) % 360;
		if (l < 0) {
			l += 360;
		}
		return l - 180;
	}
}
