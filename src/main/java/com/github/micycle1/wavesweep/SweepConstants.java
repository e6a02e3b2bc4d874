package com.github.micycle1.wavesweep;

public class SweepConstants {

	/** Equatorial radius of the WGS84 ellipsoid, in metres. */
	public static final double EARTH_RADIUS = 6378137.0;
	// tolerance (degrees) under which a coordinate is considered to lie on a cut
	public static final double COORDINATE_EPSILON = 1e-9;
	public static final double ZERO_AREA = 1e-12;
	public static final double ZERO_DIST = 1e-10; // metres
	/**
	 * Latitude bound of the Web Mercator projection. Latitudes beyond it are
	 * clamped before projecting.
	 */
	public static final double MAX_MERCATOR_LATITUDE = 85.05112878;
	public static final int TILE_SIZE = 256;
	// zoom levels closer than this are the same to a renderer
	public static final double ZOOM_EPSILON = 1e-9;

	private SweepConstants() {
	}
}
