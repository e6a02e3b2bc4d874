package com.github.micycle1.wavesweep.geometry;

import org.locationtech.jts.geom.Coordinate;

/**
 * A geographic position in degrees. Longitude is kept raw (not normalized into
 * [-180, 180]) so that rings spanning the antimeridian keep a continuous
 * longitude range; normalizing is left to callers.
 * <p>
 * Two positions are equal when their coordinates are equal, regardless of
 * whether either one is a {@link CutPosition}.
 */
public class Position {

	private final double lat;
	private final double lng;

	public Position(double lat, double lng) {
		if (!Double.isFinite(lat) || lat < -90 || lat > 90) {
			throw new IllegalArgumentException("Latitude out of range [-90, 90]: " + lat);
		}
		if (!Double.isFinite(lng)) {
			throw new IllegalArgumentException("Longitude must be finite: " + lng);
		}
		this.lat = lat;
		this.lng = lng;
	}

	public static Position of(double lat, double lng) {
		return new Position(lat, lng);
	}

	/**
	 * Creates a position from a JTS coordinate, reading x as longitude and y as
	 * latitude.
	 */
	public static Position fromCoordinate(Coordinate c) {
		return new Position(c.y, c.x);
	}

	public double getLat() {
		return lat;
	}

	public double getLng() {
		return lng;
	}

	/**
	 * @return a JTS coordinate with x = longitude and y = latitude
	 */
	public Coordinate toCoordinate() {
		return new Coordinate(lng, lat);
	}

	public boolean isCutPosition() {
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Position)) {
			return false;
		}
		Position other = (Position) o;
		return Double.compare(lat, other.lat) == 0 && Double.compare(lng, other.lng) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(lat) + Double.hashCode(lng);
	}

	@Override
	public String toString() {
		return "(" + lat + ", " + lng + ")";
	}
}
