package com.github.micycle1.wavesweep.geometry;

import java.util.Objects;

import com.github.micycle1.wavesweep.SweepConstants;

/**
 * Axis-aligned geographic box given by its south-west and north-east corners.
 * <p>
 * {@code south <= north} always holds. Longitudes are not ordered: a box whose
 * west longitude is greater than its east longitude wraps the antimeridian.
 * Boxes built from raw polygon longitudes (e.g. 170 to 190) do not wrap and are
 * used as is.
 */
public class BoundingBox {

	private final Position sw;
	private final Position ne;

	public BoundingBox(Position sw, Position ne) {
		this.sw = Objects.requireNonNull(sw, "sw");
		this.ne = Objects.requireNonNull(ne, "ne");
		if (sw.getLat() > ne.getLat()) {
			throw new IllegalArgumentException("South " + sw.getLat() + " is above north " + ne.getLat());
		}
	}

	public static BoundingBox of(double south, double west, double north, double east) {
		return new BoundingBox(new Position(south, west), new Position(north, east));
	}

	/**
	 * Smallest non-wrapping box containing every position, using raw
	 * longitudes.
	 *
	 * @param positions at least one position
	 * @return the enclosing box
	 * @throws IllegalArgumentException if {@code positions} is empty
	 */
	public static BoundingBox fromPositions(Iterable<? extends Position> positions) {
		double minLat = Double.POSITIVE_INFINITY;
		double minLng = Double.POSITIVE_INFINITY;
		double maxLat = Double.NEGATIVE_INFINITY;
		double maxLng = Double.NEGATIVE_INFINITY;
		for (Position p : positions) {
			minLat = Math.min(minLat, p.getLat());
			maxLat = Math.max(maxLat, p.getLat());
			minLng = Math.min(minLng, p.getLng());
			maxLng = Math.max(maxLng, p.getLng());
		}
		if (minLat == Double.POSITIVE_INFINITY) {
			throw new IllegalArgumentException("Cannot bound an empty set of positions");
		}
		return of(minLat, minLng, maxLat, maxLng);
	}

	/**
	 * @return a box covering both this box and {@code other}, using raw
	 *         longitudes
	 */
	public BoundingBox union(BoundingBox other) {
		return of(Math.min(getSouth(), other.getSouth()), Math.min(getWest(), other.getWest()), Math.max(getNorth(), other.getNorth()),
				Math.max(getEastUnwrapped(), other.getEastUnwrapped()));
	}

	public Position getSw() {
		return sw;
	}

	public Position getNe() {
		return ne;
	}

	public double getSouth() {
		return sw.getLat();
	}

	public double getNorth() {
		return ne.getLat();
	}

	public double getWest() {
		return sw.getLng();
	}

	public double getEast() {
		return ne.getLng();
	}

	public boolean wrapsAntimeridian() {
		return getWest() > getEast();
	}

	/**
	 * East longitude shifted by 360 when the box wraps, so that
	 * {@code west <= eastUnwrapped} always holds.
	 */
	public double getEastUnwrapped() {
		return wrapsAntimeridian() ? getEast() + 360 : getEast();
	}

	/**
	 * @return the east–west extent in degrees of longitude
	 */
	public double getWidth() {
		return getEastUnwrapped() - getWest();
	}

	/**
	 * @return the north–south extent in degrees of latitude
	 */
	public double getHeight() {
		return getNorth() - getSouth();
	}

	public Position getCenter() {
		double lng = getWest() + getWidth() / 2;
		if (wrapsAntimeridian()) {
			lng = GeoUtils.normalizeLongitude(lng);
		}
		return new Position((getSouth() + getNorth()) / 2, lng);
	}

	/**
	 * Latitude at which the box is widest on the ground: 0 if the box straddles
	 * the equator, otherwise whichever bound is closer to the equator. East–west
	 * distances are largest there.
	 */
	public double getLatitudeOfWidestPart() {
		if (getSouth() <= 0 && getNorth() >= 0) {
			return 0;
		}
		return Math.abs(getSouth()) < Math.abs(getNorth()) ? getSouth() : getNorth();
	}

	public boolean contains(Position p) {
		if (p.getLat() < getSouth() || p.getLat() > getNorth()) {
			return false;
		}
		if (!wrapsAntimeridian() && p.getLng() >= getWest() && p.getLng() <= getEast()) {
			return true;
		}
		return GeoUtils.isLongitudeInRange(p.getLng(), getWest(), getEast());
	}

	/**
	 * Whether the box has (almost) no width or no height.
	 */
	public boolean isDegenerate() {
		return getWidth() <= SweepConstants.COORDINATE_EPSILON || getHeight() <= SweepConstants.COORDINATE_EPSILON;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof BoundingBox)) {
			return false;
		}
		BoundingBox other = (BoundingBox) o;
		return sw.equals(other.sw) && ne.equals(other.ne);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sw, ne);
	}

	@Override
	public String toString() {
		return "BoundingBox[sw=" + sw + ", ne=" + ne + "]";
	}
}
