package com.github.micycle1.wavesweep.viewport;

/**
 * Half-extent of the visible region, in degrees. The camera center must stay
 * this far inside the event box for the viewport not to leave it.
 */
public class ViewportPadding {

	public static final ViewportPadding ZERO = new ViewportPadding(0, 0);

	private final double latitude;
	private final double longitude;

	public ViewportPadding(double latitude, double longitude) {
		if (!(latitude >= 0) || !(longitude >= 0)) {
			throw new IllegalArgumentException("Padding must be non-negative: " + latitude + ", " + longitude);
		}
		this.latitude = latitude;
		this.longitude = longitude;
	}

	public double getLatitude() {
		return latitude;
	}

	public double getLongitude() {
		return longitude;
	}

	public boolean isZero() {
		return latitude == 0 && longitude == 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ViewportPadding)) {
			return false;
		}
		ViewportPadding other = (ViewportPadding) o;
		return Double.compare(latitude, other.latitude) == 0 && Double.compare(longitude, other.longitude) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
	}

	@Override
	public String toString() {
		return "ViewportPadding[lat=" + latitude + ", lng=" + longitude + "]";
	}
}
