package com.github.micycle1.wavesweep.viewport;

/**
 * Size of the map view in pixels.
 */
public class ScreenSize {

	private final double width;
	private final double height;

	public ScreenSize(double width, double height) {
		this.width = width;
		this.height = height;
	}

	public double getWidth() {
		return width;
	}

	public double getHeight() {
		return height;
	}

	/**
	 * Both dimensions are finite and positive.
	 */
	public boolean isValid() {
		return width > 0 && height > 0 && Double.isFinite(width) && Double.isFinite(height);
	}

	/**
	 * @return width / height; only meaningful for a valid size
	 */
	public double getAspect() {
		return width / height;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ScreenSize)) {
			return false;
		}
		ScreenSize other = (ScreenSize) o;
		return Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(width) + Double.hashCode(height);
	}

	@Override
	public String toString() {
		return width + "x" + height;
	}
}
