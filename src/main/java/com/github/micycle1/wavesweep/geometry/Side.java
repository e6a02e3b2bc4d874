package com.github.micycle1.wavesweep.geometry;

/**
 * Position of a point relative to a {@link Cut}.
 */
public enum Side {
	WEST, EAST, ON;
}
