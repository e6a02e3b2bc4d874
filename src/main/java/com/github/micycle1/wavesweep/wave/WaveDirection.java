package com.github.micycle1.wavesweep.wave;

/**
 * Direction a sweeping wave travels in. An {@code EAST} wave starts at the west
 * edge of the area's bounding box, a {@code WEST} wave at the east edge.
 */
public enum WaveDirection {
	EAST, WEST;
}
