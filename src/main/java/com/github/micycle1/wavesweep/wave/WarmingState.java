package com.github.micycle1.wavesweep.wave;

/**
 * How close an observer is to being reached by the wave front.
 */
public enum WarmingState {
	/** No position, outside the area, or the hit is still far away. */
	NONE,
	WARMING,
	ABOUT_TO_BE_HIT,
	HIT;
}
