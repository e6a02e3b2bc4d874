package com.github.micycle1.wavesweep.viewport;

public enum FitMode {
	/**
	 * Minimum zoom shows the whole event area; used where the camera follows the
	 * wave on its own.
	 */
	TIGHT_FIT,
	/**
	 * Minimum zoom fills the screen with the event along its constraining
	 * dimension, the other dimension can be panned; used for free exploration.
	 */
	ASPECT_FIT;
}
