package com.github.micycle1.wavesweep.wave;

/**
 * How a {@link WaveSnapshot} was derived.
 */
public enum SnapshotMode {
	/** Only the previous remaining polygons were split, traversed ones were kept. */
	ADD,
	/** The whole area was split against the current front. */
	RECOMPOSE;
}
