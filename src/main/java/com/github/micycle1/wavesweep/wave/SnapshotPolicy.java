package com.github.micycle1.wavesweep.wave;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether a new snapshot may be derived from the previous one
 * ({@link SnapshotMode#ADD}) or must be computed from the whole area
 * ({@link SnapshotMode#RECOMPOSE}). The decision only depends on its arguments.
 * <p>
 * The gap threshold is a tuning knob: both modes cover the same area, ADD just
 * avoids splitting polygons that are already behind the front.
 */
public class SnapshotPolicy {

	private final Duration maxIncrementalGap;

	public SnapshotPolicy(Duration maxIncrementalGap) {
		this.maxIncrementalGap = Objects.requireNonNull(maxIncrementalGap, "maxIncrementalGap");
		if (maxIncrementalGap.isNegative()) {
			throw new IllegalArgumentException("maxIncrementalGap must not be negative: " + maxIncrementalGap);
		}
	}

	public Duration getMaxIncrementalGap() {
		return maxIncrementalGap;
	}

	/**
	 * @param previous the last snapshot handed out, or null
	 * @param now      time of the new snapshot
	 * @param front    front of the new snapshot
	 * @return {@link SnapshotMode#ADD} when the previous snapshot is recent and
	 *         its remaining polygons can be cut by {@code front}
	 */
	public SnapshotMode decide(WaveSnapshot previous, Instant now, WaveFront front) {
		if (previous == null) {
			return SnapshotMode.RECOMPOSE;
		}
		if (now.isBefore(previous.getTimestamp())) {
			return SnapshotMode.RECOMPOSE; // clock moved backwards
		}
		if (Duration.between(previous.getTimestamp(), now).compareTo(maxIncrementalGap) > 0) {
			return SnapshotMode.RECOMPOSE;
		}
		if (!front.canAdvanceFrom(previous.getFront())) {
			return SnapshotMode.RECOMPOSE;
		}
		return SnapshotMode.ADD;
	}
}
