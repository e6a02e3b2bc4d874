package com.github.micycle1.wavesweep.wave;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.micycle1.wavesweep.geometry.Polygon;

/**
 * The area divided at one moment into traversed and remaining polygons.
 * Snapshots are immutable and never modified once handed out.
 */
public class WaveSnapshot {

	private final Instant timestamp;
	private final List<Polygon> traversed;
	private final List<Polygon> remaining;
	private final List<Polygon> addedTraversed;
	private final WaveFront front;
	private final SnapshotMode mode;

	public WaveSnapshot(Instant timestamp, List<Polygon> traversed, List<Polygon> remaining, List<Polygon> addedTraversed, WaveFront front,
			SnapshotMode mode) {
		this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
		this.traversed = Collections.unmodifiableList(traversed);
		this.remaining = Collections.unmodifiableList(remaining);
		this.addedTraversed = Collections.unmodifiableList(addedTraversed);
		this.front = Objects.requireNonNull(front, "front");
		this.mode = Objects.requireNonNull(mode, "mode");
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public List<Polygon> getTraversed() {
		return traversed;
	}

	public List<Polygon> getRemaining() {
		return remaining;
	}

	/**
	 * Polygons that became traversed since the previous snapshot. Equal to
	 * {@link #getTraversed()} for a {@link SnapshotMode#RECOMPOSE} snapshot.
	 */
	public List<Polygon> getAddedTraversed() {
		return addedTraversed;
	}

	public WaveFront getFront() {
		return front;
	}

	public SnapshotMode getMode() {
		return mode;
	}

	public double getTraversedArea() {
		return traversed.stream().mapToDouble(Polygon::getArea).sum();
	}

	public double getRemainingArea() {
		return remaining.stream().mapToDouble(Polygon::getArea).sum();
	}

	@Override
	public String toString() {
		return "WaveSnapshot[" + timestamp + ", " + mode + ", traversed=" + traversed.size() + ", remaining=" + remaining.size() + "]";
	}
}
