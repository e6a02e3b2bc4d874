package com.github.micycle1.wavesweep.wave;

import java.util.List;

import org.apache.commons.lang3.tuple.Pair;

import com.github.micycle1.wavesweep.geometry.Polygon;

/**
 * Position of a wave's front at one moment, able to divide polygons into the
 * part it has already swept and the part still ahead of it.
 */
public abstract class WaveFront {

	private final WaveKind kind;
	private final double elapsedSeconds;

	protected WaveFront(WaveKind kind, double elapsedSeconds) {
		this.kind = kind;
		this.elapsedSeconds = elapsedSeconds;
	}

	public WaveKind getKind() {
		return kind;
	}

	/**
	 * Seconds since the wave started at which this front was taken.
	 */
	public double getElapsedSeconds() {
		return elapsedSeconds;
	}

	/**
	 * Divides a polygon along the front.
	 *
	 * @return a pair of (traversed, remaining) polygons
	 */
	public abstract Pair<List<Polygon>, List<Polygon>> partition(Polygon polygon);

	/**
	 * Whether polygons left over by {@code previous} can be cut further by this
	 * front, i.e. the fronts move the same way and this one is not behind it.
	 */
	public boolean canAdvanceFrom(WaveFront previous) {
		return previous != null && previous.getClass() == getClass() && previous.kind == kind && elapsedSeconds >= previous.elapsedSeconds;
	}
}
