package com.github.micycle1.wavesweep.wave;

import java.time.Duration;
import java.time.Instant;

import com.github.micycle1.wavesweep.geometry.Position;

/**
 * Queries over a wave moving across an area, evaluated at the current time of
 * the wave's clock. Every wave kind answers the same queries.
 * <p>
 * An empty area never raises an error: progression is 0, positional queries
 * return null and nobody is ever hit.
 */
public interface WaveProgression {

	WaveKind getKind();

	WavePhase getPhase();

	/**
	 * @return percentage of the total duration elapsed, in [0, 100]
	 */
	double getProgression();

	Instant getStartTime();

	/**
	 * Time the front needs to cover the whole area. Zero for an empty area.
	 */
	Duration getTotalDuration();

	Instant getEndTime();

	/**
	 * Longitude of the front at the given latitude, now. For a split wave this
	 * is the eastward front.
	 *
	 * @return the longitude, or null for an empty area
	 */
	Double closestWaveLongitude(double latitude);

	/**
	 * @return the front now, or null for an empty area
	 */
	WaveFront getCurrentFront();

	/**
	 * Divides the area at the current front.
	 *
	 * @return the snapshot, or null when the area is empty or the wave has not
	 *         started
	 */
	WaveSnapshot getWavePolygons();

	/**
	 * Whether a position lies inside the area.
	 */
	boolean isPositionWithin(Position position);

	/**
	 * Instant at which the front reaches a position.
	 *
	 * @return the hit time, or null without a position or outside the area
	 */
	Instant userHitDateTime(Position position);

	/**
	 * Time left until the front reaches a position; zero or negative once it
	 * has.
	 *
	 * @return the duration, or null without a position or outside the area
	 */
	Duration timeBeforeUserHit(Position position);

	/**
	 * @return true if the position is inside the area and the front has
	 *         already passed it
	 */
	boolean hasUserBeenHit(Position position);

	WarmingState warmingState(Position position);
}
