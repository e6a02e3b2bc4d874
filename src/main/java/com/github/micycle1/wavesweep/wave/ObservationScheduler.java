package com.github.micycle1.wavesweep.wave;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.geometry.Position;

/**
 * Chooses how long to wait before polling a wave again: coarse while the start
 * is far away, finer as it approaches, and finest just before the observer is
 * hit.
 */
public class ObservationScheduler {

	private static final Logger LOGGER = LoggerFactory.getLogger(ObservationScheduler.class);

	static final Duration FAR_START = Duration.ofHours(1).plusMinutes(5);
	static final Duration APPROACHING_START = Duration.ofMinutes(5).plusSeconds(30);
	static final Duration NEAR_START = Duration.ofSeconds(35);
	static final Duration CRITICAL_HIT = Duration.ofSeconds(1);
	static final Duration NEAR_HIT = Duration.ofSeconds(5);

	private final WaveClock clock;

	public ObservationScheduler(WaveClock clock) {
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	/**
	 * @param wave the wave being observed
	 * @param user the observer's position, or null when unknown
	 * @return the delay before the next poll, or empty when polling can stop
	 *         (the observer has been hit and the wave is no longer running)
	 */
	public Optional<Duration> observationInterval(WaveProgression wave, Position user) {
		Instant now = clock.now();
		Duration beforeStart = Duration.between(now, wave.getStartTime());
		Duration beforeHit = wave.timeBeforeUserHit(user);
		if (beforeHit == null) {
			beforeHit = Duration.ofDays(1);
		}

		Duration interval;
		if (beforeStart.compareTo(FAR_START) > 0) {
			interval = Duration.ofHours(1);
		} else if (beforeStart.compareTo(APPROACHING_START) > 0) {
			interval = Duration.ofMinutes(5);
		} else if (beforeStart.compareTo(NEAR_START) > 0) {
			interval = Duration.ofSeconds(1);
		} else if (beforeHit.isNegative()) {
			if (wave.getPhase() == WavePhase.IN_PROGRESS) {
				interval = Duration.ofMillis(500);
			} else {
				LOGGER.debug("Observer already hit and wave over, observation can stop");
				return Optional.empty();
			}
		} else if (beforeHit.compareTo(CRITICAL_HIT) < 0) {
			interval = Duration.ofMillis(50);
		} else if (beforeHit.compareTo(NEAR_HIT) < 0) {
			interval = Duration.ofMillis(200);
		} else if (!beforeStart.isNegative() || wave.getPhase() == WavePhase.IN_PROGRESS) {
			interval = Duration.ofMillis(500);
		} else {
			interval = Duration.ofSeconds(30);
		}
		LOGGER.trace("Next observation in {} (start in {}, hit in {})", interval, beforeStart, beforeHit);
		return Optional.of(interval);
	}
}
