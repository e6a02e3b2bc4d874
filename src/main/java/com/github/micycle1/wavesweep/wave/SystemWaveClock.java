package com.github.micycle1.wavesweep.wave;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link WaveClock} backed by a {@link Clock}, the system UTC clock by default.
 */
public class SystemWaveClock implements WaveClock {

	private final Clock clock;

	public SystemWaveClock() {
		this(Clock.systemUTC());
	}

	public SystemWaveClock(Clock clock) {
		this.clock = Objects.requireNonNull(clock, "clock");
	}

	@Override
	public Instant now() {
		return clock.instant();
	}
}
