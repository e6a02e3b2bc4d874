package com.github.micycle1.wavesweep.wave;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A clock that starts at a chosen simulated instant and runs {@code speed}
 * times faster than a real clock. Changing the speed keeps the simulated time
 * continuous.
 */
public class SimulatedWaveClock implements WaveClock {

	private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedWaveClock.class);

	public static final int MIN_SPEED = 1;
	public static final int MAX_SPEED = 500;

	private final Clock realClock;
	private Instant simulatedAnchor;
	private Instant realAnchor;
	private int speed;

	public SimulatedWaveClock(Instant simulatedStart, int speed, Clock realClock) {
		this.realClock = Objects.requireNonNull(realClock, "realClock");
		this.simulatedAnchor = Objects.requireNonNull(simulatedStart, "simulatedStart");
		this.realAnchor = realClock.instant();
		this.speed = checkSpeed(speed);
	}

	public SimulatedWaveClock(Instant simulatedStart, int speed) {
		this(simulatedStart, speed, Clock.systemUTC());
	}

	private static int checkSpeed(int speed) {
		if (speed < MIN_SPEED || speed > MAX_SPEED) {
			throw new IllegalArgumentException("Simulation speed must be in [" + MIN_SPEED + ", " + MAX_SPEED + "], was " + speed);
		}
		return speed;
	}

	@Override
	public synchronized Instant now() {
		return simulatedAt(realClock.instant());
	}

	private Instant simulatedAt(Instant real) {
		return simulatedAnchor.plus(Duration.between(realAnchor, real).multipliedBy(speed));
	}

	public synchronized int getSpeed() {
		return speed;
	}

	/**
	 * Changes the speed factor from now on.
	 */
	public synchronized void setSpeed(int speed) {
		int checked = checkSpeed(speed);
		Instant real = realClock.instant();
		Instant current = simulatedAt(real);
		this.simulatedAnchor = current;
		this.realAnchor = real;
		this.speed = checked;
		LOGGER.info("Simulation speed set to {}x at {}", checked, current);
	}
}
