package com.github.micycle1.wavesweep.wave;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.geometry.Position;

/**
 * Periodically polls a wave and hands every new snapshot to a listener. The
 * delay between polls comes from an {@link ObservationScheduler}; polling stops
 * once the wave has completed, the observer has been hit, or {@link #stop()} is
 * called.
 */
public class WavePoller {

	private static final Logger LOGGER = LoggerFactory.getLogger(WavePoller.class);

	private final WaveProgression wave;
	private final ObservationScheduler scheduler;
	private final Supplier<Position> userPosition;
	private final Consumer<WaveSnapshot> listener;
	private final ScheduledExecutorService executor;

	private volatile boolean running = false;
	private long pollCount = 0;

	public WavePoller(WaveProgression wave, ObservationScheduler scheduler, Supplier<Position> userPosition, Consumer<WaveSnapshot> listener,
			ScheduledExecutorService executor) {
		this.wave = Objects.requireNonNull(wave, "wave");
		this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
		this.userPosition = Objects.requireNonNull(userPosition, "userPosition");
		this.listener = Objects.requireNonNull(listener, "listener");
		this.executor = Objects.requireNonNull(executor, "executor");
	}

	public void start() {
		if (running) {
			return;
		}
		running = true;
		LOGGER.info("Starting to poll {}", wave);
		executor.execute(this::poll);
	}

	public void stop() {
		if (running) {
			running = false;
			LOGGER.info("Stopped polling after {} polls", pollCount);
		}
	}

	public boolean isRunning() {
		return running;
	}

	/**
	 * Runs one poll and schedules the next one if needed.
	 */
	void poll() {
		if (!running) {
			return;
		}
		pollCount++;
		try {
			WaveSnapshot snapshot = wave.getWavePolygons();
			if (snapshot != null) {
				listener.accept(snapshot);
			}
		} catch (RuntimeException e) {
			LOGGER.error("Wave poll {} failed, stopping", pollCount, e);
			stop();
			throw e;
		}
		if (wave.getPhase() == WavePhase.COMPLETED) {
			LOGGER.info("Wave completed");
			stop();
			return;
		}
		Optional<Duration> next = scheduler.observationInterval(wave, userPosition.get());
		if (next.isEmpty()) {
			stop();
			return;
		}
		executor.schedule(this::poll, next.get().toMillis(), TimeUnit.MILLISECONDS);
	}
}
