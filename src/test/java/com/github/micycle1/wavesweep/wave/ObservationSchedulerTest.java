package com.github.micycle1.wavesweep.wave;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.github.micycle1.wavesweep.geometry.Position;

@ExtendWith(MockitoExtension.class)
class ObservationSchedulerTest {

	private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");
	private static final Position USER = new Position(12.5, 25);

	@Mock
	private WaveClock clock;

	@Mock
	private WaveProgression wave;

	private ObservationScheduler scheduler;

	@BeforeEach
	void setUp() {
		when(clock.now()).thenReturn(NOW);
		scheduler = new ObservationScheduler(clock);
	}

	private void startsIn(Duration d) {
		when(wave.getStartTime()).thenReturn(NOW.plus(d));
	}

	private void hitIn(Duration d) {
		when(wave.timeBeforeUserHit(USER)).thenReturn(d);
	}

	@Test
	@DisplayName("Hourly while the start is far away")
	void farFromStart() {
		startsIn(Duration.ofHours(2));
		assertEquals(Optional.of(Duration.ofHours(1)), scheduler.observationInterval(wave, USER));
	}

	@Test
	void approachingStart() {
		startsIn(Duration.ofMinutes(30));
		assertEquals(Optional.of(Duration.ofMinutes(5)), scheduler.observationInterval(wave, USER));
	}

	@Test
	void nearStart() {
		startsIn(Duration.ofMinutes(2));
		assertEquals(Optional.of(Duration.ofSeconds(1)), scheduler.observationInterval(wave, USER));
	}

	@Test
	void imminentStartWithoutUser() {
		startsIn(Duration.ofSeconds(20));
		assertEquals(Optional.of(Duration.ofMillis(500)), scheduler.observationInterval(wave, USER));
	}

	@Test
	@DisplayName("Observation stops once the user has been hit and the wave is over")
	void alreadyHit() {
		startsIn(Duration.ofMinutes(-10));
		hitIn(Duration.ofSeconds(-5));
		when(wave.getPhase()).thenReturn(WavePhase.COMPLETED);
		assertTrue(scheduler.observationInterval(wave, USER).isEmpty());
	}

	@Test
	@DisplayName("A hit user keeps being observed while the wave runs")
	void alreadyHitWhileRunning() {
		startsIn(Duration.ofMinutes(-5));
		hitIn(Duration.ofSeconds(-290));
		when(wave.getPhase()).thenReturn(WavePhase.IN_PROGRESS);
		assertEquals(Optional.of(Duration.ofMillis(500)), scheduler.observationInterval(wave, USER));
	}

	@Test
	void criticalHit() {
		startsIn(Duration.ofMinutes(-10));
		hitIn(Duration.ofMillis(500));
		assertEquals(Optional.of(Duration.ofMillis(50)), scheduler.observationInterval(wave, USER));
	}

	@Test
	void nearHit() {
		startsIn(Duration.ofMinutes(-10));
		hitIn(Duration.ofSeconds(3));
		assertEquals(Optional.of(Duration.ofMillis(200)), scheduler.observationInterval(wave, USER));
	}

	@Test
	void runningWave() {
		startsIn(Duration.ofMinutes(-10));
		hitIn(Duration.ofMinutes(1));
		when(wave.getPhase()).thenReturn(WavePhase.IN_PROGRESS);
		assertEquals(Optional.of(Duration.ofMillis(500)), scheduler.observationInterval(wave, USER));
	}

	@Test
	@DisplayName("Slow polling after the wave is over")
	void finishedWave() {
		startsIn(Duration.ofHours(-3));
		when(wave.getPhase()).thenReturn(WavePhase.COMPLETED);
		assertEquals(Optional.of(Duration.ofSeconds(30)), scheduler.observationInterval(wave, USER));
	}
}
