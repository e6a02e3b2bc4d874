package com.github.micycle1.wavesweep.wave;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.github.micycle1.wavesweep.geometry.StraightCut;

class SnapshotPolicyTest {

	private static final Instant T = Instant.parse("2026-06-01T12:00:00Z");

	private SnapshotPolicy policy;
	private WaveSnapshot previous;

	@BeforeEach
	void setUp() {
		policy = new SnapshotPolicy(Duration.ofSeconds(60));
		previous = snapshot(new SweepFront(WaveKind.LINEAR, WaveDirection.EAST, new StraightCut(5), 100));
	}

	private static WaveSnapshot snapshot(WaveFront front) {
		return new WaveSnapshot(T, List.of(), List.of(), List.of(), front, SnapshotMode.RECOMPOSE);
	}

	private static SweepFront eastFront(double elapsed) {
		return new SweepFront(WaveKind.LINEAR, WaveDirection.EAST, new StraightCut(6), elapsed);
	}

	@Test
	void firstSnapshotIsRecomposed() {
		assertEquals(SnapshotMode.RECOMPOSE, policy.decide(null, T, eastFront(0)));
	}

	@Test
	void smallForwardStepAdds() {
		assertEquals(SnapshotMode.ADD, policy.decide(previous, T.plusSeconds(10), eastFront(110)));
		assertEquals(SnapshotMode.ADD, policy.decide(previous, T.plusSeconds(60), eastFront(160)));
	}

	@Test
	void gapTooLargeRecomposes() {
		assertEquals(SnapshotMode.RECOMPOSE, policy.decide(previous, T.plusSeconds(61), eastFront(161)));
	}

	@Test
	void clockMovingBackRecomposes() {
		assertEquals(SnapshotMode.RECOMPOSE, policy.decide(previous, T.minusSeconds(1), eastFront(99)));
	}

	@Test
	void incompatibleFrontRecomposes() {
		assertEquals(SnapshotMode.RECOMPOSE, policy.decide(previous, T.plusSeconds(10), eastFront(90)));
		assertEquals(SnapshotMode.RECOMPOSE,
				policy.decide(previous, T.plusSeconds(10), new SweepFront(WaveKind.LINEAR, WaveDirection.WEST, new StraightCut(4), 110)));
		assertEquals(SnapshotMode.RECOMPOSE,
				policy.decide(previous, T.plusSeconds(10), new SweepFront(WaveKind.DEEP, WaveDirection.EAST, new StraightCut(6), 110)));
		assertEquals(SnapshotMode.RECOMPOSE,
				policy.decide(previous, T.plusSeconds(10), new SplitFront(new StraightCut(4), new StraightCut(6), 110)));
	}
}
