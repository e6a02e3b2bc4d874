package com.github.micycle1.wavesweep.wave;

import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;

import com.github.micycle1.wavesweep.geometry.Cut;
import com.github.micycle1.wavesweep.geometry.Polygon;
import com.github.micycle1.wavesweep.split.PolygonSplitter;

/**
 * A single front moving east or west. Traversed polygons are those behind the
 * cut: west of it for an eastward wave, east of it for a westward one.
 */
public class SweepFront extends WaveFront {

	private final WaveDirection direction;
	private final Cut cut;

	public SweepFront(WaveKind kind, WaveDirection direction, Cut cut, double elapsedSeconds) {
		super(kind, elapsedSeconds);
		this.direction = Objects.requireNonNull(direction, "direction");
		this.cut = Objects.requireNonNull(cut, "cut");
	}

	public WaveDirection getDirection() {
		return direction;
	}

	public Cut getCut() {
		return cut;
	}

	@Override
	public Pair<List<Polygon>, List<Polygon>> partition(Polygon polygon) {
		Pair<List<Polygon>, List<Polygon>> sides = PolygonSplitter.split(polygon, cut);
		return direction == WaveDirection.EAST ? sides : Pair.of(sides.getRight(), sides.getLeft());
	}

	@Override
	public boolean canAdvanceFrom(WaveFront previous) {
		return super.canAdvanceFrom(previous) && ((SweepFront) previous).direction == direction;
	}

	@Override
	public String toString() {
		return getKind() + " front " + direction + " at " + getElapsedSeconds() + "s along " + cut;
	}
}
