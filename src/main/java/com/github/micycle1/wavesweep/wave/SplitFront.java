package com.github.micycle1.wavesweep.wave;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;

import com.github.micycle1.wavesweep.geometry.Cut;
import com.github.micycle1.wavesweep.geometry.Polygon;
import com.github.micycle1.wavesweep.split.PolygonSplitter;

/**
 * Two fronts spreading out from a common meridian. The band between the west
 * and east cuts is traversed; both outer parts remain.
 */
public class SplitFront extends WaveFront {

	private final Cut westCut;
	private final Cut eastCut;

	public SplitFront(Cut westCut, Cut eastCut, double elapsedSeconds) {
		super(WaveKind.SPLIT, elapsedSeconds);
		this.westCut = Objects.requireNonNull(westCut, "westCut");
		this.eastCut = Objects.requireNonNull(eastCut, "eastCut");
	}

	public Cut getWestCut() {
		return westCut;
	}

	public Cut getEastCut() {
		return eastCut;
	}

	@Override
	public Pair<List<Polygon>, List<Polygon>> partition(Polygon polygon) {
		Pair<List<Polygon>, List<Polygon>> byWest = PolygonSplitter.split(polygon, westCut);
		Pair<List<Polygon>, List<Polygon>> byEast = PolygonSplitter.split(byWest.getRight(), eastCut);
		List<Polygon> remaining = new ArrayList<>(byWest.getLeft());
		remaining.addAll(byEast.getRight());
		return Pair.of(byEast.getLeft(), remaining);
	}

	@Override
	public String toString() {
		return "SPLIT front at " + getElapsedSeconds() + "s between " + westCut + " and " + eastCut;
	}
}
