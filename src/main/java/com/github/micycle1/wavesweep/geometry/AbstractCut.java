package com.github.micycle1.wavesweep.geometry;

import java.util.concurrent.atomic.AtomicLong;

import com.github.micycle1.wavesweep.SweepConstants;

/**
 * Id allocation, classification and intersection shared by the cut types.
 */
abstract class AbstractCut implements Cut {

	private static final AtomicLong idCounter = new AtomicLong(0);

	private final long id;

	AbstractCut() {
		this.id = idCounter.incrementAndGet();
	}

	@Override
	public long getId() {
		return id;
	}

	@Override
	public Side sideOf(Position p) {
		double d = p.getLng() - longitudeAt(p.getLat());
		if (Math.abs(d) < SweepConstants.COORDINATE_EPSILON) {
			return Side.ON;
		}
		return d < 0 ? Side.WEST : Side.EAST;
	}

	@Override
	public CutPosition intersect(Position a, Position b) {
		// canonical order so that an edge shared by two rings intersects identically
		Position west = a;
		Position east = b;
		if (b.getLng() < a.getLng() || (b.getLng() == a.getLng() && b.getLat() < a.getLat())) {
			west = b;
			east = a;
		}
		double fw = west.getLng() - longitudeAt(west.getLat());
		double fe = east.getLng() - longitudeAt(east.getLat());
		double denominator = fw - fe;
		double t = Math.abs(denominator) < SweepConstants.ZERO_DIST ? 0.5 : fw / denominator;
		t = Math.max(0, Math.min(1, t));
		double lat = west.getLat() + t * (east.getLat() - west.getLat());
		return new CutPosition(lat, longitudeAt(lat), id, west, east);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "#" + id;
	}
}
