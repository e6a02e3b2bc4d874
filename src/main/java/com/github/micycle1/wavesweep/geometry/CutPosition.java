package com.github.micycle1.wavesweep.geometry;

import java.util.Objects;

/**
 * A vertex created by a {@link Cut}. It remembers which cut produced it and the
 * two positions it sits between on that cut: for an edge intersection these
 * are the edge endpoints (west one first), for a breakpoint of a
 * {@link ComposedCut} the neighbouring cut vertices.
 * <p>
 * Splitting again with the same cut reuses these vertices as they are, so a
 * repeated split never re-interpolates an intersection.
 */
public class CutPosition extends Position {

	private final long cutId;
	private final Position cutLeft;
	private final Position cutRight;

	public CutPosition(double lat, double lng, long cutId, Position cutLeft, Position cutRight) {
		super(lat, lng);
		this.cutId = cutId;
		this.cutLeft = Objects.requireNonNull(cutLeft, "cutLeft");
		this.cutRight = Objects.requireNonNull(cutRight, "cutRight");
	}

	public long getCutId() {
		return cutId;
	}

	public Position getCutLeft() {
		return cutLeft;
	}

	public Position getCutRight() {
		return cutRight;
	}

	@Override
	public boolean isCutPosition() {
		return true;
	}

	/**
	 * @return true if this vertex was produced by the given cut
	 */
	public boolean belongsTo(Cut cut) {
		return cut.getId() == cutId;
	}

	@Override
	public String toString() {
		return "Cut#" + cutId + super.toString();
	}
}
