package com.github.micycle1.wavesweep.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A piecewise-linear cut through an ordered list of positions. Positions are
 * sorted south to north; between two of them the longitude is interpolated
 * linearly in latitude, and beyond the southernmost (northernmost) position the
 * cut continues along that position's meridian.
 */
public class ComposedCut extends AbstractCut {

	private final double[] lats;
	private final double[] lngs;
	private final List<CutPosition> vertices; // south to north
	private final double minLng;
	private final double maxLng;

	/**
	 * @param positions at least one position; latitudes must be distinct
	 * @throws IllegalArgumentException if the list is empty or two positions
	 *                                  share a latitude
	 */
	public ComposedCut(List<? extends Position> positions) {
		Objects.requireNonNull(positions, "positions");
		if (positions.isEmpty()) {
			throw new IllegalArgumentException("A composed cut needs at least one position");
		}
		List<Position> sorted = new ArrayList<>(positions);
		sorted.sort(Comparator.comparingDouble(Position::getLat));
		int n = sorted.size();
		lats = new double[n];
		lngs = new double[n];
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < n; i++) {
			Position p = sorted.get(i);
			if (i > 0 && p.getLat() == lats[i - 1]) {
				throw new IllegalArgumentException("Two cut positions share latitude " + p.getLat());
			}
			lats[i] = p.getLat();
			lngs[i] = p.getLng();
			min = Math.min(min, p.getLng());
			max = Math.max(max, p.getLng());
		}
		minLng = min;
		maxLng = max;
		List<CutPosition> tagged = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			Position south = sorted.get(Math.max(0, i - 1));
			Position north = sorted.get(Math.min(n - 1, i + 1));
			tagged.add(new CutPosition(lats[i], lngs[i], getId(), south, north));
		}
		vertices = Collections.unmodifiableList(tagged);
	}

	/**
	 * @return the cut's vertices, south to north
	 */
	public List<CutPosition> getPositions() {
		return vertices;
	}

	@Override
	public double longitudeAt(double latitude) {
		int n = lats.length;
		if (latitude <= lats[0]) {
			return lngs[0];
		}
		if (latitude >= lats[n - 1]) {
			return lngs[n - 1];
		}
		int idx = Arrays.binarySearch(lats, latitude);
		if (idx >= 0) {
			return lngs[idx];
		}
		int upper = -idx - 1; // first index with lats[upper] > latitude
		int lower = upper - 1;
		double t = (latitude - lats[lower]) / (lats[upper] - lats[lower]);
		return lngs[lower] + t * (lngs[upper] - lngs[lower]);
	}

	@Override
	public double getMinLongitude() {
		return minLng;
	}

	@Override
	public double getMaxLongitude() {
		return maxLng;
	}

	@Override
	public List<CutPosition> breakpointsBetween(double fromLat, double toLat) {
		double lo = Math.min(fromLat, toLat);
		double hi = Math.max(fromLat, toLat);
		int start = firstIndexAbove(lo);
		if (start >= lats.length || lats[start] >= hi) {
			return Collections.emptyList();
		}
		List<CutPosition> result = new ArrayList<>();
		for (int i = start; i < lats.length && lats[i] < hi; i++) {
			result.add(vertices.get(i));
		}
		if (fromLat > toLat) {
			Collections.reverse(result);
		}
		return result;
	}

	// index of the first latitude strictly greater than lat
	private int firstIndexAbove(double lat) {
		int idx = Arrays.binarySearch(lats, lat);
		return idx >= 0 ? idx + 1 : -idx - 1;
	}

	@Override
	public String toString() {
		return super.toString() + vertices;
	}
}
