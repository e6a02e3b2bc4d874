package com.github.micycle1.wavesweep.geometry;

import java.util.List;

/**
 * A north–south dividing line, expressed as a longitude for every latitude.
 * Polygons are split along cuts; the side west of the cut is called left and
 * the east side right.
 */
public interface Cut {

	/**
	 * @return an identifier unique to this cut instance
	 */
	long getId();

	/**
	 * Longitude of the cut at the given latitude. Defined for every latitude.
	 */
	double longitudeAt(double latitude);

	double getMinLongitude();

	double getMaxLongitude();

	/**
	 * Classifies a position against the cut, with a tolerance of
	 * {@link com.github.micycle1.wavesweep.SweepConstants#COORDINATE_EPSILON}.
	 */
	Side sideOf(Position p);

	/**
	 * Vertices of the cut whose latitude lies strictly between the two given
	 * latitudes, ordered from {@code fromLat} towards {@code toLat}. Between two
	 * consecutive breakpoints the cut is linear in latitude.
	 */
	List<CutPosition> breakpointsBetween(double fromLat, double toLat);

	/**
	 * Intersects the cut with the segment {@code a-b}. The endpoints must lie on
	 * different sides (or one of them on the cut) and the cut must be linear
	 * between their latitudes. The result does not depend on the order of the
	 * arguments.
	 *
	 * @return the intersection, lying exactly on the cut
	 */
	CutPosition intersect(Position a, Position b);
}
