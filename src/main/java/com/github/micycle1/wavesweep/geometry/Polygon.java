package com.github.micycle1.wavesweep.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.algorithm.RayCrossingCounter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Location;

import com.github.micycle1.wavesweep.SweepConstants;

/**
 * An immutable, closed ring of positions (the first position is repeated at the
 * end). Vertex order is kept exactly as given, so the ring's winding is
 * whatever the caller (or the splitter) produced.
 * <p>
 * Areas and orientation are planar, computed on (longitude, latitude) with JTS.
 */
public class Polygon implements Iterable<Position> {

	private final List<Position> ring; // closed
	private final Coordinate[] coordinates; // closed, x = lng
	private final BoundingBox bbox; // null for an empty ring

	/**
	 * Creates a polygon from a ring of positions. The ring is closed if its last
	 * position differs from its first.
	 *
	 * @param positions the ring, open or closed
	 */
	public Polygon(List<? extends Position> positions) {
		Objects.requireNonNull(positions, "positions");
		List<Position> closed = new ArrayList<>(positions.size() + 1);
		closed.addAll(positions);
		if (!closed.isEmpty() && !closed.get(0).equals(closed.get(closed.size() - 1))) {
			closed.add(closed.get(0));
		}
		this.ring = Collections.unmodifiableList(closed);
		this.coordinates = new Coordinate[closed.size()];
		for (int i = 0; i < closed.size(); i++) {
			coordinates[i] = closed.get(i).toCoordinate();
		}
		this.bbox = closed.isEmpty() ? null : BoundingBox.fromPositions(closed);
	}

	public static Polygon of(Position... positions) {
		return new Polygon(List.of(positions));
	}

	/**
	 * Creates a polygon from the exterior ring of a JTS polygon (x = longitude).
	 * Holes are ignored.
	 */
	public static Polygon fromJts(org.locationtech.jts.geom.Polygon polygon) {
		Coordinate[] shell = polygon.getExteriorRing().getCoordinates();
		List<Position> positions = new ArrayList<>(shell.length);
		for (Coordinate c : shell) {
			positions.add(Position.fromCoordinate(c));
		}
		return new Polygon(positions);
	}

	public org.locationtech.jts.geom.Polygon toJts(GeometryFactory factory) {
		return factory.createPolygon(coordinates.clone());
	}

	/**
	 * @return the closed ring (first position repeated last)
	 */
	public List<Position> getPositions() {
		return ring;
	}

	/**
	 * @return the ring without its closing position
	 */
	public List<Position> getVertices() {
		return ring.isEmpty() ? ring : ring.subList(0, ring.size() - 1);
	}

	/**
	 * @return number of vertices, not counting the closing position
	 */
	public int size() {
		return Math.max(0, ring.size() - 1);
	}

	public boolean isEmpty() {
		return ring.isEmpty();
	}

	/**
	 * @return the bounding box, or null for an empty polygon
	 */
	public BoundingBox getBoundingBox() {
		return bbox;
	}

	/**
	 * Signed planar area in square degrees; positive for a clockwise ring.
	 */
	public double getSignedArea() {
		if (coordinates.length < 4) {
			return 0;
		}
		return Area.ofRingSigned(coordinates);
	}

	public double getArea() {
		return Math.abs(getSignedArea());
	}

	/**
	 * A polygon is degenerate when it has fewer than three distinct vertices or
	 * no area. Degenerate polygons are treated as empty.
	 */
	public boolean isDegenerate() {
		Set<Position> distinct = new HashSet<>(getVertices());
		return distinct.size() < 3 || getArea() <= SweepConstants.ZERO_AREA;
	}

	public boolean isClockwise() {
		if (isDegenerate()) {
			return false;
		}
		return !Orientation.isCCW(coordinates);
	}

	/**
	 * Point-in-polygon test; positions on the boundary count as inside. When the
	 * ring uses longitudes beyond ±180 the position is also tested shifted by
	 * 360 degrees.
	 */
	public boolean contains(Position p) {
		if (isEmpty()) {
			return false;
		}
		if (locate(p.getLng(), p.getLat())) {
			return true;
		}
		if (bbox.getEast() > 180 && locate(p.getLng() + 360, p.getLat())) {
			return true;
		}
		return bbox.getWest() < -180 && locate(p.getLng() - 360, p.getLat());
	}

	private boolean locate(double x, double y) {
		if (!bbox.contains(new Position(y, x))) {
			return false;
		}
		return RayCrossingCounter.locatePointInRing(new Coordinate(x, y), coordinates) != Location.EXTERIOR;
	}

	/**
	 * @return the vertices produced by a cut, in ring order
	 */
	public List<CutPosition> getCutPositions() {
		return getVertices().stream().filter(Position::isCutPosition).map(CutPosition.class::cast).collect(Collectors.toList());
	}

	@Override
	public Iterator<Position> iterator() {
		return ring.iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Polygon)) {
			return false;
		}
		return ring.equals(((Polygon) o).ring);
	}

	@Override
	public int hashCode() {
		return ring.hashCode();
	}

	@Override
	public String toString() {
		return "Polygon" + ring;
	}
}
