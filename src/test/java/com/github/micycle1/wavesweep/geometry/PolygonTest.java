package com.github.micycle1.wavesweep.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

class PolygonTest {

	private static final GeometryFactory GEOM_FACTORY = new GeometryFactory();

	private Polygon square;

	@BeforeEach
	void setUp() throws ParseException {
		square = Polygon.fromJts((org.locationtech.jts.geom.Polygon) new WKTReader(GEOM_FACTORY).read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))"));
	}

	@Test
	@DisplayName("Counter-clockwise square has negative signed area")
	void areaAndWinding() {
		assertEquals(100, square.getArea(), 1e-9);
		assertEquals(-100, square.getSignedArea(), 1e-9);
		assertFalse(square.isClockwise());

		List<Position> reversed = new ArrayList<>(square.getPositions());
		Collections.reverse(reversed);
		Polygon clockwise = new Polygon(reversed);
		assertTrue(clockwise.isClockwise());
		assertEquals(100, clockwise.getSignedArea(), 1e-9);
	}

	@Test
	void openRingIsClosed() {
		Polygon triangle = Polygon.of(new Position(0, 0), new Position(0, 1), new Position(1, 0));
		assertEquals(3, triangle.size());
		assertEquals(4, triangle.getPositions().size());
		assertEquals(triangle.getPositions().get(0), triangle.getPositions().get(3));
		assertEquals(3, triangle.getVertices().size());
	}

	@Test
	void containsWithBoundary() {
		assertTrue(square.contains(new Position(5, 5)));
		assertTrue(square.contains(new Position(5, 0)));
		assertTrue(square.contains(new Position(10, 10)));
		assertFalse(square.contains(new Position(5, 11)));
		assertFalse(square.contains(new Position(-0.1, 5)));
	}

	@Test
	@DisplayName("Ring with longitudes beyond 180 contains the wrapped position")
	void containsAcrossAntimeridian() {
		Polygon p = Polygon.of(new Position(0, 170), new Position(0, 190), new Position(10, 190), new Position(10, 170));
		assertTrue(p.contains(new Position(5, 175)));
		assertTrue(p.contains(new Position(5, -175)));
		assertFalse(p.contains(new Position(5, -165)));
	}

	@Test
	void degeneratePolygons() {
		assertTrue(Polygon.of(new Position(0, 0), new Position(1, 1), new Position(2, 2)).isDegenerate());
		assertTrue(Polygon.of(new Position(0, 0), new Position(1, 1)).isDegenerate());
		assertTrue(new Polygon(List.of()).isDegenerate());
		assertFalse(square.isDegenerate());
	}

	@Test
	void jtsRoundTripKeepsRing() {
		assertEquals(square, Polygon.fromJts(square.toJts(GEOM_FACTORY)));
		assertEquals(100, square.toJts(GEOM_FACTORY).getArea(), 1e-9);
	}

	@Test
	void boundingBox() {
		assertEquals(BoundingBox.of(0, 0, 10, 10), square.getBoundingBox());
	}
}
