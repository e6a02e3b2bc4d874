package com.github.micycle1.wavesweep.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;

import com.github.micycle1.wavesweep.geometry.ComposedCut;
import com.github.micycle1.wavesweep.geometry.Cut;
import com.github.micycle1.wavesweep.geometry.CutPosition;
import com.github.micycle1.wavesweep.geometry.Polygon;
import com.github.micycle1.wavesweep.geometry.Position;
import com.github.micycle1.wavesweep.geometry.StraightCut;

class PolygonSplitterTest {

	private static final double E = 1e-9;

	private static final Polygon SQUARE = Polygon.of(new Position(0, 0), new Position(0, 10), new Position(10, 10), new Position(10, 0));

	private static Polygon wkt(String wkt) throws ParseException {
		return Polygon.fromJts((org.locationtech.jts.geom.Polygon) new WKTReader().read(wkt));
	}

	private static double area(List<Polygon> polygons) {
		return polygons.stream().mapToDouble(Polygon::getArea).sum();
	}

	private static void assertAllWithin(List<Polygon> polygons, double west, double east) {
		for (Polygon p : polygons) {
			for (Position v : p) {
				assertTrue(v.getLng() >= west - E && v.getLng() <= east + E, () -> v + " outside [" + west + ", " + east + "]");
			}
		}
	}

	@Test
	@DisplayName("Square split down the middle")
	void squareAtMeridian() {
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(SQUARE, new StraightCut(5));

		assertEquals(1, parts.getLeft().size());
		assertEquals(1, parts.getRight().size());
		assertEquals(50, area(parts.getLeft()), E);
		assertEquals(50, area(parts.getRight()), E);
		assertAllWithin(parts.getLeft(), 0, 5);
		assertAllWithin(parts.getRight(), 5, 10);
		assertTrue(parts.getLeft().get(0).size() >= 4);
		assertEquals(2, parts.getLeft().get(0).getCutPositions().size());
		assertEquals(2, parts.getRight().get(0).getCutPositions().size());
	}

	@Test
	void windingIsPreserved() {
		Pair<List<Polygon>, List<Polygon>> ccw = PolygonSplitter.split(SQUARE, new StraightCut(5));
		assertFalse(SQUARE.isClockwise());
		ccw.getLeft().forEach(p -> assertFalse(p.isClockwise()));
		ccw.getRight().forEach(p -> assertFalse(p.isClockwise()));

		List<Position> reversed = new ArrayList<>(SQUARE.getPositions());
		Collections.reverse(reversed);
		Pair<List<Polygon>, List<Polygon>> cw = PolygonSplitter.split(new Polygon(reversed), new StraightCut(5));
		cw.getLeft().forEach(p -> assertTrue(p.isClockwise()));
		cw.getRight().forEach(p -> assertTrue(p.isClockwise()));
	}

	@Test
	@DisplayName("Polygon entirely on one side is returned unchanged")
	void wholePolygonOnOneSide() {
		Pair<List<Polygon>, List<Polygon>> east = PolygonSplitter.split(SQUARE, new StraightCut(-5));
		assertTrue(east.getLeft().isEmpty());
		assertSame(SQUARE, east.getRight().get(0));

		Pair<List<Polygon>, List<Polygon>> west = PolygonSplitter.split(SQUARE, new StraightCut(20));
		assertSame(SQUARE, west.getLeft().get(0));
		assertTrue(west.getRight().isEmpty());
	}

	@Test
	void polygonWithEdgeOnCutStaysWhole() {
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(SQUARE, new StraightCut(10));
		assertSame(SQUARE, parts.getLeft().get(0));
		assertTrue(parts.getRight().isEmpty());

		parts = PolygonSplitter.split(SQUARE, new StraightCut(0));
		assertTrue(parts.getLeft().isEmpty());
		assertSame(SQUARE, parts.getRight().get(0));
	}

	@Test
	void degeneratePolygonYieldsNothing() {
		Polygon line = Polygon.of(new Position(0, 0), new Position(1, 1), new Position(2, 2));
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(line, new StraightCut(1));
		assertTrue(parts.getLeft().isEmpty());
		assertTrue(parts.getRight().isEmpty());
	}

	@Test
	@DisplayName("Concave shape opening east splits into two eastern arms")
	void concaveShape() throws ParseException {
		Polygon c = wkt("POLYGON ((0 0, 0 30, 20 30, 20 20, 10 20, 10 10, 20 10, 20 0, 0 0))");
		assertEquals(500, c.getArea(), E);

		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(c, new StraightCut(15));
		assertEquals(1, parts.getLeft().size());
		assertEquals(2, parts.getRight().size());
		assertEquals(400, area(parts.getLeft()), E);
		assertEquals(50, parts.getRight().get(0).getArea(), E);
		assertEquals(50, parts.getRight().get(1).getArea(), E);
		assertAllWithin(parts.getRight(), 15, 20);
	}

	@Test
	void vertexOnCut() {
		Polygon triangle = Polygon.of(new Position(0, 0), new Position(10, 5), new Position(0, 10));
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(triangle, new StraightCut(5));
		assertEquals(1, parts.getLeft().size());
		assertEquals(1, parts.getRight().size());
		assertEquals(25, area(parts.getLeft()), E);
		assertEquals(25, area(parts.getRight()), E);
		assertTrue(parts.getLeft().get(0).getVertices().contains(new Position(10, 5)));
		assertTrue(parts.getRight().get(0).getVertices().contains(new Position(10, 5)));
	}

	@Test
	@DisplayName("A vertex touching the cut from the west is not a crossing")
	void touchingVertex() throws ParseException {
		Polygon notched = wkt("POLYGON ((0 0, 5 4, 0 8, 0 12, 10 12, 10 -4, 0 -4, 0 0))");
		assertEquals(140, notched.getArea(), E);

		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(notched, new StraightCut(5));
		assertEquals(1, parts.getRight().size());
		assertEquals(80, area(parts.getRight()), E);
		assertEquals(60, area(parts.getLeft()), E);
		assertAllWithin(parts.getLeft(), 0, 5);
	}

	@Test
	void composedCutAddsItsVerticesToBothSides() {
		Cut cut = new ComposedCut(List.of(new Position(0, 2), new Position(5, 8), new Position(10, 2)));
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(SQUARE, cut);

		assertEquals(50, area(parts.getLeft()), E);
		assertEquals(50, area(parts.getRight()), E);
		assertTrue(parts.getLeft().get(0).getVertices().contains(new Position(5, 8)));
		assertTrue(parts.getRight().stream().anyMatch(p -> p.getVertices().contains(new Position(5, 8))));
		for (Polygon p : parts.getLeft()) {
			for (CutPosition cp : p.getCutPositions()) {
				assertTrue(cp.belongsTo(cut));
			}
		}
	}

	@Test
	@DisplayName("Cut crossing one edge several times")
	void zigzagCut() {
		Polygon strip = Polygon.of(new Position(0, 0), new Position(0, 5), new Position(10, 5), new Position(10, 0));
		Cut cut = new ComposedCut(List.of(new Position(0, 4), new Position(3, 6), new Position(6, 4), new Position(10, 6)));
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(strip, cut);

		assertEquals(1, parts.getLeft().size());
		assertEquals(2, parts.getRight().size());
		assertEquals(47.5, area(parts.getLeft()), E);
		assertEquals(2.5, area(parts.getRight()), E);
	}

	@Test
	@DisplayName("Splitting a part again with the same cut changes nothing")
	void idempotent() {
		Cut cut = new StraightCut(5);
		Pair<List<Polygon>, List<Polygon>> first = PolygonSplitter.split(SQUARE, cut);
		Pair<List<Polygon>, List<Polygon>> again = PolygonSplitter.split(SQUARE, cut);
		assertEquals(first.getLeft(), again.getLeft());
		assertEquals(first.getRight(), again.getRight());

		Pair<List<Polygon>, List<Polygon>> left = PolygonSplitter.split(first.getLeft(), cut);
		assertEquals(first.getLeft(), left.getLeft());
		assertTrue(left.getRight().isEmpty());

		Pair<List<Polygon>, List<Polygon>> right = PolygonSplitter.split(first.getRight(), cut);
		assertTrue(right.getLeft().isEmpty());
		assertEquals(first.getRight(), right.getRight());
	}

	@Test
	void splitsCollectionsInOrder() {
		Polygon other = Polygon.of(new Position(20, 0), new Position(20, 10), new Position(30, 10), new Position(30, 0));
		Pair<List<Polygon>, List<Polygon>> parts = PolygonSplitter.split(List.of(SQUARE, other), new StraightCut(5));
		assertEquals(2, parts.getLeft().size());
		assertEquals(2, parts.getRight().size());
		assertEquals(100, area(parts.getLeft()), E);
		assertEquals(20, parts.getLeft().get(1).getBoundingBox().getSouth(), E);
	}
}
