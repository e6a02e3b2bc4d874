package com.github.micycle1.wavesweep.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CutTest {

	private static final double E = 1e-12;

	@Test
	void straightCutSides() {
		StraightCut cut = new StraightCut(5);
		assertEquals(Side.WEST, cut.sideOf(new Position(0, 4)));
		assertEquals(Side.EAST, cut.sideOf(new Position(0, 6)));
		assertEquals(Side.ON, cut.sideOf(new Position(80, 5)));
		assertTrue(cut.breakpointsBetween(-90, 90).isEmpty());
	}

	@Test
	void cutsHaveDistinctIds() {
		assertNotEquals(new StraightCut(1).getId(), new StraightCut(1).getId());
	}

	@Test
	@DisplayName("Intersection does not depend on edge direction")
	void intersectionIsSymmetric() {
		StraightCut cut = new StraightCut(5);
		Position a = new Position(1, 2);
		Position b = new Position(7, 11);
		CutPosition ab = cut.intersect(a, b);
		CutPosition ba = cut.intersect(b, a);
		assertEquals(ab, ba);
		assertEquals(5, ab.getLng(), E);
		assertEquals(3, ab.getLat(), E);
		assertEquals(a, ab.getCutLeft());
		assertEquals(b, ab.getCutRight());
		assertTrue(ab.belongsTo(cut));
	}

	@Test
	void composedCutInterpolates() {
		ComposedCut cut = new ComposedCut(List.of(new Position(10, 10), new Position(0, 0)));
		assertEquals(5, cut.longitudeAt(5), E);
		assertEquals(0, cut.longitudeAt(-20), E);
		assertEquals(10, cut.longitudeAt(30), E);
		assertEquals(0, cut.getMinLongitude(), E);
		assertEquals(10, cut.getMaxLongitude(), E);
		assertEquals(0, cut.getPositions().get(0).getLat(), E);
	}

	@Test
	void composedCutIntersection() {
		ComposedCut cut = new ComposedCut(List.of(new Position(0, 0), new Position(10, 10)));
		CutPosition x = cut.intersect(new Position(2, -5), new Position(2, 5));
		assertEquals(2, x.getLat(), E);
		assertEquals(2, x.getLng(), E);
		assertEquals(Side.WEST, cut.sideOf(new Position(8, 7)));
		assertEquals(Side.EAST, cut.sideOf(new Position(2, 7)));
	}

	@Test
	@DisplayName("Breakpoints lie strictly between the latitudes, in travel order")
	void breakpoints() {
		ComposedCut cut = new ComposedCut(List.of(new Position(0, 0), new Position(3, 1), new Position(6, 2), new Position(10, 0)));
		List<CutPosition> north = cut.breakpointsBetween(0, 10);
		assertEquals(List.of(new Position(3, 1), new Position(6, 2)), north);
		List<CutPosition> south = cut.breakpointsBetween(10, 0);
		assertEquals(List.of(new Position(6, 2), new Position(3, 1)), south);
		assertEquals(4, cut.breakpointsBetween(-1, 11).size());
		assertTrue(cut.breakpointsBetween(3, 6).isEmpty());
		assertEquals(new Position(0, 0), north.get(0).getCutLeft());
		assertEquals(new Position(6, 2), north.get(0).getCutRight());
	}

	@Test
	void composedCutRejectsSharedLatitude() {
		assertThrows(IllegalArgumentException.class, () -> new ComposedCut(List.of(new Position(1, 0), new Position(1, 2))));
		assertThrows(IllegalArgumentException.class, () -> new ComposedCut(List.of()));
	}
}
