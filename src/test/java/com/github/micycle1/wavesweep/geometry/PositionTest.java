package com.github.micycle1.wavesweep.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

class PositionTest {

	@Test
	void latitudeMustBeInRange() {
		assertThrows(IllegalArgumentException.class, () -> new Position(90.5, 0));
		assertThrows(IllegalArgumentException.class, () -> new Position(-91, 0));
		assertThrows(IllegalArgumentException.class, () -> new Position(Double.NaN, 0));
		assertThrows(IllegalArgumentException.class, () -> new Position(0, Double.POSITIVE_INFINITY));
	}

	@Test
	void longitudeIsKeptRaw() {
		assertEquals(190, new Position(0, 190).getLng());
	}

	@Test
	void cutPositionEqualsPlainPositionWithSameCoordinates() {
		Position plain = new Position(1, 2);
		CutPosition cut = new CutPosition(1, 2, 7, new Position(0, 0), new Position(2, 4));
		assertEquals(plain, cut);
		assertEquals(cut, plain);
		assertEquals(plain.hashCode(), cut.hashCode());
		assertTrue(cut.isCutPosition());
		assertFalse(plain.isCutPosition());
	}

	@Test
	void coordinateUsesLongitudeAsX() {
		Coordinate c = new Position(10, 20).toCoordinate();
		assertEquals(20, c.x);
		assertEquals(10, c.y);
		assertEquals(new Position(10, 20), Position.fromCoordinate(c));
	}
}
