package com.github.micycle1.wavesweep.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.github.micycle1.wavesweep.SweepConstants;

class GeoUtilsTest {

	@Test
	@DisplayName("One degree of longitude on the equator")
	void oneDegreeOnEquator() {
		double expected = SweepConstants.EARTH_RADIUS * Math.toRadians(1);
		assertEquals(expected, GeoUtils.distanceAlongLatitude(0, 1, 0), 1e-6);
		assertEquals(expected, GeoUtils.arcLengthAlongLatitude(0, 1, 0), 1e-6);
	}

	@Test
	void distanceShrinksTowardsThePoles() {
		double equator = GeoUtils.distanceAlongLatitude(20, 30, 0);
		double sixty = GeoUtils.distanceAlongLatitude(20, 30, 60);
		assertTrue(sixty < equator);
		assertEquals(equator / 2, sixty, equator * 0.01);
	}

	@Test
	@DisplayName("Distance at the pole is zero, never NaN")
	void poleIsFinite() {
		double d = GeoUtils.distanceAlongLatitude(0, 90, 90);
		assertFalse(Double.isNaN(d));
		assertEquals(0, d, 1e-6);
	}

	@Test
	void haversineMatchesAlongLatitudeOnSameParallel() {
		assertEquals(GeoUtils.distanceAlongLatitude(20, 30, 12.5), GeoUtils.haversine(new Position(12.5, 20), new Position(12.5, 30)), 1e-6);
	}

	@Test
	void longitudeRangeWithWrap() {
		assertTrue(GeoUtils.isLongitudeInRange(175, 170, -170));
		assertTrue(GeoUtils.isLongitudeInRange(-175, 170, -170));
		assertFalse(GeoUtils.isLongitudeInRange(0, 170, -170));
		assertTrue(GeoUtils.isLongitudeInRange(5, 0, 10));
	}

	@Test
	void normalizeLongitude() {
		assertEquals(-170, GeoUtils.normalizeLongitude(190), 1e-12);
		assertEquals(170, GeoUtils.normalizeLongitude(-190), 1e-12);
		assertEquals(-180, GeoUtils.normalizeLongitude(180), 1e-12);
		assertEquals(45, GeoUtils.normalizeLongitude(45), 1e-12);
	}
}
