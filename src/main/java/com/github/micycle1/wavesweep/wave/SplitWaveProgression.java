package com.github.micycle1.wavesweep.wave;

import java.time.Instant;

import com.github.micycle1.wavesweep.SweepConstants;
import com.github.micycle1.wavesweep.SweepSettings;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.GeoUtils;

/**
 * A wave starting on the box's central meridian and spreading both east and
 * west at ground speed, each front covering half of the box.
 */
public class SplitWaveProgression extends AbstractWaveProgression {

	public SplitWaveProgression(SplitWaveParams params, WaveArea area, Instant startTime, WaveClock clock, SweepSettings settings) {
		super(params, area, startTime, clock, settings);
	}

	private static double center(BoundingBox box) {
		return box.getWest() + box.getWidth() / 2;
	}

	private static double halfSpan(BoundingBox box, double latitude) {
		return GeoUtils.distanceAlongLatitude(center(box), box.getEastUnwrapped(), latitude);
	}

	@Override
	protected double computeTotalSeconds(BoundingBox box) {
		return halfSpan(box, box.getLatitudeOfWidestPart()) / getSpeed();
	}

	// half-width in degrees covered by each front at that latitude
	private double reach(BoundingBox box, double latitude, double elapsedSeconds) {
		double span = halfSpan(box, latitude);
		double ratio = span <= SweepConstants.ZERO_DIST ? 1 : Math.min(1, getSpeed() * elapsedSeconds / span);
		return ratio * box.getWidth() / 2;
	}

	/**
	 * Longitude of the eastward front.
	 */
	@Override
	protected double frontLongitude(BoundingBox box, double latitude, double elapsedSeconds) {
		return center(box) + reach(box, latitude, elapsedSeconds);
	}

	private double westFrontLongitude(BoundingBox box, double latitude, double elapsedSeconds) {
		return center(box) - reach(box, latitude, elapsedSeconds);
	}

	@Override
	protected WaveFront frontAt(BoundingBox box, double elapsedSeconds) {
		return new SplitFront(sampleFront(box, lat -> westFrontLongitude(box, lat, elapsedSeconds)),
				sampleFront(box, lat -> frontLongitude(box, lat, elapsedSeconds)), elapsedSeconds);
	}

	@Override
	protected double secondsToReach(BoundingBox box, double latitude, double longitude) {
		double fraction = Math.min(1, Math.abs(longitude - center(box)) / (box.getWidth() / 2));
		return fraction * halfSpan(box, latitude) / getSpeed();
	}
}
