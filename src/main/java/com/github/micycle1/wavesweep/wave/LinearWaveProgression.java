package com.github.micycle1.wavesweep.wave;

import java.time.Instant;

import com.github.micycle1.wavesweep.SweepConstants;
import com.github.micycle1.wavesweep.SweepSettings;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.GeoUtils;

/**
 * A wave whose front covers {@code speed} metres per second on every latitude.
 * On latitude φ it has travelled
 * {@code min(1, speed·t / span(φ))} of the box's width, where {@code span(φ)} is
 * the haversine distance between the box's west and east edges along φ; the
 * front therefore bends ahead towards the poles.
 */
public class LinearWaveProgression extends AbstractWaveProgression {

	private final WaveDirection direction;

	public LinearWaveProgression(LinearWaveParams params, WaveArea area, Instant startTime, WaveClock clock, SweepSettings settings) {
		super(params, area, startTime, clock, settings);
		this.direction = params.getDirection();
	}

	public WaveDirection getDirection() {
		return direction;
	}

	private static double span(BoundingBox box, double latitude) {
		return GeoUtils.distanceAlongLatitude(box.getWest(), box.getEastUnwrapped(), latitude);
	}

	@Override
	protected double computeTotalSeconds(BoundingBox box) {
		return span(box, box.getLatitudeOfWidestPart()) / getSpeed();
	}

	private double ratio(BoundingBox box, double latitude, double elapsedSeconds) {
		double span = span(box, latitude);
		if (span <= SweepConstants.ZERO_DIST) {
			return 1; // polar latitude: no ground to cover
		}
		return Math.min(1, getSpeed() * elapsedSeconds / span);
	}

	@Override
	protected double frontLongitude(BoundingBox box, double latitude, double elapsedSeconds) {
		double travelled = ratio(box, latitude, elapsedSeconds) * box.getWidth();
		return direction == WaveDirection.EAST ? box.getWest() + travelled : box.getEastUnwrapped() - travelled;
	}

	@Override
	protected WaveFront frontAt(BoundingBox box, double elapsedSeconds) {
		return new SweepFront(WaveKind.LINEAR, direction, sampleFront(box, lat -> frontLongitude(box, lat, elapsedSeconds)), elapsedSeconds);
	}

	@Override
	protected double secondsToReach(BoundingBox box, double latitude, double longitude) {
		double offset = direction == WaveDirection.EAST ? longitude - box.getWest() : box.getEastUnwrapped() - longitude;
		double fraction = Math.max(0, Math.min(1, offset / box.getWidth()));
		return fraction * span(box, latitude) / getSpeed();
	}
}
