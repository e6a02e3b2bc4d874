package com.github.micycle1.wavesweep.wave;

import java.time.Instant;

import com.github.micycle1.wavesweep.SweepSettings;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.GeoUtils;
import com.github.micycle1.wavesweep.geometry.StraightCut;

/**
 * A wave with a straight meridian front moving at a constant rate in
 * longitude. It crosses the box in the time the given speed needs to cover the
 * box's widest part, so it matches the ground speed there and is slower on
 * ground elsewhere.
 */
public class DeepWaveProgression extends AbstractWaveProgression {

	private final WaveDirection direction;

	public DeepWaveProgression(DeepWaveParams params, WaveArea area, Instant startTime, WaveClock clock, SweepSettings settings) {
		super(params, area, startTime, clock, settings);
		this.direction = params.getDirection();
	}

	public WaveDirection getDirection() {
		return direction;
	}

	@Override
	protected double computeTotalSeconds(BoundingBox box) {
		double widest = GeoUtils.distanceAlongLatitude(box.getWest(), box.getEastUnwrapped(), box.getLatitudeOfWidestPart());
		return widest / getSpeed();
	}

	private double fractionAt(BoundingBox box, double elapsedSeconds) {
		double total = computeTotalSeconds(box);
		return total <= 0 ? 1 : Math.min(1, elapsedSeconds / total);
	}

	@Override
	protected double frontLongitude(BoundingBox box, double latitude, double elapsedSeconds) {
		double travelled = fractionAt(box, elapsedSeconds) * box.getWidth();
		return direction == WaveDirection.EAST ? box.getWest() + travelled : box.getEastUnwrapped() - travelled;
	}

	@Override
	protected WaveFront frontAt(BoundingBox box, double elapsedSeconds) {
		return new SweepFront(WaveKind.DEEP, direction, new StraightCut(frontLongitude(box, box.getSouth(), elapsedSeconds)), elapsedSeconds);
	}

	@Override
	protected double secondsToReach(BoundingBox box, double latitude, double longitude) {
		double offset = direction == WaveDirection.EAST ? longitude - box.getWest() : box.getEastUnwrapped() - longitude;
		return Math.max(0, Math.min(1, offset / box.getWidth())) * computeTotalSeconds(box);
	}
}
