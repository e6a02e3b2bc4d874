package com.github.micycle1.wavesweep.wave;

import java.util.List;

/**
 * Parameters of a wave that sweeps the area in one direction.
 */
public abstract class DirectedWaveParams extends WaveParams {

	private final WaveDirection direction;

	protected DirectedWaveParams(double speed, WaveDirection direction) {
		super(speed);
		this.direction = direction;
	}

	public WaveDirection getDirection() {
		return direction;
	}

	@Override
	public List<String> validationErrors(double maxSpeed) {
		List<String> errors = super.validationErrors(maxSpeed);
		if (direction == null) {
			errors.add(getKind() + " wave has no direction");
		}
		return errors;
	}
}
