package com.github.micycle1.wavesweep.wave;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one wave kind. Exactly one kind is set on a
 * {@link WaveDefinition}.
 */
public abstract class WaveParams {

	private final double speed; // m/s

	protected WaveParams(double speed) {
		this.speed = speed;
	}

	public double getSpeed() {
		return speed;
	}

	public abstract WaveKind getKind();

	/**
	 * @param maxSpeed largest accepted speed, in metres per second
	 * @return the problems found, empty when the parameters are usable
	 */
	public List<String> validationErrors(double maxSpeed) {
		List<String> errors = new ArrayList<>();
		if (!(speed > 0) || speed > maxSpeed) {
			errors.add(getKind() + " wave speed must be in (0, " + maxSpeed + "] m/s, was " + speed);
		}
		return errors;
	}
}
