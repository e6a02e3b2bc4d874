package com.github.micycle1.wavesweep.wave;

public class LinearWaveParams extends DirectedWaveParams {

	public LinearWaveParams(double speed, WaveDirection direction) {
		super(speed, direction);
	}

	@Override
	public WaveKind getKind() {
		return WaveKind.LINEAR;
	}
}
