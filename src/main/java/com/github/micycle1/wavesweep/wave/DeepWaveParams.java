package com.github.micycle1.wavesweep.wave;

public class DeepWaveParams extends DirectedWaveParams {

	public DeepWaveParams(double speed, WaveDirection direction) {
		super(speed, direction);
	}

	@Override
	public WaveKind getKind() {
		return WaveKind.DEEP;
	}
}
