package com.github.micycle1.wavesweep.wave;

public class SplitWaveParams extends WaveParams {

	public SplitWaveParams(double speed) {
		super(speed);
	}

	@Override
	public WaveKind getKind() {
		return WaveKind.SPLIT;
	}
}
