package com.github.micycle1.wavesweep.wave;

public enum WavePhase {
	NOT_STARTED, IN_PROGRESS, COMPLETED;
}
