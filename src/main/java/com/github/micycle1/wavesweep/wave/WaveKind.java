package com.github.micycle1.wavesweep.wave;

public enum WaveKind {
	/** Front advancing at ground speed on every latitude (curved in degrees). */
	LINEAR,
	/** Straight meridian front, paced by the widest part of the area. */
	DEEP,
	/** Two fronts leaving the center meridian, one eastward and one westward. */
	SPLIT;
}
