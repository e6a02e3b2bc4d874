package com.github.micycle1.wavesweep.wave;

import java.time.Instant;

/**
 * Source of the current time for wave calculations. Calculators never read the
 * wall clock directly, so a simulated clock can drive them.
 */
public interface WaveClock {

	Instant now();
}
