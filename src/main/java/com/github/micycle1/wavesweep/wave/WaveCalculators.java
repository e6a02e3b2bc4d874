package com.github.micycle1.wavesweep.wave;

import java.time.Instant;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.SweepSettings;

/**
 * Builds the calculator matching a wave definition's active kind.
 */
public final class WaveCalculators {

	private static final Logger LOGGER = LoggerFactory.getLogger(WaveCalculators.class);

	private WaveCalculators() {
	}

	/**
	 * Validates the definition and creates its calculator.
	 *
	 * @param definition wave definition with exactly one kind set
	 * @param area       area the wave sweeps
	 * @param startTime  instant the wave leaves its starting edge
	 * @param clock      time source for every query
	 * @param settings   tunables
	 * @return the calculator
	 * @throws InvalidWaveDefinitionException if the definition is invalid
	 */
	public static AbstractWaveProgression create(WaveDefinition definition, WaveArea area, Instant startTime, WaveClock clock,
			SweepSettings settings) {
		Objects.requireNonNull(definition, "definition");
		WaveParams params = definition.validate(settings);
		AbstractWaveProgression calculator;
		switch (params.getKind()) {
			case LINEAR :
				calculator = new LinearWaveProgression((LinearWaveParams) params, area, startTime, clock, settings);
				break;
			case DEEP :
				calculator = new DeepWaveProgression((DeepWaveParams) params, area, startTime, clock, settings);
				break;
			case SPLIT :
				calculator = new SplitWaveProgression((SplitWaveParams) params, area, startTime, clock, settings);
				break;
			default :
				throw new IllegalStateException("Unhandled wave kind " + params.getKind());
		}
		LOGGER.info("Created {}", calculator);
		return calculator;
	}

	public static AbstractWaveProgression create(WaveDefinition definition, WaveArea area, Instant startTime, WaveClock clock) {
		return create(definition, area, startTime, clock, SweepSettings.defaults());
	}
}
