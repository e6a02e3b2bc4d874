package com.github.micycle1.wavesweep.wave;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a {@link WaveDefinition} fails validation. Carries every problem
 * found, as human-readable messages.
 */
public class InvalidWaveDefinitionException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final List<String> errors;

	public InvalidWaveDefinitionException(List<String> errors) {
		super("Invalid wave definition: " + String.join("; ", errors));
		this.errors = Collections.unmodifiableList(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
