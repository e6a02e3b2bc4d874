package com.github.micycle1.wavesweep.wave;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.github.micycle1.wavesweep.SweepSettings;

/**
 * Definition of a wave as loaded from an event: one slot per wave kind, of
 * which exactly one must be filled. A definition is checked with
 * {@link #validationErrors(SweepSettings)} or {@link #validate(SweepSettings)}
 * before any calculator is built from it.
 */
public class WaveDefinition {

	private final LinearWaveParams linear;
	private final DeepWaveParams deep;
	private final SplitWaveParams split;

	/**
	 * Creates a definition from raw slots, any of which may be null. No
	 * validation happens here.
	 */
	public WaveDefinition(LinearWaveParams linear, DeepWaveParams deep, SplitWaveParams split) {
		this.linear = linear;
		this.deep = deep;
		this.split = split;
	}

	public static WaveDefinition linear(double speed, WaveDirection direction) {
		return new WaveDefinition(new LinearWaveParams(speed, direction), null, null);
	}

	public static WaveDefinition deep(double speed, WaveDirection direction) {
		return new WaveDefinition(null, new DeepWaveParams(speed, direction), null);
	}

	public static WaveDefinition split(double speed) {
		return new WaveDefinition(null, null, new SplitWaveParams(speed));
	}

	public LinearWaveParams getLinear() {
		return linear;
	}

	public DeepWaveParams getDeep() {
		return deep;
	}

	public SplitWaveParams getSplit() {
		return split;
	}

	private List<WaveParams> present() {
		return Stream.of(linear, deep, split).filter(Objects::nonNull).collect(Collectors.toList());
	}

	/**
	 * Lists every problem of this definition: no kind or several kinds set, and
	 * the active kind's own parameter errors.
	 *
	 * @param settings supplies the largest accepted speed
	 * @return human-readable messages, empty if the definition is valid
	 */
	public List<String> validationErrors(SweepSettings settings) {
		List<String> errors = new ArrayList<>();
		List<WaveParams> kinds = present();
		if (kinds.isEmpty()) {
			errors.add("A wave needs one of linear, deep or split parameters; none given");
		} else if (kinds.size() > 1) {
			errors.add("A wave needs exactly one of linear, deep or split parameters; got "
					+ kinds.stream().map(k -> k.getKind().name()).collect(Collectors.joining(", ")));
		}
		for (WaveParams kind : kinds) {
			errors.addAll(kind.validationErrors(settings.getMaxSpeed()));
		}
		return errors;
	}

	/**
	 * @return the single active kind's parameters
	 * @throws InvalidWaveDefinitionException if the definition is not valid
	 */
	public WaveParams validate(SweepSettings settings) {
		List<String> errors = validationErrors(settings);
		if (!errors.isEmpty()) {
			throw new InvalidWaveDefinitionException(errors);
		}
		return present().get(0);
	}

	@Override
	public String toString() {
		return "WaveDefinition" + present().stream().map(p -> p.getKind() + "@" + p.getSpeed() + "m/s").collect(Collectors.toList());
	}
}
