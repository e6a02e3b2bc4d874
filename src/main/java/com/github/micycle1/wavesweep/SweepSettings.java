package com.github.micycle1.wavesweep;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tunable parameters of the wave and viewport engines. Defaults are read from
 * the classpath resource {@value #RESOURCE}; any key can be overridden by
 * passing a {@link Properties} instance to {@link #fromProperties(Properties)}.
 * Instances are immutable.
 */
public class SweepSettings {

	private static final Logger LOGGER = LoggerFactory.getLogger(SweepSettings.class);

	public static final String RESOURCE = "/wavesweep.properties";

	static final String MAX_SPEED = "wave.maxSpeed";
	static final String BAND_WIDTH = "wave.bandWidth";
	static final String MAX_BANDS = "wave.maxBands";
	static final String MAX_INCREMENTAL_GAP = "wave.maxIncrementalGapSeconds";
	static final String WARMING_DURATION = "wave.warmingDurationSeconds";
	static final String WARN_BEFORE_HIT = "wave.warnBeforeHitSeconds";
	static final String INVALID_HALF_EXTENT = "viewport.invalidHalfExtent";
	static final String RESIZE_THRESHOLD = "viewport.resizeThreshold";
	static final String MAX_PADDING_RATIO = "viewport.maxPaddingRatio";
	static final String BOUNDS_TOLERANCE = "viewport.boundsTolerance";
	static final String PADDING_CHANGE_THRESHOLD = "viewport.paddingChangeThreshold";

	private static volatile SweepSettings defaults;

	private final double maxSpeed; // m/s
	private final double bandWidth; // degrees of latitude
	private final int maxBands;
	private final Duration maxIncrementalGap;
	private final Duration warmingDuration;
	private final Duration warnBeforeHit;
	private final double invalidHalfExtent; // degrees
	private final double resizeThreshold;
	private final double maxPaddingRatio;
	private final double boundsTolerance; // degrees
	private final double paddingChangeThreshold;

	private SweepSettings(Properties p) {
		maxSpeed = positiveDouble(p, MAX_SPEED);
		bandWidth = positiveDouble(p, BAND_WIDTH);
		maxBands = (int) positiveDouble(p, MAX_BANDS);
		maxIncrementalGap = seconds(p, MAX_INCREMENTAL_GAP);
		warmingDuration = seconds(p, WARMING_DURATION);
		warnBeforeHit = seconds(p, WARN_BEFORE_HIT);
		invalidHalfExtent = positiveDouble(p, INVALID_HALF_EXTENT);
		resizeThreshold = positiveDouble(p, RESIZE_THRESHOLD);
		maxPaddingRatio = positiveDouble(p, MAX_PADDING_RATIO);
		if (maxPaddingRatio >= 0.5) {
			throw new IllegalArgumentException(MAX_PADDING_RATIO + " must be below 0.5, was " + maxPaddingRatio);
		}
		boundsTolerance = positiveDouble(p, BOUNDS_TOLERANCE);
		paddingChangeThreshold = positiveDouble(p, PADDING_CHANGE_THRESHOLD);
		if (warnBeforeHit.compareTo(warmingDuration) > 0) {
			throw new IllegalArgumentException(WARN_BEFORE_HIT + " must not exceed " + WARMING_DURATION);
		}
	}

	/**
	 * Returns the settings loaded from {@value #RESOURCE}. The resource is read
	 * once.
	 */
	public static SweepSettings defaults() {
		SweepSettings result = defaults;
		if (result == null) {
			synchronized (SweepSettings.class) {
				result = defaults;
				if (result == null) {
					result = new SweepSettings(loadResource());
					defaults = result;
					LOGGER.debug("Loaded sweep settings from {}", RESOURCE);
				}
			}
		}
		return result;
	}

	/**
	 * Creates settings from the defaults with the given keys overridden.
	 *
	 * @param overrides properties whose keys replace the default values
	 * @return the merged settings
	 * @throws IllegalArgumentException if a value is missing, not numeric or out
	 *                                  of range
	 */
	public static SweepSettings fromProperties(Properties overrides) {
		Properties merged = loadResource();
		merged.putAll(overrides);
		return new SweepSettings(merged);
	}

	private static Properties loadResource() {
		Properties properties = new Properties();
		try (InputStream in = SweepSettings.class.getResourceAsStream(RESOURCE)) {
			if (in == null) {
				throw new IllegalStateException("Missing classpath resource " + RESOURCE);
			}
			properties.load(in);
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot read " + RESOURCE, e);
		}
		return properties;
	}

	private static double positiveDouble(Properties p, String key) {
		String raw = p.getProperty(key);
		if (raw == null) {
			throw new IllegalArgumentException("Missing setting " + key);
		}
		double value;
		try {
			value = Double.parseDouble(raw.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Setting " + key + " is not a number: " + raw, e);
		}
		if (!(value > 0) || Double.isInfinite(value)) {
			throw new IllegalArgumentException("Setting " + key + " must be positive, was " + raw);
		}
		return value;
	}

	private static Duration seconds(Properties p, String key) {
		return Duration.ofMillis(Math.round(positiveDouble(p, key) * 1000));
	}

	public double getMaxSpeed() {
		return maxSpeed;
	}

	public double getBandWidth() {
		return bandWidth;
	}

	public int getMaxBands() {
		return maxBands;
	}

	/**
	 * Largest gap between two polls for which a snapshot may be derived
	 * incrementally from the previous one.
	 */
	public Duration getMaxIncrementalGap() {
		return maxIncrementalGap;
	}

	public Duration getWarmingDuration() {
		return warmingDuration;
	}

	public Duration getWarnBeforeHit() {
		return warnBeforeHit;
	}

	/**
	 * Viewport half-extent (degrees) above which a reported viewport is treated
	 * as not yet initialized.
	 */
	public double getInvalidHalfExtent() {
		return invalidHalfExtent;
	}

	public double getResizeThreshold() {
		return resizeThreshold;
	}

	public double getMaxPaddingRatio() {
		return maxPaddingRatio;
	}

	public double getBoundsTolerance() {
		return boundsTolerance;
	}

	public double getPaddingChangeThreshold() {
		return paddingChangeThreshold;
	}
}
