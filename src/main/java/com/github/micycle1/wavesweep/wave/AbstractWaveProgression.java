package com.github.micycle1.wavesweep.wave;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.SweepSettings;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.ComposedCut;
import com.github.micycle1.wavesweep.geometry.Polygon;
import com.github.micycle1.wavesweep.geometry.Position;

/**
 * Timing, snapshot bookkeeping and hit detection common to all wave kinds.
 * Subclasses describe where their front is after a given number of seconds.
 * <p>
 * The previous snapshot is the only mutable state shared between callers; it
 * is read and replaced under a lock so that concurrent pollers each get a
 * consistent snapshot.
 */
public abstract class AbstractWaveProgression implements WaveProgression {

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractWaveProgression.class);

	private final WaveParams params;
	private final Instant startTime;
	private final WaveClock clock;
	private final SweepSettings settings;
	private final SnapshotPolicy snapshotPolicy;

	private final Object lock = new Object();
	private volatile WaveArea area;
	private Double totalSeconds; // cached, guarded by lock
	private WaveSnapshot previous; // guarded by lock

	protected AbstractWaveProgression(WaveParams params, WaveArea area, Instant startTime, WaveClock clock, SweepSettings settings) {
		this.params = Objects.requireNonNull(params, "params");
		this.area = Objects.requireNonNull(area, "area");
		this.startTime = Objects.requireNonNull(startTime, "startTime");
		this.clock = Objects.requireNonNull(clock, "clock");
		this.settings = Objects.requireNonNull(settings, "settings");
		this.snapshotPolicy = new SnapshotPolicy(settings.getMaxIncrementalGap());
	}

	/**
	 * Seconds the front needs to cover the area. Only called for a non-empty
	 * area.
	 */
	protected abstract double computeTotalSeconds(BoundingBox box);

	/**
	 * Front longitude at a latitude, {@code elapsedSeconds} after the start.
	 */
	protected abstract double frontLongitude(BoundingBox box, double latitude, double elapsedSeconds);

	protected abstract WaveFront frontAt(BoundingBox box, double elapsedSeconds);

	/**
	 * Seconds after the start at which the front reaches a position inside the
	 * box. The longitude is already unwrapped into the box's range.
	 */
	protected abstract double secondsToReach(BoundingBox box, double latitude, double longitude);

	public WaveParams getParams() {
		return params;
	}

	protected double getSpeed() {
		return params.getSpeed();
	}

	protected SweepSettings getSettings() {
		return settings;
	}

	@Override
	public WaveKind getKind() {
		return params.getKind();
	}

	public WaveArea getArea() {
		return area;
	}

	/**
	 * Replaces the area. Cached durations and the previous snapshot are dropped,
	 * so the next snapshot is recomposed.
	 */
	public void updateArea(WaveArea newArea) {
		Objects.requireNonNull(newArea, "newArea");
		synchronized (lock) {
			this.area = newArea;
			this.totalSeconds = null;
			this.previous = null;
		}
		LOGGER.info("Wave area replaced by {}", newArea);
	}

	@Override
	public Instant getStartTime() {
		return startTime;
	}

	private double totalSeconds() {
		synchronized (lock) {
			if (totalSeconds == null) {
				WaveArea a = area;
				totalSeconds = a.isEmpty() ? 0.0 : computeTotalSeconds(a.getBoundingBox());
				LOGGER.debug("Total {} wave duration {}s over {}", getKind(), totalSeconds, a);
			}
			return totalSeconds;
		}
	}

	@Override
	public Duration getTotalDuration() {
		return toDuration(totalSeconds());
	}

	@Override
	public Instant getEndTime() {
		return startTime.plus(getTotalDuration());
	}

	private double elapsedSeconds(Instant now) {
		Duration d = Duration.between(startTime, now);
		return d.getSeconds() + d.getNano() / 1e9;
	}

	// elapsed time clamped to [0, total]
	private double clampedElapsed(Instant now) {
		return Math.max(0, Math.min(totalSeconds(), elapsedSeconds(now)));
	}

	@Override
	public WavePhase getPhase() {
		Instant now = clock.now();
		if (now.isBefore(startTime)) {
			return WavePhase.NOT_STARTED;
		}
		return elapsedSeconds(now) >= totalSeconds() ? WavePhase.COMPLETED : WavePhase.IN_PROGRESS;
	}

	@Override
	public double getProgression() {
		if (area.isEmpty()) {
			return 0;
		}
		Instant now = clock.now();
		if (now.isBefore(startTime)) {
			return 0;
		}
		double total = totalSeconds();
		if (total <= 0) {
			return 100;
		}
		return Math.min(1.0, elapsedSeconds(now) / total) * 100;
	}

	@Override
	public Double closestWaveLongitude(double latitude) {
		WaveArea a = area;
		if (a.isEmpty()) {
			return null;
		}
		return frontLongitude(a.getBoundingBox(), latitude, clampedElapsed(clock.now()));
	}

	@Override
	public WaveFront getCurrentFront() {
		WaveArea a = area;
		if (a.isEmpty()) {
			return null;
		}
		return frontAt(a.getBoundingBox(), clampedElapsed(clock.now()));
	}

	@Override
	public WaveSnapshot getWavePolygons() {
		Instant now = clock.now();
		synchronized (lock) {
			WaveArea a = area;
			if (a.isEmpty()) {
				LOGGER.debug("No wave polygons: empty area");
				return null;
			}
			if (now.isBefore(startTime)) {
				return null;
			}
			WaveFront front = frontAt(a.getBoundingBox(), clampedElapsed(now));
			SnapshotMode mode = snapshotPolicy.decide(previous, now, front);
			WaveSnapshot snapshot = mode == SnapshotMode.ADD ? advance(previous, now, front) : recompose(a, now, front);
			LOGGER.debug("Computed {} with {}", snapshot, front);
			previous = snapshot;
			return snapshot;
		}
	}

	private static WaveSnapshot recompose(WaveArea area, Instant now, WaveFront front) {
		List<Polygon> traversed = new ArrayList<>();
		List<Polygon> remaining = new ArrayList<>();
		for (Polygon polygon : area.getPolygons()) {
			Pair<List<Polygon>, List<Polygon>> parts = front.partition(polygon);
			traversed.addAll(parts.getLeft());
			remaining.addAll(parts.getRight());
		}
		return new WaveSnapshot(now, traversed, remaining, new ArrayList<>(traversed), front, SnapshotMode.RECOMPOSE);
	}

	private static WaveSnapshot advance(WaveSnapshot previous, Instant now, WaveFront front) {
		List<Polygon> added = new ArrayList<>();
		List<Polygon> remaining = new ArrayList<>();
		for (Polygon polygon : previous.getRemaining()) {
			Pair<List<Polygon>, List<Polygon>> parts = front.partition(polygon);
			added.addAll(parts.getLeft());
			remaining.addAll(parts.getRight());
		}
		List<Polygon> traversed = new ArrayList<>(previous.getTraversed());
		traversed.addAll(added);
		return new WaveSnapshot(now, traversed, remaining, added, front, SnapshotMode.ADD);
	}

	@Override
	public boolean isPositionWithin(Position position) {
		return position != null && area.contains(position);
	}

	@Override
	public Instant userHitDateTime(Position position) {
		WaveArea a = area;
		if (position == null || a.isEmpty() || !a.contains(position)) {
			return null;
		}
		double seconds = secondsToReach(a.getBoundingBox(), position.getLat(), a.unwrapLongitude(position.getLng()));
		return startTime.plus(toDuration(seconds));
	}

	@Override
	public Duration timeBeforeUserHit(Position position) {
		Instant hit = userHitDateTime(position);
		if (hit == null) {
			return null;
		}
		return Duration.between(clock.now(), hit);
	}

	@Override
	public boolean hasUserBeenHit(Position position) {
		Instant hit = userHitDateTime(position);
		if (hit == null) {
			return false;
		}
		Instant now = clock.now();
		return !now.isBefore(startTime) && !now.isBefore(hit);
	}

	@Override
	public WarmingState warmingState(Position position) {
		Duration left = timeBeforeUserHit(position);
		if (left == null) {
			return WarmingState.NONE;
		}
		if (left.isNegative() || left.isZero()) {
			return WarmingState.HIT;
		}
		if (left.compareTo(settings.getWarnBeforeHit()) <= 0) {
			return WarmingState.ABOUT_TO_BE_HIT;
		}
		if (left.compareTo(settings.getWarmingDuration()) <= 0) {
			return WarmingState.WARMING;
		}
		return WarmingState.NONE;
	}

	/**
	 * Samples a front given as longitude per latitude on latitude bands of the
	 * configured height, south to north.
	 */
	protected ComposedCut sampleFront(BoundingBox box, DoubleUnaryOperator longitudeAtLatitude) {
		double height = box.getHeight();
		int bands = (int) Math.min(settings.getMaxBands(), Math.max(1, Math.ceil(height / settings.getBandWidth())));
		List<Position> points = new ArrayList<>(bands + 1);
		for (int k = 0; k <= bands; k++) {
			double lat = k == bands ? box.getNorth() : box.getSouth() + height * k / bands;
			points.add(new Position(lat, longitudeAtLatitude.applyAsDouble(lat)));
		}
		return new ComposedCut(points);
	}

	protected static Duration toDuration(double seconds) {
		return Duration.ofNanos(Math.round(seconds * 1e9));
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + getKind() + ", speed=" + getSpeed() + "m/s, start=" + startTime + ", " + area + "]";
	}
}
