package com.github.micycle1.wavesweep.viewport;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.SweepConstants;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.Position;

/**
 * Keeps one map's camera inside an event's bounding box. Constraints are
 * recomputed whenever the camera settles (the pannable region depends on the
 * zoom) and on significant screen resizes, and only pushed to the renderer
 * when they actually changed.
 * <p>
 * Not thread-safe: meant to be driven from the renderer's UI thread.
 */
public class MapBoundsEnforcer {

	private static final Logger LOGGER = LoggerFactory.getLogger(MapBoundsEnforcer.class);

	private final BoundingBox eventBox;
	private final FitMode mode;
	private final CameraAdapter camera;
	private final ViewportConstraintEngine engine;

	private ViewportConstraints current;
	private ScreenSize lastScreen;
	private boolean skipNextRecalculation = false;

	public MapBoundsEnforcer(BoundingBox eventBox, FitMode mode, CameraAdapter camera, ViewportConstraintEngine engine) {
		this.eventBox = eventBox;
		this.mode = Objects.requireNonNull(mode, "mode");
		this.camera = Objects.requireNonNull(camera, "camera");
		this.engine = Objects.requireNonNull(engine, "engine");
	}

	/**
	 * @return the constraints last pushed to the camera, or null before the
	 *         first call to {@link #applyConstraints()}
	 */
	public ViewportConstraints getCurrentConstraints() {
		return current;
	}

	/**
	 * Computes constraints from the camera's current screen and visible region
	 * and pushes them unless they match the ones already applied.
	 *
	 * @return the constraints in effect
	 */
	public ViewportConstraints applyConstraints() {
		ScreenSize screen = camera.getScreenSize();
		ViewportConstraints next = engine.computeConstraints(eventBox, screen, mode, camera.getVisibleRegion());
		lastScreen = screen;
		if (current != null && isEquivalent(current, next)) {
			LOGGER.trace("Constraints unchanged, not pushing {}", next);
			return current;
		}
		current = next;
		if (!next.isNeutral()) {
			camera.setMinZoom(next.getMinZoom());
		}
		camera.setCameraBounds(next.getCenterBounds());
		LOGGER.debug("Applied {}", next);
		return next;
	}

	private boolean isEquivalent(ViewportConstraints a, ViewportConstraints b) {
		return a.isNeutral() == b.isNeutral() && Math.abs(a.getMinZoom() - b.getMinZoom()) <= SweepConstants.ZOOM_EPSILON && engine.boundsAreSimilar(a.getCenterBounds(), b.getCenterBounds())
				&& !engine.hasSignificantPaddingChange(a.getPadding(), b.getPadding());
	}

	/**
	 * Called when the camera stops moving. Recomputes the constraints, then
	 * pulls the camera back inside them if needed, unless the move was our own
	 * correction.
	 */
	public void onCameraIdle() {
		if (skipNextRecalculation) {
			skipNextRecalculation = false;
			LOGGER.trace("Skipping recalculation after own camera move");
			return;
		}
		applyConstraints();
		Position target = camera.getCameraTarget();
		if (target != null) {
			clampCameraTarget(target);
		}
	}

	/**
	 * Suppresses the recalculation on the next camera idle, e.g. while an
	 * animation started by the application settles.
	 */
	public void skipNextRecalculation() {
		skipNextRecalculation = true;
	}

	public boolean isRecalculationSuppressed() {
		return skipNextRecalculation;
	}

	/**
	 * @return true if the resize was significant and constraints were recomputed
	 */
	public boolean onScreenResized(ScreenSize size) {
		if (!engine.isSignificantResize(lastScreen, size)) {
			LOGGER.trace("Ignoring resize {} -> {}", lastScreen, size);
			return false;
		}
		LOGGER.debug("Screen resized {} -> {}", lastScreen, size);
		applyConstraints();
		return true;
	}

	/**
	 * Clamps a requested camera center into the current constraints and moves
	 * the camera there if it had to change.
	 *
	 * @return the valid center
	 */
	public Position clampCameraTarget(Position target) {
		ViewportConstraints constraints = current != null ? current : applyConstraints();
		Position clamped = engine.clampCenter(target, constraints.getCenterBounds());
		if (!clamped.equals(target)) {
			LOGGER.debug("Camera target {} clamped to {}", target, clamped);
			skipNextRecalculation = true;
			camera.moveCamera(clamped);
		}
		return clamped;
	}

	/**
	 * Moves the camera so its current visible region lies inside the event box,
	 * centering on the box along any axis the region is too large for.
	 *
	 * @return the new center, or null if the camera reports no target or region
	 */
	public Position keepViewportInside() {
		Position target = camera.getCameraTarget();
		BoundingBox region = camera.getVisibleRegion();
		if (target == null || region == null || eventBox == null) {
			return null;
		}
		Position inside = engine.clampCameraToKeepViewportInside(target, region, eventBox);
		if (!inside.equals(target)) {
			skipNextRecalculation = true;
			camera.moveCamera(inside);
		}
		return inside;
	}
}
