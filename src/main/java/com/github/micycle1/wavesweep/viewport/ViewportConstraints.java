package com.github.micycle1.wavesweep.viewport;

import java.util.Objects;

import com.github.micycle1.wavesweep.geometry.BoundingBox;

/**
 * Limits applied to the camera: the smallest zoom level allowed and the region
 * the camera center may move in.
 */
public class ViewportConstraints {

	private static final BoundingBox WORLD = BoundingBox.of(-90, -180, 90, 180);

	private final double minZoom;
	private final BoundingBox centerBounds;
	private final ViewportPadding padding;
	private final boolean neutral;
	private final boolean viewportFallback;

	public ViewportConstraints(double minZoom, BoundingBox centerBounds, ViewportPadding padding, boolean viewportFallback) {
		this(minZoom, centerBounds, padding, false, viewportFallback);
	}

	private ViewportConstraints(double minZoom, BoundingBox centerBounds, ViewportPadding padding, boolean neutral, boolean viewportFallback) {
		this.minZoom = minZoom;
		this.centerBounds = Objects.requireNonNull(centerBounds, "centerBounds");
		this.padding = Objects.requireNonNull(padding, "padding");
		this.neutral = neutral;
		this.viewportFallback = viewportFallback;
	}

	/**
	 * Constraints that restrict nothing beyond the event box itself, used when
	 * the inputs do not allow computing real ones.
	 *
	 * @param eventBox the event box, or null to allow the whole world
	 */
	public static ViewportConstraints neutral(BoundingBox eventBox) {
		return new ViewportConstraints(0, eventBox != null ? eventBox : WORLD, ViewportPadding.ZERO, true, false);
	}

	public double getMinZoom() {
		return minZoom;
	}

	public BoundingBox getCenterBounds() {
		return centerBounds;
	}

	public ViewportPadding getPadding() {
		return padding;
	}

	/**
	 * @return true for the no-op constraints returned on unusable input
	 */
	public boolean isNeutral() {
		return neutral;
	}

	/**
	 * @return true if the reported viewport looked uninitialized and zero
	 *         padding was used instead
	 */
	public boolean isViewportFallback() {
		return viewportFallback;
	}

	@Override
	public String toString() {
		return "ViewportConstraints[minZoom=" + minZoom + ", centerBounds=" + centerBounds + ", " + padding + (neutral ? ", neutral" : "")
				+ (viewportFallback ? ", fallback" : "") + "]";
	}
}
