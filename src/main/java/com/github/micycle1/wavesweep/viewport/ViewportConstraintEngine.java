package com.github.micycle1.wavesweep.viewport;

import java.util.Objects;

import org.apache.commons.lang3.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.SweepConstants;
import com.github.micycle1.wavesweep.SweepSettings;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.GeoUtils;
import com.github.micycle1.wavesweep.geometry.Position;

/**
 * Computes how far out the camera may zoom and where its center may go so the
 * viewport never shows anything outside the event's bounding box.
 * <p>
 * Zoom levels follow the usual tiled-map convention: at zoom {@code z} the
 * world is {@code 256·2^z} pixels wide. Spans are measured in projected units,
 * so the vertical fit is exact under Web Mercator.
 */
public class ViewportConstraintEngine {

	private static final Logger LOGGER = LoggerFactory.getLogger(ViewportConstraintEngine.class);

	private final SweepSettings settings;
	private final MapProjection projection;

	public ViewportConstraintEngine(SweepSettings settings, MapProjection projection) {
		this.settings = Objects.requireNonNull(settings, "settings");
		this.projection = Objects.requireNonNull(projection, "projection");
	}

	public ViewportConstraintEngine() {
		this(SweepSettings.defaults(), new WebMercatorProjection());
	}

	public SweepSettings getSettings() {
		return settings;
	}

	/**
	 * Computes the constraints for the current viewport.
	 *
	 * @param eventBox        the event's bounding box
	 * @param screen          size of the map view in pixels
	 * @param mode            fitting policy
	 * @param currentViewport the region currently visible, or null if not known
	 *                        yet
	 * @return the constraints; neutral ones when the event box or the screen has
	 *         no usable size
	 */
	public ViewportConstraints computeConstraints(BoundingBox eventBox, ScreenSize screen, FitMode mode, BoundingBox currentViewport) {
		Objects.requireNonNull(mode, "mode");
		if (eventBox == null || eventBox.isDegenerate() || screen == null || !screen.isValid()) {
			LOGGER.debug("Neutral constraints for box {} on screen {}", eventBox, screen);
			return ViewportConstraints.neutral(eventBox);
		}
		double minZoom = minZoom(eventBox, screen, mode);
		boolean fallback = currentViewport != null && isUninitializedViewport(currentViewport);
		ViewportPadding padding = fallback ? ViewportPadding.ZERO : calculatePadding(currentViewport);
		if (fallback) {
			LOGGER.debug("Viewport {} looks uninitialized, using zero padding", currentViewport);
		}
		ViewportConstraints constraints = new ViewportConstraints(minZoom, centerBounds(eventBox, padding), padding, fallback);
		LOGGER.debug("{} constraints for {}: {}", mode, eventBox, constraints);
		return constraints;
	}

	/**
	 * Smallest zoom allowed. For {@link FitMode#TIGHT_FIT} the whole box fits
	 * the screen; for {@link FitMode#ASPECT_FIT} the box's constraining dimension
	 * exactly fills the screen and the other one overflows.
	 */
	public double minZoom(BoundingBox eventBox, ScreenSize screen, FitMode mode) {
		double zoom;
		if (mode == FitMode.ASPECT_FIT) {
			BoundingBox constraining = constrainingBox(eventBox, screen.getAspect());
			zoom = Math.min(zoomForWidth(constraining, screen), zoomForHeight(constraining, screen));
		} else {
			zoom = Math.min(zoomForWidth(eventBox, screen), zoomForHeight(eventBox, screen));
		}
		return Math.max(0, zoom);
	}

	double zoomForWidth(BoundingBox box, ScreenSize screen) {
		double span = projection.projectLongitude(box.getEastUnwrapped()) - projection.projectLongitude(box.getWest());
		return log2(screen.getWidth() * 2 * Math.PI / (span * SweepConstants.TILE_SIZE));
	}

	double zoomForHeight(BoundingBox box, ScreenSize screen) {
		return log2(screen.getHeight() * 2 * Math.PI / (projectedHeight(box) * SweepConstants.TILE_SIZE));
	}

	private double projectedHeight(BoundingBox box) {
		return projection.projectLatitude(box.getNorth()) - projection.projectLatitude(box.getSouth());
	}

	private static double log2(double v) {
		return Math.log(v) / Math.log(2);
	}

	/**
	 * The part of the event box with the screen's aspect ratio that is as large
	 * as possible, centered on the box. A box proportionally wider than the
	 * screen is narrowed to {@code height × screenAspect}; a taller one is
	 * shortened to {@code width / screenAspect}.
	 */
	public BoundingBox constrainingBox(BoundingBox eventBox, double screenAspect) {
		double width = projection.projectLongitude(eventBox.getEastUnwrapped()) - projection.projectLongitude(eventBox.getWest());
		double height = projectedHeight(eventBox);
		double eventAspect = width / height;
		if (eventAspect > screenAspect) {
			double halfLng = Math.toDegrees(height * screenAspect) / 2;
			double centerLng = eventBox.getWest() + eventBox.getWidth() / 2;
			return BoundingBox.of(eventBox.getSouth(), centerLng - halfLng, eventBox.getNorth(), centerLng + halfLng);
		}
		double centerY = (projection.projectLatitude(eventBox.getNorth()) + projection.projectLatitude(eventBox.getSouth())) / 2;
		double halfY = width / screenAspect / 2;
		double south = projection.unprojectLatitude(centerY - halfY);
		double north = projection.unprojectLatitude(centerY + halfY);
		return BoundingBox.of(south, eventBox.getWest(), north, eventBox.getEastUnwrapped());
	}

	/**
	 * Half-extent of a visible region. An absent or implausibly large region
	 * (as reported by a renderer that has not laid out yet) gives zero padding.
	 */
	public ViewportPadding calculatePadding(BoundingBox visibleRegion) {
		if (visibleRegion == null || isUninitializedViewport(visibleRegion)) {
			return ViewportPadding.ZERO;
		}
		return new ViewportPadding(visibleRegion.getHeight() / 2, visibleRegion.getWidth() / 2);
	}

	/**
	 * Whether a viewport's half-extent exceeds the sanity threshold on either
	 * axis.
	 */
	public boolean isUninitializedViewport(BoundingBox visibleRegion) {
		double threshold = settings.getInvalidHalfExtent();
		return visibleRegion.getHeight() / 2 > threshold || visibleRegion.getWidth() / 2 > threshold;
	}

	/**
	 * The event box shrunk by the padding on every side. Padding is capped at a
	 * share of the box span below one half, so the result never inverts.
	 */
	public BoundingBox centerBounds(BoundingBox eventBox, ViewportPadding padding) {
		double ratio = settings.getMaxPaddingRatio();
		double latPad = Math.min(padding.getLatitude(), eventBox.getHeight() * ratio);
		double lngPad = Math.min(padding.getLongitude(), eventBox.getWidth() * ratio);
		double west = eventBox.getWest() + lngPad;
		double east = eventBox.getEastUnwrapped() - lngPad;
		if (eventBox.wrapsAntimeridian()) {
			west = GeoUtils.normalizeLongitude(west);
			east = GeoUtils.normalizeLongitude(east);
		}
		return BoundingBox.of(eventBox.getSouth() + latPad, west, eventBox.getNorth() - latPad, east);
	}

	/**
	 * Nearest position to {@code proposed} inside {@code bounds}, clamping each
	 * axis on its own. A position already inside is returned as is.
	 */
	public Position clampCenter(Position proposed, BoundingBox bounds) {
		Objects.requireNonNull(proposed, "proposed");
		Objects.requireNonNull(bounds, "bounds");
		if (bounds.contains(proposed)) {
			return proposed;
		}
		double lat = Range.between(bounds.getSouth(), bounds.getNorth()).fit(proposed.getLat());
		double lng;
		boolean rawLongitudes = bounds.getWest() < -180 || bounds.getEast() > 180;
		if (!bounds.wrapsAntimeridian() && !rawLongitudes) {
			lng = Range.between(bounds.getWest(), bounds.getEast()).fit(proposed.getLng());
		} else {
			// unwrap into [west, west + 360) and clamp to the closer edge
			double west = bounds.getWest();
			double east = bounds.getEastUnwrapped();
			double l = west + ((proposed.getLng() - west) % 360 + 360) % 360;
			if (l > east) {
				l = (l - east) < (west + 360 - l) ? east : west;
			}
			lng = GeoUtils.normalizeLongitude(l);
		}
		return new Position(lat, lng);
	}

	/**
	 * Center that keeps a viewport of the given size inside the event box. On
	 * an axis where the viewport is larger than the box, the camera is centered
	 * on the box.
	 */
	public Position clampCameraToKeepViewportInside(Position target, BoundingBox viewport, BoundingBox eventBox) {
		double halfLat = viewport.getHeight() / 2;
		double halfLng = viewport.getWidth() / 2;
		Position center = eventBox.getCenter();
		double lat = halfLat * 2 >= eventBox.getHeight() ? center.getLat()
				: Range.between(eventBox.getSouth() + halfLat, eventBox.getNorth() - halfLat).fit(target.getLat());
		double lng;
		if (halfLng * 2 >= eventBox.getWidth()) {
			lng = center.getLng();
		} else {
			BoundingBox inner = centerBounds(eventBox, new ViewportPadding(0, halfLng));
			lng = clampCenter(new Position(center.getLat(), target.getLng()), inner).getLng();
		}
		return new Position(lat, lng);
	}

	/**
	 * Whether a screen size change is large enough to recompute constraints:
	 * more than the resize threshold, relatively, on either axis.
	 */
	public boolean isSignificantResize(ScreenSize previous, ScreenSize current) {
		if (previous == null || !previous.isValid()) {
			return current != null && current.isValid();
		}
		if (current == null || !current.isValid()) {
			return false;
		}
		double threshold = settings.getResizeThreshold();
		double dw = Math.abs(current.getWidth() - previous.getWidth()) / previous.getWidth();
		double dh = Math.abs(current.getHeight() - previous.getHeight()) / previous.getHeight();
		return dw > threshold || dh > threshold;
	}

	/**
	 * Whether two boxes match within the bounds tolerance on every edge.
	 */
	public boolean boundsAreSimilar(BoundingBox a, BoundingBox b) {
		if (a == null || b == null) {
			return a == b;
		}
		double tolerance = settings.getBoundsTolerance();
		return Math.abs(a.getSouth() - b.getSouth()) <= tolerance && Math.abs(a.getNorth() - b.getNorth()) <= tolerance
				&& Math.abs(a.getWest() - b.getWest()) <= tolerance && Math.abs(a.getEast() - b.getEast()) <= tolerance;
	}

	/**
	 * Whether the padding changed by more than the configured relative threshold
	 * on either axis.
	 */
	public boolean hasSignificantPaddingChange(ViewportPadding previous, ViewportPadding current) {
		double threshold = settings.getPaddingChangeThreshold();
		return relativeChange(previous.getLatitude(), current.getLatitude()) > threshold
				|| relativeChange(previous.getLongitude(), current.getLongitude()) > threshold;
	}

	private static double relativeChange(double before, double after) {
		if (before == 0) {
			return after == 0 ? 0 : Double.POSITIVE_INFINITY;
		}
		return Math.abs(after - before) / before;
	}
}
