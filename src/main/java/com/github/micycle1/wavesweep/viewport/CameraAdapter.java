package com.github.micycle1.wavesweep.viewport;

import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.Position;

/**
 * What the bounds enforcer needs from the map renderer.
 */
public interface CameraAdapter {

	ScreenSize getScreenSize();

	/**
	 * @return the region currently visible, or null before the first layout
	 */
	BoundingBox getVisibleRegion();

	/**
	 * @return the current camera center, or null if unknown
	 */
	Position getCameraTarget();

	void setMinZoom(double minZoom);

	/**
	 * Restricts where the camera center may go.
	 */
	void setCameraBounds(BoundingBox centerBounds);

	void moveCamera(Position target);
}
