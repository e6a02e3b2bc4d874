package com.github.micycle1.wavesweep.viewport;

/**
 * Projection used by the renderer, mapping degrees to planar units in which the
 * whole world is {@code 2π} wide.
 */
public interface MapProjection {

	double projectLongitude(double longitude);

	double projectLatitude(double latitude);

	double unprojectLatitude(double y);
}
