package com.github.micycle1.wavesweep.wave;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.Polygon;
import com.github.micycle1.wavesweep.geometry.Position;

/**
 * The polygons a wave sweeps over, with their bounding box. The box is derived
 * from the polygons unless an explicit one is given (events may define a box
 * larger than their polygons).
 * <p>
 * Polygons must use the same continuous longitude range as the box: an area
 * crossing the antimeridian is given with longitudes such as 170 to 190.
 */
public class WaveArea {

	private final List<Polygon> polygons;
	private final BoundingBox bbox; // null when there is nothing to bound

	private WaveArea(List<Polygon> polygons, BoundingBox bbox) {
		this.polygons = polygons;
		this.bbox = bbox;
	}

	/**
	 * Creates an area from polygons; degenerate polygons are discarded.
	 */
	public static WaveArea of(List<Polygon> polygons) {
		Objects.requireNonNull(polygons, "polygons");
		List<Polygon> usable = new ArrayList<>(polygons.size());
		BoundingBox box = null;
		for (Polygon polygon : polygons) {
			if (polygon.isDegenerate()) {
				continue;
			}
			usable.add(polygon);
			box = box == null ? polygon.getBoundingBox() : box.union(polygon.getBoundingBox());
		}
		return new WaveArea(Collections.unmodifiableList(usable), box);
	}

	public static WaveArea of(Polygon... polygons) {
		return of(List.of(polygons));
	}

	public static WaveArea empty() {
		return new WaveArea(Collections.emptyList(), null);
	}

	/**
	 * @return an area with the same polygons and the given bounding box
	 */
	public WaveArea withBoundingBox(BoundingBox override) {
		return new WaveArea(polygons, Objects.requireNonNull(override, "override"));
	}

	public List<Polygon> getPolygons() {
		return polygons;
	}

	/**
	 * @return the bounding box, or null for an area without polygons
	 */
	public BoundingBox getBoundingBox() {
		return bbox;
	}

	/**
	 * An area is empty when it has no usable polygon or its box has no width or
	 * no height. Calculations over an empty area give neutral results.
	 */
	public boolean isEmpty() {
		return polygons.isEmpty() || bbox == null || bbox.isDegenerate();
	}

	/**
	 * Whether a position lies in one of the polygons (boundary included).
	 */
	public boolean contains(Position p) {
		if (p == null) {
			return false;
		}
		for (Polygon polygon : polygons) {
			if (polygon.contains(p)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Moves a longitude into the box's continuous range [west, west + width]
	 * when it is given on the other side of the antimeridian.
	 */
	public double unwrapLongitude(double lng) {
		if (bbox == null) {
			return lng;
		}
		double west = bbox.getWest();
		double east = bbox.getEastUnwrapped();
		if (lng < west && lng + 360 <= east) {
			return lng + 360;
		}
		if (lng > east && lng - 360 >= west) {
			return lng - 360;
		}
		return lng;
	}

	public double getTotalArea() {
		return polygons.stream().mapToDouble(Polygon::getArea).sum();
	}

	@Override
	public String toString() {
		return "WaveArea[" + polygons.size() + " polygons, " + bbox + "]";
	}
}
