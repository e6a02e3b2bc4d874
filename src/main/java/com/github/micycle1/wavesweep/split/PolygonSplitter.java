package com.github.micycle1.wavesweep.split;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.wavesweep.SweepConstants;
import com.github.micycle1.wavesweep.geometry.BoundingBox;
import com.github.micycle1.wavesweep.geometry.Cut;
import com.github.micycle1.wavesweep.geometry.CutPosition;
import com.github.micycle1.wavesweep.geometry.Polygon;
import com.github.micycle1.wavesweep.geometry.Position;
import com.github.micycle1.wavesweep.geometry.Side;

/**
 * Splits polygons along a {@link Cut} into the parts west (left) and east
 * (right) of it.
 * <p>
 * The ring is walked once. Every edge crossing the cut receives a
 * {@link CutPosition}, and the ring is broken into chains running from one
 * crossing to the next, each chain lying on one side of the cut. Crossings are
 * then ordered along the cut and paired: between the members of a pair the cut
 * runs through the polygon's interior. An output ring follows a chain forward,
 * walks along the cut to the crossing paired with the chain's end, and carries
 * on with the chain leaving from there until it returns to its start. Chains
 * are only ever followed forward, so every output ring keeps the input's
 * winding.
 * <p>
 * A vertex lying on the cut is counted as east when looking for crossings; a
 * crossing vertex ends up in the rings of both sides. A stretch of the ring
 * that only touches the cut from the west produces no crossing at all.
 */
public final class PolygonSplitter {

	private static final Logger LOGGER = LoggerFactory.getLogger(PolygonSplitter.class);

	private PolygonSplitter() {
	}

	/**
	 * Splits every polygon of a collection along the cut.
	 *
	 * @return a pair of (left, right) polygon lists, in input order
	 */
	public static Pair<List<Polygon>, List<Polygon>> split(Collection<Polygon> polygons, Cut cut) {
		Objects.requireNonNull(polygons, "polygons");
		List<Polygon> left = new ArrayList<>();
		List<Polygon> right = new ArrayList<>();
		for (Polygon polygon : polygons) {
			Pair<List<Polygon>, List<Polygon>> parts = split(polygon, cut);
			left.addAll(parts.getLeft());
			right.addAll(parts.getRight());
		}
		return Pair.of(left, right);
	}

	/**
	 * Splits a polygon along the cut.
	 * <p>
	 * A polygon lying entirely on one side is returned unchanged on that side,
	 * with an empty list for the other. A degenerate polygon yields two empty
	 * lists.
	 *
	 * @param polygon the polygon to split, of any winding, convex or not
	 * @param cut     the dividing line
	 * @return a pair of (left, right) polygon lists; left is west of the cut
	 */
	public static Pair<List<Polygon>, List<Polygon>> split(Polygon polygon, Cut cut) {
		Objects.requireNonNull(polygon, "polygon");
		Objects.requireNonNull(cut, "cut");
		if (polygon.isDegenerate()) {
			LOGGER.debug("Skipping degenerate polygon of {} vertices", polygon.size());
			return Pair.of(Collections.<Polygon>emptyList(), Collections.<Polygon>emptyList());
		}

		BoundingBox box = polygon.getBoundingBox();
		if (box.getEast() < cut.getMinLongitude() - SweepConstants.COORDINATE_EPSILON) {
			return wholeLeft(polygon);
		}
		if (box.getWest() > cut.getMaxLongitude() + SweepConstants.COORDINATE_EPSILON) {
			return wholeRight(polygon);
		}

		List<Position> ring = subdivide(polygon.getVertices(), cut);
		Side[] sides = new Side[ring.size()];
		boolean anyWest = false;
		boolean anyEast = false;
		for (int i = 0; i < ring.size(); i++) {
			sides[i] = cut.sideOf(ring.get(i));
			anyWest |= sides[i] == Side.WEST;
			anyEast |= sides[i] == Side.EAST;
		}
		if (!anyWest) {
			return wholeRight(polygon);
		}
		if (!anyEast) {
			return wholeLeft(polygon);
		}

		List<Node> nodes = insertCrossings(ring, sides, cut);
		List<Chain> chains = buildChains(nodes);
		dropTouchingChains(nodes, chains);
		chains = buildChains(nodes);
		if (chains.isEmpty()) {
			// the ring only touches the cut from the west
			return wholeLeft(polygon);
		}
		if (chains.size() % 2 != 0) {
			LOGGER.warn("Odd number of cut crossings ({}) for polygon of {} vertices; keeping it unsplit", chains.size(), polygon.size());
			return wholeLeft(polygon);
		}

		Map<Integer, Integer> partners = pairCrossings(nodes, chains);
		List<Polygon> left = assemble(nodes, chains, partners, cut, true);
		List<Polygon> right = assemble(nodes, chains, partners, cut, false);
		LOGGER.debug("Split polygon of {} vertices into {} left and {} right parts with {}", polygon.size(), left.size(), right.size(), cut);
		return Pair.of(left, right);
	}

	private static Pair<List<Polygon>, List<Polygon>> wholeLeft(Polygon polygon) {
		return Pair.of(Collections.singletonList(polygon), Collections.<Polygon>emptyList());
	}

	private static Pair<List<Polygon>, List<Polygon>> wholeRight(Polygon polygon) {
		return Pair.of(Collections.<Polygon>emptyList(), Collections.singletonList(polygon));
	}

	/**
	 * Inserts a vertex on every edge wherever the edge passes the latitude of a
	 * cut breakpoint, so the cut is linear along every resulting sub-edge.
	 */
	private static List<Position> subdivide(List<Position> vertices, Cut cut) {
		int n = vertices.size();
		List<Position> ring = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			Position a = vertices.get(i);
			Position b = vertices.get((i + 1) % n);
			ring.add(a);
			List<CutPosition> breaks = cut.breakpointsBetween(a.getLat(), b.getLat());
			if (breaks.isEmpty()) {
				continue;
			}
			// interpolate from the west endpoint so shared edges subdivide identically
			boolean aWest = a.getLng() < b.getLng() || (a.getLng() == b.getLng() && a.getLat() <= b.getLat());
			Position w = aWest ? a : b;
			Position e = aWest ? b : a;
			for (CutPosition bp : breaks) {
				double t = (bp.getLat() - w.getLat()) / (e.getLat() - w.getLat());
				ring.add(new Position(bp.getLat(), w.getLng() + t * (e.getLng() - w.getLng())));
			}
		}
		return ring;
	}

	private static List<Node> insertCrossings(List<Position> ring, Side[] sides, Cut cut) {
		int n = ring.size();
		List<Node> nodes = new ArrayList<>(n + 8);
		for (int i = 0; i < n; i++) {
			int j = (i + 1) % n;
			Position a = ring.get(i);
			Position b = ring.get(j);
			append(nodes, new Node(a, sides[i] == Side.WEST, sides[i] == Side.ON, false));
			boolean aWest = sides[i] == Side.WEST;
			boolean bWest = sides[j] == Side.WEST;
			if (aWest == bWest) {
				continue;
			}
			Position eastEnd = aWest ? b : a;
			Side eastSide = aWest ? sides[j] : sides[i];
			CutPosition crossing;
			if (eastSide == Side.ON) {
				crossing = onCut(eastEnd, a, b, cut);
			} else {
				crossing = cut.intersect(a, b);
			}
			append(nodes, new Node(crossing, false, true, true));
		}
		// close the ring
		if (nodes.size() > 1) {
			Node first = nodes.get(0);
			Node last = nodes.get(nodes.size() - 1);
			if (first.position.equals(last.position)) {
				nodes.remove(nodes.size() - 1);
				if (first.crossing && last.crossing) {
					nodes.set(0, new Node(first.position, false, true, false));
				} else if (last.crossing) {
					nodes.set(0, last);
				}
			}
		}
		return nodes;
	}

	/**
	 * Appends a node, collapsing it with the previous one when both share the
	 * same coordinates. A crossing replaces a plain vertex; two crossings at the
	 * same spot cancel out (the ring touches the cut and goes back).
	 */
	private static void append(List<Node> nodes, Node node) {
		if (!nodes.isEmpty()) {
			Node last = nodes.get(nodes.size() - 1);
			if (last.position.equals(node.position)) {
				if (last.crossing && node.crossing) {
					nodes.set(nodes.size() - 1, new Node(last.position, false, true, false));
				} else if (node.crossing) {
					nodes.set(nodes.size() - 1, node);
				}
				return;
			}
		}
		nodes.add(node);
	}

	private static CutPosition onCut(Position p, Position a, Position b, Cut cut) {
		if (p instanceof CutPosition && ((CutPosition) p).belongsTo(cut)) {
			return (CutPosition) p;
		}
		boolean aWest = a.getLng() < b.getLng() || (a.getLng() == b.getLng() && a.getLat() <= b.getLat());
		return new CutPosition(p.getLat(), p.getLng(), cut.getId(), aWest ? a : b, aWest ? b : a);
	}

	private static List<Chain> buildChains(List<Node> nodes) {
		List<Integer> crossings = new ArrayList<>();
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i).crossing) {
				crossings.add(i);
			}
		}
		List<Chain> chains = new ArrayList<>(crossings.size());
		int r = crossings.size();
		for (int k = 0; k < r; k++) {
			int start = crossings.get(k);
			int end = crossings.get((k + 1) % r);
			boolean west = false;
			boolean allOnCut = true;
			for (int i = next(start, nodes); i != end; i = next(i, nodes)) {
				Node node = nodes.get(i);
				west |= node.west;
				allOnCut &= node.onCut;
			}
			chains.add(new Chain(start, end, west, allOnCut && !west));
		}
		return chains;
	}

	/**
	 * Removes east chains made only of on-cut vertices, merging the two west
	 * chains around them.
	 */
	private static void dropTouchingChains(List<Node> nodes, List<Chain> chains) {
		for (Chain chain : chains) {
			if (chain.touching) {
				Node start = nodes.get(chain.start);
				Node end = nodes.get(chain.end);
				nodes.set(chain.start, new Node(start.position, false, true, false));
				nodes.set(chain.end, new Node(end.position, false, true, false));
			}
		}
	}

	/**
	 * Pairs crossings ordered by latitude along the cut: south of the first
	 * crossing the cut is outside the polygon, and each crossing toggles
	 * inside/outside.
	 */
	private static Map<Integer, Integer> pairCrossings(List<Node> nodes, List<Chain> chains) {
		List<Integer> order = new ArrayList<>(chains.size());
		for (Chain chain : chains) {
			order.add(chain.start);
		}
		order.sort(Comparator.<Integer>comparingDouble(i -> nodes.get(i).position.getLat()).thenComparing(i -> i));
		Map<Integer, Integer> partners = new HashMap<>();
		for (int k = 0; k + 1 < order.size(); k += 2) {
			partners.put(order.get(k), order.get(k + 1));
			partners.put(order.get(k + 1), order.get(k));
		}
		return partners;
	}

	private static List<Polygon> assemble(List<Node> nodes, List<Chain> chains, Map<Integer, Integer> partners, Cut cut, boolean west) {
		Map<Integer, Chain> byStart = new HashMap<>();
		for (Chain chain : chains) {
			byStart.put(chain.start, chain);
		}
		Set<Chain> visited = new HashSet<>();
		List<Polygon> result = new ArrayList<>();
		for (Chain first : chains) {
			if (first.west != west || visited.contains(first)) {
				continue;
			}
			List<Position> ring = new ArrayList<>();
			Chain current = first;
			while (true) {
				visited.add(current);
				for (int i = current.start;; i = next(i, nodes)) {
					ring.add(nodes.get(i).position);
					if (i == current.end) {
						break;
					}
				}
				int partner = partners.get(current.end);
				ring.addAll(cut.breakpointsBetween(nodes.get(current.end).position.getLat(), nodes.get(partner).position.getLat()));
				Chain following = byStart.get(partner);
				if (following == first) {
					break;
				}
				if (following == null || following.west != west || visited.contains(following)) {
					LOGGER.warn("Cannot close {} ring along {}; keeping the open part", west ? "left" : "right", cut);
					break;
				}
				current = following;
			}
			Polygon polygon = toPolygon(ring);
			if (polygon != null) {
				result.add(polygon);
			}
		}
		return result;
	}

	private static Polygon toPolygon(List<Position> ring) {
		List<Position> cleaned = new ArrayList<>(ring.size());
		for (Position p : ring) {
			if (cleaned.isEmpty() || !cleaned.get(cleaned.size() - 1).equals(p)) {
				cleaned.add(p);
			}
		}
		while (cleaned.size() > 1 && cleaned.get(0).equals(cleaned.get(cleaned.size() - 1))) {
			cleaned.remove(cleaned.size() - 1);
		}
		if (cleaned.size() < 3) {
			return null;
		}
		Polygon polygon = new Polygon(cleaned);
		if (polygon.isDegenerate()) {
			LOGGER.debug("Dropping degenerate split part {}", polygon);
			return null;
		}
		return polygon;
	}

	private static int next(int i, List<Node> nodes) {
		return (i + 1) % nodes.size();
	}

	private static final class Node {

		final Position position;
		final boolean west; // strictly west of the cut
		final boolean onCut;
		final boolean crossing;

		Node(Position position, boolean west, boolean onCut, boolean crossing) {
			this.position = position;
			this.west = west;
			this.onCut = onCut;
			this.crossing = crossing;
		}
	}

	private static final class Chain {

		final int start; // node index of the crossing the chain leaves from
		final int end; // node index of the crossing the chain arrives at
		final boolean west;
		final boolean touching;

		Chain(int start, int end, boolean west, boolean touching) {
			this.start = start;
			this.end = end;
			this.west = west;
			this.touching = touching;
		}
	}
}
