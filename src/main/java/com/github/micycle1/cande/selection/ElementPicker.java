package com.github.micycle1.cande.selection;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.locationtech.jts.algorithm.Distance;
import org.locationtech.jts.algorithm.RayCrossingCounter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Location;

import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.ElementType;

/**
 * Geometric hit tests against the current node coordinates of a model. Beams are
 * hit within a distance tolerance; soil and interface elements are hit inside
 * their outline.
 */
public class ElementPicker {

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

	private final CandeModel model;

	public ElementPicker(CandeModel model) {
		this.model = Objects.requireNonNull(model, "model");
	}

	/**
	 * @param point     the picked position
	 * @param tolerance largest distance at which a beam is hit
	 * @param types     element types to consider, null for all
	 * @return the lowest id among the elements hit, or null
	 */
	public Integer pickAt(Coordinate point, double tolerance, Set<ElementType> types) {
		Objects.requireNonNull(point, "point");
		for (Element e : model.getElements()) {
			if (types != null && !types.contains(e.getType())) {
				continue;
			}
			List<Coordinate> coords = model.coordinatesOf(e);
			if (e.isBeam()) {
				if (Distance.pointToSegment(point, coords.get(0), coords.get(1)) <= tolerance) {
					return e.getId();
				}
			} else if (RayCrossingCounter.locatePointInRing(point, ring(coords)) != Location.EXTERIOR) {
				return e.getId();
			}
		}
		return null;
	}

	/**
	 * @param box    the picking box
	 * @param policy whether elements must lie inside the box or merely touch it
	 * @param types  element types to consider, null for all
	 * @return ascending ids of the elements picked
	 */
	public SortedSet<Integer> pickInBox(Envelope box, BoxPolicy policy, Set<ElementType> types) {
		Objects.requireNonNull(box, "box");
		Objects.requireNonNull(policy, "policy");
		SortedSet<Integer> picked = new TreeSet<>();
		if (box.isNull()) {
			return picked;
		}
		Geometry boxGeometry = GEOMETRY_FACTORY.toGeometry(box);
		for (Element e : model.getElements()) {
			if (types != null && !types.contains(e.getType())) {
				continue;
			}
			List<Coordinate> coords = model.coordinatesOf(e);
			boolean hit = policy == BoxPolicy.WINDOW ? allInside(box, coords) : touches(box, boxGeometry, e, coords);
			if (hit) {
				picked.add(e.getId());
			}
		}
		return picked;
	}

	private static boolean allInside(Envelope box, List<Coordinate> coords) {
		for (Coordinate c : coords) {
			if (!box.covers(c)) {
				return false;
			}
		}
		return true;
	}

	private static boolean touches(Envelope box, Geometry boxGeometry, Element e, List<Coordinate> coords) {
		for (Coordinate c : coords) {
			if (box.covers(c)) {
				return true;
			}
		}
		Coordinate[] outline = e.isBeam() ? coords.toArray(new Coordinate[0]) : ring(coords);
		if (GEOMETRY_FACTORY.createLineString(outline).intersects(boxGeometry)) {
			return true;
		}
		// a box lying wholly inside the element
		return !e.isBeam() && RayCrossingCounter.locatePointInRing(box.centre(), outline) != Location.EXTERIOR;
	}

	private static Coordinate[] ring(List<Coordinate> coords) {
		Coordinate[] ring = new Coordinate[coords.size() + 1];
		for (int i = 0; i < coords.size(); i++) {
			ring[i] = coords.get(i);
		}
		ring[coords.size()] = coords.get(0);
		return ring;
	}
}
