package com.github.micycle1.cande.util;

import java.util.List;

import org.locationtech.jts.algorithm.Angle;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineSegment;
import org.locationtech.jts.math.Vector2D;

import com.github.micycle1.cande.CandeConstants;

public class GeometryUtil {

	/**
	 * Vertex average of the given points. For the convex quads and triangles of a
	 * CANDE mesh this lies inside the element, which is all the interface
	 * orientation needs.
	 *
	 * @param points at least one point
	 * @return the average position
	 */
	public static Coordinate centroid(List<Coordinate> points) {
		if (points.isEmpty()) {
			throw new IllegalArgumentException("Cannot compute the centroid of no points");
		}
		double x = 0;
		double y = 0;
		for (Coordinate c : points) {
			x += c.x;
			y += c.y;
		}
		return new Coordinate(x / points.size(), y / points.size());
	}

	/**
	 * Calculates the unit normal of segment a-b that points away from
	 * {@code awayFrom}. The side is decided from the segment midpoint; if
	 * {@code awayFrom} lies on the segment's supporting line the left-hand (CCW)
	 * normal is returned.
	 *
	 * @param a        first endpoint of the segment
	 * @param b        second endpoint of the segment
	 * @param awayFrom the point the normal must point away from
	 * @return the unit normal, or null if the segment has zero length
	 */
	public static Vector2D normalAwayFrom(Coordinate a, Coordinate b, Coordinate awayFrom) {
		Vector2D direction = Vector2D.create(a, b);
		if (direction.length() < CandeConstants.ZERO_DIST) {
			return null;
		}
		Vector2D normal = direction.rotateByQuarterCircle(1).normalize(); // CCW normal

		Coordinate mid = new LineSegment(a, b).midPoint();
		Vector2D toReference = Vector2D.create(mid, awayFrom);
		double side = normal.dot(toReference);
		if (side > CandeConstants.ZERO_AREA) {
			return normal.negate();
		}
		return normal;
	}

	/**
	 * @return true when {@code p} lies on the infinite line through a and b
	 */
	public static boolean isOnSupportingLine(Coordinate a, Coordinate b, Coordinate p) {
		Vector2D direction = Vector2D.create(a, b);
		double length = direction.length();
		if (length < CandeConstants.ZERO_DIST) {
			return true;
		}
		Vector2D toP = Vector2D.create(a, p);
		double cross = direction.getX() * toP.getY() - direction.getY() * toP.getX();
		return Math.abs(cross / length) < CandeConstants.ZERO_DIST;
	}

	/**
	 * Direction of the vector measured counter-clockwise from the positive x
	 * axis, in degrees within [0, 360).
	 */
	public static double angleDegrees(Vector2D v) {
		return Angle.toDegrees(Angle.normalizePositive(v.angle()));
	}

	/**
	 * Normalizes an angle in degrees to [0, 360).
	 */
	public static double normalizeDegrees(double degrees) {
		double d = degrees % CandeConstants.FULL_TURN_DEGREES;
		if (d < 0) {
			d += CandeConstants.FULL_TURN_DEGREES;
		}
		return d;
	}

	/**
	 * Rounds {@code value} to the given number of decimals, returning the scaled
	 * integer. Two values with the same index are considered equal.
	 */
	public static long quantizeIndex(double value, int decimals) {
		return Math.round(value * Math.pow(10, decimals));
	}

	/**
	 * Rounds {@code value} to the given number of decimals. The result is the
	 * double nearest to the decimal, i.e. what parsing its printed form yields.
	 */
	public static double quantize(double value, int decimals) {
		return quantizeIndex(value, decimals) / Math.pow(10, decimals);
	}

	/**
	 * Rounds an orientation to {@link CandeConstants#ORIENTATION_DECIMALS},
	 * folding values that round up to a full turn back to zero.
	 */
	public static double quantizeOrientation(double degrees) {
		double q = quantize(normalizeDegrees(degrees), CandeConstants.ORIENTATION_DECIMALS);
		return q >= CandeConstants.FULL_TURN_DEGREES ? 0.0 : q;
	}

	public static double quantizeFriction(double friction) {
		return quantize(friction, CandeConstants.FRICTION_DECIMALS);
	}

	/**
	 * Signed area of the polygon traced by the points (not closed). Positive for
	 * counter-clockwise winding.
	 */
	public static double signedArea(List<Coordinate> points) {
		if (points.size() < 3) {
			return 0;
		}
		Coordinate[] ring = new Coordinate[points.size() + 1];
		for (int i = 0; i < points.size(); i++) {
			ring[i] = points.get(i);
		}
		ring[points.size()] = points.get(0);
		// JTS reports clockwise rings as positive
		return -Area.ofRingSigned(ring);
	}

	public static boolean isCounterClockwise(List<Coordinate> points) {
		return signedArea(points) > CandeConstants.ZERO_AREA;
	}

	/**
	 * Checks whether the quadrilateral p0-p1-p2-p3 crosses itself, i.e. whether
	 * either pair of opposite edges intersects.
	 */
	public static boolean isSelfIntersectingQuad(List<Coordinate> quad) {
		if (quad.size() != 4) {
			return false;
		}
		LineSegment e01 = new LineSegment(quad.get(0), quad.get(1));
		LineSegment e12 = new LineSegment(quad.get(1), quad.get(2));
		LineSegment e23 = new LineSegment(quad.get(2), quad.get(3));
		LineSegment e30 = new LineSegment(quad.get(3), quad.get(0));
		return e01.intersection(e23) != null || e12.intersection(e30) != null;
	}
}
