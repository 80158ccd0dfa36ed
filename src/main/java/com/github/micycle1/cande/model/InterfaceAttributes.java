package com.github.micycle1.cande.model;

import java.util.Objects;

/**
 * Derived attributes of an interface element. Friction and orientation mirror the
 * element's interface material; the junction is kept for display and is not
 * written to file.
 */
public final class InterfaceAttributes {

	private final double friction;
	private final double orientation;
	private final Junction junction;

	/**
	 * @param friction    friction coefficient
	 * @param orientation normal direction of the interface, degrees in [0, 360)
	 * @param junction    the beam/soil pair bridged, null if unknown
	 */
	public InterfaceAttributes(double friction, double orientation, Junction junction) {
		this.friction = friction;
		this.orientation = orientation;
		this.junction = junction;
	}

	public double getFriction() {
		return friction;
	}

	public double getOrientation() {
		return orientation;
	}

	/**
	 * @return the bridged beam/soil pair, or null for interfaces whose junction
	 *         could not be recovered from a file
	 */
	public Junction getJunction() {
		return junction;
	}

	InterfaceAttributes withJunction(Junction junction) {
		return new InterfaceAttributes(friction, orientation, junction);
	}

	// equality ignores the junction
	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		InterfaceAttributes that = (InterfaceAttributes) o;
		return Double.compare(friction, that.friction) == 0 && Double.compare(orientation, that.orientation) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(friction, orientation);
	}

	@Override
	public String toString() {
		return "InterfaceAttributes{friction=" + friction + ", orientation=" + orientation + ", junction=" + junction + '}';
	}
}
