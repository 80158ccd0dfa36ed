package com.github.micycle1.cande.model;

import java.util.Objects;

import com.github.micycle1.cande.CandeConstants;
import com.github.micycle1.cande.util.GeometryUtil;

/**
 * Identity of an interface material: the (friction, orientation) pair after
 * quantization. Interfaces with equal keys share one material.
 */
public final class InterfaceMaterialKey {

	private final long frictionIndex;
	private final long orientationIndex;

	private InterfaceMaterialKey(long frictionIndex, long orientationIndex) {
		this.frictionIndex = frictionIndex;
		this.orientationIndex = orientationIndex;
	}

	public static InterfaceMaterialKey of(double friction, double orientation) {
		double f = GeometryUtil.quantizeFriction(friction);
		double o = GeometryUtil.quantizeOrientation(orientation);
		return new InterfaceMaterialKey(GeometryUtil.quantizeIndex(f, CandeConstants.FRICTION_DECIMALS),
				GeometryUtil.quantizeIndex(o, CandeConstants.ORIENTATION_DECIMALS));
	}

	public double getFriction() {
		return frictionIndex / Math.pow(10, CandeConstants.FRICTION_DECIMALS);
	}

	public double getOrientation() {
		return orientationIndex / Math.pow(10, CandeConstants.ORIENTATION_DECIMALS);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		InterfaceMaterialKey that = (InterfaceMaterialKey) o;
		return frictionIndex == that.frictionIndex && orientationIndex == that.orientationIndex;
	}

	@Override
	public int hashCode() {
		return Objects.hash(frictionIndex, orientationIndex);
	}

	@Override
	public String toString() {
		return "InterfaceMaterialKey{friction=" + getFriction() + ", orientation=" + getOrientation() + '}';
	}
}
