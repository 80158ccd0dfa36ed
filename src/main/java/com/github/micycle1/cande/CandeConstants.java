package com.github.micycle1.cande;

public class CandeConstants {

	/**
	 * Lengths, areas and dot products smaller than this are treated as zero.
	 */
	public static final double ZERO_DIST = 1e-9;
	public static final double ZERO_AREA = 1e-12; // tolerance for cross products
	/**
	 * Interface orientations (degrees) are compared after rounding to this many
	 * decimals. Matches the F10.3 angle column of the interface material record, so
	 * a saved orientation reloads to the same key.
	 */
	public static final int ORIENTATION_DECIMALS = 3;
	/**
	 * Friction coefficients are compared after rounding to this many decimals.
	 * Matches the F10.3 friction column of the interface material record.
	 */
	public static final int FRICTION_DECIMALS = 3;
	public static final double MIN_FRICTION = 0.0;
	public static final double MAX_FRICTION = 1.0;
	public static final double FULL_TURN_DEGREES = 360.0;

	/** CANDE model type code of an interface material (D-1 record). */
	public static final int INTERFACE_MATERIAL_TYPE = 6;
	/** CANDE element class of an interface element (C-4 record). */
	public static final int INTERFACE_ELEMENT_CLASS = 1;
	public static final int REGULAR_ELEMENT_CLASS = 0;
}
