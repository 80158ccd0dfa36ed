package com.github.micycle1.cande.selection;

/**
 * Containment rule for box picking.
 */
public enum BoxPolicy {
	/** The element lies entirely within the box. */
	WINDOW,
	/** The element touches the box. */
	CROSSING;

	/**
	 * A box dragged left to right picks by {@link #WINDOW}, right to left by
	 * {@link #CROSSING}.
	 */
	public static BoxPolicy forDrag(double startX, double endX) {
		return endX >= startX ? WINDOW : CROSSING;
	}
}
