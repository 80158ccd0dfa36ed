package com.github.micycle1.cande.model;

public enum MaterialKind {
	/** Soil model defined by a D-1 record. */
	SOIL,
	/** Interface model (D-1 type 6) with a D-2.Interface record. */
	INTERFACE,
	/**
	 * Beam pipe group. Pipe groups are defined by records this library passes
	 * through untouched, so these materials are never written.
	 */
	STRUCTURAL
}
