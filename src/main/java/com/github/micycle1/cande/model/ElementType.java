package com.github.micycle1.cande.model;

/**
 * The closed set of element variants a CANDE mesh is built from.
 */
public enum ElementType {

	/**
	 * Two-node line element modelling a structural member such as the pipe wall.
	 */
	BEAM(2, 2),

	/**
	 * Quadrilateral (or triangular) continuum element modelling soil.
	 */
	SOIL(3, 4),

	/**
	 * Contact element between a beam and soil. Synthesized elements are four-node
	 * diamonds; files may also hold three-node (I-J-K) interfaces.
	 */
	INTERFACE(3, 4);

	private final int minNodes;
	private final int maxNodes;

	ElementType(int minNodes, int maxNodes) {
		this.minNodes = minNodes;
		this.maxNodes = maxNodes;
	}

	public boolean acceptsNodeCount(int count) {
		return count >= minNodes && count <= maxNodes;
	}
}
