package com.github.micycle1.cande.model;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A mesh node. Nodes are immutable; elements refer to them by id.
 */
public class Node {

	private final int id;
	private final Coordinate coordinate;

	public Node(int id, Coordinate coordinate) {
		this.id = id;
		this.coordinate = Objects.requireNonNull(coordinate, "coordinate").copy();
	}

	public int getId() {
		return id;
	}

	/**
	 * @return a copy of the node position; z is NaN for planar meshes
	 */
	public Coordinate getCoordinate() {
		return coordinate.copy();
	}

	public double getX() {
		return coordinate.x;
	}

	public double getY() {
		return coordinate.y;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		Node that = (Node) o;
		return id == that.id && Double.compare(coordinate.x, that.coordinate.x) == 0 && Double.compare(coordinate.y, that.coordinate.y) == 0
				&& Double.compare(coordinate.getZ(), that.coordinate.getZ()) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, coordinate.x, coordinate.y, coordinate.getZ());
	}

	@Override
	public String toString() {
		return "Node{" + id + " @ " + coordinate.x + ", " + coordinate.y + '}';
	}
}
