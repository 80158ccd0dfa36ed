package com.github.micycle1.cande.model;

import java.util.Objects;

import org.apache.commons.lang3.tuple.Pair;

/**
 * A (beam, soil element) pair that shares at least one node, i.e. a place where an
 * interface element can be inserted.
 */
public final class Junction {

	private final Pair<Integer, Integer> ids;

	public Junction(int beamId, int soilId) {
		this.ids = Pair.of(beamId, soilId);
	}

	public int getBeamId() {
		return ids.getLeft();
	}

	public int getSoilId() {
		return ids.getRight();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		return Objects.equals(ids, ((Junction) o).ids);
	}

	@Override
	public int hashCode() {
		return ids.hashCode();
	}

	@Override
	public String toString() {
		return "Junction{beam=" + getBeamId() + ", soil=" + getSoilId() + '}';
	}
}
