package com.github.micycle1.cande;

/**
 * A node, element or material id is already taken.
 */
public class DuplicateIdException extends CandeException {

	private static final long serialVersionUID = 1L;

	private final int id;

	public DuplicateIdException(String kind, int id) {
		super(kind + " id " + id + " already exists");
		this.id = id;
	}

	public int getId() {
		return id;
	}
}
