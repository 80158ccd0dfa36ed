package com.github.micycle1.cande.model;

/**
 * Tracks the next free id: one above every id seen so far. Ids are never reused.
 */
public class IdAllocator {

	private int next = 1;

	/**
	 * Records an id taken by other means so later allocations stay above it.
	 */
	public void observe(int id) {
		if (id >= next) {
			next = id + 1;
		}
	}

	public int peek() {
		return next;
	}
}
