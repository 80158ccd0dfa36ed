package com.github.micycle1.cande;

/**
 * An argument is well-typed but not acceptable, e.g. a friction coefficient
 * outside [0, 1] or a node count that does not fit the element type.
 */
public class ValidationException extends CandeException {

	private static final long serialVersionUID = 1L;

	public ValidationException(String message) {
		super(message);
	}
}
