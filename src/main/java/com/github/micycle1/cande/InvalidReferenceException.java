package com.github.micycle1.cande;

/**
 * An element refers to a node or material the model does not contain.
 */
public class InvalidReferenceException extends CandeException {

	private static final long serialVersionUID = 1L;

	public InvalidReferenceException(String message) {
		super(message);
	}
}
