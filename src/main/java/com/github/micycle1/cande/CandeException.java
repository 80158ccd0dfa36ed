package com.github.micycle1.cande;

/**
 * Base of the recoverable failures raised by model operations. A failed operation
 * leaves the model exactly as it was before the call.
 */
public class CandeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CandeException(String message) {
		super(message);
	}
}
