package com.github.micycle1.cande;

public class UnknownElementException extends CandeException {

	private static final long serialVersionUID = 1L;

	private final int elementId;

	public UnknownElementException(int elementId) {
		super("No element with id " + elementId);
		this.elementId = elementId;
	}

	public int getElementId() {
		return elementId;
	}
}
