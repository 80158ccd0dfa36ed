package com.github.micycle1.cande.io;

import java.io.IOException;

/**
 * A CANDE input file could not be turned into a model. Carries the 1-based line
 * number of the offending record, or 0 when the problem is not tied to one line.
 */
public class CandeParseException extends IOException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	public CandeParseException(int lineNumber, String message) {
		super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message);
		this.lineNumber = lineNumber;
	}

	public CandeParseException(int lineNumber, String message, Throwable cause) {
		super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message, cause);
		this.lineNumber = lineNumber;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
