package com.github.micycle1.cande.selection;

/**
 * How a picked set of ids combines with the current selection.
 */
public enum SelectionMode {
	/** Replace the selection. */
	NEW,
	ADD,
	REMOVE
}
