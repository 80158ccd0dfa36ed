package com.github.micycle1.cande.selection;

import java.util.SortedSet;

/**
 * Receives the selection after each change that altered its content.
 */
public interface SelectionListener {

	void selectionChanged(SortedSet<Integer> selected);
}
