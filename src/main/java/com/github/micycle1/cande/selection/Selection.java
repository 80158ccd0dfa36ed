package com.github.micycle1.cande.selection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A mutable set of selected element ids. Listeners hear about every operation
 * that changes the content; operations that leave it as it was are silent.
 */
public class Selection {

	private final SortedSet<Integer> ids = new TreeSet<>();
	private final List<SelectionListener> listeners = new ArrayList<>();

	public void addListener(SelectionListener listener) {
		listeners.add(Objects.requireNonNull(listener, "listener"));
	}

	public void removeListener(SelectionListener listener) {
		listeners.remove(listener);
	}

	public boolean add(Collection<Integer> toAdd) {
		return changed(ids.addAll(toAdd));
	}

	public boolean remove(Collection<Integer> toRemove) {
		return changed(ids.removeAll(toRemove));
	}

	public boolean clear() {
		if (ids.isEmpty()) {
			return false;
		}
		ids.clear();
		return changed(true);
	}

	/**
	 * Selects each id that is not selected and deselects each one that is.
	 */
	public boolean toggle(Collection<Integer> toToggle) {
		boolean modified = false;
		for (Integer id : new TreeSet<>(toToggle)) {
			if (!ids.remove(id)) {
				ids.add(id);
			}
			modified = true;
		}
		return changed(modified);
	}

	public boolean replace(Collection<Integer> replacement) {
		SortedSet<Integer> next = new TreeSet<>(replacement);
		if (next.equals(ids)) {
			return false;
		}
		ids.clear();
		ids.addAll(next);
		return changed(true);
	}

	/**
	 * Combines picked ids with the selection as a click or box gesture does.
	 */
	public boolean apply(SelectionMode mode, Collection<Integer> picked) {
		switch (mode) {
		case NEW:
			return replace(picked);
		case ADD:
			return add(picked);
		case REMOVE:
			return remove(picked);
		default:
			throw new IllegalArgumentException("Unknown selection mode " + mode);
		}
	}

	public boolean contains(int id) {
		return ids.contains(id);
	}

	public boolean isEmpty() {
		return ids.isEmpty();
	}

	public int size() {
		return ids.size();
	}

	/**
	 * @return unmodifiable ascending view of the selected ids
	 */
	public SortedSet<Integer> getIds() {
		return Collections.unmodifiableSortedSet(ids);
	}

	private boolean changed(boolean modified) {
		if (modified) {
			SortedSet<Integer> snapshot = Collections.unmodifiableSortedSet(new TreeSet<>(ids));
			for (SelectionListener listener : List.copyOf(listeners)) {
				listener.selectionChanged(snapshot);
			}
		}
		return modified;
	}

	@Override
	public String toString() {
		return "Selection" + ids;
	}
}
