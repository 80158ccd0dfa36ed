package com.github.micycle1.cande.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The line layout of the file a model was read from. Lines the codec does not
 * interpret are kept here verbatim so they can be written back unchanged; lines
 * it does interpret are tagged with the record they describe.
 */
public final class SourceDeck {

	public enum RecordKind {
		/** Any line not interpreted; written back as is. */
		OPAQUE,
		/** The C-2 control record holding model counts. */
		CONTROL,
		NODE,
		ELEMENT,
		/** A D-1 material header. */
		MATERIAL,
		/** A record following a D-1 header, owned by that material. */
		MATERIAL_PROPERTY
	}

	public static final class Line {

		private final RecordKind kind;
		private final int id;
		private final String text;
		private final String terminator;

		/**
		 * @param kind       record kind
		 * @param id         node, element or material id; 0 for opaque and control
		 *                   lines
		 * @param text       line content without terminator
		 * @param terminator the line terminator as found ("\n", "\r\n" or "" on the
		 *                   last line)
		 */
		public Line(RecordKind kind, int id, String text, String terminator) {
			this.kind = Objects.requireNonNull(kind);
			this.id = id;
			this.text = Objects.requireNonNull(text);
			this.terminator = Objects.requireNonNull(terminator);
		}

		public RecordKind getKind() {
			return kind;
		}

		public int getId() {
			return id;
		}

		public String getText() {
			return text;
		}

		public String getTerminator() {
			return terminator;
		}

		@Override
		public String toString() {
			return kind + (id != 0 ? "#" + id : "") + ": " + text;
		}
	}

	private final List<Line> lines;
	private final String lineSeparator;

	public SourceDeck(List<Line> lines, String lineSeparator) {
		this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
		this.lineSeparator = Objects.requireNonNull(lineSeparator);
	}

	public List<Line> getLines() {
		return lines;
	}

	/**
	 * @return the terminator used for lines added on save
	 */
	public String getLineSeparator() {
		return lineSeparator;
	}
}
