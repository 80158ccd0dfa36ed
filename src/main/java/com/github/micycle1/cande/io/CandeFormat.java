package com.github.micycle1.cande.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.github.micycle1.cande.CandeConstants;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.Material;
import com.github.micycle1.cande.model.Node;

/**
 * Fixed-column layout of the CANDE records the editor interprets. Every record
 * carries a tag ending in {@code !!}; columns are counted from the character after
 * the tag. The first of those columns is the group flag, {@code L} on the last
 * record of a group.
 *
 * <pre>
 * C-3.L3!!  node:      flag | id I4 | 2X | code A3 | x F10 | y F10
 * C-4.L3!!  element:   flag | id I4 | n1..n4 4I5 | material I5 | step I5 | class I5
 * D-1!!     material:  flag | id I4 | type I5 | density F10 | name A20
 * D-2.Interface!!      angle F10 | friction F10
 * C-2.L3!!  control:   I5 fields
 * </pre>
 */
public final class CandeFormat {

	static final String MARKER = "!!";
	static final char LAST_FLAG = 'L';
	static final char OPEN_FLAG = ' ';

	static final Pattern CONTROL = Pattern.compile("^\\s*C-2\\.L3!!");
	static final Pattern NODE = Pattern.compile("^\\s*C-3\\.L3!!");
	static final Pattern ELEMENT = Pattern.compile("^\\s*C-4\\.L3!!");
	static final Pattern MATERIAL = Pattern.compile("^\\s*D-1!!");
	static final Pattern MATERIAL_PROPERTY = Pattern.compile("^\\s*D-\\d");
	static final Pattern INTERFACE_PROPERTY = Pattern.compile("^\\s*D-2\\.Interface!!");

	static final String NODE_TAG = StringUtils.leftPad("C-3.L3!!", 27);
	static final String ELEMENT_TAG = StringUtils.leftPad("C-4.L3!!", 27);
	static final String MATERIAL_TAG = StringUtils.leftPad("D-1!!", 27);
	static final String INTERFACE_TAG = StringUtils.leftPad("D-2.Interface!!", 27);

	// column ranges within the record body, end exclusive
	static final int ID_START = 1;
	static final int ID_END = 5;

	static final int NODE_X_START = 10;
	static final int NODE_Y_START = 20;
	static final int NODE_Y_END = 30;

	static final int ELEMENT_NODES_START = 5;
	static final int ELEMENT_MAX_NODES = 4;
	static final int ELEMENT_MATERIAL_START = 25;
	static final int ELEMENT_STEP_START = 30;
	static final int ELEMENT_CLASS_START = 35;
	static final int ELEMENT_CLASS_END = 40;

	static final int MATERIAL_TYPE_START = 5;
	static final int MATERIAL_DENSITY_START = 10;
	static final int MATERIAL_NAME_START = 20;
	static final int MATERIAL_NAME_END = 40;

	static final int INT_WIDTH = 5;
	static final int ID_WIDTH = 4;
	static final int REAL_WIDTH = 10;

	static final String DEFAULT_NODE_CODE = "000";

	private CandeFormat() {
	}

	/**
	 * @return the index of the first body column, or -1 if the line has no tag
	 */
	static int bodyStart(String line) {
		int i = line.indexOf(MARKER);
		return i < 0 ? -1 : i + MARKER.length();
	}

	static String body(String line) {
		int start = bodyStart(line);
		return start < 0 ? "" : line.substring(start);
	}

	/**
	 * Trimmed content of body columns [start, end); empty where the line is short.
	 */
	static String field(String body, int start, int end) {
		return StringUtils.substring(body, start, end).trim();
	}

	/**
	 * Reads an integer field. Blank fields read as zero, as Fortran list input
	 * does.
	 *
	 * @throws NumberFormatException if the field is not an integer
	 */
	static int intField(String body, int start, int end) {
		String f = field(body, start, end);
		return f.isEmpty() ? 0 : Integer.parseInt(f);
	}

	/**
	 * @throws NumberFormatException if the field is blank or not a number
	 */
	static double realField(String body, int start, int end) {
		String f = field(body, start, end);
		if (f.isEmpty()) {
			throw new NumberFormatException("blank field");
		}
		double value = Double.parseDouble(f);
		if (!Double.isFinite(value)) {
			throw new NumberFormatException("not a finite number: " + f);
		}
		return value;
	}

	static boolean hasLastFlag(String line) {
		int start = bodyStart(line);
		return start >= 0 && start < line.length() && line.charAt(start) == LAST_FLAG;
	}

	/**
	 * Returns the line with its group flag set or cleared.
	 */
	static String withLastFlag(String line, boolean last) {
		int start = bodyStart(line);
		if (start < 0) {
			return line;
		}
		char flag = last ? LAST_FLAG : OPEN_FLAG;
		if (start >= line.length()) {
			return line + flag;
		}
		return line.substring(0, start) + flag + line.substring(start + 1);
	}

	/**
	 * Replaces body columns [start, start + value.length()) of the line, padding a
	 * short line with blanks first.
	 */
	static String splice(String line, int start, String value) {
		int from = bodyStart(line) + start;
		String padded = StringUtils.rightPad(line, from + value.length());
		return padded.substring(0, from) + value + padded.substring(from + value.length());
	}

	static String formatInt(int value, int width) {
		String s = Integer.toString(value);
		if (s.length() > width) {
			throw new IllegalArgumentException(value + " does not fit in " + width + " columns");
		}
		return StringUtils.leftPad(s, width);
	}

	static String formatReal(double value) {
		String s = String.format(Locale.ROOT, "%10.3f", value);
		if (s.length() > REAL_WIDTH) {
			throw new IllegalArgumentException(value + " does not fit in " + REAL_WIDTH + " columns");
		}
		return s;
	}

	static String flag(boolean last) {
		return String.valueOf(last ? LAST_FLAG : OPEN_FLAG);
	}

	static String formatNode(Node node, boolean last) {
		return NODE_TAG + flag(last) + formatInt(node.getId(), ID_WIDTH) + "  " + DEFAULT_NODE_CODE + formatReal(node.getX())
				+ formatReal(node.getY());
	}

	static String formatElement(Element element, boolean last) {
		StringBuilder sb = new StringBuilder(ELEMENT_TAG);
		sb.append(flag(last)).append(formatInt(element.getId(), ID_WIDTH));
		List<Integer> nodeIds = element.getNodeIds();
		for (int i = 0; i < ELEMENT_MAX_NODES; i++) {
			sb.append(formatInt(i < nodeIds.size() ? nodeIds.get(i) : 0, INT_WIDTH));
		}
		sb.append(formatInt(element.getMaterial(), INT_WIDTH));
		sb.append(formatInt(element.getStep(), INT_WIDTH));
		int elementClass = element.isInterface() ? CandeConstants.INTERFACE_ELEMENT_CLASS : CandeConstants.REGULAR_ELEMENT_CLASS;
		sb.append(formatInt(elementClass, INT_WIDTH));
		return sb.toString();
	}

	/**
	 * Writes new material and step values into an element record, keeping every
	 * other column of the original text.
	 */
	static String spliceMaterialAndStep(String line, int material, int step) {
		String updated = splice(line, ELEMENT_MATERIAL_START, formatInt(material, INT_WIDTH));
		return splice(updated, ELEMENT_STEP_START, formatInt(step, INT_WIDTH));
	}

	/**
	 * The D-1 header of a material, followed by its property records. Interface
	 * materials created in memory get a generated {@code D-2.Interface} record.
	 */
	static List<String> formatMaterial(Material material, boolean last) {
		List<String> lines = new ArrayList<>();
		lines.add(MATERIAL_TAG + flag(last) + formatInt(material.getId(), ID_WIDTH) + formatInt(material.getTypeCode(), INT_WIDTH)
				+ formatDensity(material.getDensity()) + StringUtils.leftPad(StringUtils.left(material.getName(), 20), 20));
		if (!material.getPropertyRecords().isEmpty()) {
			lines.addAll(material.getPropertyRecords());
		} else if (material.isInterface()) {
			lines.add(formatInterfaceProperties(material.getOrientation(), material.getFriction()));
		}
		return lines;
	}

	static String formatInterfaceProperties(double angle, double friction) {
		return INTERFACE_TAG + formatReal(angle) + formatReal(friction);
	}

	private static String formatDensity(double density) {
		if (density == Math.rint(density) && Math.abs(density) < 1e9) {
			return formatInt((int) density, REAL_WIDTH);
		}
		return formatReal(density);
	}

	/**
	 * Splits the body of a control record into its five-column fields. A trailing
	 * partial field is returned as is.
	 */
	static List<String> controlFields(String line) {
		String body = body(line);
		List<String> fields = new ArrayList<>();
		for (int i = 0; i < body.length(); i += INT_WIDTH) {
			fields.add(body.substring(i, Math.min(body.length(), i + INT_WIDTH)));
		}
		return fields;
	}

	static String joinControl(String line, List<String> fields) {
		return line.substring(0, bodyStart(line)) + String.join("", fields);
	}
}
