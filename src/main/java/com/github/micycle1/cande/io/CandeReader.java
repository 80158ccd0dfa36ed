package com.github.micycle1.cande.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.cande.CandeConstants;
import com.github.micycle1.cande.CandeException;
import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.ElementType;
import com.github.micycle1.cande.model.InterfaceAttributes;
import com.github.micycle1.cande.model.Material;
import com.github.micycle1.cande.model.MaterialKind;
import com.github.micycle1.cande.model.SourceDeck;
import com.github.micycle1.cande.model.SourceDeck.RecordKind;
import com.github.micycle1.cande.util.GeometryUtil;

/**
 * Reads CANDE input files into a {@link CandeModel}.
 * <p>
 * Only node, element, material and control records are interpreted. Every line is
 * kept in the model's {@link SourceDeck} so {@link CandeWriter} can reproduce the
 * file. A file is read completely or not at all: any malformed record raises a
 * {@link CandeParseException} and no model is returned.
 */
public class CandeReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(CandeReader.class);

	/** CANDE decks are plain 8-bit text. */
	public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

	static final String DEFAULT_LINE_SEPARATOR = "\n";

	public CandeModel load(Path path) throws IOException {
		Objects.requireNonNull(path, "path");
		String text = new String(Files.readAllBytes(path), CHARSET);
		CandeModel model = parse(text);
		LOGGER.info("Loaded {}: {} nodes, {} elements, {} materials", path, model.getNodes().size(), model.getElements().size(),
				model.getMaterials().size());
		return model;
	}

	/**
	 * Parses file content, keeping its line terminators.
	 */
	public CandeModel parse(String text) throws CandeParseException {
		Objects.requireNonNull(text, "text");
		List<String> lines = new ArrayList<>();
		List<String> terminators = new ArrayList<>();
		String separator = null;
		int start = 0;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\n' || c == '\r') {
				int end = i;
				if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
					i++;
				}
				String terminator = text.substring(end, i + 1);
				lines.add(text.substring(start, end));
				terminators.add(terminator);
				if (separator == null) {
					separator = terminator;
				}
				start = i + 1;
			}
			i++;
		}
		if (start < text.length()) {
			lines.add(text.substring(start));
			terminators.add("");
		}
		return parse(lines, terminators, separator == null ? DEFAULT_LINE_SEPARATOR : separator);
	}

	/**
	 * Parses lines given without terminators; each is taken to end with a newline.
	 */
	public CandeModel parse(List<String> lines) throws CandeParseException {
		Objects.requireNonNull(lines, "lines");
		return parse(lines, Collections.nCopies(lines.size(), DEFAULT_LINE_SEPARATOR), DEFAULT_LINE_SEPARATOR);
	}

	private CandeModel parse(List<String> lines, List<String> terminators, String separator) throws CandeParseException {
		List<SourceDeck.Line> deck = new ArrayList<>(lines.size());
		List<NodeRecord> nodeRecords = new ArrayList<>();
		List<ElementRecord> elementRecords = new ArrayList<>();
		List<MaterialRecord> materialRecords = new ArrayList<>();
		MaterialRecord openMaterial = null;

		for (int index = 0; index < lines.size(); index++) {
			String line = lines.get(index);
			int lineNumber = index + 1;
			RecordKind kind;
			int id = 0;
			if (CandeFormat.CONTROL.matcher(line).find()) {
				kind = RecordKind.CONTROL;
				openMaterial = null;
			} else if (CandeFormat.NODE.matcher(line).find()) {
				NodeRecord node = parseNode(line, lineNumber);
				nodeRecords.add(node);
				kind = RecordKind.NODE;
				id = node.id;
				openMaterial = null;
			} else if (CandeFormat.ELEMENT.matcher(line).find()) {
				ElementRecord element = parseElement(line, lineNumber);
				elementRecords.add(element);
				kind = RecordKind.ELEMENT;
				id = element.id;
				openMaterial = null;
			} else if (CandeFormat.MATERIAL.matcher(line).find()) {
				openMaterial = parseMaterialHeader(line, lineNumber);
				materialRecords.add(openMaterial);
				kind = RecordKind.MATERIAL;
				id = openMaterial.id;
			} else if (openMaterial != null && CandeFormat.MATERIAL_PROPERTY.matcher(line).find()) {
				openMaterial.properties.add(line);
				if (CandeFormat.INTERFACE_PROPERTY.matcher(line).find()) {
					parseInterfaceProperties(openMaterial, line, lineNumber);
				}
				kind = RecordKind.MATERIAL_PROPERTY;
				id = openMaterial.id;
			} else {
				kind = RecordKind.OPAQUE;
				openMaterial = null;
			}
			deck.add(new SourceDeck.Line(kind, id, line, terminators.get(index)));
		}

		CandeModel model = build(nodeRecords, elementRecords, materialRecords);
		model.setSourceDeck(new SourceDeck(deck, separator));
		checkWinding(model);
		return model;
	}

	private CandeModel build(List<NodeRecord> nodeRecords, List<ElementRecord> elementRecords, List<MaterialRecord> materialRecords)
			throws CandeParseException {
		CandeModel model = new CandeModel();
		int lineNumber = 0;
		try {
			for (NodeRecord n : nodeRecords) {
				lineNumber = n.lineNumber;
				model.addNode(n.id, new Coordinate(n.x, n.y));
			}
			for (MaterialRecord m : materialRecords) {
				lineNumber = m.lineNumber;
				model.addMaterial(m.toMaterial());
			}

			// beams reference pipe groups defined in records this reader does not interpret
			TreeMap<Integer, Integer> structural = new TreeMap<>();
			for (ElementRecord e : elementRecords) {
				if (e.type == ElementType.BEAM && !model.hasMaterial(e.material)) {
					structural.putIfAbsent(e.material, e.lineNumber);
				}
			}
			for (var entry : structural.entrySet()) {
				lineNumber = entry.getValue();
				model.addMaterial(Material.structural(entry.getKey()));
			}

			List<ElementRecord> interfaces = new ArrayList<>();
			for (ElementRecord e : elementRecords) {
				if (e.type == ElementType.INTERFACE) {
					interfaces.add(e);
					continue;
				}
				lineNumber = e.lineNumber;
				model.addElement(e.id, e.type, e.nodeIds, e.material, e.step);
			}
			// interfaces last, so their junctions can be recovered from beams and soil
			for (ElementRecord e : interfaces) {
				lineNumber = e.lineNumber;
				Material m = model.getMaterial(e.material);
				if (m == null) {
					throw new CandeParseException(lineNumber, "interface element " + e.id + " references unknown material " + e.material);
				}
				if (!m.isInterface()) {
					throw new CandeParseException(lineNumber, "interface element " + e.id + " references non-interface material " + e.material);
				}
				model.addInterfaceElement(e.id, e.nodeIds, e.material, e.step, new InterfaceAttributes(m.getFriction(), m.getOrientation(), null));
			}
		} catch (CandeException e) {
			throw new CandeParseException(lineNumber, e.getMessage(), e);
		}
		return model;
	}

	private static NodeRecord parseNode(String line, int lineNumber) throws CandeParseException {
		String body = CandeFormat.body(line);
		requireLength(body, CandeFormat.NODE_Y_END, "node", lineNumber);
		NodeRecord node = new NodeRecord();
		node.lineNumber = lineNumber;
		node.id = intField(body, CandeFormat.ID_START, CandeFormat.ID_END, "node id", lineNumber);
		node.x = realField(body, CandeFormat.NODE_X_START, CandeFormat.NODE_Y_START, "x", lineNumber);
		node.y = realField(body, CandeFormat.NODE_Y_START, CandeFormat.NODE_Y_END, "y", lineNumber);
		return node;
	}

	private static ElementRecord parseElement(String line, int lineNumber) throws CandeParseException {
		String body = CandeFormat.body(line);
		requireLength(body, CandeFormat.ELEMENT_CLASS_START, "element", lineNumber);
		ElementRecord element = new ElementRecord();
		element.lineNumber = lineNumber;
		element.id = intField(body, CandeFormat.ID_START, CandeFormat.ID_END, "element id", lineNumber);
		for (int k = 0; k < CandeFormat.ELEMENT_MAX_NODES; k++) {
			int start = CandeFormat.ELEMENT_NODES_START + k * CandeFormat.INT_WIDTH;
			int nodeId = intField(body, start, start + CandeFormat.INT_WIDTH, "node " + (k + 1), lineNumber);
			if (nodeId != 0) {
				if (element.nodeIds.size() < k) {
					throw new CandeParseException(lineNumber, "element " + element.id + " has node " + nodeId + " after an empty node slot");
				}
				element.nodeIds.add(nodeId);
			}
		}
		element.material = intField(body, CandeFormat.ELEMENT_MATERIAL_START, CandeFormat.ELEMENT_STEP_START, "material", lineNumber);
		element.step = intField(body, CandeFormat.ELEMENT_STEP_START, CandeFormat.ELEMENT_CLASS_START, "step", lineNumber);
		int elementClass = intField(body, CandeFormat.ELEMENT_CLASS_START, CandeFormat.ELEMENT_CLASS_END, "class", lineNumber);

		int count = element.nodeIds.size();
		if (elementClass == CandeConstants.INTERFACE_ELEMENT_CLASS) {
			element.type = ElementType.INTERFACE;
		} else if (elementClass == CandeConstants.REGULAR_ELEMENT_CLASS) {
			element.type = count == 2 ? ElementType.BEAM : ElementType.SOIL;
		} else {
			throw new CandeParseException(lineNumber, "unknown element class " + elementClass + " for element " + element.id);
		}
		if (!element.type.acceptsNodeCount(count)) {
			throw new CandeParseException(lineNumber, "element " + element.id + " has " + count + " nodes");
		}
		return element;
	}

	private static MaterialRecord parseMaterialHeader(String line, int lineNumber) throws CandeParseException {
		String body = CandeFormat.body(line);
		requireLength(body, CandeFormat.MATERIAL_TYPE_START + CandeFormat.INT_WIDTH, "material", lineNumber);
		MaterialRecord material = new MaterialRecord();
		material.lineNumber = lineNumber;
		material.id = intField(body, CandeFormat.ID_START, CandeFormat.ID_END, "material id", lineNumber);
		material.typeCode = intField(body, CandeFormat.MATERIAL_TYPE_START, CandeFormat.MATERIAL_DENSITY_START, "model type", lineNumber);
		if (!CandeFormat.field(body, CandeFormat.MATERIAL_DENSITY_START, CandeFormat.MATERIAL_NAME_START).isEmpty()) {
			material.density = realField(body, CandeFormat.MATERIAL_DENSITY_START, CandeFormat.MATERIAL_NAME_START, "density", lineNumber);
		}
		material.name = CandeFormat.field(body, CandeFormat.MATERIAL_NAME_START, CandeFormat.MATERIAL_NAME_END);
		return material;
	}

	private static void parseInterfaceProperties(MaterialRecord material, String line, int lineNumber) throws CandeParseException {
		String body = CandeFormat.body(line);
		double angle = realField(body, 0, CandeFormat.REAL_WIDTH, "angle", lineNumber);
		double friction = realField(body, CandeFormat.REAL_WIDTH, 2 * CandeFormat.REAL_WIDTH, "friction", lineNumber);
		material.orientation = GeometryUtil.quantizeOrientation(angle);
		material.friction = GeometryUtil.quantizeFriction(friction);
	}

	private static void requireLength(String body, int length, String record, int lineNumber) throws CandeParseException {
		if (body.length() < length) {
			throw new CandeParseException(lineNumber, record + " record is too short");
		}
	}

	private static int intField(String body, int start, int end, String name, int lineNumber) throws CandeParseException {
		try {
			return CandeFormat.intField(body, start, end);
		} catch (NumberFormatException e) {
			throw new CandeParseException(lineNumber, "bad " + name + " field '" + CandeFormat.field(body, start, end) + "'", e);
		}
	}

	private static double realField(String body, int start, int end, String name, int lineNumber) throws CandeParseException {
		try {
			return CandeFormat.realField(body, start, end);
		} catch (NumberFormatException e) {
			throw new CandeParseException(lineNumber, "bad " + name + " field '" + CandeFormat.field(body, start, end) + "'", e);
		}
	}

	/**
	 * Warns about soil elements that are not counter-clockwise or whose quad
	 * crosses itself. The file is left as it is.
	 */
	private static void checkWinding(CandeModel model) {
		for (Element e : model.getElements()) {
			if (!e.isSoil()) {
				continue;
			}
			List<Coordinate> outline = model.coordinatesOf(e);
			if (GeometryUtil.isSelfIntersectingQuad(outline)) {
				LOGGER.warn("Soil element {} is a self-intersecting quadrilateral", e.getId());
			} else if (!GeometryUtil.isCounterClockwise(outline)) {
				LOGGER.warn("Soil element {} is not counter-clockwise", e.getId());
			}
		}
	}

	private static class NodeRecord {
		int lineNumber;
		int id;
		double x;
		double y;
	}

	private static class ElementRecord {
		int lineNumber;
		int id;
		ElementType type;
		final List<Integer> nodeIds = new ArrayList<>(CandeFormat.ELEMENT_MAX_NODES);
		int material;
		int step;
	}

	private static class MaterialRecord {
		int lineNumber;
		int id;
		int typeCode;
		double density;
		String name;
		double friction = Double.NaN;
		double orientation = Double.NaN;
		final List<String> properties = new ArrayList<>();

		Material toMaterial() throws CandeParseException {
			if (typeCode == CandeConstants.INTERFACE_MATERIAL_TYPE) {
				if (Double.isNaN(friction)) {
					throw new CandeParseException(lineNumber, "interface material " + id + " has no D-2.Interface record");
				}
				return new Material(id, MaterialKind.INTERFACE, typeCode, density, name, friction, orientation, properties);
			}
			return Material.soil(id, typeCode, density, name, properties);
		}
	}
}
