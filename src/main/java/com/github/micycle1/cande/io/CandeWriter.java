package com.github.micycle1.cande.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.Material;
import com.github.micycle1.cande.model.MaterialKind;
import com.github.micycle1.cande.model.Node;
import com.github.micycle1.cande.model.SourceDeck;
import com.github.micycle1.cande.model.SourceDeck.RecordKind;

/**
 * Writes a {@link CandeModel} back to CANDE input format.
 * <p>
 * A model read from file is written over its {@link SourceDeck}: uninterpreted
 * lines and unchanged records come out byte for byte, elements whose material or
 * step changed have just those columns rewritten, and records the model gained
 * since loading are inserted after the last record of their group. Structural
 * placeholder materials are never written.
 */
public class CandeWriter {

	private static final Logger LOGGER = LoggerFactory.getLogger(CandeWriter.class);

	// C-2 control fields maintained on save
	static final int CONTROL_MAX_STEP = 0;
	static final int CONTROL_NODE_COUNT = 5;
	static final int CONTROL_ELEMENT_COUNT = 6;
	static final int CONTROL_SOIL_MATERIALS = 8;
	static final int CONTROL_INTERFACE_MATERIALS = 9;

	/**
	 * Writes the model to {@code path} through a temporary file in the same
	 * directory, which then replaces the target. The target is untouched if
	 * anything fails.
	 */
	public void save(CandeModel model, Path path) throws IOException {
		Objects.requireNonNull(model, "model");
		Objects.requireNonNull(path, "path");
		byte[] content = toText(model).getBytes(CandeReader.CHARSET);

		Path target = path.toAbsolutePath();
		Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
		try {
			Files.write(tmp, content);
			try {
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				LOGGER.debug("Atomic move not supported for {}; replacing non-atomically", target);
				Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException | RuntimeException e) {
			Files.deleteIfExists(tmp);
			throw e;
		}
		LOGGER.info("Saved {}: {} nodes, {} elements, {} materials", target, model.getNodes().size(), model.getElements().size(),
				model.getMaterials().size());
	}

	/**
	 * @return the file content, line terminators included
	 */
	public String toText(CandeModel model) {
		StringBuilder sb = new StringBuilder();
		for (OutLine line : layout(model)) {
			sb.append(line.text).append(line.terminator);
		}
		return sb.toString();
	}

	/**
	 * @return the lines of the file, without terminators
	 */
	public List<String> render(CandeModel model) {
		Objects.requireNonNull(model, "model");
		List<String> lines = new ArrayList<>();
		for (OutLine line : layout(model)) {
			lines.add(line.text);
		}
		return lines;
	}

	private List<OutLine> layout(CandeModel model) {
		SourceDeck deck = model.getSourceDeck();
		return deck == null ? plainLayout(model) : deckLayout(model, deck);
	}

	/**
	 * Node, element and material groups of a model built in memory.
	 */
	private static List<OutLine> plainLayout(CandeModel model) {
		String nl = CandeReader.DEFAULT_LINE_SEPARATOR;
		List<OutLine> out = new ArrayList<>();
		for (String text : nodeLines(new ArrayList<>(model.getNodes()), true)) {
			out.add(new OutLine(RecordKind.NODE, text, nl));
		}
		for (String text : elementLines(new ArrayList<>(model.getElements()), true)) {
			out.add(new OutLine(RecordKind.ELEMENT, text, nl));
		}
		for (OutLine line : materialLines(writtenMaterials(model.getMaterials()), true, nl)) {
			out.add(line);
		}
		return out;
	}

	private static List<OutLine> deckLayout(CandeModel model, SourceDeck deck) {
		String nl = deck.getLineSeparator();
		Set<Integer> deckNodes = new HashSet<>();
		Set<Integer> deckElements = new HashSet<>();
		Set<Integer> deckMaterials = new HashSet<>();

		List<OutLine> out = new ArrayList<>(deck.getLines().size());
		int lastNode = -1;
		int lastElement = -1;
		int lastMaterial = -1;
		int lastMaterialHeader = -1;
		int control = -1;

		for (SourceDeck.Line line : deck.getLines()) {
			String text = line.getText();
			switch (line.getKind()) {
			case NODE:
				deckNodes.add(line.getId());
				lastNode = out.size();
				break;
			case ELEMENT:
				deckElements.add(line.getId());
				lastElement = out.size();
				text = updatedElement(text, model.getElement(line.getId()));
				break;
			case MATERIAL:
				deckMaterials.add(line.getId());
				lastMaterial = out.size();
				lastMaterialHeader = out.size();
				break;
			case MATERIAL_PROPERTY:
				lastMaterial = out.size();
				break;
			case CONTROL:
				control = out.size();
				break;
			default:
				break;
			}
			out.add(new OutLine(line.getKind(), text, line.getTerminator()));
		}

		List<Node> newNodes = new ArrayList<>();
		for (Node n : model.getNodes()) {
			if (!deckNodes.contains(n.getId())) {
				newNodes.add(n);
			}
		}
		List<Element> newElements = new ArrayList<>();
		for (Element e : model.getElements()) {
			if (!deckElements.contains(e.getId())) {
				newElements.add(e);
			}
		}
		List<Material> newMaterials = new ArrayList<>();
		for (Material m : writtenMaterials(model.getMaterials())) {
			if (!deckMaterials.contains(m.getId())) {
				newMaterials.add(m);
			}
		}

		// insert from the bottom of the file up so earlier anchors stay valid
		List<Insertion> insertions = new ArrayList<>();
		if (!newMaterials.isEmpty()) {
			int anchor = lastMaterial >= 0 ? lastMaterial : lastElement >= 0 ? lastElement : out.size() - 1;
			boolean moveFlag = lastMaterialHeader >= 0 && CandeFormat.hasLastFlag(out.get(lastMaterialHeader).text);
			insertions.add(new Insertion(anchor, lastMaterialHeader, moveFlag || lastMaterialHeader < 0, materialLines(newMaterials, true, nl)));
		}
		if (!newElements.isEmpty()) {
			int anchor = lastElement >= 0 ? lastElement : lastNode >= 0 ? lastNode : out.size() - 1;
			boolean moveFlag = lastElement >= 0 && CandeFormat.hasLastFlag(out.get(lastElement).text);
			insertions.add(new Insertion(anchor, lastElement, moveFlag || lastElement < 0,
					toOutLines(RecordKind.ELEMENT, elementLines(newElements, true), nl)));
		}
		if (!newNodes.isEmpty()) {
			int anchor = lastNode >= 0 ? lastNode : control;
			boolean moveFlag = lastNode >= 0 && CandeFormat.hasLastFlag(out.get(lastNode).text);
			insertions.add(new Insertion(anchor, lastNode, moveFlag || lastNode < 0, toOutLines(RecordKind.NODE, nodeLines(newNodes, true), nl)));
		}
		insertions.sort((a, b) -> Integer.compare(b.anchor, a.anchor));
		for (Insertion insertion : insertions) {
			insertion.apply(out, nl);
		}

		if (control >= 0) {
			// no insertion lands before the control record
			OutLine line = out.get(control);
			line.text = updatedControl(line.text, model);
		}
		if (!newNodes.isEmpty() || !newElements.isEmpty() || !newMaterials.isEmpty()) {
			LOGGER.debug("Appended {} nodes, {} elements and {} materials to the source layout", newNodes.size(), newElements.size(),
					newMaterials.size());
		}
		return out;
	}

	private static String updatedElement(String text, Element element) {
		if (element == null) {
			return text;
		}
		String body = CandeFormat.body(text);
		int material = CandeFormat.intField(body, CandeFormat.ELEMENT_MATERIAL_START, CandeFormat.ELEMENT_STEP_START);
		int step = CandeFormat.intField(body, CandeFormat.ELEMENT_STEP_START, CandeFormat.ELEMENT_CLASS_START);
		if (material == element.getMaterial() && step == element.getStep()) {
			return text;
		}
		return CandeFormat.spliceMaterialAndStep(text, element.getMaterial(), element.getStep());
	}

	/**
	 * Rewrites the count fields of the C-2 record. Fields that already hold the
	 * right value keep their original text.
	 */
	static String updatedControl(String text, CandeModel model) {
		List<String> fields = CandeFormat.controlFields(text);
		int soilMaterials = 0;
		int interfaceMaterials = 0;
		for (Material m : model.getMaterials()) {
			if (m.getKind() == MaterialKind.SOIL) {
				soilMaterials++;
			} else if (m.isInterface()) {
				interfaceMaterials++;
			}
		}
		setControlField(fields, CONTROL_MAX_STEP, model.getMaxStep(), true);
		setControlField(fields, CONTROL_NODE_COUNT, model.getNodes().size(), false);
		setControlField(fields, CONTROL_ELEMENT_COUNT, model.getElements().size(), false);
		setControlField(fields, CONTROL_SOIL_MATERIALS, soilMaterials, true);
		setControlField(fields, CONTROL_INTERFACE_MATERIALS, interfaceMaterials, true);
		return CandeFormat.joinControl(text, fields);
	}

	private static void setControlField(List<String> fields, int index, int value, boolean keepLarger) {
		while (fields.size() <= index) {
			fields.add(StringUtils.repeat(' ', CandeFormat.INT_WIDTH));
		}
		String current = fields.get(index).trim();
		int existing = 0;
		if (!current.isEmpty()) {
			try {
				existing = Integer.parseInt(current);
			} catch (NumberFormatException e) {
				LOGGER.warn("Control field {} holds '{}'; leaving it unchanged", index, current);
				return;
			}
		}
		int updated = keepLarger ? Math.max(existing, value) : value;
		if (updated != existing || current.isEmpty()) {
			fields.set(index, CandeFormat.formatInt(updated, CandeFormat.INT_WIDTH));
		}
	}

	private static List<Material> writtenMaterials(Iterable<Material> materials) {
		List<Material> written = new ArrayList<>();
		for (Material m : materials) {
			if (m.getKind() != MaterialKind.STRUCTURAL) {
				written.add(m);
			}
		}
		return written;
	}

	private static List<String> nodeLines(List<Node> nodes, boolean flagLast) {
		List<String> lines = new ArrayList<>(nodes.size());
		for (int i = 0; i < nodes.size(); i++) {
			lines.add(CandeFormat.formatNode(nodes.get(i), flagLast && i == nodes.size() - 1));
		}
		return lines;
	}

	private static List<String> elementLines(List<Element> elements, boolean flagLast) {
		List<String> lines = new ArrayList<>(elements.size());
		for (int i = 0; i < elements.size(); i++) {
			lines.add(CandeFormat.formatElement(elements.get(i), flagLast && i == elements.size() - 1));
		}
		return lines;
	}

	private static List<OutLine> materialLines(List<Material> materials, boolean flagLast, String nl) {
		List<OutLine> lines = new ArrayList<>();
		for (int i = 0; i < materials.size(); i++) {
			List<String> record = CandeFormat.formatMaterial(materials.get(i), flagLast && i == materials.size() - 1);
			lines.add(new OutLine(RecordKind.MATERIAL, record.get(0), nl));
			for (String property : record.subList(1, record.size())) {
				lines.add(new OutLine(RecordKind.MATERIAL_PROPERTY, property, nl));
			}
		}
		return lines;
	}

	private static List<OutLine> toOutLines(RecordKind kind, List<String> texts, String nl) {
		List<OutLine> lines = new ArrayList<>(texts.size());
		for (String text : texts) {
			lines.add(new OutLine(kind, text, nl));
		}
		return lines;
	}

	private static final class OutLine {

		final RecordKind kind;
		String text;
		String terminator;

		OutLine(RecordKind kind, String text, String terminator) {
			this.kind = kind;
			this.text = text;
			this.terminator = terminator;
		}
	}

	/**
	 * New records going in after {@code anchor}. When {@code keepFlag} is set the
	 * last new record carries the group flag, taken from {@code flagged} if that
	 * record had it.
	 */
	private static final class Insertion {

		final int anchor;
		final int flagged;
		final boolean keepFlag;
		final List<OutLine> lines;

		Insertion(int anchor, int flagged, boolean keepFlag, List<OutLine> lines) {
			this.anchor = anchor;
			this.flagged = flagged;
			this.keepFlag = keepFlag;
			this.lines = lines;
		}

		void apply(List<OutLine> out, String nl) {
			if (!keepFlag) {
				// the group had no flag; add none
				for (OutLine line : lines) {
					if (line.kind != RecordKind.MATERIAL_PROPERTY && CandeFormat.hasLastFlag(line.text)) {
						line.text = CandeFormat.withLastFlag(line.text, false);
					}
				}
			} else if (flagged >= 0) {
				OutLine previous = out.get(flagged);
				previous.text = CandeFormat.withLastFlag(previous.text, false);
			}
			int at = anchor + 1;
			if (anchor >= 0 && out.get(anchor).terminator.isEmpty()) {
				// the anchor was the unterminated final line
				out.get(anchor).terminator = nl;
				lines.get(lines.size() - 1).terminator = "";
			}
			out.addAll(at, lines);
		}
	}
}
