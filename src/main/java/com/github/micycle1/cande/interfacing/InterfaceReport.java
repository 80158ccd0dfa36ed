package com.github.micycle1.cande.interfacing;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.InterfaceAttributes;
import com.github.micycle1.cande.model.Node;

/**
 * Plain-text listing of a model's interface elements, for inspecting the result of
 * a synthesis run.
 */
public class InterfaceReport {

	private final CandeModel model;

	public InterfaceReport(CandeModel model) {
		this.model = model;
	}

	public void write(Writer out) throws IOException {
		int count = 0;
		Map<Integer, Integer> perMaterial = new HashMap<>();
		StringBuilder details = new StringBuilder();
		for (Element e : model.getElements()) {
			if (!e.isInterface()) {
				continue;
			}
			count++;
			perMaterial.merge(e.getMaterial(), 1, Integer::sum);
			InterfaceAttributes attrs = e.getInterfaceAttributes();
			details.append("Interface ").append(e.getId()).append('\n');
			details.append("  nodes:       ").append(e.getNodeIds()).append('\n');
			details.append("  material:    ").append(e.getMaterial()).append('\n');
			details.append("  step:        ").append(e.getStep()).append('\n');
			details.append(String.format(Locale.ROOT, "  friction:    %.3f\n", attrs.getFriction()));
			details.append(String.format(Locale.ROOT, "  orientation: %.3f\n", attrs.getOrientation()));
			details.append("  junction:    ").append(attrs.getJunction() == null ? "unknown" : attrs.getJunction()).append('\n');
			for (int nodeId : e.getNodeIds()) {
				Node n = model.getNode(nodeId);
				details.append(String.format(Locale.ROOT, "    node %d: (%.3f, %.3f)\n", nodeId, n.getX(), n.getY()));
			}
		}
		out.write("Interface elements: " + count + "\n");
		out.write("Interface materials in use: " + perMaterial.size() + "\n\n");
		out.write(details.toString());
		out.flush();
	}

	@Override
	public String toString() {
		StringWriter sw = new StringWriter();
		try {
			write(sw);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return sw.toString();
	}
}
