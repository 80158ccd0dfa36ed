package com.github.micycle1.cande.model;

import java.util.List;
import java.util.Objects;

/**
 * A mesh element. The variant is given by {@link ElementType}; interface elements
 * additionally carry {@link InterfaceAttributes}.
 * <p>
 * Material and step are changed through {@link CandeModel} only, which keeps the
 * model's references valid.
 */
public final class Element {

	private final int id;
	private final ElementType type;
	private final List<Integer> nodeIds;
	private int material;
	private int step;
	private InterfaceAttributes interfaceAttributes;

	Element(int id, ElementType type, List<Integer> nodeIds, int material, int step, InterfaceAttributes interfaceAttributes) {
		this.id = id;
		this.type = Objects.requireNonNull(type, "type");
		this.nodeIds = List.copyOf(nodeIds);
		this.material = material;
		this.step = step;
		if ((type == ElementType.INTERFACE) != (interfaceAttributes != null)) {
			throw new IllegalArgumentException("Interface attributes are required for, and only for, interface elements");
		}
		this.interfaceAttributes = interfaceAttributes;
	}

	public int getId() {
		return id;
	}

	public ElementType getType() {
		return type;
	}

	public boolean isBeam() {
		return type == ElementType.BEAM;
	}

	public boolean isSoil() {
		return type == ElementType.SOIL;
	}

	public boolean isInterface() {
		return type == ElementType.INTERFACE;
	}

	/**
	 * @return the ordered, unmodifiable node id list
	 */
	public List<Integer> getNodeIds() {
		return nodeIds;
	}

	public int getNodeCount() {
		return nodeIds.size();
	}

	public boolean usesNode(int nodeId) {
		return nodeIds.contains(nodeId);
	}

	public int getMaterial() {
		return material;
	}

	public int getStep() {
		return step;
	}

	/**
	 * @return the interface attributes, or null unless this is an interface element
	 */
	public InterfaceAttributes getInterfaceAttributes() {
		return interfaceAttributes;
	}

	void setMaterial(int material) {
		this.material = material;
	}

	void setStep(int step) {
		this.step = step;
	}

	void setInterfaceAttributes(InterfaceAttributes interfaceAttributes) {
		this.interfaceAttributes = interfaceAttributes;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		Element that = (Element) o;
		return id == that.id && type == that.type && material == that.material && step == that.step && nodeIds.equals(that.nodeIds)
				&& Objects.equals(interfaceAttributes, that.interfaceAttributes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, type, nodeIds, material, step, interfaceAttributes);
	}

	@Override
	public String toString() {
		return "Element{" + id + " " + type + " nodes=" + nodeIds + " mat=" + material + " step=" + step
				+ (interfaceAttributes != null ? " " + interfaceAttributes : "") + '}';
	}
}
