package com.github.micycle1.cande.interfacing;

import java.util.List;

import com.github.micycle1.cande.model.InterfaceMaterialKey;
import com.github.micycle1.cande.model.Junction;

/**
 * An interface element computed by {@link InterfaceSynthesizer#plan} but not yet
 * inserted.
 */
public final class PlannedInterface {

	private final int elementId;
	private final Junction junction;
	private final List<Integer> nodeIds;
	private final int materialId;
	private final boolean newMaterial;
	private final InterfaceMaterialKey materialKey;
	private final int step;

	PlannedInterface(int elementId, Junction junction, List<Integer> nodeIds, int materialId, boolean newMaterial,
			InterfaceMaterialKey materialKey, int step) {
		this.elementId = elementId;
		this.junction = junction;
		this.nodeIds = List.copyOf(nodeIds);
		this.materialId = materialId;
		this.newMaterial = newMaterial;
		this.materialKey = materialKey;
		this.step = step;
	}

	public int getElementId() {
		return elementId;
	}

	public Junction getJunction() {
		return junction;
	}

	public List<Integer> getNodeIds() {
		return nodeIds;
	}

	public int getMaterialId() {
		return materialId;
	}

	/**
	 * @return true if the material does not exist in the model yet
	 */
	public boolean isNewMaterial() {
		return newMaterial;
	}

	public InterfaceMaterialKey getMaterialKey() {
		return materialKey;
	}

	public double getOrientation() {
		return materialKey.getOrientation();
	}

	public int getStep() {
		return step;
	}

	@Override
	public String toString() {
		return "PlannedInterface{" + elementId + " " + junction + " nodes=" + nodeIds + " mat=" + materialId + (newMaterial ? "(new)" : "")
				+ " orientation=" + getOrientation() + " step=" + step + '}';
	}
}
