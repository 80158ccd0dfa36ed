package com.github.micycle1.cande.interfacing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.cande.CandeConstants;
import com.github.micycle1.cande.ValidationException;
import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.InterfaceAttributes;
import com.github.micycle1.cande.model.InterfaceMaterialKey;
import com.github.micycle1.cande.model.Junction;
import com.github.micycle1.cande.model.Material;
import com.github.micycle1.cande.util.GeometryUtil;

/**
 * Creates interface elements between selected beams and the soil elements they
 * share nodes with.
 * <p>
 * For every (beam, soil) junction the interface normal is the beam normal pointing
 * away from the soil centroid. Interfaces with equal (friction, orientation) share
 * one material; new materials are allocated after the model's highest material id.
 * A junction that already has an interface is left alone, so running the
 * synthesis twice over the same beams creates nothing the second time.
 */
public class InterfaceSynthesizer {

	private static final Logger LOGGER = LoggerFactory.getLogger(InterfaceSynthesizer.class);

	private final CandeModel model;

	public InterfaceSynthesizer(CandeModel model) {
		this.model = Objects.requireNonNull(model, "model");
	}

	/**
	 * Creates the interfaces for the given beams.
	 *
	 * @param elementIds selected element ids; non-beam elements are ignored
	 * @param friction   friction coefficient in [0, 1]
	 * @return ids of the created interface elements, in creation order
	 * @throws ValidationException if friction is out of range or finer than the
	 *                             record's three decimals, or the non-empty
	 *                             selection holds no beam
	 * @throws com.github.micycle1.cande.UnknownElementException for ids not in the
	 *                                                           model
	 */
	public List<Integer> createInterfaces(Collection<Integer> elementIds, double friction) {
		List<PlannedInterface> plan = plan(elementIds, friction);
		if (plan.isEmpty()) {
			return List.of();
		}

		List<Integer> created = new ArrayList<>(plan.size());
		Set<Integer> newMaterials = new HashSet<>();
		for (PlannedInterface p : plan) {
			if (p.isNewMaterial() && newMaterials.add(p.getMaterialId())) {
				InterfaceMaterialKey key = p.getMaterialKey();
				model.addMaterial(Material.interfaceMaterial(p.getMaterialId(), key.getFriction(), key.getOrientation()));
			}
			InterfaceAttributes attributes = new InterfaceAttributes(p.getMaterialKey().getFriction(), p.getMaterialKey().getOrientation(),
					p.getJunction());
			model.addInterfaceElement(p.getElementId(), p.getNodeIds(), p.getMaterialId(), p.getStep(), attributes);
			created.add(p.getElementId());
		}
		LOGGER.info("Created {} interface elements ({} new materials) with friction {}", created.size(), newMaterials.size(), friction);
		return created;
	}

	/**
	 * Computes the interfaces {@link #createInterfaces} would create, without
	 * changing the model.
	 */
	public List<PlannedInterface> plan(Collection<Integer> elementIds, double friction) {
		Objects.requireNonNull(elementIds, "elementIds");
		if (!Double.isFinite(friction) || friction < CandeConstants.MIN_FRICTION || friction > CandeConstants.MAX_FRICTION) {
			throw new ValidationException("Friction must lie in [0, 1]: " + friction);
		}
		if (Math.abs(friction - GeometryUtil.quantizeFriction(friction)) > CandeConstants.ZERO_DIST) {
			throw new ValidationException("Friction " + friction + " has more than " + CandeConstants.FRICTION_DECIMALS + " decimals");
		}
		if (elementIds.isEmpty()) {
			return List.of();
		}

		SortedSet<Integer> beams = new TreeSet<>();
		for (Integer id : new TreeSet<>(elementIds)) {
			if (model.requireElement(id).isBeam()) {
				beams.add(id);
			}
		}
		if (beams.isEmpty()) {
			throw new ValidationException("No beam elements among the " + elementIds.size() + " selected elements");
		}

		List<PlannedInterface> plan = new ArrayList<>();
		Set<Junction> planned = new HashSet<>();
		Map<InterfaceMaterialKey, Integer> pendingMaterials = new HashMap<>();
		int nextElementId = model.peekNextElementId();
		int nextMaterialId = model.peekNextMaterialId();

		for (int beamId : beams) {
			Element beam = model.getElement(beamId);
			int a = beam.getNodeIds().get(0);
			int b = beam.getNodeIds().get(1);
			Coordinate pa = model.getNode(a).getCoordinate();
			Coordinate pb = model.getNode(b).getCoordinate();
			if (pa.distance(pb) < CandeConstants.ZERO_DIST) {
				LOGGER.warn("Beam {} has zero length; no interfaces created for it", beamId);
				continue;
			}

			for (int soilId : adjacentSoil(beam)) {
				Junction junction = new Junction(beamId, soilId);
				if (model.interfaceForJunction(junction) != null || !planned.add(junction)) {
					LOGGER.debug("{} already has an interface", junction);
					continue;
				}
				Element soil = model.getElement(soilId);

				double orientation = orientation(pa, pb, soil);
				InterfaceMaterialKey key = InterfaceMaterialKey.of(friction, orientation);
				Integer materialId = model.findInterfaceMaterial(key);
				boolean newMaterial = false;
				if (materialId == null) {
					materialId = pendingMaterials.get(key);
					if (materialId == null) {
						materialId = nextMaterialId++;
						pendingMaterials.put(key, materialId);
					}
					newMaterial = true;
				}

				// a junction bridges exactly one 2D element, whose step is the minimum
				int step = soil.getStep();
				List<Integer> nodes = diamondNodes(beam, soil);
				PlannedInterface p = new PlannedInterface(nextElementId++, junction, nodes, materialId, newMaterial, key, step);
				LOGGER.debug("Planned {}", p);
				plan.add(p);
			}
		}
		return plan;
	}

	/**
	 * Soil elements sharing at least one node with the beam, ascending by id.
	 */
	private SortedSet<Integer> adjacentSoil(Element beam) {
		SortedSet<Integer> soil = new TreeSet<>();
		for (int nodeId : beam.getNodeIds()) {
			for (int candidate : model.elementsUsingNode(nodeId)) {
				if (model.getElement(candidate).isSoil()) {
					soil.add(candidate);
				}
			}
		}
		return soil;
	}

	/**
	 * Interface normal in degrees, quantized: the normal of beam a-b pointing away
	 * from the soil centroid.
	 */
	private double orientation(Coordinate a, Coordinate b, Element soil) {
		Coordinate centroid = GeometryUtil.centroid(model.coordinatesOf(soil));
		if (GeometryUtil.isOnSupportingLine(a, b, centroid)) {
			LOGGER.debug("Centroid of soil element {} lies on the beam line; using the left-hand normal", soil.getId());
		}
		Vector2D normal = GeometryUtil.normalAwayFrom(a, b, centroid);
		return GeometryUtil.quantizeOrientation(GeometryUtil.angleDegrees(normal));
	}

	/**
	 * Node list {@code [a, b, pb, pa]} of the diamond bridging the beam a-b and the
	 * soil element: pa and pb are soil nodes paired with beam ends a and b.
	 * <p>
	 * A beam end that the soil element contains is paired with its neighbour on the
	 * soil outline that is not itself a beam node. If only one end is shared, the
	 * two outline neighbours of that end are used, the one nearer the free end being
	 * paired with it.
	 */
	List<Integer> diamondNodes(Element beam, Element soil) {
		int a = beam.getNodeIds().get(0);
		int b = beam.getNodeIds().get(1);
		List<Integer> outline = soil.getNodeIds();
		boolean hasA = outline.contains(a);
		boolean hasB = outline.contains(b);

		int pa;
		int pb;
		if (hasA && hasB) {
			pa = neighbourAvoiding(outline, a, b, -1);
			pb = neighbourAvoiding(outline, b, a, pa);
		} else {
			int shared = hasA ? a : b;
			int free = hasA ? b : a;
			int i = outline.indexOf(shared);
			int n1 = outline.get(Math.floorMod(i + 1, outline.size()));
			int n2 = outline.get(Math.floorMod(i - 1, outline.size()));
			Coordinate freePos = model.getNode(free).getCoordinate();
			double d1 = model.getNode(n1).getCoordinate().distance(freePos);
			double d2 = model.getNode(n2).getCoordinate().distance(freePos);
			int nearFree = d1 <= d2 ? n1 : n2;
			int nearShared = d1 <= d2 ? n2 : n1;
			pa = hasA ? nearShared : nearFree;
			pb = hasA ? nearFree : nearShared;
		}
		return List.of(a, b, pb, pa);
	}

	/**
	 * An outline neighbour of {@code node} other than {@code avoid}, preferring one
	 * different from {@code taken}.
	 */
	private static int neighbourAvoiding(List<Integer> outline, int node, int avoid, int taken) {
		int i = outline.indexOf(node);
		int next = outline.get(Math.floorMod(i + 1, outline.size()));
		int prev = outline.get(Math.floorMod(i - 1, outline.size()));
		List<Integer> options = new ArrayList<>(2);
		for (int candidate : List.of(next, prev)) {
			if (candidate != avoid) {
				options.add(candidate);
			}
		}
		if (options.isEmpty()) {
			return next; // degenerate two-node outline
		}
		for (int candidate : options) {
			if (candidate != taken) {
				return candidate;
			}
		}
		return options.get(0);
	}
}
