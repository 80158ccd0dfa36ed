package com.github.micycle1.cande.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.cande.DuplicateIdException;
import com.github.micycle1.cande.InvalidReferenceException;
import com.github.micycle1.cande.UnknownElementException;
import com.github.micycle1.cande.ValidationException;

/**
 * Nodes, elements and materials of one CANDE mesh, with the lookup indices the
 * editing operations need.
 * <p>
 * Invariants, restored at the end of every public mutator:
 * <ul>
 * <li>every node id referenced by an element exists;</li>
 * <li>every material id referenced by an element exists;</li>
 * <li>material ids are unique, and one interface material exists per quantized
 * (friction, orientation) pair;</li>
 * <li>element ids are unique across all element types;</li>
 * <li>an interface element with a known junction has the step of its soil
 * element.</li>
 * </ul>
 * Mutators validate all of their arguments before changing anything, so a thrown
 * exception leaves the model untouched. Instances are not thread-safe.
 */
public class CandeModel {

	private static final Logger LOGGER = LoggerFactory.getLogger(CandeModel.class);

	private final Map<Integer, Node> nodes = new TreeMap<>();
	private final Map<Integer, Element> elements = new TreeMap<>();
	private final Map<Integer, Material> materials = new TreeMap<>();

	private final Map<Integer, SortedSet<Integer>> elementsByNode = new HashMap<>();
	private final Map<InterfaceMaterialKey, Integer> interfaceMaterialIds = new HashMap<>();
	private final Map<Junction, Integer> interfaceByJunction = new HashMap<>();

	private final IdAllocator elementIds = new IdAllocator();
	private final IdAllocator materialIds = new IdAllocator();

	private SourceDeck sourceDeck;

	// --- Nodes ---

	public Node addNode(int id, Coordinate coordinate) {
		Objects.requireNonNull(coordinate, "coordinate");
		if (id <= 0) {
			throw new ValidationException("Node id must be positive: " + id);
		}
		if (nodes.containsKey(id)) {
			throw new DuplicateIdException("Node", id);
		}
		Node node = new Node(id, coordinate);
		nodes.put(id, node);
		return node;
	}

	public Node getNode(int id) {
		return nodes.get(id);
	}

	public boolean hasNode(int id) {
		return nodes.containsKey(id);
	}

	/**
	 * @return unmodifiable view of the nodes, ordered by id
	 */
	public Collection<Node> getNodes() {
		return Collections.unmodifiableCollection(nodes.values());
	}

	// --- Materials ---

	/**
	 * Adds a material. Interface materials are entered into the (friction,
	 * orientation) index so later synthesis reuses them.
	 */
	public Material addMaterial(Material material) {
		Objects.requireNonNull(material, "material");
		int id = material.getId();
		if (id <= 0) {
			throw new ValidationException("Material id must be positive: " + id);
		}
		if (materials.containsKey(id)) {
			throw new DuplicateIdException("Material", id);
		}
		materials.put(id, material);
		materialIds.observe(id);
		if (material.isInterface()) {
			InterfaceMaterialKey key = material.getInterfaceKey();
			Integer existing = interfaceMaterialIds.putIfAbsent(key, id);
			if (existing != null) {
				LOGGER.debug("Interface material {} duplicates {} ({}); keeping {} for reuse", id, existing, key, existing);
			}
		}
		return material;
	}

	public Material getMaterial(int id) {
		return materials.get(id);
	}

	public boolean hasMaterial(int id) {
		return materials.containsKey(id);
	}

	/**
	 * @return unmodifiable view of the materials, ordered by id
	 */
	public Collection<Material> getMaterials() {
		return Collections.unmodifiableCollection(materials.values());
	}

	/**
	 * @return id of the interface material registered for the key, or null
	 */
	public Integer findInterfaceMaterial(InterfaceMaterialKey key) {
		return interfaceMaterialIds.get(key);
	}

	/**
	 * @return the id the next allocated material will get
	 */
	public int peekNextMaterialId() {
		return materialIds.peek();
	}

	// --- Elements ---

	/**
	 * Adds a beam or soil element under an allocated id.
	 *
	 * @return the new element
	 */
	public Element addElement(ElementType type, List<Integer> nodeIds, int material, int step) {
		Element element = validatedElement(elementIds.peek(), type, nodeIds, material, step, null);
		insert(element);
		return element;
	}

	/**
	 * Adds a beam or soil element under the given id. Interface elements are
	 * derived, see {@link #addInterfaceElement}.
	 *
	 * @throws ValidationException        for bad node counts, repeated nodes,
	 *                                    non-positive values or the interface type
	 * @throws DuplicateIdException       if the id is taken
	 * @throws InvalidReferenceException  for unknown nodes or materials
	 */
	public Element addElement(int id, ElementType type, List<Integer> nodeIds, int material, int step) {
		Element element = validatedElement(id, type, nodeIds, material, step, null);
		insert(element);
		return element;
	}

	/**
	 * Adds an interface element. The material must be an interface material. When
	 * the attributes carry no junction, one is inferred from the node layout if
	 * possible.
	 *
	 * @throws ValidationException       if the junction already has an interface
	 * @throws InvalidReferenceException if the junction does not name a beam and a
	 *                                   soil element
	 */
	public Element addInterfaceElement(int id, List<Integer> nodeIds, int material, int step, InterfaceAttributes attributes) {
		Objects.requireNonNull(attributes, "attributes");
		Element element = validatedElement(id, ElementType.INTERFACE, nodeIds, material, step, attributes);
		Material m = materials.get(material);
		if (!m.isInterface()) {
			throw new ValidationException("Interface element " + id + " needs an interface material, got " + m);
		}
		Junction junction = attributes.getJunction();
		if (junction == null) {
			junction = inferJunction(element.getNodeIds());
			if (junction != null && !interfaceByJunction.containsKey(junction)) {
				element.setInterfaceAttributes(attributes.withJunction(junction));
			} else {
				junction = null;
			}
		} else {
			Element beam = elements.get(junction.getBeamId());
			Element soil = elements.get(junction.getSoilId());
			if (beam == null || !beam.isBeam() || soil == null || !soil.isSoil()) {
				throw new InvalidReferenceException(junction + " does not name a beam and a soil element");
			}
			if (interfaceByJunction.containsKey(junction)) {
				throw new ValidationException(junction + " already has interface element " + interfaceByJunction.get(junction));
			}
		}
		insert(element);
		if (junction != null) {
			interfaceByJunction.put(junction, id);
		}
		return element;
	}

	public Element getElement(int id) {
		return elements.get(id);
	}

	public boolean hasElement(int id) {
		return elements.containsKey(id);
	}

	/**
	 * @throws UnknownElementException if absent
	 */
	public Element requireElement(int id) {
		Element element = elements.get(id);
		if (element == null) {
			throw new UnknownElementException(id);
		}
		return element;
	}

	/**
	 * @return unmodifiable view of the elements, ordered by id
	 */
	public Collection<Element> getElements() {
		return Collections.unmodifiableCollection(elements.values());
	}

	/**
	 * @return the id the next allocated element will get
	 */
	public int peekNextElementId() {
		return elementIds.peek();
	}

	/**
	 * @return id of the interface element bridging the junction, or null
	 */
	public Integer interfaceForJunction(Junction junction) {
		return interfaceByJunction.get(junction);
	}

	// --- Editing ---

	/**
	 * Sets material and/or step on each named element. A null argument leaves that
	 * field untouched. Interfaces bridging a soil element whose step changes follow
	 * it to the new step.
	 *
	 * @return the number of named elements updated
	 * @throws UnknownElementException   for any id not in the model
	 * @throws InvalidReferenceException for an unknown material
	 * @throws ValidationException       for non-positive values, or a material or
	 *                                   step change on an interface element
	 */
	public int assign(Collection<Integer> ids, Integer material, Integer step) {
		Objects.requireNonNull(ids, "ids");
		if (material != null) {
			if (material <= 0) {
				throw new ValidationException("Material must be positive: " + material);
			}
			if (!materials.containsKey(material)) {
				throw new InvalidReferenceException("Unknown material " + material);
			}
		}
		if (step != null && step <= 0) {
			throw new ValidationException("Step must be positive: " + step);
		}
		List<Element> targets = new ArrayList<>(ids.size());
		for (Integer id : new LinkedHashSet<>(ids)) {
			Element element = requireElement(id);
			if (material != null && element.isInterface() && element.getMaterial() != material) {
				throw new ValidationException("Interface element " + id + " takes its material from its friction and orientation");
			}
			if (step != null && element.isInterface() && element.getStep() != step) {
				throw new ValidationException("Interface element " + id + " takes its step from the soil element it bridges");
			}
			targets.add(element);
		}
		if (material == null && step == null) {
			return 0;
		}
		for (Element element : targets) {
			if (material != null) {
				element.setMaterial(material);
			}
			if (step != null) {
				element.setStep(step);
				if (element.isSoil()) {
					followSoilStep(element.getId(), step);
				}
			}
		}
		LOGGER.debug("Assigned material={} step={} to {} elements", material, step, targets.size());
		return targets.size();
	}

	private void followSoilStep(int soilId, int step) {
		for (Map.Entry<Junction, Integer> entry : interfaceByJunction.entrySet()) {
			if (entry.getKey().getSoilId() == soilId) {
				elements.get(entry.getValue()).setStep(step);
				LOGGER.debug("Interface {} follows soil element {} to step {}", entry.getValue(), soilId, step);
			}
		}
	}

	// --- Queries ---

	/**
	 * Ids of the elements matching every supplied filter; a null filter matches
	 * everything.
	 *
	 * @return ascending, unmodifiable set of ids
	 */
	public SortedSet<Integer> elementsBy(Integer material, Integer step, Set<ElementType> types) {
		SortedSet<Integer> result = new TreeSet<>();
		for (Element e : elements.values()) {
			if (material != null && e.getMaterial() != material) {
				continue;
			}
			if (step != null && e.getStep() != step) {
				continue;
			}
			if (types != null && !types.contains(e.getType())) {
				continue;
			}
			result.add(e.getId());
		}
		return Collections.unmodifiableSortedSet(result);
	}

	/**
	 * Node ids referenced by both elements, in the order they appear in element
	 * {@code a}.
	 */
	public List<Integer> sharedNodes(int a, int b) {
		Element first = requireElement(a);
		Element second = requireElement(b);
		List<Integer> shared = new ArrayList<>();
		for (int nodeId : first.getNodeIds()) {
			if (second.usesNode(nodeId) && !shared.contains(nodeId)) {
				shared.add(nodeId);
			}
		}
		return shared;
	}

	/**
	 * @return ascending ids of the elements referencing the node
	 */
	public SortedSet<Integer> elementsUsingNode(int nodeId) {
		SortedSet<Integer> ids = elementsByNode.get(nodeId);
		return ids == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(ids);
	}

	/**
	 * @return coordinates of the element's nodes, in element order
	 */
	public List<Coordinate> coordinatesOf(Element element) {
		List<Coordinate> coords = new ArrayList<>(element.getNodeCount());
		for (int nodeId : element.getNodeIds()) {
			coords.add(nodes.get(nodeId).getCoordinate());
		}
		return coords;
	}

	/**
	 * @return bounding box of all nodes; a null envelope if there are none
	 */
	public Envelope getExtents() {
		Envelope env = new Envelope();
		for (Node n : nodes.values()) {
			env.expandToInclude(n.getX(), n.getY());
		}
		return env;
	}

	/**
	 * @return the largest step number used by any element, 0 for an empty model
	 */
	public int getMaxStep() {
		int max = 0;
		for (Element e : elements.values()) {
			max = Math.max(max, e.getStep());
		}
		return max;
	}

	public SourceDeck getSourceDeck() {
		return sourceDeck;
	}

	/**
	 * Attaches the layout of the file the model was read from; the writer uses it
	 * to re-emit uninterpreted records.
	 */
	public void setSourceDeck(SourceDeck sourceDeck) {
		this.sourceDeck = sourceDeck;
	}

	/**
	 * Compares node, element and material content, ignoring the source deck and
	 * interface junctions.
	 */
	public boolean hasSameContent(CandeModel other) {
		return nodes.equals(other.nodes) && elements.equals(other.elements) && materials.equals(other.materials);
	}

	// --- Internals ---

	private Element validatedElement(int id, ElementType type, List<Integer> nodeIds, int material, int step, InterfaceAttributes attributes) {
		Objects.requireNonNull(type, "type");
		Objects.requireNonNull(nodeIds, "nodeIds");
		if (type == ElementType.INTERFACE && attributes == null) {
			throw new ValidationException("Interface elements are synthesized, not added directly");
		}
		if (id <= 0) {
			throw new ValidationException("Element id must be positive: " + id);
		}
		if (!type.acceptsNodeCount(nodeIds.size())) {
			throw new ValidationException(type + " element " + id + " cannot have " + nodeIds.size() + " nodes");
		}
		if (type != ElementType.INTERFACE && new HashSet<>(nodeIds).size() != nodeIds.size()) {
			throw new ValidationException("Element " + id + " repeats a node: " + nodeIds);
		}
		if (material <= 0 || step <= 0) {
			throw new ValidationException("Material and step must be positive (element " + id + ": " + material + ", " + step + ")");
		}
		if (elements.containsKey(id)) {
			throw new DuplicateIdException("Element", id);
		}
		for (Integer nodeId : nodeIds) {
			if (nodeId == null || !nodes.containsKey(nodeId)) {
				throw new InvalidReferenceException("Element " + id + " references unknown node " + nodeId);
			}
		}
		if (!materials.containsKey(material)) {
			throw new InvalidReferenceException("Element " + id + " references unknown material " + material);
		}
		return new Element(id, type, nodeIds, material, step, attributes);
	}

	private void insert(Element element) {
		elements.put(element.getId(), element);
		elementIds.observe(element.getId());
		for (int nodeId : element.getNodeIds()) {
			elementsByNode.computeIfAbsent(nodeId, k -> new TreeSet<>()).add(element.getId());
		}
	}

	/**
	 * Recovers the beam/soil pair of an interface written as
	 * {@code [a, b, pb, pa]}: the beam uses exactly the first two nodes and the soil
	 * element holds the remaining ones while sharing a node with the beam.
	 */
	private Junction inferJunction(List<Integer> nodeIds) {
		if (nodeIds.size() != 4) {
			return null;
		}
		int a = nodeIds.get(0);
		int b = nodeIds.get(1);
		Integer beam = null;
		for (int candidate : elementsUsingNode(a)) {
			Element e = elements.get(candidate);
			if (e.isBeam() && e.usesNode(b)) {
				beam = candidate;
				break;
			}
		}
		if (beam == null) {
			return null;
		}
		Set<Integer> soilSide = new HashSet<>(nodeIds.subList(2, 4));
		for (int end : List.of(a, b)) {
			for (int candidate : elementsUsingNode(end)) {
				Element e = elements.get(candidate);
				if (e.isSoil() && e.getNodeIds().containsAll(soilSide)) {
					return new Junction(beam, candidate);
				}
			}
		}
		return null;
	}
}
