package com.github.micycle1.cande.interfacing;

import static com.github.micycle1.cande.MeshFixtures.B1;
import static com.github.micycle1.cande.MeshFixtures.PIPE_MATERIAL;
import static com.github.micycle1.cande.MeshFixtures.S1;
import static com.github.micycle1.cande.MeshFixtures.S2;
import static com.github.micycle1.cande.MeshFixtures.SOIL_MATERIAL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.cande.MeshFixtures;
import com.github.micycle1.cande.UnknownElementException;
import com.github.micycle1.cande.ValidationException;
import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.ElementType;
import com.github.micycle1.cande.model.Junction;
import com.github.micycle1.cande.model.Material;

class InterfaceSynthesizerTest {

	private static final double E = 1e-9;

	private CandeModel model;
	private InterfaceSynthesizer synthesizer;

	@BeforeEach
	void setUp() {
		model = MeshFixtures.beamBetweenTwoSoils();
		synthesizer = new InterfaceSynthesizer(model);
	}

	@Nested
	@DisplayName("Beam between two soil elements")
	class BeamBetweenSoils {

		@Test
		@DisplayName("One interface per adjacent soil element, facing away from it")
		void twoInterfacesWithOppositeNormals() {
			List<Integer> created = synthesizer.createInterfaces(List.of(B1), 0.3);
			assertEquals(List.of(4, 5), created);

			Element upper = model.getElement(4);
			Element lower = model.getElement(5);
			assertTrue(upper.isInterface());
			assertEquals(new Junction(B1, S1), upper.getInterfaceAttributes().getJunction());
			assertEquals(new Junction(B1, S2), lower.getInterfaceAttributes().getJunction());
			assertEquals(270.0, upper.getInterfaceAttributes().getOrientation(), E, "S1 lies above, so its normal points down");
			assertEquals(90.0, lower.getInterfaceAttributes().getOrientation(), E, "S2 lies below, so its normal points up");
			assertEquals(0.3, upper.getInterfaceAttributes().getFriction(), E);
		}

		@Test
		@DisplayName("Interface step is the step of its soil element")
		void stepInherited() {
			synthesizer.createInterfaces(List.of(B1), 0.3);
			assertEquals(3, model.getElement(4).getStep());
			assertEquals(5, model.getElement(5).getStep());
		}

		@Test
		@DisplayName("Different orientations get distinct new materials after the highest id")
		void distinctMaterials() {
			synthesizer.createInterfaces(List.of(B1), 0.3);
			int upperMaterial = model.getElement(4).getMaterial();
			int lowerMaterial = model.getElement(5).getMaterial();
			assertEquals(3, upperMaterial);
			assertEquals(4, lowerMaterial);

			Material m = model.getMaterial(upperMaterial);
			assertTrue(m.isInterface());
			assertEquals("Inter #3", m.getName());
			assertEquals(270.0, m.getOrientation(), E);
			assertEquals(0.3, m.getFriction(), E);
		}

		@Test
		@DisplayName("Interface nodes run along the beam, then back along the soil")
		void diamondNodeOrder() {
			synthesizer.createInterfaces(List.of(B1), 0.3);
			assertEquals(List.of(10, 11, 12, 13), model.getElement(4).getNodeIds());
			assertEquals(List.of(10, 11, 15, 14), model.getElement(5).getNodeIds());
		}

		@Test
		@DisplayName("A second run over the same beam creates nothing")
		void idempotent() {
			synthesizer.createInterfaces(List.of(B1), 0.3);
			int elements = model.getElements().size();
			int materials = model.getMaterials().size();

			assertTrue(synthesizer.createInterfaces(List.of(B1), 0.3).isEmpty());
			assertTrue(synthesizer.createInterfaces(List.of(B1), 0.7).isEmpty(), "Junctions are taken regardless of friction");
			assertEquals(elements, model.getElements().size());
			assertEquals(materials, model.getMaterials().size());
		}

		@Test
		@DisplayName("Duplicate ids in the selection count once")
		void duplicateSelection() {
			assertEquals(2, synthesizer.createInterfaces(List.of(B1, B1), 0.3).size());
		}

		@Test
		@DisplayName("Soil elements in the selection are ignored")
		void mixedSelection() {
			assertEquals(List.of(4, 5), synthesizer.createInterfaces(List.of(S1, B1, S2), 0.3));
		}
	}

	@Nested
	@DisplayName("Material reuse")
	class MaterialReuse {

		@Test
		@DisplayName("Interfaces with equal friction and orientation share one material")
		void sharedWithinRun() {
			CandeModel row = MeshFixtures.twoBeamsUnderSoil();
			List<Integer> created = new InterfaceSynthesizer(row).createInterfaces(List.of(B1, 4), 0.25);
			assertEquals(4, created.size());
			Set<Integer> materials = new HashSet<>();
			for (int id : created) {
				materials.add(row.getElement(id).getMaterial());
			}
			assertEquals(Set.of(3), materials);
		}

		@Test
		@DisplayName("A later run reuses a material created earlier")
		void sharedAcrossRuns() {
			CandeModel row = MeshFixtures.twoBeamsUnderSoil();
			InterfaceSynthesizer s = new InterfaceSynthesizer(row);
			List<Integer> first = s.createInterfaces(List.of(B1), 0.25);
			List<Integer> second = s.createInterfaces(List.of(4), 0.25);
			assertFalse(second.isEmpty());
			assertEquals(row.getElement(first.get(0)).getMaterial(), row.getElement(second.get(0)).getMaterial());
			assertEquals(1, row.elementsBy(null, null, Set.of(ElementType.INTERFACE)).stream().map(id -> row.getElement(id).getMaterial())
					.distinct().count());
		}

		@Test
		@DisplayName("A different friction gets its own material")
		void frictionDistinguishes() {
			CandeModel row = MeshFixtures.twoBeamsUnderSoil();
			InterfaceSynthesizer s = new InterfaceSynthesizer(row);
			int a = s.createInterfaces(List.of(B1), 0.25).get(0);
			int b = s.createInterfaces(List.of(4), 0.5).get(0);
			assertNotEquals(row.getElement(a).getMaterial(), row.getElement(b).getMaterial());
		}

		@Test
		@DisplayName("An existing interface material with the same key is reused")
		void existingMaterialReused() {
			model.addMaterial(Material.interfaceMaterial(9, 0.3, 270));
			synthesizer.createInterfaces(List.of(B1), 0.3);
			assertEquals(9, model.getElement(4).getMaterial());
			assertEquals(10, model.getElement(5).getMaterial(), "New materials are numbered after the highest id");
		}
	}

	@Nested
	@DisplayName("Boundaries")
	class Boundaries {

		@Test
		void frictionBounds() {
			assertEquals(2, synthesizer.plan(List.of(B1), 0.0).size());
			assertEquals(2, synthesizer.plan(List.of(B1), 1.0).size());
			assertThrows(ValidationException.class, () -> synthesizer.createInterfaces(List.of(B1), 1.5));
			assertThrows(ValidationException.class, () -> synthesizer.createInterfaces(List.of(B1), -0.1));
			assertThrows(ValidationException.class, () -> synthesizer.createInterfaces(List.of(B1), Double.NaN));
			assertEquals(3, model.getElements().size(), "Model must be unchanged");
		}

		@Test
		@DisplayName("Friction finer than the record's three decimals is rejected")
		void frictionPrecision() {
			assertThrows(ValidationException.class, () -> synthesizer.createInterfaces(List.of(B1), 0.3001));
			assertEquals(3, model.getElements().size());
			assertEquals(2, synthesizer.plan(List.of(B1), 0.301).size());
		}

		@Test
		void emptySelection() {
			assertTrue(synthesizer.createInterfaces(List.of(), 0.3).isEmpty());
		}

		@Test
		@DisplayName("A selection holding no beam is rejected")
		void noBeams() {
			assertThrows(ValidationException.class, () -> synthesizer.createInterfaces(List.of(S1, S2), 0.3));
		}

		@Test
		void unknownElement() {
			assertThrows(UnknownElementException.class, () -> synthesizer.createInterfaces(List.of(B1, 99), 0.3));
			assertEquals(3, model.getElements().size());
		}

		@Test
		@DisplayName("A beam without adjacent soil yields no interfaces")
		void isolatedBeam() {
			model.addNode(20, new Coordinate(5, 5));
			model.addNode(21, new Coordinate(6, 5));
			Element beam = model.addElement(ElementType.BEAM, List.of(20, 21), PIPE_MATERIAL, 1);
			assertTrue(synthesizer.createInterfaces(List.of(beam.getId()), 0.3).isEmpty());
		}

		@Test
		@DisplayName("A zero-length beam is skipped")
		void zeroLengthBeam() {
			model.addNode(20, new Coordinate(0, 0));
			Element beam = model.addElement(ElementType.BEAM, List.of(10, 20), PIPE_MATERIAL, 1);
			assertTrue(synthesizer.createInterfaces(List.of(beam.getId()), 0.3).isEmpty());
		}

		@Test
		@DisplayName("Planning leaves the model unchanged")
		void planIsDryRun() {
			List<PlannedInterface> plan = synthesizer.plan(List.of(B1), 0.3);
			assertEquals(2, plan.size());
			assertTrue(plan.get(0).isNewMaterial());
			assertEquals(3, model.getElements().size());
			assertEquals(2, model.getMaterials().size());
			assertEquals(List.of(4, 5), synthesizer.createInterfaces(List.of(B1), 0.3));
		}

		@Test
		@DisplayName("Interfaces follow later step changes of their soil element")
		void laterStepChange() {
			synthesizer.createInterfaces(List.of(B1), 0.3);
			model.assign(List.of(S1), SOIL_MATERIAL, 8);
			assertEquals(8, model.getElement(4).getStep());
			assertEquals(5, model.getElement(5).getStep(), "The interface on S2 keeps its step");
		}

		@Test
		@DisplayName("The step of an interface cannot be set directly")
		void interfaceStepRefused() {
			synthesizer.createInterfaces(List.of(B1), 0.3);
			assertThrows(ValidationException.class, () -> model.assign(List.of(4), null, 9));
			assertThrows(ValidationException.class, () -> model.assign(List.of(S1, 4), null, 9));
			assertEquals(3, model.getElement(4).getStep());
			assertEquals(3, model.getElement(S1).getStep(), "A refused batch changes nothing");
		}
	}
}
