package com.github.micycle1.cande.io;

import static com.github.micycle1.cande.MeshFixtures.B1;
import static com.github.micycle1.cande.MeshFixtures.S1;
import static com.github.micycle1.cande.MeshFixtures.S2;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.github.micycle1.cande.interfacing.InterfaceSynthesizer;
import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.Element;
import com.github.micycle1.cande.model.ElementType;
import com.github.micycle1.cande.model.Junction;
import com.github.micycle1.cande.model.MaterialKind;
import com.github.micycle1.cande.model.SourceDeck.RecordKind;

class CandeReaderTest {

	private static final double E = 1e-9;

	private static final String NODE_TAG = "                   C-3.L3!!";
	private static final String ELEMENT_TAG = "                   C-4.L3!!";
	private static final String MATERIAL_TAG = "                      D-1!!";

	private CandeReader reader;

	static Path resource(String name) {
		try {
			return Paths.get(CandeReaderTest.class.getResource("/cid/" + name).toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Nodes 10 (0,0), 11 (1,0), 12 (1,1) and soil material 1.
	 */
	static List<String> triangleDeck() {
		List<String> lines = new ArrayList<>();
		lines.add(NODE_TAG + "   10  000     0.000     0.000");
		lines.add(NODE_TAG + "   11  000     1.000     0.000");
		lines.add(NODE_TAG + "L  12  000     1.000     1.000");
		lines.add(MATERIAL_TAG + "L   1    1         0                Soil");
		return lines;
	}

	@BeforeEach
	void setUp() {
		reader = new CandeReader();
	}

	@Nested
	@DisplayName("Loading a file")
	class Loading {

		@Test
		void loadsRecords() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			assertEquals(6, model.getNodes().size());
			assertEquals(3, model.getElements().size());
			assertEquals(1.0, model.getNode(15).getX(), E);
			assertEquals(-1.0, model.getNode(15).getY(), E);

			Element beam = model.getElement(B1);
			assertEquals(ElementType.BEAM, beam.getType());
			assertEquals(List.of(10, 11), beam.getNodeIds());
			assertEquals(ElementType.SOIL, model.getElement(S2).getType());
			assertEquals(5, model.getElement(S2).getStep());
		}

		@Test
		@DisplayName("Beam material numbers become structural placeholder materials")
		void structuralMaterials() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			assertEquals(MaterialKind.SOIL, model.getMaterial(1).getKind());
			assertEquals("Soil", model.getMaterial(1).getName());
			assertEquals(1, model.getMaterial(1).getPropertyRecords().size());
			assertEquals(MaterialKind.STRUCTURAL, model.getMaterial(2).getKind());
		}

		@Test
		@DisplayName("Every line of the file is kept in the source deck")
		void sourceDeck() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			var lines = model.getSourceDeck().getLines();
			assertEquals(18, lines.size());
			assertEquals(RecordKind.OPAQUE, lines.get(0).getKind());
			assertEquals(RecordKind.CONTROL, lines.get(4).getKind());
			assertEquals(RecordKind.NODE, lines.get(5).getKind());
			assertEquals(10, lines.get(5).getId());
			assertEquals(RecordKind.ELEMENT, lines.get(13).getKind());
			assertEquals(RecordKind.OPAQUE, lines.get(14).getKind(), "C-5 records are not interpreted");
			assertEquals(RecordKind.MATERIAL, lines.get(15).getKind());
			assertEquals(RecordKind.MATERIAL_PROPERTY, lines.get(16).getKind());
			assertEquals(RecordKind.OPAQUE, lines.get(17).getKind());
			assertEquals("\n", model.getSourceDeck().getLineSeparator());
		}

		@Test
		@DisplayName("Interfaces in a file get their material attributes and junction")
		void loadsInterfaces() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil-interfaces.cid"));
			Element upper = model.getElement(4);
			assertTrue(upper.isInterface());
			assertEquals(0.3, upper.getInterfaceAttributes().getFriction(), E);
			assertEquals(270.0, upper.getInterfaceAttributes().getOrientation(), E);
			assertEquals(new Junction(B1, S1), upper.getInterfaceAttributes().getJunction());
			assertEquals(5, model.interfaceForJunction(new Junction(B1, S2)));
		}

		@Test
		@DisplayName("Synthesis over a reloaded model creates nothing new")
		void reloadedInterfacesAreRecognised() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil-interfaces.cid"));
			assertTrue(new InterfaceSynthesizer(model).createInterfaces(List.of(B1), 0.3).isEmpty());
		}

		@Test
		@DisplayName("Three-node interfaces are accepted without a junction")
		void legacyInterface() throws Exception {
			List<String> lines = triangleDeck();
			lines.add(MATERIAL_TAG + "L   2    6         0             Inter 2");
			lines.add("            D-2.Interface!!    90.000     0.500");
			lines.add(ELEMENT_TAG + "L   1   10   11   12    0    2    1    1");
			CandeModel model = reader.parse(lines);
			Element e = model.getElement(1);
			assertEquals(ElementType.INTERFACE, e.getType());
			assertEquals(0.5, e.getInterfaceAttributes().getFriction(), E);
			assertNull(e.getInterfaceAttributes().getJunction());
		}

		@Test
		@DisplayName("CRLF terminators are detected and kept")
		void crlf() throws Exception {
			String text = String.join("\r\n", triangleDeck()) + "\r\n";
			CandeModel model = reader.parse(text);
			assertEquals("\r\n", model.getSourceDeck().getLineSeparator());
			assertEquals("\r\n", model.getSourceDeck().getLines().get(0).getTerminator());
			assertEquals(3, model.getNodes().size());
		}

		@Test
		void unterminatedLastLine() throws Exception {
			String text = String.join("\n", triangleDeck());
			CandeModel model = reader.parse(text);
			var lines = model.getSourceDeck().getLines();
			assertEquals(4, lines.size());
			assertEquals("", lines.get(3).getTerminator());
		}
	}

	@Nested
	@DisplayName("Malformed input")
	class Malformed {

		private CandeParseException parseFailure(List<String> lines) {
			return assertThrows(CandeParseException.class, () -> reader.parse(lines));
		}

		@Test
		void badCoordinate() {
			List<String> lines = triangleDeck();
			lines.set(1, NODE_TAG + "   11  000     1.0x0     0.000");
			CandeParseException e = parseFailure(lines);
			assertEquals(2, e.getLineNumber());
			assertTrue(e.getMessage().contains("x"), e.getMessage());
		}

		@Test
		void shortNodeRecord() {
			List<String> lines = triangleDeck();
			lines.set(0, NODE_TAG + "   10  000     0.000");
			assertEquals(1, parseFailure(lines).getLineNumber());
		}

		@Test
		void unknownElementClass() {
			List<String> lines = triangleDeck();
			lines.add(ELEMENT_TAG + "L   1   10   11   12    0    1    1    7");
			CandeParseException e = parseFailure(lines);
			assertEquals(5, e.getLineNumber());
			assertTrue(e.getMessage().contains("class"), e.getMessage());
		}

		@Test
		void badNodeCount() {
			List<String> lines = triangleDeck();
			lines.add(ELEMENT_TAG + "L   1   10    0    0    0    1    1    0");
			assertEquals(5, parseFailure(lines).getLineNumber());
		}

		@Test
		@DisplayName("Node slots must be filled from the left")
		void nodeAfterEmptySlot() {
			List<String> lines = triangleDeck();
			lines.add(ELEMENT_TAG + "L   1   10    0   11   12    1    1    0");
			CandeParseException e = parseFailure(lines);
			assertEquals(5, e.getLineNumber());
			assertTrue(e.getMessage().contains("empty node slot"), e.getMessage());
		}

		@Test
		void duplicateNode() {
			List<String> lines = triangleDeck();
			lines.set(2, NODE_TAG + "L  11  000     1.000     1.000");
			assertEquals(3, parseFailure(lines).getLineNumber());
		}

		@Test
		void danglingNode() {
			List<String> lines = triangleDeck();
			lines.add(ELEMENT_TAG + "L   1   10   11   99    0    1    1    0");
			assertEquals(5, parseFailure(lines).getLineNumber());
		}

		@Test
		void danglingSoilMaterial() {
			List<String> lines = triangleDeck();
			lines.add(ELEMENT_TAG + "L   1   10   11   12    0    3    1    0");
			assertEquals(5, parseFailure(lines).getLineNumber());
		}

		@Test
		void interfaceMaterialWithoutProperties() {
			List<String> lines = triangleDeck();
			lines.add(MATERIAL_TAG + "L   2    6         0             Inter 2");
			assertEquals(5, parseFailure(lines).getLineNumber());
		}

		@Test
		void interfaceOnSoilMaterial() {
			List<String> lines = triangleDeck();
			lines.add(ELEMENT_TAG + "L   1   10   11   12    0    1    1    1");
			assertEquals(5, parseFailure(lines).getLineNumber());
		}
	}
}
