package com.github.micycle1.cande.io;

import static com.github.micycle1.cande.MeshFixtures.B1;
import static com.github.micycle1.cande.MeshFixtures.S1;
import static com.github.micycle1.cande.io.CandeReaderTest.resource;
import static com.github.micycle1.cande.io.CandeReaderTest.triangleDeck;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.cande.MeshFixtures;
import com.github.micycle1.cande.interfacing.InterfaceSynthesizer;
import com.github.micycle1.cande.model.CandeModel;
import com.github.micycle1.cande.model.ElementType;

class CandeWriterTest {

	private CandeReader reader;
	private CandeWriter writer;

	@TempDir
	Path tempDir;

	private static String read(Path path) throws IOException {
		return new String(Files.readAllBytes(path), CandeReader.CHARSET);
	}

	@BeforeEach
	void setUp() {
		reader = new CandeReader();
		writer = new CandeWriter();
	}

	@Nested
	@DisplayName("Models read from file")
	class FromFile {

		@Test
		@DisplayName("An unchanged model is written back byte for byte")
		void passThrough() throws Exception {
			Path source = resource("pipe-in-soil.cid");
			CandeModel model = reader.load(source);
			assertEquals(read(source), writer.toText(model));
		}

		@Test
		@DisplayName("New interfaces and materials go after their groups, moving the L flags")
		void synthesizedInterfaces() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			new InterfaceSynthesizer(model).createInterfaces(List.of(B1), 0.3);
			assertEquals(read(resource("pipe-in-soil-interfaces.cid")), writer.toText(model));
		}

		@Test
		@DisplayName("Reloading a saved model gives the same content")
		void roundTrip() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			new InterfaceSynthesizer(model).createInterfaces(List.of(B1), 0.3);
			model.assign(List.of(S1), null, 4);

			Path target = tempDir.resolve("out.cid");
			writer.save(model, target);
			CandeModel reloaded = reader.load(target);
			assertTrue(model.hasSameContent(reloaded));
		}

		@Test
		@DisplayName("A step change rewrites only the step columns of that element")
		void stepSplice() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			List<String> before = writer.render(model);
			model.assign(List.of(S1), null, 4);
			List<String> after = writer.render(model);

			assertEquals(before.size(), after.size());
			for (int i = 0; i < before.size(); i++) {
				if (i != 11) {
					assertEquals(before.get(i), after.get(i), "Line " + (i + 1) + " must be unchanged");
				}
			}
			assertEquals("                   C-4.L3!!    1   10   11   12   13    1    4    0", after.get(11));
		}

		@Test
		@DisplayName("The control record tracks counts and the largest step")
		void controlRecord() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			model.assign(List.of(S1), null, 12);
			assertEquals("                   C-2.L3!!   12    0    0    0    0    6    3    0    1    0", writer.render(model).get(4));
		}

		@Test
		@DisplayName("A group without an L flag gains none")
		void noFlagToMove() throws Exception {
			List<String> lines = triangleDeck();
			lines.set(2, lines.get(2).replace("!!L", "!! "));
			CandeModel model = reader.parse(lines);
			model.addNode(13, new Coordinate(0, 1));

			List<String> out = writer.render(model);
			assertEquals(5, out.size());
			assertEquals(lines.get(2), out.get(2));
			assertEquals("                   C-3.L3!!   13  000     0.000     1.000", out.get(3));
		}

		@Test
		@DisplayName("Records appended after an unterminated last line")
		void unterminatedAnchor() throws Exception {
			List<String> lines = triangleDeck();
			lines.add("                   C-4.L3!!L   1   10   11   12    0    1    1    0");
			CandeModel model = reader.parse(String.join("\n", lines));
			model.addNode(13, new Coordinate(0, 1));
			model.addElement(ElementType.SOIL, List.of(10, 12, 13), 1, 1);

			String text = writer.toText(model);
			assertFalse(text.endsWith("\n"));
			assertTrue(text.contains("   1   10   11   12    0    1    1    0\n"));
			assertTrue(text.endsWith("                   C-4.L3!!L   2   10   12   13    0    1    1    0"));
		}
	}

	@Nested
	@DisplayName("Models built in memory")
	class InMemory {

		@Test
		void plainGroups() {
			List<String> lines = writer.render(MeshFixtures.beamBetweenTwoSoils());
			assertEquals(6 + 3 + 1, lines.size(), "Structural materials are not written");
			assertEquals("                   C-3.L3!!   10  000     0.000     0.000", lines.get(0));
			assertEquals("                   C-3.L3!!L  15  000     1.000    -1.000", lines.get(5));
			assertEquals("                   C-4.L3!!L   3   10   11    0    0    2    1    0", lines.get(8));
			assertEquals("                      D-1!!L   1    1         0                Soil", lines.get(9));
		}

		@Test
		void plainGroupsReload() throws Exception {
			CandeModel model = MeshFixtures.beamBetweenTwoSoils();
			new InterfaceSynthesizer(model).createInterfaces(List.of(B1), 0.3);
			CandeModel reloaded = reader.parse(writer.render(model));
			assertTrue(model.hasSameContent(reloaded));
		}
	}

	@Nested
	@DisplayName("Saving")
	class Saving {

		@Test
		@DisplayName("Saving replaces the target and leaves no temporary file")
		void replacesTarget() throws Exception {
			Path target = tempDir.resolve("model.cid");
			Files.writeString(target, "old content");
			writer.save(MeshFixtures.beamBetweenTwoSoils(), target);

			assertTrue(read(target).startsWith("                   C-3.L3!!   10"));
			try (Stream<Path> files = Files.list(tempDir)) {
				assertEquals(List.of(target), files.toList());
			}
		}

		@Test
		@DisplayName("Saving is deterministic")
		void deterministic() throws Exception {
			CandeModel model = reader.load(resource("pipe-in-soil.cid"));
			new InterfaceSynthesizer(model).createInterfaces(List.of(B1), 0.3);
			Path a = tempDir.resolve("a.cid");
			Path b = tempDir.resolve("b.cid");
			writer.save(model, a);
			writer.save(model, b);
			assertEquals(read(a), read(b));
		}
	}
}
