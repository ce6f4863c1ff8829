package org.metricshub.romanloop.util;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Test;
import org.metricshub.romanloop.Romanloop;

public class ScriptSourceTest {

	private static final class TrackingReader extends StringReader {
		private boolean closed;

		TrackingReader(String text) {
			super(text);
		}

		@Override
		public void close() {
			closed = true;
			super.close();
		}
	}

	private static Path resource(String name) throws Exception {
		return Paths.get(ScriptSourceTest.class.getResource(name).toURI());
	}

	@Test
	public void testReadTextClosesReader() throws Exception {
		TrackingReader reader = new TrackingReader("while (x < V) y := I done");
		ScriptSource source = new ScriptSource("inline", reader);
		assertEquals("while (x < V) y := I done", source.readText());
		assertTrue(reader.closed);
	}

	@Test
	public void testReaderSourceCanBeReadOnce() throws Exception {
		ScriptSource source = new ScriptSource("inline", new StringReader("while (x < V) y := I done"));
		source.readText();
		assertThrows(IOException.class, source::readText);
	}

	@Test
	public void testMissingReader() {
		IOException e = assertThrows(IOException.class, () -> new ScriptSource("nothing", null).readText());
		assertEquals("No reader for nothing", e.getMessage());
	}

	@Test
	public void testFileSourceCanBeReadAgain() throws Exception {
		Path path = resource("/programs/two-loops.rl");
		String expected = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		ScriptFileSource source = new ScriptFileSource(path.toString());

		assertEquals(expected, source.readText());
		assertEquals(expected, source.readText());

		Romanloop romanloop = new Romanloop();
		assertEquals(romanloop.parse(source), romanloop.parse(source));
		assertEquals(2, romanloop.getLastAst().getChild(0).getChildren().size());
	}
}
