package org.metricshub.romanloop;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.junit.Test;
import org.metricshub.romanloop.frontend.AstNode;
import org.metricshub.romanloop.frontend.ParserException;
import org.metricshub.romanloop.util.ScriptFileSource;
import org.metricshub.romanloop.util.ScriptSource;

public class CliTest {

	private static String resourcePath(String resource) throws Exception {
		URL url = CliTest.class.getResource(resource);
		assertNotNull("Resource not found: " + resource, url);
		return Paths.get(url.toURI()).toString();
	}

	private static final class Captured {
		private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

		String text() {
			return bytes.toString(StandardCharsets.UTF_8);
		}
	}

	@Test
	public void testProgramOnCommandLine() throws Exception {
		Captured captured = new Captured();
		Cli cli = Cli.create(new String[] { "while (x < V) y := I done" }, captured.out);
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, cli.getScriptSource().getDescription());
		String[] lines = captured.text().split("\\R");
		assertEquals(10, lines.length);
		assertEquals("Program", lines[0]);
		assertEquals("        Identifier (x)", lines[4]);
	}

	@Test
	public void testProgramFromFile() throws Exception {
		Captured captured = new Captured();
		String path = resourcePath("/programs/two-loops.rl");
		Cli cli = new Cli(captured.out);
		cli.parse(new String[] { "-f", path });
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		AstNode ast = cli.run();
		assertEquals(2, ast.getChild(0).getChildren().size());
		assertTrue(captured.text().contains("RomanNumeral (III)"));
	}

	@Test
	public void testRejectedProgramFromFile() throws Exception {
		Captured captured = new Captured();
		String path = resourcePath("/programs/missing-done.rl");
		ParserException e = assertThrows(
				ParserException.class,
				() -> Cli.create(new String[] { "-f", path }, captured.out));
		assertEquals(path, e.getSourceDescription());
		assertEquals("", captured.text());
	}

	@Test
	public void testDumpFlags() throws Exception {
		Captured captured = new Captured();
		Cli.create(new String[] { "--dump-tokens", "--no-dump-syntax", "while (x < V) y := I done" }, captured.out);
		String[] lines = captured.text().split("\\R");
		assertEquals(11, lines.length);
		assertEquals("WHILE(while)@0", lines[0]);
		assertEquals("IDENTIFIER(x)@7", lines[2]);
		assertEquals("END_OF_INPUT@25", lines[10]);
	}

	@Test
	public void testDumpFlagsFailOnParse() {
		Captured captured = new Captured();
		assertThrows(ParserException.class, () -> Cli.create(new String[] { "--dump-tokens", "x" }, captured.out));
		assertTrue(captured.text().startsWith("IDENTIFIER(x)@0"));
	}

	@Test
	public void testUsage() throws Exception {
		Captured captured = new Captured();
		assertNull(Cli.create(new String[] { "-h" }, captured.out).run());
		assertTrue(captured.text().startsWith("Usage:"));

		Captured none = new Captured();
		Cli.create(new String[0], none.out);
		assertTrue(none.text().startsWith("Usage:"));
	}

	@Test
	public void testBadArguments() {
		Cli cli = new Cli(new Captured().out);
		assertThrows(IllegalArgumentException.class, () -> cli.parse(new String[] { "--bogus" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-f" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--dump-tokens" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "x" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "a", "b" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "" }));
	}
}
