package org.metricshub.jox;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jox.ast.Atom;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.util.JoxLogger;
import org.metricshub.jox.util.JoxSettings;
import org.metricshub.jox.util.SourceFileInput;
import org.metricshub.jox.util.SourceInput;

public class JoxTest {

	private static Node calc() {
		return Jox.build("def", "calc", Arrays.asList("x"), Jox.build("return", Jox.build("+", 42, Jox.build("name", "x"))));
	}

	@Test
	public void testCalc() {
		Node calc = calc();
		String source = Jox.emit(calc);
		assertEquals("def calc(x):\n    return 42 + x\n", source);
		assertTrue(Jox.freeVars(calc).isEmpty());
		assertEquals(calc, Jox.parse(source));
		assertSame(calc, Jox.simplify(calc));
	}

	@Test
	public void testCalcFromFoldedSum() {
		Node sum = Jox.build("+", Jox.build("+", new Atom(40), new Atom(2)), Jox.build("name", "x"));
		Node calc = Jox.build("def", "calc", Arrays.asList("x"), Jox.build("return", sum));
		Node folded = Jox.simplify(calc);
		assertEquals(calc(), folded);
		assertEquals("def calc(x):\n    return 42 + x\n", Jox.emit(folded));
	}

	@Test
	public void testStaticOperations() {
		Node sum = Jox.parse("x + 2");
		assertEquals(Collections.singleton("x"), Jox.freeVars(sum));
		Node substituted = Jox.substitute(sum, Collections.singletonMap("x", new Atom(40)));
		assertEquals("40 + 2", Jox.emit(substituted));
		assertEquals(new Atom(42), Jox.simplify(substituted));
	}

	private static String run(JoxSettings settings, SourceInput... sources) throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		Jox jox = new Jox(settings);
		jox.invoke(jox.transform(Arrays.asList(sources)));
		return out.toString(StandardCharsets.UTF_8.name());
	}

	@Test
	public void testTransformModule() throws Exception {
		JoxSettings settings = new JoxSettings();
		settings.putVariable("x", 20);
		assertEquals("y = 41\n", run(settings, SourceInput.ofText("y = x * 2 + 1")));
	}

	@Test
	public void testTransformExpression() throws Exception {
		JoxSettings settings = new JoxSettings();
		settings.setExpressionMode(true);
		settings.putVariable("name", "jox");
		Jox jox = new Jox(settings);
		assertNull(jox.getLastTree());
		Node tree = jox.transform(Arrays.asList(SourceInput.ofText("  name + '!'\n")));
		assertEquals(new Atom("jox!"), tree);
		assertSame(tree, jox.getLastTree());
		assertSame(settings, jox.getSettings());
	}

	@Test
	public void testSourcesAreJoined() throws Exception {
		String output = run(
				new JoxSettings(),
				SourceInput.ofText("def f(a):"),
				new SourceInput("second", new StringReader("    return a * (1 + 1)")),
				SourceInput.ofText("f(1)\n"));
		assertEquals("def f(a):\n    return a * 2\nf(1)\n", output);
	}

	@Test
	public void testOutputModes() throws Exception {
		JoxSettings settings = new JoxSettings();
		settings.setSimplify(false);
		settings.setIndentWidth(1);
		assertEquals("while c:\n x = 1 + 1\n", run(settings, SourceInput.ofText("while c:\n    x = 1 + 1\n")));

		settings = new JoxSettings();
		settings.setPrintFreeVariables(true);
		assertEquals("", run(settings, SourceInput.ofText("x = 1\nx\n")));

		settings = new JoxSettings();
		settings.setDumpSyntaxTree(true);
		String dump = run(settings, SourceInput.ofText("return 42"));
		assertEquals("Return" + System.lineSeparator() + " Atom 42" + System.lineSeparator(), dump);
	}

	@Test
	public void testSettings() {
		JoxSettings settings = new JoxSettings();
		assertEquals(4, settings.getIndentWidth());
		assertTrue(settings.isSimplify());
		assertFalse(settings.isExpressionMode());
		assertThrows(IllegalArgumentException.class, () -> settings.setIndentWidth(0));
		assertEquals(4, settings.getIndentWidth());

		settings.putVariable("b", 1L);
		settings.putVariable("a", "s");
		assertEquals(Arrays.asList("b", "a"), Arrays.asList(settings.getVariables().keySet().toArray()));
		assertThrows(UnsupportedOperationException.class, () -> settings.getVariables().put("c", 2));
		assertTrue(settings.toDescriptionString().startsWith("variables = {b=1, a=s}\nindentWidth = 4\n"));
	}

	@Test
	public void testSourceFileMustBeUtf8() throws Exception {
		Path file = Files.createTempFile("jox-test", ".py");
		try {
			Files.write(file, new byte[] { 'x', ' ', '=', ' ', (byte) 0xff, '\n' });
			SourceFileInput input = new SourceFileInput(file.toString());
			IOException e = assertThrows(IOException.class, input::readText);
			assertEquals("Source file is not valid UTF-8: " + file, e.getMessage());

			Files.write(file, "x = '\u00e9'\n".getBytes(StandardCharsets.UTF_8));
			assertEquals("x = '\u00e9'\n", input.readText());
			assertEquals(file.toString(), input.getFilePath());
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void testDumpText() {
		String ls = System.lineSeparator();
		assertEquals("BinOp +" + ls + " Atom 1" + ls + " Name x" + ls, JoxLogger.dumpText(Jox.parse("1 + x")));
	}

	@Test
	public void testSourceInput() throws Exception {
		SourceInput input = SourceInput.ofText("x = 1");
		assertEquals(SourceInput.DESCRIPTION_COMMAND_LINE_SOURCE, input.toString());
		assertEquals("x = 1", input.readText());
	}
}
