package org.metricshub.jox;

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.jox.analysis.Simplifier;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.backend.SourceEmitter;
import org.metricshub.jox.frontend.SourceReader;

/**
 * Each source file in the src/test/resources/canonical directory is written
 * exactly the way the emitter writes it: reading it and emitting the tree
 * must give back the same text.
 */
@RunWith(Parameterized.class)
public class CanonicalSourceTest {

	private static final String CANONICAL_PATH = "/canonical";
	private static Path canonicalDirectory;

	@BeforeClass
	public static void beforeAll() throws Exception {
		canonicalDirectory = directory();
	}

	private static Path directory() throws Exception {
		URL url = CanonicalSourceTest.class.getResource(CANONICAL_PATH);
		if (url == null) {
			throw new IOException("Couldn't find resource " + CANONICAL_PATH);
		}
		Path path = Paths.get(url.toURI());
		if (!path.toFile().isDirectory()) {
			throw new IOException(CANONICAL_PATH + " is not a directory");
		}
		return path;
	}

	/**
	 * @return the names of the source files in /src/test/resources/canonical
	 * @throws Exception
	 */
	@Parameters(name = "canonical {0}")
	public static Iterable<String> sourceList() throws Exception {
		return Arrays
				.stream(directory().toFile().listFiles())
				.map(File::getName)
				.filter(name -> name.endsWith(".py"))
				.sorted()
				.collect(Collectors.toList());
	}

	/** Name of the source file to check */
	@Parameter
	public String sourceName;

	@Test
	public void test() throws Exception {
		String text = new String(Files.readAllBytes(canonicalDirectory.resolve(sourceName)), StandardCharsets.UTF_8);
		Node module = SourceReader.parseModule(text);
		assertEquals(text, SourceEmitter.emit(module));
		assertEquals(module, SourceReader.parseModule(SourceEmitter.emit(module)));
	}

	@Test
	public void testSimplifiedTreeStillReadsBack() throws Exception {
		String text = new String(Files.readAllBytes(canonicalDirectory.resolve(sourceName)), StandardCharsets.UTF_8);
		Node simplified = Simplifier.simplify(SourceReader.parseModule(text));
		assertEquals(simplified, SourceReader.parseModule(SourceEmitter.emit(simplified)));
	}
}
