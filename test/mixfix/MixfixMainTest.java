package mixfix;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MixfixMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private String table() throws URISyntaxException {
		return table("arithmetic.json");
	}

	private String table(String name) throws URISyntaxException {
		return Paths.get(getClass().getResource("/tables/" + name).toURI()).toString();
	}

	private String expressions(String text) throws IOException {
		File file = folder.newFile();
		FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);
		return file.getPath();
	}

	@Test
	public void parsesEveryLine() throws IOException, URISyntaxException {
		String file = expressions("a + b * c\n\nf x < y and b\n");
		assertTrue(new MixfixMain(new String[] {"-q", "-t", table(), file}).run());
	}

	@Test
	public void reportsBadExpressions() throws IOException, URISyntaxException {
		String file = expressions("a + b\na +\n");
		assertFalse(new MixfixMain(new String[] {"-q", "-d", "-t", table(), file}).run());
	}

	@Test
	public void unreadableCharactersDoNotStopTheRun() throws IOException, URISyntaxException {
		String bad = expressions("a + b\na { b\n");
		String good = expressions("c * d\n");
		assertFalse(new MixfixMain(new String[] {"-q", "-t", table(), bad, good}).run());
	}

	@Test
	public void reportsUndeclaredCombinators() throws IOException, URISyntaxException {
		String file = expressions("a < b\n");
		assertFalse(new MixfixMain(new String[] {"-q", "-t", table("unknown-combinator.json"), file}).run());
	}

	@Test
	public void reportsMissingTables() throws IOException {
		String file = expressions("a\n");
		assertFalse(new MixfixMain(new String[] {"-q", "-t", folder.getRoot().toPath().resolve("none.json").toString(),
				file}).run());
	}

	@Test
	public void reportsBadOptions() {
		assertFalse(new MixfixMain(new String[] {"-q"}).run());
	}
}
