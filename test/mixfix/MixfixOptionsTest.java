package mixfix;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class MixfixOptionsTest {

	@Test
	public void tableAndExpressionFiles() throws MixfixOptionException {
		MixfixOptions opts = new MixfixOptions(new String[] {"-t", "ops.json", "-d", "a.txt", "b.txt"});
		assertTrue(opts.parse());
		assertThat(opts.tableFilePath, is("ops.json"));
		assertThat(opts.expressionFilePaths, is(Arrays.asList("a.txt", "b.txt")));
		assertThat(opts.scope, is("main"));
		assertTrue(opts.display);
	}

	@Test
	public void scopeCanBeChosen() throws MixfixOptionException {
		MixfixOptions opts = new MixfixOptions(new String[] {"-t", "ops.json", "-s", "proofs", "a.txt"});
		assertTrue(opts.parse());
		assertThat(opts.scope, is("proofs"));
		assertFalse(opts.display);
	}

	@Test(expected = MixfixOptionException.class)
	public void tableIsRequired() throws MixfixOptionException {
		new MixfixOptions(new String[] {"a.txt"}).parse();
	}

	@Test(expected = MixfixOptionException.class)
	public void expressionsAreRequired() throws MixfixOptionException {
		new MixfixOptions(new String[] {"-t", "ops.json"}).parse();
	}

	@Test
	public void helpStopsTheDriver() throws MixfixOptionException {
		assertFalse(new MixfixOptions(new String[] {"-h"}).parse());
	}
}
