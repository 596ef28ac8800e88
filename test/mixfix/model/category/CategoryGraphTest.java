package mixfix.model.category;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

public class CategoryGraphTest {

	private static Set<String> set(String... ids) {
		return new HashSet<>(Arrays.asList(ids));
	}

	private static CategoryGraph ladder() {
		CategoryGraph graph = new CategoryGraph();
		graph.declareCategory("low", set(), set());
		graph.declareCategory("mid", set("low"), set());
		graph.declareCategory("high", set("mid"), set());
		graph.declareCategory("side", set("low"), set());
		return graph;
	}

	@Test
	public void tighterThanIsTransitive() {
		CategoryGraph graph = ladder();
		assertTrue(graph.tighterThan("high", "mid"));
		assertTrue(graph.tighterThan("mid", "low"));
		assertTrue(graph.tighterThan("high", "low"));
		assertFalse(graph.tighterThan("low", "high"));
	}

	@Test
	public void unrelatedCategoriesAreIncomparable() {
		CategoryGraph graph = ladder();
		assertFalse(graph.tighterThan("side", "high"));
		assertFalse(graph.tighterThan("high", "side"));
		assertFalse(graph.comparable("side", "mid"));
		assertTrue(graph.comparable("side", "low"));
		assertTrue(graph.comparable("side", "side"));
	}

	@Test
	public void weakerThanAddsReversedEdges() {
		CategoryGraph graph = ladder();
		graph.declareCategory("between", set("low"), set("high"));
		assertTrue(graph.tighterThan("high", "between"));
		assertTrue(graph.tighterThan("between", "low"));
		assertThat(graph.get("high").getTighterThan(), hasItem("between"));
	}

	@Test
	public void closureIsRecomputedAfterMutation() {
		CategoryGraph graph = ladder();
		assertFalse(graph.tighterThan("high", "side"));
		graph.declareCategory("side", set(), set("mid"));
		assertTrue(graph.tighterThan("high", "side"));
	}

	@Test
	public void rejectsCycles() {
		CategoryGraph graph = ladder();
		CategoryGraph before = graph.copy();
		try {
			graph.declareCategory("low", set("high"), set());
			fail("expected a cycle to be rejected");
		} catch (CategoryCycleIssue e) {
			assertThat(e.getDeclaring(), is("low"));
			assertThat(e.getCycle(), is(Arrays.asList("low", "high", "mid", "low")));
		}
		assertThat(graph, is(before));
		assertFalse(graph.tighterThan("low", "high"));
	}

	@Test
	public void rejectsSelfEdges() {
		CategoryGraph graph = ladder();
		try {
			graph.declareCategory("mid", set("mid"), set());
			fail("expected a cycle to be rejected");
		} catch (CategoryCycleIssue e) {
			assertThat(e.getCycle(), is(Arrays.asList("mid", "mid")));
		}
	}

	@Test
	public void rejectsUnknownCategories() {
		CategoryGraph graph = ladder();
		CategoryGraph before = graph.copy();
		try {
			graph.declareCategory("new", set("low", "missing"), set());
			fail("expected an unknown category");
		} catch (UnknownCategoryIssue e) {
			assertThat(e.getCategory(), is("missing"));
			assertThat(e.getReferencedBy(), is("new"));
		}
		assertThat(graph, is(before));
		assertFalse(graph.contains("new"));
	}

	@Test
	public void chainPolicy() {
		CategoryGraph graph = ladder();
		assertFalse(graph.get("mid").isChainEnabled());
		graph.setChainPolicy("mid", "and");
		assertTrue(graph.get("mid").isChainEnabled());
		assertThat(graph.get("mid").getChainCombinator(), is("and"));
	}

	@Test(expected = UnknownCategoryIssue.class)
	public void chainPolicyNeedsACategory() {
		ladder().setChainPolicy("missing", "and");
	}

	@Test(expected = IllegalStateException.class)
	public void frozenGraphsAreImmutable() {
		ladder().freeze().declareCategory("x", set(), set());
	}

	@Test
	public void keepsDeclarationOrder() {
		List<String> ids = new ArrayList<>();
		for(OperatorCategory category : ladder().getCategories()) {
			ids.add(category.getId());
		}
		assertThat(ids, is(Arrays.asList("low", "mid", "high", "side")));
	}

	@Test
	public void randomDeclarationsKeepAPartialOrder() {
		Random random = new Random(20241019);
		for(int round = 0; round < 20; ++round) {
			CategoryGraph graph = new CategoryGraph();
			int size = 8;
			for(int i = 0; i < size; ++i) {
				graph.declareCategory("c" + i, Collections.emptySet(), Collections.emptySet());
			}
			for(int step = 0; step < 40; ++step) {
				String a = "c" + random.nextInt(size);
				String b = "c" + random.nextInt(size);
				CategoryGraph before = graph.copy();
				boolean wasReachable = graph.tighterThan(b, a) || a.equals(b);
				try {
					graph.declareCategory(a, set(b), set());
					assertFalse("accepted an edge closing a cycle", wasReachable);
				} catch (CategoryCycleIssue e) {
					assertTrue("rejected an acyclic edge", wasReachable);
					assertThat(graph, is(before));
					assertThat(e.getCycle().get(0), is(e.getCycle().get(e.getCycle().size() - 1)));
				}
			}
			for(int i = 0; i < size; ++i) {
				String a = "c" + i;
				assertFalse(graph.tighterThan(a, a));
				for(int j = 0; j < size; ++j) {
					String b = "c" + j;
					assertFalse(graph.tighterThan(a, b) && graph.tighterThan(b, a));
					for(int k = 0; k < size; ++k) {
						String c = "c" + k;
						if(graph.tighterThan(a, b) && graph.tighterThan(b, c)) {
							assertTrue(graph.tighterThan(a, c));
						}
					}
				}
			}
		}
	}
}
