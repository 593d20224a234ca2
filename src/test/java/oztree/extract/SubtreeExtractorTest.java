package oztree.extract;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import oztree.CapturingAppender;
import oztree.exceptions.TreeAssemblyException;

public class SubtreeExtractorTest {

	private static final String TEST_TREE = "(A,(BA,(BBA,BBB_ott222,BBC:1.5)BB_ott111,BC)B:2.0,((CAA,CAB)CA,CB)C_ott333)Root;";

	private CapturingAppender appender;

	@Before
	public void attachAppender() {
		this.appender = new CapturingAppender();
		Logger.getLogger(SubtreeExtractor.class).addAppender(this.appender);
	}

	@After
	public void detachAppender() {
		Logger.getLogger(SubtreeExtractor.class).removeAppender(this.appender);
	}

	private static Set<String> set(String... ids) {
		return new HashSet<String>(Arrays.asList(ids));
	}

	@Test
	public void testSingleSubtree() {
		Map<String, String> trees = SubtreeExtractor.extract(TEST_TREE, set("B"));
		assertEquals(Collections.singletonMap("B", "(BA,(BBA,BBB_ott222,BBC:1.5)BB_ott111,BC)B:2.0"), trees);
	}

	@Test
	public void testKeysAreOttsWhenPresent() {
		Map<String, String> trees = SubtreeExtractor.extract(TEST_TREE, set("111", "C", "A"));
		assertEquals(3, trees.size());
		assertEquals("(BBA,BBB_ott222,BBC:1.5)BB_ott111", trees.get("111"));
		assertEquals("((CAA,CAB)CA,CB)C_ott333", trees.get("333"));
		assertEquals("A", trees.get("A"));
	}

	@Test
	public void testExclusionRemovesDanglingCommas() {
		Map<String, String> trees = SubtreeExtractor.extract("((A,B)C,D)E;", set("E"), set("B", "C"));
		assertEquals(Collections.singletonMap("E", "(D)E"), trees);
	}

	@Test
	public void testExcludeFirstMiddleAndLastChild() {
		assertEquals("(B,C)P", SubtreeExtractor.extract("(A,B,C)P;", set("P"), set("A")).get("P"));
		assertEquals("(A,C)P", SubtreeExtractor.extract("(A,B,C)P;", set("P"), set("B")).get("P"));
		assertEquals("(A,B)P", SubtreeExtractor.extract("(A,B,C)P;", set("P"), set("C")).get("P"));
		assertEquals("(C)P", SubtreeExtractor.extract("(A,B,C)P;", set("P"), set("A", "B")).get("P"));
	}

	@Test
	public void testExcludedByOtt() {
		Map<String, String> trees = SubtreeExtractor.extract(TEST_TREE, set("B"), set("222", "BC"));
		assertEquals("(BA,(BBA,BBC:1.5)BB_ott111)B:2.0", trees.get("B"));
	}

	@Test
	public void testIncludedAndExcludedKeepsItsOwnText() {
		Map<String, String> trees = SubtreeExtractor.extract(TEST_TREE, set("B", "111"), set("111", "BBA"));
		assertEquals("(BBB_ott222,BBC:1.5)BB_ott111", trees.get("111"));
		assertEquals("(BA,BC)B:2.0", trees.get("B"));
	}

	@Test
	public void testExtractionIsIdempotent() {
		String once = SubtreeExtractor.extract(TEST_TREE, set("C")).get("333");
		String twice = SubtreeExtractor.extract(once + ";", set("C")).get("333");
		assertEquals(once, twice);

		String reduced = SubtreeExtractor.extract(TEST_TREE, set("B"), set("BB")).get("B");
		assertEquals(reduced, SubtreeExtractor.extract(reduced + ";", set("B"), set("BB")).get("B"));
	}

	@Test
	public void testAncestors() {
		Map<String, String> trees = SubtreeExtractor.extract(TEST_TREE, set("BBA"), Collections.<String>emptySet(), 2);
		assertEquals("((BBA)BB)B", trees.get("BBA"));

		trees = SubtreeExtractor.extract(TEST_TREE, set("CAA"), Collections.<String>emptySet(), 1);
		assertEquals("(CAA)CA", trees.get("CAA"));
	}

	@Test
	public void testAncestorsStopAtTheRoot() {
		Map<String, String> trees = SubtreeExtractor.extract("(A,B)Root;", set("A"), Collections.<String>emptySet(), 5);
		assertEquals("(A)Root", trees.get("A"));
	}

	@Test
	public void testMissingTaxaAreLogged() {
		Map<String, String> trees = SubtreeExtractor.extract(TEST_TREE, set("CB", "X"));
		assertEquals(Collections.singletonMap("CB", "CB"), trees);
		assertEquals(1, this.appender.getWarnings().size());
		assertTrue(this.appender.getWarnings().get(0).contains("X"));
	}

	@Test
	public void testGetTaxonSubtree() throws Exception {
		assertEquals("(CAA,CAB)CA;", SubtreeExtractor.getTaxonSubtree(TEST_TREE, "CA"));
	}

	@Test(expected = TreeAssemblyException.class)
	public void testGetMissingTaxonSubtree() throws Exception {
		SubtreeExtractor.getTaxonSubtree(TEST_TREE, "Nope");
	}
}
