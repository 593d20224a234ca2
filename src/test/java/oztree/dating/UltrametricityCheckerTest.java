package oztree.dating;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;
import oztree.MessageLogger;
import oztree.tree.Tree;
import oztree.tree.TreeReader;

public class UltrametricityCheckerTest {

	private static Tree read(String newick) {
		return new TreeReader().readTree(newick);
	}

	@Test
	public void testUltrametric() {
		assertTrue(new UltrametricityChecker().check(read("((A:1,B:1):1,C:2);")).isUltrametric());
	}

	@Test
	public void testNotUltrametric() {
		UltrametricityChecker.Result result = new UltrametricityChecker().check(read("((A:1,B:2):1,C:2);"));
		assertFalse(result.isUltrametric());
		assertEquals("Not ultrametric! B has age 3.0, but A has age 2.0", result.getMessage());
	}

	@Test
	public void testRoundingNoiseIsIgnored() {
		assertTrue(new UltrametricityChecker().check(read("((A:0.1,B:0.1):0.2,C:0.3);")).isUltrametric());
	}

	@Test
	public void testInclusionsAreSkipped() {
		assertTrue(new UltrametricityChecker().check(read("((A:1,Foo_ott1@:5):1,C:2);")).isUltrametric());
		assertTrue(new UltrametricityChecker().check(read("((A:1,'AMORPHEA@':7):1,C:2);")).isUltrametric());
	}

	@Test
	public void testZeroAgeIsNotAReference() {
		// the first leaf has age 0, so the next leaf becomes the reference
		assertTrue(new UltrametricityChecker().check(read("(A,(B:1,C:1):1);")).isUltrametric());
	}

	@Test
	public void testMissingEdgeLength() {
		Tree tree = read("((A:1,B:1),C:1);");
		assertTrue(new UltrametricityChecker().check(tree).isUltrametric());

		UltrametricityChecker strict = new UltrametricityChecker();
		strict.setStrictEdgeLengths(true);
		UltrametricityChecker.Result result = strict.check(tree);
		assertFalse(result.isUltrametric());
		assertEquals("Not ultrametric! (Unnamed node) has no edge length", result.getMessage());
	}

	@Test
	public void testAgeCounts() {
		UltrametricityChecker.Result result = new UltrametricityChecker().check(read("((A:1,B:2):1,C:2,D:2);"));
		assertEquals(Integer.valueOf(3), result.getAgeCounts().get(2.0));
		assertEquals(Integer.valueOf(1), result.getAgeCounts().get(3.0));
	}

	@Test
	public void testDetails() throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		MessageLogger logger = new MessageLogger("");
		logger.setPrintStream(new PrintStream(bytes, true, "UTF-8"));
		UltrametricityChecker checker = new UltrametricityChecker();
		checker.setDetailsLogger(logger);
		checker.check(read("((A:1,B:1.5):1,C:2);"));

		String[] lines = bytes.toString("UTF-8").split("\\r?\\n");
		assertEquals(4, lines.length);
		assertEquals("  A: 2.0=1.0+1.0", lines[0]);
		assertEquals("  B: 2.5=1.0+1.5", lines[1]);
		assertEquals("  C: 2.0=2.0", lines[2]);
		assertEquals("Age counts instances (2 variants): {2.0: 2, 2.5: 1}", lines[3]);
	}

	@Test
	public void testTaxonNames() {
		Tree tree = read("((A:1,:1)P:1,(C:1):1);");
		assertEquals("Root", UltrametricityChecker.getTaxonName(tree.getRoot()));
		assertEquals("P (Extinct)", UltrametricityChecker.getTaxonName(tree.getRoot().getChild(0).getChild(1)));
		assertEquals("(Unnamed node)", UltrametricityChecker.getTaxonName(tree.getRoot().getChild(1)));
		assertEquals("A", UltrametricityChecker.getTaxonName(tree.getRoot().getChild(0).getChild(0)));
	}
}
